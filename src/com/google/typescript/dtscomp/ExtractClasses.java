/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.typescript.dtscomp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.typescript.dts.tree.CodePath;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.JsLocation;
import com.google.typescript.dts.tree.MethodType;
import com.google.typescript.dts.tree.TsContainer;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsFunSig;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentSimple;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberCtor;
import com.google.typescript.dts.tree.TsMemberFunction;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsProtectionLevel;
import com.google.typescript.dts.tree.TsTypeObject;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Turns variables holding constructors into classes.
 *
 * <p>{@code declare var Foo: {new (x: string): Bar; version: string}} becomes
 * {@code declare class Foo extends Bar} with the construct signatures as constructors and the
 * other members as statics. When {@code Foo} is already the name of a type the class is called
 * {@code FooCls} and the variable stays.
 *
 * <p>A variable of an object type whose properties hold constructors gets a namespace of the same
 * name containing one class per such property.
 */
public final class ExtractClasses extends TransformLeaveMembers {
  public static final ExtractClasses INSTANCE = new ExtractClasses();

  private ExtractClasses() {}

  @Override
  protected ImmutableList<TsContainerOrDecl> newMembers(TsTreeScope scope, TsContainer x) {
    FindAvailableName findName = FindAvailableName.create(x, scope);
    ImmutableListMultimap<TsIdentSimple, TsNamedDecl> byName = x.membersByName();

    Map<TsDeclVar, ImmutableList<TsNamedDecl>> replacements = new IdentityHashMap<>();
    Map<TsIdentSimple, ImmutableList<TsContainerOrDecl>> namespaceAdditions =
        new LinkedHashMap<>();
    for (TsContainerOrDecl member : x.members()) {
      if (!(member instanceof TsDeclVar v) || v.tpe() == null || v.expr() != null) {
        continue;
      }
      ImmutableList<TsNamedDecl> sameName = byName.get(v.name());
      if (sameName.stream().anyMatch(d -> d instanceof TsDeclClass)) {
        continue;
      }
      ImmutableList<TsNamedDecl> extracted = extractClassFromVar(scope, findName, v);
      if (extracted != null) {
        replacements.put(v, extracted);
        continue;
      }
      VarWithNamespace split = extractClassesFromProperties(scope, v);
      if (split == null) {
        continue;
      }
      boolean hasNamespace = sameName.stream().anyMatch(d -> d instanceof TsDeclNamespace);
      ImmutableList.Builder<TsNamedDecl> replacement = ImmutableList.builder();
      if (split.remaining() != null) {
        replacement.add(split.remaining());
      }
      if (hasNamespace) {
        namespaceAdditions.put(v.name(), split.namespace().members());
      } else {
        replacement.add(split.namespace());
      }
      replacements.put(v, replacement.build());
    }
    if (replacements.isEmpty()) {
      return x.members();
    }

    ImmutableList.Builder<TsContainerOrDecl> result = ImmutableList.builder();
    for (TsContainerOrDecl member : x.members()) {
      if (member instanceof TsDeclVar v && replacements.containsKey(v)) {
        result.addAll(replacements.get(v));
      } else if (member instanceof TsDeclNamespace ns
          && namespaceAdditions.containsKey(ns.name())) {
        ImmutableList<TsContainerOrDecl> added = namespaceAdditions.remove(ns.name());
        result.add(
            ns.withMembers(
                ImmutableList.<TsContainerOrDecl>builder()
                    .addAll(ns.members())
                    .addAll(added)
                    .build()));
      } else {
        result.add(member);
      }
    }
    return result.build();
  }

  /** The class {@code v} holds the constructors of, preceded by {@code v} if it had to stay. */
  private static @Nullable ImmutableList<TsNamedDecl> extractClassFromVar(
      TsTreeScope scope, FindAvailableName findName, TsDeclVar v) {
    AnalyzedCtors analyzed = AnalyzedCtors.from(scope, v.tpe());
    if (analyzed == null) {
      return null;
    }
    FindAvailableName.Available available = findName.apply(v.name());
    if (available == null) {
      return null;
    }
    ImmutableList<TsMember> statics =
        v.tpe() instanceof TsTypeObject obj ? staticsOf(obj) : ImmutableList.of();
    TsDeclClass cls =
        classFor(
            v.comments(),
            v.declared(),
            available.name(),
            analyzed,
            statics,
            v.jsLocation(),
            v.codePath() instanceof CodePath.HasPath path
                ? path.replaceLast(available.name())
                : v.codePath());
    return available.wasBackup() ? ImmutableList.of(v, cls) : ImmutableList.of(cls);
  }

  private record VarWithNamespace(@Nullable TsDeclVar remaining, TsDeclNamespace namespace) {}

  private static @Nullable VarWithNamespace extractClassesFromProperties(
      TsTreeScope scope, TsDeclVar v) {
    if (!(v.tpe() instanceof TsTypeObject obj) || obj.isTypeMapping()) {
      return null;
    }
    CodePath nsPath = v.codePath();
    ImmutableList.Builder<TsContainerOrDecl> classes = ImmutableList.builder();
    ImmutableList.Builder<TsMember> rest = ImmutableList.builder();
    boolean extractedAny = false;
    for (TsMember member : obj.members()) {
      if (member instanceof TsMemberProperty p && p.tpe() != null && !p.isStatic()) {
        AnalyzedCtors analyzed = AnalyzedCtors.from(scope, p.tpe());
        if (analyzed != null) {
          classes.add(
              classFor(
                  p.comments(),
                  v.declared(),
                  p.name(),
                  analyzed,
                  ImmutableList.of(),
                  v.jsLocation().add(p.name()),
                  nsPath instanceof CodePath.HasPath path ? path.add(p.name()) : nsPath));
          extractedAny = true;
          continue;
        }
      }
      rest.add(member);
    }
    if (!extractedAny) {
      return null;
    }
    ImmutableList<TsMember> remainingMembers = rest.build();
    TsDeclVar remaining =
        remainingMembers.isEmpty() ? null : v.withType(obj.withMembers(remainingMembers));
    TsDeclNamespace namespace =
        new TsDeclNamespace(
            Comments.EMPTY, v.declared(), v.name(), classes.build(), nsPath, v.jsLocation());
    return new VarWithNamespace(remaining, namespace);
  }

  private static TsDeclClass classFor(
      Comments comments,
      boolean declared,
      TsIdentSimple name,
      AnalyzedCtors analyzed,
      ImmutableList<TsMember> statics,
      JsLocation jsLocation,
      CodePath codePath) {
    ImmutableList.Builder<TsMember> members = ImmutableList.builder();
    for (TsFunSig ctor : analyzed.ctors()) {
      members.add(
          new TsMemberFunction(
              ctor.comments(),
              TsProtectionLevel.DEFAULT,
              TsIdent.CONSTRUCTOR,
              MethodType.NORMAL,
              ctor.withComments(Comments.EMPTY).withTParams(ImmutableList.of()),
              false,
              false));
    }
    members.addAll(statics);
    boolean selfReference =
        analyzed.resultType().name().last().equals(name)
            && analyzed.resultType().name().size() == 1;
    return new TsDeclClass(
        comments,
        declared,
        false,
        name,
        analyzed.longestTParams(),
        selfReference ? null : analyzed.resultType(),
        ImmutableList.of(),
        members.build(),
        jsLocation,
        codePath);
  }

  /** Everything but construct signatures, made static. */
  private static ImmutableList<TsMember> staticsOf(TsTypeObject obj) {
    ImmutableList.Builder<TsMember> result = ImmutableList.builder();
    for (TsMember member : obj.members()) {
      if (member instanceof TsMemberCtor) {
        continue;
      } else if (member instanceof TsMemberProperty p) {
        result.add(p.withStatic(true));
      } else if (member instanceof TsMemberFunction f) {
        result.add(f.withStatic(true));
      }
    }
    return result.build();
  }
}
