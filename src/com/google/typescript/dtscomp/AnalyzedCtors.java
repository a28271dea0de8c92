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
import com.google.typescript.dts.tree.HasClassMembers;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsFunSig;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberCtor;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeConstructor;
import com.google.typescript.dts.tree.TsTypeIntersect;
import com.google.typescript.dts.tree.TsTypeObject;
import com.google.typescript.dts.tree.TsTypeParam;
import com.google.typescript.dts.tree.TsTypeRef;
import org.jspecify.annotations.Nullable;

/**
 * The construct signatures reachable from a type, restricted to those which agree on what they
 * construct.
 *
 * @param longestTParams the type parameters of the signature with the most of them
 * @param resultType what every signature in {@code ctors} constructs
 */
record AnalyzedCtors(
    ImmutableList<TsTypeParam> longestTParams,
    TsTypeRef resultType,
    ImmutableList<TsFunSig> ctors) {

  /**
   * Collects the construct signatures of {@code tpe}. Returns null if none of them constructs a
   * class or an interface.
   */
  static @Nullable AnalyzedCtors from(TsTreeScope scope, TsType tpe) {
    ImmutableList.Builder<TsFunSig> simpleBuilder = ImmutableList.builder();
    for (TsFunSig sig : findCtors(scope, LoopDetector.INITIAL, tpe)) {
      if (sig.resultType() instanceof TsTypeRef rt && isSimpleType(rt, scope.descend(sig))) {
        simpleBuilder.add(sig);
      }
    }
    ImmutableList<TsFunSig> withSimpleType = simpleBuilder.build();
    if (withSimpleType.isEmpty()) {
      return null;
    }

    TsFunSig longest = withSimpleType.get(0);
    for (TsFunSig sig : withSimpleType) {
      if (sig.tparams().size() > longest.tparams().size()) {
        longest = sig;
      }
    }
    ImmutableList<TsTypeParam> longestTParams = longest.tparams();
    TsTypeRef resultType = (TsTypeRef) longest.resultType();

    ImmutableList.Builder<TsFunSig> conforming = ImmutableList.builder();
    for (TsFunSig ctor : withSimpleType) {
      if (isPrefixOf(ctor.tparams(), longestTParams)
          && ctor.resultType() instanceof TsTypeRef rt
          && rt.name().equals(resultType.name())
          && rt.tparams().size() == resultType.tparams().size()) {
        conforming.add(ctor);
      }
    }
    return new AnalyzedCtors(longestTParams, resultType, conforming.build());
  }

  private static boolean isPrefixOf(
      ImmutableList<TsTypeParam> tparams, ImmutableList<TsTypeParam> longest) {
    if (tparams.size() > longest.size()) {
      return false;
    }
    for (int i = 0; i < tparams.size(); i++) {
      if (!tparams.get(i).name().equals(longest.get(i).name())) {
        return false;
      }
    }
    return true;
  }

  /**
   * Construct signatures of {@code tpe}, looking through aliases, intersections, constructor
   * types, interfaces with their parents, and object types.
   */
  static ImmutableList<TsFunSig> findCtors(TsTreeScope scope, LoopDetector ld, TsType tpe) {
    TsType resolved = FollowAliases.apply(scope, tpe, true);
    if (resolved instanceof TsTypeIntersect intersect) {
      ImmutableList.Builder<TsFunSig> result = ImmutableList.builder();
      for (TsType t : intersect.types()) {
        result.addAll(findCtors(scope, ld, t));
      }
      return result.build();
    } else if (resolved instanceof TsTypeConstructor ctor) {
      return ImmutableList.of(ctor.signature().signature());
    } else if (resolved instanceof TsTypeRef ref) {
      LoopDetector next = ld.including(ref, scope);
      if (next == null) {
        return ImmutableList.of();
      }
      ImmutableList<TsTreeScope.Resolved<TsNamedDecl>> found =
          scope.lookupBase(Picker.TYPES, ref.name(), true);
      if (!found.isEmpty() && found.get(0).decl() instanceof TsDeclInterface iface) {
        TsDeclInterface filled = FillInTParams.apply(iface, ref.tparams());
        ImmutableList.Builder<TsFunSig> result = ImmutableList.builder();
        result.addAll(fromMembers(filled));
        for (TsTypeRef parent : filled.inheritance()) {
          result.addAll(findCtors(found.get(0).scope(), next, parent));
        }
        return result.build();
      }
      return ImmutableList.of();
    } else if (resolved instanceof TsTypeObject obj) {
      return fromMembers(obj);
    }
    return ImmutableList.of();
  }

  private static ImmutableList<TsFunSig> fromMembers(HasClassMembers x) {
    ImmutableList.Builder<TsFunSig> result = ImmutableList.builder();
    for (TsMember member : x.members()) {
      if (member instanceof TsMemberCtor ctor) {
        TsFunSig sig = ctor.signature();
        result.add(sig.withComments(sig.comments().addAll(ctor.comments())));
      }
    }
    return result.build();
  }

  /** Whether {@code ref} names a class or an interface, possibly through aliases. */
  static boolean isSimpleType(TsTypeRef ref, TsTreeScope scope) {
    return isSimpleType(ref, scope, LoopDetector.INITIAL);
  }

  private static boolean isSimpleType(TsTypeRef ref, TsTreeScope scope, LoopDetector ld) {
    LoopDetector next = ld.including(ref, scope);
    if (next == null || scope.isAbstract(ref.name())) {
      return false;
    }
    ImmutableList<TsTreeScope.Resolved<TsNamedDecl>> found =
        scope.lookupBase(Picker.TYPES, ref.name(), true);
    if (found.isEmpty()) {
      return false;
    }
    TsNamedDecl decl = found.get(0).decl();
    if (decl instanceof TsDeclClass || decl instanceof TsDeclInterface) {
      return true;
    }
    return decl instanceof TsDeclTypeAlias alias
        && alias.alias() instanceof TsTypeRef target
        && isSimpleType(target, found.get(0).scope(), next);
  }
}
