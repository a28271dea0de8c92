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
import com.google.typescript.dts.tree.CodePath;
import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.HasClassMembers;
import com.google.typescript.dts.tree.MethodType;
import com.google.typescript.dts.tree.TsContainer;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclEnum;
import com.google.typescript.dts.tree.TsDeclFunction;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentLibrary;
import com.google.typescript.dts.tree.TsIdentSimple;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberCall;
import com.google.typescript.dts.tree.TsMemberFunction;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsProtectionLevel;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsTree;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeFormatter;
import com.google.typescript.dts.tree.TsTypeFunction;
import com.google.typescript.dts.tree.TsTypeIntersect;
import com.google.typescript.dts.tree.TsTypeObject;
import com.google.typescript.dts.tree.TsTypeParam;
import com.google.typescript.dts.tree.TsTypeQuery;
import com.google.typescript.dts.tree.TsTypeRef;
import java.util.HashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Replaces {@code typeof X} with what {@code X} is declared as.
 *
 * <ul>
 *   <li>A property {@code p: typeof f} of a function {@code f} becomes a method with the signature
 *       of {@code f}, and a property {@code p: typeof v} of a variable {@code v} gets the type of
 *       {@code v}.
 *   <li>A container level {@code var x: typeof Y} becomes a copy of {@code Y} named {@code x}.
 *   <li>Any other {@code typeof X} in type position is resolved in place. Classes, interfaces and
 *       enums become references, namespaces become object types.
 * </ul>
 *
 * <p>Declarations with an initializer are left alone. What cannot be resolved becomes {@code any}
 * with a warning comment.
 */
public final class ResolveTypeQueries {
  static final DiagnosticType UNRESOLVED_TYPE_QUERY =
      DiagnosticType.warning("DTS_UNRESOLVED_TYPE_QUERY", "Couldn''t resolve {0}");

  static final DiagnosticType TYPE_QUERY_LOOP =
      DiagnosticType.warning("DTS_TYPE_QUERY_LOOP", "Loop while resolving {0}");

  public static final TreeTransformation<TsTreeScope> INSTANCE =
      new ContainerVars().combine(new ClassMembersAndTypes());

  private ResolveTypeQueries() {}

  private static final class ContainerVars extends TransformMembers {
    @Override
    protected ImmutableList<TsContainerOrDecl> newMembers(TsTreeScope scope, TsContainer tree) {
      Set<CodePath> avoidCircular = new HashSet<>();
      for (TsTree t : scope.stack()) {
        if (t instanceof TsNamedDecl named) {
          avoidCircular.add(named.codePath());
        } else if (t instanceof TsContainer c) {
          avoidCircular.add(c.codePath());
        }
      }

      Set<TsIdentSimple> addedClasses = new HashSet<>();
      ImmutableList.Builder<TsContainerOrDecl> rewritten = ImmutableList.builder();
      for (TsContainerOrDecl member : tree.members()) {
        if (!(member instanceof TsDeclVar target)
            || !(target.tpe() instanceof TsTypeQuery query)
            || target.expr() != null
            || query.expr().isPrimitive()) {
          rewritten.add(member);
          continue;
        }
        Comment note = wasNote(query);
        ImmutableList.Builder<TsNamedDecl> founds = ImmutableList.builder();
        for (TsTreeScope.Resolved<TsNamedDecl> found :
            lookup(scope, notSelf(query), query.expr())) {
          TsNamedDecl decl = found.decl();
          if (avoidCircular.contains(decl.codePath())) {
            continue;
          }
          founds.addAll(
              DeriveCopy.apply(
                  decl.withComments(decl.comments().add(note)), tree.codePath(), target.name()));
        }
        ImmutableList<TsNamedDecl> copies = founds.build();
        if (copies.isEmpty()) {
          rewritten.add(target.withType(unresolved(scope, query)));
        } else {
          for (TsNamedDecl copy : copies) {
            if (copy instanceof TsDeclClass cls) {
              addedClasses.add(cls.name());
            }
          }
          rewritten.addAll(copies);
        }
      }

      ImmutableList<TsContainerOrDecl> result = rewritten.build();
      if (addedClasses.isEmpty()) {
        return result;
      }
      ImmutableList.Builder<TsContainerOrDecl> filtered = ImmutableList.builder();
      for (TsContainerOrDecl member : result) {
        if (!(member instanceof TsDeclTypeAlias alias && addedClasses.contains(alias.name()))) {
          filtered.add(member);
        }
      }
      return filtered.build();
    }
  }

  private static final class ClassMembersAndTypes extends TransformClassMembers {
    @Override
    protected ImmutableList<TsMember> newClassMembers(TsTreeScope scope, HasClassMembers tree) {
      ImmutableList.Builder<TsMember> result = ImmutableList.builder();
      for (TsMember member : tree.members()) {
        if (member instanceof TsMemberProperty target
            && target.tpe() instanceof TsTypeQuery query
            && target.expr() == null
            && !query.expr().isPrimitive()) {
          result.addAll(resolveProperty(scope, target, query));
        } else {
          result.add(member);
        }
      }
      return result.build();
    }

    @Override
    protected TsType leaveTsType(TsTreeScope scope, TsType x) {
      return x instanceof TsTypeQuery query ? resolve(scope, query, LoopDetector.INITIAL) : x;
    }
  }

  private static ImmutableList<TsMember> resolveProperty(
      TsTreeScope scope, TsMemberProperty target, TsTypeQuery query) {
    Comment note = wasNote(query);
    ImmutableList.Builder<TsMember> result = ImmutableList.builder();
    boolean found = false;
    for (TsTreeScope.Resolved<TsNamedDecl> resolved :
        lookup(scope, Picker.NAMED_VALUES, query.expr())) {
      found = true;
      TsNamedDecl decl = resolved.decl();
      if (decl instanceof TsDeclVar v) {
        result.add(
            new TsMemberProperty(
                target.comments().addAll(v.comments()).add(note),
                target.level(),
                target.name(),
                v.tpe(),
                target.expr(),
                target.isStatic(),
                target.isReadOnly()));
      } else if (decl instanceof TsDeclFunction f) {
        result.add(
            new TsMemberFunction(
                target.comments().addAll(f.comments()).add(note),
                target.level(),
                target.name(),
                MethodType.NORMAL,
                f.signature(),
                target.isStatic(),
                target.isReadOnly()));
      } else {
        result.add(
            new TsMemberProperty(
                target.comments().add(note),
                target.level(),
                target.name(),
                typeOf(decl, resolved.scope(), LoopDetector.INITIAL),
                target.expr(),
                target.isStatic(),
                target.isReadOnly()));
      }
    }
    if (!found) {
      return ImmutableList.of(target.withType(unresolved(scope, query)));
    }
    return result.build();
  }

  static TsType resolve(TsTreeScope scope, TsTypeQuery target, LoopDetector ld) {
    String formatted = TsTypeFormatter.format(target);
    LoopDetector next = ld.including(target.expr().parts(), scope);
    if (next == null) {
      scope.logger().report(TYPE_QUERY_LOOP, formatted);
      return anyWithWarning("Loop while resolving " + formatted);
    }
    if (target.expr().equals(TsQIdent.GLOBAL_THIS)) {
      return TsTypeRef.ANY.withComments(Comments.of(new Comment.Raw("/* globalThis */ ")));
    }
    if (target.expr().isPrimitive()) {
      return unresolved(scope, target);
    }

    ImmutableList.Builder<TsTypeFunction> functions = ImmutableList.builder();
    ImmutableList.Builder<TsType> rest = ImmutableList.builder();
    boolean found = false;
    for (TsTreeScope.Resolved<TsNamedDecl> resolved :
        lookup(scope, notSelf(target), target.expr())) {
      TsType tpe = typeOf(resolved.decl(), resolved.scope(), next);
      if (tpe instanceof TsTypeFunction fn) {
        functions.add(fn);
        found = true;
      } else if (tpe != null) {
        rest.add(tpe);
        found = true;
      }
    }
    if (!found) {
      return unresolved(scope, target);
    }

    ImmutableList<TsTypeFunction> fns = functions.build();
    ImmutableList<TsType> others = rest.build();
    ImmutableList.Builder<TsType> combined = ImmutableList.builder();
    if (fns.size() == 1 && fns.get(0).signature().tparams().isEmpty() && others.size() <= 1) {
      combined.add(fns.get(0));
    } else if (!fns.isEmpty()) {
      ImmutableList.Builder<TsMember> overloads = ImmutableList.builder();
      for (TsTypeFunction fn : fns) {
        overloads.add(new TsMemberCall(Comments.EMPTY, TsProtectionLevel.DEFAULT, fn.signature()));
      }
      combined.add(new TsTypeObject(Comments.EMPTY, overloads.build()));
    }
    combined.addAll(others);
    return TsTypeIntersect.simplified(combined.build());
  }

  private static @Nullable TsType typeOf(TsNamedDecl decl, TsTreeScope scope, LoopDetector ld) {
    if (decl instanceof TsDeclFunction f) {
      return new TsTypeFunction(f.signature());
    } else if (decl instanceof TsDeclClass cls) {
      return referenceTo(cls, cls.tparams());
    } else if (decl instanceof TsDeclInterface iface) {
      return referenceTo(iface, iface.tparams());
    } else if (decl instanceof TsDeclEnum e) {
      return referenceTo(e, ImmutableList.of());
    } else if (decl instanceof TsDeclNamespace ns) {
      return nonEmptyTypeObject(ns);
    } else if (decl instanceof TsDeclVar v) {
      if (v.tpe() instanceof TsTypeQuery nested) {
        return resolve(scope, nested, ld);
      }
      return v.tpe();
    }
    return null;
  }

  /** A reference to {@code decl}, with {@code any} for each of its type parameters. */
  private static TsTypeRef referenceTo(TsNamedDecl decl, ImmutableList<TsTypeParam> tparams) {
    TsQIdent name =
        decl.codePath() instanceof CodePath.HasPath path
            ? path.codePath()
            : TsQIdent.of(decl.name());
    ImmutableList.Builder<TsType> targs = ImmutableList.builder();
    for (int i = 0; i < tparams.size(); i++) {
      targs.add(TsTypeRef.ANY);
    }
    return TsTypeRef.of(name, targs.build());
  }

  private static @Nullable TsTypeObject nonEmptyTypeObject(TsDeclNamespace ns) {
    ImmutableList.Builder<TsMember> builder = ImmutableList.builder();
    for (TsContainerOrDecl member : ns.members()) {
      if (member instanceof TsDeclNamespace nested) {
        TsTypeObject nestedType = nonEmptyTypeObject(nested);
        if (nestedType != null) {
          builder.add(
              new TsMemberProperty(
                  nested.comments(),
                  TsProtectionLevel.DEFAULT,
                  nested.name(),
                  nestedType,
                  null,
                  false,
                  true));
        }
      } else if (member instanceof TsDeclFunction f) {
        builder.add(
            new TsMemberFunction(
                f.comments(),
                TsProtectionLevel.DEFAULT,
                f.name(),
                MethodType.NORMAL,
                f.signature(),
                false,
                true));
      } else if (member instanceof TsDeclVar v) {
        builder.add(
            new TsMemberProperty(
                v.comments(),
                TsProtectionLevel.DEFAULT,
                v.name(),
                v.tpe(),
                v.expr(),
                false,
                v.readOnly()));
      } else if (member instanceof TsDeclClass cls) {
        builder.add(
            new TsMemberProperty(
                cls.comments(),
                TsProtectionLevel.DEFAULT,
                cls.name(),
                referenceTo(cls, cls.tparams()),
                null,
                false,
                false));
      }
    }
    ImmutableList<TsMember> members = builder.build();
    if (members.isEmpty()) {
      return null;
    }
    return new TsTypeObject(
        Comments.marker(new Comment.NameHint("Typeof" + ns.name().value())), members);
  }

  /**
   * Looks {@code wanted} up as written, then among globals. Variables win over functions, which
   * win over anything else.
   */
  private static ImmutableList<TsTreeScope.Resolved<TsNamedDecl>> lookup(
      TsTreeScope scope, Picker<TsNamedDecl> picker, TsQIdent wanted) {
    if (scope.isAbstract(wanted)) {
      return ImmutableList.of();
    }
    ImmutableList<TsTreeScope.Resolved<TsNamedDecl>> results =
        scope.lookupInternal(picker, wanted.parts(), LoopDetector.INITIAL);
    if (results.isEmpty()) {
      ImmutableList.Builder<TsIdent> patched = ImmutableList.builder();
      if (wanted.first() instanceof TsIdentLibrary) {
        patched.add(wanted.first()).add(TsIdent.GLOBAL);
        patched.addAll(wanted.parts().subList(1, wanted.size()));
      } else {
        patched.add(TsIdent.GLOBAL).addAll(wanted.parts());
      }
      results = scope.lookupInternal(picker, patched.build(), LoopDetector.INITIAL);
    }

    ImmutableList.Builder<TsTreeScope.Resolved<TsNamedDecl>> vars = ImmutableList.builder();
    ImmutableList.Builder<TsTreeScope.Resolved<TsNamedDecl>> functions = ImmutableList.builder();
    for (TsTreeScope.Resolved<TsNamedDecl> r : results) {
      if (r.decl() instanceof TsDeclVar) {
        vars.add(r);
      } else if (r.decl() instanceof TsDeclFunction) {
        functions.add(r);
      }
    }
    ImmutableList<TsTreeScope.Resolved<TsNamedDecl>> v = vars.build();
    if (!v.isEmpty()) {
      return v;
    }
    ImmutableList<TsTreeScope.Resolved<TsNamedDecl>> f = functions.build();
    return f.isEmpty() ? results : f;
  }

  /** Values and interfaces, except a variable typed by {@code query} itself. */
  private static Picker<TsNamedDecl> notSelf(TsTypeQuery query) {
    return decl -> {
      if (decl instanceof TsDeclVar v) {
        return query.equals(v.tpe()) ? null : v;
      }
      return Picker.NAMED_VALUES.pick(decl) != null || decl instanceof TsDeclInterface
          ? decl
          : null;
    };
  }

  private static Comment wasNote(TsTypeQuery query) {
    return new Comment.Raw("/* was `" + TsTypeFormatter.format(query) + "` */\n");
  }

  private static TsTypeRef unresolved(TsTreeScope scope, TsTypeQuery query) {
    String formatted = TsTypeFormatter.format(query);
    scope.logger().report(UNRESOLVED_TYPE_QUERY, formatted);
    return anyWithWarning("Couldn't resolve " + formatted);
  }

  private static TsTypeRef anyWithWarning(String message) {
    return TsTypeRef.ANY.withComments(Comments.of(Comment.warning(message)));
  }
}
