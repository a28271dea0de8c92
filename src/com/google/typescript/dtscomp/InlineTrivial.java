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

import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.TsDeclEnum;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeIntersect;
import com.google.typescript.dts.tree.TsTypeRef;
import java.util.HashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Points references to trivial declarations straight at what they stand for. A declaration is
 * trivial if it is marked {@link Comment.SimpleMarker#IS_TRIVIAL} and is an alias of, or an
 * interface extending, a single other type. Enums copied from elsewhere are replaced by their
 * origin.
 *
 * <p>References with type arguments are never rewritten, and neither are declarations with type
 * parameters.
 */
public final class InlineTrivial extends TreeTransformationScopedChanges {
  public static final InlineTrivial INSTANCE = new InlineTrivial();

  private InlineTrivial() {}

  @Override
  protected TsTypeRef enterTsTypeRef(TsTreeScope scope, TsTypeRef x) {
    TsTypeRef rewritten = rewritten(scope, x);
    return rewritten == null ? x : rewritten;
  }

  static @Nullable TsTypeRef rewritten(TsTreeScope scope, TsTypeRef x) {
    if (x.name().isPrimitive() || !x.tparams().isEmpty()) {
      return null;
    }
    for (TsTreeScope.Resolved<TsNamedDecl> resolved : scope.lookupTypeIncludeScope(x.name())) {
      TsNamedDecl decl = resolved.decl();
      if (decl instanceof TsDeclEnum e && e.exportedFrom() != null) {
        return x.withName(e.exportedFrom().name());
      }
      if (decl instanceof TsDeclTypeAlias || decl instanceof TsDeclInterface) {
        TsQIdent target = followTrivial(resolved.scope(), decl, LoopDetector.INITIAL);
        if (target != null) {
          return x.withName(target);
        }
      }
    }
    return null;
  }

  private static @Nullable TsQIdent followTrivial(
      TsTreeScope scope, TsNamedDecl cur, LoopDetector ld) {
    if (!cur.comments().has(Comment.SimpleMarker.IS_TRIVIAL) || hasTParams(cur)) {
      return null;
    }
    TsTypeRef next = null;
    if (cur instanceof TsDeclInterface iface && !iface.inheritance().isEmpty()) {
      next = effectiveTypeRef(iface.inheritance().get(0));
    } else if (cur instanceof TsDeclTypeAlias alias) {
      next = effectiveTypeRef(alias.alias());
    }
    if (next == null) {
      return null;
    }
    LoopDetector nextLd = ld.including(next, scope);
    if (nextLd == null) {
      return null;
    }
    for (TsTreeScope.Resolved<TsNamedDecl> resolved : scope.lookupTypeIncludeScope(next.name())) {
      TsNamedDecl nextDecl = resolved.decl();
      if (!nextDecl.codePath().equals(cur.codePath())) {
        TsQIdent further = followTrivial(resolved.scope(), nextDecl, nextLd);
        if (further != null) {
          return further;
        }
      }
    }
    return next.name();
  }

  private static boolean hasTParams(TsNamedDecl decl) {
    if (decl instanceof TsDeclTypeAlias alias) {
      return !alias.tparams().isEmpty();
    } else if (decl instanceof TsDeclInterface iface) {
      return !iface.tparams().isEmpty();
    }
    return false;
  }

  /** A reference, or an intersection of references which all end in the same name. */
  private static @Nullable TsTypeRef effectiveTypeRef(TsType tpe) {
    if (tpe instanceof TsTypeRef ref) {
      return ref;
    }
    if (tpe instanceof TsTypeIntersect intersect) {
      Set<String> names = new HashSet<>();
      for (TsType t : intersect.types()) {
        if (!(t instanceof TsTypeRef ref)) {
          return null;
        }
        names.add(ref.name().last().value());
      }
      if (names.size() == 1) {
        return (TsTypeRef) intersect.types().get(0);
      }
    }
    return null;
  }
}
