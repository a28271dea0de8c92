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
import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeFormatter;
import com.google.typescript.dts.tree.TsTypeIntersect;
import com.google.typescript.dts.tree.TsTypeRef;
import com.google.typescript.dts.tree.TsTypeUnion;

/**
 * Resolves a type through type aliases and through empty interfaces with exactly one parent,
 * filling in type arguments on the way. Unions and intersections are followed operand by
 * operand.
 */
public final class FollowAliases {
  private FollowAliases() {}

  public static TsType apply(TsTreeScope scope, TsType tpe) {
    return apply(scope, tpe, false);
  }

  public static TsType apply(TsTreeScope scope, TsType tpe, boolean skipValidation) {
    return follow(scope, tpe, skipValidation, LoopDetector.INITIAL);
  }

  private static TsType follow(
      TsTreeScope scope, TsType tpe, boolean skipValidation, LoopDetector ld) {
    if (tpe instanceof TsTypeRef ref) {
      LoopDetector next = ld.including(ref, scope);
      if (next == null) {
        String formatted = TsTypeFormatter.format(ref);
        scope.logger().error("Recovered from loop while following type alias " + formatted);
        return TsTypeRef.ANY.withComments(Comments.of(Comment.warning("circular " + formatted)));
      }
      for (TsTreeScope.Resolved<TsNamedDecl> r :
          scope.lookupBase(Picker.TYPES, ref.name(), skipValidation)) {
        if (r.decl() instanceof TsDeclTypeAlias alias) {
          return follow(
              r.scope(), FillInTParams.apply(alias, ref.tparams()).alias(), skipValidation, next);
        } else if (r.decl() instanceof TsDeclInterface iface && isForwarder(iface)) {
          TsDeclInterface filled = FillInTParams.apply(iface, ref.tparams());
          return follow(r.scope(), filled.inheritance().get(0), skipValidation, next);
        }
      }
      return ref;
    } else if (tpe instanceof TsTypeIntersect intersect) {
      ImmutableList.Builder<TsType> types = ImmutableList.builder();
      for (TsType t : intersect.types()) {
        types.add(follow(scope, t, skipValidation, ld));
      }
      return TsTypeIntersect.simplified(types.build());
    } else if (tpe instanceof TsTypeUnion union) {
      ImmutableList.Builder<TsType> types = ImmutableList.builder();
      for (TsType t : union.types()) {
        types.add(follow(scope, t, skipValidation, ld));
      }
      return TsTypeUnion.simplified(types.build());
    }
    return tpe;
  }

  /** Follows {@code ref} as long as the target is again a type reference. */
  public static TsTypeRef typeRef(TsTreeScope scope, TsTypeRef ref) {
    return typeRef(scope, ref, LoopDetector.INITIAL);
  }

  private static TsTypeRef typeRef(TsTreeScope scope, TsTypeRef ref, LoopDetector ld) {
    LoopDetector next = ld.including(ref, scope);
    if (next == null) {
      return ref;
    }
    for (TsTreeScope.Resolved<TsNamedDecl> r : scope.lookupTypeIncludeScope(ref.name())) {
      if (r.decl() instanceof TsDeclTypeAlias alias) {
        TsType filled = FillInTParams.apply(alias, ref.tparams()).alias();
        return filled instanceof TsTypeRef target ? typeRef(r.scope(), target, next) : ref;
      } else if (r.decl() instanceof TsDeclInterface iface && isForwarder(iface)) {
        TsDeclInterface filled = FillInTParams.apply(iface, ref.tparams());
        return typeRef(r.scope(), filled.inheritance().get(0), next);
      }
    }
    return ref;
  }

  private static boolean isForwarder(TsDeclInterface iface) {
    return iface.inheritance().size() == 1 && iface.members().isEmpty();
  }
}
