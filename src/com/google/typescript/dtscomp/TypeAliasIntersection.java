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
import com.google.typescript.dts.tree.TsDecl;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeIntersect;
import com.google.typescript.dts.tree.TsTypeObject;
import com.google.typescript.dts.tree.TsTypeRef;

/**
 * Turns {@code type A = B & C & {x: number}} into an interface extending {@code B} and
 * {@code C} with the members of the object types, if every operand can be inherited from.
 */
public final class TypeAliasIntersection extends TreeTransformationScopedChanges {
  public static final TypeAliasIntersection INSTANCE = new TypeAliasIntersection();

  private TypeAliasIntersection() {}

  @Override
  protected TsDecl enterTsDecl(TsTreeScope scope, TsDecl x) {
    if (!(x instanceof TsDeclTypeAlias alias)
        || !(alias.alias() instanceof TsTypeIntersect intersect)) {
      return x;
    }
    ImmutableList.Builder<TsTypeRef> inheritance = ImmutableList.builder();
    ImmutableList.Builder<TsMember> members = ImmutableList.builder();
    for (TsType operand : intersect.types()) {
      if (operand instanceof TsTypeRef ref
          && !scope.isAbstract(ref.name())
          && legalInheritance(FollowAliases.apply(scope, ref))) {
        inheritance.add(ref);
      } else if (operand instanceof TsTypeObject obj && !obj.isTypeMapping()) {
        members.addAll(obj.members());
      } else {
        return x;
      }
    }
    return new TsDeclInterface(
        alias.comments(),
        alias.declared(),
        alias.name(),
        alias.tparams(),
        inheritance.build(),
        members.build(),
        alias.codePath());
  }

  private static boolean legalInheritance(TsType tpe) {
    return tpe instanceof TsTypeRef || (tpe instanceof TsTypeObject obj && !obj.isTypeMapping());
  }
}
