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
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeFormatter;
import com.google.typescript.dts.tree.TsTypeIntersect;
import com.google.typescript.dts.tree.TsTypeQuery;
import com.google.typescript.dts.tree.TsTypeRef;
import java.util.Objects;

/**
 * Makes sure classes and interfaces only inherit from plain type references.
 *
 * <p>A parent which names a variable is replaced by what the variable's type points at:
 * intersections are flattened, {@code typeof C} becomes {@code C}, and anything else is dropped.
 * A class ends up with the first remaining parent as its superclass and the others as
 * implemented interfaces.
 */
public final class SimplifyParents extends TreeTransformationScopedChanges {
  public static final SimplifyParents INSTANCE = new SimplifyParents();

  private SimplifyParents() {}

  @Override
  protected TsDeclClass enterTsDeclClass(TsTreeScope scope, TsDeclClass x) {
    ImmutableList.Builder<TsTypeRef> all = ImmutableList.builder();
    if (x.parent() != null) {
      all.add(x.parent());
    }
    all.addAll(x.implementsInterfaces());
    ImmutableList<TsTypeRef> parents = newParents(all.build(), scope);
    TsTypeRef parent = parents.isEmpty() ? null : parents.get(0);
    ImmutableList<TsTypeRef> rest =
        parents.isEmpty() ? parents : parents.subList(1, parents.size());
    if (Objects.equals(parent, x.parent()) && rest.equals(x.implementsInterfaces())) {
      return x;
    }
    return x.withParents(parent, rest);
  }

  @Override
  protected TsDeclInterface enterTsDeclInterface(TsTreeScope scope, TsDeclInterface x) {
    ImmutableList<TsTypeRef> parents = newParents(x.inheritance(), scope);
    return parents.equals(x.inheritance()) ? x : x.withInheritance(parents);
  }

  private static ImmutableList<TsTypeRef> newParents(
      ImmutableList<TsTypeRef> parents, TsTreeScope scope) {
    ImmutableList.Builder<TsTypeRef> result = ImmutableList.builder();
    for (TsTypeRef parent : parents) {
      if (scope.lookupType(parent.name(), true).isEmpty()) {
        ImmutableList<TsTreeScope.Resolved<TsDeclVar>> vars =
            scope.lookupBase(Picker.VARS, parent.name(), true);
        if (!vars.isEmpty() && vars.get(0).decl().tpe() != null) {
          result.addAll(lift(vars.get(0).scope(), parent, vars.get(0).decl().tpe()));
          continue;
        }
      }
      result.add(parent);
    }
    return result.build();
  }

  private static ImmutableList<TsTypeRef> lift(TsTreeScope scope, TsTypeRef ref, TsType tpe) {
    if (tpe instanceof TsTypeRef typeRef) {
      ImmutableList<TsNamedDecl> found = scope.lookup(typeRef.name(), true);
      if (!found.isEmpty() && found.get(0).codePath() instanceof CodePath.HasPath path) {
        scope.logger().info(
            "Simplified class which extends var " + ref.name().asString() + " to typeof var");
        return ImmutableList.of(typeRef.withName(path.codePath()));
      }
      return ImmutableList.of(typeRef);
    } else if (tpe instanceof TsTypeIntersect intersect) {
      ImmutableList.Builder<TsTypeRef> result = ImmutableList.builder();
      for (TsType t : intersect.types()) {
        result.addAll(lift(scope, ref, t));
      }
      return result.build();
    } else if (tpe instanceof TsTypeQuery query) {
      for (TsTreeScope.Resolved<TsNamedDecl> resolved :
          scope.lookupBase(Picker.ALL, query.expr(), true)) {
        if (resolved.decl() instanceof TsDeclClass cls) {
          return ImmutableList.of(
              cls.codePath() instanceof CodePath.HasPath path
                  ? TsTypeRef.of(path.codePath())
                  : TsTypeRef.of(query.expr()));
        }
      }
      scope.logger().info("Dropping complicated parent " + query.expr().asString());
      return ImmutableList.of();
    }
    scope.logger().info("Dropping complicated parent " + TsTypeFormatter.format(tpe));
    return ImmutableList.of();
  }
}
