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
import com.google.typescript.dts.tree.TsDeclEnum;
import com.google.typescript.dts.tree.TsEnumMember;
import com.google.typescript.dts.tree.TsExpr;
import com.google.typescript.dts.tree.TsIdentSimple;
import java.util.HashMap;
import java.util.Map;

/**
 * Gives every enum member an initializer.
 *
 * <p>Members without one are numbered 0, 1, 2, ... counting only such members. References to
 * sibling members are then replaced by the initializer of the referenced member. This happens
 * once, so {@code C = B, B = A} leaves {@code C} referring to {@code A}.
 */
public final class InferEnumTypes extends TreeTransformationScopedChanges {
  public static final InferEnumTypes INSTANCE = new InferEnumTypes();

  private InferEnumTypes() {}

  @Override
  protected TsDeclEnum enterTsDeclEnum(TsTreeScope scope, TsDeclEnum x) {
    ImmutableList<TsEnumMember> initialized = initializeMembers(x.members());
    Map<TsIdentSimple, TsExpr> byName = new HashMap<>();
    for (TsEnumMember member : initialized) {
      byName.putIfAbsent(member.name(), member.expr());
    }
    ImmutableList<TsEnumMember> members =
        TreeTransformation.mapSame(
            initialized,
            m -> {
              TsExpr expr = replaceReferences(m.expr(), byName);
              return expr == m.expr() ? m : m.withExpr(expr);
            });
    return members == x.members() ? x : x.withMembers(members);
  }

  private static ImmutableList<TsEnumMember> initializeMembers(
      ImmutableList<TsEnumMember> members) {
    ImmutableList.Builder<TsEnumMember> builder = ImmutableList.builder();
    int lastUnspecifiedIndex = 0;
    boolean changed = false;
    for (TsEnumMember member : members) {
      if (member.expr() == null) {
        member = member.withExpr(TsExpr.Literal.num(String.valueOf(lastUnspecifiedIndex++)));
        changed = true;
      }
      builder.add(member);
    }
    return changed ? builder.build() : members;
  }

  private static TsExpr replaceReferences(TsExpr expr, Map<TsIdentSimple, TsExpr> byName) {
    if (expr instanceof TsExpr.Ref ref
        && ref.value().size() == 1
        && ref.value().first() instanceof TsIdentSimple name
        && byName.containsKey(name)) {
      return byName.get(name);
    } else if (expr instanceof TsExpr.Cast cast) {
      TsExpr inner = replaceReferences(cast.expr(), byName);
      return inner == cast.expr() ? expr : new TsExpr.Cast(inner, cast.tpe());
    } else if (expr instanceof TsExpr.ArrayOf array) {
      TsExpr inner = replaceReferences(array.expr(), byName);
      return inner == array.expr() ? expr : new TsExpr.ArrayOf(inner);
    } else if (expr instanceof TsExpr.Call call) {
      TsExpr function = replaceReferences(call.function(), byName);
      ImmutableList<TsExpr> params =
          TreeTransformation.mapSame(call.params(), p -> replaceReferences(p, byName));
      if (function == call.function() && params == call.params()) {
        return expr;
      }
      return new TsExpr.Call(function, params);
    } else if (expr instanceof TsExpr.Unary unary) {
      TsExpr inner = replaceReferences(unary.expr(), byName);
      return inner == unary.expr() ? expr : new TsExpr.Unary(unary.op(), inner);
    } else if (expr instanceof TsExpr.BinaryOp binary) {
      TsExpr one = replaceReferences(binary.one(), byName);
      TsExpr two = replaceReferences(binary.two(), byName);
      if (one == binary.one() && two == binary.two()) {
        return expr;
      }
      return new TsExpr.BinaryOp(one, binary.op(), two);
    }
    return expr;
  }
}
