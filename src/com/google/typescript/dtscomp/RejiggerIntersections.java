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
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeIntersect;
import com.google.typescript.dts.tree.TsTypeUnion;
import org.jspecify.annotations.Nullable;

/**
 * Distributes an intersection over its only union operand:
 * {@code A & (B | C) & D} becomes {@code (A & B & D) | (A & C & D)}. Intersections with no union
 * operand or with several are left alone.
 */
public final class RejiggerIntersections extends TreeTransformationUnit {
  public static final RejiggerIntersections INSTANCE = new RejiggerIntersections();

  private RejiggerIntersections() {}

  @Override
  protected TsType enterTsType(@Nullable Void t, TsType x) {
    if (!(x instanceof TsTypeIntersect intersect)) {
      return x;
    }
    int unionIndex = -1;
    for (int i = 0; i < intersect.types().size(); i++) {
      if (intersect.types().get(i) instanceof TsTypeUnion) {
        if (unionIndex != -1) {
          return x;
        }
        unionIndex = i;
      }
    }
    if (unionIndex == -1) {
      return x;
    }

    TsTypeUnion union = (TsTypeUnion) intersect.types().get(unionIndex);
    ImmutableList.Builder<TsType> branches = ImmutableList.builder();
    for (TsType alternative : union.types()) {
      ImmutableList.Builder<TsType> operands = ImmutableList.builder();
      for (int i = 0; i < intersect.types().size(); i++) {
        operands.add(i == unionIndex ? alternative : intersect.types().get(i));
      }
      branches.add(new TsTypeIntersect(operands.build()));
    }
    return new TsTypeUnion(branches.build());
  }
}
