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

package com.google.typescript.dts.tree;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Set;

/** {@code A | B | C} */
public record TsTypeUnion(ImmutableList<TsType> types) implements TsType {

  /**
   * Builds a union with nested unions flattened and duplicates removed. No operands gives {@code
   * never}, a single operand is returned as is.
   */
  public static TsType simplified(ImmutableList<TsType> types) {
    Set<TsType> flattened = new LinkedHashSet<>();
    flatten(types, flattened);
    switch (flattened.size()) {
      case 0:
        return TsTypeRef.NEVER;
      case 1:
        return flattened.iterator().next();
      default:
        return new TsTypeUnion(ImmutableList.copyOf(flattened));
    }
  }

  private static void flatten(ImmutableList<TsType> types, Set<TsType> out) {
    for (TsType type : types) {
      if (type instanceof TsTypeUnion union) {
        flatten(union.types(), out);
      } else {
        out.add(type);
      }
    }
  }
}
