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
import org.jspecify.annotations.Nullable;

/** {@code T extends Bound = Default} */
public record TsTypeParam(
    Comments comments,
    TsIdentSimple name,
    @Nullable TsType upperBound,
    @Nullable TsType defaultType)
    implements TsTree {

  public static TsTypeParam of(String name) {
    return new TsTypeParam(Comments.EMPTY, TsIdent.simple(name), null, null);
  }

  /** References to the given type parameters, for use as type arguments. */
  public static ImmutableList<TsType> asTypeArgs(ImmutableList<TsTypeParam> tps) {
    ImmutableList.Builder<TsType> builder = ImmutableList.builder();
    for (TsTypeParam tp : tps) {
      builder.add(TsTypeRef.of(tp.name()));
    }
    return builder.build();
  }
}
