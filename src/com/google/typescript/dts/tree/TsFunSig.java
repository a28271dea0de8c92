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

/** A function signature: type parameters, parameters and an optional result type. */
public record TsFunSig(
    Comments comments,
    ImmutableList<TsTypeParam> tparams,
    ImmutableList<TsFunParam> params,
    @Nullable TsType resultType)
    implements TsTree {

  public TsFunSig withParams(ImmutableList<TsFunParam> params) {
    return new TsFunSig(comments, tparams, params, resultType);
  }

  public TsFunSig withTParams(ImmutableList<TsTypeParam> tparams) {
    return new TsFunSig(comments, tparams, params, resultType);
  }

  public TsFunSig withComments(Comments comments) {
    return new TsFunSig(comments, tparams, params, resultType);
  }
}
