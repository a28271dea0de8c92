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

/** {@code type Foo<T> = alias} */
public record TsDeclTypeAlias(
    Comments comments,
    boolean declared,
    TsIdentSimple name,
    ImmutableList<TsTypeParam> tparams,
    TsType alias,
    CodePath codePath)
    implements TsNamedDecl {

  public TsDeclTypeAlias withAlias(TsType alias) {
    return new TsDeclTypeAlias(comments, declared, name, tparams, alias, codePath);
  }

  public TsDeclTypeAlias withTParams(ImmutableList<TsTypeParam> tparams) {
    return new TsDeclTypeAlias(comments, declared, name, tparams, alias, codePath);
  }

  @Override
  public TsDeclTypeAlias withName(TsIdentSimple name) {
    return new TsDeclTypeAlias(comments, declared, name, tparams, alias, codePath);
  }

  @Override
  public TsDeclTypeAlias withCodePath(CodePath codePath) {
    return new TsDeclTypeAlias(comments, declared, name, tparams, alias, codePath);
  }

  @Override
  public TsDeclTypeAlias withComments(Comments comments) {
    return new TsDeclTypeAlias(comments, declared, name, tparams, alias, codePath);
  }
}
