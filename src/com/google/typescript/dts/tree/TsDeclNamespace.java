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

/** {@code namespace Foo { ... }} */
public record TsDeclNamespace(
    Comments comments,
    boolean declared,
    TsIdentSimple name,
    ImmutableList<TsContainerOrDecl> members,
    CodePath codePath,
    JsLocation jsLocation)
    implements TsContainer, TsNamedDecl {

  @Override
  public TsDeclNamespace withMembers(ImmutableList<TsContainerOrDecl> members) {
    return new TsDeclNamespace(comments, declared, name, members, codePath, jsLocation);
  }

  @Override
  public TsDeclNamespace withName(TsIdentSimple name) {
    return new TsDeclNamespace(comments, declared, name, members, codePath, jsLocation);
  }

  @Override
  public TsDeclNamespace withCodePath(CodePath codePath) {
    return new TsDeclNamespace(comments, declared, name, members, codePath, jsLocation);
  }

  @Override
  public TsDeclNamespace withComments(Comments comments) {
    return new TsDeclNamespace(comments, declared, name, members, codePath, jsLocation);
  }
}
