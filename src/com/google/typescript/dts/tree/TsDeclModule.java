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

/** {@code declare module "foo" { ... }} */
public record TsDeclModule(
    Comments comments,
    boolean declared,
    TsIdentModule name,
    ImmutableList<TsContainerOrDecl> members,
    CodePath codePath,
    JsLocation jsLocation)
    implements TsContainer, TsDecl {

  @Override
  public TsDeclModule withMembers(ImmutableList<TsContainerOrDecl> members) {
    return new TsDeclModule(comments, declared, name, members, codePath, jsLocation);
  }
}
