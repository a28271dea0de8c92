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

/** {@code interface Foo<T> extends Bar, Baz { ... }} */
public record TsDeclInterface(
    Comments comments,
    boolean declared,
    TsIdentSimple name,
    ImmutableList<TsTypeParam> tparams,
    ImmutableList<TsTypeRef> inheritance,
    ImmutableList<TsMember> members,
    CodePath codePath)
    implements TsNamedDecl, HasClassMembers {

  @Override
  public TsDeclInterface withMembers(ImmutableList<TsMember> members) {
    return new TsDeclInterface(comments, declared, name, tparams, inheritance, members, codePath);
  }

  public TsDeclInterface withInheritance(ImmutableList<TsTypeRef> inheritance) {
    return new TsDeclInterface(comments, declared, name, tparams, inheritance, members, codePath);
  }

  public TsDeclInterface withTParams(ImmutableList<TsTypeParam> tparams) {
    return new TsDeclInterface(comments, declared, name, tparams, inheritance, members, codePath);
  }

  @Override
  public TsDeclInterface withName(TsIdentSimple name) {
    return new TsDeclInterface(comments, declared, name, tparams, inheritance, members, codePath);
  }

  @Override
  public TsDeclInterface withCodePath(CodePath codePath) {
    return new TsDeclInterface(comments, declared, name, tparams, inheritance, members, codePath);
  }

  @Override
  public TsDeclInterface withComments(Comments comments) {
    return new TsDeclInterface(comments, declared, name, tparams, inheritance, members, codePath);
  }
}
