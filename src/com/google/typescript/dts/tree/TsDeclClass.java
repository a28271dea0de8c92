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

/** {@code class Foo<T> extends Bar implements Baz { ... }} */
public record TsDeclClass(
    Comments comments,
    boolean declared,
    boolean isAbstract,
    TsIdentSimple name,
    ImmutableList<TsTypeParam> tparams,
    @Nullable TsTypeRef parent,
    ImmutableList<TsTypeRef> implementsInterfaces,
    ImmutableList<TsMember> members,
    JsLocation jsLocation,
    CodePath codePath)
    implements TsNamedValueDecl, HasClassMembers {

  @Override
  public TsDeclClass withMembers(ImmutableList<TsMember> members) {
    return new TsDeclClass(
        comments, declared, isAbstract, name, tparams, parent, implementsInterfaces, members,
        jsLocation, codePath);
  }

  public TsDeclClass withParents(
      @Nullable TsTypeRef parent, ImmutableList<TsTypeRef> implementsInterfaces) {
    return new TsDeclClass(
        comments, declared, isAbstract, name, tparams, parent, implementsInterfaces, members,
        jsLocation, codePath);
  }

  @Override
  public TsDeclClass withName(TsIdentSimple name) {
    return new TsDeclClass(
        comments, declared, isAbstract, name, tparams, parent, implementsInterfaces, members,
        jsLocation, codePath);
  }

  @Override
  public TsDeclClass withCodePath(CodePath codePath) {
    return new TsDeclClass(
        comments, declared, isAbstract, name, tparams, parent, implementsInterfaces, members,
        jsLocation, codePath);
  }

  @Override
  public TsDeclClass withComments(Comments comments) {
    return new TsDeclClass(
        comments, declared, isAbstract, name, tparams, parent, implementsInterfaces, members,
        jsLocation, codePath);
  }
}
