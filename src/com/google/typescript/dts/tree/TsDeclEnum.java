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

/**
 * {@code enum Foo { A, B = 2 }}. An enum with {@code isValue == false} only exists as a type;
 * {@code exportedFrom} points at the enum this one re-exports.
 */
public record TsDeclEnum(
    Comments comments,
    boolean declared,
    boolean isConst,
    TsIdentSimple name,
    ImmutableList<TsEnumMember> members,
    boolean isValue,
    @Nullable TsTypeRef exportedFrom,
    JsLocation jsLocation,
    CodePath codePath)
    implements TsNamedValueDecl {

  public TsDeclEnum withMembers(ImmutableList<TsEnumMember> members) {
    return new TsDeclEnum(
        comments, declared, isConst, name, members, isValue, exportedFrom, jsLocation, codePath);
  }

  public TsDeclEnum withIsValue(boolean isValue) {
    return new TsDeclEnum(
        comments, declared, isConst, name, members, isValue, exportedFrom, jsLocation, codePath);
  }

  public TsDeclEnum withExportedFrom(@Nullable TsTypeRef exportedFrom) {
    return new TsDeclEnum(
        comments, declared, isConst, name, members, isValue, exportedFrom, jsLocation, codePath);
  }

  @Override
  public TsDeclEnum withName(TsIdentSimple name) {
    return new TsDeclEnum(
        comments, declared, isConst, name, members, isValue, exportedFrom, jsLocation, codePath);
  }

  @Override
  public TsDeclEnum withCodePath(CodePath codePath) {
    return new TsDeclEnum(
        comments, declared, isConst, name, members, isValue, exportedFrom, jsLocation, codePath);
  }

  @Override
  public TsDeclEnum withComments(Comments comments) {
    return new TsDeclEnum(
        comments, declared, isConst, name, members, isValue, exportedFrom, jsLocation, codePath);
  }
}
