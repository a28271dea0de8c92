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

import org.jspecify.annotations.Nullable;

/** {@code declare const foo: T = expr} */
public record TsDeclVar(
    Comments comments,
    boolean declared,
    boolean readOnly,
    TsIdentSimple name,
    @Nullable TsType tpe,
    @Nullable TsExpr expr,
    JsLocation jsLocation,
    CodePath codePath)
    implements TsNamedValueDecl {

  public TsDeclVar withType(@Nullable TsType tpe) {
    return new TsDeclVar(comments, declared, readOnly, name, tpe, expr, jsLocation, codePath);
  }

  @Override
  public TsDeclVar withName(TsIdentSimple name) {
    return new TsDeclVar(comments, declared, readOnly, name, tpe, expr, jsLocation, codePath);
  }

  @Override
  public TsDeclVar withCodePath(CodePath codePath) {
    return new TsDeclVar(comments, declared, readOnly, name, tpe, expr, jsLocation, codePath);
  }

  @Override
  public TsDeclVar withComments(Comments comments) {
    return new TsDeclVar(comments, declared, readOnly, name, tpe, expr, jsLocation, codePath);
  }
}
