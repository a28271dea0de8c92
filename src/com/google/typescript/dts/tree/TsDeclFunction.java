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

/** {@code declare function foo(a: A): B} */
public record TsDeclFunction(
    Comments comments,
    boolean declared,
    TsIdentSimple name,
    TsFunSig signature,
    JsLocation jsLocation,
    CodePath codePath)
    implements TsNamedValueDecl {

  public TsDeclFunction withSignature(TsFunSig signature) {
    return new TsDeclFunction(comments, declared, name, signature, jsLocation, codePath);
  }

  @Override
  public TsDeclFunction withName(TsIdentSimple name) {
    return new TsDeclFunction(comments, declared, name, signature, jsLocation, codePath);
  }

  @Override
  public TsDeclFunction withCodePath(CodePath codePath) {
    return new TsDeclFunction(comments, declared, name, signature, jsLocation, codePath);
  }

  @Override
  public TsDeclFunction withComments(Comments comments) {
    return new TsDeclFunction(comments, declared, name, signature, jsLocation, codePath);
  }
}
