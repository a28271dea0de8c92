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

/** A method or accessor. Class constructors are methods named {@code constructor}. */
public record TsMemberFunction(
    Comments comments,
    TsProtectionLevel level,
    TsIdentSimple name,
    MethodType methodType,
    TsFunSig signature,
    boolean isStatic,
    boolean isReadOnly)
    implements TsMember {

  public TsMemberFunction withSignature(TsFunSig signature) {
    return new TsMemberFunction(
        comments, level, name, methodType, signature, isStatic, isReadOnly);
  }

  public TsMemberFunction withStatic(boolean isStatic) {
    return new TsMemberFunction(
        comments, level, name, methodType, signature, isStatic, isReadOnly);
  }
}
