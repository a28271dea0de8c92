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

/** An index signature, {@code [key: string]: T} or {@code [Symbol.iterator]: T}. */
public record TsMemberIndex(
    Comments comments,
    boolean isReadOnly,
    TsProtectionLevel level,
    Indexing indexing,
    @Nullable TsType valueType)
    implements TsMember {

  /** What the signature is indexed by. */
  public sealed interface Indexing permits Dict, Single {}

  /** {@code [name: tpe]} */
  public record Dict(TsIdentSimple name, TsType tpe) implements Indexing {}

  /** {@code [Symbol.iterator]} */
  public record Single(TsQIdent name) implements Indexing {}
}
