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

/** A literal value, as it appears in literal types and expressions. */
public sealed interface TsLiteral permits TsLiteral.Num, TsLiteral.Str, TsLiteral.Bool {

  String value();

  /** A numeric literal, kept in its source spelling. */
  record Num(String value) implements TsLiteral {}

  /** A string literal, unquoted. */
  record Str(String value) implements TsLiteral {}

  /** {@code true} or {@code false}. */
  record Bool(boolean bool) implements TsLiteral {
    @Override
    public String value() {
      return String.valueOf(bool);
    }
  }
}
