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

/** A literal type such as {@code "foo"}, {@code 1} or {@code true}. */
public record TsTypeLiteral(TsLiteral literal) implements TsType {
  public static TsTypeLiteral str(String value) {
    return new TsTypeLiteral(new TsLiteral.Str(value));
  }

  public static TsTypeLiteral num(String value) {
    return new TsTypeLiteral(new TsLiteral.Num(value));
  }
}
