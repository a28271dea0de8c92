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

import static com.google.common.base.Preconditions.checkNotNull;

/** A plain name such as {@code Foo} or {@code bar}. */
public record TsIdentSimple(String value) implements TsIdent {
  public TsIdentSimple {
    checkNotNull(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
