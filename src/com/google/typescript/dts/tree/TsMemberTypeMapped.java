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

/** The single member of a mapped type, {@code readonly [K in From as As]?: To}. */
public record TsMemberTypeMapped(
    Comments comments,
    TsProtectionLevel level,
    Modifier readonly,
    TsIdentSimple key,
    TsType from,
    @Nullable TsType as,
    Modifier optionalize,
    TsType to)
    implements TsMember {

  /** A {@code +}, {@code -} or absent modifier. */
  public enum Modifier {
    NOOP,
    YES,
    NO
  }
}
