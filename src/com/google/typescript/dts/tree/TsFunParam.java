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

/** A function parameter. A missing type means {@code any}. */
public record TsFunParam(Comments comments, TsIdentSimple name, @Nullable TsType tpe)
    implements TsTree {

  public TsFunParam withType(@Nullable TsType tpe) {
    return new TsFunParam(comments, name, tpe);
  }
}
