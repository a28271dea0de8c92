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

/** An import statement. */
public record TsImport(boolean typeOnly, ImmutableList<Imported> imported, Importee from)
    implements TsDecl {

  @Override
  public Comments comments() {
    return Comments.EMPTY;
  }

  /** What is brought into scope. */
  public sealed interface Imported permits Ident, Destructured, Star {}

  /** {@code import foo from ...} */
  public record Ident(TsIdentSimple ident) implements Imported {}

  /** {@code import {a, b as c} from ...} */
  public record Destructured(ImmutableList<Binding> bindings) implements Imported {}

  /** One name of a destructured import, with its optional alias. */
  public record Binding(TsIdentSimple name, @Nullable TsIdentSimple alias) {}

  /** {@code import * as foo from ...} */
  public record Star(@Nullable TsIdentSimple asOpt) implements Imported {}

  /** Where it is imported from. */
  public sealed interface Importee permits Required, From, Local {}

  /** {@code import foo = require("module")} */
  public record Required(TsIdentModule from) implements Importee {}

  /** {@code import ... from "module"} */
  public record From(TsIdentModule from) implements Importee {}

  /** {@code import foo = Bar.Baz} */
  public record Local(TsQIdent qident) implements Importee {}
}
