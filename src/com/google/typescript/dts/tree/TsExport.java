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

/** An export statement. */
public record TsExport(Comments comments, boolean typeOnly, ExportType tpe, Exportee exported)
    implements TsDecl {

  /** What is exported. */
  public sealed interface Exportee permits Names, Tree, Star {}

  /** {@code export {a, b as c} from "module"}, or without the {@code from}. */
  public record Names(ImmutableList<Name> idents, @Nullable TsIdentModule fromOpt)
      implements Exportee {}

  /** One exported name with its optional alias. */
  public record Name(TsQIdent qident, @Nullable TsIdentSimple alias) {}

  /** {@code export declare class Foo {}} */
  public record Tree(TsDecl decl) implements Exportee {}

  /** {@code export * as foo from "module"} */
  public record Star(@Nullable TsIdentSimple as, TsIdentModule from) implements Exportee {}
}
