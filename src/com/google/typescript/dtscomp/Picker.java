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

package com.google.typescript.dtscomp;

import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclEnum;
import com.google.typescript.dts.tree.TsDeclFunction;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsNamedValueDecl;
import org.jspecify.annotations.Nullable;

/** Selects which kinds of declarations a lookup is interested in. */
@FunctionalInterface
public interface Picker<T extends TsNamedDecl> {

  /** Every named declaration. */
  Picker<TsNamedDecl> ALL = decl -> decl;

  /** Declarations usable in type position: interfaces, classes, type aliases and enums. */
  Picker<TsNamedDecl> TYPES =
      decl ->
          decl instanceof TsDeclInterface
                  || decl instanceof TsDeclClass
                  || decl instanceof TsDeclTypeAlias
                  || decl instanceof TsDeclEnum
              ? decl
              : null;

  /** Declarations which exist at runtime, including namespaces. */
  Picker<TsNamedDecl> NAMED_VALUES =
      decl -> decl instanceof TsNamedValueDecl || decl instanceof TsDeclNamespace ? decl : null;

  Picker<TsDeclVar> VARS = decl -> decl instanceof TsDeclVar v ? v : null;

  Picker<TsDeclFunction> FUNCTIONS = decl -> decl instanceof TsDeclFunction f ? f : null;

  /** Returns {@code decl} as a {@code T} if it is wanted, null otherwise. */
  @Nullable T pick(TsNamedDecl decl);
}
