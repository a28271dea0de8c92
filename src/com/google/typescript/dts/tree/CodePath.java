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

/**
 * The canonical, library-relative address of a declaration. {@link NoPath} marks nodes that were
 * not placed in any library yet.
 */
public sealed interface CodePath permits CodePath.NoPath, CodePath.HasPath {

  CodePath NO_PATH = new NoPath();

  CodePath add(TsIdent ident);

  /** Returns the path as a {@link HasPath}, failing for {@link NoPath}. */
  HasPath forceHasPath();

  static HasPath of(TsIdentLibrary library, TsQIdent codePathPart) {
    return new HasPath(library, codePathPart);
  }

  /** The path of a library root. */
  static HasPath ofLibrary(TsIdentLibrary library) {
    return new HasPath(library, new TsQIdent(ImmutableList.of(library)));
  }

  /** A node without a library-relative address. */
  record NoPath() implements CodePath {
    @Override
    public CodePath add(TsIdent ident) {
      return this;
    }

    @Override
    public HasPath forceHasPath() {
      throw new IllegalStateException("Expected code path, got NoPath");
    }
  }

  /**
   * A node at {@code codePath}. The first part of {@code codePath} is always the library itself,
   * so the path can be used as a fully qualified reference.
   */
  record HasPath(TsIdentLibrary inLibrary, TsQIdent codePath) implements CodePath {
    @Override
    public HasPath add(TsIdent ident) {
      return new HasPath(inLibrary, codePath.plus(ident));
    }

    @Override
    public HasPath forceHasPath() {
      return this;
    }

    /** The same path with its last part replaced, used when a declaration is renamed. */
    public HasPath replaceLast(TsIdent ident) {
      ImmutableList<TsIdent> parts = codePath.parts();
      return new HasPath(
          inLibrary,
          TsQIdent.of(parts.subList(0, parts.size() - 1)).plus(ident));
    }

    @Override
    public String toString() {
      return codePath.asString();
    }
  }
}
