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

import com.google.typescript.dts.tree.TsParsedFile;

/** One stage of the pipeline. */
@FunctionalInterface
public interface FilePass {
  /** Rewrites {@code file}. Lookups start at {@code root}, which knows the dependencies. */
  TsParsedFile process(TsTreeScope.Root root, TsParsedFile file);

  /** Runs {@code transformation} over the whole file. */
  static FilePass of(TreeTransformation<TsTreeScope> transformation) {
    return (root, file) -> transformation.visitTsParsedFile(root, file);
  }
}
