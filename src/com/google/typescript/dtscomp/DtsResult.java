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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.typescript.dts.tree.TsParsedFile;
import org.jspecify.annotations.Nullable;

/** The outcome of {@link DtsCompiler#compile}. */
@AutoValue
public abstract class DtsResult {
  /** True when a file was produced and no errors were reported. */
  public abstract boolean success();

  public abstract @Nullable TsParsedFile file();

  public abstract @Nullable ParseError parseError();

  public abstract ImmutableList<DtsError> errors();

  public abstract ImmutableList<DtsError> warnings();

  static DtsResult create(
      @Nullable TsParsedFile file,
      @Nullable ParseError parseError,
      ImmutableList<DtsError> errors,
      ImmutableList<DtsError> warnings) {
    boolean success = file != null && parseError == null && errors.isEmpty();
    return new AutoValue_DtsResult(success, file, parseError, errors, warnings);
  }
}
