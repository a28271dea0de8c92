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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.typescript.dts.tree.TsParsedFile;
import org.jspecify.annotations.Nullable;

/** Either a parsed file or the error which prevented parsing it. */
@AutoValue
public abstract class ParseResult {
  public abstract @Nullable TsParsedFile file();

  public abstract @Nullable ParseError error();

  public static ParseResult success(TsParsedFile file) {
    return new AutoValue_ParseResult(file, null);
  }

  public static ParseResult failure(ParseError error) {
    return new AutoValue_ParseResult(null, error);
  }

  public final boolean isSuccess() {
    return file() != null;
  }

  public final TsParsedFile getFile() {
    checkState(isSuccess(), "No file: %s", error());
    return file();
  }
}
