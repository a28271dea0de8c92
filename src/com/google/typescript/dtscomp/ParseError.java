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

/** Why a file could not be parsed. Lines and columns are 1-based, 0 when unknown. */
@AutoValue
public abstract class ParseError {
  public abstract String sourceName();

  public abstract int line();

  public abstract int column();

  public abstract String message();

  public static ParseError create(String sourceName, int line, int column, String message) {
    return new AutoValue_ParseError(sourceName, line, column, message);
  }

  public final String format() {
    return sourceName() + ":" + line() + ":" + column() + ": " + message();
  }
}
