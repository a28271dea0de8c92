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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * A reported diagnostic.
 *
 * @param type the kind of diagnostic
 * @param description the formatted message
 * @param context where in the tree it was reported, if known
 * @param defaultLevel the level of {@code type}, before any options apply
 */
public record DtsError(
    DiagnosticType type, String description, @Nullable String context, CheckLevel defaultLevel) {
  public DtsError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  public static DtsError make(DiagnosticType type, Object... arguments) {
    return new DtsError(type, type.format(arguments), null, type.level);
  }

  public static DtsError make(@Nullable String context, DiagnosticType type, Object... arguments) {
    return new DtsError(type, type.format(arguments), context, type.level);
  }

  /** The message with its context, as printed by the error managers. */
  public String format() {
    return context == null ? description : context + ": " + description;
  }

  @Override
  public String toString() {
    return type.key + ". " + format();
  }
}
