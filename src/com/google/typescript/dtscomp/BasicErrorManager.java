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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps reported diagnostics in memory, in report order. Subclasses decide how to print them by
 * overriding {@link #println} and {@link #printSummary}.
 */
public class BasicErrorManager implements ErrorManager {
  private final List<DtsError> errors = new ArrayList<>();
  private final List<DtsError> warnings = new ArrayList<>();

  @Override
  public void report(CheckLevel level, DtsError error) {
    switch (level) {
      case ERROR:
        errors.add(error);
        break;
      case WARNING:
        warnings.add(error);
        break;
      case OFF:
        return;
    }
    println(level, error);
  }

  @Override
  public ImmutableList<DtsError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  @Override
  public ImmutableList<DtsError> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }

  @Override
  public int getErrorCount() {
    return errors.size();
  }

  @Override
  public int getWarningCount() {
    return warnings.size();
  }

  @Override
  public void generateReport() {
    printSummary();
  }

  /** Prints a single diagnostic as it is reported. Does nothing by default. */
  protected void println(CheckLevel level, DtsError error) {}

  /** Prints the totals. Does nothing by default. */
  protected void printSummary() {}
}
