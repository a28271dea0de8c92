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

import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The sink passes and scopes report anomalies to. Informational messages go to a {@link Logger};
 * warnings and errors also reach the {@link ErrorManager} of the run.
 */
public final class TsLogger {
  static final DiagnosticType GENERIC_WARNING = DiagnosticType.warning("DTS_WARNING", "{0}");
  static final DiagnosticType GENERIC_ERROR = DiagnosticType.error("DTS_ERROR", "{0}");

  private static final TsLogger DEV_NULL = new TsLogger(silentLogger(), null, null);

  private final Logger logger;
  private final @Nullable ErrorManager errorManager;
  private final @Nullable String context;

  private TsLogger(
      Logger logger, @Nullable ErrorManager errorManager, @Nullable String context) {
    this.logger = logger;
    this.errorManager = errorManager;
    this.context = context;
  }

  public static TsLogger create(Logger logger, ErrorManager errorManager) {
    return new TsLogger(logger, errorManager, null);
  }

  /** A logger which drops everything. */
  public static TsLogger devNull() {
    return DEV_NULL;
  }

  /** The same sink, with messages prefixed by {@code context}. */
  public TsLogger withContext(String context) {
    return new TsLogger(logger, errorManager, context);
  }

  public void info(String message) {
    if (logger.isLoggable(Level.INFO)) {
      logger.info(context == null ? message : context + ": " + message);
    }
  }

  public void warn(String message) {
    report(GENERIC_WARNING, message);
  }

  public void error(String message) {
    report(GENERIC_ERROR, message);
  }

  public void report(DiagnosticType type, Object... arguments) {
    if (errorManager != null && type.level.isOn()) {
      errorManager.report(type.level, DtsError.make(context, type, arguments));
    }
  }

  /** Throws in pedantic mode, warns otherwise. */
  public void fatalMaybe(String message, boolean pedantic) {
    if (pedantic) {
      throw new DtsFatalError(context == null ? message : context + ": " + message);
    }
    warn(message);
  }

  private static Logger silentLogger() {
    Logger logger = Logger.getAnonymousLogger();
    logger.setUseParentHandlers(false);
    logger.setLevel(Level.OFF);
    return logger;
  }
}
