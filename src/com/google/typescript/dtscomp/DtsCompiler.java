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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.typescript.dts.tree.TsIdentLibrary;
import com.google.typescript.dts.tree.TsParsedFile;
import java.util.logging.Logger;

/**
 * Entry point: parses a declaration file and runs it through the {@link TransformationPipeline}.
 *
 * <p>Not thread safe; diagnostics accumulate in the {@link ErrorManager} across calls.
 */
public class DtsCompiler {
  private static final Logger logger = Logger.getLogger(DtsCompiler.class.getName());

  static final DiagnosticType FATAL =
      DiagnosticType.error("DTS_FATAL", "Aborted transforming {0}: {1}");

  private final DtsOptions options;
  private final ErrorManager errorManager;

  public DtsCompiler(DtsOptions options) {
    this(options, new LoggerErrorManager(logger));
  }

  public DtsCompiler(DtsOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Parses {@code sourceText} with {@code parser} and transforms the result. A parse failure is
   * returned in the result rather than thrown.
   */
  public DtsResult compile(
      String sourceName,
      String sourceText,
      TsParser parser,
      ImmutableMap<TsIdentLibrary, TsParsedFile> deps) {
    ParseResult parsed = parser.parse(sourceName, sourceText);
    if (!parsed.isSuccess()) {
      logger.warning("Could not parse " + parsed.error().format());
      return DtsResult.create(
          null, parsed.error(), errorManager.getErrors(), errorManager.getWarnings());
    }
    return transform(sourceName, parsed.getFile(), deps);
  }

  /** Transforms an already parsed file. */
  public DtsResult transform(TsParsedFile file, ImmutableMap<TsIdentLibrary, TsParsedFile> deps) {
    return transform(options.getLibraryName().name(), file, deps);
  }

  private DtsResult transform(
      String sourceName, TsParsedFile file, ImmutableMap<TsIdentLibrary, TsParsedFile> deps) {
    TsLogger tsLogger = TsLogger.create(logger, errorManager).withContext(sourceName);
    TransformationPipeline pipeline = TransformationPipeline.create(options);
    TsParsedFile result;
    try {
      result = pipeline.run(file, deps, tsLogger);
    } catch (DtsFatalError e) {
      tsLogger.report(FATAL, sourceName, e.getMessage());
      result = null;
    }
    errorManager.generateReport();
    return DtsResult.create(
        result,
        null,
        errorManager.getErrors(),
        errorManager.getWarnings());
  }
}
