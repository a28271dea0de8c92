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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.logging.Logger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TsLoggerTest {
  private static final DiagnosticType SILENT =
      DiagnosticType.make("DTS_SILENT", CheckLevel.OFF, "Silent {0}");

  private BasicErrorManager errorManager;
  private TsLogger tsLogger;

  @Before
  public void setUp() {
    errorManager = new BasicErrorManager();
    tsLogger = TsLogger.create(Logger.getLogger(TsLoggerTest.class.getName()), errorManager);
  }

  @Test
  public void testWarningsAndErrorsReachTheErrorManager() {
    tsLogger.withContext("pass").warn("careful");
    tsLogger.error("broken");

    assertThat(errorManager.getWarnings()).hasSize(1);
    DtsError warning = errorManager.getWarnings().get(0);
    assertThat(warning.description()).isEqualTo("careful");
    assertThat(warning.context()).isEqualTo("pass");
    assertThat(errorManager.getErrors().get(0).description()).isEqualTo("broken");
  }

  @Test
  public void testDiagnosticsTurnedOffAreDropped() {
    tsLogger.report(SILENT, "x");

    assertThat(errorManager.getErrorCount()).isEqualTo(0);
    assertThat(errorManager.getWarningCount()).isEqualTo(0);
  }

  @Test
  public void testFatalMaybe() {
    tsLogger.fatalMaybe("Cannot resolve X", false);
    assertThat(errorManager.getWarnings().get(0).description()).isEqualTo("Cannot resolve X");

    DtsFatalError e =
        assertThrows(
            DtsFatalError.class,
            () -> tsLogger.withContext("stage").fatalMaybe("Cannot resolve Y", true));
    assertThat(e).hasMessageThat().isEqualTo("stage: Cannot resolve Y");
  }

  @Test
  public void testDevNullDropsEverything() {
    TsLogger.devNull().warn("ignored");
    TsLogger.devNull().info("ignored");
    assertThat(errorManager.getWarningCount()).isEqualTo(0);
  }
}
