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

import com.google.typescript.dts.tree.TsIdentLibrary;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DtsOptionsTest {
  @Test
  public void testDefaults() {
    DtsOptions options = new DtsOptions();
    assertThat(options.getLibraryName()).isEqualTo(TsIdentLibrary.DUMMY_LIBRARY);
    assertThat(options.isPedantic()).isFalse();
    assertThat(options.isLibrarySpecific()).isTrue();
    assertThat(options.getDisabledPasses()).isEmpty();
    assertThat(options.isPassEnabled("splitMethods")).isTrue();
  }

  @Test
  public void testFromPropertiesFile() throws IOException {
    Properties properties = new Properties();
    try (InputStream in = DtsOptionsTest.class.getResourceAsStream("dts.properties")) {
      assertThat(in).isNotNull();
      properties.load(in);
    }

    DtsOptions options = DtsOptions.fromProperties(properties);

    assertThat(options.getLibraryName()).isEqualTo(TsIdentLibrary.of("react"));
    assertThat(options.isPedantic()).isTrue();
    assertThat(options.isLibrarySpecific()).isFalse();
    assertThat(options.getDisabledPasses())
        .containsExactly("splitMethods", "inlineTrivial")
        .inOrder();
    assertThat(options.isPassEnabled("inlineTrivial")).isFalse();
    assertThat(options.isPassEnabled("extractClasses")).isTrue();
  }

  @Test
  public void testMissingKeysKeepDefaults() {
    Properties properties = new Properties();
    properties.setProperty(DtsOptions.LIBRARY_NAME, " ");

    DtsOptions options = DtsOptions.fromProperties(properties);

    assertThat(options.getLibraryName()).isEqualTo(TsIdentLibrary.DUMMY_LIBRARY);
    assertThat(options.isLibrarySpecific()).isTrue();
  }
}
