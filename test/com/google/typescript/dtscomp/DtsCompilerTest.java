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
import static com.google.typescript.dtscomp.TsTrees.file;
import static com.google.typescript.dtscomp.TsTrees.iface;
import static com.google.typescript.dtscomp.TsTrees.ref;
import static com.google.typescript.dtscomp.TsTrees.var;

import com.google.common.collect.ImmutableMap;
import com.google.typescript.dts.tree.TsParsedFile;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DtsCompilerTest {
  private DtsOptions options;
  private BasicErrorManager errorManager;

  @Before
  public void setUp() {
    options = new DtsOptions();
    options.setLibraryName(TsTrees.LIB);
    errorManager = new BasicErrorManager();
  }

  private DtsResult compile(TsParsedFile parsed) {
    return new DtsCompiler(options, errorManager)
        .compile(
            "index.d.ts",
            "ignored",
            (name, text) -> ParseResult.success(parsed),
            ImmutableMap.of());
  }

  @Test
  public void testParseFailureIsReturned() {
    ParseError error = ParseError.create("index.d.ts", 3, 7, "unexpected token");

    DtsResult result =
        new DtsCompiler(options, errorManager)
            .compile(
                "index.d.ts",
                "declare var",
                (name, text) -> ParseResult.failure(error),
                ImmutableMap.of());

    assertThat(result.success()).isFalse();
    assertThat(result.file()).isNull();
    assertThat(result.parseError()).isEqualTo(error);
    assertThat(error.format()).isEqualTo("index.d.ts:3:7: unexpected token");
  }

  @Test
  public void testCleanFileSucceeds() {
    TsParsedFile parsed = file(iface("Foo"));

    DtsResult result = compile(parsed);

    assertThat(result.success()).isTrue();
    assertThat(result.file()).isNotNull();
    assertThat(result.errors()).isEmpty();
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  public void testUnresolvedNameAbortsWhenPedantic() {
    options.setPedantic(true);

    DtsResult result = compile(file(var("x", ref("Missing"))));

    assertThat(result.success()).isFalse();
    assertThat(result.file()).isNull();
    assertThat(result.errors()).hasSize(1);
    DtsError error = result.errors().get(0);
    assertThat(error.type()).isSameInstanceAs(DtsCompiler.FATAL);
    assertThat(error.description()).contains("Cannot resolve Missing");
  }

  @Test
  public void testUnresolvedNameOnlyWarnsByDefault() {
    DtsResult result = compile(file(var("x", ref("Missing"))));

    assertThat(result.success()).isTrue();
    assertThat(result.file()).isNotNull();
    assertThat(result.warnings()).isNotEmpty();
    assertThat(result.warnings().stream().map(DtsError::description))
        .contains("Cannot resolve Missing");
  }

  @Test
  public void testTransformUsesLibraryNameAsContext() {
    options.setPedantic(true);

    DtsResult result =
        new DtsCompiler(options, errorManager)
            .transform(file(var("x", ref("Missing"))), ImmutableMap.of());

    assertThat(result.errors().get(0).description()).startsWith("Aborted transforming mylib");
  }
}
