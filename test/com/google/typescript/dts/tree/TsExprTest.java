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

package com.google.typescript.dts.tree;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TsExprTest {
  @Test
  public void testLiterals() {
    assertThat(TsExpr.format(TsExpr.Literal.str("a"))).isEqualTo("\"a\"");
    assertThat(TsExpr.format(TsExpr.Literal.num("42"))).isEqualTo("42");
    assertThat(TsExpr.format(TsExpr.Literal.num("4294967296"))).isEqualTo("4294967296.0");
    assertThat(TsExpr.format(TsExpr.Literal.num("1.5"))).isEqualTo("1.5");
  }

  @Test
  public void testOperators() {
    TsExpr a = new TsExpr.Ref(TsQIdent.ofStrings("a"));
    TsExpr one = TsExpr.Literal.num("1");
    assertThat(TsExpr.format(new TsExpr.BinaryOp(a, "+", one))).isEqualTo("a + 1");
    assertThat(TsExpr.format(new TsExpr.Unary("!", a))).isEqualTo("!a");
    assertThat(TsExpr.format(new TsExpr.Cast(a, TsTypeRef.NUMBER))).isEqualTo("a as number");
  }
}
