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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TsTypeSimplificationTest {
  private static final TsTypeRef A = TsTypeRef.of(TsQIdent.ofStrings("A"));
  private static final TsTypeRef B = TsTypeRef.of(TsQIdent.ofStrings("B"));
  private static final TsTypeRef C = TsTypeRef.of(TsQIdent.ofStrings("C"));

  @Test
  public void testUnionFlattensAndDeduplicates() {
    TsType nested = new TsTypeUnion(ImmutableList.of(B, A));
    assertThat(TsTypeUnion.simplified(ImmutableList.of(A, nested, C)))
        .isEqualTo(new TsTypeUnion(ImmutableList.of(A, B, C)));
  }

  @Test
  public void testUnionOfNothingIsNever() {
    assertThat(TsTypeUnion.simplified(ImmutableList.of())).isEqualTo(TsTypeRef.NEVER);
  }

  @Test
  public void testUnionOfOneIsThatType() {
    assertThat(TsTypeUnion.simplified(ImmutableList.of(A, A))).isSameInstanceAs(A);
  }

  @Test
  public void testIntersectionMergesObjectTypes() {
    TsTypeObject one =
        new TsTypeObject(
            Comments.EMPTY, ImmutableList.of(TsMemberProperty.of("a", TsTypeRef.STRING)));
    TsTypeObject two =
        new TsTypeObject(
            Comments.EMPTY, ImmutableList.of(TsMemberProperty.of("b", TsTypeRef.NUMBER)));

    TsType result = TsTypeIntersect.simplified(ImmutableList.of(one, A, two));

    assertThat(result).isInstanceOf(TsTypeIntersect.class);
    ImmutableList<TsType> types = ((TsTypeIntersect) result).types();
    assertThat(types).hasSize(2);
    assertThat(((TsTypeObject) types.get(0)).members())
        .containsExactly(
            TsMemberProperty.of("a", TsTypeRef.STRING), TsMemberProperty.of("b", TsTypeRef.NUMBER))
        .inOrder();
    assertThat(types.get(1)).isEqualTo(A);
  }

  @Test
  public void testIntersectionFlattens() {
    TsType nested = new TsTypeIntersect(ImmutableList.of(A, B));
    assertThat(TsTypeIntersect.simplified(ImmutableList.of(nested, B, C)))
        .isEqualTo(new TsTypeIntersect(ImmutableList.of(A, B, C)));
    assertThat(TsTypeIntersect.simplified(ImmutableList.of())).isEqualTo(TsTypeRef.NEVER);
  }

  @Test
  public void testFormat() {
    TsType union = new TsTypeUnion(ImmutableList.of(A, TsTypeLiteral.str("x")));
    assertThat(TsTypeFormatter.format(new TsTypeQuery(TsQIdent.ofStrings("foo", "bar"))))
        .isEqualTo("typeof foo.bar");
    assertThat(TsTypeFormatter.format(union)).contains("A");
  }
}
