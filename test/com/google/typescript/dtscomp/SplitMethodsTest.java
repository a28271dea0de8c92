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
import static com.google.typescript.dtscomp.TsTrees.fn;
import static com.google.typescript.dtscomp.TsTrees.iface;
import static com.google.typescript.dtscomp.TsTrees.method;
import static com.google.typescript.dtscomp.TsTrees.param;
import static com.google.typescript.dtscomp.TsTrees.ref;
import static com.google.typescript.dtscomp.TsTrees.run;
import static com.google.typescript.dtscomp.TsTrees.sig;
import static com.google.typescript.dtscomp.TsTrees.union;

import com.google.common.collect.ImmutableList;
import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.TsDeclFunction;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsFunParam;
import com.google.typescript.dts.tree.TsFunSig;
import com.google.typescript.dts.tree.TsMemberFunction;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeLiteral;
import com.google.typescript.dts.tree.TsTypeRef;
import com.google.typescript.dts.tree.TsTypeRepeated;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SplitMethodsTest {
  private static final TsTypeRef A = ref("A");
  private static final TsTypeRef B = ref("B");
  private static final TsTypeRef C = ref("C");
  private static final TsTypeRef D = ref("D");

  private static ImmutableList<TsType> paramTypes(TsFunSig sig) {
    ImmutableList.Builder<TsType> types = ImmutableList.builder();
    for (TsFunParam p : sig.params()) {
      types.add(p.tpe());
    }
    return types.build();
  }

  @Test
  public void testTooManyCombinationsAreNotSplit() {
    TsFunSig sig =
        sig(
            TsTypeRef.VOID,
            param("a", union(A, B, C)),
            param("b", union(A, B, C)),
            param("c", union(A, B, C)),
            param("d", union(A, B, C)));
    assertThat(SplitMethods.split(sig)).containsExactly(sig);
  }

  @Test
  public void testEveryCombinationInParameterOrder() {
    TsFunSig sig = sig(TsTypeRef.VOID, param("a", union(A, B)), param("b", union(C, D)));

    ImmutableList<TsFunSig> split = SplitMethods.split(sig);

    assertThat(split).hasSize(4);
    List<ImmutableList<TsType>> combinations = new ArrayList<>();
    for (TsFunSig s : split) {
      assertThat(s.params().get(0).name().value()).isEqualTo("a");
      assertThat(s.params().get(1).name().value()).isEqualTo("b");
      combinations.add(paramTypes(s));
    }
    assertThat(combinations)
        .containsExactly(
            ImmutableList.of(A, C),
            ImmutableList.of(B, C),
            ImmutableList.of(A, D),
            ImmutableList.of(B, D))
        .inOrder();
  }

  @Test
  public void testLiteralsStayTogether() {
    TsType lits = union(TsTypeLiteral.str("x"), TsTypeLiteral.str("y"));
    TsFunSig sig =
        sig(
            TsTypeRef.VOID,
            param("a", union(TsTypeLiteral.str("x"), A, TsTypeLiteral.str("y"))));

    ImmutableList<TsFunSig> split = SplitMethods.split(sig);

    assertThat(split).hasSize(2);
    assertThat(paramTypes(split.get(0))).containsExactly(A);
    assertThat(paramTypes(split.get(1))).containsExactly(lits);
  }

  @Test
  public void testTrailingUndefinedIsDropped() {
    TsFunSig sig = sig(TsTypeRef.VOID, param("a", union(TsTypeRef.STRING, TsTypeRef.UNDEFINED)));

    ImmutableList<TsFunSig> split = SplitMethods.split(sig);

    assertThat(split).hasSize(2);
    assertThat(split.get(0).params()).isEmpty();
    assertThat(paramTypes(split.get(1))).containsExactly(TsTypeRef.STRING);
  }

  @Test
  public void testRepeatedUnionIsSplitInside() {
    TsFunSig sig = sig(TsTypeRef.VOID, param("rest", new TsTypeRepeated(union(A, B))));

    assertThat(SplitMethods.split(sig).stream().map(SplitMethodsTest::paramTypes))
        .containsExactly(
            ImmutableList.of(new TsTypeRepeated(A)), ImmutableList.of(new TsTypeRepeated(B)))
        .inOrder();
  }

  @Test
  public void testTooManyParametersAreNotSplit() {
    List<TsFunParam> params = new ArrayList<>();
    for (int i = 0; i <= SplitMethods.MAX_PARAMS; i++) {
      params.add(param("p" + i, i == 0 ? union(A, B) : A));
    }
    TsFunSig sig = sig(TsTypeRef.VOID).withParams(ImmutableList.copyOf(params));
    assertThat(SplitMethods.split(sig)).containsExactly(sig);
  }

  @Test
  public void testSplitsFunctionsAndMethods() {
    Comments doc = Comments.of(new Comment.Raw("/** doc */"));
    TsDeclFunction f =
        fn("f", sig(TsTypeRef.VOID, param("a", union(A, B)))).withComments(doc);
    TsMemberFunction m = method("m", sig(TsTypeRef.VOID, param("a", union(C, D))));

    TsParsedFile result = run(SplitMethods.INSTANCE, file(f, iface("I", m)));

    assertThat(result.members()).hasSize(3);
    TsDeclFunction first = (TsDeclFunction) result.members().get(0);
    TsDeclFunction second = (TsDeclFunction) result.members().get(1);
    assertThat(first.comments()).isEqualTo(doc);
    assertThat(second.comments()).isEqualTo(Comments.EMPTY);
    assertThat(paramTypes(second.signature())).containsExactly(B);

    TsDeclInterface i = (TsDeclInterface) result.members().get(2);
    assertThat(i.members()).hasSize(2);
  }

  @Test
  public void testNoUnionsLeaveFileUnchanged() {
    TsParsedFile file =
        file(fn("f", sig(TsTypeRef.VOID, param("a", A))), iface("I", method("m", sig(B))));
    assertThat(run(SplitMethods.INSTANCE, file)).isSameInstanceAs(file);
  }
}
