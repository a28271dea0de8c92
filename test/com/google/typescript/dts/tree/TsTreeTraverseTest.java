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
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TsTreeTraverseTest {
  private static TsTypeRef ref(String name, TsType... targs) {
    return TsTypeRef.of(TsQIdent.ofStrings(name), ImmutableList.copyOf(targs));
  }

  private static @Nullable String refName(TsTree tree) {
    return tree instanceof TsTypeRef ref ? ref.name().asString() : null;
  }

  private static TsFunSig sig() {
    return new TsFunSig(
        Comments.EMPTY,
        ImmutableList.of(),
        ImmutableList.of(
            new TsFunParam(Comments.EMPTY, TsIdent.simple("a"), ref("A")),
            new TsFunParam(Comments.EMPTY, TsIdent.simple("b"), ref("B", ref("C")))),
        ref("D"));
  }

  @Test
  public void testPreOrderLeftToRight() {
    assertThat(TsTreeTraverse.collect(sig(), TsTreeTraverseTest::refName))
        .containsExactly("A", "B", "C", "D")
        .inOrder();
  }

  @Test
  public void testRootIsIncluded() {
    assertThat(TsTreeTraverse.collect(ref("A"), TsTreeTraverseTest::refName)).containsExactly("A");
    assertThat(TsTreeTraverse.collect(TsTypeLiteral.str("x"), TsTreeTraverseTest::refName))
        .isEmpty();
  }

  @Test
  public void testDeclarationsInFieldOrder() {
    TsDeclInterface iface =
        new TsDeclInterface(
            Comments.EMPTY,
            true,
            TsIdent.simple("I"),
            ImmutableList.of(),
            ImmutableList.of(ref("Parent")),
            ImmutableList.of(
                TsMemberProperty.of("p", ref("P")),
                new TsMemberFunction(
                    Comments.EMPTY,
                    TsProtectionLevel.DEFAULT,
                    TsIdent.simple("m"),
                    MethodType.NORMAL,
                    sig(),
                    false,
                    false)),
            CodePath.NO_PATH);

    ImmutableList<TsTree> roots = ImmutableList.of(iface, ref("Z"));
    assertThat(TsTreeTraverse.collect(roots, TsTreeTraverseTest::refName))
        .containsExactly("Parent", "P", "A", "B", "C", "D", "Z")
        .inOrder();
  }

  @Test
  public void testChildren() {
    TsTypeUnion union = new TsTypeUnion(ImmutableList.of(ref("A"), TsTypeRef.NULL));
    assertThat(TsTreeTraverse.children(union)).containsExactly(ref("A"), TsTypeRef.NULL).inOrder();
    assertThat(TsTreeTraverse.children(ref("A"))).isEmpty();
  }
}
