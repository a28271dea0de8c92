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
import static com.google.typescript.dtscomp.TsTrees.alias;
import static com.google.typescript.dtscomp.TsTrees.file;
import static com.google.typescript.dtscomp.TsTrees.iface;
import static com.google.typescript.dtscomp.TsTrees.ref;
import static com.google.typescript.dtscomp.TsTrees.run;
import static com.google.typescript.dtscomp.TsTrees.var;

import com.google.common.collect.ImmutableList;
import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.JsLocation;
import com.google.typescript.dts.tree.TsDeclEnum;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeParam;
import com.google.typescript.dts.tree.TsTypeRef;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class InlineTrivialTest {
  private static TsDeclTypeAlias trivial(String name, TsType tpe) {
    return alias(name, tpe).withComments(Comments.marker(Comment.SimpleMarker.IS_TRIVIAL));
  }

  private static TsType typeOfVar(TsParsedFile file, int index) {
    return ((TsDeclVar) file.members().get(index)).tpe();
  }

  @Test
  public void testFollowsTrivialAliases() {
    TsParsedFile result =
        run(
            InlineTrivial.INSTANCE,
            file(trivial("A", ref("B")), trivial("B", ref("C")), iface("C"), var("x", ref("A"))));
    assertThat(typeOfVar(result, 3)).isEqualTo(ref("C"));
  }

  @Test
  public void testKeepsNonTrivialAliases() {
    TsParsedFile file = file(alias("A", ref("B")), iface("B"), var("x", ref("A")));
    assertThat(run(InlineTrivial.INSTANCE, file)).isSameInstanceAs(file);
  }

  @Test
  public void testKeepsAliasesWithTypeParameters() {
    TsDeclTypeAlias generic =
        trivial("Foo", ref("Bar")).withTParams(ImmutableList.of(TsTypeParam.of("T")));
    TsParsedFile file = file(generic, iface("Bar"), var("x", ref("Foo")));
    assertThat(run(InlineTrivial.INSTANCE, file)).isSameInstanceAs(file);
  }

  @Test
  public void testChainStopsBeforeAliasWithTypeParameters() {
    TsDeclTypeAlias generic =
        trivial("B", ref("C")).withTParams(ImmutableList.of(TsTypeParam.of("T")));
    TsParsedFile result =
        run(
            InlineTrivial.INSTANCE,
            file(trivial("A", ref("B")), generic, iface("C"), var("x", ref("A"))));
    assertThat(typeOfVar(result, 3)).isEqualTo(ref("B"));
  }

  @Test
  public void testCircularAliasesTerminate() {
    TsParsedFile result =
        run(
            InlineTrivial.INSTANCE,
            file(trivial("A", ref("B")), trivial("B", ref("A")), var("x", ref("A"))));
    TsTypeRef x = (TsTypeRef) typeOfVar(result, 2);
    assertThat(x.name()).isAnyOf(TsQIdent.ofStrings("A"), TsQIdent.ofStrings("B"));
  }

  @Test
  public void testExportedEnumPointsAtOrigin() {
    TsTypeRef origin = ref("other", "E");
    TsDeclEnum e =
        new TsDeclEnum(
            Comments.EMPTY,
            true,
            false,
            TsIdent.simple("E"),
            ImmutableList.of(),
            false,
            origin,
            JsLocation.ZERO,
            TsTrees.path("E"));
    TsParsedFile result = run(InlineTrivial.INSTANCE, file(e, var("x", ref("E"))));
    assertThat(typeOfVar(result, 1)).isEqualTo(origin);
  }
}
