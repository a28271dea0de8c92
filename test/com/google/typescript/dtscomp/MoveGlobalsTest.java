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
import static com.google.typescript.dtscomp.TsTrees.cls;
import static com.google.typescript.dtscomp.TsTrees.file;
import static com.google.typescript.dtscomp.TsTrees.iface;
import static com.google.typescript.dtscomp.TsTrees.ns;
import static com.google.typescript.dtscomp.TsTrees.path;
import static com.google.typescript.dtscomp.TsTrees.var;

import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsTypeRef;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MoveGlobalsTest {
  @Test
  public void testTypesOnlyFileIsUnchanged() {
    TsParsedFile file = file(iface("Foo"), iface("Bar"));
    assertThat(MoveGlobals.apply(file)).isSameInstanceAs(file);
  }

  @Test
  public void testValuesMoveIntoGlobalNamespace() {
    TsDeclClass foo = cls("Foo", null);
    TsDeclVar bar = var("bar", TsTypeRef.STRING);

    TsParsedFile result = MoveGlobals.apply(file(foo, bar));

    assertThat(result.members()).hasSize(2);
    TsDeclInterface typeSide = (TsDeclInterface) result.members().get(0);
    assertThat(typeSide.name()).isEqualTo(foo.name());
    assertThat(typeSide.codePath()).isEqualTo(path("Foo"));

    TsDeclNamespace global = (TsDeclNamespace) result.members().get(1);
    assertThat(global.name()).isEqualTo(TsIdent.GLOBAL);
    assertThat(global.codePath()).isEqualTo(path("<global>"));
    assertThat(global.members()).hasSize(2);

    TsDeclClass classCopy = (TsDeclClass) global.members().get(0);
    assertThat(classCopy.codePath()).isEqualTo(path("<global>", "Foo"));
    assertThat(classCopy.parent()).isEqualTo(TsTypeRef.of(path("Foo").codePath()));

    TsDeclVar varCopy = (TsDeclVar) global.members().get(1);
    assertThat(varCopy.codePath()).isEqualTo(path("<global>", "bar"));
    assertThat(varCopy.tpe()).isEqualTo(TsTypeRef.STRING);
  }

  @Test
  public void testExistingGlobalNamespacesMergeByName() {
    TsDeclInterface a = iface("A");
    TsDeclInterface b = iface("B");
    TsDeclVar bar = var("bar", TsTypeRef.STRING);

    TsParsedFile result =
        MoveGlobals.apply(file(bar, ns("<global>", ns("N", a)), ns("<global>", ns("N", b))));

    TsDeclNamespace global = (TsDeclNamespace) result.members().get(result.members().size() - 1);
    assertThat(global.name()).isEqualTo(TsIdent.GLOBAL);
    assertThat(global.members()).hasSize(2);
    assertThat(((TsDeclVar) global.members().get(0)).name()).isEqualTo(bar.name());
    TsDeclNamespace n = (TsDeclNamespace) global.members().get(1);
    assertThat(n.members()).containsExactly(a, b).inOrder();
  }

  @Test
  public void testMergeKeepsDifferentNamesApart() {
    TsDeclNamespace merged =
        MoveGlobals.merge(ns("G", ns("N", iface("A"))), ns("G", ns("M", iface("B"))));
    assertThat(merged.members()).hasSize(2);
  }
}
