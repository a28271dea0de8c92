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
public final class TsIdentTest {
  @Test
  public void testLibraryNames() {
    assertThat(TsIdentLibrary.of("lodash")).isEqualTo(new TsIdentLibrarySimple("lodash"));
    assertThat(TsIdentLibrary.of("@types/lodash")).isEqualTo(new TsIdentLibrarySimple("lodash"));
    assertThat(TsIdentLibrary.of("@angular/core"))
        .isEqualTo(new TsIdentLibraryScoped("angular", "core"));
    assertThat(TsIdentLibrary.of("@types/babel__core"))
        .isEqualTo(new TsIdentLibraryScoped("babel", "core"));
    assertThat(TsIdentLibrary.of("@angular/core").value()).isEqualTo("@angular/core");
  }

  @Test
  public void testModuleNames() {
    TsIdentModule module = TsIdentModule.parse("@scope/a/b");
    assertThat(module.scope()).isEqualTo("scope");
    assertThat(module.fragments()).containsExactly("a", "b").inOrder();
    assertThat(module.value()).isEqualTo("@scope/a/b");
    assertThat(TsIdentModule.simple("foo").indexAlternative())
        .isEqualTo(TsIdentModule.parse("foo/index"));
    assertThat(TsIdentModule.parse("foo/index").indexAlternative())
        .isEqualTo(TsIdentModule.simple("foo"));
  }

  @Test
  public void testQualifiedNames() {
    TsQIdent name = TsQIdent.ofStrings("a", "b", "c");
    assertThat(name.asString()).isEqualTo("a.b.c");
    assertThat(name.first()).isEqualTo(TsIdent.simple("a"));
    assertThat(name.last()).isEqualTo(TsIdent.simple("c"));
    assertThat(name.startsWith(TsQIdent.ofStrings("a", "b"))).isTrue();
    assertThat(TsQIdent.STRING.isPrimitive()).isTrue();
    assertThat(name.isPrimitive()).isFalse();
  }

  @Test
  public void testCodePaths() {
    CodePath.HasPath lib = CodePath.ofLibrary(TsIdentLibrary.of("mylib"));
    CodePath.HasPath foo = lib.add(TsIdent.simple("Foo"));
    assertThat(foo.codePath().asString()).isEqualTo("mylib.Foo");
    assertThat(foo.replaceLast(TsIdent.simple("Bar")).codePath().asString())
        .isEqualTo("mylib.Bar");
    assertThat(CodePath.NO_PATH.add(TsIdent.simple("Foo"))).isEqualTo(CodePath.NO_PATH);
  }

  @Test(expected = IllegalStateException.class)
  public void testNoPathIsNotAPath() {
    CodePath.NO_PATH.forceHasPath();
  }

  @Test
  public void testJsLocationSkipsNamespaced() {
    JsLocation global = new JsLocation.Global(TsQIdent.ofStrings("window"));
    assertThat(global.add(TsIdent.NAMESPACED)).isSameInstanceAs(global);
    assertThat(global.add(TsIdent.simple("x")))
        .isEqualTo(new JsLocation.Global(TsQIdent.ofStrings("window", "x")));
  }
}
