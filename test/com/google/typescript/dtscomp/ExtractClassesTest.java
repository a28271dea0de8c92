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
import static com.google.typescript.dtscomp.TsTrees.ctor;
import static com.google.typescript.dtscomp.TsTrees.ctorType;
import static com.google.typescript.dtscomp.TsTrees.file;
import static com.google.typescript.dtscomp.TsTrees.iface;
import static com.google.typescript.dtscomp.TsTrees.param;
import static com.google.typescript.dtscomp.TsTrees.path;
import static com.google.typescript.dtscomp.TsTrees.ref;
import static com.google.typescript.dtscomp.TsTrees.run;
import static com.google.typescript.dtscomp.TsTrees.var;

import com.google.common.collect.ImmutableList;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberFunction;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsTypeObject;
import com.google.typescript.dts.tree.TsTypeRef;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ExtractClassesTest {
  private static TsTypeObject object(TsMember... members) {
    return new TsTypeObject(Comments.EMPTY, ImmutableList.copyOf(members));
  }

  @Test
  public void testVarWithConstructorBecomesClass() {
    TsParsedFile result =
        run(
            ExtractClasses.INSTANCE,
            file(iface("Baz"), var("Bar", object(ctor(ref("Baz"), param("a", TsTypeRef.STRING))))));

    assertThat(result.members()).hasSize(2);
    TsDeclClass bar = (TsDeclClass) result.members().get(1);
    assertThat(bar.name().value()).isEqualTo("Bar");
    assertThat(bar.parent()).isEqualTo(ref("Baz"));
    assertThat(bar.codePath()).isEqualTo(path("Bar"));
    TsMemberFunction constructor = (TsMemberFunction) bar.members().get(0);
    assertThat(constructor.name()).isEqualTo(TsIdent.CONSTRUCTOR);
    assertThat(constructor.signature().params()).hasSize(1);
  }

  @Test
  public void testNameTakenByInterfaceUsesBackupAndKeepsVar() {
    TsMemberProperty version = TsMemberProperty.of("version", TsTypeRef.STRING);
    TsDeclInterface foo = iface("Foo", TsMemberProperty.of("x", TsTypeRef.NUMBER));
    TsDeclVar fooVar = var("Foo", object(ctor(ref("Foo")), version));

    TsParsedFile result = run(ExtractClasses.INSTANCE, file(foo, fooVar));

    assertThat(result.members()).hasSize(3);
    assertThat(result.members().get(0)).isSameInstanceAs(foo);
    assertThat(result.members().get(1)).isSameInstanceAs(fooVar);
    TsDeclClass cls = (TsDeclClass) result.members().get(2);
    assertThat(cls.name().value()).isEqualTo("FooCls");
    assertThat(cls.codePath()).isEqualTo(path("FooCls"));
    assertThat(cls.parent()).isEqualTo(ref("Foo"));
    assertThat(cls.members()).contains(version.withStatic(true));
  }

  @Test
  public void testConstructorTypedVar() {
    TsParsedFile result =
        run(ExtractClasses.INSTANCE, file(iface("Baz"), var("Widget", ctorType(ref("Baz")))));
    TsDeclClass widget = (TsDeclClass) result.members().get(1);
    assertThat(widget.name().value()).isEqualTo("Widget");
    assertThat(widget.parent()).isEqualTo(ref("Baz"));
  }

  @Test
  public void testConstructorPropertiesBecomeNamespace() {
    TsMemberProperty version = TsMemberProperty.of("version", TsTypeRef.STRING);
    TsParsedFile result =
        run(
            ExtractClasses.INSTANCE,
            file(
                iface("Baz"),
                var(
                    "lib",
                    object(TsMemberProperty.of("Widget", ctorType(ref("Baz"))), version))));

    assertThat(result.members()).hasSize(3);
    TsDeclVar remaining = (TsDeclVar) result.members().get(1);
    assertThat(remaining.tpe()).isEqualTo(object(version));
    TsDeclNamespace lib = (TsDeclNamespace) result.members().get(2);
    assertThat(lib.name().value()).isEqualTo("lib");
    TsDeclClass widget = (TsDeclClass) lib.members().get(0);
    assertThat(widget.name().value()).isEqualTo("Widget");
    assertThat(widget.codePath()).isEqualTo(path("lib", "Widget"));
  }

  @Test
  public void testConstructorOfPrimitiveIsLeftAlone() {
    TsParsedFile file = file(var("Bar", object(ctor(TsTypeRef.STRING))));
    assertThat(run(ExtractClasses.INSTANCE, file)).isSameInstanceAs(file);
  }

  @Test
  public void testAnalyzedCtorsPicksConformingSignatures() {
    TsParsedFile file = file(iface("Baz"), iface("Qux"));
    TsTreeScope scope = TsTrees.root(new BasicErrorManager()).descend(file);

    AnalyzedCtors analyzed =
        AnalyzedCtors.from(scope, object(ctor(ref("Baz")), ctor(ref("Qux")), ctor(ref("Baz"))));

    assertThat(analyzed.resultType()).isEqualTo(ref("Baz"));
    assertThat(analyzed.ctors()).hasSize(2);
    assertThat(AnalyzedCtors.from(scope, object(ctor(ref("Missing"))))).isNull();
  }
}
