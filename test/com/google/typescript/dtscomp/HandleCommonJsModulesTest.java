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
import static com.google.typescript.dtscomp.TsTrees.ref;
import static com.google.typescript.dtscomp.TsTrees.run;

import com.google.common.collect.ImmutableList;
import com.google.typescript.dts.tree.CodePath;
import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.ExportType;
import com.google.typescript.dts.tree.JsLocation;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclModule;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsExport;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentModule;
import com.google.typescript.dts.tree.TsImport;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsTypeThis;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class HandleCommonJsModulesTest {
  private static final TsIdentModule MODULE = TsIdentModule.simple("m");
  private static final CodePath.HasPath MODULE_PATH = TsTrees.path().add(MODULE);

  private static final TsExport EXPORT_EQUALS =
      new TsExport(
          Comments.EMPTY,
          false,
          ExportType.NAMESPACED,
          new TsExport.Names(
              ImmutableList.of(new TsExport.Name(TsQIdent.ofStrings("Foo"), null)), null));

  private static TsDeclModule module(TsContainerOrDecl... members) {
    return new TsDeclModule(
        Comments.EMPTY,
        true,
        MODULE,
        ImmutableList.copyOf(members),
        MODULE_PATH,
        new JsLocation.Module(MODULE, ImmutableList.of()));
  }

  private static TsDeclNamespace namespace(TsContainerOrDecl... members) {
    return new TsDeclNamespace(
        Comments.EMPTY,
        true,
        TsIdent.simple("Foo"),
        ImmutableList.copyOf(members),
        MODULE_PATH.add(TsIdent.simple("Foo")),
        JsLocation.ZERO);
  }

  private static CodePath inNamespace(String name) {
    return MODULE_PATH.add(TsIdent.simple("Foo")).add(TsIdent.simple(name));
  }

  private static TsDeclModule transform(TsDeclModule module) {
    TsParsedFile result = run(HandleCommonJsModules.INSTANCE, file(module));
    return (TsDeclModule) result.members().get(0);
  }

  @Test
  public void testFlattensNamespaceIntoModule() {
    TsDeclClass foo = TsTrees.clsAt(MODULE_PATH.add(TsIdent.simple("Foo")), "Foo", null);
    TsDeclInterface x = TsTrees.ifaceAt(inNamespace("X"), "X", ImmutableList.of());
    TsDeclTypeAlias n = TsTrees.aliasAt(inNamespace("N"), "N", ref("Foo", "N"));

    TsDeclModule result = transform(module(foo, namespace(x, n), EXPORT_EQUALS));

    assertThat(result.members()).hasSize(3);
    TsExport exportX = (TsExport) result.members().get(0);
    assertThat(exportX.tpe()).isEqualTo(ExportType.NAMED);
    TsDeclInterface movedX = (TsDeclInterface) ((TsExport.Tree) exportX.exported()).decl();
    assertThat(movedX.name()).isEqualTo(x.name());
    assertThat(movedX.codePath()).isEqualTo(MODULE_PATH.add(TsIdent.simple("X")));
    assertThat(result.members().get(1)).isSameInstanceAs(foo);
    assertThat(result.members().get(2)).isSameInstanceAs(EXPORT_EQUALS);
    for (TsContainerOrDecl member : result.members()) {
      assertThat(member).isNotInstanceOf(TsDeclTypeAlias.class);
    }
  }

  @Test
  public void testStripsTargetPrefix() {
    TsDeclInterface x = TsTrees.ifaceAt(inNamespace("X"), "X", ImmutableList.of());
    TsDeclInterface y =
        TsTrees.ifaceAt(
            inNamespace("Y"), "Y", ImmutableList.of(), TsMemberProperty.of("x", ref("Foo", "X")));

    TsDeclModule result = transform(module(namespace(x, y), EXPORT_EQUALS));

    TsDeclInterface movedY =
        (TsDeclInterface) ((TsExport.Tree) ((TsExport) result.members().get(1)).exported()).decl();
    assertThat(((TsMemberProperty) movedY.members().get(0)).tpe()).isEqualTo(ref("X"));
  }

  @Test
  public void testExportImportBecomesTrivialVar() {
    TsExport exportImport =
        new TsExport(
            Comments.EMPTY,
            false,
            ExportType.NAMED,
            new TsExport.Tree(
                new TsImport(
                    false,
                    ImmutableList.of(new TsImport.Ident(TsIdent.simple("Alias"))),
                    new TsImport.Local(TsQIdent.ofStrings("Foo")))));
    TsDeclInterface x = TsTrees.ifaceAt(inNamespace("X"), "X", ImmutableList.of());

    TsDeclModule result = transform(module(namespace(x), exportImport, EXPORT_EQUALS));

    TsDeclVar var =
        (TsDeclVar) ((TsExport.Tree) ((TsExport) result.members().get(1)).exported()).decl();
    assertThat(var.name().value()).isEqualTo("Alias");
    assertThat(var.tpe()).isEqualTo(new TsTypeThis());
    assertThat(var.comments().has(Comment.SimpleMarker.IS_TRIVIAL)).isTrue();
  }

  @Test
  public void testModuleWithoutNamespaceIsUnchanged() {
    TsParsedFile file =
        file(
            module(
                TsTrees.clsAt(MODULE_PATH.add(TsIdent.simple("Foo")), "Foo", null),
                EXPORT_EQUALS));
    assertThat(run(HandleCommonJsModules.INSTANCE, file)).isSameInstanceAs(file);
  }
}
