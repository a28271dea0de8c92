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
import static com.google.typescript.dtscomp.TsTrees.cls;
import static com.google.typescript.dtscomp.TsTrees.file;
import static com.google.typescript.dtscomp.TsTrees.fn;
import static com.google.typescript.dtscomp.TsTrees.iface;
import static com.google.typescript.dtscomp.TsTrees.param;
import static com.google.typescript.dtscomp.TsTrees.path;
import static com.google.typescript.dtscomp.TsTrees.root;
import static com.google.typescript.dtscomp.TsTrees.sig;
import static com.google.typescript.dtscomp.TsTrees.var;

import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.TsDeclFunction;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsFunSig;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeFunction;
import com.google.typescript.dts.tree.TsTypeQuery;
import com.google.typescript.dts.tree.TsTypeRef;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ResolveTypeQueriesTest {
  private static final TsFunSig SIG = sig(TsTypeRef.VOID, param("x", TsTypeRef.STRING));

  private BasicErrorManager errorManager;

  @Before
  public void setUp() {
    errorManager = new BasicErrorManager();
  }

  private static TsTypeQuery typeOf(String... names) {
    return new TsTypeQuery(TsQIdent.ofStrings(names));
  }

  private TsParsedFile resolve(TsParsedFile file) {
    return ResolveTypeQueries.INSTANCE.visitTsParsedFile(root(errorManager), file);
  }

  @Test
  public void testVarOfFunctionTypeBecomesFunction() {
    TsParsedFile result = resolve(file(fn("f", SIG), var("g", typeOf("f"))));

    assertThat(result.members()).hasSize(2);
    TsDeclFunction g = (TsDeclFunction) result.members().get(1);
    assertThat(g.name().value()).isEqualTo("g");
    assertThat(g.signature()).isEqualTo(SIG);
    assertThat(g.codePath()).isEqualTo(path("g"));
    assertThat(g.comments().asList()).contains(new Comment.Raw("/* was `typeof f` */\n"));
  }

  @Test
  public void testPropertyOfVarTypeTakesItsType() {
    TsParsedFile result =
        resolve(
            file(
                var("v", TsTypeRef.NUMBER),
                iface("I", TsMemberProperty.of("p", typeOf("v")))));

    TsMemberProperty p =
        (TsMemberProperty) ((TsDeclInterface) result.members().get(1)).members().get(0);
    assertThat(p.tpe()).isEqualTo(TsTypeRef.NUMBER);
  }

  @Test
  public void testTypeOfFunctionInTypePosition() {
    TsParsedFile result = resolve(file(fn("f", SIG), alias("F", typeOf("f"))));
    assertThat(((TsDeclTypeAlias) result.members().get(1)).alias())
        .isEqualTo(new TsTypeFunction(SIG));
  }

  @Test
  public void testTypeOfClassIsReference() {
    TsParsedFile result = resolve(file(cls("C", null), alias("T", typeOf("C"))));
    assertThat(((TsDeclTypeAlias) result.members().get(1)).alias())
        .isEqualTo(TsTypeRef.of(path("C").codePath()));
  }

  @Test
  public void testUnresolvedBecomesAnyWithWarning() {
    TsParsedFile result = resolve(file(alias("T", typeOf("missing"))));

    TsType tpe = ((TsDeclTypeAlias) result.members().get(0)).alias();
    assertThat(((TsTypeRef) tpe).name()).isEqualTo(TsQIdent.ANY);
    assertThat(tpe.comments().asList())
        .containsExactly(Comment.warning("Couldn't resolve typeof missing"));
    assertThat(errorManager.getWarnings()).hasSize(1);
    assertThat(errorManager.getWarnings().get(0).type())
        .isEqualTo(ResolveTypeQueries.UNRESOLVED_TYPE_QUERY);
  }

  @Test
  public void testUnresolvedVarKeepsVar() {
    TsParsedFile result = resolve(file(var("h", typeOf("missing"))));
    TsDeclVar h = (TsDeclVar) result.members().get(0);
    assertThat(((TsTypeRef) h.tpe()).name()).isEqualTo(TsQIdent.ANY);
    assertThat(errorManager.getWarningCount()).isEqualTo(1);
  }

  @Test
  public void testGlobalThis() {
    TsParsedFile result = resolve(file(alias("T", new TsTypeQuery(TsQIdent.GLOBAL_THIS))));
    TsType tpe = ((TsDeclTypeAlias) result.members().get(0)).alias();
    assertThat(((TsTypeRef) tpe).name()).isEqualTo(TsQIdent.ANY);
    assertThat(errorManager.getWarnings()).isEmpty();
  }

  @Test
  public void testNoQueriesLeaveFileUnchanged() {
    TsParsedFile file = file(var("v", TsTypeRef.NUMBER), iface("I"));
    assertThat(resolve(file)).isSameInstanceAs(file);
  }
}
