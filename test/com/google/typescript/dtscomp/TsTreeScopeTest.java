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
import static com.google.typescript.dtscomp.TsTrees.LIB;
import static com.google.typescript.dtscomp.TsTrees.file;
import static com.google.typescript.dtscomp.TsTrees.fileIn;
import static com.google.typescript.dtscomp.TsTrees.iface;
import static com.google.typescript.dtscomp.TsTrees.ifaceAt;
import static com.google.typescript.dtscomp.TsTrees.ns;
import static com.google.typescript.dtscomp.TsTrees.path;
import static com.google.typescript.dtscomp.TsTrees.root;
import static com.google.typescript.dtscomp.TsTrees.var;
import static com.google.typescript.dtscomp.TsTrees.varAt;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.typescript.dts.tree.CodePath;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.JsLocation;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentLibrary;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsTypeParam;
import com.google.typescript.dts.tree.TsTypeRef;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TsTreeScopeTest {
  private final TsDeclInterface foo = iface("Foo");
  private final TsDeclVar bar = var("bar", TsTypeRef.STRING);
  private final TsDeclInterface inner = ifaceAt(path("N", "Inner"), "Inner", ImmutableList.of());
  private final TsDeclNamespace namespace = ns("N", inner);
  private final TsParsedFile file = file(foo, bar, namespace);

  private BasicErrorManager errorManager;

  @Before
  public void setUp() {
    errorManager = new BasicErrorManager();
  }

  @Test
  public void testLookupInFile() {
    TsTreeScope scope = root(errorManager).descend(file);
    assertThat(scope.lookupType(TsQIdent.ofStrings("Foo"))).containsExactly(foo);
    assertThat(scope.lookup(TsQIdent.ofStrings("bar"))).containsExactly(bar);
    assertThat(errorManager.getWarnings()).isEmpty();
  }

  @Test
  public void testQualifiedLookupThroughNamespace() {
    TsTreeScope scope = root(errorManager).descend(file);
    assertThat(scope.lookupType(TsQIdent.ofStrings("N", "Inner"))).containsExactly(inner);
  }

  @Test
  public void testNamespacedMemberIsSearchedWhenNameMissing() {
    TsDeclInterface x = ifaceAt(path("Foo", "^", "X"), "X", ImmutableList.of());
    TsParsedFile withNamespaced = file(ns("Foo", ns("^", x)));

    TsTreeScope scope = root(errorManager).descend(withNamespaced);

    assertThat(scope.lookupType(TsQIdent.ofStrings("Foo", "X"))).containsExactly(x);
    assertThat(errorManager.getWarnings()).isEmpty();
  }

  @Test
  public void testDirectMemberWinsOverNamespaced() {
    TsDeclInterface direct = ifaceAt(path("Foo", "X"), "X", ImmutableList.of());
    TsDeclInterface hidden = ifaceAt(path("Foo", "^", "X"), "X", ImmutableList.of());
    TsParsedFile withBoth = file(ns("Foo", direct, ns("^", hidden)));

    TsTreeScope scope = root(errorManager).descend(withBoth);

    assertThat(scope.lookupType(TsQIdent.ofStrings("Foo", "X"))).containsExactly(direct);
  }

  @Test
  public void testInnerScopeSeesOuterDeclarations() {
    TsTreeScope scope = root(errorManager).descend(file).descend(namespace).descend(inner);
    assertThat(scope.lookupType(TsQIdent.ofStrings("Foo"))).containsExactly(foo);
    assertThat(scope.lookupType(TsQIdent.ofStrings("Inner"))).containsExactly(inner);
  }

  @Test
  public void testTypePickerSkipsValues() {
    TsTreeScope scope = root(errorManager).descend(file);
    assertThat(scope.lookupType(TsQIdent.ofStrings("bar"), true)).isEmpty();
    assertThat(scope.lookupBase(Picker.VARS, TsQIdent.ofStrings("bar"), true)).hasSize(1);
  }

  @Test
  public void testLibraryNameJumpsToFile() {
    TsTreeScope scope = root(errorManager).descend(file).descend(namespace);
    assertThat(scope.lookupType(TsQIdent.of(LIB, TsIdent.simple("Foo")))).containsExactly(foo);
  }

  @Test
  public void testTypeParametersAreAbstract() {
    TsDeclInterface generic = foo.withTParams(ImmutableList.of(TsTypeParam.of("T")));
    TsTreeScope scope = root(errorManager).descend(file(generic)).descend(generic);
    assertThat(scope.isAbstract(TsQIdent.ofStrings("T"))).isTrue();
    assertThat(scope.lookup(TsQIdent.ofStrings("T"))).isEmpty();
    assertThat(errorManager.getWarnings()).isEmpty();
  }

  @Test
  public void testPrimitivesResolveToNothing() {
    TsTreeScope scope = root(errorManager).descend(file);
    assertThat(scope.lookup(TsQIdent.STRING)).isEmpty();
    assertThat(errorManager.getWarnings()).isEmpty();
  }

  @Test
  public void testDependencyLookup() {
    TsDeclInterface array =
        ifaceAt(
            CodePath.ofLibrary(TsIdentLibrary.STD).add(TsIdent.simple("Array")),
            "Array",
            ImmutableList.of());
    ImmutableMap<TsIdentLibrary, TsParsedFile> deps =
        ImmutableMap.of(TsIdentLibrary.STD, fileIn(TsIdentLibrary.STD, array));
    TsTreeScope.Root root = root(errorManager, false, deps);

    assertThat(root.lookupType(TsQIdent.of(TsIdentLibrary.STD, TsIdent.simple("Array"))))
        .containsExactly(array);
    assertThat(root.descend(file).lookupType(TsQIdent.ofStrings("Array")))
        .containsExactly(array);
  }

  @Test
  public void testGlobalNamespaceIsSearched() {
    TsDeclVar g = varAt(path("<global>", "g"), "g", TsTypeRef.NUMBER);
    TsDeclNamespace global =
        new TsDeclNamespace(
            Comments.EMPTY,
            false,
            TsIdent.GLOBAL,
            ImmutableList.of(g),
            path("<global>"),
            JsLocation.ZERO);
    TsTreeScope scope = root(errorManager).descend(file(foo, global)).descend(foo);
    assertThat(scope.lookup(TsQIdent.ofStrings("g"))).containsExactly(g);
    assertThat(scope.lookup(TsQIdent.of(TsIdent.GLOBAL, TsIdent.simple("g"))))
        .containsExactly(g);
  }

  @Test
  public void testUnresolvedNameWarns() {
    TsTreeScope scope = root(errorManager).descend(file);
    assertThat(scope.lookupType(TsQIdent.ofStrings("Missing"))).isEmpty();
    assertThat(errorManager.getWarningCount()).isEqualTo(1);
    assertThat(errorManager.getWarnings().get(0).description())
        .isEqualTo("Cannot resolve Missing");
  }

  @Test
  public void testSkipValidationIsQuiet() {
    TsTreeScope scope = root(errorManager).descend(file);
    assertThat(scope.lookupType(TsQIdent.ofStrings("Missing"), true)).isEmpty();
    assertThat(errorManager.getWarnings()).isEmpty();
  }

  @Test
  public void testUnresolvedNameIsFatalWhenPedantic() {
    TsTreeScope scope = root(errorManager, true, ImmutableMap.of()).descend(file);
    DtsFatalError e =
        assertThrows(DtsFatalError.class, () -> scope.lookupType(TsQIdent.ofStrings("Missing")));
    assertThat(e).hasMessageThat().contains("Cannot resolve Missing");
  }

  @Test
  public void testStackIsInnermostFirst() {
    TsTreeScope scope = root(errorManager).descend(file).descend(namespace);
    assertThat(scope.stack()).containsExactly(namespace, file).inOrder();
    assertThat(scope.surroundingTsContainer()).isSameInstanceAs(namespace);
    assertThat(scope.root().stack()).isEmpty();
  }

  @Test
  public void testScopesCompareByPosition() {
    TsTreeScope.Root root = root(errorManager);
    assertThat(root.descend(file).descend(namespace))
        .isEqualTo(root.descend(file).descend(namespace));
    assertThat(root.descend(file)).isNotEqualTo(root.descend(file).descend(namespace));
  }

  @Test
  public void testLoopDetectorRejectsRepeatedLookup() {
    TsTreeScope scope = root(errorManager).descend(file);
    ImmutableList<TsIdent> wanted = TsQIdent.ofStrings("Foo").parts();
    LoopDetector once = LoopDetector.INITIAL.including(wanted, scope);
    assertThat(once).isNotNull();
    assertThat(once.including(wanted, scope)).isNull();
    assertThat(once.including(wanted, scope.descend(foo))).isNotNull();
  }

  @Test
  public void testLoopDetectorRemembersEveryStep() {
    TsTreeScope scope = root(errorManager).descend(file);
    ImmutableList<TsIdent> first = TsQIdent.ofStrings("Foo").parts();
    ImmutableList<TsIdent> second = TsQIdent.ofStrings("bar").parts();
    LoopDetector two = LoopDetector.INITIAL.including(first, scope).including(second, scope);

    assertThat(two.depth()).isEqualTo(2);
    assertThat(two.including(first, scope)).isNull();
    assertThat(two.including(TsTypeRef.of(TsQIdent.ofStrings("Foo")), scope)).isNotNull();
    assertThat(LoopDetector.INITIAL.depth()).isEqualTo(0);
  }
}
