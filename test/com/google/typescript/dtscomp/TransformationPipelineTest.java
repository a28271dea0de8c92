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
import static com.google.typescript.dtscomp.TsTrees.var;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.typescript.dts.tree.TsIdentLibrary;
import com.google.typescript.dts.tree.TsParsedFile;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TransformationPipelineTest {
  private final List<String> ran = new ArrayList<>();
  private final List<TsTreeScope.Root> roots = new ArrayList<>();
  private BasicErrorManager errorManager;
  private TsLogger tsLogger;

  @Before
  public void setUp() {
    errorManager = new BasicErrorManager();
    tsLogger =
        TsLogger.create(Logger.getLogger(TransformationPipelineTest.class.getName()), errorManager);
  }

  private NamedPass recording(String name) {
    return NamedPass.of(
        name,
        (root, file) -> {
          ran.add(name);
          roots.add(root);
          return file;
        });
  }

  private static ImmutableList<String> names(ImmutableList<NamedPass> passes) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (NamedPass pass : passes) {
      result.add(pass.getName());
    }
    return result.build();
  }

  @Test
  public void testDefaultOrder() {
    assertThat(names(TransformationPipeline.defaultPasses(TsIdentLibrary.of("lodash"))))
        .containsExactly(
            "handleCommonJsModules",
            "moveGlobals",
            "inferEnumTypes",
            "rejiggerIntersections",
            "typeAliasIntersection",
            "splitMethods",
            "removeStubs",
            "dropProperties",
            "resolveTypeQueries",
            "inlineTrivial",
            "simplifyParents",
            "extractClasses")
        .inOrder();
  }

  @Test
  public void testLibrarySpecificStageOnlyForPatchedLibraries() {
    ImmutableList<String> react =
        names(TransformationPipeline.defaultPasses(TsIdentLibrary.of("react")));
    assertThat(react.get(react.size() - 1)).isEqualTo("librarySpecific");
    assertThat(names(TransformationPipeline.defaultPasses(TsIdentLibrary.of("lodash"))))
        .doesNotContain("librarySpecific");
  }

  @Test
  public void testLibrarySpecificStageCanBeTurnedOff() {
    DtsOptions options = new DtsOptions();
    options.setLibraryName(TsIdentLibrary.of("react"));
    NamedPass patch = TransformationPipeline.create(options).getPasses().get(12);
    assertThat(patch.getCondition().test(options)).isTrue();
    options.setLibrarySpecific(false);
    assertThat(patch.getCondition().test(options)).isFalse();
  }

  @Test
  public void testRunsStagesInOrderWithFreshRoots() {
    DtsOptions options = new DtsOptions();
    TransformationPipeline pipeline =
        TransformationPipeline.of(options, ImmutableList.of(recording("a"), recording("b")));

    TsParsedFile input = file();
    assertThat(pipeline.run(input, ImmutableMap.of(), tsLogger)).isSameInstanceAs(input);
    assertThat(ran).containsExactly("a", "b").inOrder();
    assertThat(roots).hasSize(2);
    assertThat(roots.get(0)).isNotSameInstanceAs(roots.get(1));
    assertThat(roots.get(0).libName()).isEqualTo(options.getLibraryName());
  }

  @Test
  public void testSkipsDisabledStages() {
    DtsOptions options = new DtsOptions();
    options.disablePass("b");
    NamedPass never =
        NamedPass.builder()
            .setName("c")
            .setCondition(o -> false)
            .setPass(
                (root, file) -> {
                  ran.add("c");
                  return file;
                })
            .build();
    TransformationPipeline pipeline =
        TransformationPipeline.of(
            options, ImmutableList.of(recording("a"), recording("b"), never, recording("d")));

    pipeline.run(file(), ImmutableMap.of(), tsLogger);

    assertThat(ran).containsExactly("a", "d").inOrder();
  }

  @Test
  public void testEachStageSeesTheOutputOfThePrevious() {
    TsParsedFile replaced = file(var("x", ref("A")));
    TransformationPipeline pipeline =
        TransformationPipeline.of(
            new DtsOptions(),
            ImmutableList.of(
                NamedPass.of("replace", (root, file) -> replaced),
                NamedPass.of(
                    "check",
                    (root, file) -> {
                      assertThat(file).isSameInstanceAs(replaced);
                      ran.add("check");
                      return file;
                    })));

    assertThat(pipeline.run(file(), ImmutableMap.of(), tsLogger)).isSameInstanceAs(replaced);
    assertThat(ran).containsExactly("check");
  }

  @Test
  public void testUnresolvedNameIsFatalWhenPedantic() {
    DtsOptions options = new DtsOptions();
    options.setPedantic(true);
    TsParsedFile input = file(var("x", ref("Missing")));

    DtsFatalError e =
        assertThrows(
            DtsFatalError.class,
            () -> TransformationPipeline.create(options).run(input, ImmutableMap.of(), tsLogger));
    assertThat(e).hasMessageThat().contains("Cannot resolve Missing");
  }

  @Test
  public void testUnresolvedNameWarnsOtherwise() {
    TsParsedFile input = file(var("x", ref("Missing")));

    TransformationPipeline.create(new DtsOptions()).run(input, ImmutableMap.of(), tsLogger);

    assertThat(errorManager.getErrorCount()).isEqualTo(0);
    assertThat(errorManager.getWarningCount()).isGreaterThan(0);
  }

  @Test
  public void testNamedPassRequiresName() {
    assertThrows(IllegalStateException.class, () -> NamedPass.of("", (root, file) -> file));
  }
}
