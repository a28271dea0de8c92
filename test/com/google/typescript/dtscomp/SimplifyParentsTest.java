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
import static com.google.typescript.dtscomp.TsTrees.path;
import static com.google.typescript.dtscomp.TsTrees.ref;
import static com.google.typescript.dtscomp.TsTrees.run;
import static com.google.typescript.dtscomp.TsTrees.var;

import com.google.common.collect.ImmutableList;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsTypeObject;
import com.google.typescript.dts.tree.TsTypeQuery;
import com.google.typescript.dts.tree.TsTypeRef;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SimplifyParentsTest {
  private static TsDeclClass child(TsParsedFile result) {
    return (TsDeclClass) result.members().get(result.members().size() - 1);
  }

  @Test
  public void testParentVarOfInterfaceType() {
    TsParsedFile result =
        run(
            SimplifyParents.INSTANCE,
            file(iface("BaseCtor"), var("Base", ref("BaseCtor")), cls("C", ref("Base"))));
    assertThat(child(result).parent()).isEqualTo(TsTypeRef.of(path("BaseCtor").codePath()));
  }

  @Test
  public void testParentVarOfClassQuery() {
    TsParsedFile result =
        run(
            SimplifyParents.INSTANCE,
            file(
                cls("Real", null),
                var("Base", new TsTypeQuery(TsQIdent.ofStrings("Real"))),
                cls("C", ref("Base"))));
    assertThat(child(result).parent()).isEqualTo(TsTypeRef.of(path("Real").codePath()));
  }

  @Test
  public void testComplicatedParentIsDropped() {
    TsTypeObject obj =
        new TsTypeObject(
            Comments.EMPTY, ImmutableList.of(TsMemberProperty.of("a", TsTypeRef.STRING)));
    TsParsedFile result =
        run(SimplifyParents.INSTANCE, file(var("Base", obj), cls("C", ref("Base"))));
    assertThat(child(result).parent()).isNull();
    assertThat(child(result).implementsInterfaces()).isEmpty();
  }

  @Test
  public void testRealParentIsKept() {
    TsParsedFile file = file(cls("Base", null), cls("C", ref("Base")));
    assertThat(run(SimplifyParents.INSTANCE, file)).isSameInstanceAs(file);
  }
}
