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
import static com.google.typescript.dtscomp.TsTrees.fileIn;
import static com.google.typescript.dtscomp.TsTrees.iface;
import static com.google.typescript.dtscomp.TsTrees.ifaceAt;
import static com.google.typescript.dtscomp.TsTrees.ns;
import static com.google.typescript.dtscomp.TsTrees.path;
import static com.google.typescript.dtscomp.TsTrees.ref;
import static com.google.typescript.dtscomp.TsTrees.root;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.typescript.dts.tree.CodePath;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentLibrary;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsTypeRef;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RemoveStubsTest {
  private static final ImmutableMap<TsIdentLibrary, TsParsedFile> DEPS =
      ImmutableMap.of(
          TsIdentLibrary.STD,
          fileIn(
              TsIdentLibrary.STD,
              ifaceAt(
                  CodePath.ofLibrary(TsIdentLibrary.STD).add(TsIdent.simple("Event")),
                  "Event",
                  ImmutableList.of(),
                  TsMemberProperty.of("type", TsTypeRef.STRING))));

  private static TsParsedFile removeStubs(TsParsedFile file) {
    return RemoveStubs.INSTANCE.visitTsParsedFile(
        root(new BasicErrorManager(), false, DEPS), file);
  }

  @Test
  public void testEmptyStdNameIsRemoved() {
    TsParsedFile result = removeStubs(file(iface("Event"), iface("Kept")));
    assertThat(result.members()).containsExactly(iface("Kept"));
  }

  @Test
  public void testStdNameWithMemberIsKept() {
    TsParsedFile file = file(iface("Event", TsMemberProperty.of("x", TsTypeRef.NUMBER)));
    assertThat(removeStubs(file)).isSameInstanceAs(file);
  }

  @Test
  public void testStdNameWithInheritanceIsKept() {
    TsDeclInterface event = ifaceAt(path("Event"), "Event", ImmutableList.of(ref("Base")));
    TsParsedFile file = file(iface("Base"), event);
    assertThat(removeStubs(file)).isSameInstanceAs(file);
  }

  @Test
  public void testEmptyOtherNameIsKept() {
    TsParsedFile file = file(iface("NotInStd"));
    assertThat(removeStubs(file)).isSameInstanceAs(file);
  }

  @Test
  public void testNamespacesAreNotSearched() {
    TsParsedFile file =
        file(ns("N", ifaceAt(path("N", "Event"), "Event", ImmutableList.of())));
    assertThat(removeStubs(file)).isSameInstanceAs(file);
  }
}
