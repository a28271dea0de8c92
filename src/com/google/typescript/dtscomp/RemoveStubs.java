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

import com.google.common.collect.ImmutableList;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsGlobal;
import com.google.typescript.dts.tree.TsIdentLibrary;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsQIdent;

/**
 * Removes empty top level interfaces which only exist to stand in for a type of the same name in
 * {@code std} or {@code node}.
 */
public final class RemoveStubs extends TreeTransformationScopedChanges {
  public static final RemoveStubs INSTANCE = new RemoveStubs();

  private RemoveStubs() {}

  @Override
  protected TsParsedFile enterTsParsedFile(TsTreeScope scope, TsParsedFile x) {
    ImmutableList<TsContainerOrDecl> members = clean(scope, x.members());
    return members.size() == x.members().size() ? x : x.withMembers(members);
  }

  @Override
  protected TsGlobal enterTsGlobal(TsTreeScope scope, TsGlobal x) {
    ImmutableList<TsContainerOrDecl> members = clean(scope, x.members());
    return members.size() == x.members().size() ? x : x.withMembers(members);
  }

  private static ImmutableList<TsContainerOrDecl> clean(
      TsTreeScope scope, ImmutableList<TsContainerOrDecl> members) {
    ImmutableList.Builder<TsContainerOrDecl> result = ImmutableList.builder();
    for (TsContainerOrDecl member : members) {
      if (!(member instanceof TsDeclInterface iface && isStub(scope, iface))) {
        result.add(member);
      }
    }
    return result.build();
  }

  static boolean isStub(TsTreeScope scope, TsDeclInterface iface) {
    if (!iface.members().isEmpty() || !iface.inheritance().isEmpty()) {
      return false;
    }
    TsTreeScope.Root root = scope.root();
    return !root.lookupType(TsQIdent.of(TsIdentLibrary.STD, iface.name()), true).isEmpty()
        || !root.lookupType(TsQIdent.of(TsIdentLibrary.NODE, iface.name()), true).isEmpty();
  }
}
