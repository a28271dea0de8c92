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
import com.google.typescript.dts.tree.TsAugmentedModule;
import com.google.typescript.dts.tree.TsContainer;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclModule;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsGlobal;
import com.google.typescript.dts.tree.TsParsedFile;

/**
 * Rewrites the member list of every container as a whole, before its members are visited. The
 * scope passed to {@link #newMembers} is already inside the container.
 */
public abstract class TransformMembers extends TreeTransformationScopedChanges {

  protected abstract ImmutableList<TsContainerOrDecl> newMembers(
      TsTreeScope scope, TsContainer container);

  private ImmutableList<TsContainerOrDecl> apply(TsTreeScope scope, TsContainer x) {
    ImmutableList<TsContainerOrDecl> members = newMembers(scope, x);
    return members.equals(x.members()) ? x.members() : members;
  }

  @Override
  protected TsParsedFile enterTsParsedFile(TsTreeScope scope, TsParsedFile x) {
    ImmutableList<TsContainerOrDecl> members = apply(scope, x);
    return members == x.members() ? x : x.withMembers(members);
  }

  @Override
  protected TsDeclNamespace enterTsDeclNamespace(TsTreeScope scope, TsDeclNamespace x) {
    ImmutableList<TsContainerOrDecl> members = apply(scope, x);
    return members == x.members() ? x : x.withMembers(members);
  }

  @Override
  protected TsDeclModule enterTsDeclModule(TsTreeScope scope, TsDeclModule x) {
    ImmutableList<TsContainerOrDecl> members = apply(scope, x);
    return members == x.members() ? x : x.withMembers(members);
  }

  @Override
  protected TsAugmentedModule enterTsAugmentedModule(TsTreeScope scope, TsAugmentedModule x) {
    ImmutableList<TsContainerOrDecl> members = apply(scope, x);
    return members == x.members() ? x : x.withMembers(members);
  }

  @Override
  protected TsGlobal enterTsGlobal(TsTreeScope scope, TsGlobal x) {
    ImmutableList<TsContainerOrDecl> members = apply(scope, x);
    return members == x.members() ? x : x.withMembers(members);
  }
}
