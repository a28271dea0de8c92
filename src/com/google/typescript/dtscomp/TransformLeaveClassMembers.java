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
import com.google.typescript.dts.tree.HasClassMembers;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsTypeObject;

/**
 * Rewrites the member list of every class, interface and object type as a whole, after the
 * members were visited.
 */
public abstract class TransformLeaveClassMembers extends TreeTransformationScopedChanges {

  protected abstract ImmutableList<TsMember> newClassMembers(
      TsTreeScope scope, HasClassMembers x);

  private ImmutableList<TsMember> apply(TsTreeScope scope, HasClassMembers x) {
    ImmutableList<TsMember> members = newClassMembers(scope, x);
    return members.equals(x.members()) ? x.members() : members;
  }

  @Override
  protected TsDeclClass leaveTsDeclClass(TsTreeScope scope, TsDeclClass x) {
    ImmutableList<TsMember> members = apply(scope, x);
    return members == x.members() ? x : x.withMembers(members);
  }

  @Override
  protected TsDeclInterface leaveTsDeclInterface(TsTreeScope scope, TsDeclInterface x) {
    ImmutableList<TsMember> members = apply(scope, x);
    return members == x.members() ? x : x.withMembers(members);
  }

  @Override
  protected TsTypeObject leaveTsTypeObject(TsTreeScope scope, TsTypeObject x) {
    ImmutableList<TsMember> members = apply(scope, x);
    return members == x.members() ? x : x.withMembers(members);
  }
}
