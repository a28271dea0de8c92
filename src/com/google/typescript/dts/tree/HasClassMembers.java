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

package com.google.typescript.dts.tree;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

/** Classes, interfaces and object types. */
public interface HasClassMembers {

  ImmutableList<TsMember> members();

  HasClassMembers withMembers(ImmutableList<TsMember> members);

  /**
   * Members grouped by name. Call signatures are keyed by {@link TsIdent#APPLY}, construct
   * signatures by {@link TsIdent#CONSTRUCTOR}. Index signatures and mapped members are left out.
   */
  default ImmutableListMultimap<TsIdentSimple, TsMember> membersByName() {
    ImmutableListMultimap.Builder<TsIdentSimple, TsMember> builder =
        ImmutableListMultimap.builder();
    for (TsMember member : members()) {
      TsIdentSimple name = TsMember.nameOf(member);
      if (name != null) {
        builder.put(name, member);
      }
    }
    return builder.build();
  }
}
