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

/** A node holding declarations: files, namespaces, modules and global blocks. */
public sealed interface TsContainer extends TsContainerOrDecl
    permits TsParsedFile, TsDeclNamespace, TsDeclModule, TsAugmentedModule, TsGlobal {

  ImmutableList<TsContainerOrDecl> members();

  CodePath codePath();

  TsContainer withMembers(ImmutableList<TsContainerOrDecl> members);

  /** The direct named members, grouped by name in order of first appearance. */
  default ImmutableListMultimap<TsIdentSimple, TsNamedDecl> membersByName() {
    ImmutableListMultimap.Builder<TsIdentSimple, TsNamedDecl> builder =
        ImmutableListMultimap.builder();
    for (TsContainerOrDecl member : members()) {
      if (member instanceof TsNamedDecl named) {
        builder.put(named.name(), named);
      }
    }
    return builder.build();
  }

  /** The members which are not named declarations, in order. */
  default ImmutableList<TsContainerOrDecl> unnamed() {
    ImmutableList.Builder<TsContainerOrDecl> builder = ImmutableList.builder();
    for (TsContainerOrDecl member : members()) {
      if (!(member instanceof TsNamedDecl)) {
        builder.add(member);
      }
    }
    return builder.build();
  }

  /** Named declarations visible to lookups: direct members and those wrapped in exports. */
  default ImmutableListMultimap<TsIdentSimple, TsNamedDecl> lookupIndex() {
    ImmutableListMultimap.Builder<TsIdentSimple, TsNamedDecl> builder =
        ImmutableListMultimap.builder();
    for (TsContainerOrDecl member : members()) {
      if (member instanceof TsNamedDecl named) {
        builder.put(named.name(), named);
      } else if (member instanceof TsExport export
          && export.exported() instanceof TsExport.Tree tree
          && tree.decl() instanceof TsNamedDecl named) {
        builder.put(named.name(), named);
      }
    }
    return builder.build();
  }

  default ImmutableList<TsDeclModule> modules() {
    ImmutableList.Builder<TsDeclModule> builder = ImmutableList.builder();
    for (TsContainerOrDecl member : members()) {
      if (member instanceof TsDeclModule module) {
        builder.add(module);
      }
    }
    return builder.build();
  }

  default ImmutableList<TsAugmentedModule> augmentedModules() {
    ImmutableList.Builder<TsAugmentedModule> builder = ImmutableList.builder();
    for (TsContainerOrDecl member : members()) {
      if (member instanceof TsAugmentedModule module) {
        builder.add(module);
      }
    }
    return builder.build();
  }
}
