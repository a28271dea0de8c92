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
import com.google.common.collect.ImmutableListMultimap;
import com.google.typescript.dts.tree.TsContainer;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentSimple;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsTree;
import org.jspecify.annotations.Nullable;

/**
 * Picks a name for a class synthesized inside a container. A name already taken by a type is
 * replaced with a backup name ending in {@code Cls}. Sharing a name with a value is fine.
 */
final class FindAvailableName {
  static final String BACKUP_SUFFIX = "Cls";

  /** A usable name, and whether it is the backup. */
  record Available(TsIdentSimple name, boolean wasBackup) {}

  private final ImmutableListMultimap<TsIdentSimple, TsNamedDecl> index;

  private FindAvailableName(ImmutableListMultimap<TsIdentSimple, TsNamedDecl> index) {
    this.index = index;
  }

  /**
   * Names in {@code x}. Inside a {@code ^} namespace the names of the enclosing container count
   * too.
   */
  static FindAvailableName create(TsContainer x, TsTreeScope scope) {
    ImmutableList<TsTree> stack = scope.stack();
    if (stack.size() >= 2
        && stack.get(0) instanceof TsDeclNamespace ns
        && ns.name().equals(TsIdent.NAMESPACED)
        && stack.get(1) instanceof TsContainer outer) {
      return new FindAvailableName(
          ImmutableListMultimap.<TsIdentSimple, TsNamedDecl>builder()
              .putAll(ns.membersByName())
              .putAll(outer.membersByName())
              .build());
    }
    return new FindAvailableName(x.membersByName());
  }

  @Nullable Available apply(TsIdentSimple potentialName) {
    TsIdentSimple backupName =
        potentialName.equals(TsIdent.NAMESPACED)
            ? TsIdent.simple("namespaced" + BACKUP_SUFFIX)
            : TsIdent.simple(potentialName.value() + BACKUP_SUFFIX);
    if (isAvailable(potentialName)) {
      return new Available(potentialName, false);
    }
    return isAvailable(backupName) ? new Available(backupName, true) : null;
  }

  private boolean isAvailable(TsIdentSimple name) {
    for (TsNamedDecl existing : index.get(name)) {
      if (existing instanceof TsDeclInterface
          || existing instanceof TsDeclClass
          || existing instanceof TsDeclTypeAlias) {
        return false;
      }
    }
    return true;
  }
}
