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
import com.google.typescript.dts.tree.CodePath;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.JsLocation;
import com.google.typescript.dts.tree.TsAugmentedModule;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclModule;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentSimple;
import com.google.typescript.dts.tree.TsNamedValueDecl;
import com.google.typescript.dts.tree.TsParsedFile;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves the value side of top-level declarations into the {@code <global>} namespace, leaving
 * only their type side at the top level.
 */
public final class MoveGlobals {
  private MoveGlobals() {}

  public static TsParsedFile apply(TsParsedFile file) {
    List<TsDeclNamespace> globals = new ArrayList<>();
    List<TsContainerOrDecl> modules = new ArrayList<>();
    List<TsNamedValueDecl> named = new ArrayList<>();
    List<TsContainerOrDecl> rest = new ArrayList<>();
    for (TsContainerOrDecl member : file.members()) {
      if (member instanceof TsDeclNamespace ns && ns.name().equals(TsIdent.GLOBAL)) {
        globals.add(ns);
      } else if (member instanceof TsDeclModule || member instanceof TsAugmentedModule) {
        modules.add(member);
      } else if (member instanceof TsNamedValueDecl value) {
        named.add(value);
      } else {
        rest.add(member);
      }
    }

    CodePath.HasPath globalCp = file.codePath().forceHasPath().add(TsIdent.GLOBAL);
    ImmutableList.Builder<TsContainerOrDecl> keepToplevel = ImmutableList.builder();
    ImmutableList.Builder<TsContainerOrDecl> globalMembers = ImmutableList.builder();
    for (TsNamedValueDecl x : named) {
      TsContainerOrDecl kept = KeepTypesOnly.apply(x);
      if (kept != null) {
        keepToplevel.add(kept);
      }
      globalMembers.addAll(DeriveCopy.apply(x, globalCp, null));
    }
    ImmutableList<TsContainerOrDecl> moved = globalMembers.build();
    if (moved.isEmpty()) {
      return file;
    }

    TsDeclNamespace global =
        new TsDeclNamespace(
            Comments.EMPTY, false, TsIdent.GLOBAL, moved, globalCp, JsLocation.ZERO);
    for (TsDeclNamespace existing : globals) {
      global = merge(global, existing);
    }

    return file.withMembers(
        ImmutableList.<TsContainerOrDecl>builder()
            .addAll(modules)
            .addAll(rest)
            .addAll(keepToplevel.build())
            .add(global)
            .build());
  }

  /** Combines two namespaces of the same name. Nested namespaces of the same name merge too. */
  static TsDeclNamespace merge(TsDeclNamespace one, TsDeclNamespace two) {
    return new TsDeclNamespace(
        one.comments().addAll(two.comments()),
        one.declared() || two.declared(),
        one.name(),
        mergeMembers(one.members(), two.members()),
        one.codePath(),
        one.jsLocation());
  }

  private static ImmutableList<TsContainerOrDecl> mergeMembers(
      ImmutableList<TsContainerOrDecl> one, ImmutableList<TsContainerOrDecl> two) {
    List<TsContainerOrDecl> result = new ArrayList<>(one);
    Map<TsIdentSimple, Integer> namespaceIndex = new HashMap<>();
    for (int i = 0; i < result.size(); i++) {
      if (result.get(i) instanceof TsDeclNamespace ns) {
        namespaceIndex.putIfAbsent(ns.name(), i);
      }
    }
    for (TsContainerOrDecl member : two) {
      if (member instanceof TsDeclNamespace ns && namespaceIndex.containsKey(ns.name())) {
        int index = namespaceIndex.get(ns.name());
        result.set(index, merge((TsDeclNamespace) result.get(index), ns));
      } else {
        if (member instanceof TsDeclNamespace ns) {
          namespaceIndex.put(ns.name(), result.size());
        }
        result.add(member);
      }
    }
    return ImmutableList.copyOf(result);
  }
}
