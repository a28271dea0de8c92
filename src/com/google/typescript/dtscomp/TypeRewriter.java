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
import com.google.common.collect.ImmutableMap;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsFunSig;
import com.google.typescript.dts.tree.TsTree;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeParam;
import com.google.typescript.dts.tree.TsTypeRef;
import java.util.Map;

/**
 * Replaces types by other types. Declarations nested inside {@code base} which declare a type
 * parameter of the same name as a replaced reference shadow that replacement.
 */
final class TypeRewriter extends TreeTransformation<ImmutableMap<TsType, TsType>> {
  private final TsTree base;

  TypeRewriter(TsTree base) {
    this.base = base;
  }

  @Override
  protected ImmutableMap<TsType, TsType> withTree(
      ImmutableMap<TsType, TsType> replacements, TsTree tree) {
    if (tree == base) {
      return replacements;
    }
    ImmutableList<TsTypeParam> shadowing = tparamsOf(tree);
    if (shadowing.isEmpty()) {
      return replacements;
    }
    ImmutableMap.Builder<TsType, TsType> kept = ImmutableMap.builder();
    for (Map.Entry<TsType, TsType> entry : replacements.entrySet()) {
      if (!isShadowed(entry.getKey(), shadowing)) {
        kept.put(entry);
      }
    }
    return kept.buildOrThrow();
  }

  @Override
  protected TsType leaveTsType(ImmutableMap<TsType, TsType> replacements, TsType x) {
    return replacements.getOrDefault(x, x);
  }

  private static boolean isShadowed(TsType key, ImmutableList<TsTypeParam> tparams) {
    if (!(key instanceof TsTypeRef ref) || ref.name().size() != 1) {
      return false;
    }
    for (TsTypeParam tparam : tparams) {
      if (tparam.name().equals(ref.name().first())) {
        return true;
      }
    }
    return false;
  }

  private static ImmutableList<TsTypeParam> tparamsOf(TsTree tree) {
    if (tree instanceof TsDeclClass c) {
      return c.tparams();
    } else if (tree instanceof TsDeclInterface i) {
      return i.tparams();
    } else if (tree instanceof TsDeclTypeAlias a) {
      return a.tparams();
    } else if (tree instanceof TsFunSig sig) {
      return sig.tparams();
    }
    return ImmutableList.of();
  }
}
