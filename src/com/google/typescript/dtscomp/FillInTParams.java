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
import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsFunSig;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeParam;
import com.google.typescript.dts.tree.TsTypeRef;
import org.jspecify.annotations.Nullable;

/**
 * Instantiates a generic declaration: every reference to one of its type parameters is replaced
 * by the corresponding provided type argument, and the type parameters are dropped.
 *
 * <p>Missing arguments fall back to the declared default, or to {@code any} with a warning comment
 * when there is none.
 */
public final class FillInTParams {
  private FillInTParams() {}

  public static TsDeclInterface apply(TsDeclInterface x, ImmutableList<TsType> provided) {
    ImmutableMap<TsType, TsType> replacements = rewriter(x.tparams(), provided);
    if (replacements == null) {
      return x;
    }
    return new TypeRewriter(x)
        .visitTsDeclInterface(replacements, x)
        .withTParams(ImmutableList.of());
  }

  public static TsDeclClass apply(TsDeclClass x, ImmutableList<TsType> provided) {
    ImmutableMap<TsType, TsType> replacements = rewriter(x.tparams(), provided);
    if (replacements == null) {
      return x;
    }
    TsDeclClass rewritten = new TypeRewriter(x).visitTsDeclClass(replacements, x);
    return new TsDeclClass(
        rewritten.comments(),
        rewritten.declared(),
        rewritten.isAbstract(),
        rewritten.name(),
        ImmutableList.of(),
        rewritten.parent(),
        rewritten.implementsInterfaces(),
        rewritten.members(),
        rewritten.jsLocation(),
        rewritten.codePath());
  }

  public static TsDeclTypeAlias apply(TsDeclTypeAlias x, ImmutableList<TsType> provided) {
    ImmutableMap<TsType, TsType> replacements = rewriter(x.tparams(), provided);
    if (replacements == null) {
      return x;
    }
    return new TypeRewriter(x)
        .visitTsDeclTypeAlias(replacements, x)
        .withTParams(ImmutableList.of());
  }

  public static TsFunSig apply(TsFunSig x, ImmutableList<TsType> provided) {
    ImmutableMap<TsType, TsType> replacements = rewriter(x.tparams(), provided);
    if (replacements == null) {
      return x;
    }
    return new TypeRewriter(x).visitTsFunSig(replacements, x).withTParams(ImmutableList.of());
  }

  /** Returns null when {@code expected} is empty and there is nothing to substitute. */
  private static @Nullable ImmutableMap<TsType, TsType> rewriter(
      ImmutableList<TsTypeParam> expected, ImmutableList<TsType> provided) {
    if (expected.isEmpty()) {
      return null;
    }
    ImmutableMap.Builder<TsType, TsType> builder = ImmutableMap.builder();
    for (int i = 0; i < expected.size(); i++) {
      TsTypeParam tparam = expected.get(i);
      TsType replacement;
      if (i < provided.size()) {
        replacement = provided.get(i);
      } else if (tparam.defaultType() != null) {
        replacement = tparam.defaultType();
      } else {
        replacement =
            TsTypeRef.ANY.withComments(
                Comments.of(Comment.warning(tparam.name().value() + " not provided")));
      }
      builder.put(TsTypeRef.of(tparam.name()), replacement);
    }
    return builder.buildKeepingLast();
  }
}
