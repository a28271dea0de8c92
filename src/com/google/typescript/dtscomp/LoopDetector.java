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
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsTypeRef;
import org.jspecify.annotations.Nullable;

/**
 * The resolution steps taken so far along one chain of recursive lookups. A chain that would
 * revisit a step is a cycle.
 *
 * <p>A fresh {@link #INITIAL} detector starts every top-level lookup; detectors are never kept
 * across unrelated lookups.
 */
@CheckReturnValue
public final class LoopDetector {
  public static final LoopDetector INITIAL = new LoopDetector(null, null, 0);

  private final @Nullable Object entry;
  private final @Nullable LoopDetector previous;
  private final int depth;

  private LoopDetector(@Nullable Object entry, @Nullable LoopDetector previous, int depth) {
    this.entry = entry;
    this.previous = previous;
    this.depth = depth;
  }

  /** Adds a lookup of {@code wanted} from {@code scope}, or returns null if it was seen before. */
  public @Nullable LoopDetector including(ImmutableList<TsIdent> wanted, TsTreeScope scope) {
    return including(new IdentsEntry(wanted, scope));
  }

  /** Adds a resolution of {@code ref} from {@code scope}, or returns null if it was seen before. */
  public @Nullable LoopDetector including(TsTypeRef ref, TsTreeScope scope) {
    return including(new RefEntry(ref, scope));
  }

  private @Nullable LoopDetector including(Object next) {
    for (LoopDetector ld = this; ld.entry != null; ld = ld.previous) {
      if (ld.entry.equals(next)) {
        return null;
      }
    }
    return new LoopDetector(next, this, depth + 1);
  }

  int depth() {
    return depth;
  }

  private record IdentsEntry(ImmutableList<TsIdent> idents, TsTreeScope scope) {}

  private record RefEntry(TsTypeRef ref, TsTreeScope scope) {}
}
