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
import com.google.errorprone.annotations.Immutable;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/** An ordered, append-only bag of {@link Comment}s. */
@Immutable
public final class Comments {
  public static final Comments EMPTY = new Comments(ImmutableList.of());

  @SuppressWarnings("Immutable") // Comment implementations are all records or enums.
  private final ImmutableList<Comment> cs;

  private Comments(ImmutableList<Comment> cs) {
    this.cs = cs;
  }

  public static Comments of(Comment... cs) {
    return cs.length == 0 ? EMPTY : new Comments(ImmutableList.copyOf(Arrays.asList(cs)));
  }

  public static Comments of(Iterable<? extends Comment> cs) {
    ImmutableList<Comment> list = ImmutableList.copyOf(cs);
    return list.isEmpty() ? EMPTY : new Comments(list);
  }

  public static Comments marker(Comment.Marker marker) {
    return of(marker);
  }

  public ImmutableList<Comment> asList() {
    return cs;
  }

  public boolean isEmpty() {
    return cs.isEmpty();
  }

  public Comments add(Comment c) {
    return new Comments(ImmutableList.<Comment>builder().addAll(cs).add(c).build());
  }

  public Comments addAll(Comments other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    return new Comments(ImmutableList.<Comment>builder().addAll(cs).addAll(other.cs).build());
  }

  public boolean has(Comment.Marker marker) {
    return cs.contains(marker);
  }

  /** Returns the first {@link Comment.NameHint}, or null. */
  public Comment.@Nullable NameHint nameHint() {
    for (Comment c : cs) {
      if (c instanceof Comment.NameHint hint) {
        return hint;
      }
    }
    return null;
  }

  /** Returns the raw comments only, dropping markers. */
  public ImmutableList<Comment.Raw> raw() {
    ImmutableList.Builder<Comment.Raw> builder = ImmutableList.builder();
    for (Comment c : cs) {
      if (c instanceof Comment.Raw r) {
        builder.add(r);
      }
    }
    return builder.build();
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof Comments that && cs.equals(that.cs);
  }

  @Override
  public int hashCode() {
    return cs.hashCode();
  }

  @Override
  public String toString() {
    return "Comments" + cs;
  }
}
