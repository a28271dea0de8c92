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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** {@code A & B & C} */
public record TsTypeIntersect(ImmutableList<TsType> types) implements TsType {

  /**
   * Builds an intersection with nested intersections flattened, all plain object types merged
   * into the first one, and duplicates removed. No operands gives {@code never}, a single operand
   * is returned as is.
   */
  public static TsType simplified(ImmutableList<TsType> types) {
    List<TsType> flat = new ArrayList<>();
    flatten(types, flat);

    List<TsTypeObject> objects = new ArrayList<>();
    for (TsType t : flat) {
      if (t instanceof TsTypeObject o && !o.isTypeMapping()) {
        objects.add(o);
      }
    }

    Set<TsType> result = new LinkedHashSet<>();
    boolean objectsAdded = false;
    for (TsType t : flat) {
      if (t instanceof TsTypeObject o && !o.isTypeMapping()) {
        if (!objectsAdded) {
          result.add(objects.size() == 1 ? o : merge(objects));
          objectsAdded = true;
        }
      } else {
        result.add(t);
      }
    }

    switch (result.size()) {
      case 0:
        return TsTypeRef.NEVER;
      case 1:
        return result.iterator().next();
      default:
        return new TsTypeIntersect(ImmutableList.copyOf(result));
    }
  }

  private static TsTypeObject merge(List<TsTypeObject> objects) {
    Comments comments = Comments.EMPTY;
    ImmutableList.Builder<TsMember> members = ImmutableList.builder();
    for (TsTypeObject o : objects) {
      comments = comments.addAll(o.comments());
      members.addAll(o.members());
    }
    return new TsTypeObject(comments, members.build());
  }

  private static void flatten(ImmutableList<TsType> types, List<TsType> out) {
    for (TsType type : types) {
      if (type instanceof TsTypeIntersect intersect) {
        flatten(intersect.types(), out);
      } else {
        out.add(type);
      }
    }
  }
}
