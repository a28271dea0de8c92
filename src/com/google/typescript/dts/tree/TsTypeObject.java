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

/** A structural type: {@code { a: string; (x: number): void }}. */
public record TsTypeObject(Comments comments, ImmutableList<TsMember> members)
    implements TsType, HasClassMembers {

  @Override
  public TsTypeObject withMembers(ImmutableList<TsMember> members) {
    return new TsTypeObject(comments, members);
  }

  /** Whether this is a mapped type, {@code { [K in keyof T]: U }}. */
  public boolean isTypeMapping() {
    return members.size() == 1 && members.get(0) instanceof TsMemberTypeMapped;
  }
}
