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

import org.jspecify.annotations.Nullable;

/** {@code static readonly foo: T = expr} */
public record TsMemberProperty(
    Comments comments,
    TsProtectionLevel level,
    TsIdentSimple name,
    @Nullable TsType tpe,
    @Nullable TsExpr expr,
    boolean isStatic,
    boolean isReadOnly)
    implements TsMember {

  public static TsMemberProperty of(String name, TsType tpe) {
    return new TsMemberProperty(
        Comments.EMPTY, TsProtectionLevel.DEFAULT, TsIdent.simple(name), tpe, null, false, false);
  }

  public TsMemberProperty withType(@Nullable TsType tpe) {
    return new TsMemberProperty(comments, level, name, tpe, expr, isStatic, isReadOnly);
  }

  public TsMemberProperty withComments(Comments comments) {
    return new TsMemberProperty(comments, level, name, tpe, expr, isStatic, isReadOnly);
  }

  public TsMemberProperty withStatic(boolean isStatic) {
    return new TsMemberProperty(comments, level, name, tpe, expr, isStatic, isReadOnly);
  }
}
