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

/** A reference to a named type, with type arguments: {@code Foo.Bar<A, B>}. */
public record TsTypeRef(Comments comments, TsQIdent name, ImmutableList<TsType> tparams)
    implements TsType {

  public static final TsTypeRef ANY = of(TsQIdent.ANY);
  public static final TsTypeRef BIGINT = of(TsQIdent.BIGINT);
  public static final TsTypeRef BOOLEAN = of(TsQIdent.BOOLEAN);
  public static final TsTypeRef NEVER = of(TsQIdent.NEVER);
  public static final TsTypeRef NULL = of(TsQIdent.NULL);
  public static final TsTypeRef NUMBER = of(TsQIdent.NUMBER);
  public static final TsTypeRef OBJECT = of(TsQIdent.OBJECT);
  public static final TsTypeRef STRING = of(TsQIdent.STRING);
  public static final TsTypeRef SYMBOL = of(TsQIdent.SYMBOL);
  public static final TsTypeRef UNDEFINED = of(TsQIdent.UNDEFINED);
  public static final TsTypeRef UNKNOWN = of(TsQIdent.UNKNOWN);
  public static final TsTypeRef VOID = of(TsQIdent.VOID);
  public static final TsTypeRef FUNCTION = of(TsQIdent.FUNCTION);

  public static TsTypeRef of(TsQIdent name) {
    return new TsTypeRef(Comments.EMPTY, name, ImmutableList.of());
  }

  public static TsTypeRef of(TsIdent name) {
    return of(TsQIdent.of(name));
  }

  public static TsTypeRef of(TsQIdent name, ImmutableList<TsType> tparams) {
    return new TsTypeRef(Comments.EMPTY, name, tparams);
  }

  public TsTypeRef withName(TsQIdent name) {
    return new TsTypeRef(comments, name, tparams);
  }

  public TsTypeRef withTParams(ImmutableList<TsType> tparams) {
    return new TsTypeRef(comments, name, tparams);
  }

  public TsTypeRef withComments(Comments comments) {
    return new TsTypeRef(comments, name, tparams);
  }
}
