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
import com.google.typescript.dts.tree.HasClassMembers;
import com.google.typescript.dts.tree.TsContainer;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclFunction;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsTypeRef;

/**
 * Drops declarations which cannot be expressed downstream: {@code __promisify__} helpers in
 * containers, and {@code prototype}, unicode-escaped or {@code never}-typed properties in classes
 * and object types.
 */
public final class DropProperties {
  static final String PROMISIFY = "__promisify__";

  public static final TreeTransformation<TsTreeScope> INSTANCE =
      new DropContainerMembers().combine(new DropClassMembers());

  private DropProperties() {}

  private static final class DropContainerMembers extends TransformMembers {
    @Override
    protected ImmutableList<TsContainerOrDecl> newMembers(TsTreeScope scope, TsContainer x) {
      ImmutableList.Builder<TsContainerOrDecl> result = ImmutableList.builder();
      for (TsContainerOrDecl member : x.members()) {
        if (!isPromisify(member)) {
          result.add(member);
        }
      }
      return result.build();
    }
  }

  private static final class DropClassMembers extends TransformClassMembers {
    @Override
    protected ImmutableList<TsMember> newClassMembers(TsTreeScope scope, HasClassMembers x) {
      ImmutableList.Builder<TsMember> result = ImmutableList.builder();
      for (TsMember member : x.members()) {
        if (!(member instanceof TsMemberProperty p && isDropped(p))) {
          result.add(member);
        }
      }
      return result.build();
    }
  }

  private static boolean isPromisify(TsContainerOrDecl member) {
    return (member instanceof TsDeclVar
            || member instanceof TsDeclFunction
            || member instanceof TsDeclTypeAlias)
        && ((TsNamedDecl) member).name().value().equals(PROMISIFY);
  }

  private static boolean isDropped(TsMemberProperty p) {
    return p.name().equals(TsIdent.PROTOTYPE)
        || p.name().value().startsWith("\\u")
        || TsTypeRef.NEVER.equals(p.tpe());
  }
}
