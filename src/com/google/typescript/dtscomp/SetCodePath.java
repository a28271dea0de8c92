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
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsExport;
import com.google.typescript.dts.tree.TsNamedDecl;

/** Re-roots declarations, and everything nested in them, under a new owner path. */
final class SetCodePath {
  private SetCodePath() {}

  static TsNamedDecl apply(TsNamedDecl x, CodePath.HasPath owner) {
    CodePath.HasPath codePath = owner.add(x.name());
    TsNamedDecl result = codePath.equals(x.codePath()) ? x : x.withCodePath(codePath);
    if (result instanceof TsDeclNamespace ns) {
      ImmutableList<TsContainerOrDecl> members =
          TreeTransformation.mapSame(ns.members(), m -> member(m, codePath));
      return members == ns.members() ? ns : ns.withMembers(members);
    }
    return result;
  }

  static TsContainerOrDecl member(TsContainerOrDecl x, CodePath.HasPath owner) {
    if (x instanceof TsNamedDecl named) {
      return apply(named, owner);
    } else if (x instanceof TsExport export
        && export.exported() instanceof TsExport.Tree tree
        && tree.decl() instanceof TsNamedDecl named) {
      TsNamedDecl updated = apply(named, owner);
      if (updated == named) {
        return export;
      }
      return new TsExport(
          export.comments(), export.typeOnly(), export.tpe(), new TsExport.Tree(updated));
    }
    return x;
  }
}
