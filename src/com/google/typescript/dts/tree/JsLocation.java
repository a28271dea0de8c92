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

/** Where a declaration can be found at runtime. */
public sealed interface JsLocation permits JsLocation.Zero, JsLocation.Global, JsLocation.Module {

  JsLocation ZERO = new Zero();

  JsLocation add(TsIdent ident);

  /** Unknown or not applicable. */
  record Zero() implements JsLocation {
    @Override
    public JsLocation add(TsIdent ident) {
      return this;
    }
  }

  /** Reachable through the global object. */
  record Global(TsQIdent qname) implements JsLocation {
    @Override
    public JsLocation add(TsIdent ident) {
      if (ident.equals(TsIdent.NAMESPACED)) {
        return this;
      }
      return new Global(qname.plus(ident));
    }
  }

  /** Exported from a module, at {@code path} within it. */
  record Module(TsIdentModule module, ImmutableList<TsIdent> path) implements JsLocation {
    @Override
    public JsLocation add(TsIdent ident) {
      if (ident.equals(TsIdent.NAMESPACED)) {
        return this;
      }
      return new Module(module, ImmutableList.<TsIdent>builder().addAll(path).add(ident).build());
    }
  }
}
