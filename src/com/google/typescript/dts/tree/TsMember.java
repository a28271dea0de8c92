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

/** A member of a class, interface or object type. */
public sealed interface TsMember extends TsTree
    permits TsMemberCall,
        TsMemberCtor,
        TsMemberFunction,
        TsMemberIndex,
        TsMemberTypeMapped,
        TsMemberProperty {

  TsProtectionLevel level();

  /** The name a member is known by, or null for index signatures and mapped members. */
  static @Nullable TsIdentSimple nameOf(TsMember member) {
    if (member instanceof TsMemberProperty p) {
      return p.name();
    } else if (member instanceof TsMemberFunction f) {
      return f.name();
    } else if (member instanceof TsMemberCall) {
      return TsIdent.APPLY;
    } else if (member instanceof TsMemberCtor) {
      return TsIdent.CONSTRUCTOR;
    }
    return null;
  }
}
