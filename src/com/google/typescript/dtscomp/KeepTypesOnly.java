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
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclEnum;
import com.google.typescript.dts.tree.TsDeclFunction;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsExport;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberCtor;
import com.google.typescript.dts.tree.TsMemberFunction;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsTypeRef;
import org.jspecify.annotations.Nullable;

/**
 * Projects declarations onto their type side. Vars and functions vanish, classes become
 * interfaces without static members or constructors, and enums lose their value.
 */
public final class KeepTypesOnly {
  private KeepTypesOnly() {}

  /** Returns null if nothing of {@code x} exists at the type level. */
  public static @Nullable TsContainerOrDecl apply(TsContainerOrDecl x) {
    if (x instanceof TsExport export && export.exported() instanceof TsExport.Tree tree) {
      TsContainerOrDecl kept = apply(tree.decl());
      if (kept == null) {
        return null;
      }
      if (kept == tree.decl()) {
        return export;
      }
      return new TsExport(
          export.comments(),
          export.typeOnly(),
          export.tpe(),
          new TsExport.Tree((TsNamedDecl) kept));
    }
    if (x instanceof TsNamedDecl named) {
      return named(named);
    }
    return x;
  }

  public static @Nullable TsNamedDecl named(TsNamedDecl x) {
    if (x instanceof TsDeclVar || x instanceof TsDeclFunction) {
      return null;
    } else if (x instanceof TsDeclClass cls) {
      ImmutableList.Builder<TsMember> nonStatics = ImmutableList.builder();
      for (TsMember member : cls.members()) {
        if (!isStaticOrCtor(member)) {
          nonStatics.add(member);
        }
      }
      ImmutableList.Builder<TsTypeRef> inheritance = ImmutableList.builder();
      if (cls.parent() != null) {
        inheritance.add(cls.parent());
      }
      inheritance.addAll(cls.implementsInterfaces());
      return new TsDeclInterface(
          cls.comments(),
          cls.declared(),
          cls.name(),
          cls.tparams(),
          inheritance.build(),
          nonStatics.build(),
          cls.codePath());
    } else if (x instanceof TsDeclNamespace ns) {
      ImmutableList.Builder<TsContainerOrDecl> members = ImmutableList.builder();
      for (TsContainerOrDecl member : ns.members()) {
        TsContainerOrDecl kept = apply(member);
        if (kept != null) {
          members.add(kept);
        }
      }
      return ns.withMembers(members.build());
    } else if (x instanceof TsDeclEnum e) {
      return e.withIsValue(false);
    }
    return x;
  }

  private static boolean isStaticOrCtor(TsMember member) {
    if (member instanceof TsMemberCtor) {
      return true;
    } else if (member instanceof TsMemberProperty prop) {
      return prop.isStatic();
    } else if (member instanceof TsMemberFunction fn) {
      return fn.isStatic() || fn.name().equals(TsIdent.CONSTRUCTOR);
    }
    return false;
  }
}
