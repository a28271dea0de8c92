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
import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclEnum;
import com.google.typescript.dts.tree.TsDeclFunction;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsGlobal;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentSimple;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberCtor;
import com.google.typescript.dts.tree.TsMemberFunction;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsTypeParam;
import com.google.typescript.dts.tree.TsTypeRef;
import org.jspecify.annotations.Nullable;

/**
 * Makes a copy of a declaration that lives under another code path and refers back to the
 * original: a class copy extends the original, an interface copy is an alias of it, and an enum
 * copy records where it was exported from.
 */
public final class DeriveCopy {
  private DeriveCopy() {}

  /**
   * Copies {@code x} into the container at {@code ownerCp}, optionally renamed. A declaration
   * already directly inside {@code ownerCp} is returned as is when not renamed.
   */
  public static ImmutableList<TsNamedDecl> apply(
      TsNamedDecl x, CodePath ownerCp, @Nullable TsIdentSimple rename) {
    if (rename != null && rename.equals(x.name())) {
      rename = null;
    }
    if (rename == null
        && x.codePath() instanceof CodePath.HasPath xPath
        && ownerCp instanceof CodePath.HasPath owner
        && isDirectChild(xPath, owner)) {
      return ImmutableList.of(x);
    }
    TsIdentSimple name = rename == null ? x.name() : rename;
    CodePath codePath = ownerCp instanceof CodePath.HasPath owner ? owner.add(name) : x.codePath();

    if (x instanceof TsDeclNamespace ns) {
      ImmutableList.Builder<TsContainerOrDecl> members = ImmutableList.builder();
      for (TsContainerOrDecl member : ns.members()) {
        members.addAll(copyMember(member, codePath));
      }
      return ImmutableList.of(
          ns.withMembers(members.build()).withName(name).withCodePath(codePath));
    } else if (x instanceof TsDeclClass cls) {
      if (cls.comments().has(Comment.SimpleMarker.EXPANDED_CLASS)) {
        return ImmutableList.of();
      }
      ImmutableList.Builder<TsMember> statics = ImmutableList.builder();
      for (TsMember member : cls.members()) {
        if (isStaticOrCtor(member)) {
          statics.add(member);
        }
      }
      return ImmutableList.of(
          new TsDeclClass(
              cls.comments(),
              true,
              cls.isAbstract(),
              name,
              cls.tparams(),
              originRef(cls, cls.tparams()),
              ImmutableList.of(),
              statics.build(),
              cls.jsLocation(),
              codePath));
    } else if (x instanceof TsDeclInterface iface) {
      return ImmutableList.of(
          new TsDeclTypeAlias(
              iface.comments(),
              iface.declared(),
              name,
              iface.tparams(),
              originRef(iface, iface.tparams()),
              codePath));
    } else if (x instanceof TsDeclEnum e) {
      TsTypeRef exportedFrom =
          e.exportedFrom() != null ? e.exportedFrom() : originRef(e, ImmutableList.of());
      return ImmutableList.of(
          e.withExportedFrom(exportedFrom).withName(name).withCodePath(codePath));
    } else if (x instanceof TsDeclFunction || x instanceof TsDeclVar
        || x instanceof TsDeclTypeAlias) {
      return ImmutableList.of(x.withName(name).withCodePath(codePath));
    }
    return ImmutableList.of();
  }

  private static ImmutableList<? extends TsContainerOrDecl> copyMember(
      TsContainerOrDecl member, CodePath ownerCp) {
    if (member instanceof TsNamedDecl named) {
      return apply(named, ownerCp, null);
    } else if (member instanceof TsGlobal global) {
      ImmutableList.Builder<TsContainerOrDecl> members = ImmutableList.builder();
      for (TsContainerOrDecl m : global.members()) {
        members.addAll(copyMember(m, ownerCp));
      }
      return ImmutableList.of(global.withMembers(members.build()));
    }
    return ImmutableList.of(member);
  }

  private static TsTypeRef originRef(TsNamedDecl x, ImmutableList<TsTypeParam> tparams) {
    TsQIdent origin = x.codePath().forceHasPath().codePath();
    return new TsTypeRef(Comments.EMPTY, origin, TsTypeParam.asTypeArgs(tparams));
  }

  private static boolean isDirectChild(CodePath.HasPath x, CodePath.HasPath owner) {
    TsQIdent path = x.codePath();
    TsQIdent ownerPath = owner.codePath();
    return path.size() == ownerPath.size() + 1 && path.startsWith(ownerPath);
  }

  private static boolean isStaticOrCtor(TsMember member) {
    if (member instanceof TsMemberCtor) {
      return true;
    } else if (member instanceof TsMemberFunction fn) {
      return fn.isStatic() || fn.name().equals(TsIdent.CONSTRUCTOR);
    } else if (member instanceof TsMemberProperty prop) {
      return prop.isStatic();
    }
    return false;
  }
}
