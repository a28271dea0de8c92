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
import com.google.typescript.dts.tree.ExportType;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclModule;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsExport;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsImport;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsTypeRef;
import com.google.typescript.dts.tree.TsTypeThis;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites modules of the shape
 *
 * <pre>
 * declare module "m" {
 *   class Foo {}
 *   namespace Foo { interface X {} }
 *   export = Foo;
 * }
 * </pre>
 *
 * so that the members of {@code namespace Foo} become named exports of the module itself.
 */
public final class HandleCommonJsModules extends TreeTransformationScopedChanges {
  public static final HandleCommonJsModules INSTANCE = new HandleCommonJsModules();

  private HandleCommonJsModules() {}

  @Override
  protected TsDeclModule enterTsDeclModule(TsTreeScope scope, TsDeclModule mod) {
    TsExport exportStatement = null;
    TsQIdent targets = null;
    List<TsContainerOrDecl> notExports = new ArrayList<>();
    for (TsContainerOrDecl member : mod.members()) {
      TsQIdent exported = exportEqualsTarget(member);
      if (exported != null && exportStatement == null) {
        exportStatement = (TsExport) member;
        targets = exported;
      } else if (exported == null) {
        notExports.add(member);
      }
    }
    if (exportStatement == null || targets.size() != 1) {
      return mod;
    }
    TsIdent target = targets.first();

    List<TsDeclNamespace> namespaces = new ArrayList<>();
    List<TsNamedDecl> toplevel = new ArrayList<>();
    List<TsContainerOrDecl> rest = new ArrayList<>();
    for (TsContainerOrDecl member : notExports) {
      if (member instanceof TsDeclNamespace ns && ns.name().equals(target)) {
        namespaces.add(ns);
      } else if (member instanceof TsNamedDecl named && named.name().equals(target)) {
        toplevel.add(named);
      } else {
        rest.add(member);
      }
    }
    if (namespaces.isEmpty()) {
      return mod;
    }

    CodePath.HasPath modCp = mod.codePath().forceHasPath();
    ImmutableList.Builder<TsContainerOrDecl> newMembers = ImmutableList.builder();
    for (TsDeclNamespace ns : namespaces) {
      for (TsContainerOrDecl member : ns.members()) {
        if (isRedundantAlias(member, target)) {
          continue;
        }
        if (member instanceof TsNamedDecl named) {
          newMembers.add(
              new TsExport(
                  Comments.EMPTY,
                  false,
                  ExportType.NAMED,
                  new TsExport.Tree(SetCodePath.apply(named, modCp))));
        } else {
          newMembers.add(SetCodePath.member(member, modCp));
        }
      }
    }
    for (TsContainerOrDecl member : rest) {
      if (!isRedundantAlias(member, target)) {
        newMembers.add(member);
      }
    }
    newMembers.addAll(toplevel);
    if (!toplevel.isEmpty()) {
      newMembers.add(exportStatement);
    }

    ImmutableList<TsContainerOrDecl> members =
        TreeTransformation.mapSame(newMembers.build(), m -> rewriteExportImport(mod, m, target));
    return new EraseNamespaceRefs(target).visitTsDeclModule(null, mod.withMembers(members));
  }

  /** The target of {@code export = Target}, or null for any other member. */
  private static @Nullable TsQIdent exportEqualsTarget(TsContainerOrDecl member) {
    if (member instanceof TsExport export
        && export.tpe() == ExportType.NAMESPACED
        && export.exported() instanceof TsExport.Names names
        && names.idents().size() == 1
        && names.fromOpt() == null
        && names.idents().get(0).alias() == null) {
      return names.idents().get(0).qident();
    }
    return null;
  }

  /** {@code type N = Target.N} */
  private static boolean isRedundantAlias(TsContainerOrDecl member, TsIdent target) {
    return member instanceof TsDeclTypeAlias alias
        && alias.tparams().isEmpty()
        && alias.alias() instanceof TsTypeRef ref
        && ref.tparams().isEmpty()
        && ref.name().size() == 2
        && ref.name().first().equals(target)
        && ref.name().last().equals(alias.name());
  }

  /** {@code export import X = Target} becomes a trivial {@code declare const X: this}. */
  private static TsContainerOrDecl rewriteExportImport(
      TsDeclModule mod, TsContainerOrDecl member, TsIdent target) {
    if (member instanceof TsExport export
        && export.tpe() == ExportType.NAMED
        && export.exported() instanceof TsExport.Tree tree
        && tree.decl() instanceof TsImport imp
        && imp.imported().size() == 1
        && imp.imported().get(0) instanceof TsImport.Ident ident
        && imp.from() instanceof TsImport.Local local
        && local.qident().size() == 1
        && local.qident().first().equals(target)) {
      TsDeclVar var =
          new TsDeclVar(
              Comments.marker(Comment.SimpleMarker.IS_TRIVIAL),
              true,
              true,
              ident.ident(),
              new TsTypeThis(),
              null,
              mod.jsLocation().add(ident.ident()),
              mod.codePath().add(ident.ident()));
      return new TsExport(Comments.EMPTY, false, ExportType.NAMED, new TsExport.Tree(var));
    }
    return member;
  }

  /** Strips a leading {@code Target.} from type references. */
  private static final class EraseNamespaceRefs extends TreeTransformationUnit {
    private final TsIdent target;

    EraseNamespaceRefs(TsIdent target) {
      this.target = target;
    }

    @Override
    protected TsTypeRef enterTsTypeRef(@Nullable Void t, TsTypeRef x) {
      ImmutableList<TsIdent> parts = x.name().parts();
      if (parts.size() > 1 && parts.get(0).equals(target)) {
        return x.withName(TsQIdent.of(parts.subList(1, parts.size())));
      }
      return x;
    }
  }
}
