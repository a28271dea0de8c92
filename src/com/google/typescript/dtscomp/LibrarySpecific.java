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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.typescript.dts.tree.Comment;
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDecl;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclModule;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentLibrary;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberFunction;
import com.google.typescript.dts.tree.TsMemberIndex;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsProtectionLevel;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeIntersect;
import com.google.typescript.dts.tree.TsTypeParam;
import com.google.typescript.dts.tree.TsTypeRef;
import com.google.typescript.dts.tree.TsTypeUnion;
import org.jspecify.annotations.Nullable;

/** Hand written fixes for declarations of particular libraries which trip up later stages. */
public final class LibrarySpecific {
  private LibrarySpecific() {}

  static final TsIdentLibrary STD = TsIdentLibrary.STD;
  static final TsIdentLibrary REACT = TsIdentLibrary.of("react");
  static final TsIdentLibrary STYLED_COMPONENTS = TsIdentLibrary.of("styled-components");
  static final TsIdentLibrary SEMANTIC_UI_REACT = TsIdentLibrary.of("semantic-ui-react");
  static final TsIdentLibrary AMAP_JS_API = TsIdentLibrary.of("amap-js-api");

  private static final ImmutableMap<TsIdentLibrary, TreeTransformationScopedChanges> PATCHES =
      ImmutableMap.of(
          STD, new Std(),
          REACT, new React(),
          STYLED_COMPONENTS, new StyledComponents(),
          SEMANTIC_UI_REACT, new SemanticUiReact(),
          AMAP_JS_API, new AMap());

  /** The fixes for {@code libName}, or null if it needs none. */
  public static @Nullable TreeTransformationScopedChanges apply(TsIdentLibrary libName) {
    return PATCHES.get(libName);
  }

  /** {@code HTMLCollectionOf} extends {@code HTMLCollection} incompatibly. */
  private static final class Std extends TreeTransformationScopedChanges {
    @Override
    protected TsDecl enterTsDecl(TsTreeScope scope, TsDecl x) {
      if (x instanceof TsDeclInterface iface
          && iface.name().value().equals("HTMLCollectionOf")
          && !iface.inheritance().isEmpty()) {
        return iface.withInheritance(ImmutableList.of());
      }
      return x;
    }
  }

  private static final class React extends TreeTransformationScopedChanges {
    @Override
    protected TsDeclInterface enterTsDeclInterface(TsTreeScope scope, TsDeclInterface x) {
      switch (x.name().value()) {
        case "CSSProperties":
          {
            TsMemberProperty hack =
                new TsMemberProperty(
                    Comments.of(new Comment.Raw("/* fake member to keep old syntax */")),
                    TsProtectionLevel.DEFAULT,
                    TsIdent.simple("hack"),
                    new TsTypeUnion(ImmutableList.of(TsTypeRef.ANY, TsTypeRef.UNDEFINED)),
                    null,
                    false,
                    false);
            return x.withMembers(
                ImmutableList.<TsMember>builder().addAll(x.members()).add(hack).build());
          }
        case "ReactElement":
          {
            if (x.tparams().isEmpty()) {
              return x;
            }
            TsDeclInterface withoutTParams = x.withTParams(ImmutableList.of());
            ImmutableMap.Builder<TsType, TsType> replacements = ImmutableMap.builder();
            for (TsTypeParam tp : x.tparams()) {
              replacements.put(TsTypeRef.of(tp.name()), TsTypeRef.ANY);
            }
            return new TypeRewriter(withoutTParams)
                .visitTsDeclInterface(replacements.buildOrThrow(), withoutTParams);
          }
        case "DOMAttributes":
          {
            ImmutableList.Builder<TsMember> kept = ImmutableList.builder();
            for (TsMember member : x.members()) {
              if (!isCapture(member)) {
                kept.add(member);
              }
            }
            return x.withMembers(kept.build());
          }
        default:
          return x;
      }
    }

    @Override
    protected TsDeclTypeAlias enterTsDeclTypeAlias(TsTreeScope scope, TsDeclTypeAlias x) {
      switch (x.name().value()) {
        case "ReactFragment":
          return without(x, TsTypeRef.OBJECT);
        case "ReactNode":
          return without(x, TsTypeRef.NULL);
        default:
          return x;
      }
    }

    private static TsDeclTypeAlias without(TsDeclTypeAlias x, TsType dropped) {
      if (!(x.alias() instanceof TsTypeUnion union) || !union.types().contains(dropped)) {
        return x;
      }
      ImmutableList.Builder<TsType> kept = ImmutableList.builder();
      for (TsType t : union.types()) {
        if (!t.equals(dropped)) {
          kept.add(t);
        }
      }
      return x.withAlias(TsTypeUnion.simplified(kept.build()));
    }

    private static boolean isCapture(TsMember member) {
      if (member instanceof TsMemberFunction f) {
        return f.name().value().endsWith("Capture");
      } else if (member instanceof TsMemberProperty p) {
        return p.name().value().endsWith("Capture");
      }
      return false;
    }
  }

  /** {@code WithOptionalTheme} starts with an {@code Omit} which loses all the props. */
  private static final class StyledComponents extends TreeTransformationScopedChanges {
    @Override
    protected TsDecl enterTsDecl(TsTreeScope scope, TsDecl x) {
      if (x instanceof TsDeclTypeAlias alias
          && alias.name().value().equals("WithOptionalTheme")
          && alias.alias() instanceof TsTypeIntersect intersect
          && !intersect.types().isEmpty()
          && intersect.types().get(0) instanceof TsTypeRef omit
          && omit.name().last().value().equals("Omit")
          && !omit.tparams().isEmpty()) {
        ImmutableList<TsType> types =
            ImmutableList.<TsType>builder()
                .add(omit.tparams().get(0))
                .addAll(intersect.types().subList(1, intersect.types().size()))
                .build();
        return alias.withAlias(new TsTypeIntersect(types));
      }
      return x;
    }
  }

  private static final class SemanticUiReact extends TreeTransformationScopedChanges {
    private static final ImmutableSet<String> REMOVE_INDEX =
        ImmutableSet.of(
            "InputProps", "TextAreaProps", "FormProps", "ButtonProps", "TableCellProps");

    @Override
    protected TsParsedFile enterTsParsedFile(TsTreeScope scope, TsParsedFile x) {
      ImmutableList.Builder<TsContainerOrDecl> kept = ImmutableList.builder();
      boolean changed = false;
      for (TsContainerOrDecl member : x.members()) {
        if (member instanceof TsDeclModule module && module.name().fragments().contains("src")) {
          changed = true;
        } else {
          kept.add(member);
        }
      }
      return changed ? x.withMembers(kept.build()) : x;
    }

    @Override
    protected TsDeclInterface enterTsDeclInterface(TsTreeScope scope, TsDeclInterface x) {
      if (!REMOVE_INDEX.contains(x.name().value())) {
        return x;
      }
      ImmutableList.Builder<TsMember> kept = ImmutableList.builder();
      for (TsMember member : x.members()) {
        if (!(member instanceof TsMemberIndex)) {
          kept.add(member);
        }
      }
      return x.withMembers(kept.build());
    }
  }

  /** {@code Merge<A, B>} is a mapped type which is as good as {@code A & B}. */
  private static final class AMap extends TreeTransformationScopedChanges {
    @Override
    protected TsDeclTypeAlias enterTsDeclTypeAlias(TsTreeScope scope, TsDeclTypeAlias x) {
      if (x.name().value().equals("Merge")) {
        return x.withAlias(new TsTypeIntersect(TsTypeParam.asTypeArgs(x.tparams())));
      }
      return x;
    }
  }
}
