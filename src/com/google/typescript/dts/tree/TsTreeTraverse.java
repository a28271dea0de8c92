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
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Walks every node reachable from a root, pre-order, depth first and left to right in field
 * declaration order. The children of each node kind are listed explicitly in {@link #children}.
 */
public final class TsTreeTraverse {

  private TsTreeTraverse() {}

  /** Applies {@code extract} to {@code tree} and all its descendants, keeping non-null results. */
  public static <T> ImmutableList<T> collect(
      TsTree tree, Function<? super TsTree, ? extends @Nullable T> extract) {
    ImmutableList.Builder<T> results = ImmutableList.builder();
    go(tree, extract, results);
    return results.build();
  }

  public static <T> ImmutableList<T> collect(
      Iterable<? extends TsTree> trees, Function<? super TsTree, ? extends @Nullable T> extract) {
    ImmutableList.Builder<T> results = ImmutableList.builder();
    for (TsTree tree : trees) {
      go(tree, extract, results);
    }
    return results.build();
  }

  private static <T> void go(
      TsTree tree,
      Function<? super TsTree, ? extends @Nullable T> extract,
      ImmutableList.Builder<T> results) {
    T extracted = extract.apply(tree);
    if (extracted != null) {
      results.add(extracted);
    }
    for (TsTree child : children(tree)) {
      go(child, extract, results);
    }
  }

  /** The direct children of a node. */
  public static ImmutableList<TsTree> children(TsTree tree) {
    Children c = new Children();
    if (tree instanceof TsContainer container) {
      c.addAll(container.members());
    } else if (tree instanceof TsDeclClass x) {
      c.addAll(x.tparams()).add(x.parent()).addAll(x.implementsInterfaces()).addAll(x.members());
    } else if (tree instanceof TsDeclInterface x) {
      c.addAll(x.tparams()).addAll(x.inheritance()).addAll(x.members());
    } else if (tree instanceof TsDeclEnum x) {
      c.addAll(x.members()).add(x.exportedFrom());
    } else if (tree instanceof TsDeclVar x) {
      c.add(x.tpe()).add(x.expr());
    } else if (tree instanceof TsDeclFunction x) {
      c.add(x.signature());
    } else if (tree instanceof TsDeclTypeAlias x) {
      c.addAll(x.tparams()).add(x.alias());
    } else if (tree instanceof TsExport x) {
      if (x.exported() instanceof TsExport.Tree t) {
        c.add(t.decl());
      }
    } else if (tree instanceof TsImport) {
      // Imports hold names only.
    } else if (tree instanceof TsEnumMember x) {
      c.add(x.expr());
    } else if (tree instanceof TsFunSig x) {
      c.addAll(x.tparams()).addAll(x.params()).add(x.resultType());
    } else if (tree instanceof TsFunParam x) {
      c.add(x.tpe());
    } else if (tree instanceof TsTypeParam x) {
      c.add(x.upperBound()).add(x.defaultType());
    } else if (tree instanceof TsTupleElement x) {
      c.add(x.tpe());
    } else if (tree instanceof TsType x) {
      typeChildren(x, c);
    } else if (tree instanceof TsMember x) {
      memberChildren(x, c);
    } else if (tree instanceof TsExpr x) {
      exprChildren(x, c);
    }
    return c.builder.build();
  }

  private static void typeChildren(TsType type, Children c) {
    if (type instanceof TsTypeRef x) {
      c.addAll(x.tparams());
    } else if (type instanceof TsTypeObject x) {
      c.addAll(x.members());
    } else if (type instanceof TsTypeFunction x) {
      c.add(x.signature());
    } else if (type instanceof TsTypeConstructor x) {
      c.add(x.signature());
    } else if (type instanceof TsTypeIs x) {
      c.add(x.tpe());
    } else if (type instanceof TsTypeAsserts x) {
      c.add(x.isOpt());
    } else if (type instanceof TsTypeTuple x) {
      c.addAll(x.elems());
    } else if (type instanceof TsTypeRepeated x) {
      c.add(x.underlying());
    } else if (type instanceof TsTypeKeyOf x) {
      c.add(x.key());
    } else if (type instanceof TsTypeLookup x) {
      c.add(x.from()).add(x.key());
    } else if (type instanceof TsTypeIntersect x) {
      c.addAll(x.types());
    } else if (type instanceof TsTypeUnion x) {
      c.addAll(x.types());
    } else if (type instanceof TsTypeConditional x) {
      c.add(x.pred()).add(x.ifTrue()).add(x.ifFalse());
    } else if (type instanceof TsTypeExtends x) {
      c.add(x.tpe()).add(x.ext());
    } else if (type instanceof TsTypeInfer x) {
      c.add(x.tparam());
    }
  }

  private static void memberChildren(TsMember member, Children c) {
    if (member instanceof TsMemberCall x) {
      c.add(x.signature());
    } else if (member instanceof TsMemberCtor x) {
      c.add(x.signature());
    } else if (member instanceof TsMemberFunction x) {
      c.add(x.signature());
    } else if (member instanceof TsMemberIndex x) {
      if (x.indexing() instanceof TsMemberIndex.Dict dict) {
        c.add(dict.tpe());
      }
      c.add(x.valueType());
    } else if (member instanceof TsMemberTypeMapped x) {
      c.add(x.from()).add(x.as()).add(x.to());
    } else if (member instanceof TsMemberProperty x) {
      c.add(x.tpe()).add(x.expr());
    }
  }

  private static void exprChildren(TsExpr expr, Children c) {
    if (expr instanceof TsExpr.Call x) {
      c.add(x.function()).addAll(x.params());
    } else if (expr instanceof TsExpr.Unary x) {
      c.add(x.expr());
    } else if (expr instanceof TsExpr.BinaryOp x) {
      c.add(x.one()).add(x.two());
    } else if (expr instanceof TsExpr.Cast x) {
      c.add(x.expr()).add(x.tpe());
    } else if (expr instanceof TsExpr.ArrayOf x) {
      c.add(x.expr());
    }
  }

  private static final class Children {
    final ImmutableList.Builder<TsTree> builder = ImmutableList.builder();

    Children add(@Nullable TsTree tree) {
      if (tree != null) {
        builder.add(tree);
      }
      return this;
    }

    Children addAll(Iterable<? extends TsTree> trees) {
      builder.addAll(trees);
      return this;
    }
  }
}
