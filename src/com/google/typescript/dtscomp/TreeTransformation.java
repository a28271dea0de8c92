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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.typescript.dts.tree.TsAugmentedModule;
import com.google.typescript.dts.tree.TsContainer;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDecl;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclEnum;
import com.google.typescript.dts.tree.TsDeclFunction;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclModule;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsDeclVar;
import com.google.typescript.dts.tree.TsEnumMember;
import com.google.typescript.dts.tree.TsExport;
import com.google.typescript.dts.tree.TsExpr;
import com.google.typescript.dts.tree.TsFunParam;
import com.google.typescript.dts.tree.TsFunSig;
import com.google.typescript.dts.tree.TsGlobal;
import com.google.typescript.dts.tree.TsImport;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberCall;
import com.google.typescript.dts.tree.TsMemberCtor;
import com.google.typescript.dts.tree.TsMemberFunction;
import com.google.typescript.dts.tree.TsMemberIndex;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsMemberTypeMapped;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsTree;
import com.google.typescript.dts.tree.TsTupleElement;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeAsserts;
import com.google.typescript.dts.tree.TsTypeConditional;
import com.google.typescript.dts.tree.TsTypeConstructor;
import com.google.typescript.dts.tree.TsTypeExtends;
import com.google.typescript.dts.tree.TsTypeFunction;
import com.google.typescript.dts.tree.TsTypeInfer;
import com.google.typescript.dts.tree.TsTypeIntersect;
import com.google.typescript.dts.tree.TsTypeIs;
import com.google.typescript.dts.tree.TsTypeKeyOf;
import com.google.typescript.dts.tree.TsTypeLiteral;
import com.google.typescript.dts.tree.TsTypeLookup;
import com.google.typescript.dts.tree.TsTypeObject;
import com.google.typescript.dts.tree.TsTypeParam;
import com.google.typescript.dts.tree.TsTypeQuery;
import com.google.typescript.dts.tree.TsTypeRef;
import com.google.typescript.dts.tree.TsTypeRepeated;
import com.google.typescript.dts.tree.TsTypeThis;
import com.google.typescript.dts.tree.TsTypeTuple;
import com.google.typescript.dts.tree.TsTypeUnion;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites a declaration tree through enter and leave hooks, one pair per node kind. Hooks that
 * are not overridden return their input.
 *
 * <p>For every node the framework calls the enter hook with a context that already includes the
 * node, visits the children of whatever the enter hook returned, rebuilds the node only if a
 * child changed, and finally calls the leave hook. An unchanged subtree comes back as the same
 * instance.
 *
 * <p>Class parents, interface inheritance and enum origins are typed as references, so they go
 * through {@link #visitTsTypeRef} without the generic {@code TsType} hooks.
 *
 * @param <T> the context threaded through the traversal, typically a {@link TsTreeScope}
 */
public abstract class TreeTransformation<T extends @Nullable Object> {

  /** Returns the context for the children of {@code tree}. */
  protected abstract T withTree(T t, TsTree tree);

  /**
   * Returns a transformation which runs the hooks of this transformation and then the hooks of
   * {@code other} on each node, threading the context of this transformation.
   */
  public final TreeTransformation<T> combine(TreeTransformation<T> other) {
    return new Combined<>(this, other);
  }

  /** Every container, before the kind-specific hook. */
  protected TsContainer enterTsContainer(T t, TsContainer x) {
    return x;
  }

  protected TsContainer leaveTsContainer(T t, TsContainer x) {
    return x;
  }

  /** Every declaration, before the kind-specific hook. */
  protected TsDecl enterTsDecl(T t, TsDecl x) {
    return x;
  }

  protected TsDecl leaveTsDecl(T t, TsDecl x) {
    return x;
  }

  protected TsParsedFile enterTsParsedFile(T t, TsParsedFile x) {
    return x;
  }

  protected TsParsedFile leaveTsParsedFile(T t, TsParsedFile x) {
    return x;
  }

  protected TsDeclNamespace enterTsDeclNamespace(T t, TsDeclNamespace x) {
    return x;
  }

  protected TsDeclNamespace leaveTsDeclNamespace(T t, TsDeclNamespace x) {
    return x;
  }

  protected TsDeclModule enterTsDeclModule(T t, TsDeclModule x) {
    return x;
  }

  protected TsDeclModule leaveTsDeclModule(T t, TsDeclModule x) {
    return x;
  }

  protected TsAugmentedModule enterTsAugmentedModule(T t, TsAugmentedModule x) {
    return x;
  }

  protected TsAugmentedModule leaveTsAugmentedModule(T t, TsAugmentedModule x) {
    return x;
  }

  protected TsGlobal enterTsGlobal(T t, TsGlobal x) {
    return x;
  }

  protected TsGlobal leaveTsGlobal(T t, TsGlobal x) {
    return x;
  }

  protected TsDeclClass enterTsDeclClass(T t, TsDeclClass x) {
    return x;
  }

  protected TsDeclClass leaveTsDeclClass(T t, TsDeclClass x) {
    return x;
  }

  protected TsDeclInterface enterTsDeclInterface(T t, TsDeclInterface x) {
    return x;
  }

  protected TsDeclInterface leaveTsDeclInterface(T t, TsDeclInterface x) {
    return x;
  }

  protected TsDeclVar enterTsDeclVar(T t, TsDeclVar x) {
    return x;
  }

  protected TsDeclVar leaveTsDeclVar(T t, TsDeclVar x) {
    return x;
  }

  protected TsDeclFunction enterTsDeclFunction(T t, TsDeclFunction x) {
    return x;
  }

  protected TsDeclFunction leaveTsDeclFunction(T t, TsDeclFunction x) {
    return x;
  }

  protected TsDeclTypeAlias enterTsDeclTypeAlias(T t, TsDeclTypeAlias x) {
    return x;
  }

  protected TsDeclTypeAlias leaveTsDeclTypeAlias(T t, TsDeclTypeAlias x) {
    return x;
  }

  protected TsDeclEnum enterTsDeclEnum(T t, TsDeclEnum x) {
    return x;
  }

  protected TsDeclEnum leaveTsDeclEnum(T t, TsDeclEnum x) {
    return x;
  }

  protected TsExport enterTsExport(T t, TsExport x) {
    return x;
  }

  protected TsExport leaveTsExport(T t, TsExport x) {
    return x;
  }

  /** Every type in a type position, before the kind-specific hook. */
  protected TsType enterTsType(T t, TsType x) {
    return x;
  }

  protected TsType leaveTsType(T t, TsType x) {
    return x;
  }

  protected TsTypeRef enterTsTypeRef(T t, TsTypeRef x) {
    return x;
  }

  protected TsTypeRef leaveTsTypeRef(T t, TsTypeRef x) {
    return x;
  }

  protected TsTypeUnion enterTsTypeUnion(T t, TsTypeUnion x) {
    return x;
  }

  protected TsTypeUnion leaveTsTypeUnion(T t, TsTypeUnion x) {
    return x;
  }

  protected TsTypeIntersect enterTsTypeIntersect(T t, TsTypeIntersect x) {
    return x;
  }

  protected TsTypeIntersect leaveTsTypeIntersect(T t, TsTypeIntersect x) {
    return x;
  }

  protected TsTypeObject enterTsTypeObject(T t, TsTypeObject x) {
    return x;
  }

  protected TsTypeObject leaveTsTypeObject(T t, TsTypeObject x) {
    return x;
  }

  protected TsTypeFunction enterTsTypeFunction(T t, TsTypeFunction x) {
    return x;
  }

  protected TsTypeFunction leaveTsTypeFunction(T t, TsTypeFunction x) {
    return x;
  }

  protected TsTypeQuery enterTsTypeQuery(T t, TsTypeQuery x) {
    return x;
  }

  protected TsTypeQuery leaveTsTypeQuery(T t, TsTypeQuery x) {
    return x;
  }

  /** Every member, before the kind-specific hook. */
  protected TsMember enterTsMember(T t, TsMember x) {
    return x;
  }

  protected TsMember leaveTsMember(T t, TsMember x) {
    return x;
  }

  protected TsMemberFunction enterTsMemberFunction(T t, TsMemberFunction x) {
    return x;
  }

  protected TsMemberFunction leaveTsMemberFunction(T t, TsMemberFunction x) {
    return x;
  }

  protected TsMemberProperty enterTsMemberProperty(T t, TsMemberProperty x) {
    return x;
  }

  protected TsMemberProperty leaveTsMemberProperty(T t, TsMemberProperty x) {
    return x;
  }

  protected TsMemberCall enterTsMemberCall(T t, TsMemberCall x) {
    return x;
  }

  protected TsMemberCall leaveTsMemberCall(T t, TsMemberCall x) {
    return x;
  }

  protected TsMemberCtor enterTsMemberCtor(T t, TsMemberCtor x) {
    return x;
  }

  protected TsMemberCtor leaveTsMemberCtor(T t, TsMemberCtor x) {
    return x;
  }

  protected TsFunSig enterTsFunSig(T t, TsFunSig x) {
    return x;
  }

  protected TsFunSig leaveTsFunSig(T t, TsFunSig x) {
    return x;
  }

  protected TsFunParam enterTsFunParam(T t, TsFunParam x) {
    return x;
  }

  protected TsFunParam leaveTsFunParam(T t, TsFunParam x) {
    return x;
  }

  protected TsTypeParam enterTsTypeParam(T t, TsTypeParam x) {
    return x;
  }

  protected TsTypeParam leaveTsTypeParam(T t, TsTypeParam x) {
    return x;
  }

  protected TsEnumMember enterTsEnumMember(T t, TsEnumMember x) {
    return x;
  }

  protected TsEnumMember leaveTsEnumMember(T t, TsEnumMember x) {
    return x;
  }

  protected TsExpr enterTsExpr(T t, TsExpr x) {
    return x;
  }

  protected TsExpr leaveTsExpr(T t, TsExpr x) {
    return x;
  }


  public final TsContainerOrDecl visitTsContainerOrDecl(T t, TsContainerOrDecl x) {
    TsContainerOrDecl entered = x;
    if (entered instanceof TsContainer container) {
      entered = enterTsContainer(withTree(t, entered), container);
    }
    if (entered instanceof TsDecl decl) {
      entered = enterTsDecl(withTree(t, entered), decl);
    }

    TsContainerOrDecl visited;
    if (entered instanceof TsParsedFile file) {
      visited = visitTsParsedFile(t, file);
    } else if (entered instanceof TsDeclNamespace ns) {
      visited = visitTsDeclNamespace(t, ns);
    } else if (entered instanceof TsDeclModule module) {
      visited = visitTsDeclModule(t, module);
    } else if (entered instanceof TsAugmentedModule module) {
      visited = visitTsAugmentedModule(t, module);
    } else if (entered instanceof TsGlobal global) {
      visited = visitTsGlobal(t, global);
    } else if (entered instanceof TsDeclClass cls) {
      visited = visitTsDeclClass(t, cls);
    } else if (entered instanceof TsDeclInterface iface) {
      visited = visitTsDeclInterface(t, iface);
    } else if (entered instanceof TsDeclVar var) {
      visited = visitTsDeclVar(t, var);
    } else if (entered instanceof TsDeclFunction fn) {
      visited = visitTsDeclFunction(t, fn);
    } else if (entered instanceof TsDeclTypeAlias alias) {
      visited = visitTsDeclTypeAlias(t, alias);
    } else if (entered instanceof TsDeclEnum e) {
      visited = visitTsDeclEnum(t, e);
    } else if (entered instanceof TsExport export) {
      visited = visitTsExport(t, export);
    } else {
      checkState(entered instanceof TsImport, "Unexpected node %s", entered);
      visited = entered;
    }

    if (visited instanceof TsDecl decl) {
      visited = leaveTsDecl(withTree(t, visited), decl);
    }
    if (visited instanceof TsContainer container) {
      visited = leaveTsContainer(withTree(t, visited), container);
    }
    return visited;
  }

  public final TsParsedFile visitTsParsedFile(T t, TsParsedFile x) {
    TsParsedFile xx = enterTsParsedFile(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsContainerOrDecl> members = visitMembers(tt, xx.members());
    TsParsedFile result = members == xx.members() ? xx : xx.withMembers(members);
    return leaveTsParsedFile(tt, result);
  }

  public final TsDeclNamespace visitTsDeclNamespace(T t, TsDeclNamespace x) {
    TsDeclNamespace xx = enterTsDeclNamespace(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsContainerOrDecl> members = visitMembers(tt, xx.members());
    TsDeclNamespace result = members == xx.members() ? xx : xx.withMembers(members);
    return leaveTsDeclNamespace(tt, result);
  }

  public final TsDeclModule visitTsDeclModule(T t, TsDeclModule x) {
    TsDeclModule xx = enterTsDeclModule(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsContainerOrDecl> members = visitMembers(tt, xx.members());
    TsDeclModule result = members == xx.members() ? xx : xx.withMembers(members);
    return leaveTsDeclModule(tt, result);
  }

  public final TsAugmentedModule visitTsAugmentedModule(T t, TsAugmentedModule x) {
    TsAugmentedModule xx = enterTsAugmentedModule(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsContainerOrDecl> members = visitMembers(tt, xx.members());
    TsAugmentedModule result = members == xx.members() ? xx : xx.withMembers(members);
    return leaveTsAugmentedModule(tt, result);
  }

  public final TsGlobal visitTsGlobal(T t, TsGlobal x) {
    TsGlobal xx = enterTsGlobal(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsContainerOrDecl> members = visitMembers(tt, xx.members());
    TsGlobal result = members == xx.members() ? xx : xx.withMembers(members);
    return leaveTsGlobal(tt, result);
  }

  private ImmutableList<TsContainerOrDecl> visitMembers(
      T tt, ImmutableList<TsContainerOrDecl> members) {
    return mapSame(members, m -> visitTsContainerOrDecl(tt, m));
  }

  public final TsDeclClass visitTsDeclClass(T t, TsDeclClass x) {
    TsDeclClass xx = enterTsDeclClass(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsTypeParam> tparams = mapSame(xx.tparams(), p -> visitTsTypeParam(tt, p));
    TsTypeRef parent = xx.parent() == null ? null : visitTsTypeRef(tt, xx.parent());
    ImmutableList<TsTypeRef> implementsInterfaces =
        mapSame(xx.implementsInterfaces(), i -> visitTsTypeRef(tt, i));
    ImmutableList<TsMember> members = mapSame(xx.members(), m -> visitTsMember(tt, m));
    TsDeclClass result = xx;
    if (tparams != xx.tparams()
        || parent != xx.parent()
        || implementsInterfaces != xx.implementsInterfaces()
        || members != xx.members()) {
      result =
          new TsDeclClass(
              xx.comments(),
              xx.declared(),
              xx.isAbstract(),
              xx.name(),
              tparams,
              parent,
              implementsInterfaces,
              members,
              xx.jsLocation(),
              xx.codePath());
    }
    return leaveTsDeclClass(tt, result);
  }

  public final TsDeclInterface visitTsDeclInterface(T t, TsDeclInterface x) {
    TsDeclInterface xx = enterTsDeclInterface(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsTypeParam> tparams = mapSame(xx.tparams(), p -> visitTsTypeParam(tt, p));
    ImmutableList<TsTypeRef> inheritance = mapSame(xx.inheritance(), i -> visitTsTypeRef(tt, i));
    ImmutableList<TsMember> members = mapSame(xx.members(), m -> visitTsMember(tt, m));
    TsDeclInterface result = xx;
    if (tparams != xx.tparams() || inheritance != xx.inheritance() || members != xx.members()) {
      result =
          new TsDeclInterface(
              xx.comments(),
              xx.declared(),
              xx.name(),
              tparams,
              inheritance,
              members,
              xx.codePath());
    }
    return leaveTsDeclInterface(tt, result);
  }

  public final TsDeclVar visitTsDeclVar(T t, TsDeclVar x) {
    TsDeclVar xx = enterTsDeclVar(withTree(t, x), x);
    T tt = withTree(t, xx);
    TsType tpe = xx.tpe() == null ? null : visitTsType(tt, xx.tpe());
    TsExpr expr = xx.expr() == null ? null : visitTsExpr(tt, xx.expr());
    TsDeclVar result = xx;
    if (tpe != xx.tpe() || expr != xx.expr()) {
      result =
          new TsDeclVar(
              xx.comments(),
              xx.declared(),
              xx.readOnly(),
              xx.name(),
              tpe,
              expr,
              xx.jsLocation(),
              xx.codePath());
    }
    return leaveTsDeclVar(tt, result);
  }

  public final TsDeclFunction visitTsDeclFunction(T t, TsDeclFunction x) {
    TsDeclFunction xx = enterTsDeclFunction(withTree(t, x), x);
    T tt = withTree(t, xx);
    TsFunSig signature = visitTsFunSig(tt, xx.signature());
    TsDeclFunction result = signature == xx.signature() ? xx : xx.withSignature(signature);
    return leaveTsDeclFunction(tt, result);
  }

  public final TsDeclTypeAlias visitTsDeclTypeAlias(T t, TsDeclTypeAlias x) {
    TsDeclTypeAlias xx = enterTsDeclTypeAlias(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsTypeParam> tparams = mapSame(xx.tparams(), p -> visitTsTypeParam(tt, p));
    TsType alias = visitTsType(tt, xx.alias());
    TsDeclTypeAlias result = xx;
    if (tparams != xx.tparams() || alias != xx.alias()) {
      result =
          new TsDeclTypeAlias(
              xx.comments(), xx.declared(), xx.name(), tparams, alias, xx.codePath());
    }
    return leaveTsDeclTypeAlias(tt, result);
  }

  public final TsDeclEnum visitTsDeclEnum(T t, TsDeclEnum x) {
    TsDeclEnum xx = enterTsDeclEnum(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsEnumMember> members = mapSame(xx.members(), m -> visitTsEnumMember(tt, m));
    TsTypeRef exportedFrom =
        xx.exportedFrom() == null ? null : visitTsTypeRef(tt, xx.exportedFrom());
    TsDeclEnum result = xx;
    if (members != xx.members()) {
      result = result.withMembers(members);
    }
    if (exportedFrom != xx.exportedFrom()) {
      result = result.withExportedFrom(exportedFrom);
    }
    return leaveTsDeclEnum(tt, result);
  }

  public final TsEnumMember visitTsEnumMember(T t, TsEnumMember x) {
    TsEnumMember xx = enterTsEnumMember(withTree(t, x), x);
    T tt = withTree(t, xx);
    TsExpr expr = xx.expr() == null ? null : visitTsExpr(tt, xx.expr());
    TsEnumMember result = expr == xx.expr() ? xx : xx.withExpr(expr);
    return leaveTsEnumMember(tt, result);
  }

  public final TsExport visitTsExport(T t, TsExport x) {
    TsExport xx = enterTsExport(withTree(t, x), x);
    T tt = withTree(t, xx);
    TsExport result = xx;
    if (xx.exported() instanceof TsExport.Tree tree) {
      TsContainerOrDecl decl = visitTsContainerOrDecl(tt, tree.decl());
      if (decl != tree.decl()) {
        checkState(decl instanceof TsDecl, "Export of %s", decl);
        result =
            new TsExport(
                xx.comments(), xx.typeOnly(), xx.tpe(), new TsExport.Tree((TsDecl) decl));
      }
    }
    return leaveTsExport(tt, result);
  }

  public final TsType visitTsType(T t, TsType x) {
    TsType entered = enterTsType(withTree(t, x), x);
    TsType visited = visitTsTypeKind(t, entered);
    return leaveTsType(withTree(t, visited), visited);
  }

  private TsType visitTsTypeKind(T t, TsType x) {
    if (x instanceof TsTypeRef ref) {
      return visitTsTypeRef(t, ref);
    } else if (x instanceof TsTypeUnion union) {
      return visitTsTypeUnion(t, union);
    } else if (x instanceof TsTypeIntersect intersect) {
      return visitTsTypeIntersect(t, intersect);
    } else if (x instanceof TsTypeObject obj) {
      return visitTsTypeObject(t, obj);
    } else if (x instanceof TsTypeFunction fn) {
      return visitTsTypeFunction(t, fn);
    } else if (x instanceof TsTypeQuery query) {
      TsTypeQuery entered = enterTsTypeQuery(withTree(t, query), query);
      return leaveTsTypeQuery(withTree(t, entered), entered);
    } else if (x instanceof TsTypeLiteral || x instanceof TsTypeThis) {
      return x;
    }

    T tt = withTree(t, x);
    if (x instanceof TsTypeConstructor ctor) {
      TsTypeFunction signature = visitTsTypeFunction(tt, ctor.signature());
      return signature == ctor.signature()
          ? x
          : new TsTypeConstructor(ctor.isAbstract(), signature);
    } else if (x instanceof TsTypeIs is) {
      TsType tpe = visitTsType(tt, is.tpe());
      return tpe == is.tpe() ? x : new TsTypeIs(is.ident(), tpe);
    } else if (x instanceof TsTypeAsserts asserts) {
      if (asserts.isOpt() == null) {
        return x;
      }
      TsType isOpt = visitTsType(tt, asserts.isOpt());
      return isOpt == asserts.isOpt() ? x : new TsTypeAsserts(asserts.ident(), isOpt);
    } else if (x instanceof TsTypeTuple tuple) {
      ImmutableList<TsTupleElement> elems =
          mapSame(
              tuple.elems(),
              e -> {
                TsType tpe = visitTsType(withTree(tt, e), e.tpe());
                return tpe == e.tpe() ? e : new TsTupleElement(e.label(), tpe);
              });
      return elems == tuple.elems() ? x : new TsTypeTuple(elems);
    } else if (x instanceof TsTypeRepeated repeated) {
      TsType underlying = visitTsType(tt, repeated.underlying());
      return underlying == repeated.underlying() ? x : new TsTypeRepeated(underlying);
    } else if (x instanceof TsTypeKeyOf keyOf) {
      TsType key = visitTsType(tt, keyOf.key());
      return key == keyOf.key() ? x : new TsTypeKeyOf(key);
    } else if (x instanceof TsTypeLookup lookup) {
      TsType from = visitTsType(tt, lookup.from());
      TsType key = visitTsType(tt, lookup.key());
      return from == lookup.from() && key == lookup.key() ? x : new TsTypeLookup(from, key);
    } else if (x instanceof TsTypeConditional cond) {
      TsType pred = visitTsType(tt, cond.pred());
      TsType ifTrue = visitTsType(tt, cond.ifTrue());
      TsType ifFalse = visitTsType(tt, cond.ifFalse());
      if (pred == cond.pred() && ifTrue == cond.ifTrue() && ifFalse == cond.ifFalse()) {
        return x;
      }
      return new TsTypeConditional(pred, ifTrue, ifFalse);
    } else if (x instanceof TsTypeExtends ext) {
      TsType tpe = visitTsType(tt, ext.tpe());
      TsType extended = visitTsType(tt, ext.ext());
      return tpe == ext.tpe() && extended == ext.ext() ? x : new TsTypeExtends(tpe, extended);
    } else if (x instanceof TsTypeInfer infer) {
      TsTypeParam tparam = visitTsTypeParam(tt, infer.tparam());
      return tparam == infer.tparam() ? x : new TsTypeInfer(tparam);
    }
    throw new IllegalStateException("Unexpected type " + x);
  }

  public final TsTypeRef visitTsTypeRef(T t, TsTypeRef x) {
    TsTypeRef xx = enterTsTypeRef(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsType> tparams = mapSame(xx.tparams(), p -> visitTsType(tt, p));
    TsTypeRef result = tparams == xx.tparams() ? xx : xx.withTParams(tparams);
    return leaveTsTypeRef(tt, result);
  }

  public final TsTypeUnion visitTsTypeUnion(T t, TsTypeUnion x) {
    TsTypeUnion xx = enterTsTypeUnion(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsType> types = mapSame(xx.types(), p -> visitTsType(tt, p));
    TsTypeUnion result = types == xx.types() ? xx : new TsTypeUnion(types);
    return leaveTsTypeUnion(tt, result);
  }

  public final TsTypeIntersect visitTsTypeIntersect(T t, TsTypeIntersect x) {
    TsTypeIntersect xx = enterTsTypeIntersect(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsType> types = mapSame(xx.types(), p -> visitTsType(tt, p));
    TsTypeIntersect result = types == xx.types() ? xx : new TsTypeIntersect(types);
    return leaveTsTypeIntersect(tt, result);
  }

  public final TsTypeObject visitTsTypeObject(T t, TsTypeObject x) {
    TsTypeObject xx = enterTsTypeObject(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsMember> members = mapSame(xx.members(), m -> visitTsMember(tt, m));
    TsTypeObject result = members == xx.members() ? xx : xx.withMembers(members);
    return leaveTsTypeObject(tt, result);
  }

  public final TsTypeFunction visitTsTypeFunction(T t, TsTypeFunction x) {
    TsTypeFunction xx = enterTsTypeFunction(withTree(t, x), x);
    T tt = withTree(t, xx);
    TsFunSig signature = visitTsFunSig(tt, xx.signature());
    TsTypeFunction result = signature == xx.signature() ? xx : new TsTypeFunction(signature);
    return leaveTsTypeFunction(tt, result);
  }

  public final TsMember visitTsMember(T t, TsMember x) {
    TsMember entered = enterTsMember(withTree(t, x), x);
    TsMember visited = visitTsMemberKind(t, entered);
    return leaveTsMember(withTree(t, visited), visited);
  }

  private TsMember visitTsMemberKind(T t, TsMember x) {
    if (x instanceof TsMemberFunction fn) {
      TsMemberFunction xx = enterTsMemberFunction(withTree(t, fn), fn);
      T tt = withTree(t, xx);
      TsFunSig signature = visitTsFunSig(tt, xx.signature());
      return leaveTsMemberFunction(
          tt, signature == xx.signature() ? xx : xx.withSignature(signature));
    } else if (x instanceof TsMemberProperty prop) {
      TsMemberProperty xx = enterTsMemberProperty(withTree(t, prop), prop);
      T tt = withTree(t, xx);
      TsType tpe = xx.tpe() == null ? null : visitTsType(tt, xx.tpe());
      TsExpr expr = xx.expr() == null ? null : visitTsExpr(tt, xx.expr());
      TsMemberProperty result = xx;
      if (tpe != xx.tpe() || expr != xx.expr()) {
        result =
            new TsMemberProperty(
                xx.comments(), xx.level(), xx.name(), tpe, expr, xx.isStatic(), xx.isReadOnly());
      }
      return leaveTsMemberProperty(tt, result);
    } else if (x instanceof TsMemberCall call) {
      TsMemberCall xx = enterTsMemberCall(withTree(t, call), call);
      T tt = withTree(t, xx);
      TsFunSig signature = visitTsFunSig(tt, xx.signature());
      return leaveTsMemberCall(tt, signature == xx.signature() ? xx : xx.withSignature(signature));
    } else if (x instanceof TsMemberCtor ctor) {
      TsMemberCtor xx = enterTsMemberCtor(withTree(t, ctor), ctor);
      T tt = withTree(t, xx);
      TsFunSig signature = visitTsFunSig(tt, xx.signature());
      return leaveTsMemberCtor(tt, signature == xx.signature() ? xx : xx.withSignature(signature));
    }

    T tt = withTree(t, x);
    if (x instanceof TsMemberIndex index) {
      TsMemberIndex.Indexing indexing = index.indexing();
      if (indexing instanceof TsMemberIndex.Dict dict) {
        TsType tpe = visitTsType(tt, dict.tpe());
        if (tpe != dict.tpe()) {
          indexing = new TsMemberIndex.Dict(dict.name(), tpe);
        }
      }
      TsType valueType = index.valueType() == null ? null : visitTsType(tt, index.valueType());
      if (indexing == index.indexing() && valueType == index.valueType()) {
        return x;
      }
      return new TsMemberIndex(
          index.comments(), index.isReadOnly(), index.level(), indexing, valueType);
    } else if (x instanceof TsMemberTypeMapped mapped) {
      TsType from = visitTsType(tt, mapped.from());
      TsType as = mapped.as() == null ? null : visitTsType(tt, mapped.as());
      TsType to = visitTsType(tt, mapped.to());
      if (from == mapped.from() && as == mapped.as() && to == mapped.to()) {
        return x;
      }
      return new TsMemberTypeMapped(
          mapped.comments(),
          mapped.level(),
          mapped.readonly(),
          mapped.key(),
          from,
          as,
          mapped.optionalize(),
          to);
    }
    throw new IllegalStateException("Unexpected member " + x);
  }

  public final TsFunSig visitTsFunSig(T t, TsFunSig x) {
    TsFunSig xx = enterTsFunSig(withTree(t, x), x);
    T tt = withTree(t, xx);
    ImmutableList<TsTypeParam> tparams = mapSame(xx.tparams(), p -> visitTsTypeParam(tt, p));
    ImmutableList<TsFunParam> params = mapSame(xx.params(), p -> visitTsFunParam(tt, p));
    TsType resultType = xx.resultType() == null ? null : visitTsType(tt, xx.resultType());
    TsFunSig result = xx;
    if (tparams != xx.tparams() || params != xx.params() || resultType != xx.resultType()) {
      result = new TsFunSig(xx.comments(), tparams, params, resultType);
    }
    return leaveTsFunSig(tt, result);
  }

  public final TsFunParam visitTsFunParam(T t, TsFunParam x) {
    TsFunParam xx = enterTsFunParam(withTree(t, x), x);
    T tt = withTree(t, xx);
    TsType tpe = xx.tpe() == null ? null : visitTsType(tt, xx.tpe());
    return leaveTsFunParam(tt, tpe == xx.tpe() ? xx : xx.withType(tpe));
  }

  public final TsTypeParam visitTsTypeParam(T t, TsTypeParam x) {
    TsTypeParam xx = enterTsTypeParam(withTree(t, x), x);
    T tt = withTree(t, xx);
    TsType upperBound = xx.upperBound() == null ? null : visitTsType(tt, xx.upperBound());
    TsType defaultType = xx.defaultType() == null ? null : visitTsType(tt, xx.defaultType());
    TsTypeParam result = xx;
    if (upperBound != xx.upperBound() || defaultType != xx.defaultType()) {
      result = new TsTypeParam(xx.comments(), xx.name(), upperBound, defaultType);
    }
    return leaveTsTypeParam(tt, result);
  }

  public final TsExpr visitTsExpr(T t, TsExpr x) {
    TsExpr xx = enterTsExpr(withTree(t, x), x);
    T tt = withTree(t, xx);
    TsExpr result = xx;
    if (xx instanceof TsExpr.Cast cast) {
      TsExpr expr = visitTsExpr(tt, cast.expr());
      TsType tpe = visitTsType(tt, cast.tpe());
      if (expr != cast.expr() || tpe != cast.tpe()) {
        result = new TsExpr.Cast(expr, tpe);
      }
    } else if (xx instanceof TsExpr.Call call) {
      TsExpr function = visitTsExpr(tt, call.function());
      ImmutableList<TsExpr> params = mapSame(call.params(), p -> visitTsExpr(tt, p));
      if (function != call.function() || params != call.params()) {
        result = new TsExpr.Call(function, params);
      }
    } else if (xx instanceof TsExpr.Unary unary) {
      TsExpr expr = visitTsExpr(tt, unary.expr());
      if (expr != unary.expr()) {
        result = new TsExpr.Unary(unary.op(), expr);
      }
    } else if (xx instanceof TsExpr.BinaryOp binary) {
      TsExpr one = visitTsExpr(tt, binary.one());
      TsExpr two = visitTsExpr(tt, binary.two());
      if (one != binary.one() || two != binary.two()) {
        result = new TsExpr.BinaryOp(one, binary.op(), two);
      }
    } else if (xx instanceof TsExpr.ArrayOf array) {
      TsExpr expr = visitTsExpr(tt, array.expr());
      if (expr != array.expr()) {
        result = new TsExpr.ArrayOf(expr);
      }
    }
    return leaveTsExpr(tt, result);
  }

  /** Maps {@code list}, returning the same instance if {@code fn} returned every element as is. */
  static <E> ImmutableList<E> mapSame(ImmutableList<E> list, Function<? super E, ? extends E> fn) {
    ImmutableList.Builder<E> builder = null;
    for (int i = 0; i < list.size(); i++) {
      E element = list.get(i);
      E mapped = fn.apply(element);
      if (builder == null && mapped != element) {
        builder = ImmutableList.builderWithExpectedSize(list.size());
        builder.addAll(list.subList(0, i));
      }
      if (builder != null) {
        builder.add(mapped);
      }
    }
    return builder == null ? list : builder.build();
  }

  private static final class Combined<T extends @Nullable Object> extends TreeTransformation<T> {
    private final TreeTransformation<T> first;
    private final TreeTransformation<T> second;

    Combined(TreeTransformation<T> first, TreeTransformation<T> second) {
      this.first = first;
      this.second = second;
    }

    @Override
    protected T withTree(T t, TsTree tree) {
      return first.withTree(t, tree);
    }

    @Override
    protected TsContainer enterTsContainer(T t, TsContainer x) {
      return second.enterTsContainer(t, first.enterTsContainer(t, x));
    }

    @Override
    protected TsContainer leaveTsContainer(T t, TsContainer x) {
      return second.leaveTsContainer(t, first.leaveTsContainer(t, x));
    }

    @Override
    protected TsDecl enterTsDecl(T t, TsDecl x) {
      return second.enterTsDecl(t, first.enterTsDecl(t, x));
    }

    @Override
    protected TsDecl leaveTsDecl(T t, TsDecl x) {
      return second.leaveTsDecl(t, first.leaveTsDecl(t, x));
    }

    @Override
    protected TsParsedFile enterTsParsedFile(T t, TsParsedFile x) {
      return second.enterTsParsedFile(t, first.enterTsParsedFile(t, x));
    }

    @Override
    protected TsParsedFile leaveTsParsedFile(T t, TsParsedFile x) {
      return second.leaveTsParsedFile(t, first.leaveTsParsedFile(t, x));
    }

    @Override
    protected TsDeclNamespace enterTsDeclNamespace(T t, TsDeclNamespace x) {
      return second.enterTsDeclNamespace(t, first.enterTsDeclNamespace(t, x));
    }

    @Override
    protected TsDeclNamespace leaveTsDeclNamespace(T t, TsDeclNamespace x) {
      return second.leaveTsDeclNamespace(t, first.leaveTsDeclNamespace(t, x));
    }

    @Override
    protected TsDeclModule enterTsDeclModule(T t, TsDeclModule x) {
      return second.enterTsDeclModule(t, first.enterTsDeclModule(t, x));
    }

    @Override
    protected TsDeclModule leaveTsDeclModule(T t, TsDeclModule x) {
      return second.leaveTsDeclModule(t, first.leaveTsDeclModule(t, x));
    }

    @Override
    protected TsAugmentedModule enterTsAugmentedModule(T t, TsAugmentedModule x) {
      return second.enterTsAugmentedModule(t, first.enterTsAugmentedModule(t, x));
    }

    @Override
    protected TsAugmentedModule leaveTsAugmentedModule(T t, TsAugmentedModule x) {
      return second.leaveTsAugmentedModule(t, first.leaveTsAugmentedModule(t, x));
    }

    @Override
    protected TsGlobal enterTsGlobal(T t, TsGlobal x) {
      return second.enterTsGlobal(t, first.enterTsGlobal(t, x));
    }

    @Override
    protected TsGlobal leaveTsGlobal(T t, TsGlobal x) {
      return second.leaveTsGlobal(t, first.leaveTsGlobal(t, x));
    }

    @Override
    protected TsDeclClass enterTsDeclClass(T t, TsDeclClass x) {
      return second.enterTsDeclClass(t, first.enterTsDeclClass(t, x));
    }

    @Override
    protected TsDeclClass leaveTsDeclClass(T t, TsDeclClass x) {
      return second.leaveTsDeclClass(t, first.leaveTsDeclClass(t, x));
    }

    @Override
    protected TsDeclInterface enterTsDeclInterface(T t, TsDeclInterface x) {
      return second.enterTsDeclInterface(t, first.enterTsDeclInterface(t, x));
    }

    @Override
    protected TsDeclInterface leaveTsDeclInterface(T t, TsDeclInterface x) {
      return second.leaveTsDeclInterface(t, first.leaveTsDeclInterface(t, x));
    }

    @Override
    protected TsDeclVar enterTsDeclVar(T t, TsDeclVar x) {
      return second.enterTsDeclVar(t, first.enterTsDeclVar(t, x));
    }

    @Override
    protected TsDeclVar leaveTsDeclVar(T t, TsDeclVar x) {
      return second.leaveTsDeclVar(t, first.leaveTsDeclVar(t, x));
    }

    @Override
    protected TsDeclFunction enterTsDeclFunction(T t, TsDeclFunction x) {
      return second.enterTsDeclFunction(t, first.enterTsDeclFunction(t, x));
    }

    @Override
    protected TsDeclFunction leaveTsDeclFunction(T t, TsDeclFunction x) {
      return second.leaveTsDeclFunction(t, first.leaveTsDeclFunction(t, x));
    }

    @Override
    protected TsDeclTypeAlias enterTsDeclTypeAlias(T t, TsDeclTypeAlias x) {
      return second.enterTsDeclTypeAlias(t, first.enterTsDeclTypeAlias(t, x));
    }

    @Override
    protected TsDeclTypeAlias leaveTsDeclTypeAlias(T t, TsDeclTypeAlias x) {
      return second.leaveTsDeclTypeAlias(t, first.leaveTsDeclTypeAlias(t, x));
    }

    @Override
    protected TsDeclEnum enterTsDeclEnum(T t, TsDeclEnum x) {
      return second.enterTsDeclEnum(t, first.enterTsDeclEnum(t, x));
    }

    @Override
    protected TsDeclEnum leaveTsDeclEnum(T t, TsDeclEnum x) {
      return second.leaveTsDeclEnum(t, first.leaveTsDeclEnum(t, x));
    }

    @Override
    protected TsExport enterTsExport(T t, TsExport x) {
      return second.enterTsExport(t, first.enterTsExport(t, x));
    }

    @Override
    protected TsExport leaveTsExport(T t, TsExport x) {
      return second.leaveTsExport(t, first.leaveTsExport(t, x));
    }

    @Override
    protected TsType enterTsType(T t, TsType x) {
      return second.enterTsType(t, first.enterTsType(t, x));
    }

    @Override
    protected TsType leaveTsType(T t, TsType x) {
      return second.leaveTsType(t, first.leaveTsType(t, x));
    }

    @Override
    protected TsTypeRef enterTsTypeRef(T t, TsTypeRef x) {
      return second.enterTsTypeRef(t, first.enterTsTypeRef(t, x));
    }

    @Override
    protected TsTypeRef leaveTsTypeRef(T t, TsTypeRef x) {
      return second.leaveTsTypeRef(t, first.leaveTsTypeRef(t, x));
    }

    @Override
    protected TsTypeUnion enterTsTypeUnion(T t, TsTypeUnion x) {
      return second.enterTsTypeUnion(t, first.enterTsTypeUnion(t, x));
    }

    @Override
    protected TsTypeUnion leaveTsTypeUnion(T t, TsTypeUnion x) {
      return second.leaveTsTypeUnion(t, first.leaveTsTypeUnion(t, x));
    }

    @Override
    protected TsTypeIntersect enterTsTypeIntersect(T t, TsTypeIntersect x) {
      return second.enterTsTypeIntersect(t, first.enterTsTypeIntersect(t, x));
    }

    @Override
    protected TsTypeIntersect leaveTsTypeIntersect(T t, TsTypeIntersect x) {
      return second.leaveTsTypeIntersect(t, first.leaveTsTypeIntersect(t, x));
    }

    @Override
    protected TsTypeObject enterTsTypeObject(T t, TsTypeObject x) {
      return second.enterTsTypeObject(t, first.enterTsTypeObject(t, x));
    }

    @Override
    protected TsTypeObject leaveTsTypeObject(T t, TsTypeObject x) {
      return second.leaveTsTypeObject(t, first.leaveTsTypeObject(t, x));
    }

    @Override
    protected TsTypeFunction enterTsTypeFunction(T t, TsTypeFunction x) {
      return second.enterTsTypeFunction(t, first.enterTsTypeFunction(t, x));
    }

    @Override
    protected TsTypeFunction leaveTsTypeFunction(T t, TsTypeFunction x) {
      return second.leaveTsTypeFunction(t, first.leaveTsTypeFunction(t, x));
    }

    @Override
    protected TsTypeQuery enterTsTypeQuery(T t, TsTypeQuery x) {
      return second.enterTsTypeQuery(t, first.enterTsTypeQuery(t, x));
    }

    @Override
    protected TsTypeQuery leaveTsTypeQuery(T t, TsTypeQuery x) {
      return second.leaveTsTypeQuery(t, first.leaveTsTypeQuery(t, x));
    }

    @Override
    protected TsMember enterTsMember(T t, TsMember x) {
      return second.enterTsMember(t, first.enterTsMember(t, x));
    }

    @Override
    protected TsMember leaveTsMember(T t, TsMember x) {
      return second.leaveTsMember(t, first.leaveTsMember(t, x));
    }

    @Override
    protected TsMemberFunction enterTsMemberFunction(T t, TsMemberFunction x) {
      return second.enterTsMemberFunction(t, first.enterTsMemberFunction(t, x));
    }

    @Override
    protected TsMemberFunction leaveTsMemberFunction(T t, TsMemberFunction x) {
      return second.leaveTsMemberFunction(t, first.leaveTsMemberFunction(t, x));
    }

    @Override
    protected TsMemberProperty enterTsMemberProperty(T t, TsMemberProperty x) {
      return second.enterTsMemberProperty(t, first.enterTsMemberProperty(t, x));
    }

    @Override
    protected TsMemberProperty leaveTsMemberProperty(T t, TsMemberProperty x) {
      return second.leaveTsMemberProperty(t, first.leaveTsMemberProperty(t, x));
    }

    @Override
    protected TsMemberCall enterTsMemberCall(T t, TsMemberCall x) {
      return second.enterTsMemberCall(t, first.enterTsMemberCall(t, x));
    }

    @Override
    protected TsMemberCall leaveTsMemberCall(T t, TsMemberCall x) {
      return second.leaveTsMemberCall(t, first.leaveTsMemberCall(t, x));
    }

    @Override
    protected TsMemberCtor enterTsMemberCtor(T t, TsMemberCtor x) {
      return second.enterTsMemberCtor(t, first.enterTsMemberCtor(t, x));
    }

    @Override
    protected TsMemberCtor leaveTsMemberCtor(T t, TsMemberCtor x) {
      return second.leaveTsMemberCtor(t, first.leaveTsMemberCtor(t, x));
    }

    @Override
    protected TsFunSig enterTsFunSig(T t, TsFunSig x) {
      return second.enterTsFunSig(t, first.enterTsFunSig(t, x));
    }

    @Override
    protected TsFunSig leaveTsFunSig(T t, TsFunSig x) {
      return second.leaveTsFunSig(t, first.leaveTsFunSig(t, x));
    }

    @Override
    protected TsFunParam enterTsFunParam(T t, TsFunParam x) {
      return second.enterTsFunParam(t, first.enterTsFunParam(t, x));
    }

    @Override
    protected TsFunParam leaveTsFunParam(T t, TsFunParam x) {
      return second.leaveTsFunParam(t, first.leaveTsFunParam(t, x));
    }

    @Override
    protected TsTypeParam enterTsTypeParam(T t, TsTypeParam x) {
      return second.enterTsTypeParam(t, first.enterTsTypeParam(t, x));
    }

    @Override
    protected TsTypeParam leaveTsTypeParam(T t, TsTypeParam x) {
      return second.leaveTsTypeParam(t, first.leaveTsTypeParam(t, x));
    }

    @Override
    protected TsEnumMember enterTsEnumMember(T t, TsEnumMember x) {
      return second.enterTsEnumMember(t, first.enterTsEnumMember(t, x));
    }

    @Override
    protected TsEnumMember leaveTsEnumMember(T t, TsEnumMember x) {
      return second.leaveTsEnumMember(t, first.leaveTsEnumMember(t, x));
    }

    @Override
    protected TsExpr enterTsExpr(T t, TsExpr x) {
      return second.enterTsExpr(t, first.enterTsExpr(t, x));
    }

    @Override
    protected TsExpr leaveTsExpr(T t, TsExpr x) {
      return second.leaveTsExpr(t, first.leaveTsExpr(t, x));
    }
  }
}
