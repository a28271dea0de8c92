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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.typescript.dts.tree.HasClassMembers;
import com.google.typescript.dts.tree.TsAugmentedModule;
import com.google.typescript.dts.tree.TsContainer;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclClass;
import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsDeclModule;
import com.google.typescript.dts.tree.TsDeclNamespace;
import com.google.typescript.dts.tree.TsDeclTypeAlias;
import com.google.typescript.dts.tree.TsFunSig;
import com.google.typescript.dts.tree.TsGlobal;
import com.google.typescript.dts.tree.TsIdent;
import com.google.typescript.dts.tree.TsIdentImport;
import com.google.typescript.dts.tree.TsIdentLibrary;
import com.google.typescript.dts.tree.TsIdentModule;
import com.google.typescript.dts.tree.TsIdentSimple;
import com.google.typescript.dts.tree.TsMemberTypeMapped;
import com.google.typescript.dts.tree.TsNamedDecl;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsQIdent;
import com.google.typescript.dts.tree.TsTree;
import com.google.typescript.dts.tree.TsTypeInfer;
import com.google.typescript.dts.tree.TsTypeParam;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A position in a declaration tree, used to resolve qualified names the way the TypeScript
 * compiler would see them from that position.
 *
 * <p>A {@link Root} holds the library being processed and its dependencies. Descending into a
 * tree node yields a {@link Scoped} whose stack records every enclosing node, innermost first.
 * Scopes are immutable; the lazily computed parts are pure functions of the stack.
 */
public abstract class TsTreeScope {

  /** A declaration together with the scope in which it was found. */
  public record Resolved<T extends TsNamedDecl>(T decl, TsTreeScope scope) {}

  private TsTreeScope() {}

  public static Root create(
      TsIdentLibrary libName,
      boolean pedantic,
      ImmutableMap<TsIdentLibrary, TsParsedFile> deps,
      TsLogger logger) {
    return new Root(libName, pedantic, deps, logger);
  }

  public abstract Root root();

  public abstract TsLogger logger();

  /** The enclosing trees, innermost first. Empty at the root. */
  public abstract ImmutableList<TsTree> stack();

  /** Type parameters in scope, keyed by name. Inner declarations shadow outer ones. */
  public abstract ImmutableMap<TsIdentSimple, TsTypeParam> tparams();

  /** Keys introduced by enclosing mapped types. */
  public abstract ImmutableSet<TsIdentSimple> tkeys();

  abstract <T extends TsNamedDecl> ImmutableList<Resolved<T>> lookupInternal(
      Picker<T> picker, ImmutableList<TsIdent> wanted, LoopDetector loopDetector);

  public final TsIdentLibrary libName() {
    return root().libName;
  }

  public final boolean pedantic() {
    return root().pedantic;
  }

  public final Scoped descend(TsTree tree) {
    return new Scoped(this, checkNotNull(tree));
  }

  public final ImmutableList<TsNamedDecl> lookup(TsQIdent qname) {
    return lookup(qname, false);
  }

  public final ImmutableList<TsNamedDecl> lookup(TsQIdent qname, boolean skipValidation) {
    return declsOf(lookupBase(Picker.ALL, qname, skipValidation));
  }

  public final ImmutableList<Resolved<TsNamedDecl>> lookupIncludeScope(TsQIdent qname) {
    return lookupBase(Picker.ALL, qname, false);
  }

  public final ImmutableList<TsNamedDecl> lookupType(TsQIdent qname) {
    return lookupType(qname, false);
  }

  public final ImmutableList<TsNamedDecl> lookupType(TsQIdent qname, boolean skipValidation) {
    return declsOf(lookupBase(Picker.TYPES, qname, skipValidation));
  }

  public final ImmutableList<Resolved<TsNamedDecl>> lookupTypeIncludeScope(TsQIdent qname) {
    return lookupBase(Picker.TYPES, qname, false);
  }

  /**
   * Resolves {@code qname} to the declarations {@code picker} accepts. Primitive names and names
   * of type parameters or mapped keys resolve to nothing. An unresolvable name is reported unless
   * {@code skipValidation} is set.
   */
  public final <T extends TsNamedDecl> ImmutableList<Resolved<T>> lookupBase(
      Picker<T> picker, TsQIdent qname, boolean skipValidation) {
    if (qname.isPrimitive() || isAbstract(qname)) {
      return ImmutableList.of();
    }
    ImmutableList<Resolved<T>> found = lookupInternal(picker, qname.parts(), LoopDetector.INITIAL);
    if (found.isEmpty() && !skipValidation) {
      fatalMaybe("Cannot resolve " + qname.asString());
    }
    return found;
  }

  /** Whether {@code qname} names a type parameter or a mapped-type key in this scope. */
  public final boolean isAbstract(TsQIdent qname) {
    if (qname.size() != 1 || !(qname.first() instanceof TsIdentSimple simple)) {
      return false;
    }
    return tparams().containsKey(simple) || tkeys().contains(simple);
  }

  public final @Nullable TsContainer surroundingTsContainer() {
    for (TsTree tree : stack()) {
      if (tree instanceof TsContainer container) {
        return container;
      }
    }
    return null;
  }

  public final @Nullable HasClassMembers surroundingHasMembers() {
    for (TsTree tree : stack()) {
      if (tree instanceof HasClassMembers owner) {
        return owner;
      }
    }
    return null;
  }

  public final boolean withinModule() {
    for (TsTree tree : stack()) {
      if (tree instanceof TsDeclModule || tree instanceof TsAugmentedModule) {
        return true;
      }
    }
    return false;
  }

  public final void fatalMaybe(String message) {
    logger().fatalMaybe(message, pedantic());
  }

  private static <T extends TsNamedDecl> ImmutableList<T> declsOf(
      ImmutableList<Resolved<T>> resolved) {
    ImmutableList.Builder<T> builder = ImmutableList.builderWithExpectedSize(resolved.size());
    for (Resolved<T> r : resolved) {
      builder.add(r.decl());
    }
    return builder.build();
  }

  /**
   * Searches {@code container}, reached through {@code scope}, for {@code fragments}. Intermediate
   * fragments must name containers. A container with {@code ^} members is searched through them
   * when a fragment is not found directly.
   */
  static <T extends TsNamedDecl> ImmutableList<Resolved<T>> search(
      TsTreeScope scope, Picker<T> picker, TsContainer container, List<TsIdent> fragments) {
    if (fragments.isEmpty()) {
      return ImmutableList.of();
    }
    ImmutableListMultimap<TsIdentSimple, TsNamedDecl> index = container.lookupIndex();
    TsIdent head = fragments.get(0);
    List<TsIdent> tail = fragments.subList(1, fragments.size());

    ImmutableList.Builder<Resolved<T>> results = ImmutableList.builder();
    if (head instanceof TsIdentSimple simple) {
      for (TsNamedDecl decl : index.get(simple)) {
        if (tail.isEmpty()) {
          T picked = picker.pick(decl);
          if (picked != null) {
            results.add(new Resolved<>(picked, scope.descend(decl)));
          }
        } else if (decl instanceof TsContainer inner) {
          results.addAll(search(scope.descend(decl), picker, inner, tail));
        }
      }
    }
    ImmutableList<Resolved<T>> direct = results.build();
    if (!direct.isEmpty() || head.equals(TsIdent.NAMESPACED)) {
      return direct;
    }
    ImmutableList.Builder<Resolved<T>> namespaced = ImmutableList.builder();
    for (TsNamedDecl decl : index.get(TsIdent.NAMESPACED)) {
      if (decl instanceof TsContainer inner) {
        namespaced.addAll(search(scope.descend(decl), picker, inner, fragments));
      }
    }
    return namespaced.build();
  }

  /** Global blocks and {@code <global>} namespaces directly inside {@code file}. */
  static ImmutableList<TsContainer> globalsOf(TsContainer file) {
    ImmutableList.Builder<TsContainer> builder = ImmutableList.builder();
    for (TsContainerOrDecl member : file.members()) {
      if (member instanceof TsGlobal global) {
        builder.add(global);
      } else if (member instanceof TsDeclNamespace ns && ns.name().equals(TsIdent.GLOBAL)) {
        builder.add(ns);
      }
    }
    return builder.build();
  }

  private static <T extends TsNamedDecl> ImmutableList<Resolved<T>> searchGlobals(
      TsTreeScope fileScope, TsContainer file, Picker<T> picker, List<TsIdent> fragments) {
    ImmutableList.Builder<Resolved<T>> results = ImmutableList.builder();
    for (TsContainer global : globalsOf(file)) {
      results.addAll(search(fileScope.descend(global), picker, global, fragments));
    }
    return results.build();
  }

  private static boolean sameModule(TsIdentModule wanted, TsIdentModule candidate) {
    return wanted.equals(candidate) || candidate.equals(wanted.indexAlternative());
  }

  /** The scope of a library: its dependencies, keyed by library name. */
  public static final class Root extends TsTreeScope {
    final TsIdentLibrary libName;
    final boolean pedantic;
    private final ImmutableMap<TsIdentLibrary, TsParsedFile> deps;
    private final TsLogger logger;
    private final Supplier<ImmutableMap<TsIdentLibrary, Scoped>> depScopes =
        Suppliers.memoize(this::computeDepScopes);

    private Root(
        TsIdentLibrary libName,
        boolean pedantic,
        ImmutableMap<TsIdentLibrary, TsParsedFile> deps,
        TsLogger logger) {
      this.libName = checkNotNull(libName);
      this.pedantic = pedantic;
      this.deps = checkNotNull(deps);
      this.logger = checkNotNull(logger);
    }

    public ImmutableMap<TsIdentLibrary, TsParsedFile> deps() {
      return deps;
    }

    private ImmutableMap<TsIdentLibrary, Scoped> computeDepScopes() {
      ImmutableMap.Builder<TsIdentLibrary, Scoped> builder = ImmutableMap.builder();
      for (Map.Entry<TsIdentLibrary, TsParsedFile> dep : deps.entrySet()) {
        builder.put(dep.getKey(), descend(dep.getValue()));
      }
      return builder.buildOrThrow();
    }

    /** Dependency scopes with {@code std} first, then the rest in declaration order. */
    private ImmutableList<Scoped> orderedDepScopes() {
      ImmutableMap<TsIdentLibrary, Scoped> scopes = depScopes.get();
      ImmutableList.Builder<Scoped> builder = ImmutableList.builder();
      Scoped std = scopes.get(TsIdentLibrary.STD);
      if (std != null) {
        builder.add(std);
      }
      for (Map.Entry<TsIdentLibrary, Scoped> entry : scopes.entrySet()) {
        if (!entry.getKey().equals(TsIdentLibrary.STD)) {
          builder.add(entry.getValue());
        }
      }
      return builder.build();
    }

    /** Module scopes from the dependencies declaring or augmenting {@code name}. */
    <T extends TsNamedDecl> ImmutableList<Resolved<T>> searchDepModules(
        TsIdentModule name, Picker<T> picker, List<TsIdent> fragments) {
      ImmutableList.Builder<Resolved<T>> results = ImmutableList.builder();
      for (Scoped depScope : orderedDepScopes()) {
        TsParsedFile file = (TsParsedFile) depScope.current;
        results.addAll(searchModulesOf(depScope, file, name, picker, fragments));
      }
      return results.build();
    }

    @Override
    public Root root() {
      return this;
    }

    @Override
    public TsLogger logger() {
      return logger;
    }

    @Override
    public ImmutableList<TsTree> stack() {
      return ImmutableList.of();
    }

    @Override
    public ImmutableMap<TsIdentSimple, TsTypeParam> tparams() {
      return ImmutableMap.of();
    }

    @Override
    public ImmutableSet<TsIdentSimple> tkeys() {
      return ImmutableSet.of();
    }

    @Override
    <T extends TsNamedDecl> ImmutableList<Resolved<T>> lookupInternal(
        Picker<T> picker, ImmutableList<TsIdent> wanted, LoopDetector loopDetector) {
      if (wanted.isEmpty() || loopDetector.including(wanted, this) == null) {
        return ImmutableList.of();
      }
      TsIdent first = wanted.get(0);
      List<TsIdent> rest = wanted.subList(1, wanted.size());

      if (first instanceof TsIdentLibrary lib) {
        Scoped depScope = depScopes.get().get(lib);
        if (depScope == null) {
          return ImmutableList.of();
        }
        return search(depScope, picker, (TsParsedFile) depScope.current, rest);
      }
      if (first instanceof TsIdentModule module) {
        return searchDepModules(module, picker, rest);
      }
      if (first instanceof TsIdentImport imported) {
        return searchDepModules(imported.from(), picker, rest);
      }
      if (first.equals(TsIdent.GLOBAL)) {
        ImmutableList.Builder<Resolved<T>> results = ImmutableList.builder();
        for (Scoped depScope : orderedDepScopes()) {
          results.addAll(
              searchGlobals(depScope, (TsParsedFile) depScope.current, picker, rest));
        }
        return results.build();
      }

      ImmutableList<Scoped> ordered = orderedDepScopes();
      if (!ordered.isEmpty() && ordered.get(0).current == deps.get(TsIdentLibrary.STD)) {
        Scoped std = ordered.get(0);
        ImmutableList<Resolved<T>> inStd =
            search(std, picker, (TsParsedFile) std.current, wanted);
        if (inStd.isEmpty()) {
          inStd = searchGlobals(std, (TsParsedFile) std.current, picker, wanted);
        }
        if (!inStd.isEmpty()) {
          return inStd;
        }
      }
      ImmutableList.Builder<Resolved<T>> results = ImmutableList.builder();
      for (Scoped depScope : ordered) {
        if (depScope.current == deps.get(TsIdentLibrary.STD)) {
          continue;
        }
        TsParsedFile file = (TsParsedFile) depScope.current;
        ImmutableList<Resolved<T>> found = search(depScope, picker, file, wanted);
        results.addAll(found.isEmpty() ? searchGlobals(depScope, file, picker, wanted) : found);
      }
      return results.build();
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return o instanceof Root that && libName.equals(that.libName);
    }

    @Override
    public int hashCode() {
      return libName.hashCode();
    }

    @Override
    public String toString() {
      return "TreeScope(" + libName.value() + ")";
    }
  }

  /** Module declarations and augmentations for {@code name} directly inside {@code file}. */
  private static <T extends TsNamedDecl> ImmutableList<Resolved<T>> searchModulesOf(
      TsTreeScope fileScope,
      TsContainer file,
      TsIdentModule name,
      Picker<T> picker,
      List<TsIdent> fragments) {
    ImmutableList.Builder<Resolved<T>> results = ImmutableList.builder();
    for (TsDeclModule module : file.modules()) {
      if (sameModule(name, module.name())) {
        results.addAll(search(fileScope.descend(module), picker, module, fragments));
      }
    }
    for (TsAugmentedModule module : file.augmentedModules()) {
      if (sameModule(name, module.name())) {
        results.addAll(search(fileScope.descend(module), picker, module, fragments));
      }
    }
    return results.build();
  }

  /** A scope inside a tree: {@code current} nested in {@code outer}. */
  public static final class Scoped extends TsTreeScope {
    private final TsTreeScope outer;
    final TsTree current;
    private final Supplier<ImmutableList<TsTree>> stack = Suppliers.memoize(this::computeStack);
    private final Supplier<ImmutableMap<TsIdentSimple, TsTypeParam>> tparams =
        Suppliers.memoize(this::computeTParams);
    private final Supplier<ImmutableSet<TsIdentSimple>> tkeys =
        Suppliers.memoize(this::computeTKeys);

    private Scoped(TsTreeScope outer, TsTree current) {
      this.outer = outer;
      this.current = current;
    }

    public TsTreeScope outer() {
      return outer;
    }

    public TsTree current() {
      return current;
    }

    @Override
    public Root root() {
      return outer.root();
    }

    @Override
    public TsLogger logger() {
      return root().logger().withContext(toString());
    }

    @Override
    public ImmutableList<TsTree> stack() {
      return stack.get();
    }

    @Override
    public ImmutableMap<TsIdentSimple, TsTypeParam> tparams() {
      return tparams.get();
    }

    @Override
    public ImmutableSet<TsIdentSimple> tkeys() {
      return tkeys.get();
    }

    private ImmutableList<TsTree> computeStack() {
      return ImmutableList.<TsTree>builder().add(current).addAll(outer.stack()).build();
    }

    private ImmutableMap<TsIdentSimple, TsTypeParam> computeTParams() {
      ImmutableList<TsTypeParam> own = tparamsOf(current);
      if (own.isEmpty()) {
        return outer.tparams();
      }
      Map<TsIdentSimple, TsTypeParam> merged = new LinkedHashMap<>(outer.tparams());
      for (TsTypeParam tparam : own) {
        merged.put(tparam.name(), tparam);
      }
      return ImmutableMap.copyOf(merged);
    }

    private ImmutableSet<TsIdentSimple> computeTKeys() {
      if (current instanceof TsMemberTypeMapped mapped) {
        return ImmutableSet.<TsIdentSimple>builder()
            .addAll(outer.tkeys())
            .add(mapped.key())
            .build();
      }
      return outer.tkeys();
    }

    private static ImmutableList<TsTypeParam> tparamsOf(TsTree tree) {
      if (tree instanceof TsDeclClass c) {
        return c.tparams();
      } else if (tree instanceof TsDeclInterface i) {
        return i.tparams();
      } else if (tree instanceof TsDeclTypeAlias a) {
        return a.tparams();
      } else if (tree instanceof TsFunSig sig) {
        return sig.tparams();
      } else if (tree instanceof TsTypeInfer infer) {
        return ImmutableList.of(infer.tparam());
      }
      return ImmutableList.of();
    }

    /** The nearest enclosing parsed-file scope, or the root when there is none. */
    private TsTreeScope fileScope() {
      TsTreeScope scope = this;
      while (scope instanceof Scoped scoped) {
        if (scoped.current instanceof TsParsedFile) {
          return scoped;
        }
        scope = scoped.outer;
      }
      return scope;
    }

    @Override
    <T extends TsNamedDecl> ImmutableList<Resolved<T>> lookupInternal(
        Picker<T> picker, ImmutableList<TsIdent> wanted, LoopDetector loopDetector) {
      LoopDetector ld = loopDetector.including(wanted, this);
      if (wanted.isEmpty() || ld == null) {
        return ImmutableList.of();
      }
      TsIdent first = wanted.get(0);
      List<TsIdent> rest = wanted.subList(1, wanted.size());

      if (first.equals(root().libName)) {
        TsTreeScope file = fileScope();
        if (file instanceof Scoped scoped) {
          return search(scoped, picker, (TsParsedFile) scoped.current, rest);
        }
        return ImmutableList.of();
      }
      if (first instanceof TsIdentModule || first instanceof TsIdentImport) {
        TsIdentModule module =
            first instanceof TsIdentImport imported ? imported.from() : (TsIdentModule) first;
        return lookupModule(module, picker, rest);
      }
      if (first.equals(TsIdent.GLOBAL)) {
        ImmutableList.Builder<Resolved<T>> results = ImmutableList.builder();
        if (fileScope() instanceof Scoped file) {
          results.addAll(searchGlobals(file, (TsParsedFile) file.current, picker, rest));
        }
        results.addAll(root().lookupInternal(picker, wanted, ld));
        return results.build();
      }

      ImmutableList<Resolved<T>> found = lookupLocal(picker, wanted);
      if (found.isEmpty() && current instanceof TsParsedFile file) {
        found = searchGlobals(this, file, picker, wanted);
      }
      if (!found.isEmpty()) {
        return found;
      }
      return outer.lookupInternal(picker, wanted, ld);
    }

    private <T extends TsNamedDecl> ImmutableList<Resolved<T>> lookupLocal(
        Picker<T> picker, ImmutableList<TsIdent> wanted) {
      if (!(current instanceof TsContainer container)) {
        return ImmutableList.of();
      }
      ImmutableList<Resolved<T>> found = search(this, picker, container, wanted);
      if (!found.isEmpty()) {
        return found;
      }
      // A module sees what its augmentations add, and an augmentation sees the module.
      if (current instanceof TsDeclModule module) {
        return otherModuleParts(module.name(), picker, wanted);
      }
      if (current instanceof TsAugmentedModule module) {
        return otherModuleParts(module.name(), picker, wanted);
      }
      return ImmutableList.of();
    }

    private <T extends TsNamedDecl> ImmutableList<Resolved<T>> otherModuleParts(
        TsIdentModule name, Picker<T> picker, List<TsIdent> wanted) {
      List<Resolved<T>> results = new ArrayList<>();
      for (Resolved<T> r : lookupModule(name, picker, wanted)) {
        if (!isInside(r.scope(), current)) {
          results.add(r);
        }
      }
      return ImmutableList.copyOf(results);
    }

    private static boolean isInside(TsTreeScope scope, TsTree tree) {
      for (TsTree t : scope.stack()) {
        if (t == tree) {
          return true;
        }
      }
      return false;
    }

    private <T extends TsNamedDecl> ImmutableList<Resolved<T>> lookupModule(
        TsIdentModule name, Picker<T> picker, List<TsIdent> rest) {
      ImmutableList.Builder<Resolved<T>> results = ImmutableList.builder();
      if (fileScope() instanceof Scoped file) {
        results.addAll(searchModulesOf(file, (TsParsedFile) file.current, name, picker, rest));
      }
      results.addAll(root().searchDepModules(name, picker, rest));
      return results.build();
    }

    @Override
    public boolean equals(@Nullable Object o) {
      if (this == o) {
        return true;
      }
      return o instanceof Scoped that && current == that.current && outer.equals(that.outer);
    }

    @Override
    public int hashCode() {
      return 31 * outer.hashCode() + System.identityHashCode(current);
    }

    @Override
    public String toString() {
      List<String> names = new ArrayList<>();
      for (TsTree tree : Lists.reverse(stack())) {
        names.add(describe(tree));
      }
      return "TreeScope(" + root().libName.value() + ": " + String.join(" / ", names) + ")";
    }

    private static String describe(TsTree tree) {
      if (tree instanceof TsNamedDecl named) {
        return named.name().value();
      } else if (tree instanceof TsDeclModule module) {
        return module.name().value();
      } else if (tree instanceof TsAugmentedModule module) {
        return module.name().value();
      } else if (tree instanceof TsParsedFile) {
        return "file";
      }
      return tree.getClass().getSimpleName();
    }
  }
}
