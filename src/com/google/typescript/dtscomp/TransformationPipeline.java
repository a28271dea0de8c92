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
import com.google.typescript.dts.tree.TsIdentLibrary;
import com.google.typescript.dts.tree.TsParsedFile;
import java.util.logging.Logger;

/**
 * The ordered stages a declaration file goes through. Every stage starts from a fresh root scope,
 * so lookups always see the output of the stage before.
 */
public final class TransformationPipeline {
  private static final Logger logger = Logger.getLogger(TransformationPipeline.class.getName());

  static final String HANDLE_COMMON_JS_MODULES = "handleCommonJsModules";
  static final String MOVE_GLOBALS = "moveGlobals";
  static final String INFER_ENUM_TYPES = "inferEnumTypes";
  static final String REJIGGER_INTERSECTIONS = "rejiggerIntersections";
  static final String TYPE_ALIAS_INTERSECTION = "typeAliasIntersection";
  static final String SPLIT_METHODS = "splitMethods";
  static final String REMOVE_STUBS = "removeStubs";
  static final String DROP_PROPERTIES = "dropProperties";
  static final String RESOLVE_TYPE_QUERIES = "resolveTypeQueries";
  static final String INLINE_TRIVIAL = "inlineTrivial";
  static final String SIMPLIFY_PARENTS = "simplifyParents";
  static final String EXTRACT_CLASSES = "extractClasses";
  static final String LIBRARY_SPECIFIC = "librarySpecific";

  private final DtsOptions options;
  private final ImmutableList<NamedPass> passes;

  private TransformationPipeline(DtsOptions options, ImmutableList<NamedPass> passes) {
    this.options = options;
    this.passes = passes;
  }

  public static TransformationPipeline create(DtsOptions options) {
    return new TransformationPipeline(options, defaultPasses(options.getLibraryName()));
  }

  /** A pipeline running exactly {@code passes}, in order. */
  public static TransformationPipeline of(DtsOptions options, ImmutableList<NamedPass> passes) {
    return new TransformationPipeline(options, passes);
  }

  static ImmutableList<NamedPass> defaultPasses(TsIdentLibrary libName) {
    ImmutableList.Builder<NamedPass> passes = ImmutableList.builder();
    passes.add(NamedPass.of(HANDLE_COMMON_JS_MODULES, FilePass.of(HandleCommonJsModules.INSTANCE)));
    passes.add(NamedPass.of(MOVE_GLOBALS, (root, file) -> MoveGlobals.apply(file)));
    passes.add(NamedPass.of(INFER_ENUM_TYPES, FilePass.of(InferEnumTypes.INSTANCE)));
    passes.add(
        NamedPass.of(
            REJIGGER_INTERSECTIONS,
            (root, file) -> RejiggerIntersections.INSTANCE.visitTsParsedFile(null, file)));
    passes.add(NamedPass.of(TYPE_ALIAS_INTERSECTION, FilePass.of(TypeAliasIntersection.INSTANCE)));
    passes.add(NamedPass.of(SPLIT_METHODS, FilePass.of(SplitMethods.INSTANCE)));
    passes.add(NamedPass.of(REMOVE_STUBS, FilePass.of(RemoveStubs.INSTANCE)));
    passes.add(NamedPass.of(DROP_PROPERTIES, FilePass.of(DropProperties.INSTANCE)));
    passes.add(NamedPass.of(RESOLVE_TYPE_QUERIES, FilePass.of(ResolveTypeQueries.INSTANCE)));
    passes.add(NamedPass.of(INLINE_TRIVIAL, FilePass.of(InlineTrivial.INSTANCE)));
    passes.add(NamedPass.of(SIMPLIFY_PARENTS, FilePass.of(SimplifyParents.INSTANCE)));
    passes.add(NamedPass.of(EXTRACT_CLASSES, FilePass.of(ExtractClasses.INSTANCE)));
    TreeTransformationScopedChanges patch = LibrarySpecific.apply(libName);
    if (patch != null) {
      passes.add(
          NamedPass.builder()
              .setName(LIBRARY_SPECIFIC)
              .setCondition(DtsOptions::isLibrarySpecific)
              .setPass(FilePass.of(patch))
              .build());
    }
    return passes.build();
  }

  public ImmutableList<NamedPass> getPasses() {
    return passes;
  }

  /**
   * Runs every enabled stage over {@code file}.
   *
   * @throws DtsFatalError in pedantic mode, when a stage meets a name it cannot resolve
   */
  public TsParsedFile run(
      TsParsedFile file, ImmutableMap<TsIdentLibrary, TsParsedFile> deps, TsLogger tsLogger) {
    TsParsedFile current = file;
    for (NamedPass pass : passes) {
      if (!options.isPassEnabled(pass.getName()) || !pass.getCondition().test(options)) {
        logger.fine("Skipping " + pass.getName());
        continue;
      }
      logger.fine("Running " + pass.getName());
      TsTreeScope.Root root =
          TsTreeScope.create(
              options.getLibraryName(),
              options.isPedantic(),
              deps,
              tsLogger.withContext(pass.getName()));
      current = pass.getPass().process(root, current);
    }
    return current;
  }
}
