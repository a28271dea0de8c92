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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** The name of a module, such as {@code "lodash/fp"} or {@code "@angular/core"}. */
public record TsIdentModule(@Nullable String scope, ImmutableList<String> fragments)
    implements TsIdent {

  public static TsIdentModule simple(String value) {
    return new TsIdentModule(null, ImmutableList.of(value));
  }

  /** Parses a module name as it appears in an import or module declaration. */
  public static TsIdentModule parse(String name) {
    List<String> parts = Splitter.on('/').splitToList(name);
    if (name.startsWith("@") && parts.size() > 1) {
      return new TsIdentModule(
          parts.get(0).substring(1), ImmutableList.copyOf(parts.subList(1, parts.size())));
    }
    return new TsIdentModule(null, ImmutableList.copyOf(parts));
  }

  public static TsIdentModule fromLibrary(TsIdentLibrary lib) {
    if (lib instanceof TsIdentLibraryScoped scoped) {
      return new TsIdentModule(scoped.scope(), ImmutableList.of(scoped.name()));
    }
    return simple(lib.value());
  }

  /** The same module with {@code index} appended, or with a trailing {@code index} removed. */
  public @Nullable TsIdentModule indexAlternative() {
    if (fragments.isEmpty()) {
      return null;
    }
    if (fragments.get(fragments.size() - 1).equals("index")) {
      if (fragments.size() == 1) {
        return null;
      }
      return new TsIdentModule(scope, fragments.subList(0, fragments.size() - 1));
    }
    return new TsIdentModule(
        scope, ImmutableList.<String>builder().addAll(fragments).add("index").build());
  }

  @Override
  public String value() {
    String joined = Joiner.on('/').join(fragments);
    return scope == null ? joined : "@" + scope + "/" + joined;
  }

  @Override
  public String toString() {
    return value();
  }
}
