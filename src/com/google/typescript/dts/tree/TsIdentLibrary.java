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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** The name of a library, i.e. an npm package or a builtin pseudo library. */
public sealed interface TsIdentLibrary extends TsIdent
    permits TsIdentLibrarySimple, TsIdentLibraryScoped {

  TsIdentLibrarySimple STD = new TsIdentLibrarySimple("std");
  TsIdentLibrarySimple NODE = new TsIdentLibrarySimple("node");
  TsIdentLibrarySimple DUMMY_LIBRARY = new TsIdentLibrarySimple("dummyLibrary");

  /** A name with its {@code @types/} prefix and any scope separators stripped. */
  String name();

  /**
   * Parses a package name. {@code @types/foo} becomes {@code foo}, {@code @types/scope__foo} and
   * {@code scope__foo} become {@code @scope/foo}.
   */
  static TsIdentLibrary of(String str) {
    Matcher scoped = Holder.SCOPED.matcher(str);
    if (scoped.matches()) {
      String scope = scoped.group(1);
      String name = scoped.group(2);
      if (scope.equals("types")) {
        return of(name);
      }
      return new TsIdentLibraryScoped(scope, name);
    }
    Matcher dunder = Holder.DUNDER.matcher(str);
    if (dunder.matches()) {
      return new TsIdentLibraryScoped(dunder.group(1), dunder.group(2));
    }
    return new TsIdentLibrarySimple(str);
  }

  /** Compiled patterns. */
  final class Holder {
    static final Pattern SCOPED = Pattern.compile("@([^/]+)/(.+)");
    static final Pattern DUNDER = Pattern.compile("(.+?)__(.+)");

    private Holder() {}
  }
}
