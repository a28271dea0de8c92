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

/**
 * An identifier. Equality is structural on the kind and payload.
 *
 * <p>The reserved identifiers are simple identifiers with names that cannot occur in source.
 */
public sealed interface TsIdent
    permits TsIdentSimple, TsIdentImport, TsIdentModule, TsIdentLibrary {

  TsIdentSimple THIS = new TsIdentSimple("this");
  TsIdentSimple APPLY = new TsIdentSimple("<apply>");
  TsIdentSimple GLOBAL = new TsIdentSimple("<global>");
  TsIdentSimple DESTRUCTURED = new TsIdentSimple("<destructured>");
  TsIdentSimple UPDATE = new TsIdentSimple("update");
  TsIdentSimple PROTOTYPE = new TsIdentSimple("prototype");
  TsIdentSimple CONSTRUCTOR = new TsIdentSimple("constructor");
  TsIdentSimple DEFAULT = new TsIdentSimple("default");
  /** The value side of a class/namespace or function/namespace merge. */
  TsIdentSimple NAMESPACED = new TsIdentSimple("^");
  TsIdentSimple CLASS = new TsIdentSimple("Class");
  TsIdentSimple SYMBOL = new TsIdentSimple("Symbol");
  TsIdentSimple WILDCARD = new TsIdentSimple("*");
  TsIdentSimple DUMMY = new TsIdentSimple("dummy");

  String value();

  static TsIdentSimple simple(String value) {
    return new TsIdentSimple(value);
  }
}
