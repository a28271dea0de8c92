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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.stream.Collectors;

/**
 * A qualified name: a non-empty, dotted sequence of identifiers such as {@code A.B.C}. Equal by
 * sequence equality.
 */
public record TsQIdent(ImmutableList<TsIdent> parts) {

  public static final TsQIdent ANY = ofStrings("any");
  public static final TsQIdent BIGINT = ofStrings("bigint");
  public static final TsQIdent NUMBER = ofStrings("number");
  public static final TsQIdent BOOLEAN = ofStrings("boolean");
  public static final TsQIdent NEVER = ofStrings("never");
  public static final TsQIdent NULL = ofStrings("null");
  public static final TsQIdent OBJECT = ofStrings("object");
  public static final TsQIdent STRING = ofStrings("string");
  public static final TsQIdent SYMBOL = ofStrings("symbol");
  public static final TsQIdent UNDEFINED = ofStrings("undefined");
  public static final TsQIdent UNKNOWN = ofStrings("unknown");
  public static final TsQIdent VOID = ofStrings("void");

  public static final TsQIdent ARRAY = ofStrings("Array");
  public static final TsQIdent FUNCTION = ofStrings("Function");
  public static final TsQIdent GLOBAL_THIS = ofStrings("globalThis");

  public static final ImmutableSet<TsQIdent> PRIMITIVES =
      ImmutableSet.of(
          ANY, BIGINT, NUMBER, BOOLEAN, NEVER, NULL, OBJECT, STRING, SYMBOL, UNDEFINED, UNKNOWN,
          VOID);

  public TsQIdent {
    checkArgument(!parts.isEmpty(), "Empty qualified name");
  }

  public static TsQIdent of(TsIdent... parts) {
    return new TsQIdent(ImmutableList.copyOf(parts));
  }

  public static TsQIdent of(Iterable<? extends TsIdent> parts) {
    return new TsQIdent(ImmutableList.copyOf(parts));
  }

  public static TsQIdent ofStrings(String... names) {
    ImmutableList.Builder<TsIdent> builder = ImmutableList.builder();
    for (String name : names) {
      builder.add(new TsIdentSimple(name));
    }
    return new TsQIdent(builder.build());
  }

  public TsQIdent plus(TsIdent ident) {
    return new TsQIdent(ImmutableList.<TsIdent>builder().addAll(parts).add(ident).build());
  }

  public TsQIdent plusAll(Iterable<? extends TsIdent> idents) {
    return new TsQIdent(ImmutableList.<TsIdent>builder().addAll(parts).addAll(idents).build());
  }

  public TsIdent first() {
    return parts.get(0);
  }

  public TsIdent last() {
    return parts.get(parts.size() - 1);
  }

  public int size() {
    return parts.size();
  }

  public boolean isPrimitive() {
    return PRIMITIVES.contains(this);
  }

  /** Whether this name starts with all the parts of {@code prefix}. */
  public boolean startsWith(TsQIdent prefix) {
    return parts.size() >= prefix.parts.size()
        && parts.subList(0, prefix.parts.size()).equals(prefix.parts);
  }

  public String asString() {
    return parts.stream().map(TsIdent::value).collect(Collectors.joining("."));
  }

  @Override
  public String toString() {
    return asString();
  }
}
