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
import java.util.stream.Collectors;

/** Renders types as TypeScript source, for comments and diagnostics. */
public final class TsTypeFormatter {

  private TsTypeFormatter() {}

  public static String format(TsType type) {
    if (type instanceof TsTypeRef ref) {
      return ref.name().asString() + typeArgs(ref.tparams());
    } else if (type instanceof TsTypeLiteral lit) {
      return lit.literal() instanceof TsLiteral.Str
          ? "'" + lit.literal().value() + "'"
          : lit.literal().value();
    } else if (type instanceof TsTypeObject obj) {
      return obj.members().isEmpty()
          ? "{}"
          : join(obj.members(), TsTypeFormatter::member, "{", "; ", "}");
    } else if (type instanceof TsTypeFunction fn) {
      return sig(fn.signature(), " => ");
    } else if (type instanceof TsTypeConstructor ctor) {
      return (ctor.isAbstract() ? "abstract " : "") + "new " + format(ctor.signature());
    } else if (type instanceof TsTypeIs is) {
      return is.ident().value() + " is " + format(is.tpe());
    } else if (type instanceof TsTypeAsserts asserts) {
      return "asserts "
          + asserts.ident().value()
          + (asserts.isOpt() == null ? "" : " is " + format(asserts.isOpt()));
    } else if (type instanceof TsTypeTuple tuple) {
      return join(
          tuple.elems(),
          e -> (e.label() == null ? "" : e.label().value() + ": ") + format(e.tpe()),
          "[",
          ", ",
          "]");
    } else if (type instanceof TsTypeQuery query) {
      return "typeof " + query.expr().asString();
    } else if (type instanceof TsTypeRepeated repeated) {
      return "..." + format(repeated.underlying());
    } else if (type instanceof TsTypeKeyOf keyOf) {
      return "keyof " + format(keyOf.key());
    } else if (type instanceof TsTypeLookup lookup) {
      return format(lookup.from()) + "[" + format(lookup.key()) + "]";
    } else if (type instanceof TsTypeThis) {
      return "this";
    } else if (type instanceof TsTypeIntersect intersect) {
      return join(intersect.types(), TsTypeFormatter::format, "", " & ", "");
    } else if (type instanceof TsTypeUnion union) {
      return join(union.types(), TsTypeFormatter::format, "", " | ", "");
    } else if (type instanceof TsTypeConditional cond) {
      return format(cond.pred()) + " ? " + format(cond.ifTrue()) + " : " + format(cond.ifFalse());
    } else if (type instanceof TsTypeExtends ext) {
      return format(ext.tpe()) + " extends " + format(ext.ext());
    } else if (type instanceof TsTypeInfer infer) {
      return "infer " + infer.tparam().name().value();
    }
    throw new IllegalArgumentException("Unknown type " + type);
  }

  public static String sig(TsFunSig sig, String resultSeparator) {
    String tparams =
        sig.tparams().isEmpty()
            ? ""
            : join(sig.tparams(), tp -> tp.name().value(), "<", ", ", ">");
    String params =
        join(
            sig.params(),
            p -> p.name().value() + (p.tpe() == null ? "" : ": " + format(p.tpe())),
            "(",
            ", ",
            ")");
    String result = sig.resultType() == null ? "" : resultSeparator + format(sig.resultType());
    return tparams + params + result;
  }

  private static String member(TsMember member) {
    if (member instanceof TsMemberProperty p) {
      return p.name().value() + (p.tpe() == null ? "" : ": " + format(p.tpe()));
    } else if (member instanceof TsMemberFunction f) {
      return f.name().value() + sig(f.signature(), ": ");
    } else if (member instanceof TsMemberCall call) {
      return sig(call.signature(), ": ");
    } else if (member instanceof TsMemberCtor ctor) {
      return "new " + sig(ctor.signature(), ": ");
    } else if (member instanceof TsMemberIndex index) {
      String indexing =
          index.indexing() instanceof TsMemberIndex.Dict dict
              ? dict.name().value() + ": " + format(dict.tpe())
              : ((TsMemberIndex.Single) index.indexing()).name().asString();
      return "["
          + indexing
          + "]"
          + (index.valueType() == null ? "" : ": " + format(index.valueType()));
    } else if (member instanceof TsMemberTypeMapped m) {
      return "[" + m.key().value() + " in " + format(m.from()) + "]: " + format(m.to());
    }
    throw new IllegalArgumentException("Unknown member " + member);
  }

  private static String typeArgs(ImmutableList<TsType> targs) {
    return targs.isEmpty() ? "" : join(targs, TsTypeFormatter::format, "<", ", ", ">");
  }

  private static <T> String join(
      ImmutableList<T> items, Function<T, String> f, String start, String sep, String end) {
    return items.stream().map(f).collect(Collectors.joining(sep, start, end));
  }
}
