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
import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * The subset of expressions found in declaration files: enum initializers and constant
 * initializers.
 */
public sealed interface TsExpr extends TsTree
    permits TsExpr.Ref,
        TsExpr.Literal,
        TsExpr.Call,
        TsExpr.Unary,
        TsExpr.BinaryOp,
        TsExpr.Cast,
        TsExpr.ArrayOf {

  @Override
  default Comments comments() {
    return Comments.EMPTY;
  }

  /** A reference to a value. */
  record Ref(TsQIdent value) implements TsExpr {}

  /** A literal. */
  record Literal(TsLiteral value) implements TsExpr {
    public static Literal num(String value) {
      return new Literal(new TsLiteral.Num(value));
    }

    public static Literal str(String value) {
      return new Literal(new TsLiteral.Str(value));
    }
  }

  /** {@code function(params...)} */
  record Call(TsExpr function, ImmutableList<TsExpr> params) implements TsExpr {}

  /** {@code op expr} */
  record Unary(String op, TsExpr expr) implements TsExpr {}

  /** {@code one op two} */
  record BinaryOp(TsExpr one, String op, TsExpr two) implements TsExpr {}

  /** {@code expr as tpe} */
  record Cast(TsExpr expr, TsType tpe) implements TsExpr {}

  /** {@code [expr]} */
  record ArrayOf(TsExpr expr) implements TsExpr {}

  /** Renders an expression the way it would be written in source. */
  static String format(TsExpr expr) {
    if (expr instanceof Ref ref) {
      return ref.value().asString();
    } else if (expr instanceof Literal lit) {
      return formatLiteral(lit.value());
    } else if (expr instanceof Call call) {
      return format(call.function())
          + call.params().stream().map(TsExpr::format).collect(Collectors.joining(", ", "(", ")"));
    } else if (expr instanceof Unary unary) {
      return unary.op() + format(unary.expr());
    } else if (expr instanceof BinaryOp bin) {
      return format(bin.one()) + " " + bin.op() + " " + format(bin.two());
    } else if (expr instanceof Cast cast) {
      return format(cast.expr()) + " as " + TsTypeFormatter.format(cast.tpe());
    } else if (expr instanceof ArrayOf array) {
      return "[" + format(array.expr()) + "]";
    }
    throw new IllegalArgumentException("Unknown expression " + expr);
  }

  private static String formatLiteral(TsLiteral literal) {
    if (literal instanceof TsLiteral.Str str) {
      return "\"" + str.value() + "\"";
    } else if (literal instanceof TsLiteral.Num num) {
      String value = num.value();
      if (isLargeInteger(value)) {
        return value + ".0";
      }
      return value;
    }
    return literal.value();
  }

  private static boolean isLargeInteger(String value) {
    if (value.contains(".") || value.contains("e") || value.contains("E")) {
      return false;
    }
    try {
      return new BigDecimal(value).compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
