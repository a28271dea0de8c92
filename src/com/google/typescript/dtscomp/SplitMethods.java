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
import com.google.typescript.dts.tree.Comments;
import com.google.typescript.dts.tree.HasClassMembers;
import com.google.typescript.dts.tree.MethodType;
import com.google.typescript.dts.tree.TsContainer;
import com.google.typescript.dts.tree.TsContainerOrDecl;
import com.google.typescript.dts.tree.TsDeclFunction;
import com.google.typescript.dts.tree.TsFunParam;
import com.google.typescript.dts.tree.TsFunSig;
import com.google.typescript.dts.tree.TsMember;
import com.google.typescript.dts.tree.TsMemberCall;
import com.google.typescript.dts.tree.TsMemberCtor;
import com.google.typescript.dts.tree.TsMemberFunction;
import com.google.typescript.dts.tree.TsType;
import com.google.typescript.dts.tree.TsTypeLiteral;
import com.google.typescript.dts.tree.TsTypeRef;
import com.google.typescript.dts.tree.TsTypeRepeated;
import com.google.typescript.dts.tree.TsTypeUnion;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Expands a signature with union-typed parameters into one overload per combination of union
 * alternatives. Literal alternatives of a parameter stay together as a single union.
 *
 * <p>Signatures with more than {@value #MAX_PARAMS} parameters are left alone, as are signatures
 * that would expand into more than {@value #MAX_NUM} overloads. A union of {@value #MAX_NUM} or
 * more alternatives is not split.
 */
public final class SplitMethods {
  static final int MAX_PARAMS = 20;
  static final int MAX_NUM = 50;

  public static final TreeTransformation<TsTreeScope> INSTANCE =
      new SplitContainerFunctions().combine(new SplitClassMembers());

  private SplitMethods() {}

  private static final class SplitClassMembers extends TransformClassMembers {
    @Override
    protected ImmutableList<TsMember> newClassMembers(TsTreeScope scope, HasClassMembers x) {
      if (!x.members().stream().anyMatch(SplitMethods::isSplittable)) {
        return x.members();
      }
      ImmutableList.Builder<TsMember> result = ImmutableList.builder();
      for (TsMember member : x.members()) {
        if (member instanceof TsMemberCtor ctor && hasUnionType(ctor.signature())) {
          result.addAll(
              splitKeepingComments(ctor.signature(), ctor::withSignature, ctor.comments()));
        } else if (member instanceof TsMemberFunction fn
            && fn.methodType() == MethodType.NORMAL
            && hasUnionType(fn.signature())) {
          result.addAll(splitKeepingComments(fn.signature(), fn::withSignature, fn.comments()));
        } else if (member instanceof TsMemberCall call && hasUnionType(call.signature())) {
          result.addAll(
              splitKeepingComments(call.signature(), call::withSignature, call.comments()));
        } else {
          result.add(member);
        }
      }
      return result.build();
    }
  }

  private static final class SplitContainerFunctions extends TransformMembers {
    @Override
    protected ImmutableList<TsContainerOrDecl> newMembers(TsTreeScope scope, TsContainer x) {
      ImmutableList.Builder<TsContainerOrDecl> result = ImmutableList.builder();
      for (TsContainerOrDecl member : x.members()) {
        if (member instanceof TsDeclFunction fn && hasUnionType(fn.signature())) {
          ImmutableList<TsFunSig> sigs = split(fn.signature());
          for (int i = 0; i < sigs.size(); i++) {
            TsDeclFunction copy = fn.withSignature(sigs.get(i));
            result.add(i == 0 ? copy : copy.withComments(Comments.EMPTY));
          }
        } else {
          result.add(member);
        }
      }
      return result.build();
    }
  }

  private static boolean isSplittable(TsMember member) {
    if (member instanceof TsMemberCtor ctor) {
      return hasUnionType(ctor.signature());
    } else if (member instanceof TsMemberFunction fn) {
      return fn.methodType() == MethodType.NORMAL && hasUnionType(fn.signature());
    } else if (member instanceof TsMemberCall call) {
      return hasUnionType(call.signature());
    }
    return false;
  }

  /**
   * Splits {@code sig} and wraps each result. Only the first overload keeps the comments of the
   * member.
   */
  private static <M extends TsMember> ImmutableList<TsMember> splitKeepingComments(
      TsFunSig sig, Function<TsFunSig, M> wrap, Comments comments) {
    ImmutableList<TsFunSig> sigs = split(sig);
    ImmutableList.Builder<TsMember> result = ImmutableList.builder();
    for (int i = 0; i < sigs.size(); i++) {
      M member = wrap.apply(sigs.get(i));
      result.add(i == 0 ? member : withoutComments(member));
    }
    return result.build();
  }

  private static TsMember withoutComments(TsMember member) {
    if (member instanceof TsMemberCtor ctor) {
      return new TsMemberCtor(Comments.EMPTY, ctor.level(), ctor.signature());
    } else if (member instanceof TsMemberCall call) {
      return new TsMemberCall(Comments.EMPTY, call.level(), call.signature());
    } else if (member instanceof TsMemberFunction fn) {
      return new TsMemberFunction(
          Comments.EMPTY,
          fn.level(),
          fn.name(),
          fn.methodType(),
          fn.signature(),
          fn.isStatic(),
          fn.isReadOnly());
    }
    return member;
  }

  static boolean hasUnionType(TsFunSig sig) {
    for (TsFunParam param : sig.params()) {
      TsType tpe = param.tpe();
      if (tpe instanceof TsTypeUnion
          || (tpe instanceof TsTypeRepeated rep && rep.underlying() instanceof TsTypeUnion)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the overloads {@code sig} expands into, ordered by parameter count. */
  static ImmutableList<TsFunSig> split(TsFunSig sig) {
    if (sig.params().size() > MAX_PARAMS) {
      return ImmutableList.of(sig);
    }
    List<ImmutableList<TsFunParam>> possibilities = new ArrayList<>();
    long num = 1;
    for (TsFunParam param : sig.params()) {
      ImmutableList<TsFunParam> alternatives = alternatives(param);
      possibilities.add(alternatives);
      num *= alternatives.size();
    }
    if (num > MAX_NUM) {
      return ImmutableList.of(sig);
    }

    List<List<TsFunParam>> combinations = new ArrayList<>();
    combinations.add(new ArrayList<>());
    for (ImmutableList<TsFunParam> alternatives : possibilities) {
      List<List<TsFunParam>> next = new ArrayList<>();
      for (TsFunParam head : alternatives) {
        for (List<TsFunParam> existing : combinations) {
          List<TsFunParam> extended = new ArrayList<>(existing);
          extended.add(head);
          next.add(extended);
        }
      }
      combinations = next;
    }

    List<TsFunSig> result = new ArrayList<>();
    for (List<TsFunParam> params : combinations) {
      result.add(sig.withParams(dropTrailingUndefineds(params)));
    }
    result.sort(Comparator.comparingInt(s -> s.params().size()));
    return ImmutableList.copyOf(result);
  }

  private static ImmutableList<TsFunParam> alternatives(TsFunParam param) {
    if (param.tpe() instanceof TsTypeRepeated rep && rep.underlying() instanceof TsTypeUnion u) {
      ImmutableList.Builder<TsFunParam> result = ImmutableList.builder();
      for (TsType t : splitUnion(u)) {
        result.add(param.withType(new TsTypeRepeated(t)));
      }
      return result.build();
    }
    if (param.tpe() instanceof TsTypeUnion u) {
      ImmutableList.Builder<TsFunParam> result = ImmutableList.builder();
      for (TsType t : splitUnion(u)) {
        result.add(param.withType(t));
      }
      return result.build();
    }
    return ImmutableList.of(param);
  }

  /** Non-literal alternatives one by one, followed by a union of all the literal alternatives. */
  private static ImmutableList<TsType> splitUnion(TsTypeUnion union) {
    if (union.types().size() >= MAX_NUM) {
      return ImmutableList.of(union);
    }
    ImmutableList.Builder<TsType> result = ImmutableList.builder();
    ImmutableList.Builder<TsType> literals = ImmutableList.builder();
    for (TsType t : union.types()) {
      if (t instanceof TsTypeLiteral) {
        literals.add(t);
      } else {
        result.add(t);
      }
    }
    ImmutableList<TsType> lits = literals.build();
    if (!lits.isEmpty()) {
      result.add(TsTypeUnion.simplified(lits));
    }
    return result.build();
  }

  private static ImmutableList<TsFunParam> dropTrailingUndefineds(List<TsFunParam> params) {
    int end = params.size();
    while (end > 0 && isUndefined(params.get(end - 1).tpe())) {
      end--;
    }
    return ImmutableList.copyOf(params.subList(0, end));
  }

  private static boolean isUndefined(TsType tpe) {
    return tpe instanceof TsTypeRef ref
        && ref.tparams().isEmpty()
        && (ref.name().equals(TsTypeRef.UNDEFINED.name())
            || ref.name().equals(TsTypeRef.NULL.name()));
  }
}
