/*
 * Copyright 2025 The Retrospect Authors
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


package org.lgo.types;

import java.util.List;
import org.lgo.ast.Ast.CallExpr;
import org.lgo.ast.Ast.Expr;
import org.lgo.types.TypeAndValue.Mode;
import org.lgo.types.Types.BasicKind;
import org.lgo.types.Types.MapType;
import org.lgo.types.Types.Pointer;
import org.lgo.types.Types.Slice;
import org.lgo.types.Types.Tuple;

/** Checks calls of the builtin functions. */
final class BuiltinCall {
  private final ExprChecker exprs;
  private final Checker checker;
  private final CallExpr call;
  private final List<Expr> args;
  private final String name;

  private BuiltinCall(ExprChecker exprs, Checker checker, CallExpr call, Builtin builtin) {
    this.exprs = exprs;
    this.checker = checker;
    this.call = call;
    this.args = call.args;
    this.name = builtin.name;
  }

  static Operand check(ExprChecker exprs, Checker checker, CallExpr call, Builtin builtin) {
    BuiltinCall bc = new BuiltinCall(exprs, checker, call, builtin);
    if (call.hasEllipsis && builtin.id != Builtin.Id.APPEND) {
      checker.error(call, "invalid use of ... with built-in %s", builtin.name);
      exprs.useAll(call.args, 0);
      return Operand.invalid(call);
    }
    switch (builtin.id) {
      case LEN:
      case CAP:
        return bc.lenOrCap(builtin.id == Builtin.Id.LEN);
      case APPEND:
        return bc.append();
      case DELETE:
        return bc.delete();
      case MAKE:
        return bc.make();
      case NEW:
        return bc.newPointer();
      case PANIC:
        return bc.panic();
      case RECOVER:
        return bc.argCount(0, 0) ? bc.result(Mode.VALUE, Types.EMPTY_INTERFACE) : bc.invalid(0);
    }
    throw new AssertionError(builtin.id);
  }

  /**
   * Returns true if the number of arguments is between {@code min} and {@code max}; otherwise
   * reports an error.
   */
  private boolean argCount(int min, int max) {
    int n = args.size();
    if (n < min) {
      checker.error(
          call, "not enough arguments for %s (expected %d, found %d)", call, min, n);
      return false;
    } else if (n > max) {
      checker.error(
          args.get(max), "too many arguments for %s (expected %d, found %d)", call, max, n);
      return false;
    }
    return true;
  }

  private Operand result(Mode mode, Type type) {
    return new Operand(call, mode, type);
  }

  /** Checks the arguments from {@code start} on for their uses, and returns an invalid operand. */
  private Operand invalid(int start) {
    exprs.useAll(args, start);
    return Operand.invalid(call);
  }

  private Operand lenOrCap(boolean isLen) {
    if (!argCount(1, 1)) {
      return invalid(0);
    }
    Operand x = exprs.value(args.get(0), null);
    if (x.isInvalid()) {
      return Operand.invalid(call);
    }
    Type u = x.type.underlying();
    boolean isString = Predicates.isString(u);
    boolean ok = (u instanceof Slice) || (isLen && (isString || u instanceof MapType));
    if (!ok) {
      checker.error(
          args.get(0), "invalid argument: %s for built-in %s", x.describe(checker), name);
      return Operand.invalid(call);
    }
    exprs.convertUntyped(x, Types.STRING);
    return result((isString && x.isConstant()) ? Mode.CONSTANT : Mode.VALUE, Types.INT);
  }

  private Operand append() {
    if (!argCount(1, Integer.MAX_VALUE)) {
      return invalid(0);
    }
    Operand s = exprs.value(args.get(0), null);
    if (s.isInvalid()) {
      return invalid(1);
    }
    if (s.isNil()) {
      checker.error(
          args.get(0), "first argument to append must be a typed slice; have untyped nil");
      return invalid(1);
    }
    if (!(s.type.underlying() instanceof Slice)) {
      checker.error(args.get(0), "invalid argument: %s is not a slice", s.describe(checker));
      return invalid(1);
    }
    Type elem = ((Slice) s.type.underlying()).elem;
    String context = "argument to append";
    if (call.hasEllipsis) {
      if (args.size() != 2) {
        checker.error(call, "can only use ... with final argument in list");
        return invalid(1);
      }
      Operand y = exprs.value(args.get(1), null);
      if (Predicates.isString(y.type) && Types.isBasic(elem.underlying(), BasicKind.UINT8)) {
        exprs.convertUntyped(y, Types.STRING);
      } else {
        exprs.assignment(y, s.type, context);
      }
    } else {
      for (int i = 1; i < args.size(); i++) {
        exprs.assignment(exprs.value(args.get(i), elem), elem, context);
      }
    }
    return result(Mode.VALUE, s.type);
  }

  private Operand delete() {
    if (!argCount(2, 2)) {
      return invalid(0);
    }
    Operand m = exprs.value(args.get(0), null);
    if (m.isInvalid()) {
      return invalid(1);
    }
    if (!(m.type.underlying() instanceof MapType)) {
      checker.error(args.get(0), "invalid argument: %s is not a map", m.describe(checker));
      return invalid(1);
    }
    MapType mt = (MapType) m.type.underlying();
    exprs.assignment(exprs.value(args.get(1), mt.key), mt.key, "argument to delete");
    return result(Mode.NOVALUE, Tuple.EMPTY);
  }

  private Operand make() {
    if (!argCount(1, Integer.MAX_VALUE)) {
      return invalid(0);
    }
    Type t = exprs.typeExpr(args.get(0));
    if (t == Types.INVALID) {
      return invalid(1);
    }
    Type u = t.underlying();
    int min;
    if (u instanceof Slice) {
      min = 2;
    } else if (u instanceof MapType) {
      min = 1;
    } else {
      checker.error(
          args.get(0),
          "invalid argument: cannot make %s; type must be slice or map",
          args.get(0));
      return invalid(1);
    }
    if (!argCount(min, min + 1)) {
      return invalid(1);
    }
    for (int i = 1; i < args.size(); i++) {
      Operand size = exprs.value(args.get(i), null);
      if (size.isInvalid()) {
        continue;
      }
      if (!Predicates.isInteger(size.type)) {
        checker.error(
            args.get(i), "cannot convert %s to type int", size.describe(checker));
      } else {
        exprs.convertUntyped(size, Types.INT);
      }
    }
    return result(Mode.VALUE, t);
  }

  private Operand newPointer() {
    if (!argCount(1, 1)) {
      return invalid(0);
    }
    Type t = exprs.typeExpr(args.get(0));
    return (t == Types.INVALID) ? Operand.invalid(call) : result(Mode.VALUE, new Pointer(t));
  }

  private Operand panic() {
    if (!argCount(1, 1)) {
      return invalid(0);
    }
    Operand x = exprs.value(args.get(0), null);
    exprs.assignment(x, Types.EMPTY_INTERFACE, "argument to panic");
    return result(Mode.NOVALUE, Tuple.EMPTY);
  }
}
