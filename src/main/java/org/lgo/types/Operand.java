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

import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast.Expr;
import org.lgo.types.TypeAndValue.Mode;

/**
 * The result of checking an expression. An operand whose {@link #mode} is null is invalid: an
 * error has already been reported and the caller should not report another one.
 */
final class Operand {
  final Expr expr;
  @Nullable Mode mode;
  Type type;

  /** Set if the operand is the name of a builtin function. */
  @Nullable Builtin builtin;

  Operand(Expr expr, @Nullable Mode mode, Type type) {
    this.expr = expr;
    this.mode = mode;
    this.type = type;
  }

  static Operand invalid(Expr expr) {
    return new Operand(expr, null, Types.INVALID);
  }

  boolean isInvalid() {
    return mode == null;
  }

  void invalidate() {
    mode = null;
    type = Types.INVALID;
  }

  boolean isConstant() {
    return mode == Mode.CONSTANT;
  }

  boolean isNil() {
    return type == Types.UNTYPED_NIL;
  }

  /** Describes the operand for error messages, e.g. {@code x (variable of type int)}. */
  String describe(Checker checker) {
    String text = expr.toString();
    if (mode == null) {
      return text + " (invalid operand)";
    }
    if (isNil()) {
      return "nil";
    }
    switch (mode) {
      case NOVALUE:
        return text + " (no value)";
      case BUILTIN:
        return text + " (built-in)";
      case TYPE:
        return text + " (type)";
      case CONSTANT:
        if (Types.isUntyped(type)) {
          return text + " (" + checker.typeString(type) + " constant)";
        }
        return text + " (constant of type " + checker.typeString(type) + ")";
      case VARIABLE:
      case MAPINDEX:
        return text + " (variable of type " + checker.typeString(type) + ")";
      default:
        return text + " (value of type " + checker.typeString(type) + ")";
    }
  }
}
