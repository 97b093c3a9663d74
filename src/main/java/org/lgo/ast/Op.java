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

package org.lgo.ast;

import org.jspecify.annotations.Nullable;

/** The operators that may appear in unary, binary, and assignment nodes. */
public enum Op {
  // Binary operators, with their precedence (higher binds tighter).
  LOR("||", 1),
  LAND("&&", 2),
  EQL("==", 3),
  NEQ("!=", 3),
  LSS("<", 3),
  LEQ("<=", 3),
  GTR(">", 3),
  GEQ(">=", 3),
  ADD("+", 4),
  SUB("-", 4),
  OR("|", 4),
  XOR("^", 4),
  MUL("*", 5),
  QUO("/", 5),
  REM("%", 5),
  SHL("<<", 5),
  SHR(">>", 5),
  AND("&", 5),

  // Unary-only operators
  NOT("!", 0),

  // Assignment operators
  ASSIGN("=", 0),
  DEFINE(":=", 0),
  ADD_ASSIGN("+=", 0),
  SUB_ASSIGN("-=", 0),
  MUL_ASSIGN("*=", 0),
  QUO_ASSIGN("/=", 0),
  REM_ASSIGN("%=", 0);

  public final String text;

  /** Binary precedence, or 0 if this is not a binary operator. */
  public final int precedence;

  Op(String text, int precedence) {
    this.text = text;
    this.precedence = precedence;
  }

  public boolean isComparison() {
    return precedence == 3;
  }

  /** For a compound assignment operator ({@code +=} etc.), returns the binary operator it applies. */
  public @Nullable Op binaryOp() {
    switch (this) {
      case ADD_ASSIGN:
        return ADD;
      case SUB_ASSIGN:
        return SUB;
      case MUL_ASSIGN:
        return MUL;
      case QUO_ASSIGN:
        return QUO;
      case REM_ASSIGN:
        return REM;
      default:
        return null;
    }
  }

  @Override
  public String toString() {
    return text;
  }
}
