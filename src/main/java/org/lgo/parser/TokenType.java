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

package org.lgo.parser;

import com.google.common.collect.ImmutableMap;
import org.antlr.v4.runtime.Vocabulary;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Op;

/**
 * A statics-only class providing convenient access to ANTLR token types (which are just ints).
 *
 * <p>The generated lexer has a constant for each symbolic token name, but to map token types to
 * the operators they denote we build maps once from the
 * lexer's Vocabulary.
 */
class TokenType {

  // Statics only
  private TokenType() {}

  /**
   * A Map from token name to token type. Token names are either literals enclosed in single quotes
   * (e.g. "{@code '+'}") or symbolic names (e.g. "{@code IDENTIFIER}").
   */
  static final ImmutableMap<String, Integer> MAP;

  /** Maps token types that are binary operators to the corresponding Op. */
  private static final ImmutableMap<Integer, Op> BINARY_OPS;

  /** Maps token types that are assignment operators to the corresponding Op. */
  private static final ImmutableMap<Integer, Op> ASSIGN_OPS;

  static {
    // The ANTLR Vocabulary class provides a way to map token types to their names.  We count on
    // token types being densely allocated starting from 1 to find them all.
    Vocabulary vocab = LgoLexer.VOCABULARY;
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 1; i <= vocab.getMaxTokenType(); i++) {
      String s = vocab.getLiteralName(i);
      if (s != null) {
        builder.put(s, i);
      }
      s = vocab.getSymbolicName(i);
      if (s != null) {
        builder.put(s, i);
      }
    }
    MAP = builder.buildOrThrow();

    ImmutableMap.Builder<Integer, Op> binary = ImmutableMap.builder();
    ImmutableMap.Builder<Integer, Op> assign = ImmutableMap.builder();
    for (Op op : Op.values()) {
      Integer type = MAP.get("'" + op.text + "'");
      if (type == null) {
        continue;
      }
      if (op.precedence > 0) {
        binary.put(type, op);
      } else if (op != Op.NOT) {
        assign.put(type, op);
      }
    }
    BINARY_OPS = binary.buildOrThrow();
    ASSIGN_OPS = assign.buildOrThrow();
  }

  /**
   * Returns the token type for the given name. Throws an exception if there is no such token name.
   */
  static int of(String name) {
    Integer result = MAP.get(name);
    if (result == null) {
      throw new IllegalArgumentException("No token named " + name);
    }
    return result;
  }

  /** Returns the binary operator denoted by the given token type, or null. */
  static @Nullable Op binaryOp(int type) {
    return BINARY_OPS.get(type);
  }

  /** Returns the prefix operator ({@code +}, {@code -}, {@code !} or {@code &}) or null. */
  static @Nullable Op unaryOp(int type) {
    return (type == LgoLexer.NOT) ? Op.NOT : BINARY_OPS.get(type);
  }

  /** Returns the assignment operator ({@code =}, {@code :=}, {@code +=}...) or null. */
  static @Nullable Op assignOp(int type) {
    return ASSIGN_OPS.get(type);
  }

  /** True if a newline after a token of this type ends the statement. */
  static boolean endsStatement(int type) {
    return type == LgoLexer.IDENTIFIER
        || type == LgoLexer.INT_LIT
        || type == LgoLexer.FLOAT_LIT
        || type == LgoLexer.RUNE_LIT
        || type == LgoLexer.STRING_LIT
        || type == LgoLexer.RAW_STRING_LIT
        || type == LgoLexer.BREAK
        || type == LgoLexer.CONTINUE
        || type == LgoLexer.RETURN
        || type == LgoLexer.INC
        || type == LgoLexer.DEC
        || type == LgoLexer.RPAREN
        || type == LgoLexer.RBRACK
        || type == LgoLexer.RBRACE;
  }
}
