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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.lgo.ast.CompileError;

/**
 * A base class for visitors of the generated parse tree that
 *
 * <ul>
 *   <li>throws an AssertionError when visiting a node type with no explicit visit* method, rather
 *       than silently returning a default; and
 *   <li>provides error() methods that report the node currently being visited.
 * </ul>
 */
class VisitorBase<T> extends LgoParserBaseVisitor<T> {

  /** The node currently being visited. */
  private ParseTree currentNode;

  @Override
  protected final T defaultResult() {
    // Every visit method that can be reached is overridden.
    throw new AssertionError();
  }

  @Override
  public final T visit(ParseTree tree) {
    return visitWithCurrentNode(tree, super::visit);
  }

  /**
   * Calls {@code visitor} with the given node, binding {@link #currentNode} for the duration of the
   * call.
   *
   * <p>If the function throws, this visitor will not be used again, so currentNode is not
   * restored.
   */
  @CanIgnoreReturnValue
  T visitWithCurrentNode(ParseTree node, Function<ParseTree, T> visitor) {
    ParseTree prevNode = currentNode;
    currentNode = node;
    T result = visitor.apply(node);
    currentNode = prevNode;
    return result;
  }

  /** Returns the first token of the current node. */
  Token currentToken() {
    return ((ParserRuleContext) currentNode).start;
  }

  /** Returns a {@link CompileError} pointing at the current node. */
  CompileError error(String msg) {
    return SourceParser.error(currentToken(), msg);
  }

  /** Returns a {@link CompileError} pointing at the current node. */
  @FormatMethod
  CompileError error(String fmt, Object... fmtArgs) {
    return SourceParser.error(currentToken(), fmt, fmtArgs);
  }
}
