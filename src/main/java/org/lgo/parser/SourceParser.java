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

import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import java.util.function.BiFunction;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.FailedPredicateException;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.lgo.ast.Ast.Expr;
import org.lgo.ast.Ast.File;
import org.lgo.ast.Ast.StatementBlock;
import org.lgo.ast.CompileError;
import org.lgo.parser.LgoParser.BlockContext;
import org.lgo.parser.LgoParser.ForStmtContext;
import org.lgo.parser.LgoParser.IfStmtContext;
import org.lgo.parser.LgoParser.LiteralValueContext;
import org.lgo.parser.LgoParser.NameOperandContext;
import org.lgo.parser.LgoParser.ParenOperandContext;
import org.lgo.parser.LgoParser.SelectorSuffixContext;
import org.lgo.parser.LgoParser.SuffixContext;

/**
 * Parses Lesser Go source text into syntax trees.
 *
 * <p>Each entry point runs the generated {@link LgoParser} and then builds the tree with an {@link
 * AstBuilder}. Any syntax error is thrown as a {@link CompileError}.
 *
 * <p>Go ends a statement at a newline only when the token before the newline could end one. The
 * lexer sends newlines to the hidden channel, and the grammar asks {@link #atBreak} and {@link
 * #noBreak} whether one is present.
 */
public final class SourceParser {

  // Statics only
  private SourceParser() {}

  /** Parses the body of a REPL cell: a sequence of statements and top-level declarations. */
  public static StatementBlock parseBlock(String src) {
    return parse(src, (parser, builder) -> builder.replBlock(parser.replBlock()));
  }

  /** Parses a complete source file, starting with its package clause. */
  public static File parseFile(String src) {
    return parse(src, (parser, builder) -> builder.sourceFile(parser.sourceFile()));
  }

  /** Parses a single expression, which may be followed by a semicolon. */
  public static Expr parseExpr(String src) {
    return parse(src, (parser, builder) -> builder.singleExpr(parser.singleExpr()));
  }

  private static <T> T parse(String src, BiFunction<LgoParser, AstBuilder, T> rule) {
    // Throw CompileErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            if (e instanceof FailedPredicateException) {
              // Drop the "rule eos" prefix.
              msg = e.getMessage();
            }
            throw new CompileError(msg, lineNum, charPositionInLine);
          }
        };
    LgoLexer lexer = new LgoLexer(CharStreams.fromString(src));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    // Set a ThreadLocal so that the predicates can examine the token stream.
    assert threadTokens.get() == null;
    threadTokens.set(tokens);
    try {
      LgoParser parser = new LgoParser(tokens);
      parser.removeErrorListeners();
      parser.addErrorListener(errorListener);
      return rule.apply(parser, new AstBuilder(src, tokens));
    } finally {
      threadTokens.set(null);
    }
  }

  /** A ThreadLocal to give the predicates access to the token stream. */
  private static final ThreadLocal<CommonTokenStream> threadTokens = new ThreadLocal<>();

  /**
   * An ANTLR semantic predicate, invoked from the {@code eos} rule. True if the next token is a
   * closing brace or parenthesis, or the end of input, or if it follows a newline that ends the
   * statement.
   */
  static boolean atBreak() {
    CommonTokenStream tokens = threadTokens.get();
    int nextType = tokens.LA(1);
    if (nextType == LgoLexer.RBRACE || nextType == LgoLexer.RPAREN || nextType == Token.EOF) {
      return true;
    }
    return newlineBefore(tokens);
  }

  /**
   * An ANTLR semantic predicate guarding each construct that would continue an expression or
   * statement: false if a newline before the next token ends the statement.
   */
  static boolean noBreak() {
    return !newlineBefore(threadTokens.get());
  }

  /**
   * An ANTLR semantic predicate that decides whether a "{" after the primary expression {@code ctx}
   * begins a composite literal. Only a type name (possibly package-qualified) may be followed by
   * one, and not at the outer level of an if or for header, where "{" opens the body.
   */
  static boolean literalAllowed(ParserRuleContext ctx) {
    if (!noBreak()) {
      return false;
    }
    List<ParseTree> children = ctx.children;
    if (children == null || !(children.get(0) instanceof NameOperandContext)) {
      return false;
    } else if (children.size() > 2
        || (children.size() == 2 && !(children.get(1) instanceof SelectorSuffixContext))) {
      return false;
    }
    for (ParserRuleContext p = ctx.getParent(); p != null; p = p.getParent()) {
      if (p instanceof IfStmtContext || p instanceof ForStmtContext) {
        return false;
      } else if (p instanceof BlockContext
          || p instanceof LiteralValueContext
          || p instanceof ParenOperandContext
          || p instanceof SuffixContext) {
        return true;
      }
    }
    return true;
  }

  /**
   * True if there is a newline between the next token and the previous visible token, and the
   * previous token is one after which a newline ends the statement.
   */
  private static boolean newlineBefore(CommonTokenStream tokens) {
    Token next = tokens.LT(1);
    boolean newline = false;
    for (int i = next.getTokenIndex() - 1; i >= 0; i--) {
      Token prev = tokens.get(i);
      if (prev.getChannel() == Token.DEFAULT_CHANNEL) {
        return newline && TokenType.endsStatement(prev.getType());
      }
      int type = prev.getType();
      if (type == LgoLexer.NEWLINE
          || (type == LgoLexer.BLOCK_COMMENT && prev.getText().indexOf('\n') >= 0)) {
        newline = true;
      }
    }
    return false;
  }

  /** Returns a new CompileError referring to the given token. */
  static CompileError error(Token token, String msg) {
    return new CompileError(msg, token.getLine(), token.getCharPositionInLine());
  }

  /** Returns a new CompileError referring to the given token. */
  @FormatMethod
  static CompileError error(Token token, String fmt, Object... fmtArgs) {
    return error(token, String.format(fmt, fmtArgs));
  }
}
