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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast;
import org.lgo.ast.Ast.AssignStmt;
import org.lgo.ast.Ast.BasicLit;
import org.lgo.ast.Ast.BinaryExpr;
import org.lgo.ast.Ast.BlockStmt;
import org.lgo.ast.Ast.Branch;
import org.lgo.ast.Ast.BranchStmt;
import org.lgo.ast.Ast.CallExpr;
import org.lgo.ast.Ast.Comment;
import org.lgo.ast.Ast.CompositeLit;
import org.lgo.ast.Ast.Decl;
import org.lgo.ast.Ast.DeclKind;
import org.lgo.ast.Ast.DeclStmt;
import org.lgo.ast.Ast.DeferStmt;
import org.lgo.ast.Ast.Ellipsis;
import org.lgo.ast.Ast.Expr;
import org.lgo.ast.Ast.ExprStmt;
import org.lgo.ast.Ast.Field;
import org.lgo.ast.Ast.FieldList;
import org.lgo.ast.Ast.File;
import org.lgo.ast.Ast.ForStmt;
import org.lgo.ast.Ast.FuncDecl;
import org.lgo.ast.Ast.FuncLit;
import org.lgo.ast.Ast.FuncType;
import org.lgo.ast.Ast.GenDecl;
import org.lgo.ast.Ast.GoStmt;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.IfStmt;
import org.lgo.ast.Ast.ImportSpec;
import org.lgo.ast.Ast.IncDecStmt;
import org.lgo.ast.Ast.IndexExpr;
import org.lgo.ast.Ast.InterfaceType;
import org.lgo.ast.Ast.KeyValueExpr;
import org.lgo.ast.Ast.LitKind;
import org.lgo.ast.Ast.MapType;
import org.lgo.ast.Ast.Node;
import org.lgo.ast.Ast.ParenExpr;
import org.lgo.ast.Ast.RangeStmt;
import org.lgo.ast.Ast.ReturnStmt;
import org.lgo.ast.Ast.SelectorExpr;
import org.lgo.ast.Ast.SliceExpr;
import org.lgo.ast.Ast.SliceType;
import org.lgo.ast.Ast.Spec;
import org.lgo.ast.Ast.StarExpr;
import org.lgo.ast.Ast.StatementBlock;
import org.lgo.ast.Ast.Stmt;
import org.lgo.ast.Ast.StructType;
import org.lgo.ast.Ast.TypeAssertExpr;
import org.lgo.ast.Ast.TypeSpec;
import org.lgo.ast.Ast.UnaryExpr;
import org.lgo.ast.Ast.ValueSpec;
import org.lgo.ast.LineMap;
import org.lgo.ast.Op;
import org.lgo.parser.LgoParser.ArgumentContext;
import org.lgo.parser.LgoParser.BlockContext;
import org.lgo.parser.LgoParser.BlockStatementContext;
import org.lgo.parser.LgoParser.BranchStatementContext;
import org.lgo.parser.LgoParser.CallSuffixContext;
import org.lgo.parser.LgoParser.DeclStatementContext;
import org.lgo.parser.LgoParser.DeclarationContext;
import org.lgo.parser.LgoParser.DeferStatementContext;
import org.lgo.parser.LgoParser.ElementContext;
import org.lgo.parser.LgoParser.ExpressionContext;
import org.lgo.parser.LgoParser.ExpressionListContext;
import org.lgo.parser.LgoParser.FieldDeclContext;
import org.lgo.parser.LgoParser.ForStatementContext;
import org.lgo.parser.LgoParser.ForStmtContext;
import org.lgo.parser.LgoParser.FuncDeclStatementContext;
import org.lgo.parser.LgoParser.FuncOperandContext;
import org.lgo.parser.LgoParser.FuncTypeContext;
import org.lgo.parser.LgoParser.FunctionDeclContext;
import org.lgo.parser.LgoParser.GoStatementContext;
import org.lgo.parser.LgoParser.IdentifierListContext;
import org.lgo.parser.LgoParser.IfStatementContext;
import org.lgo.parser.LgoParser.IfStmtContext;
import org.lgo.parser.LgoParser.ImportDeclContext;
import org.lgo.parser.LgoParser.ImportSpecContext;
import org.lgo.parser.LgoParser.ImportStatementContext;
import org.lgo.parser.LgoParser.IndexSuffixContext;
import org.lgo.parser.LgoParser.InterfaceTypeContext;
import org.lgo.parser.LgoParser.KeyedElementContext;
import org.lgo.parser.LgoParser.LiteralContext;
import org.lgo.parser.LgoParser.LiteralOperandContext;
import org.lgo.parser.LgoParser.LiteralValueContext;
import org.lgo.parser.LgoParser.MapTypeContext;
import org.lgo.parser.LgoParser.MethodSpecContext;
import org.lgo.parser.LgoParser.NameOperandContext;
import org.lgo.parser.LgoParser.ParameterDeclContext;
import org.lgo.parser.LgoParser.ParametersContext;
import org.lgo.parser.LgoParser.ParenOperandContext;
import org.lgo.parser.LgoParser.ParenTypeContext;
import org.lgo.parser.LgoParser.PointerTypeContext;
import org.lgo.parser.LgoParser.PrefixUnaryContext;
import org.lgo.parser.LgoParser.PrimaryExprContext;
import org.lgo.parser.LgoParser.PrimaryUnaryContext;
import org.lgo.parser.LgoParser.ReplBlockContext;
import org.lgo.parser.LgoParser.ResultContext;
import org.lgo.parser.LgoParser.ReturnStatementContext;
import org.lgo.parser.LgoParser.SelectorSuffixContext;
import org.lgo.parser.LgoParser.SignatureContext;
import org.lgo.parser.LgoParser.SimpleStatementContext;
import org.lgo.parser.LgoParser.SimpleStmtContext;
import org.lgo.parser.LgoParser.SingleExprContext;
import org.lgo.parser.LgoParser.SliceTypeContext;
import org.lgo.parser.LgoParser.SourceFileContext;
import org.lgo.parser.LgoParser.StatementContext;
import org.lgo.parser.LgoParser.StatementListContext;
import org.lgo.parser.LgoParser.StructTypeContext;
import org.lgo.parser.LgoParser.SuffixContext;
import org.lgo.parser.LgoParser.TopLevelDeclContext;
import org.lgo.parser.LgoParser.TypeAssertSuffixContext;
import org.lgo.parser.LgoParser.TypeLiteralContext;
import org.lgo.parser.LgoParser.TypeLiteralOperandContext;
import org.lgo.parser.LgoParser.TypeNameContext;
import org.lgo.parser.LgoParser.TypeSpecContext;
import org.lgo.parser.LgoParser.Type_Context;
import org.lgo.parser.LgoParser.UnaryExprContext;
import org.lgo.parser.LgoParser.ValueSpecContext;

/**
 * Builds the syntax tree for a parse tree produced by {@link LgoParser}, and reports the errors
 * that the grammar is too permissive to catch.
 *
 * <p>Each node is placed at the source offsets of the tokens it was built from.
 */
class AstBuilder extends VisitorBase<Node> {

  private final String src;
  private final LineMap lines;

  /** All comments in the source, in order. */
  private final List<Comment> comments = new ArrayList<>();

  /** The parser's token stream, which includes comments on the hidden channel. */
  private final CommonTokenStream tokens;

  /** True while building a file, whose functions need not have bodies. */
  private boolean allowExternalFuncs;

  AstBuilder(String src, CommonTokenStream tokens) {
    this.src = src;
    this.lines = LineMap.of(src);
    this.tokens = tokens;
  }

  StatementBlock replBlock(ReplBlockContext ctx) {
    collectComments();
    List<Stmt> stmts = statements(ctx.statementList());
    int firstPos = stmts.isEmpty() ? Integer.MAX_VALUE : stmts.get(0).pos;
    return at(
        new StatementBlock(stmts, commentsBefore(firstPos), comments, lines), 0, src.length());
  }

  File sourceFile(SourceFileContext ctx) {
    collectComments();
    allowExternalFuncs = true;
    List<Decl> decls = new ArrayList<>();
    boolean importsAllowed = true;
    for (TopLevelDeclContext declCtx : ctx.topLevelDecl()) {
      if (declCtx.importDecl() != null) {
        if (!importsAllowed) {
          throw SourceParser.error(declCtx.start, "imports must appear before other declarations");
        }
        decls.add((Decl) visit(declCtx.importDecl()));
      } else {
        importsAllowed = false;
        ParserRuleContext decl =
            (declCtx.declaration() != null) ? declCtx.declaration() : declCtx.functionDecl();
        decls.add((Decl) visit(decl));
      }
    }
    List<Comment> doc = commentsBefore(ctx.start.getStartIndex());
    return at(
        new File(ctx.IDENTIFIER().getText(), doc, decls, comments, lines), 0, src.length());
  }

  Expr singleExpr(SingleExprContext ctx) {
    return expr(ctx.expression());
  }

  private void collectComments() {
    for (Token t : tokens.getTokens()) {
      if (t.getType() == LgoLexer.LINE_COMMENT || t.getType() == LgoLexer.BLOCK_COMMENT) {
        comments.add(new Comment(t.getText(), t.getStartIndex()));
      }
    }
  }

  private List<Comment> commentsBefore(int pos) {
    List<Comment> result = new ArrayList<>();
    for (Comment c : comments) {
      if (c.pos < pos) {
        result.add(c);
      }
    }
    return result;
  }

  // Declarations

  @Override
  public Node visitImportDecl(ImportDeclContext ctx) {
    List<Spec> specs = new ArrayList<>();
    for (ImportSpecContext spec : ctx.importSpec()) {
      specs.add((Spec) visit(spec));
    }
    return at(new GenDecl(DeclKind.IMPORT, specs, ctx.LPAREN() != null), ctx);
  }

  @Override
  public Node visitImportSpec(ImportSpecContext ctx) {
    Ident name = (ctx.name != null) ? ident(ctx.name) : null;
    BasicLit path = at(new BasicLit(LitKind.STRING, ctx.path.getText()), ctx.path);
    return at(new ImportSpec(name, path), ctx);
  }

  @Override
  public Node visitDeclaration(DeclarationContext ctx) {
    List<Spec> specs = new ArrayList<>();
    DeclKind kind;
    if (ctx.kind.getType() == LgoLexer.TYPE) {
      kind = DeclKind.TYPE;
      for (TypeSpecContext spec : ctx.typeSpec()) {
        specs.add((Spec) visit(spec));
      }
    } else {
      kind = (ctx.kind.getType() == LgoLexer.CONST) ? DeclKind.CONST : DeclKind.VAR;
      for (ValueSpecContext specCtx : ctx.valueSpec()) {
        ValueSpec spec = (ValueSpec) visit(specCtx);
        if (kind == DeclKind.CONST && spec.values.isEmpty()) {
          throw SourceParser.error(specCtx.start, "missing init expr for const declaration");
        }
        specs.add(spec);
      }
    }
    return at(new GenDecl(kind, specs, ctx.LPAREN() != null), ctx);
  }

  @Override
  public Node visitValueSpec(ValueSpecContext ctx) {
    Expr type = (ctx.type_() != null) ? expr(ctx.type_()) : null;
    List<Expr> values =
        (ctx.expressionList() != null) ? exprList(ctx.expressionList()) : new ArrayList<>();
    return at(new ValueSpec(identList(ctx.identifierList()), type, values), ctx);
  }

  @Override
  public Node visitTypeSpec(TypeSpecContext ctx) {
    if (ctx.alias != null) {
      throw SourceParser.error(ctx.alias, "type aliases are not supported");
    }
    return at(new TypeSpec(ident(ctx.IDENTIFIER().getSymbol()), expr(ctx.type_())), ctx);
  }

  @Override
  public Node visitFunctionDecl(FunctionDeclContext ctx) {
    FieldList recv = null;
    if (ctx.receiver != null) {
      recv = (FieldList) visit(ctx.receiver);
      if (recv.numFields() != 1) {
        throw SourceParser.error(ctx.receiver.start, "method has multiple receivers");
      }
    }
    Ident name = ident(ctx.IDENTIFIER().getSymbol());
    FuncType type = funcType(ctx.signature(), ctx.start.getStartIndex());
    BlockStmt body = null;
    if (ctx.block() != null) {
      body = (BlockStmt) visit(ctx.block());
    } else if (!allowExternalFuncs) {
      throw error("missing function body");
    }
    return at(new FuncDecl(recv, name, type, body), ctx);
  }

  // Statements

  private List<Stmt> statements(StatementListContext ctx) {
    List<Stmt> result = new ArrayList<>();
    for (StatementContext stmt : ctx.statement()) {
      result.add((Stmt) visit(stmt));
    }
    return result;
  }

  /** True if the statement is directly in the REPL block rather than in a nested block. */
  private static boolean isTopLevel(StatementContext ctx) {
    return ctx.getParent().getParent() instanceof ReplBlockContext;
  }

  @Override
  public Node visitImportStatement(ImportStatementContext ctx) {
    if (!isTopLevel(ctx)) {
      throw error("unexpected import");
    }
    return at(new DeclStmt((Decl) visit(ctx.importDecl())), ctx);
  }

  @Override
  public Node visitFuncDeclStatement(FuncDeclStatementContext ctx) {
    if (!isTopLevel(ctx)) {
      throw error("function declarations are only allowed at the outermost level");
    }
    return at(new DeclStmt((Decl) visit(ctx.functionDecl())), ctx);
  }

  @Override
  public Node visitDeclStatement(DeclStatementContext ctx) {
    return at(new DeclStmt((Decl) visit(ctx.declaration())), ctx);
  }

  @Override
  public Node visitGoStatement(GoStatementContext ctx) {
    return at(new GoStmt(callOperand(ctx.expression(), "go")), ctx);
  }

  @Override
  public Node visitDeferStatement(DeferStatementContext ctx) {
    return at(new DeferStmt(callOperand(ctx.expression(), "defer")), ctx);
  }

  private CallExpr callOperand(ExpressionContext ctx, String keyword) {
    Expr x = expr(ctx);
    if (!(x instanceof CallExpr)) {
      throw SourceParser.error(ctx.start, "expression in %s must be function call", keyword);
    }
    return (CallExpr) x;
  }

  @Override
  public Node visitReturnStatement(ReturnStatementContext ctx) {
    List<Expr> results =
        (ctx.expressionList() != null) ? exprList(ctx.expressionList()) : new ArrayList<>();
    return at(new ReturnStmt(results), ctx);
  }

  @Override
  public Node visitBranchStatement(BranchStatementContext ctx) {
    if (ctx.label != null) {
      throw error("labels are not supported");
    }
    Branch branch = (ctx.kind.getType() == LgoLexer.BREAK) ? Branch.BREAK : Branch.CONTINUE;
    return at(new BranchStmt(branch), ctx);
  }

  @Override
  public Node visitBlockStatement(BlockStatementContext ctx) {
    return visit(ctx.block());
  }

  @Override
  public Node visitBlock(BlockContext ctx) {
    return at(new BlockStmt(statements(ctx.statementList())), ctx);
  }

  @Override
  public Node visitSimpleStatement(SimpleStatementContext ctx) {
    return simpleStmt(ctx.simpleStmt(), false);
  }

  @Override
  public Node visitIfStatement(IfStatementContext ctx) {
    return visit(ctx.ifStmt());
  }

  @Override
  public Node visitForStatement(ForStatementContext ctx) {
    return visit(ctx.forStmt());
  }

  /**
   * Builds an assignment, definition, increment or expression statement. If {@code rangeOk} is
   * true and the statement is a range clause, returns a RangeStmt with an empty body.
   */
  private Stmt simpleStmt(SimpleStmtContext ctx, boolean rangeOk) {
    List<Expr> lhs = exprList(ctx.lhs);
    if (ctx.assignOp() != null) {
      Op op = TokenType.assignOp(ctx.assignOp().start.getType());
      if (op == Op.DEFINE) {
        for (Expr e : lhs) {
          if (!(e instanceof Ident)) {
            throw lines.error(e, "non-name %s on left side of :=", e);
          }
        }
      }
      if (ctx.RANGE() != null) {
        if (!rangeOk || (op != Op.ASSIGN && op != Op.DEFINE)) {
          throw SourceParser.error(ctx.RANGE().getSymbol(), "unexpected range");
        } else if (lhs.size() > 2) {
          throw lines.error(lhs.get(2), "range clause permits at most two iteration variables");
        }
        Expr value = (lhs.size() > 1) ? lhs.get(1) : null;
        BlockStmt empty = at(new BlockStmt(new ArrayList<>()), ctx.stop);
        return at(
            new RangeStmt(lhs.get(0), value, op == Op.DEFINE, expr(ctx.rangeExpr), empty), ctx);
      }
      return at(new AssignStmt(lhs, op, exprList(ctx.rhs)), ctx);
    } else if (lhs.size() > 1) {
      throw lines.error(lhs.get(1), "expected 1 expression");
    }
    Expr x = lhs.get(0);
    if (ctx.incDec != null) {
      return at(new IncDecStmt(x, ctx.incDec.getType() == LgoLexer.INC), ctx);
    }
    return at(new ExprStmt(x), ctx);
  }

  /** Returns the expression of a statement that must be a condition. */
  private Expr condition(SimpleStmtContext ctx) {
    Stmt stmt = simpleStmt(ctx, false);
    if (!(stmt instanceof ExprStmt)) {
      throw lines.error(stmt, "expected boolean expression, found %s", describe(stmt));
    }
    return ((ExprStmt) stmt).x;
  }

  private static String describe(Stmt stmt) {
    if (stmt instanceof AssignStmt) {
      return (((AssignStmt) stmt).op == Op.DEFINE) ? "definition" : "assignment";
    } else if (stmt instanceof IncDecStmt) {
      return "increment statement";
    }
    return "range clause";
  }

  @Override
  public Node visitIfStmt(IfStmtContext ctx) {
    Stmt init = null;
    SimpleStmtContext condCtx = ctx.first;
    if (ctx.SEMICOLON() != null) {
      init = (ctx.first != null) ? simpleStmt(ctx.first, false) : null;
      condCtx = ctx.second;
    }
    if (condCtx == null) {
      throw SourceParser.error(ctx.body.start, "missing condition in if statement");
    }
    Expr cond = condition(condCtx);
    BlockStmt body = (BlockStmt) visit(ctx.body);
    Stmt els = null;
    if (ctx.elseIf != null) {
      els = (Stmt) visit(ctx.elseIf);
    } else if (ctx.elseBlock != null) {
      els = (Stmt) visit(ctx.elseBlock);
    }
    return at(new IfStmt(init, cond, body, els), ctx);
  }

  @Override
  public Node visitForStmt(ForStmtContext ctx) {
    int pos = ctx.start.getStartIndex();
    if (ctx.RANGE() != null) {
      Expr x = expr(ctx.rangeExpr);
      BlockStmt body = (BlockStmt) visit(ctx.block());
      return at(new RangeStmt(null, null, false, x, body), pos, body.end);
    } else if (ctx.SEMICOLON().isEmpty()) {
      Stmt header = (ctx.first != null) ? simpleStmt(ctx.first, true) : null;
      Expr cond = null;
      if (header instanceof RangeStmt) {
        RangeStmt range = (RangeStmt) header;
        BlockStmt body = (BlockStmt) visit(ctx.block());
        return at(
            new RangeStmt(range.key, range.value, range.define, range.x, body), pos, body.end);
      } else if (header != null) {
        cond = condition(ctx.first);
      }
      BlockStmt body = (BlockStmt) visit(ctx.block());
      return at(new ForStmt(null, cond, null, body), pos, body.end);
    }
    Stmt init = (ctx.first != null) ? simpleStmt(ctx.first, false) : null;
    Expr cond = (ctx.cond != null) ? expr(ctx.cond) : null;
    Stmt post = null;
    if (ctx.post != null) {
      post = simpleStmt(ctx.post, false);
      if (post instanceof AssignStmt && ((AssignStmt) post).op == Op.DEFINE) {
        throw lines.error(post, "cannot declare in post statement of for loop");
      }
    }
    BlockStmt body = (BlockStmt) visit(ctx.block());
    return at(new ForStmt(init, cond, post, body), pos, body.end);
  }

  // Expressions

  private Expr expr(ParserRuleContext ctx) {
    return (Expr) visit(ctx);
  }

  private List<Expr> exprList(ExpressionListContext ctx) {
    List<Expr> result = new ArrayList<>();
    for (ExpressionContext e : ctx.expression()) {
      result.add(expr(e));
    }
    return result;
  }

  private List<Ident> identList(IdentifierListContext ctx) {
    List<Ident> result = new ArrayList<>();
    for (TerminalNode t : ctx.IDENTIFIER()) {
      result.add(ident(t.getSymbol()));
    }
    return result;
  }

  private static Ident ident(Token token) {
    return at(new Ident(token.getText()), token);
  }

  /** Groups the operands and operators of a binary expression by precedence, left to right. */
  @Override
  public Node visitExpression(ExpressionContext ctx) {
    List<UnaryExprContext> operands = ctx.unaryExpr();
    Deque<Expr> values = new ArrayDeque<>();
    Deque<Op> pending = new ArrayDeque<>();
    values.push(expr(operands.get(0)));
    for (int i = 1; i < operands.size(); i++) {
      Op op = TokenType.binaryOp(ctx.binaryOp(i - 1).start.getType());
      while (!pending.isEmpty() && pending.peek().precedence >= op.precedence) {
        reduce(values, pending);
      }
      pending.push(op);
      values.push(expr(operands.get(i)));
    }
    while (!pending.isEmpty()) {
      reduce(values, pending);
    }
    return values.pop();
  }

  private static void reduce(Deque<Expr> values, Deque<Op> pending) {
    Expr y = values.pop();
    Expr x = values.pop();
    values.push(at(new BinaryExpr(pending.pop(), x, y), x.pos, y.end));
  }

  @Override
  public Node visitPrimaryUnary(PrimaryUnaryContext ctx) {
    return visit(ctx.primaryExpr());
  }

  @Override
  public Node visitPrefixUnary(PrefixUnaryContext ctx) {
    Expr x = expr(ctx.unaryExpr());
    int type = ctx.op.getType();
    if (type == LgoLexer.MUL) {
      return at(new StarExpr(x), ctx);
    }
    return at(new UnaryExpr(TokenType.unaryOp(type), x), ctx);
  }

  @Override
  public Node visitPrimaryExpr(PrimaryExprContext ctx) {
    Expr x = expr(ctx.operand());
    for (int i = 1; i < ctx.getChildCount(); i++) {
      ParseTree child = ctx.getChild(i);
      if (child instanceof LiteralValueContext) {
        x = compositeLit(x, (LiteralValueContext) child);
      } else {
        x = suffix(x, (SuffixContext) child);
      }
    }
    return x;
  }

  private Expr suffix(Expr x, SuffixContext ctx) {
    int end = end(ctx.stop);
    if (ctx instanceof SelectorSuffixContext) {
      Ident sel = ident(((SelectorSuffixContext) ctx).IDENTIFIER().getSymbol());
      return at(new SelectorExpr(x, sel), x.pos, end);
    } else if (ctx instanceof TypeAssertSuffixContext) {
      Expr type = expr(((TypeAssertSuffixContext) ctx).type_());
      return at(new TypeAssertExpr(x, type), x.pos, end);
    } else if (ctx instanceof IndexSuffixContext) {
      IndexSuffixContext index = (IndexSuffixContext) ctx;
      Expr low = (index.low != null) ? expr(index.low) : null;
      if (index.colon != null) {
        Expr high = (index.high != null) ? expr(index.high) : null;
        return at(new SliceExpr(x, low, high), x.pos, end);
      } else if (low == null) {
        throw SourceParser.error(index.stop, "expected operand");
      }
      return at(new IndexExpr(x, low), x.pos, end);
    }
    List<Expr> args = new ArrayList<>();
    boolean hasEllipsis = false;
    for (ArgumentContext arg : ((CallSuffixContext) ctx).argument()) {
      args.add(expr(arg.expression()));
      if (arg.ELLIPSIS() != null) {
        hasEllipsis = true;
      }
    }
    return at(new CallExpr(x, args, hasEllipsis), x.pos, end);
  }

  /** Builds a composite literal; {@code type} is null if it is elided. */
  private CompositeLit compositeLit(@Nullable Expr type, LiteralValueContext ctx) {
    List<Expr> elts = new ArrayList<>();
    for (KeyedElementContext e : ctx.keyedElement()) {
      Expr key = element(e.key);
      if (e.value == null) {
        elts.add(key);
      } else {
        Expr value = element(e.value);
        elts.add(at(new KeyValueExpr(key, value), key.pos, value.end));
      }
    }
    int pos = (type != null) ? type.pos : ctx.start.getStartIndex();
    return at(new CompositeLit(type, elts), pos, end(ctx.stop));
  }

  private Expr element(ElementContext ctx) {
    return (ctx.expression() != null)
        ? expr(ctx.expression())
        : compositeLit(null, ctx.literalValue());
  }

  @Override
  public Node visitLiteralOperand(LiteralOperandContext ctx) {
    return visit(ctx.literal());
  }

  @Override
  public Node visitLiteral(LiteralContext ctx) {
    LitKind kind;
    switch (ctx.start.getType()) {
      case LgoLexer.INT_LIT:
        kind = LitKind.INT;
        break;
      case LgoLexer.FLOAT_LIT:
        kind = LitKind.FLOAT;
        break;
      case LgoLexer.RUNE_LIT:
        kind = LitKind.RUNE;
        break;
      default:
        kind = LitKind.STRING;
        break;
    }
    return at(new BasicLit(kind, ctx.getText()), ctx);
  }

  @Override
  public Node visitNameOperand(NameOperandContext ctx) {
    return ident(ctx.IDENTIFIER().getSymbol());
  }

  @Override
  public Node visitParenOperand(ParenOperandContext ctx) {
    return at(new ParenExpr(expr(ctx.expression())), ctx);
  }

  @Override
  public Node visitFuncOperand(FuncOperandContext ctx) {
    FuncType type = funcType(ctx.signature(), ctx.start.getStartIndex());
    if (ctx.block() == null) {
      return type;
    }
    return at(new FuncLit(type, (BlockStmt) visit(ctx.block())), ctx);
  }

  @Override
  public Node visitTypeLiteralOperand(TypeLiteralOperandContext ctx) {
    Expr type = expr(ctx.typeLiteral());
    return (ctx.literalValue() != null) ? compositeLit(type, ctx.literalValue()) : type;
  }

  // Types

  @Override
  public Node visitType_(Type_Context ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public Node visitTypeLiteral(TypeLiteralContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public Node visitTypeName(TypeNameContext ctx) {
    Ident name = ident(ctx.IDENTIFIER(0).getSymbol());
    if (ctx.IDENTIFIER().size() == 1) {
      return name;
    }
    return at(new SelectorExpr(name, ident(ctx.IDENTIFIER(1).getSymbol())), ctx);
  }

  @Override
  public Node visitPointerType(PointerTypeContext ctx) {
    return at(new StarExpr(expr(ctx.type_())), ctx);
  }

  @Override
  public Node visitSliceType(SliceTypeContext ctx) {
    return at(new SliceType(expr(ctx.type_())), ctx);
  }

  @Override
  public Node visitMapType(MapTypeContext ctx) {
    return at(new MapType(expr(ctx.key), expr(ctx.value)), ctx);
  }

  @Override
  public Node visitParenType(ParenTypeContext ctx) {
    return at(new ParenExpr(expr(ctx.type_())), ctx);
  }

  @Override
  public Node visitStructType(StructTypeContext ctx) {
    List<Field> fields = new ArrayList<>();
    for (FieldDeclContext f : ctx.fieldDecl()) {
      if (f.embedded != null) {
        throw SourceParser.error(f.start, "embedded fields are not supported");
      }
      fields.add(at(new Field(identList(f.identifierList()), expr(f.type_())), f));
    }
    return at(new StructType(new FieldList(fields)), ctx);
  }

  @Override
  public Node visitInterfaceType(InterfaceTypeContext ctx) {
    List<Field> methods = new ArrayList<>();
    for (MethodSpecContext m : ctx.methodSpec()) {
      if (m.embedded != null) {
        throw SourceParser.error(m.start, "embedded interfaces are not supported");
      }
      Ident name = ident(m.IDENTIFIER().getSymbol());
      FuncType type = funcType(m.signature(), name.pos);
      methods.add(at(new Field(List.of(name), type), m));
    }
    return at(new InterfaceType(new FieldList(methods)), ctx);
  }

  @Override
  public Node visitFuncType(FuncTypeContext ctx) {
    return funcType(ctx.signature(), ctx.start.getStartIndex());
  }

  private FuncType funcType(SignatureContext ctx, int pos) {
    FieldList params = (FieldList) visit(ctx.parameters());
    FieldList results = null;
    ResultContext result = ctx.result();
    if (result != null) {
      if (result.parameters() != null) {
        results = (FieldList) visit(result.parameters());
      } else {
        Expr type = expr(result.type_());
        Field field = at(new Field(new ArrayList<>(), type), type.pos, type.end);
        results = at(new FieldList(List.of(field)), type.pos, type.end);
      }
    }
    int end = (results != null) ? results.end : params.end;
    return at(new FuncType(params, results), pos, end);
  }

  /**
   * Builds a parameter list. Unnamed entries that precede a named one are its names, so {@code (a,
   * b int)} is a single field with two names.
   */
  @Override
  public Node visitParameters(ParametersContext ctx) {
    List<Field> fields = new ArrayList<>();
    List<Expr> pending = new ArrayList<>();
    boolean named = false;
    for (ParameterDeclContext p : ctx.parameterDecl()) {
      Expr type = expr(p.type_());
      if (p.ELLIPSIS() != null) {
        type = at(new Ellipsis(type), p.ELLIPSIS().getSymbol().getStartIndex(), type.end);
      }
      if (p.IDENTIFIER() == null) {
        pending.add(type);
        continue;
      }
      named = true;
      List<Ident> names = new ArrayList<>();
      for (Expr e : pending) {
        if (!(e instanceof Ident)) {
          throw lines.error(e, "mixed named and unnamed parameters");
        }
        names.add((Ident) e);
      }
      names.add(ident(p.IDENTIFIER().getSymbol()));
      fields.add(at(new Field(names, type), names.get(0).pos, type.end));
      pending.clear();
    }
    if (named && !pending.isEmpty()) {
      throw lines.error(pending.get(0), "mixed named and unnamed parameters");
    }
    for (Expr type : pending) {
      fields.add(at(new Field(new ArrayList<>(), type), type.pos, type.end));
    }
    return at(new FieldList(fields), ctx);
  }

  // Positions

  private static int end(Token token) {
    return token.getStopIndex() + 1;
  }

  private static <T extends Node> T at(T node, int pos, int end) {
    return Ast.at(node, pos, end);
  }

  private static <T extends Node> T at(T node, Token token) {
    return Ast.at(node, token.getStartIndex(), end(token));
  }

  private static <T extends Node> T at(T node, ParserRuleContext ctx) {
    return Ast.at(node, ctx.start.getStartIndex(), end(ctx.stop));
  }
}
