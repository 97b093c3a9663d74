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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The Lesser Go syntax tree.
 *
 * <p>Every node carries a {@link Kind} tag, and code that needs to treat nodes generically (see
 * {@link Walker}, {@link Rewriter} and {@link Printer}) switches on the tag rather than relying on
 * virtual dispatch. Nodes are mutable: the converter rewrites trees in place, and the type checker
 * keys its results by node identity, so a node must not be shared between two places in a tree.
 *
 * <p>{@link Node#pos} and {@link Node#end} are character offsets into the parsed source; nodes
 * created by the converter have {@link #NO_POS}.
 */
public final class Ast {

  // Static members only
  private Ast() {}

  public static final int NO_POS = -1;

  /** The tag identifying each concrete node class. */
  public enum Kind {
    // Expressions
    IDENT,
    BASIC_LIT,
    COMPOSITE_LIT,
    KEY_VALUE,
    FUNC_LIT,
    PAREN,
    SELECTOR,
    INDEX,
    SLICE,
    TYPE_ASSERT,
    CALL,
    STAR,
    UNARY,
    BINARY,
    ELLIPSIS,
    // Type expressions
    SLICE_TYPE,
    MAP_TYPE,
    STRUCT_TYPE,
    FUNC_TYPE,
    INTERFACE_TYPE,
    // Parts of type expressions
    FIELD,
    FIELD_LIST,
    // Statements
    DECL_STMT,
    EXPR_STMT,
    INC_DEC,
    ASSIGN,
    GO,
    DEFER,
    RETURN,
    BRANCH,
    BLOCK,
    IF,
    FOR,
    RANGE,
    // Specs and declarations
    IMPORT_SPEC,
    VALUE_SPEC,
    TYPE_SPEC,
    GEN_DECL,
    FUNC_DECL,
    // Roots
    FILE,
    STATEMENT_BLOCK
  }

  public abstract static class Node {
    public final Kind kind;
    public int pos = NO_POS;
    public int end = NO_POS;

    Node(Kind kind) {
      this.kind = kind;
    }

    @Override
    public String toString() {
      return Printer.nodeToString(this);
    }
  }

  public abstract static class Expr extends Node {
    Expr(Kind kind) {
      super(kind);
    }
  }

  public abstract static class Stmt extends Node {
    Stmt(Kind kind) {
      super(kind);
    }
  }

  public abstract static class Spec extends Node {
    Spec(Kind kind) {
      super(kind);
    }
  }

  public abstract static class Decl extends Node {
    Decl(Kind kind) {
      super(kind);
    }
  }

  /** Sets the source range of {@code node} and returns it. */
  public static <T extends Node> T at(T node, int pos, int end) {
    node.pos = pos;
    node.end = end;
    return node;
  }

  /** A comment, including its delimiters. Comments are not part of the tree. */
  public static final class Comment {
    public final String text;
    public final int pos;

    public Comment(String text, int pos) {
      this.text = text;
      this.pos = pos;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Expressions

  public static final class Ident extends Expr {
    /** Mutable, so that renaming can be done in place without invalidating type-checker maps. */
    public String name;

    public Ident(String name) {
      super(Kind.IDENT);
      this.name = name;
    }

    public boolean isBlank() {
      return name.equals("_");
    }
  }

  public enum LitKind {
    INT,
    FLOAT,
    RUNE,
    STRING
  }

  public static final class BasicLit extends Expr {
    public final LitKind litKind;

    /** The literal exactly as written, including quotes. */
    public final String value;

    public BasicLit(LitKind litKind, String value) {
      super(Kind.BASIC_LIT);
      this.litKind = litKind;
      this.value = value;
    }
  }

  public static final class CompositeLit extends Expr {
    /** Null if elided (e.g. the elements of {@code []Point{{1, 2}}}). */
    public @Nullable Expr type;

    public final List<Expr> elts;

    public CompositeLit(@Nullable Expr type, List<Expr> elts) {
      super(Kind.COMPOSITE_LIT);
      this.type = type;
      this.elts = new ArrayList<>(elts);
    }
  }

  public static final class KeyValueExpr extends Expr {
    public Expr key;
    public Expr value;

    public KeyValueExpr(Expr key, Expr value) {
      super(Kind.KEY_VALUE);
      this.key = key;
      this.value = value;
    }
  }

  public static final class FuncLit extends Expr {
    public final FuncType type;
    public BlockStmt body;

    public FuncLit(FuncType type, BlockStmt body) {
      super(Kind.FUNC_LIT);
      this.type = type;
      this.body = body;
    }
  }

  public static final class ParenExpr extends Expr {
    public Expr x;

    public ParenExpr(Expr x) {
      super(Kind.PAREN);
      this.x = x;
    }
  }

  public static final class SelectorExpr extends Expr {
    public Expr x;
    public final Ident sel;

    public SelectorExpr(Expr x, Ident sel) {
      super(Kind.SELECTOR);
      this.x = x;
      this.sel = sel;
    }
  }

  public static final class IndexExpr extends Expr {
    public Expr x;
    public Expr index;

    public IndexExpr(Expr x, Expr index) {
      super(Kind.INDEX);
      this.x = x;
      this.index = index;
    }
  }

  public static final class SliceExpr extends Expr {
    public Expr x;
    public @Nullable Expr low;
    public @Nullable Expr high;

    public SliceExpr(Expr x, @Nullable Expr low, @Nullable Expr high) {
      super(Kind.SLICE);
      this.x = x;
      this.low = low;
      this.high = high;
    }
  }

  public static final class TypeAssertExpr extends Expr {
    public Expr x;
    public Expr type;

    public TypeAssertExpr(Expr x, Expr type) {
      super(Kind.TYPE_ASSERT);
      this.x = x;
      this.type = type;
    }
  }

  public static final class CallExpr extends Expr {
    public Expr fun;
    public final List<Expr> args;

    /** True if the last argument is followed by {@code ...}. */
    public final boolean hasEllipsis;

    public CallExpr(Expr fun, List<Expr> args, boolean hasEllipsis) {
      super(Kind.CALL);
      this.fun = fun;
      this.args = new ArrayList<>(args);
      this.hasEllipsis = hasEllipsis;
    }
  }

  /** {@code *x}: a pointer type or a pointer indirection, depending on context. */
  public static final class StarExpr extends Expr {
    public Expr x;

    public StarExpr(Expr x) {
      super(Kind.STAR);
      this.x = x;
    }
  }

  /** Unary {@code + - ! &}; {@code *} is represented by {@link StarExpr}. */
  public static final class UnaryExpr extends Expr {
    public final Op op;
    public Expr x;

    public UnaryExpr(Op op, Expr x) {
      super(Kind.UNARY);
      this.op = op;
      this.x = x;
    }
  }

  public static final class BinaryExpr extends Expr {
    public final Op op;
    public Expr x;
    public Expr y;

    public BinaryExpr(Op op, Expr x, Expr y) {
      super(Kind.BINARY);
      this.op = op;
      this.x = x;
      this.y = y;
    }
  }

  /** {@code ...T}, only valid as the type of a function's final parameter. */
  public static final class Ellipsis extends Expr {
    public Expr elt;

    public Ellipsis(Expr elt) {
      super(Kind.ELLIPSIS);
      this.elt = elt;
    }
  }

  public static final class SliceType extends Expr {
    public Expr elt;

    public SliceType(Expr elt) {
      super(Kind.SLICE_TYPE);
      this.elt = elt;
    }
  }

  public static final class MapType extends Expr {
    public Expr key;
    public Expr value;

    public MapType(Expr key, Expr value) {
      super(Kind.MAP_TYPE);
      this.key = key;
      this.value = value;
    }
  }

  public static final class StructType extends Expr {
    public final FieldList fields;

    public StructType(FieldList fields) {
      super(Kind.STRUCT_TYPE);
      this.fields = fields;
    }
  }

  public static final class FuncType extends Expr {
    public final FieldList params;

    /** Null if the function has no results. */
    public final @Nullable FieldList results;

    public FuncType(FieldList params, @Nullable FieldList results) {
      super(Kind.FUNC_TYPE);
      this.params = params;
      this.results = results;
    }
  }

  /** Each method is a Field with a single name and a FuncType. */
  public static final class InterfaceType extends Expr {
    public final FieldList methods;

    public InterfaceType(FieldList methods) {
      super(Kind.INTERFACE_TYPE);
      this.methods = methods;
    }
  }

  /** A parameter, result, struct field, or interface method; {@code names} may be empty. */
  public static final class Field extends Node {
    public final List<Ident> names;
    public Expr type;

    public Field(List<Ident> names, Expr type) {
      super(Kind.FIELD);
      this.names = new ArrayList<>(names);
      this.type = type;
    }
  }

  public static final class FieldList extends Node {
    public final List<Field> list;

    public FieldList(List<Field> list) {
      super(Kind.FIELD_LIST);
      this.list = new ArrayList<>(list);
    }

    /** The number of entities declared (a Field with no names counts as one). */
    public int numFields() {
      int n = 0;
      for (Field f : list) {
        n += Math.max(1, f.names.size());
      }
      return n;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Statements

  /** A declaration appearing as a statement; {@code decl} is a FuncDecl only at block top level. */
  public static final class DeclStmt extends Stmt {
    public final Decl decl;

    public DeclStmt(Decl decl) {
      super(Kind.DECL_STMT);
      this.decl = decl;
    }
  }

  public static final class ExprStmt extends Stmt {
    public Expr x;

    public ExprStmt(Expr x) {
      super(Kind.EXPR_STMT);
      this.x = x;
    }
  }

  public static final class IncDecStmt extends Stmt {
    public Expr x;
    public final boolean inc;

    public IncDecStmt(Expr x, boolean inc) {
      super(Kind.INC_DEC);
      this.x = x;
      this.inc = inc;
    }
  }

  public static final class AssignStmt extends Stmt {
    public final List<Expr> lhs;

    /** {@link Op#ASSIGN}, {@link Op#DEFINE}, or a compound assignment operator. */
    public Op op;

    public final List<Expr> rhs;

    public AssignStmt(List<Expr> lhs, Op op, List<Expr> rhs) {
      super(Kind.ASSIGN);
      this.lhs = new ArrayList<>(lhs);
      this.op = op;
      this.rhs = new ArrayList<>(rhs);
    }
  }

  public static final class GoStmt extends Stmt {
    public CallExpr call;

    public GoStmt(CallExpr call) {
      super(Kind.GO);
      this.call = call;
    }
  }

  public static final class DeferStmt extends Stmt {
    public CallExpr call;

    public DeferStmt(CallExpr call) {
      super(Kind.DEFER);
      this.call = call;
    }
  }

  public static final class ReturnStmt extends Stmt {
    public final List<Expr> results;

    public ReturnStmt(List<Expr> results) {
      super(Kind.RETURN);
      this.results = new ArrayList<>(results);
    }
  }

  public enum Branch {
    BREAK,
    CONTINUE;

    @Override
    public String toString() {
      return name().toLowerCase();
    }
  }

  public static final class BranchStmt extends Stmt {
    public final Branch branch;

    public BranchStmt(Branch branch) {
      super(Kind.BRANCH);
      this.branch = branch;
    }
  }

  public static final class BlockStmt extends Stmt {
    public final List<Stmt> list;

    public BlockStmt(List<Stmt> list) {
      super(Kind.BLOCK);
      this.list = new ArrayList<>(list);
    }
  }

  public static final class IfStmt extends Stmt {
    public @Nullable Stmt init;
    public Expr cond;
    public final BlockStmt body;

    /** Null, an IfStmt, or a BlockStmt. */
    public @Nullable Stmt els;

    public IfStmt(@Nullable Stmt init, Expr cond, BlockStmt body, @Nullable Stmt els) {
      super(Kind.IF);
      this.init = init;
      this.cond = cond;
      this.body = body;
      this.els = els;
    }
  }

  public static final class ForStmt extends Stmt {
    public @Nullable Stmt init;
    public @Nullable Expr cond;
    public @Nullable Stmt post;
    public final BlockStmt body;

    public ForStmt(
        @Nullable Stmt init, @Nullable Expr cond, @Nullable Stmt post, BlockStmt body) {
      super(Kind.FOR);
      this.init = init;
      this.cond = cond;
      this.post = post;
      this.body = body;
    }
  }

  public static final class RangeStmt extends Stmt {
    public @Nullable Expr key;
    public @Nullable Expr value;

    /** True for {@code :=}, false for {@code =} (or when there is no key). */
    public final boolean define;

    public Expr x;
    public final BlockStmt body;

    public RangeStmt(
        @Nullable Expr key, @Nullable Expr value, boolean define, Expr x, BlockStmt body) {
      super(Kind.RANGE);
      this.key = key;
      this.value = value;
      this.define = define;
      this.x = x;
      this.body = body;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Specs and declarations

  public static final class ImportSpec extends Spec {
    /** Null if no explicit name was given. */
    public final @Nullable Ident name;

    public final BasicLit path;

    public ImportSpec(@Nullable Ident name, BasicLit path) {
      super(Kind.IMPORT_SPEC);
      this.name = name;
      this.path = path;
    }

    /** The unquoted import path. */
    public String pathValue() {
      return Literals.unquote(path.value);
    }
  }

  /** A const or var spec. */
  public static final class ValueSpec extends Spec {
    public final List<Ident> names;
    public @Nullable Expr type;
    public final List<Expr> values;

    public ValueSpec(List<Ident> names, @Nullable Expr type, List<Expr> values) {
      super(Kind.VALUE_SPEC);
      this.names = new ArrayList<>(names);
      this.type = type;
      this.values = new ArrayList<>(values);
    }
  }

  public static final class TypeSpec extends Spec {
    public final Ident name;
    public Expr type;

    public TypeSpec(Ident name, Expr type) {
      super(Kind.TYPE_SPEC);
      this.name = name;
      this.type = type;
    }
  }

  public enum DeclKind {
    IMPORT,
    CONST,
    VAR,
    TYPE;

    @Override
    public String toString() {
      return name().toLowerCase();
    }
  }

  public static final class GenDecl extends Decl {
    public final DeclKind declKind;
    public final List<Spec> specs;

    /** True if the specs are enclosed in parentheses. */
    public boolean grouped;

    public GenDecl(DeclKind declKind, List<? extends Spec> specs, boolean grouped) {
      super(Kind.GEN_DECL);
      this.declKind = declKind;
      this.specs = new ArrayList<>(specs);
      this.grouped = grouped;
    }
  }

  public static final class FuncDecl extends Decl {
    /** Null for functions; a FieldList with a single Field for methods. */
    public final @Nullable FieldList recv;

    public final Ident name;
    public final FuncType type;

    /** Null for external (body-less) declarations in package stubs. */
    public @Nullable BlockStmt body;

    public FuncDecl(
        @Nullable FieldList recv, Ident name, FuncType type, @Nullable BlockStmt body) {
      super(Kind.FUNC_DECL);
      this.recv = recv;
      this.name = name;
      this.type = type;
      this.body = body;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Roots

  /** A complete translation unit. */
  public static final class File extends Node {
    public final String packageName;
    public final List<Comment> doc;
    public final List<Decl> decls;
    public final List<Comment> comments;
    public final LineMap lines;

    public File(
        String packageName,
        List<Comment> doc,
        List<? extends Decl> decls,
        List<Comment> comments,
        LineMap lines) {
      super(Kind.FILE);
      this.packageName = packageName;
      this.doc = new ArrayList<>(doc);
      this.decls = new ArrayList<>(decls);
      this.comments = new ArrayList<>(comments);
      this.lines = lines;
    }
  }

  /** The statements of a single REPL submission. */
  public static final class StatementBlock extends Node {
    public final List<Stmt> stmts;

    /** Comments that precede the first statement. */
    public final List<Comment> doc;

    public final List<Comment> comments;
    public final LineMap lines;

    public StatementBlock(
        List<Stmt> stmts, List<Comment> doc, List<Comment> comments, LineMap lines) {
      super(Kind.STATEMENT_BLOCK);
      this.stmts = new ArrayList<>(stmts);
      this.doc = new ArrayList<>(doc);
      this.comments = new ArrayList<>(comments);
      this.lines = lines;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Constructors for synthesized nodes

  public static Ident ident(String name) {
    return new Ident(name);
  }

  /** Returns {@code x.sel}. */
  public static SelectorExpr selector(Expr x, String sel) {
    return new SelectorExpr(x, new Ident(sel));
  }

  /** Returns {@code pkg.name}, or just {@code name} if {@code pkg} is empty. */
  public static Expr qualified(String pkg, String name) {
    return pkg.isEmpty() ? new Ident(name) : selector(new Ident(pkg), name);
  }

  public static CallExpr call(Expr fun, Expr... args) {
    return new CallExpr(fun, Arrays.asList(args), false);
  }

  public static BasicLit stringLit(String s) {
    return new BasicLit(LitKind.STRING, Literals.quote(s));
  }

  public static ExprStmt exprStmt(Expr x) {
    return new ExprStmt(x);
  }

  public static BlockStmt block(Stmt... stmts) {
    return new BlockStmt(Arrays.asList(stmts));
  }

  public static FieldList emptyFields() {
    return new FieldList(List.of());
  }
}
