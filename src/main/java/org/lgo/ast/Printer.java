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

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast.AssignStmt;
import org.lgo.ast.Ast.BasicLit;
import org.lgo.ast.Ast.BinaryExpr;
import org.lgo.ast.Ast.BlockStmt;
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
import org.lgo.ast.Ast.Kind;
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

/**
 * Serializes a syntax tree as Lesser Go source.
 *
 * <p>The layout is fixed: tabs for indentation, one statement per line, a blank line between
 * top-level declarations (except between consecutive import declarations), and composite literals
 * on a single line. Comments other than the file's doc comments are not reproduced.
 */
public class Printer {
  private final StringBuilder sb = new StringBuilder();
  private int indent;

  private Printer() {}

  /** Returns the complete source of {@code file}, ending with a newline. */
  public static String print(File file) {
    Printer p = new Printer();
    p.file(file);
    return p.sb.toString();
  }

  /**
   * Returns the source of a single node (used by {@link Node#toString}). Statements are printed
   * at indent zero, with nested blocks indented relative to that.
   */
  public static String nodeToString(Node node) {
    Printer p = new Printer();
    p.node(node);
    return p.sb.toString();
  }

  private void node(Node node) {
    if (node instanceof Expr) {
      expr((Expr) node);
    } else if (node instanceof Stmt) {
      stmt((Stmt) node);
    } else if (node instanceof Decl) {
      decl((Decl) node);
    } else if (node instanceof Spec) {
      spec(node);
    } else if (node.kind == Kind.FIELD) {
      field((Field) node);
    } else if (node.kind == Kind.FIELD_LIST) {
      params((FieldList) node);
    } else if (node.kind == Kind.FILE) {
      file((File) node);
    } else {
      StatementBlock block = (StatementBlock) node;
      for (Stmt s : block.stmts) {
        stmt(s);
        sb.append('\n');
      }
    }
  }

  private void newline() {
    sb.append('\n');
    for (int i = 0; i < indent; i++) {
      sb.append('\t');
    }
  }

  private void file(File file) {
    for (Comment c : file.doc) {
      sb.append(c.text).append('\n');
    }
    sb.append("package ").append(file.packageName).append('\n');
    Decl prev = null;
    for (Decl d : file.decls) {
      if (!(isImport(prev) && isImport(d))) {
        sb.append('\n');
      }
      decl(d);
      sb.append('\n');
      prev = d;
    }
  }

  private static boolean isImport(@Nullable Decl d) {
    return d instanceof GenDecl && ((GenDecl) d).declKind == DeclKind.IMPORT;
  }

  private void decl(Decl decl) {
    if (decl instanceof FuncDecl) {
      FuncDecl fn = (FuncDecl) decl;
      sb.append("func ");
      if (fn.recv != null) {
        params(fn.recv);
        sb.append(' ');
      }
      sb.append(fn.name.name);
      signature(fn.type);
      if (fn.body != null) {
        sb.append(' ');
        block(fn.body);
      }
      return;
    }
    GenDecl gen = (GenDecl) decl;
    sb.append(gen.declKind).append(' ');
    if (!gen.grouped && gen.specs.size() == 1) {
      spec(gen.specs.get(0));
      return;
    }
    sb.append('(');
    indent++;
    for (Node spec : gen.specs) {
      newline();
      spec(spec);
    }
    indent--;
    newline();
    sb.append(')');
  }

  private void spec(Node spec) {
    switch (spec.kind) {
      case IMPORT_SPEC:
        {
          ImportSpec imp = (ImportSpec) spec;
          if (imp.name != null) {
            sb.append(imp.name.name).append(' ');
          }
          sb.append(imp.path.value);
          break;
        }
      case VALUE_SPEC:
        {
          ValueSpec vs = (ValueSpec) spec;
          exprList(vs.names);
          if (vs.type != null) {
            sb.append(' ');
            expr(vs.type);
          }
          if (!vs.values.isEmpty()) {
            sb.append(" = ");
            exprList(vs.values);
          }
          break;
        }
      case TYPE_SPEC:
        {
          TypeSpec ts = (TypeSpec) spec;
          sb.append(ts.name.name).append(' ');
          expr(ts.type);
          break;
        }
      default:
        throw new IllegalArgumentException("not a spec: " + spec.kind);
    }
  }

  private void block(BlockStmt block) {
    sb.append('{');
    indent++;
    for (Stmt s : block.list) {
      newline();
      stmt(s);
    }
    indent--;
    newline();
    sb.append('}');
  }

  private void stmt(Stmt stmt) {
    switch (stmt.kind) {
      case DECL_STMT:
        decl(((DeclStmt) stmt).decl);
        break;
      case EXPR_STMT:
        expr(((ExprStmt) stmt).x);
        break;
      case INC_DEC:
        expr(((IncDecStmt) stmt).x);
        sb.append(((IncDecStmt) stmt).inc ? "++" : "--");
        break;
      case ASSIGN:
        {
          AssignStmt assign = (AssignStmt) stmt;
          exprList(assign.lhs);
          sb.append(' ').append(assign.op).append(' ');
          exprList(assign.rhs);
          break;
        }
      case GO:
        sb.append("go ");
        expr(((GoStmt) stmt).call);
        break;
      case DEFER:
        sb.append("defer ");
        expr(((DeferStmt) stmt).call);
        break;
      case RETURN:
        {
          List<Expr> results = ((ReturnStmt) stmt).results;
          sb.append("return");
          if (!results.isEmpty()) {
            sb.append(' ');
            exprList(results);
          }
          break;
        }
      case BRANCH:
        sb.append(((BranchStmt) stmt).branch);
        break;
      case BLOCK:
        block((BlockStmt) stmt);
        break;
      case IF:
        {
          IfStmt ifStmt = (IfStmt) stmt;
          sb.append("if ");
          if (ifStmt.init != null) {
            stmt(ifStmt.init);
            sb.append("; ");
          }
          expr(ifStmt.cond);
          sb.append(' ');
          block(ifStmt.body);
          if (ifStmt.els != null) {
            sb.append(" else ");
            stmt(ifStmt.els);
          }
          break;
        }
      case FOR:
        {
          ForStmt forStmt = (ForStmt) stmt;
          sb.append("for ");
          if (forStmt.init != null || forStmt.post != null) {
            if (forStmt.init != null) {
              stmt(forStmt.init);
            }
            sb.append("; ");
            if (forStmt.cond != null) {
              expr(forStmt.cond);
            }
            sb.append("; ");
            if (forStmt.post != null) {
              stmt(forStmt.post);
              sb.append(' ');
            }
          } else if (forStmt.cond != null) {
            expr(forStmt.cond);
            sb.append(' ');
          }
          block(forStmt.body);
          break;
        }
      case RANGE:
        {
          RangeStmt range = (RangeStmt) stmt;
          sb.append("for ");
          if (range.key != null) {
            expr(range.key);
            if (range.value != null) {
              sb.append(", ");
              expr(range.value);
            }
            sb.append(range.define ? " := " : " = ");
          }
          sb.append("range ");
          expr(range.x);
          sb.append(' ');
          block(range.body);
          break;
        }
      default:
        throw new IllegalArgumentException("not a statement: " + stmt.kind);
    }
  }

  private void exprList(List<? extends Expr> exprs) {
    for (int i = 0; i < exprs.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      expr(exprs.get(i));
    }
  }

  private void expr(Expr expr) {
    switch (expr.kind) {
      case IDENT:
        sb.append(((Ident) expr).name);
        break;
      case BASIC_LIT:
        sb.append(((BasicLit) expr).value);
        break;
      case COMPOSITE_LIT:
        {
          CompositeLit lit = (CompositeLit) expr;
          if (lit.type != null) {
            expr(lit.type);
          }
          sb.append('{');
          exprList(lit.elts);
          sb.append('}');
          break;
        }
      case KEY_VALUE:
        expr(((KeyValueExpr) expr).key);
        sb.append(": ");
        expr(((KeyValueExpr) expr).value);
        break;
      case FUNC_LIT:
        sb.append("func");
        signature(((FuncLit) expr).type);
        sb.append(' ');
        block(((FuncLit) expr).body);
        break;
      case PAREN:
        sb.append('(');
        expr(((ParenExpr) expr).x);
        sb.append(')');
        break;
      case SELECTOR:
        expr(((SelectorExpr) expr).x);
        sb.append('.').append(((SelectorExpr) expr).sel.name);
        break;
      case INDEX:
        expr(((IndexExpr) expr).x);
        sb.append('[');
        expr(((IndexExpr) expr).index);
        sb.append(']');
        break;
      case SLICE:
        {
          SliceExpr slice = (SliceExpr) expr;
          expr(slice.x);
          sb.append('[');
          if (slice.low != null) {
            expr(slice.low);
          }
          sb.append(':');
          if (slice.high != null) {
            expr(slice.high);
          }
          sb.append(']');
          break;
        }
      case TYPE_ASSERT:
        expr(((TypeAssertExpr) expr).x);
        sb.append(".(");
        expr(((TypeAssertExpr) expr).type);
        sb.append(')');
        break;
      case CALL:
        {
          CallExpr call = (CallExpr) expr;
          expr(call.fun);
          sb.append('(');
          exprList(call.args);
          if (call.hasEllipsis) {
            sb.append("...");
          }
          sb.append(')');
          break;
        }
      case STAR:
        sb.append('*');
        expr(((StarExpr) expr).x);
        break;
      case UNARY:
        {
          UnaryExpr unary = (UnaryExpr) expr;
          sb.append(unary.op);
          // Keep "- -x" from printing as the decrement token.
          if (unary.x instanceof UnaryExpr && ((UnaryExpr) unary.x).op == unary.op) {
            sb.append(' ');
          }
          expr(unary.x);
          break;
        }
      case BINARY:
        {
          BinaryExpr binary = (BinaryExpr) expr;
          operand(binary.x, binary.op.precedence, false);
          sb.append(' ').append(binary.op).append(' ');
          operand(binary.y, binary.op.precedence, true);
          break;
        }
      case ELLIPSIS:
        sb.append("...");
        expr(((Ellipsis) expr).elt);
        break;
      case SLICE_TYPE:
        sb.append("[]");
        expr(((SliceType) expr).elt);
        break;
      case MAP_TYPE:
        sb.append("map[");
        expr(((MapType) expr).key);
        sb.append(']');
        expr(((MapType) expr).value);
        break;
      case STRUCT_TYPE:
        {
          FieldList fields = ((StructType) expr).fields;
          if (fields.list.isEmpty()) {
            sb.append("struct{}");
            break;
          }
          sb.append("struct {");
          indent++;
          for (Field f : fields.list) {
            newline();
            field(f);
          }
          indent--;
          newline();
          sb.append('}');
          break;
        }
      case FUNC_TYPE:
        sb.append("func");
        signature((FuncType) expr);
        break;
      case INTERFACE_TYPE:
        {
          FieldList methods = ((InterfaceType) expr).methods;
          if (methods.list.isEmpty()) {
            sb.append("interface{}");
            break;
          }
          sb.append("interface {");
          indent++;
          for (Field m : methods.list) {
            newline();
            sb.append(m.names.get(0).name);
            signature((FuncType) m.type);
          }
          indent--;
          newline();
          sb.append('}');
          break;
        }
      default:
        throw new IllegalArgumentException("not an expression: " + expr.kind);
    }
  }

  /**
   * Prints one operand of a binary expression, adding parentheses if the tree's structure would
   * not survive reparsing without them.
   */
  private void operand(Expr x, int precedence, boolean right) {
    boolean parens = false;
    if (x instanceof BinaryExpr) {
      int inner = ((BinaryExpr) x).op.precedence;
      parens = inner < precedence || (right && inner == precedence);
    }
    if (parens) {
      sb.append('(');
      expr(x);
      sb.append(')');
    } else {
      expr(x);
    }
  }

  private void signature(FuncType type) {
    params(type.params);
    FieldList results = type.results;
    if (results == null || results.list.isEmpty()) {
      return;
    }
    sb.append(' ');
    if (results.list.size() == 1 && results.list.get(0).names.isEmpty()) {
      expr(results.list.get(0).type);
    } else {
      params(results);
    }
  }

  private void params(FieldList fields) {
    sb.append('(');
    for (int i = 0; i < fields.list.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      field(fields.list.get(i));
    }
    sb.append(')');
  }

  private void field(Field f) {
    if (!f.names.isEmpty()) {
      exprList(f.names);
      sb.append(' ');
    }
    expr(f.type);
  }
}
