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
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast.AssignStmt;
import org.lgo.ast.Ast.BinaryExpr;
import org.lgo.ast.Ast.BlockStmt;
import org.lgo.ast.Ast.CallExpr;
import org.lgo.ast.Ast.CompositeLit;
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
import org.lgo.ast.Ast.IfStmt;
import org.lgo.ast.Ast.IncDecStmt;
import org.lgo.ast.Ast.IndexExpr;
import org.lgo.ast.Ast.InterfaceType;
import org.lgo.ast.Ast.KeyValueExpr;
import org.lgo.ast.Ast.MapType;
import org.lgo.ast.Ast.Node;
import org.lgo.ast.Ast.ParenExpr;
import org.lgo.ast.Ast.RangeStmt;
import org.lgo.ast.Ast.ReturnStmt;
import org.lgo.ast.Ast.SelectorExpr;
import org.lgo.ast.Ast.SliceExpr;
import org.lgo.ast.Ast.SliceType;
import org.lgo.ast.Ast.StarExpr;
import org.lgo.ast.Ast.StatementBlock;
import org.lgo.ast.Ast.StructType;
import org.lgo.ast.Ast.TypeAssertExpr;
import org.lgo.ast.Ast.TypeSpec;
import org.lgo.ast.Ast.UnaryExpr;
import org.lgo.ast.Ast.ValueSpec;

/**
 * Generic bottom-up rewriting of the expressions in a syntax tree.
 *
 * <p>Every expression in a replaceable position is first rewritten recursively and then passed to
 * the rewrite function, whose result takes its place. Nodes returned by the function are not
 * visited again. Identifiers that are declared names (function names, spec names, field names,
 * selectors' final identifiers) are not in replaceable positions and are never passed to the
 * function.
 */
public final class Rewriter {

  // Statics only
  private Rewriter() {}

  /** Rewrites every replaceable expression below {@code root}. */
  public static void rewriteExprs(Node root, UnaryOperator<Expr> fn) {
    new Rewriter.Pass(fn).children(root);
  }

  private static class Pass {
    final UnaryOperator<Expr> fn;

    Pass(UnaryOperator<Expr> fn) {
      this.fn = fn;
    }

    Expr expr(Expr e) {
      children(e);
      return fn.apply(e);
    }

    @Nullable Expr optional(@Nullable Expr e) {
      return (e == null) ? null : expr(e);
    }

    void list(List<Expr> exprs) {
      exprs.replaceAll(this::expr);
    }

    void optionalNode(@Nullable Node node) {
      if (node != null) {
        children(node);
      }
    }

    void children(Node node) {
      switch (node.kind) {
        case IDENT:
        case BASIC_LIT:
        case BRANCH:
        case IMPORT_SPEC:
          break;
        case COMPOSITE_LIT:
          {
            CompositeLit lit = (CompositeLit) node;
            lit.type = optional(lit.type);
            list(lit.elts);
            break;
          }
        case KEY_VALUE:
          {
            KeyValueExpr kv = (KeyValueExpr) node;
            kv.key = expr(kv.key);
            kv.value = expr(kv.value);
            break;
          }
        case FUNC_LIT:
          children(((FuncLit) node).type);
          children(((FuncLit) node).body);
          break;
        case PAREN:
          ((ParenExpr) node).x = expr(((ParenExpr) node).x);
          break;
        case SELECTOR:
          ((SelectorExpr) node).x = expr(((SelectorExpr) node).x);
          break;
        case INDEX:
          {
            IndexExpr index = (IndexExpr) node;
            index.x = expr(index.x);
            index.index = expr(index.index);
            break;
          }
        case SLICE:
          {
            SliceExpr slice = (SliceExpr) node;
            slice.x = expr(slice.x);
            slice.low = optional(slice.low);
            slice.high = optional(slice.high);
            break;
          }
        case TYPE_ASSERT:
          {
            TypeAssertExpr assertion = (TypeAssertExpr) node;
            assertion.x = expr(assertion.x);
            assertion.type = expr(assertion.type);
            break;
          }
        case CALL:
          {
            CallExpr call = (CallExpr) node;
            call.fun = expr(call.fun);
            list(call.args);
            break;
          }
        case STAR:
          ((StarExpr) node).x = expr(((StarExpr) node).x);
          break;
        case UNARY:
          ((UnaryExpr) node).x = expr(((UnaryExpr) node).x);
          break;
        case BINARY:
          {
            BinaryExpr binary = (BinaryExpr) node;
            binary.x = expr(binary.x);
            binary.y = expr(binary.y);
            break;
          }
        case ELLIPSIS:
          ((Ellipsis) node).elt = expr(((Ellipsis) node).elt);
          break;
        case SLICE_TYPE:
          ((SliceType) node).elt = expr(((SliceType) node).elt);
          break;
        case MAP_TYPE:
          {
            MapType map = (MapType) node;
            map.key = expr(map.key);
            map.value = expr(map.value);
            break;
          }
        case STRUCT_TYPE:
          children(((StructType) node).fields);
          break;
        case FUNC_TYPE:
          children(((FuncType) node).params);
          optionalNode(((FuncType) node).results);
          break;
        case INTERFACE_TYPE:
          children(((InterfaceType) node).methods);
          break;
        case FIELD:
          ((Field) node).type = expr(((Field) node).type);
          break;
        case FIELD_LIST:
          ((FieldList) node).list.forEach(this::children);
          break;
        case DECL_STMT:
          children(((DeclStmt) node).decl);
          break;
        case EXPR_STMT:
          ((ExprStmt) node).x = expr(((ExprStmt) node).x);
          break;
        case INC_DEC:
          ((IncDecStmt) node).x = expr(((IncDecStmt) node).x);
          break;
        case ASSIGN:
          list(((AssignStmt) node).lhs);
          list(((AssignStmt) node).rhs);
          break;
        case GO:
          children(((GoStmt) node).call);
          break;
        case DEFER:
          children(((DeferStmt) node).call);
          break;
        case RETURN:
          list(((ReturnStmt) node).results);
          break;
        case BLOCK:
          ((BlockStmt) node).list.forEach(this::children);
          break;
        case IF:
          {
            IfStmt ifStmt = (IfStmt) node;
            optionalNode(ifStmt.init);
            ifStmt.cond = expr(ifStmt.cond);
            children(ifStmt.body);
            optionalNode(ifStmt.els);
            break;
          }
        case FOR:
          {
            ForStmt forStmt = (ForStmt) node;
            optionalNode(forStmt.init);
            forStmt.cond = optional(forStmt.cond);
            optionalNode(forStmt.post);
            children(forStmt.body);
            break;
          }
        case RANGE:
          {
            RangeStmt range = (RangeStmt) node;
            range.key = optional(range.key);
            range.value = optional(range.value);
            range.x = expr(range.x);
            children(range.body);
            break;
          }
        case VALUE_SPEC:
          {
            ValueSpec spec = (ValueSpec) node;
            spec.type = optional(spec.type);
            list(spec.values);
            break;
          }
        case TYPE_SPEC:
          ((TypeSpec) node).type = expr(((TypeSpec) node).type);
          break;
        case GEN_DECL:
          ((GenDecl) node).specs.forEach(this::children);
          break;
        case FUNC_DECL:
          {
            FuncDecl decl = (FuncDecl) node;
            optionalNode(decl.recv);
            children(decl.type);
            optionalNode(decl.body);
            break;
          }
        case FILE:
          ((File) node).decls.forEach(this::children);
          break;
        case STATEMENT_BLOCK:
          ((StatementBlock) node).stmts.forEach(this::children);
          break;
      }
    }
  }
}
