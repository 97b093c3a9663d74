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
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast.AssignStmt;
import org.lgo.ast.Ast.BinaryExpr;
import org.lgo.ast.Ast.BlockStmt;
import org.lgo.ast.Ast.CallExpr;
import org.lgo.ast.Ast.CompositeLit;
import org.lgo.ast.Ast.DeclStmt;
import org.lgo.ast.Ast.DeferStmt;
import org.lgo.ast.Ast.Ellipsis;
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
import org.lgo.ast.Ast.ImportSpec;
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

/** Generic read-only traversal of a syntax tree. */
public final class Walker {

  // Statics only
  private Walker() {}

  /**
   * Calls {@code visitor} on {@code node} and then, if it returned true, walks each of the node's
   * children in source order.
   */
  public static void walk(Node node, Predicate<Node> visitor) {
    if (visitor.test(node)) {
      forEachChild(node, child -> walk(child, visitor));
    }
  }

  /** Calls {@code action} on each direct child of {@code node}, in source order. */
  public static void forEachChild(Node node, Consumer<Node> action) {
    switch (node.kind) {
      case IDENT:
      case BASIC_LIT:
      case BRANCH:
        break;
      case COMPOSITE_LIT:
        {
          CompositeLit lit = (CompositeLit) node;
          optional(lit.type, action);
          lit.elts.forEach(action);
          break;
        }
      case KEY_VALUE:
        action.accept(((KeyValueExpr) node).key);
        action.accept(((KeyValueExpr) node).value);
        break;
      case FUNC_LIT:
        action.accept(((FuncLit) node).type);
        action.accept(((FuncLit) node).body);
        break;
      case PAREN:
        action.accept(((ParenExpr) node).x);
        break;
      case SELECTOR:
        action.accept(((SelectorExpr) node).x);
        action.accept(((SelectorExpr) node).sel);
        break;
      case INDEX:
        action.accept(((IndexExpr) node).x);
        action.accept(((IndexExpr) node).index);
        break;
      case SLICE:
        {
          SliceExpr slice = (SliceExpr) node;
          action.accept(slice.x);
          optional(slice.low, action);
          optional(slice.high, action);
          break;
        }
      case TYPE_ASSERT:
        action.accept(((TypeAssertExpr) node).x);
        action.accept(((TypeAssertExpr) node).type);
        break;
      case CALL:
        action.accept(((CallExpr) node).fun);
        ((CallExpr) node).args.forEach(action);
        break;
      case STAR:
        action.accept(((StarExpr) node).x);
        break;
      case UNARY:
        action.accept(((UnaryExpr) node).x);
        break;
      case BINARY:
        action.accept(((BinaryExpr) node).x);
        action.accept(((BinaryExpr) node).y);
        break;
      case ELLIPSIS:
        action.accept(((Ellipsis) node).elt);
        break;
      case SLICE_TYPE:
        action.accept(((SliceType) node).elt);
        break;
      case MAP_TYPE:
        action.accept(((MapType) node).key);
        action.accept(((MapType) node).value);
        break;
      case STRUCT_TYPE:
        action.accept(((StructType) node).fields);
        break;
      case FUNC_TYPE:
        action.accept(((FuncType) node).params);
        optional(((FuncType) node).results, action);
        break;
      case INTERFACE_TYPE:
        action.accept(((InterfaceType) node).methods);
        break;
      case FIELD:
        ((Field) node).names.forEach(action);
        action.accept(((Field) node).type);
        break;
      case FIELD_LIST:
        ((FieldList) node).list.forEach(action);
        break;
      case DECL_STMT:
        action.accept(((DeclStmt) node).decl);
        break;
      case EXPR_STMT:
        action.accept(((ExprStmt) node).x);
        break;
      case INC_DEC:
        action.accept(((IncDecStmt) node).x);
        break;
      case ASSIGN:
        ((AssignStmt) node).lhs.forEach(action);
        ((AssignStmt) node).rhs.forEach(action);
        break;
      case GO:
        action.accept(((GoStmt) node).call);
        break;
      case DEFER:
        action.accept(((DeferStmt) node).call);
        break;
      case RETURN:
        ((ReturnStmt) node).results.forEach(action);
        break;
      case BLOCK:
        ((BlockStmt) node).list.forEach(action);
        break;
      case IF:
        {
          IfStmt ifStmt = (IfStmt) node;
          optional(ifStmt.init, action);
          action.accept(ifStmt.cond);
          action.accept(ifStmt.body);
          optional(ifStmt.els, action);
          break;
        }
      case FOR:
        {
          ForStmt forStmt = (ForStmt) node;
          optional(forStmt.init, action);
          optional(forStmt.cond, action);
          optional(forStmt.post, action);
          action.accept(forStmt.body);
          break;
        }
      case RANGE:
        {
          RangeStmt range = (RangeStmt) node;
          optional(range.key, action);
          optional(range.value, action);
          action.accept(range.x);
          action.accept(range.body);
          break;
        }
      case IMPORT_SPEC:
        optional(((ImportSpec) node).name, action);
        action.accept(((ImportSpec) node).path);
        break;
      case VALUE_SPEC:
        {
          ValueSpec spec = (ValueSpec) node;
          spec.names.forEach(action);
          optional(spec.type, action);
          spec.values.forEach(action);
          break;
        }
      case TYPE_SPEC:
        action.accept(((TypeSpec) node).name);
        action.accept(((TypeSpec) node).type);
        break;
      case GEN_DECL:
        ((GenDecl) node).specs.forEach(action);
        break;
      case FUNC_DECL:
        {
          FuncDecl fn = (FuncDecl) node;
          optional(fn.recv, action);
          action.accept(fn.name);
          action.accept(fn.type);
          optional(fn.body, action);
          break;
        }
      case FILE:
        ((File) node).decls.forEach(action);
        break;
      case STATEMENT_BLOCK:
        ((StatementBlock) node).stmts.forEach(action);
        break;
    }
  }

  /** Returns all nodes of type {@code cls} in the tree rooted at {@code root}, in source order. */
  public static <T extends Node> List<T> collect(Node root, Class<T> cls) {
    List<T> result = new ArrayList<>();
    walk(
        root,
        n -> {
          if (cls.isInstance(n)) {
            result.add(cls.cast(n));
          }
          return true;
        });
    return result;
  }

  private static void optional(@Nullable Node node, Consumer<Node> action) {
    if (node != null) {
      action.accept(node);
    }
  }
}
