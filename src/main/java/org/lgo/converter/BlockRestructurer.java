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


package org.lgo.converter;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast;
import org.lgo.ast.Ast.AssignStmt;
import org.lgo.ast.Ast.CallExpr;
import org.lgo.ast.Ast.Decl;
import org.lgo.ast.Ast.DeclKind;
import org.lgo.ast.Ast.DeclStmt;
import org.lgo.ast.Ast.Expr;
import org.lgo.ast.Ast.ExprStmt;
import org.lgo.ast.Ast.File;
import org.lgo.ast.Ast.FuncDecl;
import org.lgo.ast.Ast.FuncType;
import org.lgo.ast.Ast.GenDecl;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.StatementBlock;
import org.lgo.ast.Ast.Stmt;
import org.lgo.ast.Ast.ValueSpec;
import org.lgo.ast.Op;

/**
 * Splits a block into a translation unit: type, import and function declarations move to the top
 * level, and every other statement goes into the body of an init function.
 *
 * <p>Variables declared by the block are still local to the init function at this stage; a
 * "consume all" assignment {@code _, _ = a, b} is appended to the body so that the checker does not
 * report them as unused. A trailing expression statement that is not a call is wrapped in {@code
 * panic(...)} for the same reason.
 */
final class BlockRestructurer {

  /** The result of restructuring a block. */
  static final class Restructured {
    final File file;
    final FuncDecl initFunc;

    /** The identifiers declared by {@code var} statements and {@code :=}, in source order. */
    final List<Ident> vars;

    /** Null if the block declared no variables. */
    final @Nullable AssignStmt consumeAll;

    /** The block's final statement, if it is an expression statement. */
    final @Nullable ExprStmt lastExpr;

    /** True if {@link #lastExpr} was wrapped in {@code panic}. */
    final boolean lastExprWrapped;

    private Restructured(
        File file,
        FuncDecl initFunc,
        List<Ident> vars,
        @Nullable AssignStmt consumeAll,
        @Nullable ExprStmt lastExpr,
        boolean lastExprWrapped) {
      this.file = file;
      this.initFunc = initFunc;
      this.vars = vars;
      this.consumeAll = consumeAll;
      this.lastExpr = lastExpr;
      this.lastExprWrapped = lastExprWrapped;
    }

    /** Returns the argument of the {@code panic} call wrapped around the last expression. */
    Expr wrappedExpr() {
      return ((CallExpr) lastExpr.x).args.get(0);
    }
  }

  // Statics only
  private BlockRestructurer() {}

  static Restructured restructure(StatementBlock blk) {
    List<Decl> decls = new ArrayList<>();
    List<Stmt> initBody = new ArrayList<>();
    List<Ident> vars = new ArrayList<>();
    for (Stmt stmt : blk.stmts) {
      if (stmt instanceof DeclStmt) {
        Decl decl = ((DeclStmt) stmt).decl;
        if (decl instanceof GenDecl && isValueDecl((GenDecl) decl)) {
          initBody.add(stmt);
          GenDecl gen = (GenDecl) decl;
          if (gen.declKind == DeclKind.VAR) {
            for (Ast.Spec spec : gen.specs) {
              vars.addAll(((ValueSpec) spec).names);
            }
          }
        } else {
          decls.add(decl);
        }
        continue;
      }
      initBody.add(stmt);
      if (stmt instanceof AssignStmt && ((AssignStmt) stmt).op == Op.DEFINE) {
        for (Expr lhs : ((AssignStmt) stmt).lhs) {
          if (lhs instanceof Ident) {
            vars.add((Ident) lhs);
          }
        }
      }
    }

    ExprStmt lastExpr = null;
    boolean wrapped = false;
    if (!initBody.isEmpty() && initBody.get(initBody.size() - 1) instanceof ExprStmt) {
      lastExpr = (ExprStmt) initBody.get(initBody.size() - 1);
      // panic(f()) is invalid if f has no results, so calls are left alone.
      if (!(lastExpr.x instanceof CallExpr)) {
        lastExpr.x = Ast.call(Ast.ident("panic"), lastExpr.x);
        wrapped = true;
      }
    }

    AssignStmt consumeAll = null;
    List<String> names = uniqueSortedNames(vars);
    if (!names.isEmpty()) {
      List<Expr> lhs = new ArrayList<>();
      List<Expr> rhs = new ArrayList<>();
      for (String name : names) {
        lhs.add(Ast.ident("_"));
        rhs.add(Ast.ident(name));
      }
      consumeAll = new AssignStmt(lhs, Op.ASSIGN, rhs);
      initBody.add(consumeAll);
    }

    FuncDecl initFunc =
        new FuncDecl(
            null,
            Ast.ident(CoreHooks.INIT_FUNC_NAME),
            new FuncType(Ast.emptyFields(), null),
            new Ast.BlockStmt(initBody));
    decls.add(initFunc);
    File file = new File(CoreHooks.PACKAGE_NAME, blk.doc, decls, blk.comments, blk.lines);
    return new Restructured(file, initFunc, vars, consumeAll, lastExpr, wrapped);
  }

  private static boolean isValueDecl(GenDecl gen) {
    return gen.declKind == DeclKind.CONST || gen.declKind == DeclKind.VAR;
  }

  /** Returns the distinct names of {@code ids}, sorted, omitting the blank identifier. */
  static List<String> uniqueSortedNames(List<Ident> ids) {
    TreeSet<String> names = new TreeSet<>();
    for (Ident id : ids) {
      if (!id.isBlank()) {
        names.add(id.name);
      }
    }
    return new ArrayList<>(names);
  }
}
