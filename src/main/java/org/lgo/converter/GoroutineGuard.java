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

import java.util.List;
import java.util.function.Supplier;
import org.lgo.ast.Ast;
import org.lgo.ast.Ast.AssignStmt;
import org.lgo.ast.Ast.BlockStmt;
import org.lgo.ast.Ast.CallExpr;
import org.lgo.ast.Ast.DeferStmt;
import org.lgo.ast.Ast.FuncLit;
import org.lgo.ast.Ast.FuncType;
import org.lgo.ast.Ast.GoStmt;
import org.lgo.ast.Ast.Node;
import org.lgo.ast.Ast.Stmt;
import org.lgo.ast.Op;
import org.lgo.ast.Walker;

/**
 * Rewrites each {@code go} statement so that the runtime can track the goroutine and recover a
 * panic raised in it:
 *
 * <pre>
 * {
 *   ectx := core.InitGoroutine()
 *   go func() {
 *     defer core.FinalizeGoroutine(ectx)
 *     f(x)
 *   }()
 * }
 * </pre>
 *
 * {@code InitGoroutine} runs in the launching goroutine, before the new one starts.
 */
final class GoroutineGuard {
  private final Supplier<String> core;
  private final NamePicker picker;

  /**
   * @param core returns the qualifier for the runtime package; called only if there is a {@code
   *     go} statement
   * @param picker chooses the name of each goroutine's state variable
   */
  GoroutineGuard(Supplier<String> core, NamePicker picker) {
    this.core = core;
    this.picker = picker;
  }

  /** Rewrites every {@code go} statement below {@code root}, innermost first. */
  void guard(Node root) {
    Walker.walk(
        root,
        n -> {
          if (n instanceof BlockStmt) {
            block((BlockStmt) n);
            return false;
          }
          return true;
        });
  }

  private void block(BlockStmt b) {
    List<Stmt> list = b.list;
    for (int i = 0; i < list.size(); i++) {
      Stmt stmt = list.get(i);
      guard(stmt);
      if (stmt instanceof GoStmt) {
        list.set(i, wrap((GoStmt) stmt));
      }
    }
  }

  private BlockStmt wrap(GoStmt g) {
    String ectx = picker.newName("ectx");
    String core = this.core.get();
    DeferStmt finalize =
        new DeferStmt(
            Ast.call(Ast.qualified(core, CoreHooks.FINALIZE_GOROUTINE), Ast.ident(ectx)));
    FuncLit body =
        new FuncLit(
            new FuncType(Ast.emptyFields(), null), Ast.block(finalize, Ast.exprStmt(g.call)));
    g.call = Ast.call(body);
    CallExpr init = Ast.call(Ast.qualified(core, CoreHooks.INIT_GOROUTINE));
    return Ast.block(new AssignStmt(List.of(Ast.ident(ectx)), Op.DEFINE, List.of(init)), g);
  }
}
