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
import java.util.function.Supplier;
import org.lgo.ast.Ast;
import org.lgo.ast.Ast.BlockStmt;
import org.lgo.ast.Ast.ForStmt;
import org.lgo.ast.Ast.FuncDecl;
import org.lgo.ast.Ast.FuncLit;
import org.lgo.ast.Ast.Node;
import org.lgo.ast.Ast.RangeStmt;
import org.lgo.ast.Walker;

/**
 * Inserts a call to {@code core.ExitIfCtxDone()} at the start of every function body and loop
 * body, so that a cancelled execution stops at its next call or iteration.
 */
final class AutoExit {

  // Statics only
  private AutoExit() {}

  /** @param core returns the qualifier for the runtime package; called only if needed */
  static void inject(Node root, Supplier<String> core) {
    List<BlockStmt> bodies = new ArrayList<>();
    Walker.walk(
        root,
        n -> {
          if (n instanceof FuncDecl) {
            BlockStmt body = ((FuncDecl) n).body;
            if (body != null) {
              bodies.add(body);
            }
          } else if (n instanceof FuncLit) {
            bodies.add(((FuncLit) n).body);
          } else if (n instanceof ForStmt) {
            bodies.add(((ForStmt) n).body);
          } else if (n instanceof RangeStmt) {
            bodies.add(((RangeStmt) n).body);
          }
          return true;
        });
    if (bodies.isEmpty()) {
      return;
    }
    String qualifier = core.get();
    for (BlockStmt body : bodies) {
      body.list.add(
          0, Ast.exprStmt(Ast.call(Ast.qualified(qualifier, CoreHooks.EXIT_IF_CTX_DONE))));
    }
  }
}
