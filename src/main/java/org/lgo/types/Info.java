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


package org.lgo.types;

import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast.Expr;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.Node;

/**
 * The results of type checking. All maps are keyed by node identity.
 *
 * <p>Identifiers that declare a symbol are in {@link #defs}; the only declaring identifiers mapped
 * to null are those of a {@code :=} that redeclare an existing variable (those are in {@link
 * #uses}). Every other resolved identifier is in {@link #uses}.
 */
public final class Info {
  public final Map<Ident, Symbol> defs = new IdentityHashMap<>();
  public final Map<Ident, Symbol> uses = new IdentityHashMap<>();
  public final Map<Expr, TypeAndValue> types = new IdentityHashMap<>();

  /** Symbols declared implicitly by a node, i.e. the PkgName of an import without a name. */
  public final Map<Node, Symbol> implicits = new IdentityHashMap<>();

  /** The scopes of File, FuncType, BlockStmt, IfStmt, ForStmt and RangeStmt nodes. */
  public final Map<Node, Scope> scopes = new IdentityHashMap<>();

  /** Returns the symbol defined or used by {@code id}, or null. */
  public @Nullable Symbol symbolOf(Ident id) {
    Symbol result = defs.get(id);
    return (result != null) ? result : uses.get(id);
  }

  /** Returns the type recorded for {@code e}, or null if none was recorded. */
  public @Nullable Type typeOf(Expr e) {
    TypeAndValue tv = types.get(e);
    return (tv == null) ? null : tv.type;
  }
}
