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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast;
import org.lgo.ast.Ast.AssignStmt;
import org.lgo.ast.Ast.Decl;
import org.lgo.ast.Ast.DeclKind;
import org.lgo.ast.Ast.DeclStmt;
import org.lgo.ast.Ast.Expr;
import org.lgo.ast.Ast.ExprStmt;
import org.lgo.ast.Ast.GenDecl;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.Node;
import org.lgo.ast.Ast.SelectorExpr;
import org.lgo.ast.Ast.Spec;
import org.lgo.ast.Ast.Stmt;
import org.lgo.ast.Ast.UnaryExpr;
import org.lgo.ast.Ast.ValueSpec;
import org.lgo.ast.CompileError;
import org.lgo.ast.Op;
import org.lgo.ast.Rewriter;
import org.lgo.ast.Walker;
import org.lgo.converter.BlockRestructurer.Restructured;
import org.lgo.parser.SourceParser;
import org.lgo.types.Importer;
import org.lgo.types.Info;
import org.lgo.types.Symbol;
import org.lgo.types.Type;
import org.lgo.types.TypeString;
import org.lgo.types.Types;
import org.lgo.types.Types.BasicKind;
import org.lgo.types.Types.MapType;
import org.lgo.types.Types.Pointer;
import org.lgo.types.Types.Signature;
import org.lgo.types.Types.Slice;
import org.lgo.types.Types.Struct;
import org.lgo.types.Types.Tuple;

/**
 * Turns the variables declared by a block into package-level variables, so that later blocks can
 * refer to them, and rewrites the init function's statements to assign to them.
 *
 * <p>Also qualifies references to symbols of earlier blocks with an alias for their package,
 * replaces uses of the execution context variable with a call to the runtime, and arranges for
 * the value of a trailing expression to be printed.
 */
final class StateHoister {

  // Statics only
  private StateHoister() {}

  /**
   * Rewrites the restructured block in place, using the results of checking it in {@code info}.
   *
   * @param olds the symbols of earlier blocks
   * @param runctx the execution context variable, or null if an earlier symbol has its name
   */
  static void hoist(
      Restructured block,
      Info info,
      ImportManager immg,
      Converter.Config conf,
      List<? extends Symbol> olds,
      @Nullable Symbol runctx) {
    qualifyOlds(block.file, info, immg, olds);
    Importer importer = conf.importer();
    if (runctx != null) {
      replaceExecContext(block.file, info, immg, importer, runctx);
    }

    List<Stmt> newBody = new ArrayList<>();
    List<Spec> varSpecs = new ArrayList<>();
    for (Stmt stmt : block.initFunc.body.list) {
      if (stmt == block.consumeAll) {
        continue;
      }
      if (stmt == block.lastExpr) {
        printLastExpr(block, info, immg, importer);
      }
      if (stmt instanceof DeclStmt) {
        GenDecl gen = (GenDecl) ((DeclStmt) stmt).decl;
        if (gen.declKind == DeclKind.VAR) {
          for (Spec spec : gen.specs) {
            ValueSpec vs = (ValueSpec) spec;
            for (Ident name : vs.names) {
              addIfNotNull(varSpecs, varSpec(name, info, immg));
            }
            if (!vs.values.isEmpty()) {
              List<Expr> lhs = new ArrayList<>();
              for (Ident name : vs.names) {
                lhs.add(Ast.ident(name.name));
              }
              newBody.add(new AssignStmt(lhs, Op.ASSIGN, vs.values));
            }
          }
        } else if (gen.declKind == DeclKind.CONST) {
          block.file.decls.add(gen);
        } else {
          throw new IllegalStateException("Unexpected declaration in init body: " + gen.declKind);
        }
        continue;
      }
      newBody.add(stmt);
      if (stmt instanceof AssignStmt && ((AssignStmt) stmt).op == Op.DEFINE) {
        AssignStmt assign = (AssignStmt) stmt;
        assign.op = Op.ASSIGN;
        for (Expr lhs : assign.lhs) {
          if (lhs instanceof Ident) {
            addIfNotNull(varSpecs, varSpec((Ident) lhs, info, immg));
          }
        }
      }
    }
    block.initFunc.body.list.clear();
    block.initFunc.body.list.addAll(newBody);

    if (!varSpecs.isEmpty()) {
      block.file.decls.add(new GenDecl(DeclKind.VAR, varSpecs, true));
      if (conf.registerVars()) {
        String core = immg.shortName(CoreHooks.require(importer, CoreHooks.PATH));
        List<Stmt> registers = new ArrayList<>();
        for (Spec spec : varSpecs) {
          for (Ident name : ((ValueSpec) spec).names) {
            registers.add(
                Ast.exprStmt(
                    Ast.call(
                        Ast.qualified(core, CoreHooks.REGISTER_VAR),
                        Ast.stringLit(name.name),
                        new UnaryExpr(Op.AND, Ast.ident(name.name)))));
          }
        }
        block.initFunc.body.list.addAll(0, registers);
      }
    }

    List<Decl> decls = new ArrayList<>(immg.injectedImports);
    for (Decl decl : block.file.decls) {
      if (decl == block.initFunc && block.initFunc.body.list.isEmpty()) {
        continue;
      }
      decls.add(decl);
    }
    block.file.decls.clear();
    block.file.decls.addAll(decls);
  }

  /**
   * Qualifies each reference to one of {@code olds} with its package's alias ({@code x} becomes
   * {@code pkg0.x}). Selectors are never rewritten, so {@code pkg0.x} is left as it is.
   */
  static void qualifyOlds(
      Node root, Info info, ImportManager immg, List<? extends Symbol> olds) {
    if (olds.isEmpty()) {
      return;
    }
    Set<Symbol> isOld = Collections.newSetFromMap(new IdentityHashMap<>());
    isOld.addAll(olds);
    Rewriter.rewriteExprs(
        root,
        e -> {
          if (!(e instanceof Ident)) {
            return e;
          }
          Symbol sym = info.uses.get(e);
          if (sym == null || !isOld.contains(sym)) {
            return e;
          }
          return new SelectorExpr(Ast.ident(immg.shortName(sym.pkg())), (Ident) e);
        });
  }

  /** Replaces each use of {@code runctx} with a call that retrieves the execution context. */
  static void replaceExecContext(
      Node root, Info info, ImportManager immg, Importer importer, Symbol runctx) {
    Rewriter.rewriteExprs(
        root,
        e -> {
          if (!(e instanceof Ident) || info.uses.get(e) != runctx) {
            return e;
          }
          String core = immg.shortName(CoreHooks.require(importer, CoreHooks.PATH));
          return Ast.call(Ast.qualified(core, CoreHooks.GET_EXEC_CONTEXT));
        });
  }

  /**
   * Wraps the trailing expression in a print call, unless it is a call whose result is not a
   * single value.
   */
  private static void printLastExpr(
      Restructured block, Info info, ImportManager immg, Importer importer) {
    ExprStmt last = block.lastExpr;
    Expr target = null;
    if (block.lastExprWrapped) {
      target = block.wrappedExpr();
    } else {
      Type t = info.typeOf(last.x);
      if (t != null && !(t instanceof Tuple)) {
        target = last.x;
      }
    }
    if (target != null) {
      String core = immg.shortName(CoreHooks.require(importer, CoreHooks.PATH));
      last.x = Ast.call(Ast.qualified(core, CoreHooks.PRINTLN), target);
    }
  }

  /**
   * Returns a package-level declaration for the variable defined by {@code id}, or null if {@code
   * id} does not define a variable of a known type.
   */
  private static @Nullable ValueSpec varSpec(Ident id, Info info, ImportManager immg) {
    if (id.isBlank()) {
      return null;
    }
    Symbol sym = info.defs.get(id);
    if (sym == null || hasInvalid(sym.type())) {
      return null;
    }
    String typeString = TypeString.of(sym.type(), immg::shortName);
    Expr type;
    try {
      type = SourceParser.parseExpr(typeString);
    } catch (CompileError e) {
      throw new IllegalStateException("Failed to parse type expression " + typeString, e);
    }
    // Positions refer to typeString, not to the block.
    Walker.walk(
        type,
        n -> {
          n.pos = Ast.NO_POS;
          n.end = Ast.NO_POS;
          return true;
        });
    return new ValueSpec(List.of(Ast.ident(id.name)), type, List.of());
  }

  /** True if {@code t} could not be resolved, or is built from a type that could not. */
  private static boolean hasInvalid(Type t) {
    if (t instanceof Pointer) {
      return hasInvalid(((Pointer) t).elem);
    } else if (t instanceof Slice) {
      return hasInvalid(((Slice) t).elem);
    } else if (t instanceof MapType) {
      return hasInvalid(((MapType) t).key) || hasInvalid(((MapType) t).elem);
    } else if (t instanceof Struct) {
      return ((Struct) t).fields.stream().anyMatch(f -> hasInvalid(f.type()));
    } else if (t instanceof Signature) {
      Signature sig = (Signature) t;
      return hasInvalid(sig.params) || hasInvalid(sig.results);
    } else if (t instanceof Tuple) {
      return ((Tuple) t).vars.stream().anyMatch(v -> hasInvalid(v.type()));
    }
    return Types.isBasic(t, BasicKind.INVALID);
  }

  private static void addIfNotNull(List<Spec> specs, @Nullable ValueSpec spec) {
    if (spec != null) {
      specs.add(spec);
    }
  }
}
