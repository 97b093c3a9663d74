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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast.AssignStmt;
import org.lgo.ast.Ast.BlockStmt;
import org.lgo.ast.Ast.Branch;
import org.lgo.ast.Ast.BranchStmt;
import org.lgo.ast.Ast.CallExpr;
import org.lgo.ast.Ast.DeclStmt;
import org.lgo.ast.Ast.DeferStmt;
import org.lgo.ast.Ast.Expr;
import org.lgo.ast.Ast.ExprStmt;
import org.lgo.ast.Ast.ForStmt;
import org.lgo.ast.Ast.FuncLit;
import org.lgo.ast.Ast.FuncType;
import org.lgo.ast.Ast.GenDecl;
import org.lgo.ast.Ast.GoStmt;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.IfStmt;
import org.lgo.ast.Ast.IncDecStmt;
import org.lgo.ast.Ast.Node;
import org.lgo.ast.Ast.ParenExpr;
import org.lgo.ast.Ast.RangeStmt;
import org.lgo.ast.Ast.ReturnStmt;
import org.lgo.ast.Ast.Spec;
import org.lgo.ast.Ast.Stmt;
import org.lgo.ast.Ast.TypeSpec;
import org.lgo.ast.Ast.ValueSpec;
import org.lgo.ast.Op;
import org.lgo.ast.Walker;
import org.lgo.types.TypeAndValue.Mode;
import org.lgo.types.Types.MapType;
import org.lgo.types.Types.Signature;
import org.lgo.types.Types.Slice;
import org.lgo.types.Types.Tuple;

/**
 * Checks function bodies on behalf of a {@link Checker}: declares local symbols, checks each
 * statement, and reports unused local variables and missing returns.
 */
final class StmtChecker {
  private final Checker checker;
  private final ExprChecker exprs;
  private final Info info;

  /** The signature of the function whose body is being checked. */
  private @Nullable Signature sig;

  /** The number of enclosing loops within the current function. */
  private int loopDepth;

  /** The identifiers that declared the current function's local variables, in order. */
  private List<Ident> locals = new ArrayList<>();

  StmtChecker(Checker checker) {
    this.checker = checker;
    this.exprs = checker.exprs;
    this.info = checker.info;
  }

  /**
   * Checks the body of a function or function literal. The function's scope is a child of
   * {@code parent}; state belonging to an enclosing function is restored afterwards.
   */
  void funcBody(Signature sig, FuncType type, BlockStmt body, Scope parent) {
    Signature savedSig = this.sig;
    int savedLoopDepth = loopDepth;
    List<Ident> savedLocals = locals;
    Scope savedScope = checker.scope;
    Scope scope = new Scope(parent, "function");
    info.scopes.put(type, scope);
    if (sig.recv != null) {
      declareParam(scope, sig.recv);
    }
    for (Var v : sig.params.vars) {
      declareParam(scope, v);
    }
    for (Var v : sig.results.vars) {
      declareParam(scope, v);
    }
    this.sig = sig;
    loopDepth = 0;
    locals = new ArrayList<>();
    checker.scope = scope;
    try {
      stmtList(body.list);
      if (sig.results.size() > 0 && !isTerminatingList(body.list)) {
        checker.errorAt(Math.max(body.pos, body.end - 1), "missing return");
      }
      for (Ident id : locals) {
        Var v = (Var) info.defs.get(id);
        if (!v.used) {
          checker.error(id, "%s declared and not used", id.name);
        }
      }
    } finally {
      this.sig = savedSig;
      loopDepth = savedLoopDepth;
      locals = savedLocals;
      checker.scope = savedScope;
    }
  }

  private void declareParam(Scope scope, Var v) {
    if (!v.name.isEmpty() && !v.name.equals("_") && scope.insert(v) != null) {
      checker.errorAt(v.pos, "duplicate argument " + v.name);
    }
  }

  private void openScope(Node node, String comment) {
    Scope scope = new Scope(checker.scope, comment);
    info.scopes.put(node, scope);
    checker.scope = scope;
  }

  private void closeScope() {
    checker.scope = checker.scope.parent;
  }

  /** Adds a local symbol to the current scope. */
  private void declare(Ident id, Symbol sym) {
    info.defs.put(id, sym);
    if (!id.isBlank() && checker.scope.insert(sym) != null) {
      checker.error(id, "%s redeclared in this block", id.name);
    }
  }

  private void declareVar(Ident id, Var v) {
    declare(id, v);
    if (!id.isBlank()) {
      locals.add(id);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Statements

  private void stmtList(List<Stmt> stmts) {
    for (Stmt s : stmts) {
      stmt(s);
    }
  }

  private void stmt(Stmt s) {
    switch (s.kind) {
      case DECL_STMT:
        declStmt((DeclStmt) s);
        break;
      case EXPR_STMT:
        exprStmt((ExprStmt) s);
        break;
      case INC_DEC:
        incDec((IncDecStmt) s);
        break;
      case ASSIGN:
        assign((AssignStmt) s);
        break;
      case GO:
        exprs.expr(((GoStmt) s).call, null);
        break;
      case DEFER:
        exprs.expr(((DeferStmt) s).call, null);
        break;
      case RETURN:
        returnStmt((ReturnStmt) s);
        break;
      case BRANCH:
        if (loopDepth == 0) {
          checker.error(
              s,
              (((BranchStmt) s).branch == Branch.BREAK)
                  ? "break is not in a loop, switch, or select"
                  : "continue is not in a loop");
        }
        break;
      case BLOCK:
        openScope(s, "block");
        stmtList(((BlockStmt) s).list);
        closeScope();
        break;
      case IF:
        ifStmt((IfStmt) s);
        break;
      case FOR:
        forStmt((ForStmt) s);
        break;
      case RANGE:
        rangeStmt((RangeStmt) s);
        break;
      default:
        throw new IllegalStateException("Unexpected statement kind " + s.kind);
    }
  }

  private void declStmt(DeclStmt s) {
    if (!(s.decl instanceof GenDecl)) {
      checker.error(s, "function declaration not allowed in function body");
      return;
    }
    GenDecl decl = (GenDecl) s.decl;
    for (Spec spec : decl.specs) {
      switch (decl.declKind) {
        case CONST:
          {
            ValueSpec vs = (ValueSpec) spec;
            List<Const> consts = new ArrayList<>();
            for (Ident name : vs.names) {
              consts.add(new Const(name.name, checker.pkg, null, name.pos));
            }
            exprs.constSpec(consts, vs);
            for (int i = 0; i < consts.size(); i++) {
              declare(vs.names.get(i), consts.get(i));
            }
            break;
          }
        case VAR:
          {
            ValueSpec vs = (ValueSpec) spec;
            List<Var> vars = new ArrayList<>();
            for (Ident name : vs.names) {
              vars.add(new Var(name.name, checker.pkg, null, name.pos));
            }
            exprs.varSpec(vars, vs);
            for (int i = 0; i < vars.size(); i++) {
              declareVar(vs.names.get(i), vars.get(i));
            }
            break;
          }
        case TYPE:
          {
            TypeSpec ts = (TypeSpec) spec;
            TypeName tn = TypeName.declare(ts.name.name, checker.pkg, ts.name.pos);
            declare(ts.name, tn);
            checker.typeDecl(tn, ts);
            checker.checkRecursion(tn);
            break;
          }
        default:
          checker.error(spec, "imports must appear at the top level");
          break;
      }
    }
  }

  private void exprStmt(ExprStmt s) {
    Operand x = exprs.expr(s.x, null);
    if (x.isInvalid()) {
      return;
    }
    Expr e = unparen(s.x);
    if (e instanceof CallExpr) {
      Expr fun = unparen(((CallExpr) e).fun);
      TypeAndValue ftv = info.types.get(fun);
      if (ftv == null) {
        return;
      } else if (ftv.mode == Mode.BUILTIN) {
        Builtin b = builtinOf(fun);
        if (b == null
            || b.id == Builtin.Id.PANIC
            || b.id == Builtin.Id.DELETE
            || b.id == Builtin.Id.RECOVER) {
          return;
        }
      } else if (ftv.mode != Mode.TYPE) {
        return;
      }
    }
    checker.error(s.x, "%s is not used", x.describe(checker));
  }

  private @Nullable Builtin builtinOf(Expr fun) {
    if (fun instanceof Ident) {
      Symbol sym = info.uses.get(fun);
      if (sym instanceof Builtin) {
        return (Builtin) sym;
      }
    }
    return null;
  }

  private static Expr unparen(Expr e) {
    while (e instanceof ParenExpr) {
      e = ((ParenExpr) e).x;
    }
    return e;
  }

  private void incDec(IncDecStmt s) {
    Operand x = exprs.value(s.x, null);
    if (x.isInvalid()) {
      return;
    }
    if (!Predicates.isNumeric(x.type)) {
      checker.error(
          s.x,
          "invalid operation: %s%s (non-numeric type %s)",
          s.x,
          s.inc ? "++" : "--",
          checker.typeString(x.type));
    } else if (x.mode != Mode.VARIABLE && x.mode != Mode.MAPINDEX) {
      cannotAssign(s.x);
    }
  }

  private void cannotAssign(Expr e) {
    checker.error(e, "cannot assign to %s (neither addressable nor a map index expression)", e);
  }

  private void assign(AssignStmt s) {
    if (s.op == Op.DEFINE) {
      shortVarDecl(s);
    } else if (s.op == Op.ASSIGN) {
      assignVars(s);
    } else {
      opAssign(s);
    }
  }

  /**
   * Returns the type of a variable being assigned to, or null if {@code e} is the blank
   * identifier. Assigning to a variable does not count as using it.
   */
  private @Nullable Type lhsType(Expr e) {
    Expr u = unparen(e);
    if (u instanceof Ident) {
      Ident id = (Ident) u;
      if (id.isBlank()) {
        return null;
      }
      Symbol sym = checker.scope.lookupParent(id.name);
      if (sym == null) {
        checker.error(id, "undefined: %s", id.name);
        return Types.INVALID;
      }
      info.uses.put(id, sym);
      if (sym instanceof Var) {
        checker.objDecl(sym);
        info.types.put(id, new TypeAndValue(Mode.VARIABLE, sym.type()));
        return sym.type();
      }
      cannotAssign(e);
      return Types.INVALID;
    }
    Operand x = exprs.value(e, null);
    if (x.isInvalid()) {
      return Types.INVALID;
    }
    if (x.mode != Mode.VARIABLE && x.mode != Mode.MAPINDEX) {
      cannotAssign(e);
      return Types.INVALID;
    }
    return x.type;
  }

  private void assignVars(AssignStmt s) {
    List<Expr> lhs = s.lhs;
    List<Expr> rhs = s.rhs;
    if (lhs.size() == rhs.size()) {
      for (int i = 0; i < lhs.size(); i++) {
        Type target = lhsType(lhs.get(i));
        Operand x = exprs.value(rhs.get(i), target);
        if (target != null) {
          exprs.assignment(x, target, "assignment");
        } else if (!x.isInvalid()) {
          exprs.varType(x, null, "assignment");
        }
      }
      return;
    }
    List<Type> targets = new ArrayList<>();
    for (Expr e : lhs) {
      targets.add(lhsType(e));
    }
    if (rhs.size() != 1) {
      checker.error(
          s,
          "assignment mismatch: %s but %s",
          ExprChecker.plural(lhs.size(), "variable"),
          ExprChecker.plural(rhs.size(), "value"));
      exprs.useAll(rhs, 0);
      return;
    }
    List<Type> types = exprs.multiValue(rhs.get(0));
    if (types == null) {
      return;
    } else if (types.size() != lhs.size()) {
      exprs.mismatch(s, lhs.size(), rhs.get(0), types.size());
      return;
    }
    for (int i = 0; i < lhs.size(); i++) {
      Type target = targets.get(i);
      if (target != null) {
        exprs.assignable(rhs.get(0), types.get(i), target, "assignment");
      }
    }
  }

  private void opAssign(AssignStmt s) {
    if (s.lhs.size() != 1 || s.rhs.size() != 1) {
      checker.error(s, "assignment operation %s requires single-valued expressions", s.op);
      return;
    }
    Expr lhs = s.lhs.get(0);
    Operand x = exprs.value(lhs, null);
    Operand y = exprs.value(s.rhs.get(0), null);
    Operand result = exprs.binary(lhs, x, y, s.op.binaryOp());
    if (result.isInvalid()) {
      return;
    }
    if (x.mode != Mode.VARIABLE && x.mode != Mode.MAPINDEX) {
      cannotAssign(lhs);
      return;
    }
    exprs.assignment(result, x.type, "assignment");
  }

  private void shortVarDecl(AssignStmt s) {
    List<@Nullable Var> lhsVars = new ArrayList<>();
    Set<Var> fresh = new HashSet<>();
    List<Ident> newIdents = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (Expr e : s.lhs) {
      if (!(e instanceof Ident)) {
        checker.error(e, "non-name %s on left side of :=", e);
        lhsVars.add(null);
        continue;
      }
      Ident id = (Ident) e;
      if (id.isBlank()) {
        Var v = new Var("_", checker.pkg, null, id.pos);
        info.defs.put(id, v);
        fresh.add(v);
        lhsVars.add(v);
        continue;
      }
      if (!seen.add(id.name)) {
        checker.error(id, "%s repeated on left side of :=", id.name);
        lhsVars.add(null);
        continue;
      }
      Symbol alt = checker.scope.lookup(id.name);
      if (alt != null) {
        info.uses.put(id, alt);
        if (alt instanceof Var) {
          lhsVars.add((Var) alt);
        } else {
          cannotAssign(id);
          lhsVars.add(null);
        }
        continue;
      }
      Var v = new Var(id.name, checker.pkg, null, id.pos);
      info.defs.put(id, v);
      fresh.add(v);
      lhsVars.add(v);
      newIdents.add(id);
    }
    if (newIdents.isEmpty()) {
      checker.error(s, "no new variables on left side of :=");
    }

    List<Expr> rhs = s.rhs;
    if (lhsVars.size() == rhs.size()) {
      for (int i = 0; i < rhs.size(); i++) {
        Var v = lhsVars.get(i);
        boolean isNew = v != null && fresh.contains(v);
        Operand x = exprs.value(rhs.get(i), (v != null && !isNew) ? v.type() : null);
        if (v == null) {
          continue;
        } else if (isNew) {
          v.type = exprs.varType(x, null, "assignment");
        } else {
          exprs.assignment(x, v.type(), "assignment");
        }
      }
    } else {
      List<Type> types = null;
      if (rhs.size() == 1) {
        types = exprs.multiValue(rhs.get(0));
        if (types != null && types.size() != lhsVars.size()) {
          exprs.mismatch(s, lhsVars.size(), rhs.get(0), types.size());
          types = null;
        }
      } else {
        checker.error(
            s,
            "assignment mismatch: %s but %s",
            ExprChecker.plural(lhsVars.size(), "variable"),
            ExprChecker.plural(rhs.size(), "value"));
        exprs.useAll(rhs, 0);
      }
      for (int i = 0; i < lhsVars.size(); i++) {
        Var v = lhsVars.get(i);
        if (v == null) {
          continue;
        } else if (fresh.contains(v)) {
          v.type = (types == null) ? Types.INVALID : Types.defaultType(types.get(i));
        } else if (types != null) {
          exprs.assignable(rhs.get(0), types.get(i), v.type(), "assignment");
        }
      }
    }
    for (Ident id : newIdents) {
      declareVar(id, (Var) info.defs.get(id));
    }
  }

  private void returnStmt(ReturnStmt s) {
    Tuple results = sig.results;
    List<Expr> values = s.results;
    if (values.isEmpty()) {
      if (results.size() > 0 && results.vars.get(0).name.isEmpty()) {
        checker.error(s, "not enough return values");
      }
      return;
    }
    if (results.size() == 0) {
      checker.error(values.get(0), "too many return values");
      exprs.useAll(values, 0);
      return;
    }
    String context = "return statement";
    if (values.size() == results.size()) {
      for (int i = 0; i < values.size(); i++) {
        Type t = results.type(i);
        exprs.assignment(exprs.value(values.get(i), t), t, context);
      }
      return;
    }
    if (values.size() == 1) {
      List<Type> types = exprs.multiValue(values.get(0));
      if (types == null) {
        return;
      } else if (types.size() != results.size()) {
        checker.error(values.get(0), returnCountError(types.size(), results.size()));
        return;
      }
      for (int i = 0; i < types.size(); i++) {
        exprs.assignable(values.get(0), types.get(i), results.type(i), context);
      }
      return;
    }
    checker.error(values.get(0), returnCountError(values.size(), results.size()));
    exprs.useAll(values, 0);
  }

  private static String returnCountError(int have, int want) {
    return (have < want) ? "not enough return values" : "too many return values";
  }

  private void ifStmt(IfStmt s) {
    openScope(s, "if");
    if (s.init != null) {
      stmt(s.init);
    }
    condition(s.cond, "if");
    stmt(s.body);
    if (s.els != null) {
      stmt(s.els);
    }
    closeScope();
  }

  private void condition(@Nullable Expr cond, String statement) {
    if (cond == null) {
      return;
    }
    Operand x = exprs.value(cond, null);
    if (!x.isInvalid() && !Predicates.isBoolean(x.type)) {
      checker.error(cond, "non-boolean condition in %s statement", statement);
    }
  }

  private void forStmt(ForStmt s) {
    openScope(s, "for");
    if (s.init != null) {
      stmt(s.init);
    }
    condition(s.cond, "for");
    if (s.post != null) {
      if (s.post instanceof AssignStmt && ((AssignStmt) s.post).op == Op.DEFINE) {
        checker.error(s.post, "cannot declare in post statement of for loop");
      } else {
        stmt(s.post);
      }
    }
    loopDepth++;
    stmt(s.body);
    loopDepth--;
    closeScope();
  }

  private void rangeStmt(RangeStmt s) {
    openScope(s, "range");
    Operand x = exprs.value(s.x, null);
    Type keyType = Types.INVALID;
    Type valueType = Types.INVALID;
    if (!x.isInvalid()) {
      Type u = x.type.underlying();
      if (Predicates.isString(u)) {
        exprs.convertUntyped(x, Types.STRING);
        keyType = Types.INT;
        valueType = Types.RUNE;
      } else if (u instanceof Slice) {
        keyType = Types.INT;
        valueType = ((Slice) u).elem;
      } else if (u instanceof MapType) {
        keyType = ((MapType) u).key;
        valueType = ((MapType) u).elem;
      } else {
        checker.error(s.x, "cannot range over %s", x.describe(checker));
      }
    }
    Expr[] lhs = {s.key, s.value};
    Type[] types = {keyType, valueType};
    if (s.define) {
      List<Ident> ids = new ArrayList<>();
      List<Var> vars = new ArrayList<>();
      for (int i = 0; i < 2; i++) {
        if (lhs[i] == null) {
          continue;
        } else if (!(lhs[i] instanceof Ident)) {
          checker.error(lhs[i], "non-name %s on left side of :=", lhs[i]);
          continue;
        }
        Ident id = (Ident) lhs[i];
        ids.add(id);
        vars.add(new Var(id.name, checker.pkg, types[i], id.pos));
      }
      for (int i = 0; i < ids.size(); i++) {
        declareVar(ids.get(i), vars.get(i));
      }
    } else {
      for (int i = 0; i < 2; i++) {
        if (lhs[i] != null) {
          Type target = lhsType(lhs[i]);
          if (target != null) {
            exprs.assignable(lhs[i], types[i], target, "range");
          }
        }
      }
    }
    loopDepth++;
    stmt(s.body);
    loopDepth--;
    closeScope();
  }

  // ---------------------------------------------------------------------------------------------
  // Termination

  private boolean isTerminatingList(List<Stmt> stmts) {
    return !stmts.isEmpty() && isTerminating(stmts.get(stmts.size() - 1));
  }

  private boolean isTerminating(Stmt s) {
    switch (s.kind) {
      case RETURN:
        return true;
      case EXPR_STMT:
        {
          Expr e = unparen(((ExprStmt) s).x);
          if (!(e instanceof CallExpr)) {
            return false;
          }
          Builtin b = builtinOf(unparen(((CallExpr) e).fun));
          return b != null && b.id == Builtin.Id.PANIC;
        }
      case BLOCK:
        return isTerminatingList(((BlockStmt) s).list);
      case IF:
        {
          IfStmt is = (IfStmt) s;
          return is.els != null && isTerminating(is.body) && isTerminating(is.els);
        }
      case FOR:
        {
          ForStmt fs = (ForStmt) s;
          return fs.cond == null && !hasBreak(fs.body);
        }
      default:
        return false;
    }
  }

  /** True if {@code body} contains a break that refers to the loop enclosing it. */
  private static boolean hasBreak(BlockStmt body) {
    boolean[] found = {false};
    Walker.walk(
        body,
        node -> {
          if (node instanceof BranchStmt && ((BranchStmt) node).branch == Branch.BREAK) {
            found[0] = true;
          }
          return !found[0]
              && !(node instanceof ForStmt)
              && !(node instanceof RangeStmt)
              && !(node instanceof FuncLit);
        });
    return found[0];
  }
}
