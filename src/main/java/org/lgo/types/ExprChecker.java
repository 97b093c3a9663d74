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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast.BasicLit;
import org.lgo.ast.Ast.BinaryExpr;
import org.lgo.ast.Ast.CallExpr;
import org.lgo.ast.Ast.CompositeLit;
import org.lgo.ast.Ast.Ellipsis;
import org.lgo.ast.Ast.Expr;
import org.lgo.ast.Ast.Field;
import org.lgo.ast.Ast.FieldList;
import org.lgo.ast.Ast.FuncLit;
import org.lgo.ast.Ast.FuncType;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.IndexExpr;
import org.lgo.ast.Ast.InterfaceType;
import org.lgo.ast.Ast.KeyValueExpr;
import org.lgo.ast.Ast.Node;
import org.lgo.ast.Ast.ParenExpr;
import org.lgo.ast.Ast.SelectorExpr;
import org.lgo.ast.Ast.SliceExpr;
import org.lgo.ast.Ast.SliceType;
import org.lgo.ast.Ast.StarExpr;
import org.lgo.ast.Ast.StructType;
import org.lgo.ast.Ast.TypeAssertExpr;
import org.lgo.ast.Ast.UnaryExpr;
import org.lgo.ast.Ast.ValueSpec;
import org.lgo.ast.Op;
import org.lgo.types.TypeAndValue.Mode;
import org.lgo.types.Types.Basic;
import org.lgo.types.Types.BasicKind;
import org.lgo.types.Types.Interface;
import org.lgo.types.Types.MapType;
import org.lgo.types.Types.Named;
import org.lgo.types.Types.Pointer;
import org.lgo.types.Types.Signature;
import org.lgo.types.Types.Slice;
import org.lgo.types.Types.Struct;
import org.lgo.types.Types.Tuple;

/** Checks expressions, type expressions and value declarations on behalf of a {@link Checker}. */
final class ExprChecker {
  private final Checker checker;
  private final Info info;

  ExprChecker(Checker checker) {
    this.checker = checker;
    this.info = checker.info;
  }

  // ---------------------------------------------------------------------------------------------
  // Value declarations

  /** Sets the types of the constants declared by {@code spec}. */
  void constSpec(List<? extends Symbol> consts, ValueSpec spec) {
    Type declared = null;
    if (spec.type != null) {
      declared = typeExpr(spec.type);
      if (declared != Types.INVALID && !(declared.underlying() instanceof Basic)) {
        checker.error(spec.type, "invalid constant type %s", checker.typeString(declared));
        declared = Types.INVALID;
      }
    }
    for (int i = 0; i < consts.size(); i++) {
      Symbol c = consts.get(i);
      if (i >= spec.values.size()) {
        checker.error(spec.names.get(i), "missing init expr for const declaration");
        c.type = Types.INVALID;
        continue;
      }
      Operand x = value(spec.values.get(i), null);
      if (x.isInvalid()) {
        c.type = Types.INVALID;
      } else if (!x.isConstant()) {
        checker.error(x.expr, "%s is not constant", x.describe(checker));
        c.type = Types.INVALID;
      } else if (declared != null) {
        assignment(x, declared, "constant declaration");
        c.type = declared;
      } else {
        c.type = x.type;
      }
    }
    if (spec.values.size() > consts.size()) {
      checker.error(spec.values.get(consts.size()), "extra init expr");
    }
  }

  /** Sets the types of the variables declared by {@code spec}. */
  void varSpec(List<Var> vars, ValueSpec spec) {
    Type declared = (spec.type != null) ? typeExpr(spec.type) : null;
    initVars(vars, spec.values, declared, spec);
  }

  /**
   * Sets the types of {@code lhs} from their initializers (which may be a single multi-valued
   * expression) and an optional declared type.
   */
  void initVars(List<Var> lhs, List<Expr> values, @Nullable Type declared, Node at) {
    if (values.isEmpty()) {
      for (Var v : lhs) {
        v.type = (declared != null) ? declared : Types.INVALID;
      }
      return;
    }
    if (lhs.size() == values.size()) {
      for (int i = 0; i < lhs.size(); i++) {
        Operand x = value(values.get(i), declared);
        lhs.get(i).type = varType(x, declared, "variable declaration");
      }
      return;
    }
    if (values.size() == 1) {
      Expr rhs = values.get(0);
      List<Type> types = multiValue(rhs);
      if (types != null && types.size() != lhs.size()) {
        mismatch(at, lhs.size(), rhs, types.size());
        types = null;
      }
      for (int i = 0; i < lhs.size(); i++) {
        Var v = lhs.get(i);
        if (types == null) {
          v.type = Types.INVALID;
        } else if (declared != null) {
          assignable(rhs, types.get(i), declared, "variable declaration");
          v.type = declared;
        } else {
          v.type = Types.defaultType(types.get(i));
        }
      }
      return;
    }
    checker.error(
        at,
        "assignment mismatch: %s but %s",
        plural(lhs.size(), "variable"),
        plural(values.size(), "value"));
    useAll(values, 0);
    for (Var v : lhs) {
      v.type = Types.INVALID;
    }
  }

  /** Returns the type of a variable with initial value {@code x} and optional declared type. */
  Type varType(Operand x, @Nullable Type declared, String context) {
    if (declared != null) {
      assignment(x, declared, context);
      return declared;
    }
    if (x.isInvalid()) {
      return Types.INVALID;
    }
    if (x.isNil()) {
      checker.error(x.expr, "use of untyped nil in %s", context);
      return Types.INVALID;
    }
    convertUntyped(x, Types.defaultType(x.type));
    return x.type;
  }

  void mismatch(Node at, int numVars, Expr rhs, int numValues) {
    checker.error(
        at,
        "assignment mismatch: %s but %s returns %s",
        plural(numVars, "variable"),
        rhs,
        plural(numValues, "value"));
  }

  static String plural(int n, String noun) {
    return n + " " + noun + ((n == 1) ? "" : "s");
  }

  /** Reports an error unless a value of type {@code t} (produced by {@code at}) fits {@code target}. */
  void assignable(Expr at, Type t, Type target, String context) {
    if (t != Types.INVALID && target != Types.INVALID && !Predicates.assignable(t, target)) {
      checker.error(
          at,
          "cannot use %s value as %s value in %s",
          checker.typeString(t),
          checker.typeString(target),
          context);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Operands

  /** Checks an expression, which may be a value, a type, or a builtin. */
  Operand expr(Expr e, @Nullable Type hint) {
    Operand x = exprInternal(e, hint);
    record(x);
    return x;
  }

  /** Checks an expression that must have a single value. */
  Operand value(Expr e, @Nullable Type hint) {
    Operand x = expr(e, hint);
    singleValue(x);
    return x;
  }

  /**
   * Checks an expression that may have several values: a call, or a map index or type assertion
   * used in a comma-ok assignment. Returns null if the expression is invalid.
   */
  @Nullable List<Type> multiValue(Expr e) {
    Operand x = expr(e, null);
    if (x.isInvalid()) {
      return null;
    }
    if (x.mode == Mode.MAPINDEX || x.mode == Mode.COMMAOK) {
      return ImmutableList.of(x.type, Types.UNTYPED_BOOL);
    } else if (x.mode == Mode.NOVALUE) {
      return ImmutableList.of();
    } else if (x.type instanceof Tuple) {
      List<Type> result = new ArrayList<>();
      for (Var v : ((Tuple) x.type).vars) {
        result.add(v.type());
      }
      return result;
    }
    singleValue(x);
    return x.isInvalid() ? null : ImmutableList.of(x.type);
  }

  private void singleValue(Operand x) {
    if (x.isInvalid()) {
      return;
    }
    switch (x.mode) {
      case NOVALUE:
        checker.error(x.expr, "%s (no value) used as value", x.expr);
        break;
      case BUILTIN:
        checker.error(x.expr, "%s (built-in) must be called", x.expr);
        break;
      case TYPE:
        checker.error(x.expr, "%s (type) is not an expression", x.expr);
        break;
      default:
        if (!(x.type instanceof Tuple)) {
          return;
        }
        checker.error(
            x.expr,
            "multiple-value %s (value of type %s) in single-value context",
            x.expr,
            checker.typeString(x.type));
        break;
    }
    x.invalidate();
  }

  private void record(Operand x) {
    if (!x.isInvalid()) {
      info.types.put(x.expr, new TypeAndValue(x.mode, x.type));
    }
  }

  /** Checks the given expressions for their side effects on {@link Info} and unused variables. */
  void useAll(List<Expr> exprs, int start) {
    for (int i = start; i < exprs.size(); i++) {
      Expr e = exprs.get(i);
      if (!(e instanceof KeyValueExpr)) {
        expr(e, null);
      }
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Assignability and untyped operands

  /** Checks that {@code x} may be assigned to a variable of type {@code target}. */
  void assignment(Operand x, Type target, String context) {
    if (x.isInvalid() || target == Types.INVALID) {
      return;
    }
    if (Types.isUntyped(x.type)) {
      if (!Predicates.assignable(x.type, target)) {
        cannotUse(x, target, context, "");
        x.invalidate();
      } else {
        convertUntyped(x, target);
      }
      return;
    }
    if (!Predicates.assignable(x.type, target)) {
      String reason = "";
      Type tu = target.underlying();
      if (tu instanceof Interface) {
        Func missing = Predicates.missingMethod(x.type, (Interface) tu);
        if (missing != null) {
          reason =
              String.format(
                  ": %s does not implement %s (missing method %s)",
                  checker.typeString(x.type),
                  checker.typeString(target),
                  missing.name);
        }
      }
      cannotUse(x, target, context, reason);
    }
  }

  private void cannotUse(Operand x, Type target, String context, String reason) {
    checker.error(
        x.expr,
        "cannot use %s as %s value in %s%s",
        x.describe(checker),
        checker.typeString(target),
        context,
        reason);
  }

  /**
   * If {@code x} is untyped, gives it the type {@code target} (or, if {@code target} is an
   * interface, its default type).
   */
  void convertUntyped(Operand x, Type target) {
    if (x.isInvalid() || !Types.isUntyped(x.type) || target == Types.INVALID) {
      return;
    }
    if (Types.isUntyped(target)) {
      return;
    }
    Type tu = target.underlying();
    if (x.isNil()) {
      if (!Predicates.hasNil(target)) {
        checker.error(x.expr, "cannot convert nil to type %s", checker.typeString(target));
        x.invalidate();
        return;
      }
      x.type = target;
    } else if (tu instanceof Interface) {
      x.type = Types.defaultType(x.type);
    } else if (!Predicates.assignable(x.type, target)) {
      checker.error(
          x.expr, "cannot convert %s to type %s", x.describe(checker), checker.typeString(target));
      x.invalidate();
      return;
    } else {
      x.type = target;
    }
    record(x);
  }

  /** Gives untyped operands of a binary operation a common type. */
  private void matchTypes(Operand x, Operand y) {
    boolean xUntyped = Types.isUntyped(x.type);
    boolean yUntyped = Types.isUntyped(y.type);
    if (xUntyped && !yUntyped) {
      convertUntyped(x, y.type);
    } else if (!xUntyped && yUntyped) {
      convertUntyped(y, x.type);
    } else if (xUntyped && yUntyped) {
      BasicKind xk = ((Basic) x.type).kind;
      BasicKind yk = ((Basic) y.type).kind;
      if (xk.isNumeric() && yk.isNumeric() && xk != yk) {
        Type larger = (xk.compareTo(yk) > 0) ? x.type : y.type;
        x.type = larger;
        y.type = larger;
        record(x);
        record(y);
      }
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Expressions

  private Operand exprInternal(Expr e, @Nullable Type hint) {
    switch (e.kind) {
      case IDENT:
        return ident((Ident) e);
      case BASIC_LIT:
        return basicLit((BasicLit) e);
      case COMPOSITE_LIT:
        return compositeLit((CompositeLit) e, hint);
      case FUNC_LIT:
        {
          FuncLit lit = (FuncLit) e;
          Signature sig = signature(null, lit.type);
          checker.stmts.funcBody(sig, lit.type, lit.body, checker.scope);
          return new Operand(e, Mode.VALUE, sig);
        }
      case PAREN:
        {
          Operand inner = expr(((ParenExpr) e).x, hint);
          Operand result = new Operand(e, inner.mode, inner.type);
          result.builtin = inner.builtin;
          return result;
        }
      case SELECTOR:
        return selector((SelectorExpr) e);
      case INDEX:
        return index((IndexExpr) e);
      case SLICE:
        return slice((SliceExpr) e);
      case TYPE_ASSERT:
        return typeAssert((TypeAssertExpr) e);
      case CALL:
        return call((CallExpr) e);
      case STAR:
        return star((StarExpr) e);
      case UNARY:
        return unary((UnaryExpr) e, hint);
      case BINARY:
        {
          BinaryExpr b = (BinaryExpr) e;
          Operand x = value(b.x, null);
          Operand y = value(b.y, null);
          return binary(e, x, y, b.op);
        }
      case KEY_VALUE:
        checker.error(e, "unexpected key:value expression");
        return Operand.invalid(e);
      case ELLIPSIS:
        checker.error(e, "invalid use of ...");
        useAll(ImmutableList.of(((Ellipsis) e).elt), 0);
        return Operand.invalid(e);
      case SLICE_TYPE:
      case MAP_TYPE:
      case STRUCT_TYPE:
      case FUNC_TYPE:
      case INTERFACE_TYPE:
        {
          Type t = typeExprInternal(e);
          return (t == Types.INVALID) ? Operand.invalid(e) : new Operand(e, Mode.TYPE, t);
        }
      default:
        throw new IllegalStateException("Unexpected expression kind " + e.kind);
    }
  }

  private Operand ident(Ident id) {
    if (id.isBlank()) {
      checker.error(id, "cannot use _ as value");
      return Operand.invalid(id);
    }
    Symbol sym = checker.scope.lookupParent(id.name);
    if (sym == null) {
      checker.error(id, "undefined: %s", id.name);
      return Operand.invalid(id);
    }
    info.uses.put(id, sym);
    return symbolOperand(id, sym);
  }

  private Operand symbolOperand(Expr e, Symbol sym) {
    checker.objDecl(sym);
    if (sym instanceof PkgName) {
      checker.error(e, "use of package %s without selector", sym.name);
      return Operand.invalid(e);
    } else if (sym instanceof Builtin) {
      Operand result = new Operand(e, Mode.BUILTIN, Types.INVALID);
      result.builtin = (Builtin) sym;
      return result;
    }
    if (sym instanceof Var) {
      ((Var) sym).used = true;
    }
    Type t = sym.type();
    if (t == Types.INVALID) {
      return Operand.invalid(e);
    }
    if (sym instanceof Const) {
      return new Operand(e, Mode.CONSTANT, t);
    } else if (sym instanceof TypeName) {
      return new Operand(e, Mode.TYPE, t);
    } else if (sym instanceof Var) {
      return new Operand(e, Mode.VARIABLE, t);
    }
    return new Operand(e, Mode.VALUE, t);
  }

  private static Operand basicLit(BasicLit lit) {
    Type t;
    switch (lit.litKind) {
      case INT:
        t = Types.UNTYPED_INT;
        break;
      case FLOAT:
        t = Types.UNTYPED_FLOAT;
        break;
      case RUNE:
        t = Types.UNTYPED_RUNE;
        break;
      default:
        t = Types.UNTYPED_STRING;
        break;
    }
    return new Operand(lit, Mode.CONSTANT, t);
  }

  private Operand compositeLit(CompositeLit lit, @Nullable Type hint) {
    Type t;
    if (lit.type != null) {
      t = typeExpr(lit.type);
    } else if (hint != null) {
      t = hint;
    } else {
      checker.error(lit, "invalid composite literal type: missing type");
      useAll(lit.elts, 0);
      return Operand.invalid(lit);
    }
    // An elided &T in the elements of a []*T literal.
    Type base = t;
    if (lit.type == null && t instanceof Pointer) {
      base = ((Pointer) t).elem;
    }
    Type u = base.underlying();
    if (t == Types.INVALID) {
      useAll(lit.elts, 0);
      return Operand.invalid(lit);
    } else if (u instanceof Struct) {
      structLit(lit, (Struct) u, base);
    } else if (u instanceof Slice) {
      Type elem = ((Slice) u).elem;
      for (Expr elt : lit.elts) {
        if (elt instanceof KeyValueExpr) {
          checker.error(elt, "index keys are not supported in slice literals");
          continue;
        }
        assignment(value(elt, elem), elem, "slice literal");
      }
    } else if (u instanceof MapType) {
      MapType mt = (MapType) u;
      for (Expr elt : lit.elts) {
        if (!(elt instanceof KeyValueExpr)) {
          checker.error(elt, "missing key in map literal");
          expr(elt, null);
          continue;
        }
        KeyValueExpr kv = (KeyValueExpr) elt;
        assignment(value(kv.key, mt.key), mt.key, "map literal");
        assignment(value(kv.value, mt.elem), mt.elem, "map literal");
      }
    } else {
      checker.error(lit, "invalid composite literal type %s", checker.typeString(t));
      useAll(lit.elts, 0);
      return Operand.invalid(lit);
    }
    return new Operand(lit, Mode.VALUE, t);
  }

  private void structLit(CompositeLit lit, Struct s, Type t) {
    if (lit.elts.isEmpty()) {
      return;
    }
    if (lit.elts.get(0) instanceof KeyValueExpr) {
      Set<String> seen = new HashSet<>();
      for (Expr elt : lit.elts) {
        if (!(elt instanceof KeyValueExpr)) {
          checker.error(elt, "mixture of field:value and value elements in struct literal");
          expr(elt, null);
          continue;
        }
        KeyValueExpr kv = (KeyValueExpr) elt;
        Var f = (kv.key instanceof Ident) ? s.field(((Ident) kv.key).name) : null;
        if (f == null || !accessible(f)) {
          checker.error(
              kv.key, "unknown field %s in struct literal of type %s", kv.key, checker.typeString(t));
          expr(kv.value, null);
          continue;
        }
        Ident key = (Ident) kv.key;
        info.uses.put(key, f);
        if (!seen.add(key.name)) {
          checker.error(key, "duplicate field name %s in struct literal", key.name);
        }
        assignment(value(kv.value, f.type()), f.type(), "struct literal");
      }
      return;
    }
    for (int i = 0; i < lit.elts.size(); i++) {
      Expr elt = lit.elts.get(i);
      if (elt instanceof KeyValueExpr) {
        checker.error(elt, "mixture of field:value and value elements in struct literal");
        continue;
      }
      if (i >= s.fields.size()) {
        checker.error(elt, "too many values in struct literal of type %s", checker.typeString(t));
        useAll(lit.elts, i);
        return;
      }
      Var f = s.fields.get(i);
      Operand x = value(elt, f.type());
      if (!accessible(f)) {
        checker.error(
            elt,
            "implicit assignment to unexported field %s in struct literal of type %s",
            f.name,
            checker.typeString(t));
      } else {
        assignment(x, f.type(), "struct literal");
      }
    }
    if (lit.elts.size() < s.fields.size()) {
      checker.errorAt(
          Math.max(lit.pos, lit.end - 1),
          String.format("too few values in struct literal of type %s", checker.typeString(t)));
    }
  }

  /** True if {@code sym} may be referred to by name from the package being checked. */
  private boolean accessible(Symbol sym) {
    return sym.exported() || sym.pkg == null || sym.pkg == checker.pkg || sym.pkg.session;
  }

  private Operand selector(SelectorExpr sel) {
    if (sel.x instanceof Ident) {
      Ident xid = (Ident) sel.x;
      Symbol s = checker.scope.lookupParent(xid.name);
      if (s instanceof PkgName) {
        Symbol member = qualified(xid, (PkgName) s, sel);
        return (member == null) ? Operand.invalid(sel) : symbolOperand(sel, member);
      }
    }
    Operand x = expr(sel.x, null);
    if (x.isInvalid()) {
      return Operand.invalid(sel);
    }
    if (x.mode == Mode.TYPE) {
      checker.error(sel, "method expressions are not supported: %s", sel);
      return Operand.invalid(sel);
    }
    singleValue(x);
    if (x.isInvalid()) {
      return Operand.invalid(sel);
    }
    String name = sel.sel.name;
    Symbol found = lookupFieldOrMethod(x.type, name);
    if (found == null) {
      checker.error(
          sel.sel,
          "%s undefined (type %s has no field or method %s)",
          sel,
          checker.typeString(x.type),
          name);
      return Operand.invalid(sel);
    } else if (!accessible(found)) {
      checker.error(
          sel.sel, "%s undefined (cannot refer to unexported field or method %s)", sel, name);
      return Operand.invalid(sel);
    }
    info.uses.put(sel.sel, found);
    if (found instanceof Var) {
      boolean addressable = x.mode == Mode.VARIABLE || x.type.underlying() instanceof Pointer;
      return new Operand(sel, addressable ? Mode.VARIABLE : Mode.VALUE, found.type());
    }
    Signature sig = ((Func) found).signature();
    if (sig == null) {
      return Operand.invalid(sel);
    }
    if (sig.recv != null
        && sig.recv.type() instanceof Pointer
        && !(x.type instanceof Pointer)
        && x.mode != Mode.VARIABLE) {
      checker.error(
          sel, "cannot call pointer method %s on %s", name, checker.typeString(x.type));
      return Operand.invalid(sel);
    }
    return new Operand(sel, Mode.VALUE, Predicates.stripRecv(sig));
  }

  /** Resolves {@code pkg.name}; returns null (after reporting an error) if it cannot. */
  private @Nullable Symbol qualified(Ident xid, PkgName pkgName, SelectorExpr sel) {
    info.uses.put(xid, pkgName);
    pkgName.used = true;
    Package imported = pkgName.imported;
    Symbol member = imported.scope.lookup(sel.sel.name);
    if (member == null) {
      checker.error(sel.sel, "undefined: %s", sel);
      return null;
    } else if (!member.exported() && !imported.session) {
      checker.error(sel.sel, "name %s not exported by package %s", sel.sel.name, imported.name);
      return null;
    }
    info.uses.put(sel.sel, member);
    return member;
  }

  /**
   * Returns the field or method named {@code name} of a value of type {@code t}: a method of its
   * named type (or of the type it points to), a struct field, or an interface method. The result
   * is the declared Symbol, so it may be used as the target of {@link Info#uses}.
   */
  static @Nullable Symbol lookupFieldOrMethod(Type t, String name) {
    Type base = t;
    boolean isPointer = false;
    if (t instanceof Pointer) {
      base = ((Pointer) t).elem;
      isPointer = true;
    }
    if (base instanceof Named) {
      Func m = ((Named) base).method(name);
      if (m != null) {
        return m;
      }
    }
    Type u = base.underlying();
    if (u instanceof Struct) {
      return ((Struct) u).field(name);
    } else if (u instanceof Interface && !isPointer) {
      return ((Interface) u).method(name);
    }
    return null;
  }

  private Operand index(IndexExpr ix) {
    Operand x = value(ix.x, null);
    if (x.isInvalid()) {
      expr(ix.index, null);
      return Operand.invalid(ix);
    }
    Type u = x.type.underlying();
    if (Predicates.isString(u)) {
      checkIndex(ix.index);
      convertUntyped(x, Types.STRING);
      return new Operand(ix, Mode.VALUE, Types.BYTE);
    } else if (u instanceof Slice) {
      checkIndex(ix.index);
      return new Operand(ix, Mode.VARIABLE, ((Slice) u).elem);
    } else if (u instanceof MapType) {
      MapType mt = (MapType) u;
      assignment(value(ix.index, mt.key), mt.key, "map index");
      return new Operand(ix, Mode.MAPINDEX, mt.elem);
    }
    checker.error(ix, "invalid operation: cannot index %s", x.describe(checker));
    expr(ix.index, null);
    return Operand.invalid(ix);
  }

  private void checkIndex(@Nullable Expr e) {
    if (e == null) {
      return;
    }
    Operand i = value(e, null);
    if (i.isInvalid()) {
      return;
    }
    if (!Predicates.isInteger(i.type)) {
      checker.error(e, "invalid argument: index %s must be integer", i.describe(checker));
    } else {
      convertUntyped(i, Types.INT);
    }
  }

  private Operand slice(SliceExpr se) {
    Operand x = value(se.x, null);
    checkIndex(se.low);
    checkIndex(se.high);
    if (x.isInvalid()) {
      return Operand.invalid(se);
    }
    Type u = x.type.underlying();
    if (Predicates.isString(u)) {
      convertUntyped(x, Types.STRING);
      return new Operand(se, Mode.VALUE, x.type);
    } else if (u instanceof Slice) {
      return new Operand(se, Mode.VALUE, x.type);
    }
    checker.error(se, "cannot slice %s", x.describe(checker));
    return Operand.invalid(se);
  }

  private Operand typeAssert(TypeAssertExpr ta) {
    Operand x = value(ta.x, null);
    Type t = typeExpr(ta.type);
    if (x.isInvalid() || t == Types.INVALID) {
      return Operand.invalid(ta);
    }
    if (!Predicates.isInterface(x.type)) {
      checker.error(ta.x, "invalid operation: %s is not an interface", x.describe(checker));
      return Operand.invalid(ta);
    }
    if (!Predicates.isInterface(t)) {
      Func missing = Predicates.missingMethod(t, (Interface) x.type.underlying());
      if (missing != null) {
        checker.error(
            ta.type,
            "impossible type assertion: %s does not implement %s (missing method %s)",
            checker.typeString(t),
            checker.typeString(x.type),
            missing.name);
        return Operand.invalid(ta);
      }
    }
    return new Operand(ta, Mode.COMMAOK, t);
  }

  private Operand star(StarExpr s) {
    Operand x = expr(s.x, null);
    if (x.isInvalid()) {
      return Operand.invalid(s);
    }
    if (x.mode == Mode.TYPE) {
      return new Operand(s, Mode.TYPE, new Pointer(x.type));
    }
    singleValue(x);
    if (x.isInvalid()) {
      return Operand.invalid(s);
    }
    if (x.isNil()) {
      checker.error(s, "invalid operation: cannot indirect nil");
      return Operand.invalid(s);
    }
    Type u = x.type.underlying();
    if (!(u instanceof Pointer)) {
      checker.error(s, "invalid operation: cannot indirect %s", x.describe(checker));
      return Operand.invalid(s);
    }
    return new Operand(s, Mode.VARIABLE, ((Pointer) u).elem);
  }

  private Operand unary(UnaryExpr u, @Nullable Type hint) {
    if (u.op == Op.AND) {
      Expr inner = u.x;
      while (inner instanceof ParenExpr) {
        inner = ((ParenExpr) inner).x;
      }
      if (inner instanceof CompositeLit) {
        Type elemHint = (hint instanceof Pointer) ? ((Pointer) hint).elem : null;
        Operand x = value(u.x, elemHint);
        return x.isInvalid() ? Operand.invalid(u) : new Operand(u, Mode.VALUE, new Pointer(x.type));
      }
      Operand x = value(u.x, null);
      if (x.isInvalid()) {
        return Operand.invalid(u);
      }
      if (x.mode != Mode.VARIABLE) {
        checker.error(u, "invalid operation: cannot take address of %s", x.describe(checker));
        return Operand.invalid(u);
      }
      return new Operand(u, Mode.VALUE, new Pointer(x.type));
    }
    Operand x = value(u.x, null);
    if (x.isInvalid()) {
      return Operand.invalid(u);
    }
    boolean ok = (u.op == Op.NOT) ? Predicates.isBoolean(x.type) : Predicates.isNumeric(x.type);
    if (!ok) {
      checker.error(
          u, "invalid operation: operator %s not defined on %s", u.op, x.describe(checker));
      return Operand.invalid(u);
    }
    return new Operand(u, x.isConstant() ? Mode.CONSTANT : Mode.VALUE, x.type);
  }

  /** Checks the binary operation {@code x op y}, represented by {@code e}. */
  Operand binary(Expr e, Operand x, Operand y, Op op) {
    if (x.isInvalid() || y.isInvalid()) {
      return Operand.invalid(e);
    }
    Mode mode = (x.isConstant() && y.isConstant()) ? Mode.CONSTANT : Mode.VALUE;
    if (op == Op.SHL || op == Op.SHR) {
      if (!Predicates.isInteger(y.type)) {
        checker.error(
            y.expr, "invalid operation: shift count %s must be integer", y.describe(checker));
        return Operand.invalid(e);
      } else if (!Predicates.isInteger(x.type)) {
        checker.error(
            x.expr, "invalid operation: shifted operand %s must be integer", x.describe(checker));
        return Operand.invalid(e);
      }
      convertUntyped(y, Types.INT);
      if (mode != Mode.CONSTANT) {
        convertUntyped(x, Types.INT);
      }
      return new Operand(e, mode, x.type);
    }
    boolean nilComparison = x.isNil() || y.isNil();
    matchTypes(x, y);
    if (x.isInvalid() || y.isInvalid()) {
      return Operand.invalid(e);
    }
    if (op.isComparison()) {
      return comparison(e, x, y, op, mode, nilComparison);
    }
    if (!Predicates.identical(x.type, y.type)) {
      mismatchedTypes(e, x, y);
      return Operand.invalid(e);
    }
    if (!operatorAllowed(op, x.type)) {
      checker.error(
          e, "invalid operation: operator %s not defined on %s", op, x.describe(checker));
      return Operand.invalid(e);
    }
    if ((op == Op.QUO || op == Op.REM)
        && y.isConstant()
        && Predicates.isInteger(y.type)
        && isZero(y.expr)) {
      checker.error(y.expr, "invalid operation: division by zero");
      return Operand.invalid(e);
    }
    return new Operand(e, mode, x.type);
  }

  private void mismatchedTypes(Expr e, Operand x, Operand y) {
    checker.error(
        e,
        "invalid operation: %s (mismatched types %s and %s)",
        e,
        checker.typeString(x.type),
        checker.typeString(y.type));
  }

  /**
   * Checks a comparison. If {@code nilComparison}, one of the operands was nil before it was
   * given the type of the other.
   */
  private Operand comparison(
      Expr e, Operand x, Operand y, Op op, Mode mode, boolean nilComparison) {
    if (!Predicates.assignable(x.type, y.type) && !Predicates.assignable(y.type, x.type)) {
      mismatchedTypes(e, x, y);
      return Operand.invalid(e);
    }
    boolean ok;
    Operand bad;
    if (op == Op.EQL || op == Op.NEQ) {
      if (nilComparison) {
        ok = Predicates.hasNil(x.type) && !x.isNil();
        bad = x;
      } else {
        ok = Predicates.comparable(x.type) && Predicates.comparable(y.type);
        bad = Predicates.comparable(x.type) ? y : x;
      }
    } else {
      ok = isOrdered(x.type) && isOrdered(y.type);
      bad = isOrdered(x.type) ? y : x;
    }
    if (!ok) {
      checker.error(
          e, "invalid operation: %s (operator %s not defined on %s)", e, op, bad.describe(checker));
      return Operand.invalid(e);
    }
    return new Operand(e, mode, Types.UNTYPED_BOOL);
  }

  private static boolean isOrdered(Type t) {
    return Predicates.isNumeric(t) || Predicates.isString(t);
  }

  private static boolean operatorAllowed(Op op, Type t) {
    switch (op) {
      case LAND:
      case LOR:
        return Predicates.isBoolean(t);
      case ADD:
        return Predicates.isNumeric(t) || Predicates.isString(t);
      case SUB:
      case MUL:
      case QUO:
        return Predicates.isNumeric(t);
      default:
        return Predicates.isInteger(t);
    }
  }

  private static boolean isZero(Expr e) {
    while (e instanceof ParenExpr) {
      e = ((ParenExpr) e).x;
    }
    if (!(e instanceof BasicLit)) {
      return false;
    }
    String v = ((BasicLit) e).value.replace("_", "");
    return v.matches("0+|0[xX]0+");
  }

  // ---------------------------------------------------------------------------------------------
  // Calls

  private Operand call(CallExpr call) {
    Operand f = expr(call.fun, null);
    if (f.isInvalid()) {
      useAll(call.args, 0);
      return Operand.invalid(call);
    }
    if (f.mode == Mode.TYPE) {
      return conversion(call, f.type);
    } else if (f.mode == Mode.BUILTIN) {
      return BuiltinCall.check(this, checker, call, f.builtin);
    }
    singleValue(f);
    if (f.isInvalid()) {
      useAll(call.args, 0);
      return Operand.invalid(call);
    }
    Type u = f.type.underlying();
    if (!(u instanceof Signature)) {
      checker.error(call, "invalid operation: cannot call non-function %s", f.describe(checker));
      useAll(call.args, 0);
      return Operand.invalid(call);
    }
    Signature sig = (Signature) u;
    arguments(call, sig);
    Tuple results = sig.results;
    if (results.size() == 0) {
      return new Operand(call, Mode.NOVALUE, Tuple.EMPTY);
    } else if (results.size() == 1) {
      return new Operand(call, Mode.VALUE, results.type(0));
    }
    return new Operand(call, Mode.VALUE, results);
  }

  private Operand conversion(CallExpr call, Type t) {
    if (call.args.size() != 1) {
      checker.error(
          call,
          "%s argument%s in conversion to %s",
          call.args.isEmpty() ? "missing" : "too many",
          call.args.isEmpty() ? "" : "s",
          checker.typeString(t));
      useAll(call.args, 0);
      return Operand.invalid(call);
    }
    if (call.hasEllipsis) {
      checker.error(call, "invalid use of ... in conversion to %s", checker.typeString(t));
    }
    Operand x = value(call.args.get(0), null);
    if (x.isInvalid()) {
      return Operand.invalid(call);
    }
    boolean constant = x.isConstant() && t.underlying() instanceof Basic;
    boolean ok;
    if (x.isNil()) {
      ok = Predicates.hasNil(t);
    } else if (Types.isUntyped(x.type)) {
      ok =
          Predicates.assignable(x.type, t)
              || Predicates.convertible(Types.defaultType(x.type), t);
      if (ok) {
        convertUntyped(x, Predicates.assignable(x.type, t) ? t : Types.defaultType(x.type));
      }
    } else {
      ok = Predicates.convertible(x.type, t);
    }
    if (!ok) {
      checker.error(
          call, "cannot convert %s to type %s", x.describe(checker), checker.typeString(t));
      return Operand.invalid(call);
    }
    return new Operand(call, constant ? Mode.CONSTANT : Mode.VALUE, t);
  }

  /** Checks the arguments of a call to a function with signature {@code sig}. */
  private void arguments(CallExpr call, Signature sig) {
    List<Operand> args = new ArrayList<>();
    if (call.args.size() == 1 && !call.hasEllipsis) {
      Expr arg = call.args.get(0);
      Operand x = expr(arg, null);
      if (x.isInvalid()) {
        return;
      }
      if (x.mode == Mode.VALUE && x.type instanceof Tuple) {
        spreadArguments(call, sig, arg, (Tuple) x.type);
        return;
      }
      singleValue(x);
      if (x.isInvalid()) {
        return;
      }
      args.add(x);
    } else {
      for (Expr arg : call.args) {
        args.add(value(arg, null));
      }
    }
    Tuple params = sig.params;
    int n = args.size();
    int np = params.size();
    String context = "argument to " + call.fun;
    if (call.hasEllipsis) {
      if (!sig.variadic) {
        checker.error(call, "cannot use ... in call to non-variadic %s", call.fun);
        return;
      } else if (n != np) {
        argCountError(call, n < np);
        return;
      }
      for (int i = 0; i < n; i++) {
        assignment(args.get(i), params.type(i), context);
      }
      return;
    }
    if (sig.variadic ? n < np - 1 : n != np) {
      argCountError(call, n < np);
      return;
    }
    for (int i = 0; i < n; i++) {
      assignment(args.get(i), paramType(sig, i), context);
    }
  }

  private void spreadArguments(CallExpr call, Signature sig, Expr arg, Tuple types) {
    int n = types.size();
    int np = sig.params.size();
    if (sig.variadic ? n < np - 1 : n != np) {
      argCountError(call, n < np);
      return;
    }
    for (int i = 0; i < n; i++) {
      assignable(arg, types.type(i), paramType(sig, i), "argument to " + call.fun);
    }
  }

  /** The type of the parameter receiving argument {@code i} (which may be a variadic one). */
  private static Type paramType(Signature sig, int i) {
    int np = sig.params.size();
    if (sig.variadic && i >= np - 1) {
      return ((Slice) sig.params.type(np - 1)).elem;
    }
    return sig.params.type(i);
  }

  private void argCountError(CallExpr call, boolean tooFew) {
    checker.error(
        call, "%s arguments in call to %s", tooFew ? "not enough" : "too many", call.fun);
  }

  // ---------------------------------------------------------------------------------------------
  // Type expressions

  /** Evaluates a type expression; returns {@link Types#INVALID} after reporting any error. */
  Type typeExpr(Expr e) {
    Type t = typeExprInternal(e);
    if (t != Types.INVALID) {
      info.types.put(e, new TypeAndValue(Mode.TYPE, t));
    }
    return t;
  }

  private Type typeExprInternal(Expr e) {
    switch (e.kind) {
      case IDENT:
        {
          Ident id = (Ident) e;
          if (id.isBlank()) {
            checker.error(id, "cannot use _ as value or type");
            return Types.INVALID;
          }
          Symbol sym = checker.scope.lookupParent(id.name);
          if (sym == null) {
            checker.error(id, "undefined: %s", id.name);
            return Types.INVALID;
          }
          info.uses.put(id, sym);
          return typeOf(id, sym);
        }
      case SELECTOR:
        {
          SelectorExpr sel = (SelectorExpr) e;
          if (sel.x instanceof Ident) {
            Symbol s = checker.scope.lookupParent(((Ident) sel.x).name);
            if (s instanceof PkgName) {
              Symbol member = qualified((Ident) sel.x, (PkgName) s, sel);
              return (member == null) ? Types.INVALID : typeOf(sel, member);
            }
          }
          checker.error(e, "%s is not a type", e);
          return Types.INVALID;
        }
      case PAREN:
        return typeExpr(((ParenExpr) e).x);
      case STAR:
        return new Pointer(typeExpr(((StarExpr) e).x));
      case SLICE_TYPE:
        return new Slice(typeExpr(((SliceType) e).elt));
      case MAP_TYPE:
        {
          org.lgo.ast.Ast.MapType mt = (org.lgo.ast.Ast.MapType) e;
          Type key = typeExpr(mt.key);
          Type elem = typeExpr(mt.value);
          if (!Predicates.comparable(key)) {
            checker.error(mt.key, "invalid map key type %s", checker.typeString(key));
          }
          return new MapType(key, elem);
        }
      case STRUCT_TYPE:
        return structType((StructType) e);
      case FUNC_TYPE:
        return signature(null, (FuncType) e);
      case INTERFACE_TYPE:
        return interfaceType((InterfaceType) e);
      case ELLIPSIS:
        checker.error(e, "invalid use of ...");
        return Types.INVALID;
      default:
        checker.error(e, "%s is not a type", e);
        return Types.INVALID;
    }
  }

  private Type typeOf(Expr e, Symbol sym) {
    checker.objDecl(sym);
    if (sym instanceof PkgName) {
      checker.error(e, "use of package %s without selector", sym.name);
      return Types.INVALID;
    } else if (!(sym instanceof TypeName)) {
      checker.error(e, "%s is not a type", e);
      return Types.INVALID;
    }
    return sym.type();
  }

  private Type structType(StructType st) {
    List<Var> fields = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (Field f : st.fields.list) {
      Type t = typeExpr(f.type);
      if (f.names.isEmpty()) {
        checker.error(f, "embedded fields are not supported");
        continue;
      }
      for (Ident name : f.names) {
        Var v = Var.field(name.name, checker.pkg, t, name.pos);
        info.defs.put(name, v);
        if (!name.isBlank() && !names.add(name.name)) {
          checker.error(name, "%s redeclared", name.name);
        } else {
          fields.add(v);
        }
      }
    }
    return new Struct(fields);
  }

  private Type interfaceType(InterfaceType it) {
    List<Func> methods = new ArrayList<>();
    List<Var> recvs = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (Field f : it.methods.list) {
      Ident name = f.names.get(0);
      Var recv = new Var("", checker.pkg, null, f.pos);
      Func m = new Func(name.name, checker.pkg, signature(recv, (FuncType) f.type), name.pos);
      info.defs.put(name, m);
      if (!names.add(name.name)) {
        checker.error(name, "duplicate method %s", name.name);
      } else {
        methods.add(m);
        recvs.add(recv);
      }
    }
    Interface result = new Interface(methods);
    for (Var recv : recvs) {
      recv.type = result;
    }
    return result;
  }

  /** Returns the signature of a function with the given receiver and type. */
  Signature signature(@Nullable Var recv, FuncType ft) {
    List<Var> params = new ArrayList<>();
    boolean variadic = false;
    List<Field> list = ft.params.list;
    for (int i = 0; i < list.size(); i++) {
      Field f = list.get(i);
      Type t;
      if (f.type instanceof Ellipsis) {
        t = new Slice(typeExpr(((Ellipsis) f.type).elt));
        if (i != list.size() - 1 || f.names.size() > 1) {
          checker.error(f.type, "can only use ... with final parameter in list");
        } else {
          variadic = true;
        }
      } else {
        t = typeExpr(f.type);
      }
      addVars(params, f, t);
    }
    List<Var> results = new ArrayList<>();
    FieldList resultFields = ft.results;
    if (resultFields != null) {
      for (Field f : resultFields.list) {
        addVars(results, f, typeExpr(f.type));
      }
    }
    return new Signature(recv, new Tuple(params), new Tuple(results), variadic);
  }

  private void addVars(List<Var> vars, Field f, Type t) {
    if (f.names.isEmpty()) {
      vars.add(new Var("", checker.pkg, t, f.pos));
      return;
    }
    for (Ident name : f.names) {
      Var v = new Var(name.name, checker.pkg, t, name.pos);
      info.defs.put(name, v);
      vars.add(v);
    }
  }
}
