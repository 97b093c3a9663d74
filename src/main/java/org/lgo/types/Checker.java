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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import org.lgo.ast.Ast.Decl;
import org.lgo.ast.Ast.DeclKind;
import org.lgo.ast.Ast.Expr;
import org.lgo.ast.Ast.Field;
import org.lgo.ast.Ast.File;
import org.lgo.ast.Ast.FuncDecl;
import org.lgo.ast.Ast.GenDecl;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.ImportSpec;
import org.lgo.ast.Ast.Node;
import org.lgo.ast.Ast.ParenExpr;
import org.lgo.ast.Ast.Spec;
import org.lgo.ast.Ast.StarExpr;
import org.lgo.ast.Ast.TypeSpec;
import org.lgo.ast.Ast.ValueSpec;
import org.lgo.ast.CompileError;
import org.lgo.ast.LineMap;
import org.lgo.types.Types.Interface;
import org.lgo.types.Types.Named;
import org.lgo.types.Types.Pointer;
import org.lgo.types.Types.Signature;
import org.lgo.types.Types.Struct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Type-checks a single Lesser Go file as the only file of a package, recording its results in an
 * {@link Info}.
 *
 * <p>Package-level declarations are collected first and then resolved lazily, so that they may
 * appear in any order: resolving a declaration first resolves the declarations it refers to.
 * Methods are attached to their receiver types once all types have been resolved, and function
 * bodies are checked last.
 *
 * <p>Expressions are checked by an {@link ExprChecker} and statements by a {@link StmtChecker};
 * both evaluate names in this Checker's current {@link #scope}.
 */
public final class Checker {

  private static final Logger logger = LoggerFactory.getLogger(Checker.class);

  /** Options for a Checker. */
  public static final class Config {
    final Importer importer;
    final Consumer<CompileError> errorHandler;
    boolean ignoreFuncBodies;
    ImmutableSet<String> alwaysChecked = ImmutableSet.of();

    /** Each diagnostic is passed to {@code errorHandler}; checking continues after an error. */
    public Config(Importer importer, Consumer<CompileError> errorHandler) {
      this.importer = importer;
      this.errorHandler = errorHandler;
    }

    /** If true, function bodies are not checked (except those named by {@link #alwaysCheck}). */
    @CanIgnoreReturnValue
    public Config ignoreFuncBodies(boolean ignore) {
      this.ignoreFuncBodies = ignore;
      return this;
    }

    /** The bodies of functions with these names are checked even when ignoring function bodies. */
    @CanIgnoreReturnValue
    public Config alwaysCheck(String... funcNames) {
      this.alwaysChecked = ImmutableSet.copyOf(funcNames);
      return this;
    }
  }

  /** The resolution state of a package-level declaration. */
  private enum Color {
    WHITE,
    GREY,
    BLACK
  }

  /**
   * A package-level spec or function declaration, shared by all the symbols it declares (a
   * ValueSpec may declare several).
   */
  private static final class DeclInfo {
    final Node node;
    final DeclKind kind;
    final ImmutableList<Symbol> syms;
    Color color = Color.WHITE;

    DeclInfo(Node node, DeclKind kind, List<Symbol> syms) {
      this.node = node;
      this.kind = kind;
      this.syms = ImmutableList.copyOf(syms);
    }
  }

  final Config conf;
  final Package pkg;
  final Info info;
  final ExprChecker exprs;
  final StmtChecker stmts;

  /** The scope in which names are currently being resolved. */
  Scope scope;

  private LineMap lines = LineMap.NONE;
  private Scope fileScope;

  private final Map<Symbol, DeclInfo> decls = new IdentityHashMap<>();

  /** Package-level symbols in declaration order. */
  private final List<Symbol> declOrder = new ArrayList<>();

  /** Functions and methods, in source order, paired with their declarations. */
  private final List<FuncDecl> funcDecls = new ArrayList<>();

  private final Map<FuncDecl, Func> funcs = new IdentityHashMap<>();

  private int numErrors;

  public Checker(Config conf, Package pkg, Info info) {
    this.conf = conf;
    this.pkg = pkg;
    this.info = info;
    this.exprs = new ExprChecker(this);
    this.stmts = new StmtChecker(this);
    this.fileScope = new Scope(pkg.scope, "file");
    this.scope = fileScope;
  }

  /** Checks {@code file}, adding its declarations to this Checker's package. */
  public void checkFile(File file) {
    lines = file.lines;
    fileScope = new Scope(pkg.scope, "file");
    scope = fileScope;
    info.scopes.put(file, fileScope);
    collectObjects(file);
    // Types first, so that methods can be attached before any value refers to them.
    for (Symbol sym : declOrder) {
      if (sym instanceof TypeName) {
        objDecl(sym);
      }
    }
    for (Symbol sym : declOrder) {
      if (sym instanceof TypeName) {
        checkRecursion((TypeName) sym);
      }
    }
    collectMethods();
    for (Symbol sym : declOrder) {
      objDecl(sym);
    }
    checkFuncBodies();
    logger.debug(
        "Checked package {}: {} declarations, {} errors", pkg.path, declOrder.size(), numErrors);
  }

  /** The file scope (holding the file's imports) of the file being checked. */
  public Scope fileScope() {
    return fileScope;
  }

  // ---------------------------------------------------------------------------------------------
  // Errors

  @FormatMethod
  void error(Node node, String fmt, Object... fmtArgs) {
    report(lines.error(node, fmt, fmtArgs));
  }

  void errorAt(int offset, String msg) {
    report(lines.errorAt(offset, msg));
  }

  private void report(CompileError err) {
    numErrors++;
    conf.errorHandler.accept(err);
  }

  /** Types in error messages are qualified with their package name, unless in this package. */
  String typeString(Type t) {
    return TypeString.of(t, qualifier());
  }

  Function<Package, String> qualifier() {
    return p -> (p == pkg) ? "" : p.name;
  }

  // ---------------------------------------------------------------------------------------------
  // Collecting package-level declarations

  private void collectObjects(File file) {
    for (Decl decl : file.decls) {
      if (decl instanceof FuncDecl) {
        collectFunc((FuncDecl) decl);
        continue;
      }
      GenDecl gen = (GenDecl) decl;
      for (Spec spec : gen.specs) {
        switch (gen.declKind) {
          case IMPORT:
            collectImport((ImportSpec) spec);
            break;
          case TYPE:
            TypeSpec ts = (TypeSpec) spec;
            TypeName tn = TypeName.declare(ts.name.name, pkg, ts.name.pos);
            declarePkg(ts.name, tn, new DeclInfo(ts, DeclKind.TYPE, ImmutableList.of(tn)));
            break;
          default:
            collectValueSpec(gen.declKind, (ValueSpec) spec);
            break;
        }
      }
    }
    for (String name : fileScope.names()) {
      Symbol alt = pkg.scope.lookup(name);
      if (alt != null) {
        errorAt(
            alt.pos,
            String.format(
                "%s already declared through import of %s", name, fileScope.lookup(name)));
      }
    }
  }

  private void collectImport(ImportSpec spec) {
    String path = spec.pathValue();
    Package imported;
    try {
      imported = conf.importer.importPackage(path);
    } catch (ImportException e) {
      error(spec.path, "could not import %s (%s)", path, e.getMessage());
      return;
    }
    String name = (spec.name != null) ? spec.name.name : imported.name;
    PkgName pkgName = new PkgName(name, pkg, imported, spec.pos);
    if (spec.name != null) {
      info.defs.put(spec.name, pkgName);
    } else {
      info.implicits.put(spec, pkgName);
    }
    if (name.equals("_")) {
      return;
    }
    if (fileScope.insert(pkgName) != null) {
      error(spec, "%s redeclared in this block", name);
    }
  }

  private void collectValueSpec(DeclKind kind, ValueSpec spec) {
    List<Symbol> syms = new ArrayList<>();
    for (Ident name : spec.names) {
      syms.add(
          (kind == DeclKind.CONST)
              ? new Const(name.name, pkg, null, name.pos)
              : new Var(name.name, pkg, null, name.pos));
    }
    DeclInfo d = new DeclInfo(spec, kind, syms);
    for (int i = 0; i < syms.size(); i++) {
      declarePkg(spec.names.get(i), syms.get(i), d);
    }
  }

  private void collectFunc(FuncDecl fd) {
    Func f = new Func(fd.name.name, pkg, null, fd.name.pos);
    funcDecls.add(fd);
    funcs.put(fd, f);
    if (fd.recv != null) {
      // Methods are not in the package scope; they are attached to their receiver type later.
      info.defs.put(fd.name, f);
      return;
    }
    DeclInfo d = new DeclInfo(fd, DeclKind.VAR, ImmutableList.of(f));
    if (fd.name.name.equals("init")) {
      info.defs.put(fd.name, f);
      decls.put(f, d);
      declOrder.add(f);
      return;
    }
    declarePkg(fd.name, f, d);
  }

  private void declarePkg(Ident id, Symbol sym, DeclInfo d) {
    info.defs.put(id, sym);
    decls.put(sym, d);
    declOrder.add(sym);
    if (!id.isBlank() && pkg.scope.insert(sym) != null) {
      error(id, "%s redeclared in this block", id.name);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Resolving package-level declarations

  /**
   * Ensures that {@code sym}'s type is known. Does nothing if {@code sym} is not a package-level
   * symbol of the file being checked.
   */
  void objDecl(Symbol sym) {
    DeclInfo d = decls.get(sym);
    if (d == null || d.color == Color.BLACK) {
      return;
    }
    if (d.color == Color.GREY) {
      // A type may refer to itself (its Named already exists); a value may not.
      if (!(sym instanceof TypeName) && sym.type == null) {
        errorAt(sym.pos, "initialization cycle or invalid recursive reference to " + sym.name);
        sym.type = Types.INVALID;
      }
      return;
    }
    d.color = Color.GREY;
    Scope saved = scope;
    scope = fileScope;
    try {
      if (d.node instanceof TypeSpec) {
        typeDecl((TypeName) sym, (TypeSpec) d.node);
      } else if (d.node instanceof FuncDecl) {
        FuncDecl fd = (FuncDecl) d.node;
        sym.type = exprs.signature(null, fd.type);
      } else if (d.kind == DeclKind.CONST) {
        exprs.constSpec(d.syms, (ValueSpec) d.node);
      } else {
        ValueSpec spec = (ValueSpec) d.node;
        List<Var> vars = new ArrayList<>();
        for (Symbol s : d.syms) {
          vars.add((Var) s);
        }
        exprs.varSpec(vars, spec);
      }
    } finally {
      scope = saved;
      d.color = Color.BLACK;
    }
  }

  /** Resolves the underlying type of a type declared at package level or in a function. */
  void typeDecl(TypeName tn, TypeSpec spec) {
    Named named = (Named) tn.type;
    Type rhs = exprs.typeExpr(spec.type);
    if (rhs instanceof Named && ((Named) rhs).underlying == null) {
      error(spec.name, "invalid recursive type %s", tn.name);
      named.underlying = Types.INVALID;
    } else {
      named.underlying = rhs.underlying();
    }
  }

  /**
   * Reports an error if the struct underlying {@code tn} contains itself (directly or through
   * other struct types) by value.
   */
  void checkRecursion(TypeName tn) {
    Named named = (Named) tn.type;
    if (containsByValue(named.underlying(), named, new HashSet<>())) {
      errorAt(tn.pos, "invalid recursive type " + tn.name);
      named.underlying = Types.INVALID;
    }
  }

  private static boolean containsByValue(Type t, Named target, Set<Named> visited) {
    if (!(t instanceof Struct)) {
      return false;
    }
    for (Var f : ((Struct) t).fields) {
      Type ft = f.type();
      if (ft == target) {
        return true;
      }
      if (ft instanceof Named) {
        if (visited.add((Named) ft) && containsByValue(ft.underlying(), target, visited)) {
          return true;
        }
      } else if (containsByValue(ft, target, visited)) {
        return true;
      }
    }
    return false;
  }

  private void collectMethods() {
    for (FuncDecl fd : funcDecls) {
      if (fd.recv != null) {
        method(fd, funcs.get(fd));
      }
    }
  }

  private void method(FuncDecl fd, Func f) {
    Field recvField = fd.recv.list.get(0);
    Expr rt = recvField.type;
    boolean isPointer = false;
    while (rt instanceof ParenExpr) {
      rt = ((ParenExpr) rt).x;
    }
    if (rt instanceof StarExpr) {
      rt = ((StarExpr) rt).x;
      isPointer = true;
    }
    Named base = null;
    if (rt instanceof Ident) {
      Ident id = (Ident) rt;
      Symbol sym = fileScope.lookupParent(id.name);
      if (sym == null) {
        error(id, "undefined: %s", id.name);
      } else {
        info.uses.put(id, sym);
        if (sym instanceof TypeName && sym.pkg == pkg && sym.type instanceof Named) {
          base = (Named) sym.type;
        } else {
          error(id, "cannot define new methods on non-local type %s", id.name);
        }
      }
    } else {
      error(rt, "invalid receiver type %s", rt);
    }
    Type recvType = Types.INVALID;
    if (base != null) {
      Type u = base.underlying();
      if (u instanceof Pointer || u instanceof Interface) {
        error(rt, "invalid receiver type %s (pointer or interface type)", base.obj.name);
        base = null;
      } else {
        recvType = isPointer ? new Pointer(base) : base;
      }
    }
    String recvName = recvField.names.isEmpty() ? "" : recvField.names.get(0).name;
    Var recv = new Var(recvName, pkg, recvType, recvField.pos);
    if (!recvField.names.isEmpty()) {
      info.defs.put(recvField.names.get(0), recv);
    }
    Scope saved = scope;
    scope = fileScope;
    f.type = exprs.signature(recv, fd.type);
    scope = saved;
    if (base == null) {
      return;
    }
    if (base.method(f.name) != null) {
      error(fd.name, "method %s.%s already declared", base.obj.name, f.name);
    } else if (base.underlying() instanceof Struct
        && ((Struct) base.underlying()).field(f.name) != null) {
      error(fd.name, "field and method with the same name %s", f.name);
    } else if (!fd.name.isBlank()) {
      base.methods.add(f);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Function bodies

  private void checkFuncBodies() {
    for (FuncDecl fd : funcDecls) {
      if (fd.body == null) {
        continue;
      }
      if (conf.ignoreFuncBodies
          && !(fd.recv == null && conf.alwaysChecked.contains(fd.name.name))) {
        continue;
      }
      Type t = funcs.get(fd).type;
      if (t instanceof Signature) {
        stmts.funcBody((Signature) t, fd.type, fd.body, fileScope);
      }
    }
  }
}
