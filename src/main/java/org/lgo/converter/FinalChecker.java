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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.lgo.ast.Ast;
import org.lgo.ast.Ast.Decl;
import org.lgo.ast.Ast.DeclKind;
import org.lgo.ast.Ast.File;
import org.lgo.ast.Ast.GenDecl;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.ImportSpec;
import org.lgo.ast.CompileError;
import org.lgo.ast.ErrorList;
import org.lgo.ast.Printer;
import org.lgo.types.Checker;
import org.lgo.types.Func;
import org.lgo.types.Info;
import org.lgo.types.Package;
import org.lgo.types.PkgName;
import org.lgo.types.Symbol;
import org.lgo.types.Var;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a hoisted translation unit with every function body included, then renames its symbols
 * so that they cannot collide with those of other blocks, and prints it.
 */
final class FinalChecker {

  private static final Logger logger = LoggerFactory.getLogger(FinalChecker.class);

  /** The printed unit, with the package and Info from its final check. */
  static final class Output {
    final byte[] src;
    final Package pkg;
    final Info info;

    Output(byte[] src, Package pkg, Info info) {
      this.src = src;
      this.pkg = pkg;
      this.info = info;
    }
  }

  // Statics only
  private FinalChecker() {}

  /** Throws a CompileError if the unit does not check. */
  static Output checkAndRename(File file, Converter.Config conf) {
    Session session = Session.create(conf);
    Package pkg = session.pkg;
    Info info = new Info();
    List<CompileError> errors = new ArrayList<>();
    Checker.Config checkerConf =
        new Checker.Config(Session.importerWithOlds(conf.importer(), conf.olds()), errors::add);
    Checker checker = new Checker(checkerConf, pkg, info);
    checker.checkFile(file);
    if (!errors.isEmpty()) {
      logger.debug("Final check of {} failed with {} errors", pkg.path(), errors.size());
      throw ErrorList.of(errors);
    }

    for (Map.Entry<Ident, Symbol> entry : info.defs.entrySet()) {
      Ident id = entry.getKey();
      if (Symbol.isExported(id.name) || id.name.equals(CoreHooks.INIT_FUNC_NAME)) {
        continue;
      }
      if (isRenamed(entry.getValue(), pkg)) {
        id.name = conf.defPrefix() + id.name;
      }
    }

    ImportManager immg = new ImportManager(pkg, checker.fileScope(), file, ImmutableSet.of());
    Supplier<String> core =
        () -> immg.shortName(CoreHooks.require(conf.importer(), CoreHooks.PATH));
    // Function bodies were not checked before hoisting, so they may still refer to old symbols
    // and the execution context directly.
    StateHoister.qualifyOlds(file, info, immg, conf.olds());
    if (session.runctx != null) {
      StateHoister.replaceExecContext(file, info, immg, conf.importer(), session.runctx);
    }
    if (conf.autoExitCode()) {
      AutoExit.inject(file, core);
    }
    List<String> defined = new ArrayList<>();
    info.defs.keySet().forEach(id -> defined.add(id.name));
    new GoroutineGuard(core, new NamePicker(defined)).guard(file);

    List<Decl> decls = new ArrayList<>(immg.injectedImports);
    for (PkgName old : session.oldImports) {
      if (old.used()) {
        ImportSpec spec =
            new ImportSpec(Ast.ident(old.name()), Ast.stringLit(old.imported().path()));
        decls.add(new GenDecl(DeclKind.IMPORT, List.of(spec), false));
      }
    }
    for (Decl decl : file.decls) {
      if (!(decl instanceof GenDecl) || ((GenDecl) decl).declKind != DeclKind.IMPORT) {
        decls.add(decl);
        continue;
      }
      GenDecl gen = (GenDecl) decl;
      gen.specs.removeIf(spec -> !importedPkgName((ImportSpec) spec, info).used());
      if (!gen.specs.isEmpty()) {
        decls.add(gen);
      }
    }
    if (decls.isEmpty()) {
      logger.debug("Nothing left to run in {}", pkg.path());
      return new Output(new byte[0], pkg, info);
    }
    file.decls.clear();
    file.decls.addAll(decls);

    for (Map.Entry<Ident, Symbol> entry : info.uses.entrySet()) {
      Ident id = entry.getKey();
      Symbol sym = entry.getValue();
      if (Symbol.isExported(id.name)) {
        continue;
      }
      Package owner = sym.pkg();
      if (owner != null && owner.isSession() && isRenamed(sym, owner)) {
        id.name = conf.refPrefix() + id.name;
      }
    }
    String src = Printer.print(file);
    logger.debug("Converted block into {} ({} declarations)", pkg.path(), decls.size());
    return new Output(src.getBytes(UTF_8), pkg, info);
  }

  /** Package-level symbols, functions and methods, and struct fields are renamed. */
  private static boolean isRenamed(Symbol sym, Package owner) {
    return owner.scope().lookup(sym.name()) == sym
        || sym instanceof Func
        || (sym instanceof Var && ((Var) sym).isField());
  }

  private static PkgName importedPkgName(ImportSpec spec, Info info) {
    Symbol sym = (spec.name != null) ? info.defs.get(spec.name) : info.implicits.get(spec);
    return (PkgName) Verify.verifyNotNull(sym, "No PkgName for %s", spec);
  }
}
