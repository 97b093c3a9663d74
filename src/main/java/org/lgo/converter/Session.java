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

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.lgo.types.Importer;
import org.lgo.types.Package;
import org.lgo.types.PkgName;
import org.lgo.types.Scope;
import org.lgo.types.Symbol;
import org.lgo.types.Var;

/**
 * The package into which a block is checked, with the symbols of earlier blocks visible in its
 * value scope. Every package created here is a session package, so its unexported members are
 * accessible to later blocks.
 */
final class Session {
  final Package pkg;

  /** Fresh PkgNames for the imports of earlier blocks, owned by {@link #pkg}. */
  final ImmutableList<PkgName> oldImports;

  /** The execution context variable, or null if an earlier symbol is named {@code runctx}. */
  final @Nullable Var runctx;

  private Session(Package pkg, ImmutableList<PkgName> oldImports, @Nullable Var runctx) {
    this.pkg = pkg;
    this.oldImports = oldImports;
    this.runctx = runctx;
  }

  static Session create(Converter.Config conf) {
    Package pkg = Package.withOldValues(conf.lgoPkgPath(), CoreHooks.PACKAGE_NAME, conf.olds());
    pkg.setSession(true);
    Scope values = Verify.verifyNotNull(pkg.valueScope());
    ImmutableList.Builder<PkgName> imports = ImmutableList.builder();
    for (PkgName old : conf.oldImports()) {
      PkgName pkgName = new PkgName(old.name(), pkg, old.imported(), -1);
      values.insert(pkgName);
      imports.add(pkgName);
    }
    Var runctx = null;
    if (values.lookup(CoreHooks.EXEC_CONTEXT_VAR) == null) {
      Package context = CoreHooks.require(conf.importer(), "context");
      Symbol ctxType = context.scope().lookup("Context");
      if (ctxType == null) {
        throw new IllegalStateException("context.Context is not declared");
      }
      runctx = new Var(CoreHooks.EXEC_CONTEXT_VAR, pkg, ctxType.type(), -1);
      values.insert(runctx);
    }
    return new Session(pkg, imports.build(), runctx);
  }

  /**
   * Returns an importer that resolves the paths of the packages that declared {@code olds} to
   * those packages, and delegates every other path to {@code base}.
   */
  static Importer importerWithOlds(Importer base, ImmutableList<Symbol> olds) {
    Map<String, Package> oldPackages = new HashMap<>();
    for (Symbol old : olds) {
      Package p = old.pkg();
      if (p != null) {
        oldPackages.put(p.path(), p);
      }
    }
    if (oldPackages.isEmpty()) {
      return base;
    }
    return path -> {
      Package p = oldPackages.get(path);
      return (p != null) ? p : base.importPackage(path);
    };
  }
}
