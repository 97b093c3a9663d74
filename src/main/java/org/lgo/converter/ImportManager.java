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
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.lgo.ast.Ast;
import org.lgo.ast.Ast.DeclKind;
import org.lgo.ast.Ast.GenDecl;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.ImportSpec;
import org.lgo.ast.Ast.Node;
import org.lgo.ast.Walker;
import org.lgo.types.Package;
import org.lgo.types.PkgName;
import org.lgo.types.Scope;
import org.lgo.types.Symbol;

/**
 * Chooses the names by which a translation unit refers to other packages.
 *
 * <p>Packages the file already imports keep their names. Any other package is given a fresh alias
 * {@code pkgN}, and an import declaration for it is recorded in {@link #injectedImports}. An alias
 * is never an identifier that appears anywhere in the unit, so it cannot be shadowed by a local
 * declaration at the point where it is used.
 */
final class ImportManager {
  private final Package current;
  private final Scope fileScope;

  /** Names that must not be used as aliases. */
  private final Set<String> reserved = new HashSet<>();

  private final Map<Package, String> names = new IdentityHashMap<>();
  private int counter;

  /** Import declarations for the aliases minted so far, in order. */
  final List<GenDecl> injectedImports = new ArrayList<>();

  /**
   * {@code reserved} holds names that will be declared at package level after this manager has
   * run, such as hoisted variables.
   */
  ImportManager(Package current, Scope fileScope, Node root, Set<String> reserved) {
    this.current = current;
    this.fileScope = fileScope;
    this.reserved.addAll(reserved);
    Walker.walk(
        root,
        node -> {
          if (node instanceof Ident) {
            this.reserved.add(((Ident) node).name);
          }
          return true;
        });
    for (String name : fileScope.names()) {
      Symbol sym = fileScope.lookup(name);
      if (sym instanceof PkgName) {
        names.put(((PkgName) sym).imported(), name);
      }
    }
  }

  /** Returns the qualifier for members of {@code pkg}; empty for the current package. */
  String shortName(Package pkg) {
    if (pkg == current) {
      return "";
    }
    String name = names.get(pkg);
    if (name != null) {
      return name;
    }
    do {
      name = "pkg" + counter++;
    } while (fileScope.lookupParent(name) != null || reserved.contains(name));
    names.put(pkg, name);
    ImportSpec spec = new ImportSpec(Ast.ident(name), Ast.stringLit(pkg.path()));
    injectedImports.add(new GenDecl(DeclKind.IMPORT, List.of(spec), false));
    return name;
  }
}
