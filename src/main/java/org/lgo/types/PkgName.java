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

import org.jspecify.annotations.Nullable;

/** The name under which a package is imported into a file. */
public final class PkgName extends Symbol {
  final Package imported;

  /** Set when the name is used in a qualified identifier. */
  boolean used;

  public PkgName(String name, @Nullable Package pkg, Package imported, int pos) {
    super(name, pkg, null, pos);
    this.imported = imported;
  }

  public Package imported() {
    return imported;
  }

  public boolean used() {
    return used;
  }

  @Override
  String keyword() {
    return "package";
  }

  @Override
  public String toString() {
    return String.format("package %s (\"%s\")", name, imported.path());
  }
}
