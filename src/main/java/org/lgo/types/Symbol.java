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

/**
 * A named language entity: a variable, constant, type, function, package name, builtin, or nil.
 *
 * <p>Symbols are compared by identity; the type checker's {@link Info} maps identifiers to the
 * Symbols they define or use.
 */
public abstract class Symbol {
  final String name;

  /** Null for predeclared symbols. */
  final @Nullable Package pkg;

  /** Null until resolved, for package-level declarations that have not yet been checked. */
  @Nullable Type type;

  /** The source offset of the declaring identifier, or -1. */
  final int pos;

  Symbol(String name, @Nullable Package pkg, @Nullable Type type, int pos) {
    this.name = name;
    this.pkg = pkg;
    this.type = type;
    this.pos = pos;
  }

  public String name() {
    return name;
  }

  public @Nullable Package pkg() {
    return pkg;
  }

  public Type type() {
    return (type == null) ? Types.INVALID : type;
  }

  /** True if the name starts with an upper-case letter. */
  public boolean exported() {
    return isExported(name);
  }

  public static boolean isExported(String name) {
    return !name.isEmpty() && Character.isUpperCase(name.charAt(0));
  }

  /** The keyword used when describing this symbol ("var", "func", ...). */
  abstract String keyword();

  /**
   * Describes the symbol as it would be declared, e.g. {@code var x int} or {@code func f(x int)
   * string}. Types from the symbol's own package are unqualified.
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(keyword()).append(' ').append(name);
    if (type != null) {
      sb.append(' ').append(TypeString.of(type, TypeString.relativeTo(pkg)));
    }
    return sb.toString();
  }
}
