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

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A package: a path, a name, and a scope holding its package-level declarations.
 *
 * <p>Packages produced by converting REPL blocks are flagged as session packages; their
 * unexported members may be referenced from later blocks.
 */
public final class Package {
  final String path;
  String name;
  final Scope scope;

  /** If non-null, the parent of {@link #scope}; holds the symbols of earlier blocks. */
  final @Nullable Scope valueScope;

  boolean session;

  private Package(String path, String name, Scope scope, @Nullable Scope valueScope) {
    this.path = path;
    this.name = name;
    this.scope = scope;
    this.valueScope = valueScope;
  }

  /** Creates a package whose scope's parent is the universe. */
  public static Package create(String path, String name) {
    return new Package(path, name, new Scope(Universe.SCOPE, "package " + path), null);
  }

  /**
   * Creates a package whose scope's parent is a new value scope containing {@code olds}; if two
   * olds have the same name, the later one is visible. The value scope's parent is the universe.
   */
  public static Package withOldValues(String path, String name, List<? extends Symbol> olds) {
    Scope valueScope = new Scope(Universe.SCOPE, "values");
    for (Symbol old : olds) {
      valueScope.replace(old);
    }
    return new Package(path, name, new Scope(valueScope, "package " + path), valueScope);
  }

  public String path() {
    return path;
  }

  public String name() {
    return name;
  }

  public Scope scope() {
    return scope;
  }

  public @Nullable Scope valueScope() {
    return valueScope;
  }

  public boolean isSession() {
    return session;
  }

  public void setSession(boolean session) {
    this.session = session;
  }

  @Override
  public String toString() {
    return "package " + name + " (\"" + path + "\")";
  }
}
