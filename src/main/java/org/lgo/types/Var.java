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

/** A variable, parameter, result, or struct field. */
public final class Var extends Symbol {
  final boolean isField;

  /** Set when the variable is read; used to report unused local variables. */
  boolean used;

  public Var(String name, @Nullable Package pkg, @Nullable Type type, int pos) {
    this(name, pkg, type, pos, false);
  }

  Var(String name, @Nullable Package pkg, @Nullable Type type, int pos, boolean isField) {
    super(name, pkg, type, pos);
    this.isField = isField;
  }

  static Var field(String name, @Nullable Package pkg, Type type, int pos) {
    return new Var(name, pkg, type, pos, true);
  }

  public boolean isField() {
    return isField;
  }

  @Override
  String keyword() {
    return isField ? "field" : "var";
  }
}
