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
import org.lgo.types.Types.Named;

/** A type name: either a declared (Named) type or a predeclared basic type. */
public final class TypeName extends Symbol {
  TypeName(String name, @Nullable Package pkg, @Nullable Type type, int pos) {
    super(name, pkg, type, pos);
  }

  /** Creates a TypeName for a new defined type whose underlying type is not yet known. */
  static TypeName declare(String name, @Nullable Package pkg, int pos) {
    TypeName result = new TypeName(name, pkg, null, pos);
    result.type = new Named(result, null);
    return result;
  }

  @Override
  String keyword() {
    return "type";
  }

  /** Describes a defined type by its underlying type, e.g. {@code type T struct{x int}}. */
  @Override
  public String toString() {
    Type t = type();
    Type shown = (t instanceof Named && ((Named) t).obj == this) ? t.underlying() : t;
    return "type " + name + " " + TypeString.of(shown, TypeString.relativeTo(pkg));
  }
}
