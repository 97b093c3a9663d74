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

/**
 * A Lesser Go type. The concrete subclasses are nested in {@link Types}.
 *
 * <p>Types are compared with {@link Predicates#identical}; except for basic types (which are
 * identical if they have the same kind) and named types (which are identical only to themselves),
 * distinct instances may represent identical types.
 */
public abstract class Type {

  Type() {}

  /** A named type returns the type it was defined with; every other type returns itself. */
  public Type underlying() {
    return this;
  }

  /** Returns this type's representation with every package qualified by its full path. */
  @Override
  public String toString() {
    return TypeString.of(this, null);
  }
}
