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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Maps names to Symbols. Each Scope has a parent (except the universe), and lookups that fail in a
 * scope continue in its parent.
 *
 * <p>The chain for code in a converted block is: block scopes, function scope, file scope (imports),
 * package scope, value scope (symbols from earlier blocks), universe.
 */
public final class Scope {

  /** Maps each name declared in this scope to its Symbol, in declaration order. */
  private final Map<String, Symbol> entries = new LinkedHashMap<>();

  final @Nullable Scope parent;

  /** A short description of what this scope belongs to, for debugging. */
  final String comment;

  public Scope(@Nullable Scope parent, String comment) {
    this.parent = parent;
    this.comment = comment;
  }

  public @Nullable Scope parent() {
    return parent;
  }

  /** Returns the Symbol declared with the given name in this scope (not its parents), or null. */
  public @Nullable Symbol lookup(String name) {
    return entries.get(name);
  }

  /** Returns the Symbol with the given name in this scope or the nearest parent that has one. */
  public @Nullable Symbol lookupParent(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Symbol result = s.entries.get(name);
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  /**
   * Adds {@code sym} to this scope unless a Symbol with the same name is already present, in
   * which case the existing Symbol is returned (and the scope is unchanged).
   */
  @CanIgnoreReturnValue
  public @Nullable Symbol insert(Symbol sym) {
    return entries.putIfAbsent(sym.name, sym);
  }

  /** Adds {@code sym} to this scope, replacing any Symbol with the same name. */
  void replace(Symbol sym) {
    entries.put(sym.name, sym);
  }

  /** The names declared in this scope, sorted. */
  public ImmutableList<String> names() {
    return ImmutableList.sortedCopyOf(entries.keySet());
  }

  public int size() {
    return entries.size();
  }

  @Override
  public String toString() {
    return comment + " scope " + entries.keySet();
  }
}
