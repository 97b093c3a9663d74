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

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/** Hands out names that do not clash with any name in use, or with each other. */
final class NamePicker {
  private final Set<String> used;

  NamePicker(Collection<String> used) {
    this.used = new HashSet<>(used);
  }

  /** Returns {@code base} if it is free, otherwise the first free {@code base1}, {@code base2}... */
  String newName(String base) {
    String name = base;
    for (int i = 1; !used.add(name); i++) {
      name = base + i;
    }
    return name;
  }
}
