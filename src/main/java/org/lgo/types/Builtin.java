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

/** A predeclared function with special typing rules. */
public final class Builtin extends Symbol {
  public enum Id {
    APPEND,
    CAP,
    DELETE,
    LEN,
    MAKE,
    NEW,
    PANIC,
    RECOVER
  }

  final Id id;

  Builtin(Id id) {
    super(id.name().toLowerCase(), null, Types.INVALID, -1);
    this.id = id;
  }

  @Override
  String keyword() {
    return "builtin";
  }

  @Override
  public String toString() {
    return "builtin " + name;
  }
}
