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

/** The mode and type recorded for each expression. */
public final class TypeAndValue {

  public enum Mode {
    /** An expression with no value, e.g. a call of a function with no results. */
    NOVALUE,
    /** A builtin function name. */
    BUILTIN,
    /** A type. */
    TYPE,
    CONSTANT,
    /** An addressable variable. */
    VARIABLE,
    /** A map index expression, which may be assigned to or used in a comma-ok assignment. */
    MAPINDEX,
    /** Any other value. */
    VALUE,
    /** A value that may also be used in a comma-ok assignment (type assertions). */
    COMMAOK
  }

  public final Mode mode;
  public final Type type;

  public TypeAndValue(Mode mode, Type type) {
    this.mode = mode;
    this.type = type;
  }

  public boolean isValue() {
    return mode != Mode.NOVALUE && mode != Mode.BUILTIN && mode != Mode.TYPE;
  }

  @Override
  public String toString() {
    return mode.name().toLowerCase() + " " + type;
  }
}
