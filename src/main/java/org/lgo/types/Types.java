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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** The concrete Type classes, and the predeclared basic types. */
public final class Types {

  // Static members only
  private Types() {}

  public enum BasicKind {
    INVALID,
    BOOL,
    INT,
    INT32,
    INT64,
    UINT8,
    FLOAT64,
    STRING,
    UNTYPED_BOOL,
    UNTYPED_INT,
    UNTYPED_RUNE,
    UNTYPED_FLOAT,
    UNTYPED_STRING,
    UNTYPED_NIL;

    public boolean isUntyped() {
      return compareTo(UNTYPED_BOOL) >= 0;
    }

    public boolean isBoolean() {
      return this == BOOL || this == UNTYPED_BOOL;
    }

    public boolean isInteger() {
      return this == INT
          || this == INT32
          || this == INT64
          || this == UINT8
          || this == UNTYPED_INT
          || this == UNTYPED_RUNE;
    }

    public boolean isNumeric() {
      return isInteger() || this == FLOAT64 || this == UNTYPED_FLOAT;
    }

    public boolean isString() {
      return this == STRING || this == UNTYPED_STRING;
    }
  }

  /** A predeclared type. Two Basics are identical if they have the same kind. */
  public static final class Basic extends Type {
    public final BasicKind kind;
    public final String name;

    private Basic(BasicKind kind, String name) {
      this.kind = kind;
      this.name = name;
    }
  }

  public static final Basic INVALID = new Basic(BasicKind.INVALID, "invalid type");
  public static final Basic BOOL = new Basic(BasicKind.BOOL, "bool");
  public static final Basic INT = new Basic(BasicKind.INT, "int");
  public static final Basic INT32 = new Basic(BasicKind.INT32, "int32");
  public static final Basic INT64 = new Basic(BasicKind.INT64, "int64");
  public static final Basic UINT8 = new Basic(BasicKind.UINT8, "uint8");
  public static final Basic FLOAT64 = new Basic(BasicKind.FLOAT64, "float64");
  public static final Basic STRING = new Basic(BasicKind.STRING, "string");

  /** Aliases; identical to INT32 and UINT8 but printed with their own names. */
  public static final Basic RUNE = new Basic(BasicKind.INT32, "rune");

  public static final Basic BYTE = new Basic(BasicKind.UINT8, "byte");

  public static final Basic UNTYPED_BOOL = new Basic(BasicKind.UNTYPED_BOOL, "untyped bool");
  public static final Basic UNTYPED_INT = new Basic(BasicKind.UNTYPED_INT, "untyped int");
  public static final Basic UNTYPED_RUNE = new Basic(BasicKind.UNTYPED_RUNE, "untyped rune");
  public static final Basic UNTYPED_FLOAT = new Basic(BasicKind.UNTYPED_FLOAT, "untyped float");
  public static final Basic UNTYPED_STRING =
      new Basic(BasicKind.UNTYPED_STRING, "untyped string");
  public static final Basic UNTYPED_NIL = new Basic(BasicKind.UNTYPED_NIL, "untyped nil");

  /** Returns true if {@code t} is a Basic of the given kind. */
  public static boolean isBasic(Type t, BasicKind kind) {
    return t instanceof Basic && ((Basic) t).kind == kind;
  }

  /** Returns true if {@code t} is an untyped basic type. */
  public static boolean isUntyped(Type t) {
    return t instanceof Basic && ((Basic) t).kind.isUntyped();
  }

  /**
   * Returns the type that an untyped constant of type {@code t} assumes when no other type is
   * required; other types are returned unchanged.
   */
  public static Type defaultType(Type t) {
    if (!(t instanceof Basic)) {
      return t;
    }
    switch (((Basic) t).kind) {
      case UNTYPED_BOOL:
        return BOOL;
      case UNTYPED_INT:
        return INT;
      case UNTYPED_RUNE:
        return RUNE;
      case UNTYPED_FLOAT:
        return FLOAT64;
      case UNTYPED_STRING:
        return STRING;
      default:
        return t;
    }
  }

  /** A defined type. The underlying type is filled in once the declaration has been resolved. */
  public static final class Named extends Type {
    public final TypeName obj;

    /** Null while this type's declaration is being resolved. */
    @Nullable Type underlying;

    /** The methods declared with this type (or a pointer to it) as receiver, in source order. */
    final List<Func> methods = new ArrayList<>();

    Named(TypeName obj, @Nullable Type underlying) {
      this.obj = obj;
      this.underlying = underlying;
    }

    @Override
    public Type underlying() {
      return (underlying == null) ? INVALID : underlying;
    }

    public ImmutableList<Func> methods() {
      return ImmutableList.copyOf(methods);
    }

    /** Returns the method with the given name, or null. */
    public @Nullable Func method(String name) {
      for (Func m : methods) {
        if (m.name.equals(name)) {
          return m;
        }
      }
      return null;
    }
  }

  public static final class Pointer extends Type {
    public final Type elem;

    public Pointer(Type elem) {
      this.elem = elem;
    }
  }

  public static final class Slice extends Type {
    public final Type elem;

    public Slice(Type elem) {
      this.elem = elem;
    }
  }

  public static final class MapType extends Type {
    public final Type key;
    public final Type elem;

    public MapType(Type key, Type elem) {
      this.key = key;
      this.elem = elem;
    }
  }

  public static final class Struct extends Type {
    /** Each field is a Var with {@code isField} set. */
    public final ImmutableList<Var> fields;

    public Struct(List<Var> fields) {
      this.fields = ImmutableList.copyOf(fields);
    }

    /** Returns the field with the given name, or null. */
    public @Nullable Var field(String name) {
      for (Var f : fields) {
        if (f.name.equals(name)) {
          return f;
        }
      }
      return null;
    }
  }

  /**
   * An ordered list of variables; used for function parameters and results, and as the type of a
   * call that returns zero or more than one value.
   */
  public static final class Tuple extends Type {
    public static final Tuple EMPTY = new Tuple(ImmutableList.of());

    public final ImmutableList<Var> vars;

    public Tuple(List<Var> vars) {
      this.vars = ImmutableList.copyOf(vars);
    }

    public int size() {
      return vars.size();
    }

    public Type type(int i) {
      return vars.get(i).type;
    }
  }

  public static final class Signature extends Type {
    /** Null unless this is the signature of a method. */
    public final @Nullable Var recv;

    public final Tuple params;
    public final Tuple results;

    /** If true, the last parameter's type is a Slice and arguments may be passed individually. */
    public final boolean variadic;

    public Signature(@Nullable Var recv, Tuple params, Tuple results, boolean variadic) {
      this.recv = recv;
      this.params = params;
      this.results = results;
      this.variadic = variadic;
    }
  }

  public static final class Interface extends Type {
    /** Sorted by name. */
    public final ImmutableList<Func> methods;

    public Interface(List<Func> methods) {
      List<Func> sorted = new ArrayList<>(methods);
      sorted.sort(Comparator.comparing(f -> f.name));
      this.methods = ImmutableList.copyOf(sorted);
    }

    public boolean isEmpty() {
      return methods.isEmpty();
    }

    /** Returns the method with the given name, or null. */
    public @Nullable Func method(String name) {
      for (Func m : methods) {
        if (m.name.equals(name)) {
          return m;
        }
      }
      return null;
    }
  }

  /** {@code interface{}} */
  public static final Interface EMPTY_INTERFACE = new Interface(ImmutableList.of());
}
