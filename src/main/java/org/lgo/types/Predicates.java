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

import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.lgo.types.Types.Basic;
import org.lgo.types.Types.BasicKind;
import org.lgo.types.Types.Interface;
import org.lgo.types.Types.MapType;
import org.lgo.types.Types.Named;
import org.lgo.types.Types.Pointer;
import org.lgo.types.Types.Signature;
import org.lgo.types.Types.Slice;
import org.lgo.types.Types.Struct;
import org.lgo.types.Types.Tuple;

/** Relations between types. */
public final class Predicates {

  // Statics only
  private Predicates() {}

  public static boolean identical(Type x, Type y) {
    if (x == y) {
      return true;
    }
    if (x instanceof Basic && y instanceof Basic) {
      return ((Basic) x).kind == ((Basic) y).kind;
    } else if (x instanceof Pointer && y instanceof Pointer) {
      return identical(((Pointer) x).elem, ((Pointer) y).elem);
    } else if (x instanceof Slice && y instanceof Slice) {
      return identical(((Slice) x).elem, ((Slice) y).elem);
    } else if (x instanceof MapType && y instanceof MapType) {
      MapType mx = (MapType) x;
      MapType my = (MapType) y;
      return identical(mx.key, my.key) && identical(mx.elem, my.elem);
    } else if (x instanceof Struct && y instanceof Struct) {
      Struct sx = (Struct) x;
      Struct sy = (Struct) y;
      if (sx.fields.size() != sy.fields.size()) {
        return false;
      }
      for (int i = 0; i < sx.fields.size(); i++) {
        Var fx = sx.fields.get(i);
        Var fy = sy.fields.get(i);
        if (!fx.name.equals(fy.name) || !identical(fx.type(), fy.type())) {
          return false;
        }
      }
      return true;
    } else if (x instanceof Tuple && y instanceof Tuple) {
      return identicalTuples((Tuple) x, (Tuple) y);
    } else if (x instanceof Signature && y instanceof Signature) {
      Signature sx = (Signature) x;
      Signature sy = (Signature) y;
      return sx.variadic == sy.variadic
          && identicalTuples(sx.params, sy.params)
          && identicalTuples(sx.results, sy.results);
    } else if (x instanceof Interface && y instanceof Interface) {
      Interface ix = (Interface) x;
      Interface iy = (Interface) y;
      if (ix.methods.size() != iy.methods.size()) {
        return false;
      }
      for (int i = 0; i < ix.methods.size(); i++) {
        Func mx = ix.methods.get(i);
        Func my = iy.methods.get(i);
        if (!mx.name.equals(my.name) || !identical(mx.type(), my.type())) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  private static boolean identicalTuples(Tuple x, Tuple y) {
    if (x.size() != y.size()) {
      return false;
    }
    for (int i = 0; i < x.size(); i++) {
      if (!identical(x.type(i), y.type(i))) {
        return false;
      }
    }
    return true;
  }

  public static boolean isInterface(Type t) {
    return t.underlying() instanceof Interface;
  }

  static boolean isBasicKind(Type t, Predicate<BasicKind> test) {
    Type u = t.underlying();
    return u instanceof Basic && test.test(((Basic) u).kind);
  }

  public static boolean isBoolean(Type t) {
    return isBasicKind(t, BasicKind::isBoolean);
  }

  public static boolean isInteger(Type t) {
    return isBasicKind(t, BasicKind::isInteger);
  }

  public static boolean isNumeric(Type t) {
    return isBasicKind(t, BasicKind::isNumeric);
  }

  public static boolean isString(Type t) {
    return isBasicKind(t, BasicKind::isString);
  }

  /** True for types whose zero value is nil. */
  public static boolean hasNil(Type t) {
    Type u = t.underlying();
    return u instanceof Pointer
        || u instanceof Slice
        || u instanceof MapType
        || u instanceof Signature
        || u instanceof Interface
        || Types.isBasic(u, BasicKind.UNTYPED_NIL);
  }

  /** True if values of type {@code t} may be compared with {@code ==}. */
  public static boolean comparable(Type t) {
    Type u = t.underlying();
    if (u instanceof Basic) {
      return ((Basic) u).kind != BasicKind.UNTYPED_NIL;
    } else if (u instanceof Pointer || u instanceof Interface) {
      return true;
    } else if (u instanceof Struct) {
      for (Var f : ((Struct) u).fields) {
        if (!comparable(f.type())) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  /**
   * True if a value of type {@code v} may be assigned to a variable of type {@code t}. An untyped
   * {@code v} must be representable in {@code t}.
   */
  public static boolean assignable(Type v, Type t) {
    if (identical(v, t)) {
      return true;
    }
    Type vu = v.underlying();
    Type tu = t.underlying();
    if (Types.isUntyped(v)) {
      BasicKind kind = ((Basic) v).kind;
      if (tu instanceof Interface) {
        return kind != BasicKind.UNTYPED_NIL ? ((Interface) tu).isEmpty() : true;
      }
      switch (kind) {
        case UNTYPED_BOOL:
          return isBoolean(tu);
        case UNTYPED_INT:
        case UNTYPED_RUNE:
        case UNTYPED_FLOAT:
          return isNumeric(tu);
        case UNTYPED_STRING:
          return isString(tu);
        case UNTYPED_NIL:
          return hasNil(tu);
        default:
          return false;
      }
    }
    if (tu instanceof Interface && missingMethod(v, (Interface) tu) == null) {
      return true;
    }
    // Identical underlying types, and at least one of them is not a named type.
    return identical(vu, tu) && (!(v instanceof Named) || !(t instanceof Named));
  }

  /** True if a value of type {@code v} may be explicitly converted to type {@code t}. */
  public static boolean convertible(Type v, Type t) {
    if (assignable(v, t)) {
      return true;
    }
    Type vu = v.underlying();
    Type tu = t.underlying();
    if (identical(vu, tu)) {
      return true;
    }
    if (vu instanceof Pointer && tu instanceof Pointer) {
      return identical(((Pointer) vu).elem.underlying(), ((Pointer) tu).elem.underlying());
    }
    if (isNumeric(vu) && isNumeric(tu)) {
      return true;
    }
    if (isString(tu)) {
      if (isInteger(vu)) {
        return true;
      }
      if (vu instanceof Slice) {
        return isByteOrRune(((Slice) vu).elem);
      }
    }
    if (isString(vu) && tu instanceof Slice) {
      return isByteOrRune(((Slice) tu).elem);
    }
    return false;
  }

  private static boolean isByteOrRune(Type t) {
    return Types.isBasic(t.underlying(), BasicKind.UINT8)
        || Types.isBasic(t.underlying(), BasicKind.INT32);
  }

  /**
   * Returns the first method of {@code iface} that {@code t} does not implement, or null if
   * {@code t} implements {@code iface}. A method with a pointer receiver is only in the method
   * set of the pointer type.
   */
  public static @Nullable Func missingMethod(Type t, Interface iface) {
    for (Func m : iface.methods) {
      Func found = methodOf(t, m.name);
      if (found == null || !identical(found.type(), stripRecv(m.signature()))) {
        return m;
      }
    }
    return null;
  }

  /** Returns the method named {@code name} in the method set of {@code t}, or null. */
  static @Nullable Func methodOf(Type t, String name) {
    Type u = t.underlying();
    if (u instanceof Interface) {
      Func m = ((Interface) u).method(name);
      return (m == null) ? null : withoutRecv(m);
    }
    boolean isPointer = false;
    if (t instanceof Pointer) {
      t = ((Pointer) t).elem;
      isPointer = true;
    }
    if (!(t instanceof Named)) {
      return null;
    }
    Func m = ((Named) t).method(name);
    if (m == null) {
      return null;
    }
    Var recv = m.signature().recv;
    if (!isPointer && recv != null && recv.type() instanceof Pointer) {
      return null;
    }
    return withoutRecv(m);
  }

  private static Func withoutRecv(Func m) {
    return new Func(m.name, m.pkg, stripRecv(m.signature()), m.pos);
  }

  static Signature stripRecv(Signature sig) {
    return (sig.recv == null) ? sig : new Signature(null, sig.params, sig.results, sig.variadic);
  }
}
