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

import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.lgo.types.Types.Basic;
import org.lgo.types.Types.Interface;
import org.lgo.types.Types.MapType;
import org.lgo.types.Types.Named;
import org.lgo.types.Types.Pointer;
import org.lgo.types.Types.Signature;
import org.lgo.types.Types.Slice;
import org.lgo.types.Types.Struct;
import org.lgo.types.Types.Tuple;

/**
 * Renders types as Lesser Go source.
 *
 * <p>A qualifier decides how the package of each named type is written: it returns the prefix to
 * use (an import alias, say), or the empty string to leave the name unqualified. With a null
 * qualifier every package is written as its full path.
 */
public final class TypeString {

  // Statics only
  private TypeString() {}

  public static String of(Type type, @Nullable Function<Package, String> qualifier) {
    StringBuilder sb = new StringBuilder();
    write(sb, type, qualifier);
    return sb.toString();
  }

  /** Returns a qualifier that omits {@code pkg} and writes every other package as its path. */
  public static Function<Package, String> relativeTo(@Nullable Package pkg) {
    return p -> (p == pkg) ? "" : p.path();
  }

  /** Writes the signature of {@code sig} without the leading {@code func}. */
  static void writeSignature(
      StringBuilder sb, Signature sig, @Nullable Function<Package, String> qualifier) {
    writeTuple(sb, sig.params, sig.variadic, qualifier);
    Tuple results = sig.results;
    if (results.size() == 0) {
      return;
    }
    sb.append(' ');
    if (results.size() == 1 && results.vars.get(0).name.isEmpty()) {
      write(sb, results.type(0), qualifier);
    } else {
      writeTuple(sb, results, false, qualifier);
    }
  }

  private static void write(
      StringBuilder sb, Type type, @Nullable Function<Package, String> qualifier) {
    if (type instanceof Basic) {
      sb.append(((Basic) type).name);
    } else if (type instanceof Named) {
      TypeName obj = ((Named) type).obj;
      if (obj.pkg != null) {
        String prefix = (qualifier == null) ? obj.pkg.path() : qualifier.apply(obj.pkg);
        if (!prefix.isEmpty()) {
          sb.append(prefix).append('.');
        }
      }
      sb.append(obj.name);
    } else if (type instanceof Pointer) {
      sb.append('*');
      write(sb, ((Pointer) type).elem, qualifier);
    } else if (type instanceof Slice) {
      sb.append("[]");
      write(sb, ((Slice) type).elem, qualifier);
    } else if (type instanceof MapType) {
      sb.append("map[");
      write(sb, ((MapType) type).key, qualifier);
      sb.append(']');
      write(sb, ((MapType) type).elem, qualifier);
    } else if (type instanceof Struct) {
      sb.append("struct{");
      String sep = "";
      for (Var f : ((Struct) type).fields) {
        sb.append(sep).append(f.name).append(' ');
        write(sb, f.type, qualifier);
        sep = "; ";
      }
      sb.append('}');
    } else if (type instanceof Tuple) {
      writeTuple(sb, (Tuple) type, false, qualifier);
    } else if (type instanceof Signature) {
      sb.append("func");
      writeSignature(sb, (Signature) type, qualifier);
    } else {
      Interface iface = (Interface) type;
      sb.append("interface{");
      String sep = "";
      for (Func m : iface.methods) {
        sb.append(sep).append(m.name);
        writeSignature(sb, m.signature(), qualifier);
        sep = "; ";
      }
      sb.append('}');
    }
  }

  private static void writeTuple(
      StringBuilder sb, Tuple tuple, boolean variadic, @Nullable Function<Package, String> qualifier) {
    sb.append('(');
    for (int i = 0; i < tuple.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      Var v = tuple.vars.get(i);
      if (!v.name.isEmpty()) {
        sb.append(v.name).append(' ');
      }
      if (variadic && i == tuple.size() - 1) {
        sb.append("...");
        write(sb, ((Slice) v.type).elem, qualifier);
      } else {
        write(sb, v.type, qualifier);
      }
    }
    sb.append(')');
  }
}
