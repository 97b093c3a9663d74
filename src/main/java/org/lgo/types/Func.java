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
import org.lgo.types.Types.Signature;

/** A function or method (including interface methods). */
public final class Func extends Symbol {
  Func(String name, @Nullable Package pkg, @Nullable Signature sig, int pos) {
    super(name, pkg, sig, pos);
  }

  public Signature signature() {
    return (Signature) type;
  }

  @Override
  String keyword() {
    return "func";
  }

  /** Describes the function as {@code func name(params) results}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("func ");
    Signature sig = signature();
    if (sig != null && sig.recv != null) {
      sb.append('(')
          .append(TypeString.of(sig.recv.type(), TypeString.relativeTo(pkg)))
          .append(") ");
    }
    sb.append(name);
    if (sig != null) {
      TypeString.writeSignature(sb, sig, TypeString.relativeTo(pkg));
    }
    return sb.toString();
  }
}
