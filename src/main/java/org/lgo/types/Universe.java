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
import org.lgo.types.Types.Interface;
import org.lgo.types.Types.Named;
import org.lgo.types.Types.Signature;
import org.lgo.types.Types.Tuple;

/** The predeclared symbols. */
public final class Universe {

  // Statics only
  private Universe() {}

  public static final Scope SCOPE = new Scope(null, "universe");

  /** The predeclared {@code error} interface. */
  public static final Named ERROR;

  public static final Nil NIL = new Nil();

  static {
    for (Types.Basic basic :
        ImmutableList.of(
            Types.BOOL,
            Types.INT,
            Types.INT32,
            Types.INT64,
            Types.UINT8,
            Types.FLOAT64,
            Types.STRING,
            Types.RUNE,
            Types.BYTE)) {
      SCOPE.insert(new TypeName(basic.name, null, basic, -1));
    }

    TypeName errorName = TypeName.declare("error", null, -1);
    ERROR = (Named) errorName.type;
    Signature errorSig =
        new Signature(
            null,
            Tuple.EMPTY,
            new Tuple(ImmutableList.of(new Var("", null, Types.STRING, -1))),
            false);
    ERROR.underlying = new Interface(ImmutableList.of(new Func("Error", null, errorSig, -1)));
    SCOPE.insert(errorName);

    SCOPE.insert(new Const("true", null, Types.UNTYPED_BOOL, -1));
    SCOPE.insert(new Const("false", null, Types.UNTYPED_BOOL, -1));
    SCOPE.insert(NIL);
    for (Builtin.Id id : Builtin.Id.values()) {
      SCOPE.insert(new Builtin(id));
    }
  }
}
