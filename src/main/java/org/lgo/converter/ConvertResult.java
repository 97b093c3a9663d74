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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.CompileError;
import org.lgo.types.Info;
import org.lgo.types.Package;
import org.lgo.types.PkgName;

/**
 * The outcome of converting a block: either the source of the translation unit, with the package
 * it was checked into, or an error.
 */
public final class ConvertResult {
  private final byte[] src;
  private final @Nullable Package pkg;
  private final @Nullable Info info;
  private final ImmutableList<PkgName> imports;
  private final @Nullable CompileError error;

  private ConvertResult(
      byte[] src,
      @Nullable Package pkg,
      @Nullable Info info,
      ImmutableList<PkgName> imports,
      @Nullable CompileError error) {
    this.src = src;
    this.pkg = pkg;
    this.info = info;
    this.imports = imports;
    this.error = error;
  }

  static ConvertResult success(byte[] src, Package pkg, Info info, ImmutableList<PkgName> imports) {
    return new ConvertResult(src, pkg, info, imports, null);
  }

  static ConvertResult failure(CompileError error) {
    return new ConvertResult(new byte[0], null, null, ImmutableList.of(), error);
  }

  /** The UTF-8 source of the translation unit; empty if the block declared nothing to run. */
  public byte[] src() {
    return src.clone();
  }

  /** Returns {@link #src} as a String. */
  public String source() {
    return new String(src, UTF_8);
  }

  /**
   * The package the unit was checked into. Its package-level symbols are the olds for the next
   * block. Null if conversion failed.
   */
  public @Nullable Package pkg() {
    return pkg;
  }

  /** The results of the final check. Null if conversion failed. */
  public @Nullable Info info() {
    return info;
  }

  /** The packages imported by the block itself, sorted by name. */
  public ImmutableList<PkgName> imports() {
    return imports;
  }

  public @Nullable CompileError error() {
    return error;
  }

  public boolean ok() {
    return error == null;
  }
}
