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

import org.lgo.types.ImportException;
import org.lgo.types.Importer;
import org.lgo.types.Package;

/**
 * The runtime functions that converted code calls. They are only referenced by name; their
 * declarations come from the importer's {@code lgo/core} package.
 */
final class CoreHooks {

  // Statics only
  private CoreHooks() {}

  static final String PATH = "lgo/core";

  static final String GET_EXEC_CONTEXT = "GetExecContext";
  static final String PRINTLN = "LgoPrintln";
  static final String REGISTER_VAR = "LgoRegisterVar";
  static final String INIT_GOROUTINE = "InitGoroutine";
  static final String FINALIZE_GOROUTINE = "FinalizeGoroutine";
  static final String EXIT_IF_CTX_DONE = "ExitIfCtxDone";

  /** The name of the function that holds a block's statements. */
  static final String INIT_FUNC_NAME = "lgo_init";

  /** The name of the variable through which a block refers to its execution context. */
  static final String EXEC_CONTEXT_VAR = "runctx";

  /** The package name of every converted block. */
  static final String PACKAGE_NAME = "lgo_exec";

  /**
   * Imports a package the converter depends on; a failure means the importer is misconfigured, not
   * that the block is wrong.
   */
  static Package require(Importer importer, String path) {
    try {
      return importer.importPackage(path);
    } catch (ImportException e) {
      throw new IllegalStateException("Failed to import " + path, e);
    }
  }
}
