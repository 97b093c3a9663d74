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

package org.lgo.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A CompileError that aggregates two or more diagnostics. It reports the position of the first one,
 * and its message summarizes the rest as "(and N more errors)".
 */
public final class ErrorList extends CompileError {
  private final ImmutableList<CompileError> errors;

  private ErrorList(ImmutableList<CompileError> errors) {
    super(errors.get(0).msg, errors.get(0).lineNum, errors.get(0).charPositionInLine);
    this.errors = errors;
  }

  /**
   * Returns the single error if {@code errors} has one element, or an ErrorList wrapping all of
   * them. {@code errors} must not be empty.
   */
  public static CompileError of(List<CompileError> errors) {
    checkArgument(!errors.isEmpty(), "no errors");
    if (errors.size() == 1) {
      return errors.get(0);
    }
    return new ErrorList(ImmutableList.copyOf(errors));
  }

  /** All of the aggregated errors, in the order they were reported. */
  public ImmutableList<CompileError> errors() {
    return errors;
  }

  @Override
  public String getMessage() {
    return String.format("%s (and %d more errors)", errors.get(0).getMessage(), errors.size() - 1);
  }
}
