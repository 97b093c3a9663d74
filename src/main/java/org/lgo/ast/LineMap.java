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

import com.google.errorprone.annotations.FormatMethod;
import java.util.Arrays;

/**
 * Translates character offsets (as stored in {@link Ast.Node#pos}) into line numbers and columns of
 * the source they were parsed from.
 */
public final class LineMap {
  /** A LineMap for code that was not parsed from any source; every position maps to 0:0. */
  public static final LineMap NONE = new LineMap(new int[0]);

  /** The offset at which each line starts; {@code lineStarts[0]} is always 0. */
  private final int[] lineStarts;

  private LineMap(int[] lineStarts) {
    this.lineStarts = lineStarts;
  }

  public static LineMap of(String src) {
    int[] starts = new int[16];
    int n = 1;
    for (int i = 0; i < src.length(); i++) {
      if (src.charAt(i) == '\n') {
        if (n == starts.length) {
          starts = Arrays.copyOf(starts, n * 2);
        }
        starts[n++] = i + 1;
      }
    }
    return new LineMap(Arrays.copyOf(starts, n));
  }

  /** Returns the 1-based line containing {@code offset}, or 0 if the offset is unknown. */
  public int line(int offset) {
    if (offset < 0 || lineStarts.length == 0) {
      return 0;
    }
    int i = Arrays.binarySearch(lineStarts, offset);
    return (i >= 0) ? i + 1 : -i - 1;
  }

  /** Returns the 0-based column of {@code offset}, or 0 if the offset is unknown. */
  public int column(int offset) {
    int line = line(offset);
    return (line == 0) ? 0 : offset - lineStarts[line - 1];
  }

  /** Returns a new CompileError located at the start of the given node. */
  public CompileError error(Ast.Node node, String msg) {
    return errorAt(node.pos, msg);
  }

  /** Returns a new CompileError located at the given offset. */
  public CompileError errorAt(int offset, String msg) {
    return new CompileError(msg, line(offset), column(offset));
  }

  /** Returns a new CompileError located at the start of the given node. */
  @FormatMethod
  public CompileError error(Ast.Node node, String fmt, Object... fmtArgs) {
    return error(node, String.format(fmt, fmtArgs));
  }
}
