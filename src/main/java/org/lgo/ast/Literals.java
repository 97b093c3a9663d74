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

/** Statics for converting between string values and Lesser Go string literals. */
public final class Literals {

  // Statics only
  private Literals() {}

  /** Returns an interpreted string literal (with double quotes) for {@code s}. */
  public static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\r':
          sb.append("\\r");
          break;
        default:
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('"').toString();
  }

  /**
   * Returns the value of an interpreted ({@code "..."}) or raw ({@code `...`}) string literal. The
   * literal is assumed to be well-formed (the lexer only produces well-formed literals).
   */
  public static String unquote(String literal) {
    checkArgument(literal.length() >= 2, "not a string literal: %s", literal);
    String body = literal.substring(1, literal.length() - 1);
    if (literal.charAt(0) == '`') {
      return body.replace("\r", "");
    }
    StringBuilder sb = new StringBuilder(body.length());
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      char e = body.charAt(++i);
      switch (e) {
        case 'a':
          sb.append('\u0007');
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'v':
          sb.append('\u000b');
          break;
        case 'x':
          sb.append((char) Integer.parseInt(body.substring(i + 1, i + 3), 16));
          i += 2;
          break;
        case 'u':
          sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
          i += 4;
          break;
        default:
          if (e >= '0' && e <= '7') {
            sb.append((char) Integer.parseInt(body.substring(i, i + 3), 8));
            i += 2;
          } else {
            // \\, \', \"
            sb.append(e);
          }
      }
    }
    return sb.toString();
  }
}
