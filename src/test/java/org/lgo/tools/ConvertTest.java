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


package org.lgo.tools;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConvertTest {

  @Test
  public void splitsOnSeparatorLines() {
    assertThat(Convert.splitBlocks("x := 1\n---\ny := 2\n  ---  \nz := 3"))
        .containsExactly("x := 1\n", "y := 2\n", "z := 3\n")
        .inOrder();
    assertThat(Convert.splitBlocks("x := 1\n---\n\n")).containsExactly("x := 1\n");
    assertThat(Convert.splitBlocks("---\nx := 1")).containsExactly("", "x := 1\n").inOrder();
  }

  @Test
  public void convertsSession() {
    Convert session = new Convert("LgoExport_", "LgoExport_", false, false);
    assertThat(session.convert("x := 1"))
        .isEqualTo(
            "/* BLOCK 1 */\n"
                + "package lgo_exec\n"
                + "\n"
                + "func lgo_init() {\n"
                + "\tLgoExport_x = 1\n"
                + "}\n"
                + "\n"
                + "var (\n"
                + "\tLgoExport_x int\n"
                + ")\n");
    assertThat(session.convert("x + 1")).contains("pkg1.LgoPrintln(pkg0.LgoExport_x + 1)");
    assertThat(session.convert("y")).startsWith("/* BLOCK 3 ERROR\n  undefined: y");
    // The failed block is still counted.
    assertThat(session.convert("x * 2")).contains("import pkg0 \"lgo/exec/pkg1\"");
  }

  @Test
  public void reusesImportsOfEarlierBlocks() {
    Convert session = new Convert("", "", false, false);
    session.convert("import \"strings\"");
    assertThat(session.convert("strings.ToUpper(\"a\")")).contains("import strings \"strings\"");
  }

  @Test
  public void optionsArePassedToConverter() {
    Convert session = new Convert("", "", true, true);
    String out = session.convert("n := 0\nfor n < 3 {\n\tn++\n}");
    assertThat(out).contains("pkg0.LgoRegisterVar(\"n\", &n)");
    assertThat(out).contains("for n < 3 {\n\t\tpkg0.ExitIfCtxDone()");
  }
}
