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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.base.Splitter;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.lgo.testing.TestdataScanner;
import org.lgo.testing.TestdataScanner.TestProgram;
import org.lgo.types.Package;
import org.lgo.types.PkgName;
import org.lgo.types.Symbol;

/**
 * Converts the blocks in each of the .lgo files in the testdata directory, based on comments in
 * the files. The blocks of a file are converted in order as a single session, so later blocks may
 * refer to symbols and imports of earlier ones.
 */
@RunWith(TestParameterInjector.class)
public class ConvertTestdataTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/lgo/converter/testdata");

  /**
   * Each block is followed by a comment that begins "{@code /* CONVERT}", optionally followed by
   * options in parentheses (e.g. "{@code (defPrefix=Def_, autoExit)}"). Then either
   *
   * <ul>
   *   <li>a colon and the beginning of the expected error message, or
   *   <li>the expected translation unit, on the following lines (nothing, if the block converts
   *       to an empty unit).
   * </ul>
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n?/\\* CONVERT(.*?)\\*/\\n*", Pattern.DOTALL);

  private static final Pattern FIRST_LINE_PATTERN =
      Pattern.compile(" *(?:\\(([^)]*)\\))? *(?::(.*))?\n?");

  @Test
  public void convertTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    Session session = new Session();
    for (TestProgram earlier : testProgram.earlier()) {
      session.convert(earlier);
    }
    String comment = checkNotNull(testProgram.comment(), "No CONVERT comment found");
    Matcher parts = FIRST_LINE_PATTERN.matcher(comment);
    assertWithMessage("Bad CONVERT comment").that(parts.lookingAt()).isTrue();
    String errMsg = parts.group(2);
    ConvertResult result = session.convert(testProgram);
    if (errMsg != null) {
      assertWithMessage("Expected error, converted OK").that(result.ok()).isFalse();
      assertWithMessage("Unexpected error %s", result.error())
          .that(result.error().getMessage())
          .startsWith(errMsg.trim());
      return;
    }
    assertWithMessage("Unexpected error %s", result.error()).that(result.ok()).isTrue();
    System.out.format("** %s:\n%s\n", testProgram.name(), result.source());
    assertWithMessage("Conversion results don't match")
        .that(cleanLines(result.source()))
        .isEqualTo(cleanLines(comment.substring(parts.end())));
  }

  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, COMMENT_PATTERN);
    }
  }

  /** The symbols and imports accumulated by converting the blocks of one file. */
  private static final class Session {
    final List<Symbol> olds = new ArrayList<>();
    final List<PkgName> oldImports = new ArrayList<>();
    int count;

    ConvertResult convert(TestProgram program) {
      Converter.Config conf =
          new Converter.Config()
              .olds(olds)
              .oldImports(oldImports)
              .lgoPkgPath("lgo/exec/pkg" + ++count);
      applyOptions(conf, program.comment());
      ConvertResult result = Converter.convert(program.code(), conf);
      if (result.ok()) {
        Package pkg = result.pkg();
        for (String name : pkg.scope().names()) {
          olds.add(pkg.scope().lookup(name));
        }
        for (PkgName imported : result.imports()) {
          oldImports.removeIf(old -> old.name().equals(imported.name()));
          oldImports.add(imported);
        }
      }
      return result;
    }
  }

  private static void applyOptions(Converter.Config conf, String comment) {
    if (comment == null) {
      return;
    }
    Matcher parts = FIRST_LINE_PATTERN.matcher(comment);
    if (!parts.lookingAt() || parts.group(1) == null) {
      return;
    }
    for (String option : Splitter.on(',').trimResults().omitEmptyStrings().split(parts.group(1))) {
      if (option.startsWith("defPrefix=")) {
        conf.defPrefix(option.substring("defPrefix=".length()));
      } else if (option.startsWith("refPrefix=")) {
        conf.refPrefix(option.substring("refPrefix=".length()));
      } else if (option.equals("autoExit")) {
        conf.autoExitCode(true);
      } else if (option.equals("registerVars")) {
        conf.registerVars(true);
      } else {
        throw new IllegalArgumentException("Unknown option " + option);
      }
    }
  }

  /**
   * Removes all whitespace at the beginning and end of lines in the given output, and removes all
   * completely blank lines.
   */
  private static String cleanLines(String output) {
    return output.replaceAll("[ \t]*\n[ \t\n]*", "\n").trim();
  }
}
