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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lgo.ast.ErrorList;
import org.lgo.types.Package;
import org.lgo.types.PkgName;
import org.lgo.types.SourceImporter;
import org.lgo.types.Symbol;

@RunWith(JUnit4.class)
public class ConverterTest {

  private final List<Symbol> olds = new ArrayList<>();
  private final List<PkgName> oldImports = new ArrayList<>();
  private int count;
  private Converter.Config base;

  @Before
  public void setUp() {
    base = new Converter.Config();
  }

  /** Converts {@code src} as the next block of the session, and remembers its symbols. */
  private ConvertResult convert(String src) {
    Converter.Config conf =
        base.olds(olds).oldImports(oldImports).lgoPkgPath("lgo/exec/pkg" + ++count);
    ConvertResult result = Converter.convert(src, conf);
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

  private String convertOk(String src) {
    ConvertResult result = convert(src);
    assertWithMessage("Unexpected error %s", result.error()).that(result.ok()).isTrue();
    return result.source();
  }

  private static int occurrences(String s, String sub) {
    int n = 0;
    for (int i = s.indexOf(sub); i >= 0; i = s.indexOf(sub, i + sub.length())) {
      n++;
    }
    return n;
  }

  @Test
  public void definedVariableIsPersisted() {
    ConvertResult first = convert("x := 1");
    assertThat(first.ok()).isTrue();
    assertThat(first.source()).contains("\tx = 1\n");
    assertThat(first.source()).contains("var (\n\tx int\n)");
    assertThat(first.pkg().scope().lookup("x").toString()).isEqualTo("var x int");

    ConvertResult second = convert("y := x\ny");
    assertThat(second.ok()).isTrue();
    assertThat(second.pkg().scope().lookup("y").toString()).isEqualTo("var y int");
  }

  @Test
  public void trailingExpressionIsPrinted() {
    convertOk("x := 1");
    assertThat(convertOk("x + 1")).contains("pkg1.LgoPrintln(pkg0.x + 1)");
  }

  @Test
  public void trailingCallIsPrintedOnlyWithOneResult() {
    assertThat(convertOk("import \"strings\"\nstrings.ToUpper(\"a\")")).contains("LgoPrintln");
    assertThat(convertOk("import \"fmt\"\nfmt.Println(\"hi\")")).doesNotContain("LgoPrintln");
    assertThat(convertOk("func two() (int, int) { return 1, 2 }\ntwo()"))
        .doesNotContain("LgoPrintln");
    assertThat(convertOk("func none() {}\nnone()")).doesNotContain("LgoPrintln");
  }

  @Test
  public void repeatedImportIsDeclaredOnce() {
    String first = convertOk("import \"strings\"\nstrings.ToUpper(\"a\")");
    String second = convertOk("import \"strings\"\nstrings.ToLower(\"B\")");
    String third = convertOk("strings.TrimSpace(\" c \")");
    assertThat(occurrences(first, "\"strings\"")).isEqualTo(1);
    assertThat(occurrences(second, "\"strings\"")).isEqualTo(1);
    assertThat(occurrences(third, "\"strings\"")).isEqualTo(1);
    assertThat(third).contains("import strings \"strings\"");
  }

  @Test
  public void aliasAvoidsVisibleNames() {
    convertOk("pkg0 := 1\npkg2 := 2");
    String src = convertOk("pkg0 + pkg2");
    // pkg0 and pkg2 are earlier variables, so the earlier block gets pkg1 and the runtime pkg3.
    assertThat(src).contains("import pkg1 \"lgo/exec/pkg1\"");
    assertThat(src).contains("import pkg3 \"lgo/core\"");
    assertThat(src).contains("pkg3.LgoPrintln(pkg1.pkg0 + pkg1.pkg2)");
  }

  @Test
  public void aliasAvoidsNamesDeclaredInNestedScopes() {
    convertOk("x := 1");
    String src = convertOk("for pkg0 := 0; pkg0 < 1; pkg0++ {\n\tx = x + 1\n}");
    assertThat(src).contains("import pkg1 \"lgo/exec/pkg1\"");
    assertThat(src).contains("pkg1.x = pkg1.x + 1");
  }

  @Test
  public void aliasAvoidsNamesDeclaredInFunctionBodies() {
    convertOk("x := 1");
    String src = convertOk("func f() int {\n\tpkg0 := 2\n\treturn x + pkg0\n}");
    assertThat(src).contains("return pkg1.x + pkg0");
  }

  @Test
  public void goStatementIsGuarded() {
    String src = convertOk("func f(n int) {}\ngo f(1)");
    int init = src.indexOf("ectx := pkg0.InitGoroutine()");
    int go = src.indexOf("go func() {");
    int finalize = src.indexOf("defer pkg0.FinalizeGoroutine(ectx)");
    assertThat(init).isAtLeast(0);
    assertThat(go).isGreaterThan(init);
    assertThat(finalize).isGreaterThan(go);
    assertThat(src).contains("f(1)\n\t\t}()");
  }

  @Test
  public void goStatementInFunctionLiteral() {
    String src = convertOk("func f() {}\ng := func() {\n\tgo f()\n}\ng()");
    assertThat(src).contains("g = func() {\n\t\t{\n\t\t\tectx := pkg0.InitGoroutine()");
  }

  @Test
  public void unexportedNamesArePrefixed() {
    base.defPrefix("Def_").refPrefix("Ref_");
    String first = convertOk("func half(n int) int {\n\treturn n / 2\n}\nvar Limit = 8");
    assertThat(first).contains("func Def_half(n int) int");
    assertThat(first).contains("\tLimit = 8");
    assertThat(first).doesNotContain("Def_Limit");

    String second = convertOk("half(Limit)");
    assertThat(second).contains("pkg0.Ref_half(pkg0.Limit)");
    assertThat(second).doesNotContain("Ref_Limit");
  }

  @Test
  public void fieldsAndMethodsArePrefixed() {
    base.defPrefix("D_").refPrefix("R_");
    String first =
        convertOk("type pt struct {\n\tx int\n}\nfunc (p pt) twice() int {\n\treturn p.x * 2\n}");
    assertThat(first).contains("type D_pt struct {\n\tD_x int\n}");
    assertThat(first).contains("func (p R_pt) D_twice() int {\n\treturn p.R_x * 2\n}");

    String second = convertOk("v := pt{x: 3}\nv.twice()");
    // The hoisted declaration is a definition; the assignment to it is a reference.
    assertThat(second).contains("\tD_v pkg0.R_pt\n");
    assertThat(second).contains("R_v = pkg0.R_pt{R_x: 3}");
    assertThat(second).contains("LgoPrintln(R_v.R_twice())");
  }

  @Test
  public void unusedImportIsPruned() {
    ConvertResult result = convert("import \"math\"\nx := 2");
    assertThat(result.ok()).isTrue();
    assertThat(result.source()).doesNotContain("math");
    assertThat(result.imports()).hasSize(1);
  }

  @Test
  public void blockWithOnlyAnImportIsEmpty() {
    ConvertResult result = convert("import \"math\"");
    assertThat(result.ok()).isTrue();
    assertThat(result.src()).isEmpty();
    assertThat(convertOk("math.Sqrt(4.0)")).contains("import math \"math\"");
  }

  @Test
  public void executionContextIsRetrievedAtRunTime() {
    String src = convertOk("c := runctx\nfunc check() error {\n\treturn runctx.Err()\n}");
    assertThat(src).contains("c = pkg0.GetExecContext()");
    assertThat(src).contains("return pkg0.GetExecContext().Err()");
    assertThat(src).contains("import pkg1 \"context\"");
    assertThat(src).contains("\tc pkg1.Context\n");
  }

  @Test
  public void earlierRunctxHidesExecutionContext() {
    convertOk("runctx := 5");
    assertThat(convertOk("runctx + 1")).contains("pkg1.LgoPrintln(pkg0.runctx + 1)");
  }

  @Test
  public void autoExitIsInsertedInBodies() {
    base.autoExitCode(true);
    String src = convertOk("func loop() {\n\tfor {\n\t}\n}");
    assertThat(src)
        .contains("func loop() {\n\tpkg0.ExitIfCtxDone()\n\tfor {\n\t\tpkg0.ExitIfCtxDone()\n\t}");
  }

  @Test
  public void registersHoistedVariables() {
    base.registerVars(true);
    String src = convertOk("a, b := 1, \"x\"");
    assertThat(src)
        .contains(
            "pkg0.LgoRegisterVar(\"a\", &a)\n\tpkg0.LgoRegisterVar(\"b\", &b)\n\ta, b = 1, \"x\"");
  }

  @Test
  public void parseErrorIsReported() {
    ConvertResult result = convert("x := ");
    assertThat(result.ok()).isFalse();
    assertThat(result.src()).isEmpty();
  }

  @Test
  public void severalErrorsAreReportedTogether() {
    ConvertResult result = convert("a := b\nc := d");
    assertThat(result.ok()).isFalse();
    assertThat(result.error()).isInstanceOf(ErrorList.class);
    assertThat(result.error().getMessage()).startsWith("undefined: b");
    assertThat(result.error().getMessage()).containsMatch("\\(and \\d+ more errors\\)$");
  }

  @Test
  public void failedInitializersAreNotReportedAsUnused() {
    ConvertResult result = convert("a := undefined1\nb := undefined2");
    assertThat(result.ok()).isFalse();
    assertThat(((ErrorList) result.error()).errors()).hasSize(2);
    assertThat(result.error().getMessage()).endsWith("(and 1 more errors)");
  }

  @Test
  public void failedBlockLeavesSessionUnchanged() {
    convertOk("x := 1");
    assertThat(convert("x := undefinedThing").ok()).isFalse();
    assertThat(convertOk("x")).contains("LgoPrintln(pkg0.x)");
  }

  @Test
  public void injectedImporter() {
    base.importer(
        SourceImporter.withSources(
            ImmutableMap.of(
                "example.com/geo", "package geo\n\nfunc Dist(a, b float64) float64\n")));
    String src = convertOk("import \"example.com/geo\"\ngeo.Dist(1, 2)");
    assertThat(src).contains("import \"example.com/geo\"");
    assertThat(src).contains("pkg0.LgoPrintln(geo.Dist(1, 2))");
  }

  @Test
  public void missingPackageIsAnError() {
    ConvertResult result = convert("import \"no/such/pkg\"");
    assertThat(result.ok()).isFalse();
    assertThat(result.error().getMessage()).startsWith("could not import no/such/pkg");
  }
}
