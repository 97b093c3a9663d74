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

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lgo.converter.DocResolver.Inspection;
import org.lgo.types.Package;
import org.lgo.types.Symbol;

@RunWith(JUnit4.class)
public class DocResolverTest {

  private final Converter.Config conf = new Converter.Config().lgoPkgPath("lgo/exec/pkg2");

  /** Inspects the first occurrence of {@code target} in {@code src}. */
  private Inspection inspect(String src, String target) {
    int offset = src.indexOf(target);
    assertThat(offset).isAtLeast(0);
    return DocResolver.inspectIdent(src, offset, conf);
  }

  private static Inspection doc(String doc) {
    return Inspection.doc(doc);
  }

  private static Inspection query(String query) {
    return Inspection.query(query);
  }

  @Test
  public void packageFunction() {
    String src = "import \"strings\"\nstrings.ToUpper(\"x\")";
    assertThat(inspect(src, "ToUpper")).isEqualTo(query("strings.ToUpper"));
    assertThat(inspect(src, "strings.")).isEqualTo(query("strings"));
  }

  @Test
  public void methodOfPointerReceiver() {
    String src = "import \"strings\"\nvar b strings.Builder\nb.WriteString(\"x\")";
    assertThat(inspect(src, "WriteString")).isEqualTo(query("strings.Builder.WriteString"));
  }

  @Test
  public void methodOfInterface() {
    String src = "import \"context\"\nvar ctx context.Context\nctx.Err()";
    assertThat(inspect(src, "Err")).isEqualTo(query("context.Context.Err"));
  }

  @Test
  public void methodOfExecutionContext() {
    assertThat(inspect("runctx.Err()", "Err")).isEqualTo(query("context.Context.Err"));
  }

  @Test
  public void packageVariable() {
    String src = "import \"context\"\ncontext.Canceled";
    assertThat(inspect(src, "Canceled")).isEqualTo(query("context.Canceled"));
  }

  @Test
  public void localFunction() {
    String src = "func f(x int) int {\n\treturn x\n}\nf(1)";
    assertThat(inspect(src, "f(1)")).isEqualTo(doc("func(x int) int"));
  }

  @Test
  public void localVariable() {
    assertThat(inspect("x := 1\nx + 1", "x + 1")).isEqualTo(doc("var x int"));
  }

  @Test
  public void localConstant() {
    assertThat(inspect("const c = 3\nc * 2", "c * 2")).isEqualTo(doc("const c untyped int"));
  }

  @Test
  public void localType() {
    String src = "type T struct {\n\ta int\n}\nT{a: 1}";
    assertThat(inspect(src, "T{")).isEqualTo(doc("type T struct{a int}"));
  }

  @Test
  public void fieldHasNoDoc() {
    String src = "type T struct {\n\ta int\n}\nv := T{a: 1}\nv.a\n";
    assertThat(inspect(src, "a\n")).isEqualTo(Inspection.EMPTY);
  }

  @Test
  public void symbolOfEarlierBlock() {
    ConvertResult first =
        Converter.convert(
            "func sq(n int) int {\n\treturn n * n\n}",
            new Converter.Config().lgoPkgPath("lgo/exec/pkg1"));
    assertThat(first.ok()).isTrue();
    Package pkg = first.pkg();
    List<Symbol> olds = new ArrayList<>();
    for (String name : pkg.scope().names()) {
      olds.add(pkg.scope().lookup(name));
    }
    conf.olds(olds);
    assertThat(inspect("sq(2)", "sq")).isEqualTo(doc("func(n int) int"));
  }

  @Test
  public void builtinIsEmpty() {
    assertThat(inspect("len(\"abc\")", "len")).isEqualTo(Inspection.EMPTY);
  }

  @Test
  public void notAnIdentifier() {
    assertThat(inspect("x := 1 + 2", "+")).isEqualTo(Inspection.EMPTY);
  }

  @Test
  public void undefinedIdentifier() {
    assertThat(inspect("nothing + 1", "nothing")).isEqualTo(Inspection.EMPTY);
  }

  @Test
  public void parseError() {
    assertThat(inspect("x := (", "x")).isEqualTo(Inspection.EMPTY);
  }
}
