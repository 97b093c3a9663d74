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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.lgo.ast.Ast.File;
import org.lgo.ast.Ast.FuncDecl;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.CompileError;
import org.lgo.parser.SourceParser;

@RunWith(JUnitParamsRunner.class)
public class CheckerTest {

  private Importer importer = SourceImporter.standard();
  private Info info = new Info();
  private Package pkg;

  /** Checks {@code src} as the body of a file in package p; returns the diagnostics. */
  private ImmutableList<String> check(String src) {
    File file = SourceParser.parseFile("package p\n\n" + src);
    pkg = Package.create("example.com/p", "p");
    List<CompileError> errors = new ArrayList<>();
    new Checker(new Checker.Config(importer, errors::add), pkg, info).checkFile(file);
    ImmutableList.Builder<String> result = ImmutableList.builder();
    errors.forEach(e -> result.add(e.msg));
    return result.build();
  }

  private static Object[] badPrograms() {
    return new Object[] {
      new Object[] {"func f() {\n\tx := y\n\t_ = x\n}", "undefined: y"},
      new Object[] {"func f() {\n\tx := 1\n}", "x declared and not used"},
      new Object[] {"func f() int {\n}", "missing return"},
      new Object[] {"func f() {\n\tbreak\n}", "break is not in a loop"},
      new Object[] {"var x = 1\nvar x = 2", "x redeclared in this block"},
      new Object[] {"type T struct {\n\tt T\n}", "invalid recursive type T"},
      new Object[] {"var xs []int\nconst c = len(xs)", "len(xs) (value of type int) is not constant"},
      new Object[] {
        "func f(a string, b int) {\n\t_ = a + b\n}",
        "invalid operation: a + b (mismatched types string and int)"
      },
      new Object[] {
        "func f() {\n\tx := 1\n\tvar s string = x\n\t_ = s\n}",
        "cannot use x (variable of type int) as string value in "
      },
      new Object[] {
        "func f() {\n\tg(1, 2)\n}\nfunc g(x int) {\n}",
        "too many arguments for g(1, 2) (expected 1, found 2)"
      },
      new Object[] {
        "func f() int {\n\treturn g() + 1\n}\nfunc g() (int, int) {\n\treturn 1, 2\n}",
        "multiple-value g() (value of type (int, int)) in single-value context"
      },
      new Object[] {
        "func f() {\n\tx, y := g()\n\t_, _ = x, y\n}\nfunc g() int {\n\treturn 1\n}",
        "assignment mismatch: "
      },
      new Object[] {"func f() {\n\tx := 1\n\tx := 2\n\t_ = x\n}", "no new variables on left side of :="},
      new Object[] {"func f() {\n\tfor i := 0; i < 2; i++ {\n\t}\n\t1 + 2\n}", "1 + 2 "},
    };
  }

  @Test
  @Parameters(method = "badPrograms")
  public void reportsError(String src, String msg) {
    ImmutableList<String> errors = check(src);
    assertThat(errors).isNotEmpty();
    assertThat(errors.get(0)).startsWith(msg);
  }

  private static Object[] goodPrograms() {
    return new Object[] {
      new Object[] {"var x = 1\nvar y = x + 2"},
      new Object[] {"var y = x\nvar x = 3"},
      new Object[] {"func f(m map[string]int) bool {\n\t_, ok := m[\"a\"]\n\treturn ok\n}"},
      new Object[] {"func f(x interface{}) int {\n\tn, _ := x.(int)\n\treturn n\n}"},
      new Object[] {"import \"fmt\"\n\nfunc f(xs []interface{}) {\n\tfmt.Println(xs...)\n}"},
      new Object[] {"func f() (int, string) {\n\treturn g()\n}\nfunc g() (int, string) {\n\treturn 1, \"\"\n}"},
      new Object[] {"func f(xs []int) int {\n\tn := 0\n\tfor _, x := range xs {\n\t\tn += x\n\t}\n\treturn n\n}"},
      new Object[] {"func f(s string) int {\n\tfor i := range s {\n\t\treturn i\n\t}\n\treturn -1\n}"},
      new Object[] {"const big = 1 << 10\nvar f float64 = big"},
      new Object[] {"type list struct {\n\tnext *list\n}"},
      new Object[] {"func f() {\n\tch := make([]int, 3)\n\tch = append(ch, 4)\n\tdelete(map[int]int{}, 1)\n}"},
      new Object[] {"func f() func() int {\n\tn := 0\n\treturn func() int {\n\t\tn++\n\t\treturn n\n\t}\n}"},
    };
  }

  @Test
  @Parameters(method = "goodPrograms")
  public void checksCleanly(String src) {
    assertThat(check(src)).isEmpty();
  }

  @Test
  public void pointerMethodsAreNotInValueMethodSet() {
    String types =
        "import \"fmt\"\n\ntype T struct{}\n\nfunc (t *T) String() string {\n\treturn \"t\"\n}\n";
    assertThat(check(types + "var s fmt.Stringer = &T{}")).isEmpty();
    ImmutableList<String> errors = check(types + "var s fmt.Stringer = T{}");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0)).endsWith(": T does not implement fmt.Stringer (missing method String)");
  }

  @Test
  public void unexportedNamesOfSessionPackages() {
    importer =
        SourceImporter.withSources(
            ImmutableMap.of("example.com/q", "package q\n\nvar hidden int\n\nvar Shown int\n"));
    String src = "import \"example.com/q\"\n\nvar a = q.Shown + q.hidden";
    assertThat(check(src)).contains("name hidden not exported by package q");

    Package q;
    try {
      q = importer.importPackage("example.com/q");
    } catch (ImportException e) {
      throw new AssertionError(e);
    }
    q.setSession(true);
    assertThat(check(src)).isEmpty();
  }

  @Test
  public void recordsDefsAndUses() {
    File file = SourceParser.parseFile("package p\n\nvar x = 1\n\nfunc f() int {\n\treturn x\n}\n");
    pkg = Package.create("example.com/p", "p");
    List<CompileError> errors = new ArrayList<>();
    new Checker(new Checker.Config(importer, errors::add), pkg, info).checkFile(file);
    assertThat(errors).isEmpty();
    Symbol x = pkg.scope().lookup("x");
    assertThat(x.toString()).isEqualTo("var x int");
    assertThat(info.uses.values()).contains(x);
    Ident fName = ((FuncDecl) file.decls.get(1)).name;
    assertThat(info.defs.get(fName).toString()).isEqualTo("func f() int");
  }

  @Test
  public void ignoredBodiesAreNotChecked() {
    File file =
        SourceParser.parseFile(
            "package p\n\nfunc f() {\n\tundefinedName()\n}\n\nfunc g() {\n\talsoUndefined()\n}\n");
    pkg = Package.create("example.com/p", "p");
    List<CompileError> errors = new ArrayList<>();
    Checker.Config conf =
        new Checker.Config(importer, errors::add).ignoreFuncBodies(true).alwaysCheck("g");
    new Checker(conf, pkg, info).checkFile(file);
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).msg).isEqualTo("undefined: alsoUndefined");
  }

  @Test
  public void variableWithInvalidInitializerCountsAsUsed() {
    ImmutableList<String> errors =
        check("func f() {\n\ta := undefined1\n\tb := undefined2\n\t_, _ = a, b\n}");
    assertThat(errors).containsExactly("undefined: undefined1", "undefined: undefined2").inOrder();
  }

  @Test
  public void errorPositions() {
    ImmutableList<String> unused = check("func f() {\n\tx := 1\n}");
    assertThat(unused).hasSize(1);
    File file = SourceParser.parseFile("package p\n\nfunc f() {\n\tx := 1\n}\n");
    List<CompileError> errors = new ArrayList<>();
    new Checker(new Checker.Config(importer, errors::add), Package.create("p", "p"), new Info())
        .checkFile(file);
    assertThat(errors.get(0).lineNum).isEqualTo(4);
    assertThat(errors.get(0).getMessage()).isEqualTo("x declared and not used (4:1)");
  }
}
