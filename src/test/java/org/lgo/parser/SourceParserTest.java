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


package org.lgo.parser;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.lgo.ast.Ast.BlockStmt;
import org.lgo.ast.Ast.DeclStmt;
import org.lgo.ast.Ast.File;
import org.lgo.ast.Ast.FuncDecl;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.IfStmt;
import org.lgo.ast.Ast.ReturnStmt;
import org.lgo.ast.Ast.StatementBlock;
import org.lgo.ast.CompileError;
import org.lgo.ast.Printer;

@RunWith(JUnitParamsRunner.class)
public class SourceParserTest {

  /** Each of these blocks should print exactly as written. */
  private static Object[] canonicalBlocks() {
    return new Object[] {
      new Object[] {"x := 1"},
      new Object[] {"a, b = b, a"},
      new Object[] {"x += 2"},
      new Object[] {"x++"},
      new Object[] {"y := -x + a * b"},
      new Object[] {"y := (a + b) * c"},
      new Object[] {"y := a - (b - c)"},
      new Object[] {"if x > 0 {\n\ty = 1\n} else if x < 0 {\n\ty = 2\n} else {\n\ty = 3\n}"},
      new Object[] {"if v, ok := m[k]; ok {\n\tf(v)\n}"},
      new Object[] {"for i := 0; i < 3; i++ {\n\tn += i\n}"},
      new Object[] {"for k, v := range m {\n\tf(k, v)\n}"},
      new Object[] {"for x := range xs {\n}"},
      new Object[] {"for {\n\tbreak\n}"},
      new Object[] {"for x < 10 {\n\tx *= 2\n}"},
      new Object[] {"p := point{x: 1, y: 2}"},
      new Object[] {"if p == (point{}) {\n}"},
      new Object[] {"f := func(x int) int {\n\treturn x * 2\n}"},
      new Object[] {"v, ok := m[k]"},
      new Object[] {"s := xs[1:]"},
      new Object[] {"n, ok := x.(int)"},
      new Object[] {"go f(x)"},
      new Object[] {"defer g()"},
      new Object[] {"f(xs...)"},
      new Object[] {"xs := []int{1, 2, 3}"},
      new Object[] {"m := map[string]int{\"a\": 1}"},
      new Object[] {"p := &point{}"},
      new Object[] {"var x, y int = 1, 2"},
      new Object[] {"var f func(int, string) (int, error)"},
      new Object[] {"var s interface {\n\tString() string\n}"},
      new Object[] {"const (\n\ta = 1\n\tb = 2\n)"},
      new Object[] {"type T struct {\n\ta, b int\n\tname string\n}"},
      new Object[] {"import \"fmt\""},
      new Object[] {"import (\n\t\"fmt\"\n\ts \"strings\"\n)"},
      new Object[] {"func (p *T) Name() string {\n\treturn p.name\n}"},
    };
  }

  @Test
  @Parameters(method = "canonicalBlocks")
  public void printsAsWritten(String src) {
    assertThat(print(SourceParser.parseBlock(src))).isEqualTo(src);
  }

  private static Object[] insertedSemicolons() {
    return new Object[] {
      new Object[] {"x := 1; y := 2", "x := 1\ny := 2"},
      new Object[] {"x := 1\n\n\ny := 2\n", "x := 1\ny := 2"},
      new Object[] {"f(a,\n\tb)", "f(a, b)"},
      new Object[] {"x := []int{\n\t1,\n\t2,\n}", "x := []int{1, 2}"},
      new Object[] {"if ok { f() }", "if ok {\n\tf()\n}"},
      new Object[] {"y := a +\n\tb", "y := a + b"},
    };
  }

  @Test
  @Parameters(method = "insertedSemicolons")
  public void semicolons(String src, String expected) {
    assertThat(print(SourceParser.parseBlock(src))).isEqualTo(expected);
  }

  private static Object[] syntaxErrors() {
    return new Object[] {
      new Object[] {"if {\n}", 1, "missing condition in if statement"},
      new Object[] {"go x", 1, "expression in go must be function call"},
      new Object[] {"a.b := 1", 1, "non-name a.b on left side of :="},
      new Object[] {"x := 1\nif true {\n\timport \"fmt\"\n}", 3, "unexpected import"},
      new Object[] {"for i := 0; i < 3; j := 1 {\n}", 1, "cannot declare in post statement"},
      new Object[] {"x := 1\ny := )", 2, ""},
      new Object[] {"x := 1 y := 2", 1, ""},
      new Object[] {"break outer", 1, "labels are not supported"},
      new Object[] {"type T = int", 1, "type aliases are not supported"},
      new Object[] {"if ok {\n\tfunc f() {}\n}", 2, "function declarations are only allowed"},
    };
  }

  @Test
  @Parameters(method = "syntaxErrors")
  public void syntaxError(String src, int line, String msg) {
    CompileError e = assertThrows(CompileError.class, () -> SourceParser.parseBlock(src));
    assertThat(e.lineNum).isEqualTo(line);
    assertThat(e.msg).startsWith(msg);
  }

  /** A newline ends the statement only after a token that could end one. */
  private static Object[] statementCounts() {
    return new Object[] {
      new Object[] {"x := 1\n-x", 2},
      new Object[] {"x := 1\n*p = 2", 2},
      new Object[] {"f()\n(g)()", 2},
      new Object[] {"x := y\n[]int{1}[0]++", 2},
      new Object[] {"y := a +\n\tb", 1},
      new Object[] {"y := f(\n\ta,\n)", 1},
      new Object[] {"y := x.\n\tf()", 1},
      new Object[] {"f := func()\nf = nil", 2},
      new Object[] {"x := 1 /* one\n */ y := 2", 2},
    };
  }

  @Test
  @Parameters(method = "statementCounts")
  public void newlinesEndStatements(String src, int count) {
    assertThat(SourceParser.parseBlock(src).stmts).hasSize(count);
  }

  @Test
  public void returnAtEndOfLineHasNoResults() {
    StatementBlock blk = SourceParser.parseBlock("func f() {\n\treturn\n\tg()\n}");
    BlockStmt body = ((FuncDecl) ((DeclStmt) blk.stmts.get(0)).decl).body;
    assertThat(body.list).hasSize(2);
    assertThat(((ReturnStmt) body.list.get(0)).results).isEmpty();
  }

  /** In an if or for header a brace after a name opens the body, elsewhere a composite literal. */
  private static Object[] bracesAfterNames() {
    return new Object[] {
      new Object[] {"if x == y {\n\tf()\n}"},
      new Object[] {"for x < n {\n\tx++\n}"},
      new Object[] {"if ok {\n\tp := point{x: 1}\n}"},
      new Object[] {"if f(point{}) {\n}"},
      new Object[] {"for _, p := range f(point{}) {\n}"},
      new Object[] {"if p == (pkg0.T{}) {\n}"},
      new Object[] {"x := pkg0.T{a: 1}"},
    };
  }

  @Test
  @Parameters(method = "bracesAfterNames")
  public void bracesAfterNamesPrintAsWritten(String src) {
    assertThat(print(SourceParser.parseBlock(src))).isEqualTo(src);
  }

  @Test
  public void conditionIsNotCompositeLiteral() {
    StatementBlock blk = SourceParser.parseBlock("if ok {\n}");
    IfStmt stmt = (IfStmt) blk.stmts.get(0);
    assertThat(stmt.cond).isInstanceOf(Ident.class);
    assertThat(stmt.body.list).isEmpty();
  }

  @Test
  public void blockPositions() {
    StatementBlock blk = SourceParser.parseBlock("x := 1\ny := 2");
    assertThat(blk.stmts).hasSize(2);
    assertThat(blk.stmts.get(1).pos).isEqualTo(7);
    assertThat(blk.stmts.get(1).end).isEqualTo(13);
  }

  @Test
  public void leadingCommentsAreDoc() {
    StatementBlock blk = SourceParser.parseBlock("// Doubles x.\nx = 2 * x // twice\n");
    assertThat(blk.doc).hasSize(1);
    assertThat(blk.doc.get(0).text).isEqualTo("// Doubles x.");
    assertThat(blk.comments).hasSize(2);
  }

  @Test
  public void fileWithExternalFunction() {
    File file =
        SourceParser.parseFile("package geo\n\nimport \"math\"\n\nfunc Dist(a, b float64) float64\n");
    assertThat(file.packageName).isEqualTo("geo");
    assertThat(file.decls).hasSize(2);
    assertThat(((FuncDecl) file.decls.get(1)).body).isNull();
  }

  @Test
  public void blockFunctionNeedsBody() {
    assertThrows(CompileError.class, () -> SourceParser.parseBlock("func f()"));
  }

  @Test
  public void typeExpression() {
    assertThat(SourceParser.parseExpr("map[string][]*pkg0.T").toString())
        .isEqualTo("map[string][]*pkg0.T");
  }

  private static String print(StatementBlock blk) {
    return Printer.nodeToString(blk).stripTrailing();
  }
}
