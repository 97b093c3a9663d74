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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lgo.ast.Ast.AssignStmt;
import org.lgo.ast.Ast.DeclKind;
import org.lgo.ast.Ast.Expr;
import org.lgo.ast.Ast.File;
import org.lgo.ast.Ast.FuncDecl;
import org.lgo.ast.Ast.FuncType;
import org.lgo.ast.Ast.GenDecl;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.ImportSpec;
import org.lgo.ast.Ast.UnaryExpr;
import org.lgo.ast.Ast.ValueSpec;
import org.lgo.parser.SourceParser;

@RunWith(JUnit4.class)
public class PrinterTest {

  private static GenDecl importDecl(String name, String path) {
    ImportSpec spec = new ImportSpec((name == null) ? null : Ast.ident(name), Ast.stringLit(path));
    return new GenDecl(DeclKind.IMPORT, List.of(spec), false);
  }

  @Test
  public void synthesizedFile() {
    FuncDecl init =
        new FuncDecl(
            null,
            Ast.ident("lgo_init"),
            new FuncType(Ast.emptyFields(), null),
            Ast.block(
                Ast.exprStmt(
                    Ast.call(
                        Ast.qualified("pkg0", "LgoRegisterVar"),
                        Ast.stringLit("x"),
                        new UnaryExpr(Op.AND, Ast.ident("x")))),
                new AssignStmt(
                    List.of(Ast.ident("x")), Op.ASSIGN, List.of(SourceParser.parseExpr("1 + 2")))));
    GenDecl vars =
        new GenDecl(
            DeclKind.VAR,
            List.of(new ValueSpec(List.of(Ast.ident("x")), Ast.ident("int"), List.of())),
            true);
    File file =
        new File(
            "lgo_exec",
            List.of(),
            List.of(importDecl("pkg0", "lgo/core"), importDecl(null, "fmt"), init, vars),
            List.of(),
            LineMap.NONE);
    assertThat(Printer.print(file))
        .isEqualTo(
            "package lgo_exec\n"
                + "\n"
                + "import pkg0 \"lgo/core\"\n"
                + "import \"fmt\"\n"
                + "\n"
                + "func lgo_init() {\n"
                + "\tpkg0.LgoRegisterVar(\"x\", &x)\n"
                + "\tx = 1 + 2\n"
                + "}\n"
                + "\n"
                + "var (\n"
                + "\tx int\n"
                + ")\n");
  }

  @Test
  public void emptyFile() {
    File file = new File("p", List.of(), List.of(), List.of(), LineMap.NONE);
    assertThat(Printer.print(file)).isEqualTo("package p\n");
  }

  @Test
  public void emptyBodies() {
    File file = SourceParser.parseFile("package p\nfunc f() {}\ntype E struct{}\ntype I interface{}\n");
    assertThat(Printer.print(file))
        .isEqualTo(
            "package p\n\nfunc f() {\n}\n\ntype E struct{}\n\ntype I interface{}\n");
  }

  @Test
  public void docCommentsAreKept() {
    File file = SourceParser.parseFile("// Package p does things.\npackage p\n\nvar x int // not kept\n");
    assertThat(Printer.print(file))
        .isEqualTo("// Package p does things.\npackage p\n\nvar x int\n");
  }

  @Test
  public void parenthesesFollowTreeStructure() {
    // (a - b) - c and a - (b - c) differ; a * b + c needs no parentheses.
    Expr left = new Ast.BinaryExpr(Op.SUB, Ast.ident("a"), Ast.ident("b"));
    Expr right = new Ast.BinaryExpr(Op.SUB, Ast.ident("b"), Ast.ident("c"));
    assertThat(new Ast.BinaryExpr(Op.SUB, left, Ast.ident("c")).toString())
        .isEqualTo("a - b - c");
    assertThat(new Ast.BinaryExpr(Op.SUB, Ast.ident("a"), right).toString())
        .isEqualTo("a - (b - c)");
    Expr product = new Ast.BinaryExpr(Op.MUL, Ast.ident("a"), Ast.ident("b"));
    assertThat(new Ast.BinaryExpr(Op.ADD, product, Ast.ident("c")).toString())
        .isEqualTo("a * b + c");
    Expr sum = new Ast.BinaryExpr(Op.ADD, Ast.ident("a"), Ast.ident("b"));
    assertThat(new Ast.BinaryExpr(Op.MUL, sum, Ast.ident("c")).toString())
        .isEqualTo("(a + b) * c");
  }

  @Test
  public void doubleNegation() {
    Expr neg = new UnaryExpr(Op.SUB, new UnaryExpr(Op.SUB, Ast.ident("x")));
    assertThat(neg.toString()).isEqualTo("- -x");
  }

  @Test
  public void stringLiteralsAreQuoted() {
    assertThat(Ast.stringLit("a\"b\n").toString()).isEqualTo("\"a\\\"b\\n\"");
  }

  @Test
  public void rewriterReplacesIdentifiers() {
    File file =
        SourceParser.parseFile("package p\n\nfunc f() int {\n\treturn x + g(x, y.x)\n}\n");
    Rewriter.rewriteExprs(
        file,
        e ->
            (e instanceof Ident && ((Ident) e).name.equals("x"))
                ? Ast.selector(Ast.ident("pkg0"), "x")
                : e);
    // Selected names are not rewritten.
    assertThat(Printer.print(file)).contains("return pkg0.x + g(pkg0.x, y.x)");
  }

  @Test
  public void walkerVisitsInSourceOrder() {
    File file = SourceParser.parseFile("package p\n\nvar a = b + c\n\nfunc d() {\n\te(f)\n}\n");
    List<String> names = new ArrayList<>();
    Walker.walk(
        file,
        n -> {
          if (n instanceof Ident) {
            names.add(((Ident) n).name);
          }
          return true;
        });
    assertThat(names).containsExactly("a", "b", "c", "d", "e", "f").inOrder();
  }
}
