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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast.Ident;
import org.lgo.ast.Ast.StatementBlock;
import org.lgo.ast.Ast.Stmt;
import org.lgo.ast.CompileError;
import org.lgo.ast.Walker;
import org.lgo.converter.BlockRestructurer.Restructured;
import org.lgo.parser.SourceParser;
import org.lgo.types.Checker;
import org.lgo.types.Const;
import org.lgo.types.Func;
import org.lgo.types.Info;
import org.lgo.types.Package;
import org.lgo.types.PkgName;
import org.lgo.types.Symbol;
import org.lgo.types.Type;
import org.lgo.types.TypeName;
import org.lgo.types.TypeString;
import org.lgo.types.Types.Interface;
import org.lgo.types.Types.Named;
import org.lgo.types.Types.Pointer;
import org.lgo.types.Types.Signature;
import org.lgo.types.Var;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds what the identifier under a cursor refers to, for interactive help.
 *
 * <p>Symbols defined in this session are described directly; anything else is identified by a
 * query naming it within its package (e.g. {@code strings.Builder.WriteString}), for an external
 * documentation tool to look up.
 */
public final class DocResolver {

  private static final Logger logger = LoggerFactory.getLogger(DocResolver.class);

  /** A description of a symbol, or a query to look one up. Either or both may be empty. */
  public static final class Inspection {
    public static final Inspection EMPTY = new Inspection("", "");

    public final String doc;
    public final String query;

    Inspection(String doc, String query) {
      this.doc = doc;
      this.query = query;
    }

    static Inspection doc(String doc) {
      return new Inspection(doc, "");
    }

    static Inspection query(String query) {
      return new Inspection("", query);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      } else if (!(obj instanceof Inspection)) {
        return false;
      }
      Inspection other = (Inspection) obj;
      return doc.equals(other.doc) && query.equals(other.query);
    }

    @Override
    public int hashCode() {
      return Objects.hash(doc, query);
    }

    @Override
    public String toString() {
      return String.format("Inspection(doc=%s, query=%s)", doc, query);
    }
  }

  // Static methods only
  private DocResolver() {}

  /**
   * Returns a description of the identifier at {@code offset} (a character offset into {@code
   * src}), or {@link Inspection#EMPTY} if there is none or it cannot be resolved. Errors in the
   * block are ignored.
   */
  public static Inspection inspectIdent(String src, int offset, Converter.Config conf) {
    StatementBlock blk;
    try {
      blk = SourceParser.parseBlock(src);
    } catch (CompileError e) {
      return Inspection.EMPTY;
    }
    Ident target = null;
    for (Stmt stmt : blk.stmts) {
      target = findIdent(stmt, offset);
      if (target != null) {
        break;
      }
    }
    if (target == null) {
      return Inspection.EMPTY;
    }

    Restructured block = BlockRestructurer.restructure(blk);
    Session first = Session.create(conf);
    Info firstInfo = new Info();
    List<CompileError> ignored = new ArrayList<>();
    Checker checker =
        new Checker(Converter.firstPassConfig(conf, ignored), first.pkg, firstInfo);
    checker.checkFile(block.file);
    Converter.hoist(block, checker, firstInfo, first, conf);

    Session full = Session.create(conf);
    Info info = new Info();
    new Checker(
            new Checker.Config(
                Session.importerWithOlds(conf.importer(), conf.olds()), ignored::add),
            full.pkg,
            info)
        .checkFile(block.file);
    logger.debug("Inspecting {} ({} errors ignored)", target.name, ignored.size());
    Symbol sym = info.uses.get(target);
    return (sym == null) ? Inspection.EMPTY : inspect(sym, full.pkg);
  }

  /** Returns the identifier whose range contains {@code offset}, or null. */
  private static @Nullable Ident findIdent(Stmt stmt, int offset) {
    Ident[] found = new Ident[1];
    Walker.walk(
        stmt,
        n -> {
          if (found[0] != null || offset < n.pos || n.end <= offset) {
            return false;
          } else if (n instanceof Ident) {
            found[0] = (Ident) n;
            return false;
          }
          return true;
        });
    return found[0];
  }

  static Inspection inspect(Symbol sym, Package current) {
    if (sym instanceof PkgName) {
      return Inspection.query(((PkgName) sym).imported().path());
    }
    Package pkg = sym.pkg();
    if (pkg == null) {
      // Predeclared
      return Inspection.EMPTY;
    }
    boolean local = (pkg == current) || pkg.isSession();
    String query = pkg.path() + "." + sym.name();
    if (sym instanceof Func) {
      Signature sig = ((Func) sym).signature();
      if (local) {
        return Inspection.doc(TypeString.of(sig, TypeString.relativeTo(pkg)));
      } else if (sig.recv == null) {
        return Inspection.query(query);
      }
      String recvName = receiverName(sig.recv.type(), pkg);
      return (recvName == null)
          ? Inspection.EMPTY
          : Inspection.query(pkg.path() + "." + recvName + "." + sym.name());
    } else if (sym instanceof Var) {
      if (((Var) sym).isField()) {
        return Inspection.EMPTY;
      }
      return local ? Inspection.doc(sym.toString()) : Inspection.query(query);
    } else if (sym instanceof Const || sym instanceof TypeName) {
      return local ? Inspection.doc(sym.toString()) : Inspection.query(query);
    }
    return Inspection.EMPTY;
  }

  /**
   * Returns the name of the type that declares a method with the given receiver type. Interface
   * methods are found by looking for the named type whose underlying type is the interface.
   */
  private static @Nullable String receiverName(Type recv, Package pkg) {
    if (recv instanceof Named) {
      return ((Named) recv).obj.name();
    } else if (recv instanceof Pointer && ((Pointer) recv).elem instanceof Named) {
      return ((Named) ((Pointer) recv).elem).obj.name();
    } else if (recv instanceof Interface) {
      for (String name : pkg.scope().names()) {
        Symbol s = pkg.scope().lookup(name);
        if (s instanceof TypeName
            && s.type() instanceof Named
            && s.type().underlying() == recv) {
          return name;
        }
      }
      return null;
    }
    throw new IllegalStateException("Unsupported receiver type: " + recv);
  }
}
