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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.lgo.converter.ConvertResult;
import org.lgo.converter.Converter;
import org.lgo.types.Package;
import org.lgo.types.PkgName;
import org.lgo.types.Symbol;

/**
 * A command-line tool that converts a sequence of blocks as one session, printing the translation
 * unit produced for each. Blocks are separated by lines containing only {@code ---}.
 *
 * <p>Options are read from system properties: {@code defPrefix}, {@code refPrefix}, {@code
 * autoExit} and {@code registerVars}.
 */
public class Convert {
  private final String defPrefix;
  private final String refPrefix;
  private final boolean autoExit;
  private final boolean registerVars;

  /** The package-level symbols of every block converted so far, oldest first. */
  private final List<Symbol> olds = new ArrayList<>();

  private final List<PkgName> oldImports = new ArrayList<>();
  private int blockCount;

  Convert(String defPrefix, String refPrefix, boolean autoExit, boolean registerVars) {
    this.defPrefix = defPrefix;
    this.refPrefix = refPrefix;
    this.autoExit = autoExit;
    this.registerVars = registerVars;
  }

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: convert <fileName>");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    checkUsage(args.length == 1);
    Convert session =
        new Convert(
            System.getProperty("defPrefix", "LgoExport_"),
            System.getProperty("refPrefix", "LgoExport_"),
            Boolean.parseBoolean(System.getProperty("autoExit", "false")),
            Boolean.parseBoolean(System.getProperty("registerVars", "false")));
    String input = Files.readString(Path.of(args[0]), UTF_8);
    for (String block : splitBlocks(input)) {
      System.out.print(session.convert(block));
    }
  }

  static List<String> splitBlocks(String input) {
    List<String> blocks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : Splitter.on('\n').split(input)) {
      if (line.strip().equals("---")) {
        blocks.add(current.toString());
        current.setLength(0);
      } else {
        current.append(line).append('\n');
      }
    }
    if (!current.toString().isBlank()) {
      blocks.add(current.toString());
    }
    return blocks;
  }

  /**
   * Converts the next block of the session and returns a report of the result. A block that
   * fails to convert leaves the session unchanged.
   */
  String convert(String block) {
    int n = ++blockCount;
    Converter.Config conf =
        new Converter.Config()
            .olds(olds)
            .oldImports(oldImports)
            .defPrefix(defPrefix)
            .refPrefix(refPrefix)
            .lgoPkgPath("lgo/exec/pkg" + n)
            .autoExitCode(autoExit)
            .registerVars(registerVars);
    ConvertResult result = Converter.convert(block, conf);
    if (!result.ok()) {
      return String.format("/* BLOCK %d ERROR\n  %s\n*/\n", n, result.error().getMessage());
    }
    Package pkg = result.pkg();
    for (String name : pkg.scope().names()) {
      olds.add(pkg.scope().lookup(name));
    }
    for (PkgName imported : result.imports()) {
      oldImports.removeIf(old -> old.name().equals(imported.name()));
      oldImports.add(imported);
    }
    return String.format("/* BLOCK %d */\n%s", n, result.source());
  }
}
