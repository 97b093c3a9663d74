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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.lgo.ast.Ast.StatementBlock;
import org.lgo.ast.CompileError;
import org.lgo.ast.ErrorList;
import org.lgo.converter.BlockRestructurer.Restructured;
import org.lgo.parser.SourceParser;
import org.lgo.types.Checker;
import org.lgo.types.Importer;
import org.lgo.types.Info;
import org.lgo.types.PkgName;
import org.lgo.types.Scope;
import org.lgo.types.SourceImporter;
import org.lgo.types.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a block of top-level statements into a complete translation unit.
 *
 * <p>Conversion proceeds in stages:
 *
 * <ol>
 *   <li>the block is restructured into a file whose statements are the body of an init function
 *       ({@link BlockRestructurer});
 *   <li>the file is checked, with function bodies other than the init function's ignored;
 *   <li>variables are hoisted to package level, references to earlier blocks are qualified, and a
 *       trailing expression is printed ({@link StateHoister});
 *   <li>the file is checked in full, renamed, and printed ({@link FinalChecker}).
 * </ol>
 *
 * <p>Each block is checked into its own package. The package-level symbols of earlier blocks
 * (the "olds") are visible to a block through its package's value scope.
 */
public final class Converter {

  private static final Logger logger = LoggerFactory.getLogger(Converter.class);

  /** Options for a conversion. */
  public static final class Config {
    private ImmutableList<Symbol> olds = ImmutableList.of();
    private ImmutableList<PkgName> oldImports = ImmutableList.of();
    private String defPrefix = "";
    private String refPrefix = "";
    private String lgoPkgPath = "lgo/exec";
    private boolean autoExitCode;
    private boolean registerVars;
    private Importer importer = SourceImporter.standard();

    /**
     * The package-level symbols of earlier blocks; if two have the same name, the later one is
     * visible.
     */
    @CanIgnoreReturnValue
    public Config olds(List<? extends Symbol> olds) {
      this.olds = ImmutableList.copyOf(olds);
      return this;
    }

    /** The imports of earlier blocks, which remain usable without being imported again. */
    @CanIgnoreReturnValue
    public Config oldImports(List<PkgName> oldImports) {
      this.oldImports = ImmutableList.copyOf(oldImports);
      return this;
    }

    /** Prepended to the name of each unexported symbol the block defines. */
    @CanIgnoreReturnValue
    public Config defPrefix(String defPrefix) {
      this.defPrefix = defPrefix;
      return this;
    }

    /** Prepended to each reference to an unexported symbol defined by a block. */
    @CanIgnoreReturnValue
    public Config refPrefix(String refPrefix) {
      this.refPrefix = refPrefix;
      return this;
    }

    /** The path of the package the block is converted into; must differ between blocks. */
    @CanIgnoreReturnValue
    public Config lgoPkgPath(String lgoPkgPath) {
      this.lgoPkgPath = lgoPkgPath;
      return this;
    }

    /** If true, function and loop bodies start by checking whether execution was cancelled. */
    @CanIgnoreReturnValue
    public Config autoExitCode(boolean autoExitCode) {
      this.autoExitCode = autoExitCode;
      return this;
    }

    /** If true, the init function registers each hoisted variable with the runtime. */
    @CanIgnoreReturnValue
    public Config registerVars(boolean registerVars) {
      this.registerVars = registerVars;
      return this;
    }

    @CanIgnoreReturnValue
    public Config importer(Importer importer) {
      this.importer = importer;
      return this;
    }

    ImmutableList<Symbol> olds() {
      return olds;
    }

    ImmutableList<PkgName> oldImports() {
      return oldImports;
    }

    String defPrefix() {
      return defPrefix;
    }

    String refPrefix() {
      return refPrefix;
    }

    String lgoPkgPath() {
      return lgoPkgPath;
    }

    boolean autoExitCode() {
      return autoExitCode;
    }

    boolean registerVars() {
      return registerVars;
    }

    Importer importer() {
      return importer;
    }
  }

  // Static methods only
  private Converter() {}

  public static ConvertResult convert(String src, Config conf) {
    StatementBlock blk;
    try {
      blk = SourceParser.parseBlock(src);
    } catch (CompileError e) {
      return ConvertResult.failure(e);
    }
    Restructured block = BlockRestructurer.restructure(blk);

    Session session = Session.create(conf);
    Info info = new Info();
    List<CompileError> errors = new ArrayList<>();
    Checker checker = new Checker(firstPassConfig(conf, errors), session.pkg, info);
    checker.checkFile(block.file);
    if (!errors.isEmpty()) {
      logger.debug("First pass over {} found {} errors", conf.lgoPkgPath(), errors.size());
      return ConvertResult.failure(ErrorList.of(errors));
    }
    hoist(block, checker, info, session, conf);

    FinalChecker.Output out;
    try {
      out = FinalChecker.checkAndRename(block.file, conf);
    } catch (CompileError e) {
      return ConvertResult.failure(e);
    }
    return ConvertResult.success(out.src, out.pkg, out.info, imports(checker.fileScope()));
  }

  /**
   * The first pass checks only the init function's body; function declarations are checked once
   * their references to hoisted variables can be resolved.
   */
  static Checker.Config firstPassConfig(Config conf, List<CompileError> errors) {
    return new Checker.Config(Session.importerWithOlds(conf.importer(), conf.olds()), errors::add)
        .ignoreFuncBodies(true)
        .alwaysCheck(CoreHooks.INIT_FUNC_NAME);
  }

  /** Runs the State Hoister over a block that has been through the first pass. */
  static void hoist(
      Restructured block, Checker checker, Info info, Session session, Config conf) {
    ImmutableSet<String> varNames =
        ImmutableSet.copyOf(BlockRestructurer.uniqueSortedNames(block.vars));
    ImportManager immg =
        new ImportManager(session.pkg, checker.fileScope(), block.file, varNames);
    StateHoister.hoist(block, info, immg, conf, conf.olds(), session.runctx);
  }

  private static ImmutableList<PkgName> imports(Scope fileScope) {
    ImmutableList.Builder<PkgName> result = ImmutableList.builder();
    for (String name : fileScope.names()) {
      Symbol sym = fileScope.lookup(name);
      if (sym instanceof PkgName) {
        result.add((PkgName) sym);
      }
    }
    return result.build();
  }
}
