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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import java.io.IOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lgo.ast.Ast;
import org.lgo.ast.CompileError;
import org.lgo.ast.ErrorList;
import org.lgo.parser.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An Importer that type-checks package stubs written in Lesser Go. A stub declares the package's
 * types, constants, variables and functions; functions usually have no bodies.
 *
 * <p>Each package is loaded at most once, so every importer of a path sees the same Package and
 * the same Named types.
 */
public final class SourceImporter implements Importer {

  private static final Logger logger = LoggerFactory.getLogger(SourceImporter.class);

  /** The directory (relative to the classpath root) holding the standard stubs. */
  static final String STDLIB_RESOURCE_DIR = "org/lgo/stdlib/";

  /** Returns the source of the package with the given path, or null if there is none. */
  public interface SourceLookup {
    @Nullable String source(String path) throws IOException;
  }

  private static final SourceImporter STANDARD = new SourceImporter(SourceImporter::stdlibSource);

  private final SourceLookup lookup;
  private final Map<String, Package> cache = new HashMap<>();

  /** Paths whose loading is in progress, to detect import cycles between stubs. */
  private final Set<String> loading = new HashSet<>();

  public SourceImporter(SourceLookup lookup) {
    this.lookup = lookup;
  }

  /**
   * Returns the shared importer for the standard stubs ({@code context}, {@code fmt}, {@code
   * lgo/core}, ...).
   */
  public static SourceImporter standard() {
    return STANDARD;
  }

  /**
   * Returns an importer for the given sources, keyed by path; paths that are not in the map are
   * looked up in the standard stubs.
   */
  public static SourceImporter withSources(Map<String, String> sources) {
    ImmutableMap<String, String> copy = ImmutableMap.copyOf(sources);
    return new SourceImporter(
        path -> {
          String src = copy.get(path);
          return (src != null) ? src : stdlibSource(path);
        });
  }

  private static @Nullable String stdlibSource(String path) throws IOException {
    URL url = SourceImporter.class.getClassLoader().getResource(STDLIB_RESOURCE_DIR + path + ".go");
    return (url == null) ? null : Resources.toString(url, UTF_8);
  }

  @Override
  public synchronized Package importPackage(String path) throws ImportException {
    Package result = cache.get(path);
    if (result != null) {
      return result;
    }
    if (!loading.add(path)) {
      throw new ImportException("import cycle not allowed");
    }
    try {
      result = load(path);
    } finally {
      loading.remove(path);
    }
    cache.put(path, result);
    return result;
  }

  private Package load(String path) throws ImportException {
    String src;
    try {
      src = lookup.source(path);
    } catch (IOException e) {
      throw new ImportException("cannot read package " + path, e);
    }
    if (src == null) {
      throw new ImportException(String.format("cannot find package \"%s\"", path));
    }
    Ast.File file;
    try {
      file = SourceParser.parseFile(src);
    } catch (CompileError e) {
      throw new ImportException(e.getMessage(), e);
    }
    Package pkg = Package.create(path, file.packageName);
    List<CompileError> errors = new ArrayList<>();
    Checker.Config conf = new Checker.Config(this, errors::add).ignoreFuncBodies(true);
    new Checker(conf, pkg, new Info()).checkFile(file);
    if (!errors.isEmpty()) {
      throw new ImportException(ErrorList.of(errors).getMessage());
    }
    logger.debug("Loaded package {} ({} declarations)", path, pkg.scope.size());
    return pkg;
  }
}
