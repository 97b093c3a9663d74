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


package org.lgo.testing;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Provides the chunks of the testdata files in a directory as test parameters.
 *
 * <p>Each file is split at the comments matching a pattern; each chunk is the source code that
 * precedes a comment, paired with the comment's first capture group. The chunks of a file are
 * meant to be run in order, as one session.
 */
@SuppressWarnings("deprecation") // TestParameterValuesProvider
public class TestdataScanner implements TestParameter.TestParameterValuesProvider {

  /** A chunk of source code and the comment that follows it. */
  public static final class TestProgram {
    private final String name;
    private final String code;
    private final @Nullable String comment;
    private final ImmutableList<TestProgram> earlier;

    TestProgram(
        String name, String code, @Nullable String comment, ImmutableList<TestProgram> earlier) {
      this.name = name;
      this.code = code;
      this.comment = comment;
      this.earlier = earlier;
    }

    /** The file name and the index of the chunk within it, e.g. {@code basics.lgo:3}. */
    public String name() {
      return name;
    }

    public String code() {
      return code;
    }

    /** Null if the chunk is at the end of the file and not followed by a comment. */
    public @Nullable String comment() {
      return comment;
    }

    /** The chunks that precede this one in the same file. */
    public ImmutableList<TestProgram> earlier() {
      return earlier;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final Pattern commentPattern;

  protected TestdataScanner(Path dir, Pattern commentPattern) {
    this.dir = dir;
    this.commentPattern = commentPattern;
  }

  @Override
  public List<TestProgram> provideValues() {
    List<TestProgram> result = new ArrayList<>();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : (Iterable<Path>) files.sorted()::iterator) {
        scanFile(file, result);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result;
  }

  private void scanFile(Path file, List<TestProgram> result) throws IOException {
    String text = Files.readString(file, UTF_8);
    String fileName = file.getFileName().toString();
    List<TestProgram> chunks = new ArrayList<>();
    Matcher matcher = commentPattern.matcher(text);
    int start = 0;
    while (matcher.find()) {
      String code = text.substring(start, matcher.start());
      String name = fileName + ":" + (chunks.size() + 1);
      chunks.add(new TestProgram(name, code, matcher.group(1), ImmutableList.copyOf(chunks)));
      start = matcher.end();
    }
    String rest = text.substring(start);
    if (!rest.isBlank()) {
      String name = fileName + ":" + (chunks.size() + 1);
      chunks.add(new TestProgram(name, rest, null, ImmutableList.copyOf(chunks)));
    }
    result.addAll(chunks);
  }
}
