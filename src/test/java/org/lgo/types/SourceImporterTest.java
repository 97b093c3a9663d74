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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SourceImporterTest {

  @Test
  public void standardPackages() throws ImportException {
    Package strings = SourceImporter.standard().importPackage("strings");
    assertThat(strings.name()).isEqualTo("strings");
    assertThat(strings.path()).isEqualTo("strings");
    assertThat(strings.scope().lookup("ToUpper").toString())
        .isEqualTo("func ToUpper(s string) string");
    assertThat(SourceImporter.standard().importPackage("strings")).isSameInstanceAs(strings);

    Package core = SourceImporter.standard().importPackage("lgo/core");
    assertThat(core.name()).isEqualTo("core");
    assertThat(core.scope().lookup("LgoPrintln")).isInstanceOf(Func.class);
  }

  @Test
  public void namedTypesAreShared() throws ImportException {
    SourceImporter importer = SourceImporter.standard();
    Package context = importer.importPackage("context");
    Package time = importer.importPackage("time");
    Func withTimeout = (Func) context.scope().lookup("WithTimeout");
    Type timeout = withTimeout.signature().params.vars.get(1).type();
    assertThat(timeout).isSameInstanceAs(time.scope().lookup("Duration").type());
  }

  @Test
  public void missingPackage() {
    ImportException e =
        assertThrows(
            ImportException.class, () -> SourceImporter.standard().importPackage("no/such"));
    assertThat(e).hasMessageThat().isEqualTo("cannot find package \"no/such\"");
  }

  @Test
  public void packageWithErrors() {
    SourceImporter importer =
        SourceImporter.withSources(ImmutableMap.of("bad", "package bad\n\nvar x = undefinedName\n"));
    ImportException e = assertThrows(ImportException.class, () -> importer.importPackage("bad"));
    assertThat(e).hasMessageThat().startsWith("undefined: undefinedName");
  }

  @Test
  public void packageThatDoesNotParse() {
    SourceImporter importer =
        SourceImporter.withSources(ImmutableMap.of("bad", "package bad\n\nvar = 3\n"));
    assertThrows(ImportException.class, () -> importer.importPackage("bad"));
  }

  @Test
  public void importCycle() {
    SourceImporter importer =
        SourceImporter.withSources(
            ImmutableMap.of(
                "a", "package a\n\nimport \"b\"\n\nvar A = b.B\n",
                "b", "package b\n\nimport \"a\"\n\nvar B = a.A\n"));
    ImportException e = assertThrows(ImportException.class, () -> importer.importPackage("a"));
    assertThat(e).hasMessageThat().contains("import cycle not allowed");
  }

  @Test
  public void sourcesOverrideStandardPackages() throws ImportException {
    SourceImporter importer =
        SourceImporter.withSources(
            ImmutableMap.of("strings", "package strings\n\nfunc Shout(s string) string\n"));
    Package strings = importer.importPackage("strings");
    assertThat(strings.scope().names()).containsExactly("Shout");
    // Other paths still come from the standard stubs.
    assertThat(importer.importPackage("fmt").scope().lookup("Sprintf")).isNotNull();
  }
}
