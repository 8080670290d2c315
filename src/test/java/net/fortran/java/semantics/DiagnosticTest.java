// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.fortran.java.semantics;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import net.fortran.java.syntax.Location;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of Diagnostic and its formatting. */
@RunWith(JUnit4.class)
public class DiagnosticTest {

  private static final Location LOOP = Location.fromFileLineColumn("a.f90", 3, 1);
  private static final Location STMT = Location.fromFileLineColumn("a.f90", 5, 7);

  @Test
  public void testToString() {
    Diagnostic diagnostic =
        Diagnostic.builder(Diagnostic.Severity.ERROR, STMT, "RETURN is not allowed")
            .attach(LOOP, "Enclosing %s statement", "DO CONCURRENT")
            .build();
    assertThat(diagnostic.toString())
        .isEqualTo(
            "a.f90:5:7: error: RETURN is not allowed\n"
                + "  a.f90:3:1: Enclosing DO CONCURRENT statement");
    assertThat(diagnostic.isError()).isTrue();
    assertThat(diagnostic.attachments()).hasSize(1);
  }

  @Test
  public void testWarning() {
    Diagnostic diagnostic =
        Diagnostic.builder(Diagnostic.Severity.WARNING, STMT, "step is zero").build();
    assertThat(diagnostic.toString()).isEqualTo("a.f90:5:7: warning: step is zero");
    assertThat(diagnostic.isError()).isFalse();
  }

  @Test
  public void testCountErrors() {
    Diagnostic error = Diagnostic.builder(Diagnostic.Severity.ERROR, STMT, "e").build();
    Diagnostic warning = Diagnostic.builder(Diagnostic.Severity.WARNING, STMT, "w").build();
    assertThat(Diagnostic.countErrors(ImmutableList.of(error, warning, error))).isEqualTo(2);
    assertThat(Diagnostic.countErrors(ImmutableList.of())).isEqualTo(0);
    assertThat(Diagnostic.toString(ImmutableList.of(error, warning)))
        .isEqualTo("a.f90:5:7: error: e\na.f90:5:7: warning: w\n");
  }

  @Test
  public void testEquality() {
    Diagnostic a =
        Diagnostic.builder(Diagnostic.Severity.ERROR, STMT, "m").attach(LOOP, "note").build();
    Diagnostic b =
        Diagnostic.builder(Diagnostic.Severity.ERROR, STMT, "m").attach(LOOP, "note").build();
    Diagnostic c = Diagnostic.builder(Diagnostic.Severity.ERROR, STMT, "m").build();
    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
    assertThat(a).isNotEqualTo(c);
  }
}
