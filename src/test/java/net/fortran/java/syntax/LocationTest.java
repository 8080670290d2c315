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
package net.fortran.java.syntax;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of Location. */
@RunWith(JUnit4.class)
public class LocationTest {

  @Test
  public void testToString() {
    assertThat(Location.fromFileLineColumn("a.f90", 3, 7).toString()).isEqualTo("a.f90:3:7");
    assertThat(Location.fromFileLineColumn("a.f90", 3, 0).toString()).isEqualTo("a.f90:3");
    assertThat(Location.fromFile("a.f90").toString()).isEqualTo("a.f90");
    assertThat(Location.BUILTIN.toString()).isEqualTo("<builtin>");
  }

  @Test
  public void testOrdering() {
    Location a = Location.fromFileLineColumn("a.f90", 3, 7);
    Location b = Location.fromFileLineColumn("a.f90", 4, 1);
    Location c = Location.fromFileLineColumn("b.f90", 1, 1);
    assertThat(a).isLessThan(b);
    assertThat(b).isLessThan(c);
    assertThat(a).isEquivalentAccordingToCompareTo(Location.fromFileLineColumn("a.f90", 3, 7));
  }

  @Test
  public void testEquality() {
    assertThat(Location.fromFileLineColumn("a.f90", 3, 7))
        .isEqualTo(Location.fromFileLineColumn("a.f90", 3, 7));
    assertThat(Location.fromFileLineColumn("a.f90", 3, 7))
        .isNotEqualTo(Location.fromFileLineColumn("a.f90", 3, 8));
  }
}
