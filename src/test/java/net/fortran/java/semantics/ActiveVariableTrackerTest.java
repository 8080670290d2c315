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

import com.google.common.collect.ImmutableSet;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.syntax.Location;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of ActiveVariableTracker. */
@RunWith(JUnit4.class)
public class ActiveVariableTrackerTest {

  private final TreeFixture tree = new TreeFixture();
  private final ActiveVariableTracker tracker = new ActiveVariableTracker();

  @Test
  public void testActivateAndDeactivate() {
    Symbol i = tree.integer("i");
    Location loc = tree.loc();
    assertThat(tracker.isEmpty()).isTrue();
    assertThat(tracker.activate(i, loc)).isTrue();
    assertThat(tracker.isActive(i)).isTrue();
    assertThat(tracker.getActivationLocation(i)).isEqualTo(loc);
    assertThat(tracker.activeCount()).isEqualTo(1);

    tracker.deactivate(i, loc);
    assertThat(tracker.isActive(i)).isFalse();
    assertThat(tracker.getActivationLocation(i)).isNull();
    assertThat(tracker.isEmpty()).isTrue();
  }

  @Test
  public void testSecondActivationFails() {
    Symbol i = tree.integer("i");
    Location outer = tree.loc();
    Location inner = tree.loc();
    tracker.activate(i, outer);
    assertThat(tracker.activate(i, inner)).isFalse();

    // The inner loop did not activate i, so its end leaves i active.
    tracker.deactivate(i, inner);
    assertThat(tracker.getActivationLocation(i)).isEqualTo(outer);
    tracker.deactivate(i, outer);
    assertThat(tracker.isActive(i)).isFalse();
  }

  @Test
  public void testVariablesAreKeyedByUltimateSymbol() {
    Symbol i = tree.integer("i");
    Symbol alias =
        tree.global.declare(
            "alias",
            tree.loc(),
            ImmutableSet.of(),
            new Symbol.UseAssociation(i));
    tracker.activate(alias, tree.loc());
    assertThat(tracker.isActive(i)).isTrue();
    assertThat(tracker.activate(i, tree.loc())).isFalse();
  }

  @Test
  public void testDoLabels() {
    assertThat(tracker.isDoLabel(10)).isFalse();
    tracker.newDoLabel(10);
    assertThat(tracker.isDoLabel(10)).isTrue();

    tracker.enterNonlabelDoConstruct();
    assertThat(tracker.isDoLabel(10)).isFalse();
    assertThat(tracker.isEmpty()).isFalse();
    tracker.newDoLabel(20);
    assertThat(tracker.isDoLabel(20)).isTrue();

    tracker.leaveDoConstruct();
    assertThat(tracker.isDoLabel(10)).isTrue();
    assertThat(tracker.isEmpty()).isTrue();
  }

  @Test
  public void testLeaveAtTopLevelIsIgnored() {
    tracker.leaveDoConstruct();
    tracker.enterNonlabelDoConstruct();
    tracker.leaveDoConstruct();
    assertThat(tracker.isEmpty()).isTrue();
  }
}
