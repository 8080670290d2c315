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

import com.google.common.base.Preconditions;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.syntax.Location;

/**
 * Tracks the DO variables whose loops are being executed at the current position of the
 * traversal, and the terminating labels of the label DO loops that are open.
 *
 * <p>A DO variable is active from the DO statement to the end of its loop. Variables are keyed by
 * their ultimate symbol, so a name made accessible by use or host association is the same
 * variable as the entity it names.
 *
 * <p>Label DO loops are tracked by the depth of block DO loops at which they appear: a label is
 * the terminating label of an open label DO only if no block DO has been entered since that loop
 * began.
 */
public final class ActiveVariableTracker {

  // ultimate symbol -> location of the name in the DO statement that activated it
  private final Map<Symbol, Location> active = new LinkedHashMap<>();
  // terminating label -> block DO depth of the label DO statement
  private final Map<Integer, Integer> doLabels = new HashMap<>();
  private int nonlabelDoDepth;

  /**
   * Marks a variable active, and returns true. Returns false, and leaves the tracker unchanged, if
   * the variable is already active.
   */
  public boolean activate(Symbol variable, Location location) {
    Symbol ultimate = variable.getUltimate();
    if (active.containsKey(ultimate)) {
      return false;
    }
    active.put(ultimate, location);
    return true;
  }

  /**
   * Marks a variable inactive, provided it was activated at the given location. A DO statement
   * that failed to activate its variable, because an enclosing loop had activated it, does not
   * deactivate it.
   */
  public void deactivate(Symbol variable, Location location) {
    Symbol ultimate = variable.getUltimate();
    if (location.equals(active.get(ultimate))) {
      active.remove(ultimate);
    }
  }

  public boolean isActive(Symbol variable) {
    return active.containsKey(variable.getUltimate());
  }

  /** Returns the location at which an active variable was activated, or null if it is inactive. */
  @Nullable
  public Location getActivationLocation(Symbol variable) {
    return active.get(variable.getUltimate());
  }

  /** Returns the number of active variables. */
  public int activeCount() {
    return active.size();
  }

  /** Records the terminating label of a label DO statement. */
  public void newDoLabel(int label) {
    Preconditions.checkArgument(label > 0, "bad label %s", label);
    doLabels.put(label, nonlabelDoDepth);
  }

  /**
   * Reports whether the label is the terminating label of a label DO that is open and visible at
   * the current block DO depth.
   */
  public boolean isDoLabel(int label) {
    Integer depth = doLabels.get(label);
    return depth != null && depth >= nonlabelDoDepth;
  }

  public void enterNonlabelDoConstruct() {
    nonlabelDoDepth++;
  }

  public void leaveDoConstruct() {
    if (nonlabelDoDepth > 0) {
      nonlabelDoDepth--;
    }
  }

  /** Reports whether no variable is active and no block DO is open. */
  public boolean isEmpty() {
    return active.isEmpty() && nonlabelDoDepth == 0;
  }
}
