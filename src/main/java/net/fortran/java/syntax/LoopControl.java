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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * The loop control of a DO statement: counted bounds ({@code i = lower, upper [, step]}), a WHILE
 * condition, or a CONCURRENT header with its locality specs. A DO statement with no loop control
 * loops forever.
 */
public abstract sealed class LoopControl {

  private LoopControl() {}

  /** Loop control {@code var = lower, upper [, step]} of a counted DO. */
  public static final class Bounds extends LoopControl {
    private final Identifier variable;
    private final Expression lower;
    private final Expression upper;
    @Nullable private final Expression step;

    public Bounds(
        Identifier variable, Expression lower, Expression upper, @Nullable Expression step) {
      this.variable = Preconditions.checkNotNull(variable);
      this.lower = Preconditions.checkNotNull(lower);
      this.upper = Preconditions.checkNotNull(upper);
      this.step = step;
    }

    /** Returns the DO variable. */
    public Identifier getVariable() {
      return variable;
    }

    public Expression getLower() {
      return lower;
    }

    public Expression getUpper() {
      return upper;
    }

    /** Returns the step expression, or null if it is omitted. */
    @Nullable
    public Expression getStep() {
      return step;
    }
  }

  /** Loop control {@code WHILE (condition)}. */
  public static final class While extends LoopControl {
    private final Expression condition;

    public While(Expression condition) {
      this.condition = Preconditions.checkNotNull(condition);
    }

    public Expression getCondition() {
      return condition;
    }
  }

  /** Loop control {@code CONCURRENT header [locality-spec]...}. */
  public static final class Concurrent extends LoopControl {
    private final ConcurrentHeader header;
    private final ImmutableList<LocalitySpec> localitySpecs;

    public Concurrent(ConcurrentHeader header, ImmutableList<LocalitySpec> localitySpecs) {
      this.header = Preconditions.checkNotNull(header);
      this.localitySpecs = localitySpecs;
    }

    public ConcurrentHeader getHeader() {
      return header;
    }

    /** Returns the locality specs, in source order. */
    public ImmutableList<LocalitySpec> getLocalitySpecs() {
      return localitySpecs;
    }
  }
}
