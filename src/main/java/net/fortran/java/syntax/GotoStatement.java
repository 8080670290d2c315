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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax node for a branch statement: {@code GO TO 10}, or the computed form {@code GO TO (10, 20,
 * 30) expr} when a selector is present.
 */
public final class GotoStatement extends Statement {

  private final ImmutableList<Integer> targets;
  @Nullable private final Expression selector;

  public GotoStatement(
      Location start, ImmutableList<Integer> targets, @Nullable Expression selector) {
    super(start, Kind.GOTO);
    Preconditions.checkArgument(!targets.isEmpty(), "branch without target");
    Preconditions.checkArgument(
        selector != null || targets.size() == 1, "unconditional branch with several targets");
    this.targets = targets;
    this.selector = selector;
  }

  /** Returns the labels this statement may branch to. */
  public ImmutableList<Integer> getTargets() {
    return targets;
  }

  /** Returns the selector expression of a computed GO TO, or null. */
  @Nullable
  public Expression getSelector() {
    return selector;
  }

  @Override
  public String toString() {
    return selector == null
        ? "go to " + targets.get(0)
        : "go to (" + Joiner.on(", ").join(targets) + ") " + selector;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
