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
 * Syntax node for an I/O implied-DO list item {@code (items, var = lower, upper [, step])}. The
 * items are expressions or further implied-DOs.
 */
public final class IoImpliedDo extends Node {

  private final ImmutableList<Node> items;
  private final Identifier variable;
  private final Expression lower;
  private final Expression upper;
  @Nullable private final Expression step;

  public IoImpliedDo(
      Location start,
      ImmutableList<Node> items,
      Identifier variable,
      Expression lower,
      Expression upper,
      @Nullable Expression step) {
    super(start);
    for (Node item : items) {
      Preconditions.checkArgument(
          item instanceof Expression || item instanceof IoImpliedDo, "bad I/O item: %s", item);
    }
    this.items = items;
    this.variable = Preconditions.checkNotNull(variable);
    this.lower = Preconditions.checkNotNull(lower);
    this.upper = Preconditions.checkNotNull(upper);
    this.step = step;
  }

  public ImmutableList<Node> getItems() {
    return items;
  }

  /** Returns the implied-DO variable, which the I/O statement defines. */
  public Identifier getVariable() {
    return variable;
  }

  public Expression getLower() {
    return lower;
  }

  public Expression getUpper() {
    return upper;
  }

  @Nullable
  public Expression getStep() {
    return step;
  }

  @Override
  public String toString() {
    return "("
        + Joiner.on(", ").join(items)
        + ", "
        + variable
        + " = "
        + lower
        + ", "
        + upper
        + (step != null ? ", " + step : "")
        + ")";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
