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
import javax.annotation.Nullable;

/** A class for flow statements ({@code CYCLE} and {@code EXIT}) with an optional construct name. */
public final class FlowStatement extends Statement {

  /** The two kinds of flow statement. */
  public enum FlowKind {
    CYCLE,
    EXIT;
  }

  private final FlowKind flowKind;
  @Nullable private final Identifier constructName;

  /**
   * Constructs a new flow control statement.
   *
   * @param flowKind The specific kind of flow control statement (cycle or exit)
   * @param constructName The construct name following the keyword, if any
   */
  public FlowStatement(Location start, FlowKind flowKind, @Nullable Identifier constructName) {
    super(start, Kind.FLOW);
    this.flowKind = Preconditions.checkNotNull(flowKind);
    this.constructName = constructName;
  }

  public FlowKind getFlowKind() {
    return flowKind;
  }

  /** Returns the construct name, or null for an unnamed CYCLE or EXIT. */
  @Nullable
  public Identifier getConstructName() {
    return constructName;
  }

  @Override
  public String toString() {
    return constructName == null ? flowKind.toString() : flowKind + " " + constructName;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
