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
import net.fortran.java.symbols.Scope;

/**
 * Syntax node for a DO construct: a counted DO, a DO WHILE, a DO CONCURRENT, or a DO with no loop
 * control.
 *
 * <p>A label DO ({@code DO 10 I = 1, N}) is terminated by the statement with that label, which is
 * the last statement of its body; a block DO is terminated by {@code END DO}, whose location is
 * the construct's end location in both cases.
 */
public final class DoConstruct extends Construct {

  @Nullable private final LoopControl control;
  private final ImmutableList<Statement> body;
  private final int terminatingLabel; // 0 for a block DO
  @Nullable private final Scope scope; // set for DO CONCURRENT by name resolution

  /**
   * Constructs a DO construct.
   *
   * @param terminatingLabel the label in {@code DO label ...}, or 0 for a block DO
   * @param scope the construct scope holding the index names and locality-spec variables of a DO
   *     CONCURRENT; null for other DO loops
   */
  public DoConstruct(
      Location start,
      @Nullable Identifier name,
      @Nullable LoopControl control,
      ImmutableList<Statement> body,
      Location endLocation,
      int terminatingLabel,
      @Nullable Scope scope) {
    super(start, Kind.DO, name, endLocation);
    Preconditions.checkArgument(terminatingLabel >= 0, "bad label %s", terminatingLabel);
    Preconditions.checkArgument(
        scope == null || control instanceof LoopControl.Concurrent,
        "only DO CONCURRENT has a construct scope");
    this.control = control;
    this.body = body;
    this.terminatingLabel = terminatingLabel;
    this.scope = scope;
  }

  /** Returns the loop control, or null for {@code DO} with no control. */
  @Nullable
  public LoopControl getLoopControl() {
    return control;
  }

  /** Returns the statements of the loop body. */
  public ImmutableList<Statement> getBody() {
    return body;
  }

  /** Returns the label in {@code DO label ...}, or zero for a block DO. */
  public int getTerminatingLabel() {
    return terminatingLabel;
  }

  public boolean isLabelDo() {
    return terminatingLabel != 0;
  }

  /** Reports whether this is a counted DO ({@code DO i = lower, upper}). */
  public boolean isDoNormal() {
    return control instanceof LoopControl.Bounds;
  }

  public boolean isDoWhile() {
    return control instanceof LoopControl.While;
  }

  public boolean isDoConcurrent() {
    return control instanceof LoopControl.Concurrent;
  }

  /** Returns the bounds of a counted DO. */
  public LoopControl.Bounds getBounds() {
    Preconditions.checkState(isDoNormal(), "not a counted DO");
    return (LoopControl.Bounds) control;
  }

  /** Returns the loop control of a DO CONCURRENT. */
  public LoopControl.Concurrent getConcurrent() {
    Preconditions.checkState(isDoConcurrent(), "not a DO CONCURRENT");
    return (LoopControl.Concurrent) control;
  }

  /**
   * Returns the construct scope of a DO CONCURRENT, which is a child of the scope enclosing the
   * loop. Returns null if this is not a DO CONCURRENT or was not resolved.
   */
  @Nullable
  public Scope getScope() {
    return scope;
  }

  @Override
  public String toString() {
    if (isDoConcurrent()) {
      return "do concurrent ...\n";
    } else if (isDoWhile()) {
      return "do while ...\n";
    } else if (isDoNormal()) {
      return "do " + getBounds().getVariable() + " = ...\n";
    }
    return "do\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
