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

/** Syntax node for an IF construct, {@code IF (cond) THEN ... [ELSE ...] END IF}. */
public final class IfConstruct extends Construct {

  private final Expression condition;
  private final ImmutableList<Statement> thenBlock;
  @Nullable private final ImmutableList<Statement> elseBlock;

  public IfConstruct(
      Location start,
      @Nullable Identifier name,
      Expression condition,
      ImmutableList<Statement> thenBlock,
      @Nullable ImmutableList<Statement> elseBlock,
      Location endLocation) {
    super(start, Kind.IF, name, endLocation);
    this.condition = Preconditions.checkNotNull(condition);
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getThenBlock() {
    return thenBlock;
  }

  /** Returns the ELSE block, or null if there is none. */
  @Nullable
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  @Override
  public String toString() {
    return "if (" + condition + ") then\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
