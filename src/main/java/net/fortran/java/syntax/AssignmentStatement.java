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

/** Syntax node for an intrinsic assignment statement {@code variable = expr}. */
public final class AssignmentStatement extends Statement {

  private final Expression variable; // IDENTIFIER | COMPONENT | ARRAY_ELEMENT
  private final Expression expr;

  public AssignmentStatement(Location start, Expression variable, Expression expr) {
    super(start, Kind.ASSIGNMENT);
    Preconditions.checkArgument(
        variable instanceof Identifier
            || variable instanceof ComponentReference
            || variable instanceof ArrayElement,
        "cannot assign to '%s'",
        variable);
    this.variable = variable;
    this.expr = Preconditions.checkNotNull(expr);
  }

  /** Returns the variable being defined. */
  public Expression getVariable() {
    return variable;
  }

  /** Returns the expression being assigned. */
  public Expression getExpression() {
    return expr;
  }

  @Override
  public String toString() {
    return variable + " = " + expr;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
