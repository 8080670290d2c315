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

/** A UnaryOperatorExpression represents a unary operator expression, 'op x'. */
public final class UnaryOperatorExpression extends Expression {

  private final Operator op; // PLUS | MINUS | NOT
  private final Expression x;

  public UnaryOperatorExpression(Location start, Operator op, Expression x) {
    super(start, Kind.UNARY_OPERATOR);
    Preconditions.checkArgument(
        op == Operator.PLUS || op == Operator.MINUS || op == Operator.NOT,
        "not a unary operator: %s",
        op);
    this.op = op;
    this.x = Preconditions.checkNotNull(x);
  }

  /** Returns the operator. */
  public Operator getOperator() {
    return op;
  }

  /** Returns the operand. */
  public Expression getX() {
    return x;
  }

  @Override
  public String toString() {
    return op == Operator.NOT ? op + " " + x : op.toString() + x;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
