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

/**
 * Syntax node for a function reference {@code f(args)}. The procedure designator is either an
 * {@link Identifier} or a {@link ComponentReference} naming a procedure pointer component.
 */
public final class FunctionReference extends Expression {

  private final Expression procedure;
  private final ImmutableList<Argument> arguments;

  public FunctionReference(Expression procedure, ImmutableList<Argument> arguments) {
    super(procedure.getStartLocation(), Kind.FUNCTION_REFERENCE);
    Preconditions.checkArgument(
        procedure instanceof Identifier || procedure instanceof ComponentReference,
        "bad procedure designator: %s",
        procedure);
    this.procedure = procedure;
    this.arguments = arguments;
  }

  /** Returns the procedure designator. */
  public Expression getProcedure() {
    return procedure;
  }

  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  @Override
  public String toString() {
    return procedure + "(" + Joiner.on(", ").join(arguments) + ")";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
