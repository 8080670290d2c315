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
import net.fortran.java.symbols.Scope;

/**
 * Syntax node for a program unit with an execution part: a main program, or an external or module
 * subprogram. It is the unit of semantic checking: state such as open constructs and active DO
 * variables never outlives a program unit.
 */
public final class ProgramUnit extends Node {

  private final String name;
  private final Scope scope;
  private final ImmutableList<Statement> body;
  private final Location endLocation;

  public ProgramUnit(
      Location start,
      String name,
      Scope scope,
      ImmutableList<Statement> body,
      Location endLocation) {
    super(start);
    this.name = Preconditions.checkNotNull(name);
    this.scope = Preconditions.checkNotNull(scope);
    this.body = body;
    this.endLocation = Preconditions.checkNotNull(endLocation);
  }

  public String getName() {
    return name;
  }

  /** Returns the scope of the program unit's local entities. */
  public Scope getScope() {
    return scope;
  }

  /** Returns the statements of the execution part. */
  public ImmutableList<Statement> getBody() {
    return body;
  }

  public Location getEndLocation() {
    return endLocation;
  }

  @Override
  public String toString() {
    return scope.getKind() + " " + name;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
