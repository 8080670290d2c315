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
 * Syntax node for a BLOCK construct. Its specification part declares entities in a scope of its
 * own, which are deallocated (if allocatable and not SAVE) when the block exits.
 */
public final class BlockConstruct extends Construct {

  private final Scope scope;
  private final ImmutableList<Statement> body;

  public BlockConstruct(
      Location start,
      @Nullable Identifier name,
      Scope scope,
      ImmutableList<Statement> body,
      Location endLocation) {
    super(start, Kind.BLOCK, name, endLocation);
    this.scope = Preconditions.checkNotNull(scope);
    this.body = body;
  }

  /** Returns the scope of the entities declared in the block. */
  public Scope getScope() {
    return scope;
  }

  /** Returns the executable statements of the block. */
  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "block\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
