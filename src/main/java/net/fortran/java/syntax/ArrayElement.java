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

/** Syntax node for an array element or section reference {@code base(s1, s2, ...)}. */
public final class ArrayElement extends Expression {

  private final Expression base;
  private final ImmutableList<Expression> subscripts;

  public ArrayElement(Expression base, ImmutableList<Expression> subscripts) {
    super(base.getStartLocation(), Kind.ARRAY_ELEMENT);
    Preconditions.checkArgument(!subscripts.isEmpty(), "array element without subscripts");
    this.base = base;
    this.subscripts = subscripts;
  }

  public Expression getBase() {
    return base;
  }

  public ImmutableList<Expression> getSubscripts() {
    return subscripts;
  }

  @Override
  public String toString() {
    return base + "(" + Joiner.on(", ").join(subscripts) + ")";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
