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

/**
 * Syntax node for a structure component reference {@code base%component}. The component
 * identifier resolves to the component's symbol in the derived type; when it names a procedure
 * pointer component, the reference is a procedure designator.
 */
public final class ComponentReference extends Expression {

  private final Expression base;
  private final Identifier component;

  public ComponentReference(Expression base, Identifier component) {
    super(base.getStartLocation(), Kind.COMPONENT);
    this.base = base;
    this.component = Preconditions.checkNotNull(component);
  }

  public Expression getBase() {
    return base;
  }

  public Identifier getComponent() {
    return component;
  }

  @Override
  public String toString() {
    return base + "%" + component;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
