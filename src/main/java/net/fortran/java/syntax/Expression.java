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

/**
 * Base class for all expression nodes in the AST.
 *
 * <p>Designators (variables and procedure names) are expressions too: an {@link Identifier}, a
 * {@link ComponentReference} {@code x%y}, or an {@link ArrayElement} {@code x(i)}.
 */
public abstract class Expression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    ARRAY_ELEMENT,
    BINARY_OPERATOR,
    COMPONENT,
    FUNCTION_REFERENCE,
    IDENTIFIER,
    INT_LITERAL,
    LOGICAL_LITERAL,
    REAL_LITERAL,
    STRING_LITERAL,
    UNARY_OPERATOR,
  }

  // Materialize kind as a field so its accessor can be non-virtual.
  private final Kind kind;

  Expression(Location start, Kind kind) {
    super(start);
    this.kind = kind;
  }

  // Final to avoid cost of virtual call.
  public final Kind kind() {
    return kind;
  }
}
