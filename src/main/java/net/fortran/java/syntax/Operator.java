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

/** The intrinsic operators of unary and binary operator expressions. */
public enum Operator {
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  SLASH("/"),
  POWER("**"),
  CONCAT("//"),
  EQ("=="),
  NE("/="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  NOT(".not."),
  AND(".and."),
  OR(".or."),
  EQV(".eqv."),
  NEQV(".neqv.");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  /** Reports whether the operator yields a numeric result from numeric operands. */
  public boolean isArithmetic() {
    return this == PLUS || this == MINUS || this == STAR || this == SLASH || this == POWER;
  }

  /** Reports whether the operator compares its operands, yielding a logical result. */
  public boolean isRelational() {
    return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
  }

  /** Reports whether the operator combines logical operands. */
  public boolean isLogical() {
    return this == NOT || this == AND || this == OR || this == EQV || this == NEQV;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
