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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * Syntax node for a {@code KEYWORD=value} specifier of an I/O statement: a control specifier of
 * READ or WRITE, a connect specifier of OPEN, or an inquire specifier.
 *
 * <p>Branch specifiers (ERR=, END=, EOR=) carry a statement label instead of an expression.
 */
public final class IoSpecifier extends Node {

  /** The specifier keywords. */
  public enum SpecifierKind {
    ADVANCE,
    END,
    EOR,
    ERR,
    EXIST,
    FILE,
    FMT,
    IOMSG,
    IOSTAT,
    NEWUNIT,
    NEXTREC,
    NUMBER,
    POS,
    REC,
    RECL,
    SIZE,
    STATUS,
    UNIT;

    /** Reports whether the specifier's value is a statement label. */
    public boolean isBranch() {
      return this == ERR || this == END || this == EOR;
    }

    @Override
    public String toString() {
      return Ascii.toUpperCase(name());
    }
  }

  private final SpecifierKind specifierKind;
  @Nullable private final Expression value;
  private final int label;

  private IoSpecifier(
      Location start, SpecifierKind specifierKind, @Nullable Expression value, int label) {
    super(start);
    this.specifierKind = specifierKind;
    this.value = value;
    this.label = label;
  }

  /** Returns a specifier whose value is an expression or variable. */
  public static IoSpecifier of(Location start, SpecifierKind kind, Expression value) {
    Preconditions.checkArgument(!kind.isBranch(), "%s= takes a label", kind);
    return new IoSpecifier(start, kind, Preconditions.checkNotNull(value), 0);
  }

  /** Returns a branch specifier (ERR=, END= or EOR=). */
  public static IoSpecifier branch(Location start, SpecifierKind kind, int label) {
    Preconditions.checkArgument(kind.isBranch(), "%s= does not take a label", kind);
    Preconditions.checkArgument(label > 0, "bad label %s", label);
    return new IoSpecifier(start, kind, null, label);
  }

  public SpecifierKind getSpecifierKind() {
    return specifierKind;
  }

  /** Returns the value, or null for a branch specifier. */
  @Nullable
  public Expression getValue() {
    return value;
  }

  /** Returns the branch target label, or zero if this is not a branch specifier. */
  public int getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return specifierKind + "=" + (value != null ? value.toString() : Integer.toString(label));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
