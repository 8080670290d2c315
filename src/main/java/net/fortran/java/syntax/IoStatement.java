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
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Syntax node for an input/output statement: READ, WRITE, PRINT, OPEN, CLOSE or INQUIRE, with its
 * specifiers and its list of data transfer items.
 */
public final class IoStatement extends Statement {

  /** The I/O statement keywords. */
  public enum IoKind {
    READ,
    WRITE,
    PRINT,
    OPEN,
    CLOSE,
    INQUIRE;

    /** Reports whether the statement transfers data to or from its items. */
    public boolean isDataTransfer() {
      return this == READ || this == WRITE || this == PRINT;
    }

    @Override
    public String toString() {
      return Ascii.toLowerCase(name());
    }
  }

  private final IoKind ioKind;
  private final ImmutableList<IoSpecifier> specifiers;
  private final ImmutableList<Node> items;

  public IoStatement(
      Location start,
      IoKind ioKind,
      ImmutableList<IoSpecifier> specifiers,
      ImmutableList<Node> items) {
    super(start, Kind.IO);
    Preconditions.checkArgument(
        ioKind.isDataTransfer() || items.isEmpty(), "%s statement with data items", ioKind);
    for (Node item : items) {
      Preconditions.checkArgument(
          item instanceof Expression || item instanceof IoImpliedDo, "bad I/O item: %s", item);
    }
    this.ioKind = Preconditions.checkNotNull(ioKind);
    this.specifiers = specifiers;
    this.items = items;
  }

  public IoKind getIoKind() {
    return ioKind;
  }

  public ImmutableList<IoSpecifier> getSpecifiers() {
    return specifiers;
  }

  /** Returns the data transfer items: expressions and {@link IoImpliedDo}s. */
  public ImmutableList<Node> getItems() {
    return items;
  }

  @Override
  public String toString() {
    String s = ioKind + "(" + Joiner.on(", ").join(specifiers) + ")";
    return items.isEmpty() ? s : s + " " + Joiner.on(", ").join(items);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
