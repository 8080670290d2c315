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

/** Base class for all statements and executable constructs. */
public abstract class Statement extends Node {

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    ALLOCATE,
    ASSIGNMENT,
    BLOCK,
    CALL,
    CHANGE_TEAM,
    CONTINUE,
    CRITICAL,
    DEALLOCATE,
    DO,
    FLOW,
    GOTO,
    IF,
    IMAGE_CONTROL,
    IO,
    RETURN,
  }

  private final Kind kind;
  private int label; // 0 if unlabeled

  Statement(Location start, Kind kind) {
    super(start);
    this.kind = kind;
  }

  // Final to avoid cost of virtual call.
  public final Kind kind() {
    return kind;
  }

  /** Returns the statement label, or zero if the statement has none. */
  public int getLabel() {
    return label;
  }

  public boolean hasLabel() {
    return label != 0;
  }

  /** Sets the statement label. Called by the parser, at most once. */
  public void setLabel(int label) {
    Preconditions.checkArgument(label > 0 && label <= 99999, "bad statement label %s", label);
    Preconditions.checkState(this.label == 0, "statement already labeled");
    this.label = label;
  }
}
