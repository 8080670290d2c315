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
import javax.annotation.Nullable;

/**
 * Base class for executable constructs: a construct statement (such as {@code DO} or {@code
 * BLOCK}), a block of statements, and a matching {@code END} statement.
 *
 * <p>The start location of a construct is the location of its construct statement.
 */
public abstract class Construct extends Statement {

  @Nullable private final Identifier name;
  private final Location endLocation;
  private int endLabel; // label of the END statement, or 0

  Construct(Location start, Kind kind, @Nullable Identifier name, Location endLocation) {
    super(start, kind);
    this.name = name;
    this.endLocation = Preconditions.checkNotNull(endLocation);
  }

  /** Returns the construct name {@code name:} preceding the construct statement, or null. */
  @Nullable
  public Identifier getName() {
    return name;
  }

  /** Returns the location of the END statement. */
  public Location getEndLocation() {
    return endLocation;
  }

  /** Returns the label of the END statement, or zero if it has none. */
  public int getEndLabel() {
    return endLabel;
  }

  /** Sets the label of the END statement. Called by the parser, at most once. */
  public void setEndLabel(int label) {
    Preconditions.checkArgument(label > 0 && label <= 99999, "bad statement label %s", label);
    Preconditions.checkState(endLabel == 0, "END statement already labeled");
    this.endLabel = label;
  }
}
