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
 * Syntax node for the simple statements that synchronize images: {@code SYNC ALL}, {@code SYNC
 * IMAGES}, {@code SYNC MEMORY}, {@code SYNC TEAM}, {@code EVENT POST}, {@code EVENT WAIT}, {@code
 * FORM TEAM}, {@code LOCK} and {@code UNLOCK}.
 *
 * <p>The CRITICAL and CHANGE TEAM constructs, and ALLOCATE and DEALLOCATE of coarrays, are image
 * control statements too, but have their own node types.
 */
public final class ImageControlStatement extends Statement {

  /** The simple image control statements. */
  public enum ImageControlKind {
    SYNC_ALL("SYNC ALL"),
    SYNC_IMAGES("SYNC IMAGES"),
    SYNC_MEMORY("SYNC MEMORY"),
    SYNC_TEAM("SYNC TEAM"),
    EVENT_POST("EVENT POST"),
    EVENT_WAIT("EVENT WAIT"),
    FORM_TEAM("FORM TEAM"),
    LOCK("LOCK"),
    UNLOCK("UNLOCK");

    private final String keyword;

    ImageControlKind(String keyword) {
      this.keyword = keyword;
    }

    @Override
    public String toString() {
      return keyword;
    }
  }

  private final ImageControlKind imageControlKind;
  @Nullable private final Expression operand;
  @Nullable private final Expression stat;

  /**
   * Constructs an image control statement.
   *
   * @param operand the image set, team, event or lock variable, if the statement has one
   * @param stat the STAT= variable, if any
   */
  public ImageControlStatement(
      Location start,
      ImageControlKind imageControlKind,
      @Nullable Expression operand,
      @Nullable Expression stat) {
    super(start, Kind.IMAGE_CONTROL);
    this.imageControlKind = Preconditions.checkNotNull(imageControlKind);
    this.operand = operand;
    this.stat = stat;
  }

  public ImageControlKind getImageControlKind() {
    return imageControlKind;
  }

  @Nullable
  public Expression getOperand() {
    return operand;
  }

  @Nullable
  public Expression getStat() {
    return stat;
  }

  @Override
  public String toString() {
    return imageControlKind + (operand != null ? " " + operand : "");
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
