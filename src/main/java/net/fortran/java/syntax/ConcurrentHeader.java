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

/**
 * The parenthesized header {@code (i = 1:n [:step], j = ... [, mask])} of a DO CONCURRENT
 * statement (or FORALL): a non-empty list of index controls and an optional mask expression.
 */
public final class ConcurrentHeader {

  private final ImmutableList<ConcurrentControl> controls;
  @Nullable private final Expression mask;

  public ConcurrentHeader(ImmutableList<ConcurrentControl> controls, @Nullable Expression mask) {
    Preconditions.checkArgument(!controls.isEmpty(), "concurrent header without controls");
    this.controls = controls;
    this.mask = mask;
  }

  public ImmutableList<ConcurrentControl> getControls() {
    return controls;
  }

  /** Returns the scalar logical mask expression, or null. */
  @Nullable
  public Expression getMask() {
    return mask;
  }

  /** One index control {@code index-name = lower : upper [: step]}. */
  public static final class ConcurrentControl {
    private final Identifier indexName;
    private final Expression lower;
    private final Expression upper;
    @Nullable private final Expression step;

    public ConcurrentControl(
        Identifier indexName, Expression lower, Expression upper, @Nullable Expression step) {
      this.indexName = Preconditions.checkNotNull(indexName);
      this.lower = Preconditions.checkNotNull(lower);
      this.upper = Preconditions.checkNotNull(upper);
      this.step = step;
    }

    public Identifier getIndexName() {
      return indexName;
    }

    public Expression getLower() {
      return lower;
    }

    public Expression getUpper() {
      return upper;
    }

    @Nullable
    public Expression getStep() {
      return step;
    }
  }
}
