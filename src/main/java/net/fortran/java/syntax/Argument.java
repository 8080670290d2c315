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

/** Syntax node for an actual argument {@code value} or {@code keyword=value} of a call. */
public final class Argument extends Node {

  @Nullable private final Identifier keyword;
  private final Expression value;

  public Argument(@Nullable Identifier keyword, Expression value) {
    super(keyword != null ? keyword.getStartLocation() : value.getStartLocation());
    this.keyword = keyword;
    this.value = Preconditions.checkNotNull(value);
  }

  /** Returns the keyword of a keyword argument, or null for a positional one. */
  @Nullable
  public Identifier getKeyword() {
    return keyword;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public String toString() {
    return keyword != null ? keyword + "=" + value : value.toString();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
