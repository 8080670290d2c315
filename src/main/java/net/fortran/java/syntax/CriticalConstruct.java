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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Syntax node for a CRITICAL construct, whose body is executed by one image at a time. */
public final class CriticalConstruct extends Construct {

  @Nullable private final Expression stat;
  private final ImmutableList<Statement> body;

  public CriticalConstruct(
      Location start,
      @Nullable Identifier name,
      @Nullable Expression stat,
      ImmutableList<Statement> body,
      Location endLocation) {
    super(start, Kind.CRITICAL, name, endLocation);
    this.stat = stat;
    this.body = body;
  }

  /** Returns the STAT= variable of the CRITICAL statement, or null. */
  @Nullable
  public Expression getStat() {
    return stat;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "critical\n";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
