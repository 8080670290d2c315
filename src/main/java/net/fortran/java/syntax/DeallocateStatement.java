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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax node for {@code DEALLOCATE(objects, STAT=stat)}. Unlike the deallocation implied by
 * assignment or block exit, this statement deallocates pointers as well as allocatables.
 */
public final class DeallocateStatement extends Statement {

  private final ImmutableList<Expression> objects;
  @Nullable private final Expression stat;

  public DeallocateStatement(
      Location start, ImmutableList<Expression> objects, @Nullable Expression stat) {
    super(start, Kind.DEALLOCATE);
    Preconditions.checkArgument(!objects.isEmpty(), "DEALLOCATE without objects");
    this.objects = objects;
    this.stat = stat;
  }

  public ImmutableList<Expression> getObjects() {
    return objects;
  }

  /** Returns the STAT= variable, or null. */
  @Nullable
  public Expression getStat() {
    return stat;
  }

  @Override
  public String toString() {
    return "deallocate("
        + Joiner.on(", ").join(objects)
        + (stat != null ? ", stat=" + stat : "")
        + ")";
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
