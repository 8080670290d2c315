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

/**
 * A Node is a node in the syntax tree of a program unit.
 *
 * <p>Nodes are created by the parser and annotated by name resolution; the semantic checks only
 * read them. Nodes have identity: two distinct nodes are never equal.
 */
public abstract class Node {

  private final Location start;

  Node(Location start) {
    this.start = Preconditions.checkNotNull(start);
  }

  /** Returns the location of the first token of this node. */
  public final Location getStartLocation() {
    return start;
  }

  /** Implements double-dispatch for {@link NodeVisitor}. */
  public abstract void accept(NodeVisitor visitor);

  @Override
  public String toString() {
    return getClass().getSimpleName() + " @ " + start;
  }
}
