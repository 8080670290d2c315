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

package net.fortran.java.semantics;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import net.fortran.java.syntax.Construct;

/**
 * The stack of constructs that enclose the current position of the traversal, outermost first.
 * Its order mirrors the lexical nesting of the constructs; it is empty outside any construct.
 */
public final class ConstructStack {

  private final ArrayList<ConstructNode> nodes = new ArrayList<>();

  /** Pushes a construct when its construct statement is reached. */
  public void push(ConstructNode node) {
    nodes.add(Preconditions.checkNotNull(node));
  }

  /**
   * Pops the innermost construct when its END statement is reached, and returns it.
   *
   * @throws com.google.common.base.VerifyException if the innermost construct is not {@code
   *     construct}, which means the traversal has lost track of the nesting
   */
  public ConstructNode pop(Construct construct) {
    Preconditions.checkState(!nodes.isEmpty(), "pop of empty construct stack");
    ConstructNode top = nodes.remove(nodes.size() - 1);
    Verify.verify(
        top.getConstruct() == construct,
        "popped %s, expected the construct at %s",
        top,
        construct.getStartLocation());
    return top;
  }

  /** Returns the open constructs from the innermost outward. */
  public List<ConstructNode> innermostFirst() {
    return Lists.reverse(nodes);
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public int size() {
    return nodes.size();
  }

  @Override
  public String toString() {
    return nodes.toString();
  }
}
