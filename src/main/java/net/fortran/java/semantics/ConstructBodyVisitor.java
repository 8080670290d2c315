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
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.TreeSet;
import net.fortran.java.syntax.Construct;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.Location;
import net.fortran.java.syntax.Node;
import net.fortran.java.syntax.NodeVisitor;
import net.fortran.java.syntax.Statement;

/**
 * Base class for the walks over the body of a construct. It keeps track of the statement being
 * visited, and collects the labels of the statements of the body, including the labels of END
 * statements of nested constructs.
 *
 * <p>The walks over a DO CONCURRENT body do not enter the body of a nested DO CONCURRENT, which is
 * checked on its own; they do visit its loop control.
 */
abstract class ConstructBodyVisitor extends NodeVisitor {

  private final boolean enterNestedDoConcurrentBodies;
  private final TreeSet<Integer> labels = new TreeSet<>();
  private Location currentStatementLocation;

  ConstructBodyVisitor(boolean enterNestedDoConcurrentBodies) {
    this.enterNestedDoConcurrentBodies = enterNestedDoConcurrentBodies;
  }

  /** Walks the statements of a construct body. */
  final void walk(List<Statement> body) {
    visitBlock(body);
  }

  @Override
  public final void visit(Node node) {
    if (node instanceof Statement stmt) {
      currentStatementLocation = stmt.getStartLocation();
      if (stmt.hasLabel()) {
        labels.add(stmt.getLabel());
      }
      if (stmt instanceof Construct construct && construct.getEndLabel() != 0) {
        labels.add(construct.getEndLabel());
      }
    }
    super.visit(node);
  }

  @Override
  public void visit(DoConstruct node) {
    if (node.isDoConcurrent() && !enterNestedDoConcurrentBodies) {
      visitLoopControl(node.getLoopControl());
    } else {
      super.visit(node);
    }
  }

  /** Returns the location of the statement being visited. */
  final Location currentStatementLocation() {
    Preconditions.checkState(currentStatementLocation != null, "no statement visited yet");
    return currentStatementLocation;
  }

  /** Returns the labels of the statements visited so far, in increasing order. */
  final ImmutableSortedSet<Integer> labels() {
    return ImmutableSortedSet.copyOf(labels);
  }
}
