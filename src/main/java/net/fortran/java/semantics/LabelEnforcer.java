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

import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.fortran.java.syntax.GotoStatement;
import net.fortran.java.syntax.IoSpecifier;
import net.fortran.java.syntax.Location;
import net.fortran.java.syntax.Statement;

/**
 * Checks that the branches in the body of a construct stay in the construct: every label used as
 * the target of a GO TO, or of an ERR=, END= or EOR= specifier, must be the label of a statement
 * of the body.
 *
 * <p>Used for the bodies of DO CONCURRENT, CRITICAL and CHANGE TEAM constructs.
 */
final class LabelEnforcer extends ConstructBodyVisitor {

  private final SemanticsContext context;
  private final ImmutableSet<Integer> labels;
  private final Location constructLocation;
  private final String constructName;

  /**
   * @param labels the labels defined in the body
   * @param constructLocation the location of the construct statement
   * @param constructName the construct keyword, such as {@code "DO CONCURRENT"}
   */
  LabelEnforcer(
      SemanticsContext context,
      ImmutableSet<Integer> labels,
      Location constructLocation,
      String constructName,
      boolean enterNestedDoConcurrentBodies) {
    super(enterNestedDoConcurrentBodies);
    this.context = context;
    this.labels = labels;
    this.constructLocation = constructLocation;
    this.constructName = constructName;
  }

  void enforce(List<Statement> body) {
    walk(body);
  }

  @Override
  public void visit(GotoStatement node) {
    super.visit(node);
    for (int target : node.getTargets()) {
      checkLabelUse(target);
    }
  }

  @Override
  public void visit(IoSpecifier node) {
    super.visit(node);
    if (node.getSpecifierKind().isBranch()) {
      checkLabelUse(node.getLabel());
    }
  }

  private void checkLabelUse(int label) {
    if (!labels.contains(label)) {
      context
          .error(currentStatementLocation(), "Control flow escapes from %s", constructName)
          .attach(constructLocation, "Enclosing %s statement", constructName);
    }
  }
}
