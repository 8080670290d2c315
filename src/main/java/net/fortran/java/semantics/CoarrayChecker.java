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
import net.fortran.java.syntax.AllocateStatement;
import net.fortran.java.syntax.CallStatement;
import net.fortran.java.syntax.ChangeTeamConstruct;
import net.fortran.java.syntax.Construct;
import net.fortran.java.syntax.CriticalConstruct;
import net.fortran.java.syntax.DeallocateStatement;
import net.fortran.java.syntax.ImageControlStatement;
import net.fortran.java.syntax.Location;
import net.fortran.java.syntax.ReturnStatement;
import net.fortran.java.syntax.Statement;

/**
 * Checks the bodies of CRITICAL and CHANGE TEAM constructs. Neither body may branch out of the
 * construct. A CRITICAL body may also contain neither a RETURN nor an image control statement.
 */
final class CoarrayChecker {

  private final SemanticsContext context;

  CoarrayChecker(SemanticsContext context) {
    this.context = context;
  }

  void leave(CriticalConstruct construct) {
    CriticalBodyEnforcer enforcer = new CriticalBodyEnforcer(construct.getStartLocation());
    enforcer.walk(construct.getBody());
    enforceLabels(construct, construct.getBody(), enforcer.labels(), "CRITICAL");
  }

  void leave(ChangeTeamConstruct construct) {
    LabelCollector collector = new LabelCollector();
    collector.walk(construct.getBody());
    enforceLabels(construct, construct.getBody(), collector.labels(), "CHANGE TEAM");
  }

  private void enforceLabels(
      Construct construct, List<Statement> body, ImmutableSet<Integer> labels, String name) {
    if (construct.getEndLabel() != 0) {
      labels =
          ImmutableSet.<Integer>builder().addAll(labels).add(construct.getEndLabel()).build();
    }
    new LabelEnforcer(
            context,
            labels,
            construct.getStartLocation(),
            name,
            /* enterNestedDoConcurrentBodies= */ true)
        .enforce(body);
  }

  private static final class LabelCollector extends ConstructBodyVisitor {
    LabelCollector() {
      super(/* enterNestedDoConcurrentBodies= */ true);
    }
  }

  private final class CriticalBodyEnforcer extends ConstructBodyVisitor {
    private final Location criticalLocation;

    CriticalBodyEnforcer(Location criticalLocation) {
      super(/* enterNestedDoConcurrentBodies= */ true);
      this.criticalLocation = criticalLocation;
    }

    @Override
    public void visit(ReturnStatement node) {
      super.visit(node);
      context
          .error(
              currentStatementLocation(),
              "RETURN statement is not allowed in a CRITICAL construct")
          .attach(criticalLocation, "Enclosing CRITICAL statement");
    }

    private void checkImageControl(Statement stmt) {
      if (ImageControl.isImageControl(stmt)) {
        Diagnostic.Builder diagnostic =
            context.error(
                stmt.getStartLocation(),
                "An image control statement is not allowed in a CRITICAL construct");
        String coarrayNote = ImageControl.getCoarrayNote(stmt);
        if (coarrayNote != null) {
          diagnostic.attach(stmt.getStartLocation(), "%s", coarrayNote);
        }
        diagnostic.attach(criticalLocation, "Enclosing CRITICAL statement");
      }
    }

    @Override
    public void visit(ImageControlStatement node) {
      super.visit(node);
      checkImageControl(node);
    }

    @Override
    public void visit(AllocateStatement node) {
      super.visit(node);
      checkImageControl(node);
    }

    @Override
    public void visit(DeallocateStatement node) {
      super.visit(node);
      checkImageControl(node);
    }

    @Override
    public void visit(CallStatement node) {
      super.visit(node);
      checkImageControl(node);
    }

    @Override
    public void visit(CriticalConstruct node) {
      super.visit(node);
      checkImageControl(node);
    }

    @Override
    public void visit(ChangeTeamConstruct node) {
      super.visit(node);
      checkImageControl(node);
    }
  }
}
