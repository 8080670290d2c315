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

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import net.fortran.java.syntax.AllocateStatement;
import net.fortran.java.syntax.AssignmentStatement;
import net.fortran.java.syntax.BlockConstruct;
import net.fortran.java.syntax.CallStatement;
import net.fortran.java.syntax.ChangeTeamConstruct;
import net.fortran.java.syntax.CriticalConstruct;
import net.fortran.java.syntax.DeallocateStatement;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.FlowStatement;
import net.fortran.java.syntax.FunctionReference;
import net.fortran.java.syntax.IfConstruct;
import net.fortran.java.syntax.ImageControlStatement;
import net.fortran.java.syntax.IoImpliedDo;
import net.fortran.java.syntax.IoStatement;
import net.fortran.java.syntax.NodeVisitor;
import net.fortran.java.syntax.ProgramUnit;

/**
 * The semantic checks for DO constructs and the constructs that interact with them, run over a
 * program unit whose names have been resolved.
 *
 * <p>A single traversal of the unit maintains the stack of open constructs and the set of active
 * DO variables. Constructs are pushed at their construct statement and popped at their END
 * statement; DO constructs are checked just before they are popped, when their whole body has been
 * seen. Diagnostics are reported in the order of the traversal.
 *
 * <p>Checking never stops at the first problem: all the diagnostics of a unit are reported. A
 * failure of an internal consistency check, such as an unresolved DO variable, throws an
 * unchecked exception.
 */
public final class Semantics {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private Semantics() {}

  /** Checks a program unit and returns its diagnostics, in the order they were reported. */
  public static ImmutableList<Diagnostic> check(ProgramUnit unit, LanguageOptions options) {
    SemanticsContext context = new SemanticsContext(options);
    new Walker(context).visit(unit);
    Verify.verify(
        context.isQuiescent(),
        "constructs or DO variables still open at the end of %s: %s",
        unit,
        context.constructStack());
    ImmutableList<Diagnostic> diagnostics = context.getDiagnostics();
    logger.atFine().log("checked %s: %d diagnostics", unit, diagnostics.size());
    return diagnostics;
  }

  /**
   * Checks several program units, each with its own state, and returns their diagnostics, unit by
   * unit.
   */
  public static ImmutableList<Diagnostic> checkAll(
      List<ProgramUnit> units, LanguageOptions options) {
    ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
    for (ProgramUnit unit : units) {
      diagnostics.addAll(check(unit, options));
    }
    return diagnostics.build();
  }

  /**
   * Checks a program unit, and throws if there are errors. Returns the warnings, if any.
   *
   * @throws CheckException if any diagnostic is an error
   */
  @CanIgnoreReturnValue
  public static ImmutableList<Diagnostic> checkOrThrow(ProgramUnit unit, LanguageOptions options)
      throws CheckException {
    ImmutableList<Diagnostic> diagnostics = check(unit, options);
    if (Diagnostic.countErrors(diagnostics) > 0) {
      throw new CheckException(unit.getName(), diagnostics);
    }
    return diagnostics;
  }

  /** An exception that indicates that a program unit has semantic errors. */
  public static final class CheckException extends Exception {

    private final ImmutableList<Diagnostic> diagnostics;

    CheckException(String unitName, List<Diagnostic> diagnostics) {
      super(
          String.format(
              "%s has %d semantic error(s)\n%s",
              unitName,
              Diagnostic.countErrors(diagnostics),
              Diagnostic.toString(diagnostics)));
      this.diagnostics = ImmutableList.copyOf(diagnostics);
    }

    /** Returns all the diagnostics of the unit, errors and warnings. */
    public ImmutableList<Diagnostic> diagnostics() {
      return diagnostics;
    }
  }

  // The traversal. Each construct is pushed on entry and popped on exit, whatever its checks
  // report.
  private static final class Walker extends NodeVisitor {

    private final SemanticsContext context;
    private final DoChecker doChecker;
    private final CoarrayChecker coarrayChecker;

    Walker(SemanticsContext context) {
      this.context = context;
      this.doChecker = new DoChecker(context);
      this.coarrayChecker = new CoarrayChecker(context);
    }

    // ==== Constructs ====

    @Override
    public void visit(DoConstruct node) {
      context.constructStack().push(ConstructNode.of(node));
      doChecker.enter(node);
      super.visit(node);
      doChecker.leave(node);
      context.constructStack().pop(node);
    }

    @Override
    public void visit(CriticalConstruct node) {
      context.constructStack().push(ConstructNode.of(node));
      super.visit(node);
      doChecker.checkStatVariable(node.getStat());
      coarrayChecker.leave(node);
      context.constructStack().pop(node);
    }

    @Override
    public void visit(ChangeTeamConstruct node) {
      context.constructStack().push(ConstructNode.of(node));
      super.visit(node);
      doChecker.checkStatVariable(node.getStat());
      coarrayChecker.leave(node);
      context.constructStack().pop(node);
    }

    @Override
    public void visit(BlockConstruct node) {
      context.constructStack().push(ConstructNode.of(node));
      super.visit(node);
      context.constructStack().pop(node);
    }

    @Override
    public void visit(IfConstruct node) {
      context.constructStack().push(ConstructNode.of(node));
      super.visit(node);
      context.constructStack().pop(node);
    }

    // ==== Statements ====

    @Override
    public void visit(FlowStatement node) {
      doChecker.enter(node);
    }

    @Override
    public void visit(AssignmentStatement node) {
      super.visit(node);
      doChecker.leave(node);
    }

    @Override
    public void visit(CallStatement node) {
      super.visit(node);
      doChecker.checkActualArguments(node.getProcedure(), node.getArguments());
    }

    @Override
    public void visit(FunctionReference node) {
      super.visit(node);
      doChecker.checkActualArguments(node.getProcedure(), node.getArguments());
    }

    @Override
    public void visit(IoStatement node) {
      super.visit(node);
      doChecker.leave(node);
    }

    @Override
    public void visit(IoImpliedDo node) {
      super.visit(node);
      doChecker.leave(node);
    }

    @Override
    public void visit(AllocateStatement node) {
      super.visit(node);
      doChecker.checkStatVariable(node.getStat());
    }

    @Override
    public void visit(DeallocateStatement node) {
      super.visit(node);
      doChecker.checkStatVariable(node.getStat());
    }

    @Override
    public void visit(ImageControlStatement node) {
      super.visit(node);
      doChecker.checkStatVariable(node.getStat());
    }
  }
}
