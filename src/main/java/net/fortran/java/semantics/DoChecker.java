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
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import javax.annotation.Nullable;
import net.fortran.java.evaluate.Expressions;
import net.fortran.java.symbols.DeclTypeSpec;
import net.fortran.java.symbols.Intent;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.symbols.TypeCategory;
import net.fortran.java.syntax.Argument;
import net.fortran.java.syntax.AssignmentStatement;
import net.fortran.java.syntax.ConcurrentHeader.ConcurrentControl;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.Expression;
import net.fortran.java.syntax.FlowStatement;
import net.fortran.java.syntax.Identifier;
import net.fortran.java.syntax.IoImpliedDo;
import net.fortran.java.syntax.IoSpecifier;
import net.fortran.java.syntax.IoStatement;
import net.fortran.java.syntax.Location;
import net.fortran.java.syntax.LoopControl;

/**
 * Checks DO constructs, and the statements that interact with them.
 *
 * <ul>
 *   <li>DO variables and DO CONCURRENT index names are active from the DO statement to the end of
 *       the loop, and may not be redefined meanwhile: not by assignment, by being passed to an
 *       INTENT(OUT) dummy argument, as the variable of an I/O implied DO, or as a variable that an
 *       I/O statement or a STAT= specifier sets. Passing one to an INTENT(INOUT) dummy argument is
 *       a warning.
 *   <li>CYCLE and EXIT must match an enclosing construct, and may not leave a DO CONCURRENT,
 *       CRITICAL or CHANGE TEAM construct.
 *   <li>The DO variable, limits and step of a counted DO should be INTEGER, and the step should
 *       not be zero.
 *   <li>The header and body of a DO CONCURRENT are checked when the loop ends.
 * </ul>
 */
final class DoChecker {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final SemanticsContext context;

  DoChecker(SemanticsContext context) {
    this.context = context;
  }

  // ==== DO constructs ====

  /** Called at the DO statement, after the construct has been pushed. */
  void enter(DoConstruct loop) {
    trackDoLabel(loop);
    defineDoVariables(loop);
  }

  /** Called at the end of the loop, before the construct is popped. */
  void leave(DoConstruct loop) {
    if (loop.isDoConcurrent()) {
      checkDoConcurrent(loop);
    } else if (loop.isDoNormal()) {
      checkDoNormal(loop.getBounds());
    }
    resetDoVariables(loop);
    if (!loop.isLabelDo()) {
      context.activeVariables().leaveDoConstruct();
    }
  }

  // Nested label DO loops may end on the same statement. This is obsolescent.
  private void trackDoLabel(DoConstruct loop) {
    ActiveVariableTracker tracker = context.activeVariables();
    if (!loop.isLabelDo()) {
      tracker.enterNonlabelDoConstruct();
      return;
    }
    int label = loop.getTerminatingLabel();
    if (tracker.isDoLabel(label)) {
      LanguageOptions options = context.getOptions();
      if (options.strictConformance()) {
        context.error(
            loop.getStartLocation(), "Label %d terminates more than one DO loop", label);
      } else if (options.shouldWarn(LanguageFeature.SHARED_DO_TERMINATION)) {
        context.warning(
            loop.getStartLocation(), "Label %d terminates more than one DO loop", label);
      }
    }
    tracker.newDoLabel(label);
  }

  private void defineDoVariables(DoConstruct loop) {
    if (loop.isDoNormal()) {
      context.activateDoVariable(loop.getBounds().getVariable());
    } else if (loop.isDoConcurrent()) {
      for (ConcurrentControl control : loop.getConcurrent().getHeader().getControls()) {
        context.activateDoVariable(control.getIndexName());
      }
    }
  }

  private void resetDoVariables(DoConstruct loop) {
    if (loop.isDoNormal()) {
      context.deactivateDoVariable(loop.getBounds().getVariable());
    } else if (loop.isDoConcurrent()) {
      for (ConcurrentControl control : loop.getConcurrent().getHeader().getControls()) {
        context.deactivateDoVariable(control.getIndexName());
      }
    }
  }

  private void checkDoConcurrent(DoConstruct loop) {
    logger.atFinest().log("checking DO CONCURRENT at %s", loop.getStartLocation());
    new ConcurrentHeaderValidator(context, loop).validate();
    ImmutableSet<Integer> labels =
        ImmutableSet.<Integer>builder()
            .addAll(new DoConcurrentBodyEnforcer(context, loop).enforce(loop.getBody()))
            .addAll(endLabels(loop))
            .build();
    new LabelEnforcer(
            context,
            labels,
            loop.getStartLocation(),
            "DO CONCURRENT",
            /* enterNestedDoConcurrentBodies= */ false)
        .enforce(loop.getBody());
  }

  private static ImmutableSet<Integer> endLabels(DoConstruct loop) {
    ImmutableSet.Builder<Integer> labels = ImmutableSet.builder();
    if (loop.isLabelDo()) {
      labels.add(loop.getTerminatingLabel());
    }
    if (loop.getEndLabel() != 0) {
      labels.add(loop.getEndLabel());
    }
    return labels.build();
  }

  // ==== Counted DO ====

  private void checkDoNormal(LoopControl.Bounds bounds) {
    checkDoVariable(bounds.getVariable());
    checkDoExpression(bounds.getLower());
    checkDoExpression(bounds.getUpper());
    Expression step = bounds.getStep();
    if (step != null) {
      checkDoExpression(step);
      if (Expressions.isZero(step)) {
        Diagnostic.Severity severity =
            context.getOptions().strictConformance()
                ? Diagnostic.Severity.ERROR
                : Diagnostic.Severity.WARNING;
        context.say(severity, step.getStartLocation(), "DO step expression should not be zero");
      }
    }
  }

  private void checkDoVariable(Identifier variable) {
    Symbol symbol = variable.getSymbol();
    if (symbol == null) {
      return;
    }
    Location location = variable.getStartLocation();
    if (!symbol.isVariableName()) {
      context.error(location, "DO control must be an INTEGER variable");
      return;
    }
    DeclTypeSpec type = symbol.getType();
    if (type == null) {
      sayBadDoControl(location);
    } else if (!type.isNumeric(TypeCategory.INTEGER)) {
      checkDoControl(location, type.isNumeric(TypeCategory.REAL));
    }
  }

  // The limits and step of a counted DO; no message for INTEGER, or if the type is unknown.
  private void checkDoExpression(Expression expr) {
    if (Expressions.getType(expr) != null
        && !Expressions.hasTypeCategory(expr, TypeCategory.INTEGER)) {
      checkDoControl(
          expr.getStartLocation(), Expressions.hasTypeCategory(expr, TypeCategory.REAL));
    }
  }

  // REAL DO controls are an extension: silent by default, a warning on request, an error when
  // conformance is strict. Anything else that is not INTEGER is an error.
  private void checkDoControl(Location location, boolean isReal) {
    if (!isReal || context.getOptions().strictConformance()) {
      sayBadDoControl(location);
    } else if (context.getOptions().shouldWarn(LanguageFeature.REAL_DO_CONTROLS)) {
      context.warning(location, "DO controls should be INTEGER");
    }
  }

  private void sayBadDoControl(Location location) {
    context.error(location, "DO controls should be INTEGER");
  }

  // ==== CYCLE and EXIT ====

  /**
   * Checks that a CYCLE or EXIT statement matches an enclosing construct, reporting each
   * construct it may not leave.
   */
  void enter(FlowStatement stmt) {
    for (ConstructNode construct : context.constructStack().innermostFirst()) {
      if (matches(stmt, construct)) {
        // An EXIT may not leave a DO CONCURRENT even when it names it.
        if (stmt.getFlowKind() == FlowStatement.FlowKind.EXIT && construct.isDoConcurrent()) {
          sayBadLeave(stmt, "DO CONCURRENT", construct);
        }
        return;
      }
      checkForBadLeave(stmt, construct);
    }
    if (stmt.getFlowKind() == FlowStatement.FlowKind.EXIT) {
      context.error(stmt.getStartLocation(), "No matching construct for EXIT statement");
    } else {
      context.error(stmt.getStartLocation(), "No matching DO construct for CYCLE statement");
    }
  }

  // An unnamed CYCLE or EXIT matches the innermost DO. A named EXIT matches any construct of that
  // name; a named CYCLE only a DO.
  private static boolean matches(FlowStatement stmt, ConstructNode construct) {
    boolean isDo = construct.kind() == ConstructNode.Kind.DO;
    Identifier stmtName = stmt.getConstructName();
    if (stmtName == null) {
      return isDo;
    }
    Identifier constructName = construct.getName();
    if (constructName != null && constructName.getName().equals(stmtName.getName())) {
      return stmt.getFlowKind() == FlowStatement.FlowKind.EXIT || isDo;
    }
    return false;
  }

  private void checkForBadLeave(FlowStatement stmt, ConstructNode construct) {
    String enclosing =
        switch (construct.kind()) {
          case DO -> construct.isDoConcurrent() ? "DO CONCURRENT" : null;
          case CRITICAL -> "CRITICAL";
          case CHANGE_TEAM -> "CHANGE TEAM";
          case LABELED -> null;
        };
    if (enclosing != null) {
      sayBadLeave(stmt, enclosing, construct);
    }
  }

  private void sayBadLeave(FlowStatement stmt, String enclosing, ConstructNode construct) {
    context
        .error(
            stmt.getStartLocation(),
            "%s must not leave a %s statement",
            stmt.getFlowKind(),
            enclosing)
        .attach(construct.getLocation(), "The construct that was left");
  }

  // ==== Redefinition of active DO variables ====

  void leave(AssignmentStatement stmt) {
    context.checkDoVarRedefine(stmt.getVariable());
  }

  /**
   * Checks the actual arguments of a procedure reference against the intents of the dummy
   * arguments. Arguments are matched to dummies by position until the first keyword argument, and
   * then by keyword.
   */
  void checkActualArguments(Expression procedure, List<Argument> arguments) {
    Symbol.Procedure details = getProcedureDetails(procedure);
    if (details == null) {
      return;
    }
    for (int i = 0; i < arguments.size(); i++) {
      Argument arg = arguments.get(i);
      Symbol dummy;
      if (arg.getKeyword() != null) {
        dummy = details.findDummy(arg.getKeyword().getName());
      } else {
        dummy = i < details.getDummies().size() ? details.getDummies().get(i) : null;
      }
      if (dummy != null) {
        checkIfArgIsDoVar(arg.getValue(), dummy);
      }
    }
  }

  @Nullable
  private static Symbol.Procedure getProcedureDetails(Expression procedure) {
    Identifier name = Expressions.getLastName(procedure);
    if (name == null || name.getSymbol() == null) {
      return null;
    }
    return name.getSymbol().getUltimate().getDetails() instanceof Symbol.Procedure procedureDetails
        ? procedureDetails
        : null;
  }

  private void checkIfArgIsDoVar(Expression actual, Symbol dummy) {
    if (!(dummy.getDetails() instanceof Symbol.ObjectEntity entity)) {
      return;
    }
    Intent intent = entity.getIntent();
    if (intent != Intent.OUT && intent != Intent.IN_OUT) {
      return;
    }
    Symbol variable = Expressions.unwrapWholeSymbol(actual);
    if (variable == null) {
      return;
    }
    if (intent == Intent.OUT) {
      context.checkDoVarRedefine(actual.getStartLocation(), variable);
    } else {
      context.warnDoVarRedefine(actual.getStartLocation(), variable);
    }
  }

  void leave(IoImpliedDo node) {
    Identifier variable = node.getVariable();
    if (variable.getSymbol() != null) {
      context.checkDoVarRedefine(variable.getStartLocation(), variable.getSymbol());
    }
  }

  /** Checks the specifiers through which an I/O statement sets a variable. */
  void leave(IoStatement stmt) {
    for (IoSpecifier spec : stmt.getSpecifiers()) {
      if (spec.getValue() != null && setsVariable(stmt.getIoKind(), spec.getSpecifierKind())) {
        context.checkDoVarRedefine(spec.getValue());
      }
    }
  }

  private static boolean setsVariable(IoStatement.IoKind ioKind, IoSpecifier.SpecifierKind kind) {
    switch (kind) {
      case IOSTAT:
        return true;
      case SIZE:
        return ioKind == IoStatement.IoKind.READ || ioKind == IoStatement.IoKind.INQUIRE;
      case NEWUNIT:
        return ioKind == IoStatement.IoKind.OPEN;
      case NUMBER:
      case NEXTREC:
      case POS:
      case RECL:
        return ioKind == IoStatement.IoKind.INQUIRE;
      default:
        return false;
    }
  }

  /** Checks the variable of a STAT= specifier, which the statement sets. */
  void checkStatVariable(@Nullable Expression stat) {
    if (stat != null) {
      context.checkDoVarRedefine(stat);
    }
  }
}
