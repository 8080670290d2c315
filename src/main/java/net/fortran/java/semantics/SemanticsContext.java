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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import net.fortran.java.evaluate.Expressions;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.syntax.Expression;
import net.fortran.java.syntax.Identifier;
import net.fortran.java.syntax.Location;

/**
 * The state shared by the checks of a single program unit: the language options, the ordered
 * list of diagnostics, the stack of open constructs, and the active DO variables.
 *
 * <p>A SemanticsContext is used for one program unit only. Units checked in parallel each need
 * their own.
 */
public final class SemanticsContext {

  private final LanguageOptions options;
  private final List<Diagnostic.Builder> diagnostics = new ArrayList<>();
  private final ConstructStack constructStack = new ConstructStack();
  private final ActiveVariableTracker activeVariables = new ActiveVariableTracker();

  public SemanticsContext(LanguageOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  public LanguageOptions getOptions() {
    return options;
  }

  public ConstructStack constructStack() {
    return constructStack;
  }

  public ActiveVariableTracker activeVariables() {
    return activeVariables;
  }

  // ==== Reporting ====

  /** Reports an error at a location. Notes may be attached to the returned builder. */
  @CanIgnoreReturnValue
  @FormatMethod
  public Diagnostic.Builder error(Location location, String format, Object... args) {
    return say(Diagnostic.Severity.ERROR, location, format, args);
  }

  /** Reports a warning at a location. Notes may be attached to the returned builder. */
  @CanIgnoreReturnValue
  @FormatMethod
  public Diagnostic.Builder warning(Location location, String format, Object... args) {
    return say(Diagnostic.Severity.WARNING, location, format, args);
  }

  @CanIgnoreReturnValue
  @FormatMethod
  public Diagnostic.Builder say(
      Diagnostic.Severity severity, Location location, String format, Object... args) {
    Diagnostic.Builder diagnostic =
        Diagnostic.builder(severity, location, String.format(format, args));
    diagnostics.add(diagnostic);
    return diagnostic;
  }

  /**
   * Reports an error about a symbol at a location, and attaches a note at the declaration of the
   * symbol.
   */
  @CanIgnoreReturnValue
  @FormatMethod
  public Diagnostic.Builder sayWithDecl(
      Symbol symbol, Location location, String format, Object... args) {
    Diagnostic.Builder diagnostic = error(location, format, args);
    if (!symbol.getLocation().equals(Location.BUILTIN)) {
      diagnostic.attach(symbol.getLocation(), "Declaration of '%s'", symbol.getName());
    }
    return diagnostic;
  }

  /** Returns the diagnostics reported so far, in the order they were reported. */
  public ImmutableList<Diagnostic> getDiagnostics() {
    ImmutableList.Builder<Diagnostic> result =
        ImmutableList.builderWithExpectedSize(diagnostics.size());
    for (Diagnostic.Builder diagnostic : diagnostics) {
      result.add(diagnostic.build());
    }
    return result.build();
  }

  // ==== DO variables ====

  /**
   * Makes the variable named in a DO statement active. A variable that is already active, because
   * an enclosing loop has the same DO variable, is being redefined.
   */
  public void activateDoVariable(Identifier name) {
    Symbol symbol = checkResolved(name);
    if (!activeVariables.activate(symbol, name.getStartLocation())) {
      sayDoVarRedefine(name.getStartLocation(), symbol);
    }
  }

  /** Makes the variable named in a DO statement inactive, at the end of its loop. */
  public void deactivateDoVariable(Identifier name) {
    activeVariables.deactivate(checkResolved(name), name.getStartLocation());
  }

  /** Reports an error if the variable, about to be defined at {@code location}, is active. */
  public void checkDoVarRedefine(Location location, Symbol variable) {
    if (activeVariables.isActive(variable)) {
      sayDoVarRedefine(location, variable);
    }
  }

  /** Reports an error if the designator, about to be defined, names an active variable. */
  public void checkDoVarRedefine(Expression variable) {
    Identifier name = Expressions.getLastName(variable);
    if (name != null && name.getSymbol() != null) {
      checkDoVarRedefine(variable.getStartLocation(), name.getSymbol());
    }
  }

  /** Reports a warning if the variable, which might be defined at {@code location}, is active. */
  public void warnDoVarRedefine(Location location, Symbol variable) {
    Location activation = activeVariables.getActivationLocation(variable);
    if (activation != null) {
      warning(location, "Possible redefinition of DO variable '%s'", variable.getName())
          .attach(activation, "Enclosing DO construct");
    }
  }

  private void sayDoVarRedefine(Location location, Symbol variable) {
    Diagnostic.Builder diagnostic =
        error(location, "Cannot redefine DO variable '%s'", variable.getName());
    Location activation = activeVariables.getActivationLocation(variable);
    if (activation != null) {
      diagnostic.attach(activation, "Enclosing DO construct");
    }
  }

  private static Symbol checkResolved(Identifier name) {
    Symbol symbol = name.getSymbol();
    Preconditions.checkState(symbol != null, "DO variable '%s' was not resolved", name);
    return symbol;
  }

  /** Reports whether the traversal is outside any construct, with no DO variable active. */
  public boolean isQuiescent() {
    return constructStack.isEmpty() && activeVariables.isEmpty();
  }
}
