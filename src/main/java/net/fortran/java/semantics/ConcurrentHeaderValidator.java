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
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import javax.annotation.Nullable;
import net.fortran.java.evaluate.Expressions;
import net.fortran.java.symbols.Scope;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.syntax.ConcurrentHeader;
import net.fortran.java.syntax.ConcurrentHeader.ConcurrentControl;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.Expression;
import net.fortran.java.syntax.Identifier;
import net.fortran.java.syntax.LocalitySpec;
import net.fortran.java.syntax.LocalitySpec.LocalityKind;
import net.fortran.java.syntax.Location;
import net.fortran.java.syntax.LoopControl;

/**
 * Checks the concurrent header and locality specs of a DO CONCURRENT statement.
 *
 * <ul>
 *   <li>A procedure referenced in the mask must be pure.
 *   <li>The limits and steps must not reference an index name of the same header, and a step must
 *       not be zero.
 *   <li>A variable in a LOCAL locality spec must not be referenced in the limits, steps or mask.
 *   <li>DEFAULT(NONE) may appear at most once; when it appears, the body is checked by {@link
 *       DoConcurrentVariableEnforcer}.
 * </ul>
 */
final class ConcurrentHeaderValidator {

  private final SemanticsContext context;
  private final DoConstruct loop;
  private final Location doLocation;
  private final ConcurrentHeader header;
  private final ImmutableList<LocalitySpec> localitySpecs;

  ConcurrentHeaderValidator(SemanticsContext context, DoConstruct loop) {
    this.context = context;
    this.loop = loop;
    this.doLocation = loop.getStartLocation();
    LoopControl.Concurrent concurrent = loop.getConcurrent();
    this.header = concurrent.getHeader();
    this.localitySpecs = concurrent.getLocalitySpecs();
  }

  void validate() {
    Expression mask = header.getMask();
    if (mask != null) {
      checkMaskIsPure(mask);
    }
    checkConcurrentHeader();
    checkLocalitySpecs();
  }

  // Returns the association roots of the symbols referenced by an expression.
  private static ImmutableSet<Symbol> gatherSymbols(Expression expr) {
    ImmutableSet.Builder<Symbol> result = ImmutableSet.builder();
    for (Symbol symbol : Expressions.collectSymbols(expr)) {
      result.add(symbol.getAssociationRoot());
    }
    return result.build();
  }

  private void checkMaskIsPure(Expression mask) {
    for (Symbol ref : gatherSymbols(mask)) {
      if (ref.isProcedure() && !ref.isPureProcedure()) {
        context.sayWithDecl(
            ref,
            mask.getStartLocation(),
            "Concurrent-header mask expression cannot reference an impure procedure '%s'",
            ref.getName());
        return;
      }
    }
  }

  // Returns the first symbol referenced by expr that is in uses, or null.
  @Nullable
  private static Symbol findCollision(Expression expr, Set<Symbol> uses) {
    for (Symbol ref : gatherSymbols(expr)) {
      if (uses.contains(ref)) {
        return ref;
      }
    }
    return null;
  }

  private void checkNoIndexReference(Expression expr, Set<Symbol> indexNames) {
    Symbol ref = findCollision(expr, indexNames);
    if (ref != null) {
      context.sayWithDecl(
          ref,
          expr.getStartLocation(),
          "concurrent-control expression references index-name '%s'",
          ref.getName());
    }
  }

  private void checkConcurrentHeader() {
    ImmutableSet.Builder<Symbol> builder = ImmutableSet.builder();
    for (ConcurrentControl control : header.getControls()) {
      Symbol index = control.getIndexName().getSymbol();
      if (index != null) {
        builder.add(index);
      }
    }
    ImmutableSet<Symbol> indexNames = builder.build();
    for (ConcurrentControl control : header.getControls()) {
      checkNoIndexReference(control.getLower(), indexNames);
      checkNoIndexReference(control.getUpper(), indexNames);
      Expression step = control.getStep();
      if (step != null) {
        checkNoIndexReference(step, indexNames);
        if (Expressions.isZero(step)) {
          context.error(
              step.getStartLocation(), "DO CONCURRENT step expression should not be zero");
        }
      }
    }
  }

  // Returns the root symbols of the names in LOCAL locality specs. The names are looked up in the
  // scope enclosing the loop, since the loop's own scope declares local copies of them.
  private ImmutableSet<Symbol> gatherLocals() {
    Scope parentScope = checkScope().getParent();
    ImmutableSet.Builder<Symbol> symbols = ImmutableSet.builder();
    for (LocalitySpec spec : localitySpecs) {
      if (spec.getLocalityKind() != LocalityKind.LOCAL) {
        continue;
      }
      for (Identifier name : spec.getNames()) {
        Symbol symbol = parentScope.findSymbol(name.getName());
        if (symbol != null) {
          symbols.add(symbol.getAssociationRoot());
        }
      }
    }
    return symbols.build();
  }

  private void checkLocalitySpecs() {
    if (localitySpecs.isEmpty()) {
      return;
    }
    ImmutableSet<Symbol> localVars = gatherLocals();
    for (ConcurrentControl control : header.getControls()) {
      checkNoLocalReference(control.getLower(), localVars);
      checkNoLocalReference(control.getUpper(), localVars);
      if (control.getStep() != null) {
        checkNoLocalReference(control.getStep(), localVars);
      }
    }
    Expression mask = header.getMask();
    if (mask != null) {
      Symbol ref = findCollision(mask, localVars);
      if (ref != null) {
        context.sayWithDecl(
            ref,
            mask.getStartLocation(),
            "concurrent-header mask-expr references variable '%s' in LOCAL locality-spec",
            ref.getName());
      }
    }
    checkDefaultNoneImpliesExplicitLocality();
  }

  private void checkNoLocalReference(Expression expr, Set<Symbol> localVars) {
    Symbol ref = findCollision(expr, localVars);
    if (ref != null) {
      context.sayWithDecl(
          ref,
          expr.getStartLocation(),
          "concurrent-header expression references variable '%s' in LOCAL locality-spec",
          ref.getName());
    }
  }

  private void checkDefaultNoneImpliesExplicitLocality() {
    boolean hasDefaultNone = false;
    for (LocalitySpec spec : localitySpecs) {
      if (spec.getLocalityKind() == LocalityKind.DEFAULT_NONE) {
        if (hasDefaultNone) {
          // Only the second DEFAULT(NONE) is reported.
          context
              .error(spec.getLocation(), "Only one DEFAULT(NONE) may appear")
              .attach(doLocation, "Enclosing DO CONCURRENT statement");
          break;
        }
        hasDefaultNone = true;
      }
    }
    if (hasDefaultNone) {
      new DoConcurrentVariableEnforcer(context, loop).enforce(loop.getBody());
    }
  }

  private Scope checkScope() {
    return Preconditions.checkNotNull(loop.getScope(), "DO CONCURRENT without a scope");
  }
}
