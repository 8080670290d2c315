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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import java.util.function.Predicate;
import javax.annotation.Nullable;
import net.fortran.java.evaluate.Expressions;
import net.fortran.java.symbols.Attr;
import net.fortran.java.symbols.DeclTypeSpec;
import net.fortran.java.symbols.DerivedTypeSpec;
import net.fortran.java.symbols.Scope;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.syntax.AllocateStatement;
import net.fortran.java.syntax.AssignmentStatement;
import net.fortran.java.syntax.BlockConstruct;
import net.fortran.java.syntax.CallStatement;
import net.fortran.java.syntax.ChangeTeamConstruct;
import net.fortran.java.syntax.ComponentReference;
import net.fortran.java.syntax.CriticalConstruct;
import net.fortran.java.syntax.DeallocateStatement;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.Expression;
import net.fortran.java.syntax.FunctionReference;
import net.fortran.java.syntax.Identifier;
import net.fortran.java.syntax.ImageControlStatement;
import net.fortran.java.syntax.IoSpecifier;
import net.fortran.java.syntax.Location;
import net.fortran.java.syntax.ReturnStatement;
import net.fortran.java.syntax.Statement;

/**
 * Enforces the constraints on the statements in the body of a DO CONCURRENT.
 *
 * <p>The body may not deallocate a polymorphic entity, whether by leaving a BLOCK construct, by
 * intrinsic assignment, or by a DEALLOCATE statement, since the deallocation might invoke an impure
 * final subroutine. It may not contain an image control statement or a RETURN statement, reference
 * an impure procedure, call IEEE_GET_FLAG or IEEE_SET_HALTING_MODE, or use the ADVANCE= specifier.
 *
 * <p>Each statement or expression violates at most one of these rules. Every diagnostic has a
 * note at the DO CONCURRENT statement.
 */
final class DoConcurrentBodyEnforcer extends ConstructBodyVisitor {

  private static final String ENCLOSING_DO = "Enclosing DO CONCURRENT statement";

  private static final ImmutableSet<String> IEEE_RESTRICTED_PROCEDURES =
      ImmutableSet.of("ieee_get_flag", "ieee_set_halting_mode");

  // Deallocation by block exit or DEALLOCATE deallocates all allocatable components.
  private static final Predicate<Symbol> DEALLOCATE_ALL = component -> true;

  // Intrinsic assignment never deallocates coarray components.
  private static final Predicate<Symbol> DEALLOCATE_NON_COARRAY =
      component -> !component.isCoarray();

  private final SemanticsContext context;
  private final Location doLocation;
  private final Scope doScope;

  DoConcurrentBodyEnforcer(SemanticsContext context, DoConstruct loop) {
    super(/* enterNestedDoConcurrentBodies= */ false);
    Preconditions.checkArgument(loop.isDoConcurrent(), "not a DO CONCURRENT");
    this.context = context;
    this.doLocation = loop.getStartLocation();
    this.doScope = Preconditions.checkNotNull(loop.getScope(), "DO CONCURRENT without a scope");
  }

  /** Checks the body and returns the labels of its statements. */
  ImmutableSet<Integer> enforce(List<Statement> body) {
    walk(body);
    return labels();
  }

  @FormatMethod
  private void sayWithDo(Location location, String format, Object... args) {
    context.error(location, format, args).attach(doLocation, ENCLOSING_DO);
  }

  @FormatMethod
  private void sayWithDeclAndDo(Symbol symbol, Location location, String format, Object... args) {
    context.sayWithDecl(symbol, location, format, args).attach(doLocation, ENCLOSING_DO);
  }

  // ==== Deallocation of polymorphic entities ====

  /**
   * Reports whether deallocating the entity might deallocate a polymorphic entity: the entity
   * itself, or one of its ultimate components that {@code willDeallocate} accepts.
   */
  static boolean mightDeallocatePolymorphic(Symbol entity, Predicate<Symbol> willDeallocate) {
    Symbol root = entity.getAssociationRoot();
    // The entity itself is checked with no coarray exception.
    if (root.isPolymorphicAllocatable()) {
      return true;
    }
    if (root.getDetails() instanceof Symbol.ObjectEntity object) {
      DeclTypeSpec type = object.getType();
      DerivedTypeSpec derived = type != null ? type.asDerived() : null;
      if (derived != null) {
        for (Symbol ultimate : derived.ultimateComponents()) {
          if (willDeallocate.test(ultimate) && ultimate.isPolymorphicAllocatable()) {
            return true;
          }
        }
      }
    }
    return false;
  }

  // Leaving a block deallocates its unsaved allocatable entities and all of their allocatable
  // components. An entity that is not itself allocatable is not deallocated, whatever its
  // components.
  @Override
  public void visit(BlockConstruct node) {
    super.visit(node);
    Scope blockScope = node.getScope();
    if (Scope.doesScopeContain(doScope, blockScope)) {
      for (Symbol entity : blockScope) {
        if (entity.isAllocatable()
            && !entity.hasAttr(Attr.SAVE)
            && mightDeallocatePolymorphic(entity, DEALLOCATE_ALL)) {
          sayWithDeclAndDo(
              entity,
              node.getEndLocation(),
              "Deallocation of a polymorphic entity caused by block exit not allowed in DO"
                  + " CONCURRENT");
        }
      }
    }
  }

  @Override
  public void visit(AssignmentStatement node) {
    super.visit(node);
    Expression variable = node.getVariable();
    Identifier name = Expressions.getLastName(variable);
    if (name != null
        && name.getSymbol() != null
        && mightDeallocatePolymorphic(name.getSymbol(), DEALLOCATE_NON_COARRAY)) {
      sayWithDeclAndDo(
          name.getSymbol(),
          variable.getStartLocation(),
          "Deallocation of a polymorphic entity caused by assignment not allowed in DO"
              + " CONCURRENT");
    }
  }

  // DEALLOCATE deallocates pointers as well as allocatables, so any polymorphic object counts.
  @Override
  public void visit(DeallocateStatement node) {
    super.visit(node);
    if (checkImageControl(node)) {
      return;
    }
    for (Expression object : node.getObjects()) {
      Identifier name = Expressions.getLastName(object);
      if (name == null || name.getSymbol() == null) {
        continue;
      }
      Symbol entity = name.getSymbol();
      DeclTypeSpec type = entity.getType();
      if ((type != null && type.isPolymorphic())
          || mightDeallocatePolymorphic(entity, DEALLOCATE_ALL)) {
        sayWithDeclAndDo(
            entity,
            currentStatementLocation(),
            "Deallocation of a polymorphic entity not allowed in DO CONCURRENT");
      }
    }
  }

  // ==== Image control statements ====

  // Reports an image control statement, and returns true if the statement was one.
  private boolean checkImageControl(Statement stmt) {
    if (!ImageControl.isImageControl(stmt)) {
      return false;
    }
    Location location = stmt.getStartLocation();
    Diagnostic.Builder diagnostic =
        context.error(location, "An image control statement is not allowed in DO CONCURRENT");
    String coarrayNote = ImageControl.getCoarrayNote(stmt);
    if (coarrayNote != null) {
      diagnostic.attach(location, "%s", coarrayNote);
    }
    diagnostic.attach(doLocation, ENCLOSING_DO);
    return true;
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
  public void visit(CriticalConstruct node) {
    super.visit(node);
    checkImageControl(node);
  }

  @Override
  public void visit(ChangeTeamConstruct node) {
    super.visit(node);
    checkImageControl(node);
  }

  @Override
  public void visit(ReturnStatement node) {
    super.visit(node);
    sayWithDo(currentStatementLocation(), "RETURN is not allowed in DO CONCURRENT");
  }

  // ==== Procedure references ====

  @Override
  public void visit(CallStatement node) {
    super.visit(node);
    if (!checkImageControl(node)) {
      checkProcedureDesignator(node.getProcedure());
    }
  }

  @Override
  public void visit(FunctionReference node) {
    super.visit(node);
    checkProcedureDesignator(node.getProcedure());
  }

  private void checkProcedureDesignator(Expression procedure) {
    if (procedure instanceof Identifier name) {
      Symbol symbol = name.getSymbol();
      if (symbol == null) {
        return;
      }
      String restricted = getRestrictedIeeeProcedure(symbol);
      if (restricted != null) {
        sayWithDo(currentStatementLocation(), "%s is not allowed in DO CONCURRENT", restricted);
      } else if (!symbol.isPureProcedure()) {
        sayWithDo(
            currentStatementLocation(),
            "Call to an impure procedure is not allowed in DO CONCURRENT");
      }
    } else if (procedure instanceof ComponentReference ref) {
      Symbol component = ref.getComponent().getSymbol();
      if (component != null && !component.isPureProcedure()) {
        sayWithDo(
            currentStatementLocation(),
            "Call to an impure procedure component is not allowed in DO CONCURRENT");
      }
    }
  }

  // Returns the upper-case name of IEEE_GET_FLAG or IEEE_SET_HALTING_MODE from the intrinsic
  // module IEEE_EXCEPTIONS, or null for any other procedure.
  @Nullable
  private static String getRestrictedIeeeProcedure(Symbol symbol) {
    Symbol ultimate = symbol.getUltimate();
    Scope owner = ultimate.getOwner();
    if (owner.isModule()
        && "ieee_exceptions".equals(owner.getName())
        && IEEE_RESTRICTED_PROCEDURES.contains(ultimate.getName())) {
      return Ascii.toUpperCase(ultimate.getName());
    }
    return null;
  }

  // ==== I/O ====

  @Override
  public void visit(IoSpecifier node) {
    super.visit(node);
    if (node.getSpecifierKind() == IoSpecifier.SpecifierKind.ADVANCE) {
      sayWithDo(currentStatementLocation(), "ADVANCE specifier is not allowed in DO CONCURRENT");
    }
  }
}
