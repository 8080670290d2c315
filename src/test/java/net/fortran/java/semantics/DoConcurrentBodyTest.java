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

import static com.google.common.truth.Truth.assertThat;
import static net.fortran.java.semantics.TestUtils.assertContainsError;
import static net.fortran.java.semantics.TestUtils.messages;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.fortran.java.symbols.Attr;
import net.fortran.java.symbols.DeclTypeSpec;
import net.fortran.java.symbols.DerivedTypeSpec;
import net.fortran.java.symbols.Intent;
import net.fortran.java.symbols.Scope;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.symbols.TypeCategory;
import net.fortran.java.syntax.AllocateStatement;
import net.fortran.java.syntax.AssignmentStatement;
import net.fortran.java.syntax.DeallocateStatement;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.Expression;
import net.fortran.java.syntax.ImageControlStatement;
import net.fortran.java.syntax.ImageControlStatement.ImageControlKind;
import net.fortran.java.syntax.IoSpecifier;
import net.fortran.java.syntax.IoStatement;
import net.fortran.java.syntax.ReturnStatement;
import net.fortran.java.syntax.StringLiteral;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the constraints on the statements in the body of a DO CONCURRENT. */
@RunWith(JUnit4.class)
public class DoConcurrentBodyTest {

  private final TreeFixture tree = new TreeFixture();
  private DerivedTypeSpec t;

  private List<Diagnostic> checkBody(TreeFixture.ConcurrentBuilder loop) {
    return tree.check(loop.index("i").build());
  }

  // Returns the derived type t, declaring it on first use.
  private DerivedTypeSpec typeT() {
    if (t == null) {
      t = tree.derivedType("t");
    }
    return t;
  }

  // Declares an allocatable variable of type CLASS(t).
  private Symbol polymorphic(Scope scope, String name, Attr... extraAttrs) {
    ImmutableSet<Attr> attrs =
        ImmutableSet.<Attr>builder().add(Attr.ALLOCATABLE).add(extraAttrs).build();
    return tree.variable(
        scope, name, DeclTypeSpec.classOf(typeT()), attrs.toArray(new Attr[0]));
  }

  @Test
  public void testEmptyBodyIsValid() {
    assertThat(checkBody(tree.concurrent())).isEmpty();
  }

  @Test
  public void testReturn() {
    TreeFixture.ConcurrentBuilder loop = tree.concurrent();
    loop.body(new ReturnStatement(tree.loc()));
    Diagnostic diagnostic =
        assertContainsError(checkBody(loop), "RETURN is not allowed in DO CONCURRENT");
    assertThat(diagnostic.isError()).isTrue();
    assertThat(diagnostic.attachments()).hasSize(1);
    assertThat(diagnostic.attachments().get(0).location()).isEqualTo(loop.startLocation());
    assertThat(diagnostic.attachments().get(0).message())
        .isEqualTo("Enclosing DO CONCURRENT statement");
  }

  @Test
  public void testImpureSubroutineCall() {
    Symbol sub = tree.subroutine("sub", ImmutableSet.of());
    List<Diagnostic> diagnostics = checkBody(tree.concurrent().body(tree.call(sub)));
    assertThat(messages(diagnostics))
        .containsExactly("Call to an impure procedure is not allowed in DO CONCURRENT");
  }

  @Test
  public void testPureAndElementalCallsAreValid() {
    Symbol pure = tree.subroutine("p", ImmutableSet.of(Attr.PURE));
    Symbol elemental = tree.subroutine("e", ImmutableSet.of(Attr.ELEMENTAL));
    assertThat(checkBody(tree.concurrent().body(tree.call(pure), tree.call(elemental))))
        .isEmpty();
  }

  @Test
  public void testImpureElementalCall() {
    Symbol sub = tree.subroutine("e", ImmutableSet.of(Attr.ELEMENTAL, Attr.IMPURE));
    assertContainsError(
        checkBody(tree.concurrent().body(tree.call(sub))),
        "Call to an impure procedure is not allowed in DO CONCURRENT");
  }

  @Test
  public void testImpureFunctionReference() {
    Symbol f = tree.function("f", ImmutableSet.of());
    Symbol x = tree.integer("x");
    TreeFixture.ConcurrentBuilder loop = tree.concurrent();
    loop.localInit(x);
    loop.body(tree.assign(loop.symbol("x"), tree.functionRef(f)));
    assertThat(messages(checkBody(loop)))
        .containsExactly("Call to an impure procedure is not allowed in DO CONCURRENT");
  }

  @Test
  public void testImpureProcedureComponent() {
    Symbol proc =
        tree.procedure(typeT().getComponentScope(), "proc", ImmutableSet.of(Attr.POINTER), null);
    Symbol obj = tree.variable(tree.unitScope, "obj", DeclTypeSpec.type(typeT()));
    List<Diagnostic> diagnostics =
        checkBody(
            tree.concurrent()
                .body(tree.call(tree.component(obj, proc), ImmutableList.of())));
    assertThat(messages(diagnostics))
        .containsExactly("Call to an impure procedure component is not allowed in DO CONCURRENT");
  }

  @Test
  public void testRestrictedIeeeProcedures() {
    Scope ieee = tree.global.makeChild(Scope.Kind.MODULE, "ieee_exceptions");
    // Both are pure, but still may not be called.
    Symbol getFlag =
        tree.procedure(ieee, "ieee_get_flag", ImmutableSet.of(Attr.PURE), null, Intent.IN);
    Symbol setHalting =
        tree.procedure(
            ieee, "ieee_set_halting_mode", ImmutableSet.of(Attr.IMPURE), null, Intent.IN);
    Symbol other =
        tree.procedure(ieee, "ieee_set_flag", ImmutableSet.of(Attr.PURE), null, Intent.IN);
    List<Diagnostic> diagnostics =
        checkBody(
            tree.concurrent()
                .body(
                    tree.call(tree.use(getFlag), tree.lit(1)),
                    tree.call(tree.use(setHalting), tree.lit(1)),
                    tree.call(tree.use(other), tree.lit(1))));
    // A restricted procedure is not also reported as impure.
    assertThat(messages(diagnostics))
        .containsExactly(
            "IEEE_GET_FLAG is not allowed in DO CONCURRENT",
            "IEEE_SET_HALTING_MODE is not allowed in DO CONCURRENT")
        .inOrder();
  }

  @Test
  public void testSameNamesOutsideIeeeModuleAreOrdinaryProcedures() {
    Symbol getFlag = tree.subroutine("ieee_get_flag", ImmutableSet.of(Attr.PURE));
    assertThat(checkBody(tree.concurrent().body(tree.call(getFlag)))).isEmpty();
  }

  @Test
  public void testImageControlStatement() {
    TreeFixture.ConcurrentBuilder loop = tree.concurrent();
    loop.body(new ImageControlStatement(tree.loc(), ImageControlKind.SYNC_ALL, null, null));
    Diagnostic diagnostic =
        assertContainsError(
            checkBody(loop), "An image control statement is not allowed in DO CONCURRENT");
    assertThat(diagnostic.attachments()).hasSize(1);
  }

  @Test
  public void testCriticalConstructIsImageControl() {
    List<Diagnostic> diagnostics =
        checkBody(tree.concurrent().body(tree.critical(tree.continueStmt())));
    assertThat(messages(diagnostics))
        .containsExactly("An image control statement is not allowed in DO CONCURRENT");
  }

  @Test
  public void testAllocateOfCoarray() {
    Symbol ca = tree.coarray("ca");
    Symbol plain =
        tree.variable(
            tree.unitScope,
            "plain",
            DeclTypeSpec.intrinsic(TypeCategory.INTEGER),
            Attr.ALLOCATABLE);
    TreeFixture.ConcurrentBuilder loop = tree.concurrent();
    AllocateStatement allocate =
        new AllocateStatement(tree.loc(), ImmutableList.of(tree.ref(ca)), null);
    loop.body(
        new AllocateStatement(tree.loc(), ImmutableList.of(tree.ref(plain)), null), allocate);
    List<Diagnostic> diagnostics = checkBody(loop);
    assertThat(diagnostics).hasSize(1);
    Diagnostic diagnostic = diagnostics.get(0);
    assertThat(diagnostic.message())
        .isEqualTo("An image control statement is not allowed in DO CONCURRENT");
    assertThat(diagnostic.location()).isEqualTo(allocate.getStartLocation());
    assertThat(diagnostic.attachments().get(0).message())
        .isEqualTo("ALLOCATE of coarray 'ca' is an image control statement");
    assertThat(diagnostic.attachments().get(1).message())
        .isEqualTo("Enclosing DO CONCURRENT statement");
  }

  @Test
  public void testDeallocateOfPolymorphicCoarrayIsReportedOnce() {
    Symbol ca =
        tree.unitScope.declare(
            "ca",
            tree.loc(),
            ImmutableSet.of(Attr.ALLOCATABLE),
            new Symbol.ObjectEntity(DeclTypeSpec.classOf(typeT()), 1, Intent.DEFAULT));
    List<Diagnostic> diagnostics =
        checkBody(
            tree.concurrent()
                .body(new DeallocateStatement(tree.loc(), ImmutableList.of(tree.ref(ca)), null)));
    assertThat(messages(diagnostics))
        .containsExactly("An image control statement is not allowed in DO CONCURRENT");
  }

  @Test
  public void testDeallocateOfPolymorphicEntity() {
    Symbol p = polymorphic(tree.unitScope, "p");
    Diagnostic diagnostic =
        assertContainsError(
            checkBody(
                tree.concurrent()
                    .body(
                        new DeallocateStatement(
                            tree.loc(), ImmutableList.of(tree.ref(p)), null))),
            "Deallocation of a polymorphic entity not allowed in DO CONCURRENT");
    assertThat(diagnostic.attachments().get(0).message()).isEqualTo("Declaration of 'p'");
    assertThat(diagnostic.attachments().get(0).location()).isEqualTo(p.getLocation());
    assertThat(diagnostic.attachments().get(1).message())
        .isEqualTo("Enclosing DO CONCURRENT statement");
  }

  @Test
  public void testDeallocateOfPolymorphicPointer() {
    Symbol p = tree.variable(tree.unitScope, "p", DeclTypeSpec.classOf(typeT()), Attr.POINTER);
    assertContainsError(
        checkBody(
            tree.concurrent()
                .body(new DeallocateStatement(tree.loc(), ImmutableList.of(tree.ref(p)), null))),
        "Deallocation of a polymorphic entity not allowed in DO CONCURRENT");
  }

  @Test
  public void testDeallocateOfMonomorphicEntityIsValid() {
    Symbol a =
        tree.variable(
            tree.unitScope, "a", DeclTypeSpec.intrinsic(TypeCategory.REAL), Attr.ALLOCATABLE);
    assertThat(
            checkBody(
                tree.concurrent()
                    .body(
                        new DeallocateStatement(
                            tree.loc(), ImmutableList.of(tree.ref(a)), null))))
        .isEmpty();
  }

  @Test
  public void testAssignmentToPolymorphicAllocatable() {
    Symbol p = polymorphic(tree.unitScope, "p");
    Symbol q = polymorphic(tree.unitScope, "q");
    assertContainsError(
        checkBody(tree.concurrent().body(tree.assign(p, tree.ref(q)))),
        "Deallocation of a polymorphic entity caused by assignment not allowed in DO CONCURRENT");
  }

  @Test
  public void testAssignmentToEntityWithPolymorphicComponent() {
    DerivedTypeSpec inner = typeT();
    DerivedTypeSpec outer = tree.derivedType("outer");
    tree.variable(
        outer.getComponentScope(), "c", DeclTypeSpec.classOf(inner), Attr.ALLOCATABLE);
    Symbol x = tree.variable(tree.unitScope, "x", DeclTypeSpec.type(outer));
    Symbol y = tree.variable(tree.unitScope, "y", DeclTypeSpec.type(outer));
    assertContainsError(
        checkBody(tree.concurrent().body(tree.assign(x, tree.ref(y)))),
        "Deallocation of a polymorphic entity caused by assignment not allowed in DO CONCURRENT");
  }

  @Test
  public void testAssignmentDoesNotDeallocateCoarrayComponents() {
    DerivedTypeSpec inner = typeT();
    DerivedTypeSpec outer = tree.derivedType("outer");
    outer
        .getComponentScope()
        .declare(
            "c",
            tree.loc(),
            ImmutableSet.of(Attr.ALLOCATABLE),
            new Symbol.ObjectEntity(DeclTypeSpec.classOf(inner), 1, Intent.DEFAULT));
    Symbol x = tree.variable(tree.unitScope, "x", DeclTypeSpec.type(outer));
    Symbol y = tree.variable(tree.unitScope, "y", DeclTypeSpec.type(outer));
    assertThat(checkBody(tree.concurrent().body(tree.assign(x, tree.ref(y))))).isEmpty();
  }

  @Test
  public void testBlockExitDeallocatesPolymorphicEntity() {
    TreeFixture.ConcurrentBuilder loop = tree.concurrent();
    Scope blockScope = loop.scope().makeChild(Scope.Kind.BLOCK, null);
    Symbol p = polymorphic(blockScope, "p");
    loop.body(tree.block(blockScope, tree.continueStmt()));
    Diagnostic diagnostic =
        assertContainsError(
            checkBody(loop),
            "Deallocation of a polymorphic entity caused by block exit not allowed in DO"
                + " CONCURRENT");
    assertThat(diagnostic.attachments().get(0).location()).isEqualTo(p.getLocation());
  }

  @Test
  public void testBlockExitIgnoresSavedEntities() {
    TreeFixture.ConcurrentBuilder loop = tree.concurrent();
    Scope blockScope = loop.scope().makeChild(Scope.Kind.BLOCK, null);
    polymorphic(blockScope, "p", Attr.SAVE);
    loop.body(tree.block(blockScope, tree.continueStmt()));
    assertThat(checkBody(loop)).isEmpty();
  }

  @Test
  public void testAdvanceSpecifier() {
    Expression no = new StringLiteral(tree.loc(), "no");
    IoStatement write =
        new IoStatement(
            tree.loc(),
            IoStatement.IoKind.WRITE,
            ImmutableList.of(
                IoSpecifier.of(tree.loc(), IoSpecifier.SpecifierKind.UNIT, tree.lit(6)),
                IoSpecifier.of(tree.loc(), IoSpecifier.SpecifierKind.ADVANCE, no)),
            ImmutableList.of());
    Diagnostic diagnostic =
        assertContainsError(
            checkBody(tree.concurrent().body(write)),
            "ADVANCE specifier is not allowed in DO CONCURRENT");
    assertThat(diagnostic.location()).isEqualTo(write.getStartLocation());
  }

  @Test
  public void testNestedDoConcurrentBodyIsReportedOnce() {
    TreeFixture.ConcurrentBuilder outer = tree.concurrent();
    TreeFixture.ConcurrentBuilder inner = tree.concurrent(outer.scope());
    DoConstruct innerLoop =
        inner.index("j").body(new ReturnStatement(tree.loc())).build();
    List<Diagnostic> diagnostics = checkBody(outer.body(innerLoop));
    assertThat(messages(diagnostics)).containsExactly("RETURN is not allowed in DO CONCURRENT");
    assertThat(diagnostics.get(0).attachments().get(0).location())
        .isEqualTo(innerLoop.getStartLocation());
  }

  @Test
  public void testViolationsInNestedSerialLoopAreReported() {
    Symbol k = tree.integer("k");
    Symbol sub = tree.subroutine("sub", ImmutableSet.of());
    List<Diagnostic> diagnostics =
        checkBody(
            tree.concurrent()
                .body(tree.doLoop(k, tree.lit(1), tree.lit(2), null, tree.call(sub))));
    assertThat(messages(diagnostics))
        .containsExactly("Call to an impure procedure is not allowed in DO CONCURRENT");
  }

  @Test
  public void testBranchOutOfDoConcurrent() {
    TreeFixture.ConcurrentBuilder loop = tree.concurrent();
    loop.body(tree.goTo(100));
    DoConstruct doConcurrent = loop.index("i").build();
    List<Diagnostic> diagnostics =
        tree.check(doConcurrent, TreeFixture.labeled(100, tree.continueStmt()));
    Diagnostic diagnostic =
        assertContainsError(diagnostics, "Control flow escapes from DO CONCURRENT");
    assertThat(diagnostic.attachments().get(0).message())
        .isEqualTo("Enclosing DO CONCURRENT statement");
  }

  @Test
  public void testBranchesWithinDoConcurrentAreValid() {
    TreeFixture.ConcurrentBuilder loop = tree.concurrent();
    loop.endLabel(20);
    loop.body(
        tree.goTo(10),
        TreeFixture.labeled(10, tree.continueStmt()),
        tree.goTo(20));
    assertThat(checkBody(loop)).isEmpty();
  }

  @Test
  public void testErrSpecifierBranchOutOfDoConcurrent() {
    IoStatement read =
        new IoStatement(
            tree.loc(),
            IoStatement.IoKind.READ,
            ImmutableList.of(
                IoSpecifier.of(tree.loc(), IoSpecifier.SpecifierKind.UNIT, tree.lit(5)),
                IoSpecifier.branch(tree.loc(), IoSpecifier.SpecifierKind.ERR, 99)),
            ImmutableList.of());
    assertContainsError(
        checkBody(tree.concurrent().body(read)), "Control flow escapes from DO CONCURRENT");
  }

  @Test
  public void testAssignmentToMonomorphicVariableIsValid() {
    Symbol x = tree.integer("x");
    AssignmentStatement assignment = tree.assign(x, tree.lit(1));
    assertThat(checkBody(tree.concurrent().body(assignment))).isEmpty();
  }
}
