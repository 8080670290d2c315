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
import net.fortran.java.symbols.Intent;
import net.fortran.java.symbols.Scope;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.symbols.TypeCategory;
import net.fortran.java.syntax.AllocateStatement;
import net.fortran.java.syntax.Argument;
import net.fortran.java.syntax.BinaryOperatorExpression;
import net.fortran.java.syntax.CriticalConstruct;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.Expression;
import net.fortran.java.syntax.Identifier;
import net.fortran.java.syntax.IoImpliedDo;
import net.fortran.java.syntax.IoSpecifier;
import net.fortran.java.syntax.IoSpecifier.SpecifierKind;
import net.fortran.java.syntax.IoStatement;
import net.fortran.java.syntax.IoStatement.IoKind;
import net.fortran.java.syntax.Node;
import net.fortran.java.syntax.Operator;
import net.fortran.java.syntax.Statement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests that active DO variables and DO CONCURRENT index names are not redefined. */
@RunWith(JUnit4.class)
public class DoVariableRedefinitionTest {

  private final TreeFixture tree = new TreeFixture();
  private final Symbol i = tree.integer("i");

  private DoConstruct loop(Symbol variable, Statement... body) {
    return tree.doLoop(variable, tree.lit(1), tree.lit(10), null, body);
  }

  private IoStatement io(IoKind kind, SpecifierKind specifier, Expression value) {
    return new IoStatement(
        tree.loc(),
        kind,
        ImmutableList.of(
            IoSpecifier.of(tree.loc(), SpecifierKind.UNIT, tree.lit(10)),
            IoSpecifier.of(tree.loc(), specifier, value)),
        ImmutableList.of());
  }

  @Test
  public void testAssignmentToDoVariable() {
    DoConstruct doLoop = loop(i, tree.assign(i, tree.lit(3)));
    Diagnostic diagnostic =
        assertContainsError(tree.check(doLoop), "Cannot redefine DO variable 'i'");
    assertThat(diagnostic.attachments()).hasSize(1);
    assertThat(diagnostic.attachments().get(0).message()).isEqualTo("Enclosing DO construct");
    assertThat(diagnostic.attachments().get(0).location())
        .isEqualTo(doLoop.getBounds().getVariable().getStartLocation());
  }

  @Test
  public void testAssignmentAfterLoopIsValid() {
    assertThat(tree.check(loop(i, tree.continueStmt()), tree.assign(i, tree.lit(3)))).isEmpty();
  }

  @Test
  public void testAssignmentToOtherVariableIsValid() {
    Symbol x = tree.integer("x");
    assertThat(tree.check(loop(i, tree.assign(x, tree.ref(i))))).isEmpty();
  }

  @Test
  public void testNestedLoopWithSameVariable() {
    List<Diagnostic> diagnostics = tree.check(loop(i, loop(i, tree.continueStmt())));
    assertThat(messages(diagnostics)).containsExactly("Cannot redefine DO variable 'i'");
  }

  @Test
  public void testSequentialLoopsWithSameVariableAreValid() {
    assertThat(tree.check(loop(i, tree.continueStmt()), loop(i, tree.continueStmt()))).isEmpty();
  }

  @Test
  public void testRedefinitionThroughUseAssociation() {
    Scope module = tree.global.makeChild(Scope.Kind.MODULE, "mod");
    Symbol k = tree.variable(module, "k", DeclTypeSpec.intrinsic(TypeCategory.INTEGER));
    Symbol alias = tree.use(k);
    assertContainsError(
        tree.check(loop(alias, tree.assign(k, tree.lit(0)))), "Cannot redefine DO variable 'k'");
  }

  @Test
  public void testAssignmentToDoConcurrentIndex() {
    TreeFixture.ConcurrentBuilder concurrent = tree.concurrent().index("j");
    concurrent.body(tree.assign(concurrent.symbol("j"), tree.lit(1)));
    assertThat(messages(tree.check(concurrent.build())))
        .containsExactly("Cannot redefine DO variable 'j'");
  }

  @Test
  public void testIntentOutArgument() {
    Symbol sub = tree.subroutine("sub", ImmutableSet.of(), Intent.IN, Intent.OUT);
    List<Diagnostic> diagnostics =
        tree.check(loop(i, tree.call(sub, tree.ref(i), tree.ref(i))));
    assertThat(messages(diagnostics)).containsExactly("Cannot redefine DO variable 'i'");
  }

  @Test
  public void testIntentInOutArgumentIsWarning() {
    Symbol sub = tree.subroutine("sub", ImmutableSet.of(), Intent.IN_OUT);
    List<Diagnostic> diagnostics = tree.check(loop(i, tree.call(sub, tree.ref(i))));
    Diagnostic diagnostic =
        assertContainsError(diagnostics, "Possible redefinition of DO variable 'i'");
    assertThat(diagnostic.isError()).isFalse();
    assertThat(Diagnostic.countErrors(diagnostics)).isEqualTo(0);
  }

  @Test
  public void testIntentInAndDefaultArgumentsAreValid() {
    Symbol sub = tree.subroutine("sub", ImmutableSet.of(), Intent.IN, Intent.DEFAULT);
    assertThat(tree.check(loop(i, tree.call(sub, tree.ref(i), tree.ref(i))))).isEmpty();
  }

  @Test
  public void testKeywordArgument() {
    Symbol sub = tree.subroutine("sub", ImmutableSet.of(), Intent.OUT, Intent.IN);
    Symbol x = tree.integer("x");
    ImmutableList<Argument> args =
        ImmutableList.of(
            new Argument(new Identifier(tree.loc(), "a2"), tree.ref(i)),
            new Argument(new Identifier(tree.loc(), "a1"), tree.ref(x)));
    assertThat(tree.check(loop(i, tree.call(tree.ref(sub), args)))).isEmpty();

    ImmutableList<Argument> swapped =
        ImmutableList.of(
            new Argument(new Identifier(tree.loc(), "a2"), tree.ref(x)),
            new Argument(new Identifier(tree.loc(), "a1"), tree.ref(i)));
    assertContainsError(
        tree.check(loop(i, tree.call(tree.ref(sub), swapped))), "Cannot redefine DO variable 'i'");
  }

  @Test
  public void testExpressionArgumentIsNotRedefined() {
    Symbol sub = tree.subroutine("sub", ImmutableSet.of(), Intent.OUT);
    Expression sum =
        new BinaryOperatorExpression(
            tree.ref(i), Operator.PLUS, tree.lit(1));
    assertThat(tree.check(loop(i, tree.call(sub, sum)))).isEmpty();
  }

  @Test
  public void testIntentOutArgumentOfFunction() {
    Symbol f = tree.function("f", ImmutableSet.of(Attr.PURE), Intent.OUT);
    Symbol x = tree.integer("x");
    assertContainsError(
        tree.check(loop(i, tree.assign(x, tree.functionRef(f, tree.ref(i))))),
        "Cannot redefine DO variable 'i'");
  }

  @Test
  public void testIostat() {
    assertContainsError(
        tree.check(loop(i, io(IoKind.READ, SpecifierKind.IOSTAT, tree.ref(i)))),
        "Cannot redefine DO variable 'i'");
  }

  @Test
  public void testSpecifiersThatSetVariables() {
    assertContainsError(
        tree.check(loop(i, io(IoKind.OPEN, SpecifierKind.NEWUNIT, tree.ref(i)))),
        "Cannot redefine DO variable 'i'");
    assertContainsError(
        tree.check(loop(i, io(IoKind.INQUIRE, SpecifierKind.RECL, tree.ref(i)))),
        "Cannot redefine DO variable 'i'");
    assertContainsError(
        tree.check(loop(i, io(IoKind.READ, SpecifierKind.SIZE, tree.ref(i)))),
        "Cannot redefine DO variable 'i'");
  }

  @Test
  public void testSpecifiersThatReadVariablesAreValid() {
    assertThat(tree.check(loop(i, io(IoKind.READ, SpecifierKind.REC, tree.ref(i))))).isEmpty();
    assertThat(tree.check(loop(i, io(IoKind.WRITE, SpecifierKind.POS, tree.ref(i))))).isEmpty();
  }

  @Test
  public void testImpliedDoVariable() {
    Symbol a = tree.integer("a");
    IoImpliedDo impliedDo =
        new IoImpliedDo(
            tree.loc(),
            ImmutableList.<Node>of(tree.ref(a)),
            tree.ref(i),
            tree.lit(1),
            tree.lit(3),
            null);
    IoStatement print =
        new IoStatement(
            tree.loc(), IoKind.PRINT, ImmutableList.of(), ImmutableList.<Node>of(impliedDo));
    Diagnostic diagnostic =
        assertContainsError(tree.check(loop(i, print)), "Cannot redefine DO variable 'i'");
    assertThat(diagnostic.location()).isEqualTo(impliedDo.getVariable().getStartLocation());
  }

  @Test
  public void testStatVariable() {
    Symbol a =
        tree.variable(
            tree.unitScope, "a", DeclTypeSpec.intrinsic(TypeCategory.REAL), Attr.ALLOCATABLE);
    AllocateStatement allocate =
        new AllocateStatement(tree.loc(), ImmutableList.of(tree.ref(a)), tree.ref(i));
    assertContainsError(tree.check(loop(i, allocate)), "Cannot redefine DO variable 'i'");
  }

  @Test
  public void testStatVariableOfCriticalConstruct() {
    CriticalConstruct critical =
        new CriticalConstruct(
            tree.loc(), null, tree.ref(i), ImmutableList.of(tree.continueStmt()), tree.loc());
    assertContainsError(tree.check(loop(i, critical)), "Cannot redefine DO variable 'i'");
  }
}
