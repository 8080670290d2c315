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
import net.fortran.java.symbols.Intent;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.syntax.ChangeTeamConstruct;
import net.fortran.java.syntax.CriticalConstruct;
import net.fortran.java.syntax.DeallocateStatement;
import net.fortran.java.syntax.ImageControlStatement;
import net.fortran.java.syntax.ImageControlStatement.ImageControlKind;
import net.fortran.java.syntax.ReturnStatement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the constraints on the bodies of CRITICAL and CHANGE TEAM constructs. */
@RunWith(JUnit4.class)
public class CoarrayConstructTest {

  private final TreeFixture tree = new TreeFixture();

  private ImageControlStatement syncAll() {
    return new ImageControlStatement(tree.loc(), ImageControlKind.SYNC_ALL, null, null);
  }

  @Test
  public void testEmptyCriticalIsValid() {
    assertThat(tree.check(tree.critical(tree.continueStmt()))).isEmpty();
  }

  @Test
  public void testReturnInCritical() {
    CriticalConstruct critical = tree.critical(new ReturnStatement(tree.loc()));
    Diagnostic diagnostic =
        assertContainsError(
            tree.check(critical), "RETURN statement is not allowed in a CRITICAL construct");
    assertThat(diagnostic.attachments().get(0).message())
        .isEqualTo("Enclosing CRITICAL statement");
    assertThat(diagnostic.attachments().get(0).location())
        .isEqualTo(critical.getStartLocation());
  }

  @Test
  public void testImageControlInCritical() {
    assertThat(messages(tree.check(tree.critical(syncAll()))))
        .containsExactly("An image control statement is not allowed in a CRITICAL construct");
  }

  @Test
  public void testNestedCritical() {
    assertThat(messages(tree.check(tree.critical(tree.critical(tree.continueStmt())))))
        .containsExactly("An image control statement is not allowed in a CRITICAL construct");
  }

  @Test
  public void testDeallocateOfCoarrayInCritical() {
    Symbol ca = tree.coarray("ca");
    Diagnostic diagnostic =
        assertContainsError(
            tree.check(
                tree.critical(
                    new DeallocateStatement(tree.loc(), ImmutableList.of(tree.ref(ca)), null))),
            "An image control statement is not allowed in a CRITICAL construct");
    assertThat(diagnostic.attachments().get(0).message())
        .isEqualTo("DEALLOCATE of coarray 'ca' is an image control statement");
  }

  @Test
  public void testMoveAllocOfCoarray() {
    Symbol moveAlloc =
        tree.subroutine(
            "move_alloc", ImmutableSet.of(Attr.INTRINSIC, Attr.PURE), Intent.IN_OUT, Intent.OUT);
    Symbol from = tree.coarray("from");
    Symbol to = tree.coarray("to");
    Diagnostic diagnostic =
        assertContainsError(
            tree.check(tree.critical(tree.call(moveAlloc, tree.ref(from), tree.ref(to)))),
            "An image control statement is not allowed in a CRITICAL construct");
    assertThat(diagnostic.attachments().get(0).message())
        .isEqualTo("MOVE_ALLOC of coarray 'from' is an image control statement");
  }

  @Test
  public void testOtherCallWithCoarrayIsValid() {
    Symbol sub = tree.subroutine("sub", ImmutableSet.of(), Intent.IN);
    Symbol ca = tree.coarray("ca");
    assertThat(tree.check(tree.critical(tree.call(sub, tree.ref(ca))))).isEmpty();
  }

  @Test
  public void testViolationsInNestedLoopsOfCritical() {
    TreeFixture.ConcurrentBuilder loop = tree.concurrent().index("i");
    loop.body(new ReturnStatement(tree.loc()));
    List<Diagnostic> diagnostics = tree.check(tree.critical(loop.build()));
    assertThat(messages(diagnostics))
        .containsExactly(
            "RETURN is not allowed in DO CONCURRENT",
            "RETURN statement is not allowed in a CRITICAL construct")
        .inOrder();
  }

  @Test
  public void testBranchOutOfCritical() {
    CriticalConstruct critical = tree.critical(tree.goTo(50));
    Diagnostic diagnostic =
        assertContainsError(
            tree.check(critical, TreeFixture.labeled(50, tree.continueStmt())),
            "Control flow escapes from CRITICAL");
    assertThat(diagnostic.attachments().get(0).message())
        .isEqualTo("Enclosing CRITICAL statement");
  }

  @Test
  public void testBranchToEndOfCriticalIsValid() {
    CriticalConstruct critical = tree.critical(tree.goTo(50), tree.continueStmt());
    critical.setEndLabel(50);
    assertThat(tree.check(critical)).isEmpty();
  }

  @Test
  public void testBranchWithinNestedLoopOfCritical() {
    Symbol k = tree.integer("k");
    CriticalConstruct critical =
        tree.critical(
            tree.doLoop(
                k,
                tree.lit(1),
                tree.lit(3),
                null,
                tree.goTo(60),
                TreeFixture.labeled(60, tree.continueStmt())));
    assertThat(tree.check(critical)).isEmpty();
  }

  @Test
  public void testBranchOutOfChangeTeam() {
    Symbol team = tree.integer("team");
    ChangeTeamConstruct changeTeam = tree.changeTeam(tree.ref(team), tree.goTo(70));
    List<Diagnostic> diagnostics =
        tree.check(changeTeam, TreeFixture.labeled(70, tree.continueStmt()));
    Diagnostic diagnostic =
        assertContainsError(diagnostics, "Control flow escapes from CHANGE TEAM");
    assertThat(diagnostic.attachments().get(0).message())
        .isEqualTo("Enclosing CHANGE TEAM statement");
    assertThat(diagnostic.attachments().get(0).location())
        .isEqualTo(changeTeam.getStartLocation());
  }

  @Test
  public void testChangeTeamMayContainImageControlAndReturn() {
    Symbol team = tree.integer("team");
    assertThat(
            tree.check(
                tree.changeTeam(tree.ref(team), syncAll(), new ReturnStatement(tree.loc()))))
        .isEmpty();
  }
}
