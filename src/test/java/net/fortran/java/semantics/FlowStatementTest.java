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

import java.util.List;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.syntax.CriticalConstruct;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.FlowStatement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the matching of CYCLE and EXIT statements to the constructs they affect. */
@RunWith(JUnit4.class)
public class FlowStatementTest {

  private final TreeFixture tree = new TreeFixture();

  @Test
  public void testExitOutsideLoop() {
    FlowStatement exit = tree.exit(null);
    List<Diagnostic> diagnostics = tree.check(exit);
    assertThat(messages(diagnostics)).containsExactly("No matching construct for EXIT statement");
    assertThat(diagnostics.get(0).location()).isEqualTo(exit.getStartLocation());
    assertThat(diagnostics.get(0).attachments()).isEmpty();
  }

  @Test
  public void testCycleOutsideLoop() {
    assertThat(messages(tree.check(tree.cycle(null))))
        .containsExactly("No matching DO construct for CYCLE statement");
  }

  @Test
  public void testUnnamedCycleAndExitInLoop() {
    assertThat(tree.check(tree.doForever(null, tree.cycle(null), tree.exit(null)))).isEmpty();
  }

  @Test
  public void testNamedExitOfOuterLoop() {
    assertThat(
            tree.check(
                tree.doForever("outer", tree.doForever("inner", tree.exit("outer")))))
        .isEmpty();
  }

  @Test
  public void testConstructNamesAreCaseInsensitive() {
    assertThat(tree.check(tree.doForever("Outer", tree.cycle("OUTER")))).isEmpty();
  }

  @Test
  public void testUnknownConstructName() {
    assertContainsError(
        tree.check(tree.doForever("outer", tree.exit("other"))),
        "No matching construct for EXIT statement");
  }

  @Test
  public void testExitFromNamedIfConstruct() {
    assertThat(tree.check(tree.ifConstruct("blk", tree.exit("blk")))).isEmpty();
  }

  @Test
  public void testCycleOfIfConstruct() {
    assertContainsError(
        tree.check(tree.doForever(null, tree.ifConstruct("blk", tree.cycle("blk")))),
        "No matching DO construct for CYCLE statement");
  }

  @Test
  public void testUnnamedExitSkipsIfConstruct() {
    assertThat(tree.check(tree.doForever(null, tree.ifConstruct("blk", tree.exit(null)))))
        .isEmpty();
  }

  @Test
  public void testUnnamedExitInIfWithoutLoop() {
    assertContainsError(
        tree.check(tree.ifConstruct("blk", tree.exit(null))),
        "No matching construct for EXIT statement");
  }

  @Test
  public void testCycleInDoConcurrentIsValid() {
    assertThat(tree.check(tree.concurrent().index("i").body(tree.cycle(null)).build())).isEmpty();
  }

  @Test
  public void testExitOfDoConcurrent() {
    TreeFixture.ConcurrentBuilder loop = tree.concurrent().index("i");
    loop.body(tree.exit(null));
    List<Diagnostic> diagnostics = tree.check(loop.build());
    assertThat(messages(diagnostics))
        .containsExactly("EXIT must not leave a DO CONCURRENT statement");
    assertThat(diagnostics.get(0).attachments().get(0).message())
        .isEqualTo("The construct that was left");
    assertThat(diagnostics.get(0).attachments().get(0).location())
        .isEqualTo(loop.startLocation());
  }

  @Test
  public void testNamedExitOfDoConcurrent() {
    TreeFixture.ConcurrentBuilder loop = tree.concurrent().named("par").index("i");
    loop.body(tree.exit("par"));
    assertContainsError(tree.check(loop.build()), "EXIT must not leave a DO CONCURRENT statement");
  }

  @Test
  public void testCycleOfOuterLoopFromDoConcurrent() {
    Symbol k = tree.integer("k");
    DoConstruct inner = tree.concurrent().index("i").body(tree.cycle("outer")).build();
    List<Diagnostic> diagnostics =
        tree.check(tree.doLoop("outer", k, tree.lit(1), tree.lit(5), null, inner));
    assertThat(messages(diagnostics))
        .containsExactly("CYCLE must not leave a DO CONCURRENT statement");
    assertThat(diagnostics.get(0).attachments().get(0).location())
        .isEqualTo(inner.getStartLocation());
  }

  @Test
  public void testExitOfLoopFromCritical() {
    CriticalConstruct critical = tree.critical(tree.exit(null));
    List<Diagnostic> diagnostics = tree.check(tree.doForever(null, critical));
    assertThat(messages(diagnostics)).containsExactly("EXIT must not leave a CRITICAL statement");
    assertThat(diagnostics.get(0).attachments().get(0).location())
        .isEqualTo(critical.getStartLocation());
  }

  @Test
  public void testExitOfLoopFromChangeTeam() {
    Symbol team = tree.integer("team");
    List<Diagnostic> diagnostics =
        tree.check(tree.doForever(null, tree.changeTeam(tree.ref(team), tree.cycle(null))));
    assertThat(messages(diagnostics))
        .containsExactly("CYCLE must not leave a CHANGE TEAM statement");
  }

  @Test
  public void testEachLeftConstructIsReported() {
    Symbol team = tree.integer("team");
    List<Diagnostic> diagnostics =
        tree.check(
            tree.doForever(
                "outer",
                tree.changeTeam(tree.ref(team), tree.critical(tree.exit("outer")))));
    assertThat(messages(diagnostics))
        .containsExactly(
            "EXIT must not leave a CRITICAL statement",
            "EXIT must not leave a CHANGE TEAM statement")
        .inOrder();
  }

  @Test
  public void testLoopInsideCriticalIsValid() {
    assertThat(tree.check(tree.critical(tree.doForever(null, tree.exit(null))))).isEmpty();
  }
}
