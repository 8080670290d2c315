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

package net.fortran.java.syntax;

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order.
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)}, {@link #visitAll}, or {@link #visitBlock} on child fields. An
 * override that does its work after calling {@code super.visit()} sees the node in post-order.
 *
 * <p>Names that never carry a symbol are not visited: construct names, the construct name of a
 * CYCLE or EXIT, keywords of keyword arguments, and the names in locality specs.
 *
 * <p>Contrary to usual Java style, it is *not* recommended to strictly group all overloads of
 * {@code visit()} together, but rather to place helper methods for a specific node type next to its
 * associated {@code visit()} overload.
 */
public class NodeVisitor {

  // visit() overloads in this class are ordered by node type, first by category (misc / construct /
  // statement / expression), then alphabetically within category.

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  // ==== Miscellaneous node types ====

  public void visit(Argument node) {
    visit(node.getValue());
  }

  public void visit(IoImpliedDo node) {
    visitAll(node.getItems());
    visit(node.getVariable());
    visit(node.getLower());
    visit(node.getUpper());
    if (node.getStep() != null) {
      visit(node.getStep());
    }
  }

  public void visit(IoSpecifier node) {
    if (node.getValue() != null) {
      visit(node.getValue());
    }
  }

  public void visit(ProgramUnit node) {
    visitBlock(node.getBody());
  }

  // ==== Construct nodes ====

  public void visit(BlockConstruct node) {
    visitBlock(node.getBody());
  }

  public void visit(ChangeTeamConstruct node) {
    visit(node.getTeam());
    if (node.getStat() != null) {
      visit(node.getStat());
    }
    visitBlock(node.getBody());
  }

  public void visit(CriticalConstruct node) {
    if (node.getStat() != null) {
      visit(node.getStat());
    }
    visitBlock(node.getBody());
  }

  public void visit(DoConstruct node) {
    if (node.getLoopControl() != null) {
      visitLoopControl(node.getLoopControl());
    }
    visitBlock(node.getBody());
  }

  /**
   * Visits the expressions of a loop control: the DO variable and bounds of a counted DO, the
   * condition of a DO WHILE, or the index names, limits, steps and mask of a DO CONCURRENT.
   */
  public final void visitLoopControl(LoopControl control) {
    if (control instanceof LoopControl.Bounds bounds) {
      visit(bounds.getVariable());
      visit(bounds.getLower());
      visit(bounds.getUpper());
      if (bounds.getStep() != null) {
        visit(bounds.getStep());
      }
    } else if (control instanceof LoopControl.While loopWhile) {
      visit(loopWhile.getCondition());
    } else if (control instanceof LoopControl.Concurrent concurrent) {
      ConcurrentHeader header = concurrent.getHeader();
      for (ConcurrentHeader.ConcurrentControl c : header.getControls()) {
        visit(c.getIndexName());
        visit(c.getLower());
        visit(c.getUpper());
        if (c.getStep() != null) {
          visit(c.getStep());
        }
      }
      if (header.getMask() != null) {
        visit(header.getMask());
      }
    }
  }

  public void visit(IfConstruct node) {
    visit(node.getCondition());
    visitBlock(node.getThenBlock());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  // ==== Statement nodes ====

  public void visit(AllocateStatement node) {
    visitAll(node.getObjects());
    if (node.getStat() != null) {
      visit(node.getStat());
    }
  }

  public void visit(AssignmentStatement node) {
    visit(node.getVariable());
    visit(node.getExpression());
  }

  public void visit(CallStatement node) {
    visit(node.getProcedure());
    visitAll(node.getArguments());
  }

  public void visit(@SuppressWarnings("unused") ContinueStatement node) {}

  public void visit(DeallocateStatement node) {
    visitAll(node.getObjects());
    if (node.getStat() != null) {
      visit(node.getStat());
    }
  }

  public void visit(@SuppressWarnings("unused") FlowStatement node) {}

  public void visit(GotoStatement node) {
    if (node.getSelector() != null) {
      visit(node.getSelector());
    }
  }

  public void visit(ImageControlStatement node) {
    if (node.getOperand() != null) {
      visit(node.getOperand());
    }
    if (node.getStat() != null) {
      visit(node.getStat());
    }
  }

  public void visit(IoStatement node) {
    visitAll(node.getSpecifiers());
    visitAll(node.getItems());
  }

  public void visit(@SuppressWarnings("unused") ReturnStatement node) {}

  // ==== Expression nodes ====

  public void visit(ArrayElement node) {
    visit(node.getBase());
    visitAll(node.getSubscripts());
  }

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(ComponentReference node) {
    visit(node.getBase());
    visit(node.getComponent());
  }

  public void visit(FunctionReference node) {
    visit(node.getProcedure());
    visitAll(node.getArguments());
  }

  public void visit(@SuppressWarnings("unused") Identifier node) {}

  public void visit(@SuppressWarnings("unused") IntLiteral node) {}

  public void visit(@SuppressWarnings("unused") LogicalLiteral node) {}

  public void visit(@SuppressWarnings("unused") RealLiteral node) {}

  public void visit(@SuppressWarnings("unused") StringLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }

  // ==== Helpers for sequences of nodes ====

  /**
   * Visits a sequence of nodes (e.g. a list of arguments).
   *
   * <p>See {@link #visitBlock} for a common case.
   */
  // Final because this method is called across completely different categories of nodes, so it is
  // usually a mistake to attempt to override it.
  public final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  /** Convenience/readability method for visiting a block of statements (e.g. a loop body). */
  public final void visitBlock(List<Statement> statements) {
    visitAll(statements);
  }
}
