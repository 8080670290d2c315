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
import java.util.List;
import net.fortran.java.symbols.Scope;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.Identifier;
import net.fortran.java.syntax.Statement;

/**
 * In a DO CONCURRENT with DEFAULT(NONE), a variable from an enclosing scope may be referenced in
 * the body only if it appears in a locality spec. Name resolution declares the variables of the
 * locality specs in the scope of the loop, so any reference to a variable owned by a scope that
 * contains the loop's scope is an error.
 */
final class DoConcurrentVariableEnforcer extends ConstructBodyVisitor {

  private final SemanticsContext context;
  private final Scope loopScope;

  DoConcurrentVariableEnforcer(SemanticsContext context, DoConstruct loop) {
    super(/* enterNestedDoConcurrentBodies= */ false);
    this.context = context;
    this.loopScope = Preconditions.checkNotNull(loop.getScope(), "DO CONCURRENT without a scope");
  }

  void enforce(List<Statement> body) {
    walk(body);
  }

  @Override
  public void visit(Identifier node) {
    Symbol symbol = node.getSymbol();
    if (symbol != null
        && symbol.isVariableName()
        && Scope.doesScopeContain(symbol.getOwner(), loopScope)) {
      context.sayWithDecl(
          symbol,
          node.getStartLocation(),
          "Variable '%s' from an enclosing scope referenced in DO CONCURRENT with DEFAULT(NONE)"
              + " must appear in a locality-spec",
          symbol.getName());
    }
  }
}
