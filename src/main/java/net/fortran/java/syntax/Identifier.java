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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import javax.annotation.Nullable;
import net.fortran.java.symbols.Symbol;

/**
 * Syntax node for a name. Names are case-insensitive and are stored in lower case.
 *
 * <p>Name resolution attaches the {@link Symbol} that the name denotes. Construct names and
 * keyword argument names have no symbol.
 */
public final class Identifier extends Expression {

  private final String name;

  // set by name resolution
  @Nullable private Symbol symbol;

  public Identifier(Location start, String name) {
    super(start, Kind.IDENTIFIER);
    this.name = Ascii.toLowerCase(name);
  }

  /** Returns the name, in lower case. */
  public String getName() {
    return name;
  }

  /** Returns the symbol this name denotes, or null if it was not resolved. */
  @Nullable
  public Symbol getSymbol() {
    return symbol;
  }

  /** Records the resolved symbol. Called by name resolution, at most once. */
  public void setSymbol(Symbol symbol) {
    Preconditions.checkState(this.symbol == null, "'%s' already resolved", name);
    this.symbol = Preconditions.checkNotNull(symbol);
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
