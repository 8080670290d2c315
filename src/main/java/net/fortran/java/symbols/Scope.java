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

package net.fortran.java.symbols;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.fortran.java.syntax.Location;

/**
 * A Scope is a node in the tree of lexical scopes: the global scope, modules, program units,
 * BLOCK constructs, other constructs that declare names (such as DO CONCURRENT), and derived
 * types. It maps names to the {@link Symbol}s declared directly in it, in declaration order.
 *
 * <p>Scopes are built by name resolution, or by hand in tests; the checking passes only query
 * them.
 */
public final class Scope implements Iterable<Symbol> {

  /** The kinds of scope. */
  public enum Kind {
    GLOBAL,
    MODULE,
    MAIN_PROGRAM,
    SUBPROGRAM,
    BLOCK,
    CONSTRUCT,
    DERIVED_TYPE;
  }

  private final Kind kind;
  @Nullable private final Scope parent; // null for the global scope only
  @Nullable private final String name;
  private final Map<String, Symbol> symbols = new LinkedHashMap<>();

  private Scope(Kind kind, @Nullable Scope parent, @Nullable String name) {
    this.kind = kind;
    this.parent = parent;
    this.name = name == null ? null : Ascii.toLowerCase(name);
  }

  /** Returns a new global scope, the root of a scope tree. */
  public static Scope global() {
    return new Scope(Kind.GLOBAL, null, null);
  }

  /** Returns a new scope nested in this one. */
  public Scope makeChild(Kind kind, @Nullable String name) {
    Preconditions.checkArgument(kind != Kind.GLOBAL, "the global scope has no parent");
    return new Scope(kind, this, name);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isGlobal() {
    return kind == Kind.GLOBAL;
  }

  public boolean isModule() {
    return kind == Kind.MODULE;
  }

  /** Returns the enclosing scope. It is an error to call this on the global scope. */
  public Scope getParent() {
    Preconditions.checkState(parent != null, "the global scope has no parent");
    return parent;
  }

  /** Returns the name of a module, program unit, named construct or derived type, or null. */
  @Nullable
  public String getName() {
    return name;
  }

  /**
   * Declares a new symbol in this scope.
   *
   * @throws IllegalArgumentException if the name is already declared here
   */
  @CanIgnoreReturnValue
  public Symbol declare(String name, Location location, Set<Attr> attrs, Symbol.Details details) {
    String key = Ascii.toLowerCase(name);
    Preconditions.checkArgument(
        !symbols.containsKey(key), "'%s' is already declared in %s", key, this);
    Symbol symbol = new Symbol(key, this, location, attrs, details);
    symbols.put(key, symbol);
    return symbol;
  }

  /** Returns the symbol declared in this scope with the given name, or null. */
  @Nullable
  public Symbol findLocal(String name) {
    return symbols.get(Ascii.toLowerCase(name));
  }

  /**
   * Looks up a name in this scope and then in each enclosing scope in turn, and returns the first
   * symbol found, or null.
   */
  @Nullable
  public Symbol findSymbol(String name) {
    for (Scope scope = this; scope != null; scope = scope.parent) {
      Symbol symbol = scope.findLocal(name);
      if (symbol != null) {
        return symbol;
      }
    }
    return null;
  }

  /**
   * Reports whether {@code maybeAncestor} strictly contains {@code scope}, that is, is one of its
   * enclosing scopes. A scope does not contain itself.
   */
  public static boolean doesScopeContain(@Nullable Scope maybeAncestor, Scope scope) {
    if (maybeAncestor == null) {
      return false;
    }
    for (Scope s = scope.parent; s != null; s = s.parent) {
      if (s == maybeAncestor) {
        return true;
      }
    }
    return false;
  }

  /** Returns the number of symbols declared directly in this scope. */
  public int size() {
    return symbols.size();
  }

  /** Iterates over the symbols declared directly in this scope, in declaration order. */
  @Override
  public Iterator<Symbol> iterator() {
    return Iterators.unmodifiableIterator(symbols.values().iterator());
  }

  @Override
  public String toString() {
    return name == null ? kind.toString() : kind + " " + name;
  }
}
