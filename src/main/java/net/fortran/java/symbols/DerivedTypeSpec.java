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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A reference to a derived type, as it appears in {@code TYPE(t)} or {@code CLASS(t)}. It wraps
 * the symbol of the type name, whose details hold the scope of the type's components.
 */
public final class DerivedTypeSpec {

  private final Symbol typeSymbol;

  public DerivedTypeSpec(Symbol typeSymbol) {
    Preconditions.checkArgument(
        typeSymbol.getDetails() instanceof Symbol.DerivedType,
        "'%s' is not a derived type",
        typeSymbol);
    this.typeSymbol = typeSymbol;
  }

  public Symbol getTypeSymbol() {
    return typeSymbol;
  }

  public String getName() {
    return typeSymbol.getName();
  }

  /** Returns the scope holding the component symbols, in declaration order. */
  public Scope getComponentScope() {
    return ((Symbol.DerivedType) typeSymbol.getDetails()).getComponentScope();
  }

  /**
   * Returns the ultimate components of the type, in declaration order.
   *
   * <p>An ultimate component is one of intrinsic type, or with the ALLOCATABLE or POINTER
   * attribute, or a procedure pointer. A component of derived type that is neither allocatable nor
   * a pointer is not itself ultimate: its own ultimate components are, recursively.
   */
  public ImmutableList<Symbol> ultimateComponents() {
    ImmutableList.Builder<Symbol> result = ImmutableList.builder();
    collectUltimateComponents(this, result);
    return result.build();
  }

  private static void collectUltimateComponents(
      DerivedTypeSpec type, ImmutableList.Builder<Symbol> result) {
    for (Symbol component : type.getComponentScope()) {
      DeclTypeSpec componentType = component.getType();
      DerivedTypeSpec derived = componentType != null ? componentType.asDerived() : null;
      if (derived != null
          && !component.isAllocatable()
          && !component.isPointer()
          && component.getDetails() instanceof Symbol.ObjectEntity) {
        collectUltimateComponents(derived, result);
      } else {
        result.add(component);
      }
    }
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof DerivedTypeSpec && ((DerivedTypeSpec) that).typeSymbol == typeSymbol;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(typeSymbol);
  }

  @Override
  public String toString() {
    return typeSymbol.getName();
  }
}
