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
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * The declared type of an entity: an intrinsic type such as {@code INTEGER}, a derived type
 * {@code TYPE(t)}, a polymorphic {@code CLASS(t)}, or the unlimited polymorphic {@code CLASS(*)}.
 */
public final class DeclTypeSpec {

  private final TypeCategory category;
  @Nullable private final DerivedTypeSpec derived; // null for intrinsic types and CLASS(*)
  private final boolean polymorphic;

  private DeclTypeSpec(
      TypeCategory category, @Nullable DerivedTypeSpec derived, boolean polymorphic) {
    this.category = category;
    this.derived = derived;
    this.polymorphic = polymorphic;
  }

  /** Returns the intrinsic type of the given category. */
  public static DeclTypeSpec intrinsic(TypeCategory category) {
    Preconditions.checkArgument(category != TypeCategory.DERIVED, "not an intrinsic category");
    return new DeclTypeSpec(category, null, false);
  }

  /** Returns the monomorphic type {@code TYPE(t)}. */
  public static DeclTypeSpec type(DerivedTypeSpec derived) {
    return new DeclTypeSpec(TypeCategory.DERIVED, Preconditions.checkNotNull(derived), false);
  }

  /** Returns the polymorphic type {@code CLASS(t)}. */
  public static DeclTypeSpec classOf(DerivedTypeSpec derived) {
    return new DeclTypeSpec(TypeCategory.DERIVED, Preconditions.checkNotNull(derived), true);
  }

  /** Returns the unlimited polymorphic type {@code CLASS(*)}. */
  public static DeclTypeSpec unlimitedPolymorphic() {
    return new DeclTypeSpec(TypeCategory.DERIVED, null, true);
  }

  public TypeCategory getCategory() {
    return category;
  }

  /** Reports whether this is the intrinsic numeric type of the given category. */
  public boolean isNumeric(TypeCategory category) {
    return category.isNumeric() && this.category == category;
  }

  /** Reports whether this is an intrinsic numeric type. */
  public boolean isNumeric() {
    return category.isNumeric();
  }

  /** Reports whether this is {@code CLASS(t)} or {@code CLASS(*)}. */
  public boolean isPolymorphic() {
    return polymorphic;
  }

  public boolean isUnlimitedPolymorphic() {
    return polymorphic && derived == null;
  }

  /** Returns the derived type of a {@code TYPE(t)} or {@code CLASS(t)}, or null. */
  @Nullable
  public DerivedTypeSpec asDerived() {
    return derived;
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof DeclTypeSpec)) {
      return false;
    }
    DeclTypeSpec other = (DeclTypeSpec) that;
    return category == other.category
        && polymorphic == other.polymorphic
        && Objects.equals(derived, other.derived);
  }

  @Override
  public int hashCode() {
    return Objects.hash(category, derived, polymorphic);
  }

  @Override
  public String toString() {
    if (category != TypeCategory.DERIVED) {
      return category.toString();
    }
    String name = derived == null ? "*" : derived.getName();
    return (polymorphic ? "CLASS(" : "TYPE(") + name + ")";
  }
}
