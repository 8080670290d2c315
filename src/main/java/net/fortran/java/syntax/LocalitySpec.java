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
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A locality spec of a DO CONCURRENT statement: {@code LOCAL(names)}, {@code LOCAL_INIT(names)},
 * {@code SHARED(names)} or {@code DEFAULT(NONE)}.
 *
 * <p>The names are the source names as written. Name resolution gives each LOCAL, LOCAL_INIT and
 * SHARED name a symbol of its own in the construct scope, so the identifiers here are not
 * resolved.
 */
public final class LocalitySpec {

  /** The kinds of locality spec. */
  public enum LocalityKind {
    LOCAL,
    LOCAL_INIT,
    SHARED,
    DEFAULT_NONE;
  }

  private final Location location;
  private final LocalityKind localityKind;
  private final ImmutableList<Identifier> names;

  private LocalitySpec(
      Location location, LocalityKind localityKind, ImmutableList<Identifier> names) {
    this.location = Preconditions.checkNotNull(location);
    this.localityKind = localityKind;
    this.names = names;
  }

  /** Returns a LOCAL, LOCAL_INIT or SHARED spec naming the given variables. */
  public static LocalitySpec of(
      Location location, LocalityKind localityKind, ImmutableList<Identifier> names) {
    Preconditions.checkArgument(
        localityKind != LocalityKind.DEFAULT_NONE, "DEFAULT(NONE) has no names");
    Preconditions.checkArgument(!names.isEmpty(), "%s without names", localityKind);
    return new LocalitySpec(location, localityKind, names);
  }

  /** Returns a {@code DEFAULT(NONE)} spec. */
  public static LocalitySpec defaultNone(Location location) {
    return new LocalitySpec(location, LocalityKind.DEFAULT_NONE, ImmutableList.of());
  }

  public Location getLocation() {
    return location;
  }

  public LocalityKind getLocalityKind() {
    return localityKind;
  }

  /** Returns the names, empty for DEFAULT(NONE). */
  public ImmutableList<Identifier> getNames() {
    return names;
  }

  @Override
  public String toString() {
    return localityKind == LocalityKind.DEFAULT_NONE
        ? "default(none)"
        : Ascii.toLowerCase(localityKind.name()) + "(" + Joiner.on(", ").join(names) + ")";
  }
}
