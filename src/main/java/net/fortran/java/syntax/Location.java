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

import com.google.common.base.Preconditions;
import java.util.Comparator;
import java.util.Objects;

/**
 * A Location denotes a position within a source file: a file name, a 1-based line number, and a
 * 1-based column number. A zero line or column means "unknown".
 *
 * <p>Locations are ordered by file, then line, then column, which is source order for a single
 * file.
 */
public final class Location implements Comparable<Location> {

  private static final Comparator<Location> ORDER =
      Comparator.comparing((Location loc) -> loc.file)
          .thenComparingInt(loc -> loc.line)
          .thenComparingInt(loc -> loc.column);

  private final String file;
  private final int line;
  private final int column;

  private Location(String file, int line, int column) {
    this.file = Preconditions.checkNotNull(file);
    this.line = line;
    this.column = column;
  }

  /** Returns a Location for the given file, line and column. */
  public static Location fromFileLineColumn(String file, int line, int column) {
    Preconditions.checkArgument(line >= 0 && column >= 0, "negative line or column");
    return new Location(file, line, column);
  }

  /** Returns a Location for the given file, with unknown line and column. */
  public static Location fromFile(String file) {
    return new Location(file, 0, 0);
  }

  /** The placeholder location of entities with no source, such as intrinsic procedures. */
  public static final Location BUILTIN = fromFile("<builtin>");

  /** Returns the name of the file containing this location. */
  public String file() {
    return file;
  }

  /** Returns the line number of this location, or zero if unknown. */
  public int line() {
    return line;
  }

  /** Returns the column number of this location, or zero if unknown. */
  public int column() {
    return column;
  }

  @Override
  public int compareTo(Location that) {
    return ORDER.compare(this, that);
  }

  /** Formats the location as {@code "file:line:column"}, omitting unknown parts. */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof Location loc
            && this.file.equals(loc.file)
            && this.line == loc.line
            && this.column == loc.column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }
}
