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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import java.util.Objects;
import net.fortran.java.syntax.Location;

/**
 * A Diagnostic reports a violation of a constraint of the language, or a nonconforming or
 * questionable use of it, at a location in the source. It may carry attachments: secondary
 * messages at related locations, such as the loop that a statement may not leave.
 */
public final class Diagnostic {

  /** The severity of a diagnostic. */
  public enum Severity {
    ERROR,
    WARNING;

    @Override
    public String toString() {
      return Ascii.toLowerCase(name());
    }
  }

  /** A secondary message at a related location. */
  public static final class Attachment {
    private final Location location;
    private final String message;

    Attachment(Location location, String message) {
      this.location = Preconditions.checkNotNull(location);
      this.message = Preconditions.checkNotNull(message);
    }

    public Location location() {
      return location;
    }

    public String message() {
      return message;
    }

    @Override
    public boolean equals(Object that) {
      return that instanceof Attachment
          && ((Attachment) that).location.equals(location)
          && ((Attachment) that).message.equals(message);
    }

    @Override
    public int hashCode() {
      return Objects.hash(location, message);
    }

    @Override
    public String toString() {
      return location + ": " + message;
    }
  }

  private final Location location;
  private final String message;
  private final Severity severity;
  private final ImmutableList<Attachment> attachments;

  private Diagnostic(
      Location location, String message, Severity severity, ImmutableList<Attachment> attachments) {
    this.location = location;
    this.message = message;
    this.severity = severity;
    this.attachments = attachments;
  }

  /** Returns the location of the diagnostic. */
  public Location location() {
    return location;
  }

  /** Returns the message, without location or severity. */
  public String message() {
    return message;
  }

  public Severity severity() {
    return severity;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  /** Returns the attachments, in the order they were added. */
  public ImmutableList<Attachment> attachments() {
    return attachments;
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof Diagnostic)) {
      return false;
    }
    Diagnostic other = (Diagnostic) that;
    return location.equals(other.location)
        && message.equals(other.message)
        && severity == other.severity
        && attachments.equals(other.attachments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(location, message, severity, attachments);
  }

  /**
   * Returns a string of the form {@code "file.f90:3:5: error: message"}, followed by one indented
   * line per attachment.
   */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(location).append(": ").append(severity).append(": ").append(message);
    for (Attachment attachment : attachments) {
      buf.append("\n  ").append(attachment);
    }
    return buf.toString();
  }

  /**
   * Returns a string of the diagnostics in the list, one or more lines each, separated by
   * newlines.
   */
  public static String toString(List<Diagnostic> diagnostics) {
    StringBuilder buf = new StringBuilder();
    for (Diagnostic diagnostic : diagnostics) {
      buf.append(diagnostic).append('\n');
    }
    return buf.toString();
  }

  /** Returns the number of errors in the list, ignoring warnings. */
  public static int countErrors(List<Diagnostic> diagnostics) {
    int count = 0;
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        count++;
      }
    }
    return count;
  }

  static Builder builder(Severity severity, Location location, String message) {
    return new Builder(severity, location, message);
  }

  /**
   * A diagnostic under construction. The checks report a diagnostic as soon as the violation is
   * found, and may then attach notes to it.
   */
  public static final class Builder {
    private final Severity severity;
    private final Location location;
    private final String message;
    private final ImmutableList.Builder<Attachment> attachments = ImmutableList.builder();

    private Builder(Severity severity, Location location, String message) {
      this.severity = Preconditions.checkNotNull(severity);
      this.location = Preconditions.checkNotNull(location);
      this.message = Preconditions.checkNotNull(message);
    }

    /** Attaches a formatted note at a related location. */
    @CanIgnoreReturnValue
    @FormatMethod
    public Builder attach(Location location, String format, Object... args) {
      attachments.add(new Attachment(location, String.format(format, args)));
      return this;
    }

    public Diagnostic build() {
      return new Diagnostic(location, message, severity, attachments.build());
    }
  }
}
