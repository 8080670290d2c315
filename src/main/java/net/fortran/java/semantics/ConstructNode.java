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
import javax.annotation.Nullable;
import net.fortran.java.syntax.BlockConstruct;
import net.fortran.java.syntax.ChangeTeamConstruct;
import net.fortran.java.syntax.Construct;
import net.fortran.java.syntax.CriticalConstruct;
import net.fortran.java.syntax.DoConstruct;
import net.fortran.java.syntax.Identifier;
import net.fortran.java.syntax.IfConstruct;
import net.fortran.java.syntax.Location;

/**
 * An open construct on the {@link ConstructStack}. It refers to, but does not copy, the syntax
 * node of the construct.
 *
 * <p>The kinds of ConstructNode are closed; code that behaves differently per kind switches over
 * {@link #kind()}.
 */
public abstract sealed class ConstructNode {

  /** The kinds of open construct. */
  public enum Kind {
    /** A DO loop of any form, including DO CONCURRENT. */
    DO,
    CRITICAL,
    CHANGE_TEAM,
    /** Any other construct that may be named by an EXIT statement, such as BLOCK or IF. */
    LABELED;
  }

  private final Construct construct;

  private ConstructNode(Construct construct) {
    this.construct = Preconditions.checkNotNull(construct);
  }

  /** Returns the ConstructNode of the appropriate kind for a construct. */
  public static ConstructNode of(Construct construct) {
    if (construct instanceof DoConstruct doConstruct) {
      return new Do(doConstruct);
    } else if (construct instanceof CriticalConstruct critical) {
      return new Critical(critical);
    } else if (construct instanceof ChangeTeamConstruct changeTeam) {
      return new ChangeTeam(changeTeam);
    } else if (construct instanceof BlockConstruct || construct instanceof IfConstruct) {
      return new Labeled(construct);
    }
    throw new IllegalArgumentException("not a construct: " + construct.kind());
  }

  public abstract Kind kind();

  /** Returns the syntax node of the construct. */
  public Construct getConstruct() {
    return construct;
  }

  /** Returns the construct name, or null. */
  @Nullable
  public Identifier getName() {
    return construct.getName();
  }

  /** Returns the location of the construct statement. */
  public Location getLocation() {
    return construct.getStartLocation();
  }

  /** Reports whether this is a DO CONCURRENT loop. */
  public boolean isDoConcurrent() {
    return this instanceof Do d && d.getDoConstruct().isDoConcurrent();
  }

  @Override
  public String toString() {
    return kind() + (getName() != null ? " " + getName() : "") + " at " + getLocation();
  }

  /** An open DO loop. */
  public static final class Do extends ConstructNode {
    private Do(DoConstruct construct) {
      super(construct);
    }

    @Override
    public Kind kind() {
      return Kind.DO;
    }

    public DoConstruct getDoConstruct() {
      return (DoConstruct) getConstruct();
    }
  }

  /** An open CRITICAL construct. */
  public static final class Critical extends ConstructNode {
    private Critical(CriticalConstruct construct) {
      super(construct);
    }

    @Override
    public Kind kind() {
      return Kind.CRITICAL;
    }
  }

  /** An open CHANGE TEAM construct. */
  public static final class ChangeTeam extends ConstructNode {
    private ChangeTeam(ChangeTeamConstruct construct) {
      super(construct);
    }

    @Override
    public Kind kind() {
      return Kind.CHANGE_TEAM;
    }
  }

  /** Another open construct, which matters only as the target of a named EXIT. */
  public static final class Labeled extends ConstructNode {
    private Labeled(Construct construct) {
      super(construct);
    }

    @Override
    public Kind kind() {
      return Kind.LABELED;
    }
  }
}
