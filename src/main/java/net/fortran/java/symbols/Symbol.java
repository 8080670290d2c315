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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Set;
import javax.annotation.Nullable;
import net.fortran.java.syntax.Expression;
import net.fortran.java.syntax.Location;

/**
 * A Symbol is a declared entity: a variable, a procedure, a derived type, a module, or a name that
 * is associated with some other entity by use, host or construct association.
 *
 * <p>Symbols are compared by identity. Two symbols with the same name in different scopes, or an
 * associated name and the entity it refers to, are distinct symbols; {@link #getUltimate} and
 * {@link #getAssociationRoot} follow the associations.
 *
 * <p>Symbols are created only by {@link Scope#declare}.
 */
public final class Symbol {

  private final String name;
  private final Scope owner;
  private final Location location;
  private final ImmutableSet<Attr> attrs;
  private final Details details;

  Symbol(String name, Scope owner, Location location, Set<Attr> attrs, Details details) {
    this.name = name;
    this.owner = owner;
    this.location = location;
    this.attrs = Sets.immutableEnumSet(attrs);
    this.details = Preconditions.checkNotNull(details);
  }

  /** Returns the name of the symbol, in lower case. */
  public String getName() {
    return name;
  }

  /** Returns the scope in which the symbol is declared. */
  public Scope getOwner() {
    return owner;
  }

  /** Returns the location of the declaration. */
  public Location getLocation() {
    return location;
  }

  public ImmutableSet<Attr> getAttrs() {
    return attrs;
  }

  public boolean hasAttr(Attr attr) {
    return attrs.contains(attr);
  }

  public Details getDetails() {
    return details;
  }

  /** Follows use and host associations to the entity they name. */
  public Symbol getUltimate() {
    Symbol symbol = this;
    while (symbol.details instanceof UseAssociation || symbol.details instanceof HostAssociation) {
      symbol = ((Association) symbol.details).getTarget();
    }
    return symbol;
  }

  /**
   * Follows use, host and construct associations to the underlying entity. An associate name whose
   * selector is not a variable is its own root.
   */
  public Symbol getAssociationRoot() {
    Symbol symbol = getUltimate();
    while (symbol.details instanceof ConstructAssociation assoc && assoc.getTarget() != null) {
      symbol = assoc.getTarget().getUltimate();
    }
    return symbol;
  }

  /** Returns the declared type, or null for typeless entities such as modules and subroutines. */
  @Nullable
  public DeclTypeSpec getType() {
    Details d = getUltimate().details;
    if (d instanceof ObjectEntity entity) {
      return entity.getType();
    } else if (d instanceof Procedure procedure) {
      return procedure.getResultType();
    } else if (d instanceof ConstructAssociation assoc) {
      if (assoc.getType() != null) {
        return assoc.getType();
      }
      return assoc.getTarget() != null ? assoc.getTarget().getType() : null;
    }
    return null;
  }

  public boolean isAllocatable() {
    return getUltimate().hasAttr(Attr.ALLOCATABLE);
  }

  public boolean isPointer() {
    return getUltimate().hasAttr(Attr.POINTER);
  }

  /** Reports whether the entity is a coarray, that is, has a nonzero corank. */
  public boolean isCoarray() {
    return getUltimate().details instanceof ObjectEntity entity && entity.getCorank() > 0;
  }

  /** Reports whether the entity is allocatable and of a polymorphic type. */
  public boolean isPolymorphicAllocatable() {
    DeclTypeSpec type = getType();
    return isAllocatable() && type != null && type.isPolymorphic();
  }

  /** Reports whether the name denotes a variable: a data object that is not a named constant. */
  public boolean isVariableName() {
    Symbol root = getAssociationRoot();
    return root.details instanceof ObjectEntity && !root.hasAttr(Attr.PARAMETER);
  }

  public boolean isProcedure() {
    return getUltimate().details instanceof Procedure;
  }

  /**
   * Reports whether the name denotes a pure procedure: one declared PURE, or ELEMENTAL and not
   * IMPURE.
   */
  public boolean isPureProcedure() {
    Symbol ultimate = getUltimate();
    if (!(ultimate.details instanceof Procedure)) {
      return false;
    }
    return ultimate.hasAttr(Attr.PURE)
        || (ultimate.hasAttr(Attr.ELEMENTAL) && !ultimate.hasAttr(Attr.IMPURE));
  }

  @Override
  public String toString() {
    return name;
  }

  // ==== Details ====

  /** What kind of entity a symbol is, and the facts specific to that kind. */
  public abstract static sealed class Details
      permits ObjectEntity, Procedure, Association, DerivedType, Module {}

  /** A data object: a variable, named constant, dummy data argument, or component. */
  public static final class ObjectEntity extends Details {
    @Nullable private final DeclTypeSpec type;
    private final int corank;
    private final Intent intent;
    @Nullable private final Expression initialization; // the value of a named constant

    public ObjectEntity(
        @Nullable DeclTypeSpec type,
        int corank,
        Intent intent,
        @Nullable Expression initialization) {
      Preconditions.checkArgument(corank >= 0, "negative corank");
      this.type = type;
      this.corank = corank;
      this.intent = Preconditions.checkNotNull(intent);
      this.initialization = initialization;
    }

    public ObjectEntity(@Nullable DeclTypeSpec type, int corank, Intent intent) {
      this(type, corank, intent, null);
    }

    public ObjectEntity(@Nullable DeclTypeSpec type) {
      this(type, 0, Intent.DEFAULT, null);
    }

    @Nullable
    public DeclTypeSpec getType() {
      return type;
    }

    public int getCorank() {
      return corank;
    }

    public Intent getIntent() {
      return intent;
    }

    @Nullable
    public Expression getInitialization() {
      return initialization;
    }
  }

  /**
   * A procedure: an external, module, internal or intrinsic subprogram, or a procedure pointer
   * component. Its dummy arguments are listed in order; their intents govern what a call may
   * modify.
   */
  public static final class Procedure extends Details {
    private final ImmutableList<Symbol> dummies;
    @Nullable private final DeclTypeSpec resultType; // null for subroutines

    public Procedure(ImmutableList<Symbol> dummies, @Nullable DeclTypeSpec resultType) {
      this.dummies = dummies;
      this.resultType = resultType;
    }

    public ImmutableList<Symbol> getDummies() {
      return dummies;
    }

    @Nullable
    public DeclTypeSpec getResultType() {
      return resultType;
    }

    public boolean isFunction() {
      return resultType != null;
    }

    /** Returns the dummy argument of the given name, or null. */
    @Nullable
    public Symbol findDummy(String name) {
      for (Symbol dummy : dummies) {
        if (dummy.getName().equals(name)) {
          return dummy;
        }
      }
      return null;
    }
  }

  /** A name that refers to another entity. */
  public abstract static sealed class Association extends Details
      permits UseAssociation, HostAssociation, ConstructAssociation {
    @Nullable private final Symbol target;

    Association(@Nullable Symbol target) {
      this.target = target;
    }

    @Nullable
    public Symbol getTarget() {
      return target;
    }
  }

  /** A name made accessible by a USE statement. */
  public static final class UseAssociation extends Association {
    public UseAssociation(Symbol target) {
      super(Preconditions.checkNotNull(target));
    }
  }

  /** A name of the host scope that is referenced in a contained scope. */
  public static final class HostAssociation extends Association {
    public HostAssociation(Symbol target) {
      super(Preconditions.checkNotNull(target));
    }
  }

  /**
   * An associate name of an ASSOCIATE, SELECT TYPE or similar construct. The target is the
   * selector's variable, or null when the selector is an expression.
   */
  public static final class ConstructAssociation extends Association {
    @Nullable private final DeclTypeSpec type;

    public ConstructAssociation(@Nullable Symbol target, @Nullable DeclTypeSpec type) {
      super(target);
      this.type = type;
    }

    @Nullable
    public DeclTypeSpec getType() {
      return type;
    }
  }

  /** A derived type name. */
  public static final class DerivedType extends Details {
    private final Scope componentScope;

    public DerivedType(Scope componentScope) {
      Preconditions.checkArgument(componentScope.getKind() == Scope.Kind.DERIVED_TYPE);
      this.componentScope = componentScope;
    }

    public Scope getComponentScope() {
      return componentScope;
    }
  }

  /** A module name. */
  public static final class Module extends Details {
    private final Scope scope;

    public Module(Scope scope) {
      Preconditions.checkArgument(scope.getKind() == Scope.Kind.MODULE);
      this.scope = scope;
    }

    public Scope getScope() {
      return scope;
    }
  }
}
