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

package net.fortran.java.evaluate;

import com.google.common.collect.ImmutableSet;
import com.google.common.math.LongMath;
import javax.annotation.Nullable;
import net.fortran.java.symbols.Attr;
import net.fortran.java.symbols.DeclTypeSpec;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.symbols.TypeCategory;
import net.fortran.java.syntax.ArrayElement;
import net.fortran.java.syntax.BinaryOperatorExpression;
import net.fortran.java.syntax.ComponentReference;
import net.fortran.java.syntax.Expression;
import net.fortran.java.syntax.FunctionReference;
import net.fortran.java.syntax.Identifier;
import net.fortran.java.syntax.IntLiteral;
import net.fortran.java.syntax.NodeVisitor;
import net.fortran.java.syntax.Operator;
import net.fortran.java.syntax.UnaryOperatorExpression;

/**
 * Static queries over resolved expressions: the symbols they reference, their types, and their
 * values when they are integer constant expressions.
 */
public final class Expressions {

  private Expressions() {}

  /**
   * Returns the symbols referenced by an expression, in order of first reference. This includes
   * the components of component references and the procedures of function references, but not
   * argument keywords.
   */
  public static ImmutableSet<Symbol> collectSymbols(Expression expr) {
    ImmutableSet.Builder<Symbol> symbols = ImmutableSet.builder();
    new NodeVisitor() {
      @Override
      public void visit(Identifier id) {
        if (id.getSymbol() != null) {
          symbols.add(id.getSymbol());
        }
      }
    }.visit(expr);
    return symbols.build();
  }

  /** Returns the type of an expression, or null if it cannot be determined. */
  @Nullable
  public static DeclTypeSpec getType(Expression expr) {
    switch (expr.kind()) {
      case INT_LITERAL:
        return DeclTypeSpec.intrinsic(TypeCategory.INTEGER);
      case REAL_LITERAL:
        return DeclTypeSpec.intrinsic(TypeCategory.REAL);
      case LOGICAL_LITERAL:
        return DeclTypeSpec.intrinsic(TypeCategory.LOGICAL);
      case STRING_LITERAL:
        return DeclTypeSpec.intrinsic(TypeCategory.CHARACTER);
      case IDENTIFIER:
        Symbol symbol = ((Identifier) expr).getSymbol();
        return symbol != null ? symbol.getType() : null;
      case COMPONENT:
        return getType(((ComponentReference) expr).getComponent());
      case ARRAY_ELEMENT:
        return getType(((ArrayElement) expr).getBase());
      case FUNCTION_REFERENCE:
        return getType(((FunctionReference) expr).getProcedure());
      case UNARY_OPERATOR:
        UnaryOperatorExpression unary = (UnaryOperatorExpression) expr;
        if (unary.getOperator() == Operator.NOT) {
          return DeclTypeSpec.intrinsic(TypeCategory.LOGICAL);
        }
        return getType(unary.getX());
      case BINARY_OPERATOR:
        return getBinaryType((BinaryOperatorExpression) expr);
    }
    throw new IllegalStateException("unexpected expression kind: " + expr.kind());
  }

  @Nullable
  private static DeclTypeSpec getBinaryType(BinaryOperatorExpression binop) {
    Operator op = binop.getOperator();
    if (op.isRelational() || op.isLogical()) {
      return DeclTypeSpec.intrinsic(TypeCategory.LOGICAL);
    } else if (op == Operator.CONCAT) {
      return DeclTypeSpec.intrinsic(TypeCategory.CHARACTER);
    }
    DeclTypeSpec x = getType(binop.getX());
    DeclTypeSpec y = getType(binop.getY());
    if (x == null || y == null || !x.isNumeric() || !y.isNumeric()) {
      return null;
    }
    // The result of mixed-mode arithmetic has the wider of the two categories.
    return x.getCategory().ordinal() >= y.getCategory().ordinal() ? x : y;
  }

  /** Reports whether the type of an expression is known and of the given category. */
  public static boolean hasTypeCategory(Expression expr, TypeCategory category) {
    DeclTypeSpec type = getType(expr);
    return type != null && type.getCategory() == category;
  }

  /**
   * Returns the value of an integer constant expression, or null if the expression is not one.
   * Literals, named constants and the arithmetic operators are folded. An operation whose result
   * does not fit in a {@code long} is not folded.
   */
  @Nullable
  public static Long foldInteger(Expression expr) {
    switch (expr.kind()) {
      case INT_LITERAL:
        return ((IntLiteral) expr).getValue();
      case IDENTIFIER:
        return foldNamedConstant(((Identifier) expr).getSymbol());
      case UNARY_OPERATOR:
        UnaryOperatorExpression unary = (UnaryOperatorExpression) expr;
        Long x = foldInteger(unary.getX());
        if (x == null) {
          return null;
        }
        switch (unary.getOperator()) {
          case PLUS:
            return x;
          case MINUS:
            return x == Long.MIN_VALUE ? null : -x;
          default:
            return null;
        }
      case BINARY_OPERATOR:
        return foldBinary((BinaryOperatorExpression) expr);
      default:
        return null;
    }
  }

  @Nullable
  private static Long foldNamedConstant(@Nullable Symbol symbol) {
    if (symbol == null) {
      return null;
    }
    Symbol ultimate = symbol.getUltimate();
    if (ultimate.hasAttr(Attr.PARAMETER)
        && ultimate.getDetails() instanceof Symbol.ObjectEntity entity
        && entity.getInitialization() != null
        && hasTypeCategory(entity.getInitialization(), TypeCategory.INTEGER)) {
      return foldInteger(entity.getInitialization());
    }
    return null;
  }

  @Nullable
  private static Long foldBinary(BinaryOperatorExpression binop) {
    Long x = foldInteger(binop.getX());
    Long y = foldInteger(binop.getY());
    if (x == null || y == null) {
      return null;
    }
    try {
      switch (binop.getOperator()) {
        case PLUS:
          return LongMath.checkedAdd(x, y);
        case MINUS:
          return LongMath.checkedSubtract(x, y);
        case STAR:
          return LongMath.checkedMultiply(x, y);
        case SLASH:
          if (y == 0) {
            return null;
          }
          return y == -1 ? LongMath.checkedMultiply(x, -1) : x / y;
        case POWER:
          return y < 0 ? null : power(x, y);
        default:
          return null;
      }
    } catch (ArithmeticException e) {
      return null;
    }
  }

  private static long power(long base, long exponent) {
    if (exponent <= Integer.MAX_VALUE) {
      return LongMath.checkedPow(base, (int) exponent);
    }
    // Only 0, 1 and -1 raised to such an exponent fit in a long.
    if (base == 0 || base == 1) {
      return base;
    } else if (base == -1) {
      return exponent % 2 == 0 ? 1 : -1;
    }
    throw new ArithmeticException("overflow: " + base + " ** " + exponent);
  }

  /** Reports whether an expression is an integer constant expression whose value is zero. */
  public static boolean isZero(Expression expr) {
    Long value = foldInteger(expr);
    return value != null && value == 0;
  }

  /**
   * Returns the last name of a designator: {@code x} for {@code x}, {@code c} for {@code a%b%c},
   * and {@code b} for {@code a%b(i)}. Returns null if the expression is not a designator.
   */
  @Nullable
  public static Identifier getLastName(Expression expr) {
    switch (expr.kind()) {
      case IDENTIFIER:
        return (Identifier) expr;
      case COMPONENT:
        return ((ComponentReference) expr).getComponent();
      case ARRAY_ELEMENT:
        return getLastName(((ArrayElement) expr).getBase());
      default:
        return null;
    }
  }

  /**
   * Returns the symbol of an expression that is a reference to a whole variable, or null if it is
   * anything else, such as a subobject or a function result.
   */
  @Nullable
  public static Symbol unwrapWholeSymbol(Expression expr) {
    if (expr instanceof Identifier id) {
      Symbol symbol = id.getSymbol();
      if (symbol != null && symbol.isVariableName()) {
        return symbol;
      }
    }
    return null;
  }
}
