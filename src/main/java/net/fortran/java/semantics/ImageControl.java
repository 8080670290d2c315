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

import javax.annotation.Nullable;
import net.fortran.java.evaluate.Expressions;
import net.fortran.java.symbols.Attr;
import net.fortran.java.symbols.Symbol;
import net.fortran.java.syntax.AllocateStatement;
import net.fortran.java.syntax.Argument;
import net.fortran.java.syntax.CallStatement;
import net.fortran.java.syntax.DeallocateStatement;
import net.fortran.java.syntax.Expression;
import net.fortran.java.syntax.Identifier;
import net.fortran.java.syntax.Statement;

/**
 * Classifies image control statements: statements that synchronize or communicate between images.
 * They are the SYNC, EVENT, FORM TEAM, LOCK and UNLOCK statements, the CRITICAL and CHANGE TEAM
 * constructs, ALLOCATE and DEALLOCATE of a coarray, and a call of MOVE_ALLOC with coarray
 * arguments.
 */
final class ImageControl {

  private ImageControl() {}

  /** Reports whether a statement is an image control statement. */
  static boolean isImageControl(Statement stmt) {
    switch (stmt.kind()) {
      case IMAGE_CONTROL:
      case CRITICAL:
      case CHANGE_TEAM:
        return true;
      case ALLOCATE:
      case DEALLOCATE:
      case CALL:
        return getCoarray(stmt) != null;
      default:
        return false;
    }
  }

  /**
   * Returns a note naming the coarray that makes an ALLOCATE, DEALLOCATE or MOVE_ALLOC statement an
   * image control statement, or null for other statements.
   */
  @Nullable
  static String getCoarrayNote(Statement stmt) {
    Symbol coarray = getCoarray(stmt);
    if (coarray == null) {
      return null;
    }
    String statement;
    switch (stmt.kind()) {
      case ALLOCATE:
        statement = "ALLOCATE";
        break;
      case DEALLOCATE:
        statement = "DEALLOCATE";
        break;
      default:
        statement = "MOVE_ALLOC";
        break;
    }
    return String.format(
        "%s of coarray '%s' is an image control statement", statement, coarray.getName());
  }

  @Nullable
  private static Symbol getCoarray(Statement stmt) {
    if (stmt instanceof AllocateStatement allocate) {
      return findCoarray(allocate.getObjects());
    } else if (stmt instanceof DeallocateStatement deallocate) {
      return findCoarray(deallocate.getObjects());
    } else if (stmt instanceof CallStatement call && isMoveAlloc(call.getProcedure())) {
      for (Argument arg : call.getArguments()) {
        Symbol symbol = Expressions.unwrapWholeSymbol(arg.getValue());
        if (symbol != null && symbol.isCoarray()) {
          return symbol;
        }
      }
    }
    return null;
  }

  @Nullable
  private static Symbol findCoarray(Iterable<Expression> objects) {
    for (Expression object : objects) {
      Identifier name = Expressions.getLastName(object);
      if (name != null && name.getSymbol() != null && name.getSymbol().isCoarray()) {
        return name.getSymbol();
      }
    }
    return null;
  }

  private static boolean isMoveAlloc(Expression procedure) {
    if (!(procedure instanceof Identifier id) || id.getSymbol() == null) {
      return false;
    }
    Symbol ultimate = id.getSymbol().getUltimate();
    return ultimate.hasAttr(Attr.INTRINSIC) && ultimate.getName().equals("move_alloc");
  }
}
