/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.gotoc.ir.tree;

import exm.gotoc.common.exceptions.GotocRuntimeError;

/**
 * Value of a symbol: nothing, an initializer expression, or
 * a function body statement.
 */
public class SymbolValue {

  public static enum ValueKind {
    NONE,
    EXPR,
    STMT,
  }

  private static final SymbolValue NONE = new SymbolValue(null, null);

  private final Expr expr;
  private final Stmt stmt;

  private SymbolValue(Expr expr, Stmt stmt) {
    this.expr = expr;
    this.stmt = stmt;
  }

  public static SymbolValue none() {
    return NONE;
  }

  public static SymbolValue of(Expr expr) {
    assert(expr != null);
    return new SymbolValue(expr, null);
  }

  public static SymbolValue of(Stmt stmt) {
    assert(stmt != null);
    return new SymbolValue(null, stmt);
  }

  public ValueKind kind() {
    if (expr != null) {
      return ValueKind.EXPR;
    } else if (stmt != null) {
      return ValueKind.STMT;
    } else {
      return ValueKind.NONE;
    }
  }

  public boolean isNone() {
    return kind() == ValueKind.NONE;
  }

  public boolean isExpr() {
    return kind() == ValueKind.EXPR;
  }

  public boolean isStmt() {
    return kind() == ValueKind.STMT;
  }

  public Expr expr() {
    if (expr == null) {
      throw new GotocRuntimeError("Symbol value is not an expression: "
                                  + this);
    }
    return expr;
  }

  public Stmt stmt() {
    if (stmt == null) {
      throw new GotocRuntimeError("Symbol value is not a statement: "
                                  + this);
    }
    return stmt;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SymbolValue))
      return false;
    SymbolValue other = (SymbolValue)o;
    if (expr == null ? other.expr != null : !expr.equals(other.expr))
      return false;
    return stmt == null ? other.stmt == null : stmt.equals(other.stmt);
  }

  @Override
  public int hashCode() {
    if (expr != null) {
      return expr.hashCode();
    } else if (stmt != null) {
      return stmt.hashCode() * 3;
    }
    return 0;
  }

  @Override
  public String toString() {
    switch (kind()) {
      case EXPR:
        return expr.toString();
      case STMT:
        return stmt.toString();
      default:
        return "<none>";
    }
  }
}
