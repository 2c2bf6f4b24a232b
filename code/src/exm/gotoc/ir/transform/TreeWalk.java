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
package exm.gotoc.ir.transform;

import org.apache.log4j.Logger;

import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Stmt.SwitchCase;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types.Type;

/**
 * Read-only walk over every node of a symbol table.
 */
public class TreeWalk {

  /**
   * Top-down walk of all symbols in table order
   * @param logger
   * @param symbols
   * @param walker
   */
  public static void walk(Logger logger, SymbolTable symbols,
                          TreeWalker walker) {
    for (Symbol sym: symbols.symbols()) {
      walk(logger, sym, walker);
    }
  }

  /**
   * Walk pre-order: symbol, then its type, then its value
   */
  public static void walk(Logger logger, Symbol sym, TreeWalker walker) {
    walker.visitSymbol(logger, sym);
    walkType(logger, sym, sym.type(), walker);
    switch (sym.value().kind()) {
      case EXPR:
        walkExpr(logger, sym, sym.value().expr(), walker);
        break;
      case STMT:
        walkStmt(logger, sym, sym.value().stmt(), walker);
        break;
      default:
        break;
    }
  }

  private static void walkType(Logger logger, Symbol context, Type type,
                               TreeWalker walker) {
    walker.visit(logger, context, type);
    for (Type child: type.componentTypes()) {
      walkType(logger, context, child, walker);
    }
  }

  private static void walkExpr(Logger logger, Symbol context, Expr expr,
                               TreeWalker walker) {
    walker.visit(logger, context, expr);
    walkType(logger, context, expr.type(), walker);
    for (Expr op: expr.operands()) {
      walkExpr(logger, context, op, walker);
    }
    for (Stmt s: expr.statements()) {
      walkStmt(logger, context, s, walker);
    }
  }

  private static void walkStmt(Logger logger, Symbol context, Stmt stmt,
                               TreeWalker walker) {
    walker.visit(logger, context, stmt);
    for (Expr e: stmt.exprs()) {
      walkExpr(logger, context, e, walker);
    }
    if (stmt.kind() == Stmt.StmtKind.SWITCH) {
      for (SwitchCase c: stmt.cases()) {
        walkExpr(logger, context, c.caseValue(), walker);
      }
    }
    for (Stmt child: stmt.stmts()) {
      walkStmt(logger, context, child, walker);
    }
  }

  public static abstract class TreeWalker {
    public void visitSymbol(Logger logger, Symbol sym) {
      visitSymbol(sym);
    }
    protected void visitSymbol(Symbol sym) {
      // Nothing
    }

    public void visit(Logger logger, Symbol context, Type type) {
      visit(type);
    }
    protected void visit(Type type) {
      // Nothing
    }

    public void visit(Logger logger, Symbol context, Expr expr) {
      visit(expr);
    }
    protected void visit(Expr expr) {
      // Nothing
    }

    public void visit(Logger logger, Symbol context, Stmt stmt) {
      visit(stmt);
    }
    protected void visit(Stmt stmt) {
      // nothing
    }
  }
}
