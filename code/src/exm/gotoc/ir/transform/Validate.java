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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Sets;

import exm.gotoc.common.exceptions.InvalidOutputException;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.common.exceptions.UnresolvedReferenceException;
import exm.gotoc.ir.transform.TreeWalk.TreeWalker;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Expr.ExprKind;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Stmt.StmtKind;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

/**
 * Sanity checks on a symbol table, without modifying it:
 * - Check every symbol expression and aggregate tag resolves in the table
 * - Optionally check all names are legal C identifiers
 * - Optionally check no nondet values remain
 */
public class Validate implements SymtabPass {
  private final String stage;
  private final boolean checkIdentifiers;
  private final boolean checkNoNondet;

  private Validate(String stage, boolean checkIdentifiers,
                   boolean checkNoNondet) {
    this.stage = stage;
    this.checkIdentifiers = checkIdentifiers;
    this.checkNoNondet = checkNoNondet;
  }

  /**
   * @return validator for a table handed to the pipeline
   */
  public static Validate inputValidator() {
    return new Validate("input", false, false);
  }

  /**
   * @param passName pass that produced the table
   */
  public static Validate closureValidator(String passName) {
    return new Validate("after " + passName, false, false);
  }

  /**
   * @returns validator for tables that will be printed as C text
   */
  public static Validate cTextValidator() {
    return new Validate("C text output", true, true);
  }

  @Override
  public String getPassName() {
    return "Validate";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  /**
   * @return the input table, unchanged
   */
  @Override
  public SymbolTable transform(Logger logger, SymbolTable table)
                                      throws TransformException {
    checkClosure(logger, table);
    if (checkIdentifiers) {
      checkIdentifiers(logger, table);
    }
    if (checkNoNondet) {
      checkNoNondet(logger, table);
    }
    return table;
  }

  /**
   * Check that every reference resolves to a key of the table
   * @throws UnresolvedReferenceException listing all missing names
   */
  private void checkClosure(Logger logger, final SymbolTable table)
                          throws UnresolvedReferenceException {
    final ListMultimap<String, String> unresolved =
                              LinkedListMultimap.create();

    TreeWalk.walk(logger, table, new TreeWalker() {
      @Override
      public void visitSymbol(Logger logger, Symbol sym) {
        if (!sym.isFunctionDefinition()) {
          return;
        }
        for (Parameter p: sym.type().asCode().parameters()) {
          if (p.identifier() != null) {
            check(sym, p.identifier());
          }
        }
      }

      @Override
      public void visit(Logger logger, Symbol context, Type type) {
        switch (type.kind()) {
          case STRUCT_TAG:
          case UNION_TAG:
            check(context, Types.tagSymbolName(type.tag()));
            break;
          default:
            break;
        }
      }

      @Override
      public void visit(Logger logger, Symbol context, Expr expr) {
        if (expr.kind() == ExprKind.SYMBOL) {
          check(context, expr.identifier());
        }
      }

      private void check(Symbol context, String name) {
        if (!table.contains(name) &&
            !unresolved.containsEntry(context.name(), name)) {
          unresolved.put(context.name(), name);
        }
      }
    });

    if (!unresolved.isEmpty()) {
      throw new UnresolvedReferenceException(stage, unresolved);
    }
    logger.trace("Closure holds " + stage + " for " + table.size() +
                 " symbols");
  }

  /**
   * Check names that will appear in C output
   */
  private void checkIdentifiers(Logger logger, SymbolTable table)
                          throws InvalidOutputException {
    final List<String> illegal = new ArrayList<String>();
    for (String name: table.names()) {
      if (!CIdentifiers.isLegalName(name)) {
        illegal.add(name);
      }
    }

    TreeWalk.walk(logger, table, new TreeWalker() {
      @Override
      protected void visit(Type type) {
        if (type.kind() == Types.TypeKind.STRUCT ||
            type.kind() == Types.TypeKind.UNION) {
          for (DatatypeComponent c: type.asAggregate().components()) {
            if (!CIdentifiers.isIdentifier(c.name())) {
              illegal.add(c.name());
            }
          }
        }
      }

      @Override
      protected void visit(Stmt stmt) {
        if (stmt.kind() == StmtKind.GOTO || stmt.kind() == StmtKind.LABEL) {
          if (!CIdentifiers.isIdentifier(stmt.label())) {
            illegal.add(stmt.label());
          }
        }
      }
    });

    if (!illegal.isEmpty()) {
      throw new InvalidOutputException("illegal C identifiers", stage,
                                       illegal);
    }
  }

  /**
   * Check no nondet values remain, other than struct padding
   */
  private void checkNoNondet(Logger logger, final SymbolTable table)
                          throws InvalidOutputException {
    final Set<Expr> padding = Sets.newIdentityHashSet();
    final List<String> found = new ArrayList<String>();

    TreeWalk.walk(logger, table, new TreeWalker() {
      @Override
      public void visit(Logger logger, Symbol context, Expr expr) {
        if (expr.kind() == ExprKind.STRUCT) {
          // Struct is visited before its operands
          List<DatatypeComponent> comps =
                              table.lookupComponents(expr.type());
          for (int i = 0; i < comps.size(); i++) {
            if (comps.get(i).isPadding()) {
              padding.add(expr.operand(i));
            }
          }
        } else if (expr.isNondet() && !padding.contains(expr)) {
          found.add(context.name());
        }
      }
    });

    if (!found.isEmpty()) {
      throw new InvalidOutputException("nondet values remain", stage,
                                       found);
    }
  }
}
