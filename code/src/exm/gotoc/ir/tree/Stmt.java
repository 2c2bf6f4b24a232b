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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.gotoc.common.exceptions.GotocRuntimeError;

/**
 * Immutable goto program statement.
 *
 * Like {@link Expr}, every statement kind shares one representation
 * with kind-specific accessors.  Optional parts (else branch, return
 * value, declaration initializer, call result, switch default) are null
 * when absent.
 */
public class Stmt {

  public static enum StmtKind {
    ASSERT,
    ASSIGN,
    ASSUME,
    ATOMIC_BLOCK,
    BLOCK,
    BREAK,
    CONTINUE,
    DECL,
    EXPRESSION,
    FOR,
    FUNCTION_CALL,
    GOTO,
    IF_THEN_ELSE,
    LABEL,
    RETURN,
    SKIP,
    SWITCH,
    WHILE,
    ;
  }

  /**
   * One case arm of a switch statement
   */
  public static class SwitchCase {
    private final Expr caseValue;
    private final Stmt body;

    public SwitchCase(Expr caseValue, Stmt body) {
      assert(caseValue != null);
      assert(body != null);
      this.caseValue = caseValue;
      this.body = body;
    }

    public Expr caseValue() {
      return caseValue;
    }

    public Stmt body() {
      return body;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof SwitchCase))
        return false;
      SwitchCase other = (SwitchCase)o;
      return caseValue.equals(other.caseValue) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
      return caseValue.hashCode() * 31 + body.hashCode();
    }
  }

  private final StmtKind kind;
  private final Location location;

  /** Primary expressions: lhs/rhs, condition, callee + args, etc */
  private final List<Expr> exprs;
  /** Optional expression: declaration init, return value, call target */
  private final Expr optExpr;
  /** Child statements: block contents, branches, loop parts */
  private final List<Stmt> stmts;
  /** Optional statement: else branch, switch default */
  private final Stmt optStmt;
  private final List<SwitchCase> cases;
  /** Label for GOTO/LABEL, property class for ASSERT */
  private final String label;
  /** Message for ASSERT */
  private final String comment;

  private Stmt(StmtKind kind, Location location, List<Expr> exprs,
               Expr optExpr, List<Stmt> stmts, Stmt optStmt,
               List<SwitchCase> cases, String label, String comment) {
    assert(location != null);
    this.kind = kind;
    this.location = location;
    this.exprs = exprs;
    this.optExpr = optExpr;
    this.stmts = stmts;
    this.optStmt = optStmt;
    this.cases = cases;
    this.label = label;
    this.comment = comment;
  }

  private static Stmt create(StmtKind kind, List<Expr> exprs, Expr optExpr,
                List<Stmt> stmts, Stmt optStmt, List<SwitchCase> cases,
                String label, String comment) {
    return new Stmt(kind, Location.none(), immutable(exprs), optExpr,
                    immutable(stmts), optStmt, immutable(cases),
                    label, comment);
  }

  private static <T> List<T> immutable(List<T> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<T>(list));
  }

  private static Stmt simple(StmtKind kind, Expr ...exprs) {
    return create(kind, Arrays.asList(exprs), null, null, null, null,
                  null, null);
  }

  public StmtKind kind() {
    return kind;
  }

  public Location location() {
    return location;
  }

  public Stmt withLocation(Location newLocation) {
    return new Stmt(kind, newLocation, exprs, optExpr, stmts, optStmt,
                    cases, label, comment);
  }

  /*
   * Factories
   */

  public static Stmt assign(Expr lhs, Expr rhs) {
    if (!lhs.isLvalue()) {
      throw new GotocRuntimeError("Assignment to non-lvalue " + lhs);
    }
    if (!lhs.type().equals(rhs.type())) {
      throw new GotocRuntimeError("Assignment of " + rhs.type() + " to " +
                                  lhs + " of type " + lhs.type());
    }
    return simple(StmtKind.ASSIGN, lhs, rhs);
  }

  public static Stmt assertion(Expr cond, String propertyClass,
                               String message) {
    return create(StmtKind.ASSERT, Collections.singletonList(cond), null,
                  null, null, null, propertyClass, message);
  }

  public static Stmt assume(Expr cond) {
    return simple(StmtKind.ASSUME, cond);
  }

  public static Stmt atomicBlock(List<Stmt> body) {
    return create(StmtKind.ATOMIC_BLOCK, null, null, body, null, null,
                  null, null);
  }

  public static Stmt block(List<Stmt> body) {
    return create(StmtKind.BLOCK, null, null, body, null, null, null, null);
  }

  public static Stmt block(Stmt ...body) {
    return block(Arrays.asList(body));
  }

  public static Stmt breakStmt() {
    return simple(StmtKind.BREAK);
  }

  public static Stmt continueStmt() {
    return simple(StmtKind.CONTINUE);
  }

  /**
   * @param lhs declared symbol expression
   * @param value initial value, or null
   */
  public static Stmt decl(Expr lhs, Expr value) {
    if (lhs.kind() != Expr.ExprKind.SYMBOL) {
      throw new GotocRuntimeError("Declaration of non-symbol " + lhs);
    }
    if (value != null && !value.type().equals(lhs.type())) {
      throw new GotocRuntimeError("Declaration of " + lhs + " of type " +
                        lhs.type() + " initialized with " + value.type());
    }
    return create(StmtKind.DECL, Collections.singletonList(lhs), value,
                  null, null, null, null, null);
  }

  public static Stmt expression(Expr e) {
    return simple(StmtKind.EXPRESSION, e);
  }

  public static Stmt forLoop(Stmt init, Expr cond, Stmt update, Stmt body) {
    return create(StmtKind.FOR, Collections.singletonList(cond), null,
                  Arrays.asList(init, update, body), null, null, null, null);
  }

  /**
   * @param lhs result target, or null to discard result
   */
  public static Stmt functionCall(Expr lhs, Expr function,
                                  List<Expr> arguments) {
    // Type check the call
    Expr call = function.call(arguments);
    if (lhs != null && !lhs.type().equals(call.type())) {
      throw new GotocRuntimeError("Call to " + function + " returns " +
                    call.type() + " but assigned to " + lhs.type());
    }
    List<Expr> exprs = new ArrayList<Expr>(arguments.size() + 1);
    exprs.add(function);
    exprs.addAll(arguments);
    return create(StmtKind.FUNCTION_CALL, exprs, lhs, null, null, null,
                  null, null);
  }

  public static Stmt gotoStmt(String label) {
    return create(StmtKind.GOTO, null, null, null, null, null, label, null);
  }

  /**
   * @param elseBranch else branch, or null
   */
  public static Stmt ifThenElse(Expr cond, Stmt thenBranch, Stmt elseBranch) {
    return create(StmtKind.IF_THEN_ELSE, Collections.singletonList(cond),
            null, Collections.singletonList(thenBranch), elseBranch,
            null, null, null);
  }

  public static Stmt label(String label, Stmt body) {
    return create(StmtKind.LABEL, null, null, Collections.singletonList(body),
                  null, null, label, null);
  }

  /**
   * @param value returned value, or null
   */
  public static Stmt ret(Expr value) {
    return create(StmtKind.RETURN, null, value, null, null, null, null, null);
  }

  public static Stmt skip() {
    return simple(StmtKind.SKIP);
  }

  /**
   * @param defaultCase default arm, or null
   */
  public static Stmt switchStmt(Expr control, List<SwitchCase> cases,
                                Stmt defaultCase) {
    return create(StmtKind.SWITCH, Collections.singletonList(control), null,
                  null, defaultCase, cases, null, null);
  }

  public static Stmt whileLoop(Expr cond, Stmt body) {
    return create(StmtKind.WHILE, Collections.singletonList(cond), null,
                  Collections.singletonList(body), null, null, null, null);
  }

  /*
   * Accessors
   */

  private void checkKind(StmtKind ...kinds) {
    for (StmtKind k: kinds) {
      if (k == kind) {
        return;
      }
    }
    throw new GotocRuntimeError("Invalid accessor for statement kind "
                                + kind + ": " + this);
  }

  /**
   * All direct sub-expressions in evaluation order, including optional
   * ones when present
   */
  public List<Expr> exprs() {
    if (optExpr == null) {
      return exprs;
    }
    List<Expr> result = new ArrayList<Expr>(exprs.size() + 1);
    if (kind == StmtKind.FUNCTION_CALL) {
      result.add(optExpr);
      result.addAll(exprs);
    } else {
      result.addAll(exprs);
      result.add(optExpr);
    }
    return result;
  }

  /**
   * All direct sub-statements, including optional ones when present
   */
  public List<Stmt> stmts() {
    List<Stmt> result = new ArrayList<Stmt>(stmts);
    for (SwitchCase c: cases) {
      result.add(c.body());
    }
    if (optStmt != null) {
      result.add(optStmt);
    }
    return result;
  }

  /** ASSIGN */
  public Expr lhs() {
    checkKind(StmtKind.ASSIGN, StmtKind.DECL);
    return exprs.get(0);
  }

  /** ASSIGN */
  public Expr rhs() {
    checkKind(StmtKind.ASSIGN);
    return exprs.get(1);
  }

  /** ASSERT, ASSUME, FOR, IF_THEN_ELSE, WHILE */
  public Expr cond() {
    checkKind(StmtKind.ASSERT, StmtKind.ASSUME, StmtKind.FOR,
              StmtKind.IF_THEN_ELSE, StmtKind.WHILE);
    return exprs.get(0);
  }

  /** EXPRESSION */
  public Expr expr() {
    checkKind(StmtKind.EXPRESSION);
    return exprs.get(0);
  }

  /** SWITCH */
  public Expr control() {
    checkKind(StmtKind.SWITCH);
    return exprs.get(0);
  }

  /** DECL initializer or RETURN value, may be null */
  public Expr value() {
    checkKind(StmtKind.DECL, StmtKind.RETURN);
    return optExpr;
  }

  /** FUNCTION_CALL result target, may be null */
  public Expr callLhs() {
    checkKind(StmtKind.FUNCTION_CALL);
    return optExpr;
  }

  public Expr function() {
    checkKind(StmtKind.FUNCTION_CALL);
    return exprs.get(0);
  }

  public List<Expr> arguments() {
    checkKind(StmtKind.FUNCTION_CALL);
    return exprs.subList(1, exprs.size());
  }

  /** BLOCK, ATOMIC_BLOCK */
  public List<Stmt> body() {
    checkKind(StmtKind.BLOCK, StmtKind.ATOMIC_BLOCK);
    return stmts;
  }

  /** FOR, LABEL, WHILE */
  public Stmt loopBody() {
    checkKind(StmtKind.FOR, StmtKind.LABEL, StmtKind.WHILE);
    return stmts.get(stmts.size() - 1);
  }

  public Stmt init() {
    checkKind(StmtKind.FOR);
    return stmts.get(0);
  }

  public Stmt update() {
    checkKind(StmtKind.FOR);
    return stmts.get(1);
  }

  public Stmt thenBranch() {
    checkKind(StmtKind.IF_THEN_ELSE);
    return stmts.get(0);
  }

  /** may be null */
  public Stmt elseBranch() {
    checkKind(StmtKind.IF_THEN_ELSE);
    return optStmt;
  }

  public List<SwitchCase> cases() {
    checkKind(StmtKind.SWITCH);
    return cases;
  }

  /** may be null */
  public Stmt defaultCase() {
    checkKind(StmtKind.SWITCH);
    return optStmt;
  }

  /** GOTO, LABEL */
  public String label() {
    checkKind(StmtKind.GOTO, StmtKind.LABEL);
    return label;
  }

  public String propertyClass() {
    checkKind(StmtKind.ASSERT);
    return label;
  }

  public String message() {
    checkKind(StmtKind.ASSERT);
    return comment;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Stmt))
      return false;
    Stmt other = (Stmt) obj;
    if (kind != other.kind || !location.equals(other.location))
      return false;
    if (optExpr == null ? other.optExpr != null
                        : !optExpr.equals(other.optExpr))
      return false;
    if (optStmt == null ? other.optStmt != null
                        : !optStmt.equals(other.optStmt))
      return false;
    if (label == null ? other.label != null : !label.equals(other.label))
      return false;
    if (comment == null ? other.comment != null
                        : !comment.equals(other.comment))
      return false;
    return exprs.equals(other.exprs) && stmts.equals(other.stmts) &&
           cases.equals(other.cases);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + exprs.hashCode();
    result = prime * result + (optExpr == null ? 0 : optExpr.hashCode());
    result = prime * result + stmts.hashCode();
    result = prime * result + (optStmt == null ? 0 : optStmt.hashCode());
    result = prime * result + cases.hashCode();
    result = prime * result + (label == null ? 0 : label.hashCode());
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, "");
    return sb.toString();
  }

  public void prettyPrint(StringBuilder sb, String indent) {
    String ind2 = indent + "  ";
    switch (kind) {
      case BLOCK:
      case ATOMIC_BLOCK:
        sb.append(indent).append(kind == StmtKind.BLOCK ? "{" : "atomic {")
          .append("\n");
        for (Stmt s: stmts) {
          s.prettyPrint(sb, ind2);
        }
        sb.append(indent).append("}\n");
        return;
      case IF_THEN_ELSE:
        sb.append(indent).append("if ").append(cond()).append("\n");
        thenBranch().prettyPrint(sb, ind2);
        if (optStmt != null) {
          sb.append(indent).append("else\n");
          optStmt.prettyPrint(sb, ind2);
        }
        return;
      case WHILE:
        sb.append(indent).append("while ").append(cond()).append("\n");
        loopBody().prettyPrint(sb, ind2);
        return;
      case FOR:
        sb.append(indent).append("for ").append(cond()).append("\n");
        init().prettyPrint(sb, ind2);
        update().prettyPrint(sb, ind2);
        loopBody().prettyPrint(sb, ind2);
        return;
      case LABEL:
        sb.append(indent).append(label).append(":\n");
        loopBody().prettyPrint(sb, ind2);
        return;
      case SWITCH:
        sb.append(indent).append("switch ").append(control()).append("\n");
        for (SwitchCase c: cases) {
          sb.append(ind2).append("case ").append(c.caseValue()).append(":\n");
          c.body().prettyPrint(sb, ind2 + "  ");
        }
        if (optStmt != null) {
          sb.append(ind2).append("default:\n");
          optStmt.prettyPrint(sb, ind2 + "  ");
        }
        return;
      default:
        break;
    }
    sb.append(indent).append(kind.toString().toLowerCase());
    if (label != null) {
      sb.append(" ").append(label);
    }
    for (Expr e: exprs()) {
      sb.append(" ").append(e);
    }
    if (comment != null) {
      sb.append(" \"").append(comment).append("\"");
    }
    sb.append("\n");
  }
}
