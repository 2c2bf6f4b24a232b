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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.ir.tree.Operators.BinaryOperator;
import exm.gotoc.ir.tree.Operators.SelfOperator;
import exm.gotoc.ir.tree.Operators.UnaryOperator;
import exm.gotoc.ir.tree.Types.CodeType;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

/**
 * Immutable goto program expression.
 *
 * All expressions share one representation: a kind, a type, a location,
 * sub-expressions, sub-statements (only for statement expressions) and a
 * kind-specific value (identifier, constant, operator, etc).
 * Use the static factories and builder methods, which check that the
 * resulting expression is well typed.
 */
public class Expr {

  public static enum ExprKind {
    ADDRESS_OF,
    ARRAY,
    ARRAY_OF,
    /** Assignment used as a value: the new value of the left operand */
    ASSIGN,
    BIN_OP,
    BOOL_CONSTANT,
    /** Reinterpret bytes of operand at offset as another type */
    BYTE_EXTRACT,
    C_BOOL_CONSTANT,
    DEREFERENCE,
    DOUBLE_CONSTANT,
    FLOAT_CONSTANT,
    FUNCTION_CALL,
    IF,
    INDEX,
    INT_CONSTANT,
    MEMBER,
    /** Any value of the expression type */
    NONDET,
    POINTER_CONSTANT,
    SELF_OP,
    STATEMENT_EXPRESSION,
    STRING_CONSTANT,
    STRUCT,
    SYMBOL,
    TYPECAST,
    UNION,
    UN_OP,
    VECTOR,
    ;
  }

  private final ExprKind kind;
  private final Type type;
  private final Location location;
  private final List<Expr> operands;
  private final List<Stmt> statements;
  /**
   * Identifier for SYMBOL, field name for MEMBER/UNION, BigInteger for
   * integer and pointer constants, offset for BYTE_EXTRACT, operator for
   * operations, Boolean/Double/Float/String for other constants.
   */
  private final Object value;

  private Expr(ExprKind kind, Type type, Location location,
               List<Expr> operands, List<Stmt> statements, Object value) {
    assert(type != null);
    assert(location != null);
    this.kind = kind;
    this.type = type;
    this.location = location;
    this.operands = operands;
    this.statements = statements;
    this.value = value;
  }

  private static Expr create(ExprKind kind, Type type, Object value,
                             Expr ...operands) {
    List<Expr> ops;
    if (operands.length == 0) {
      ops = Collections.emptyList();
    } else {
      ops = Collections.unmodifiableList(Arrays.asList(operands));
    }
    return new Expr(kind, type, Location.none(), ops,
                    Collections.<Stmt>emptyList(), value);
  }

  private static Expr create(ExprKind kind, Type type, Object value,
                             List<Expr> operands) {
    return new Expr(kind, type, Location.none(),
              Collections.unmodifiableList(new ArrayList<Expr>(operands)),
              Collections.<Stmt>emptyList(), value);
  }

  public ExprKind kind() {
    return kind;
  }

  public Type type() {
    return type;
  }

  public Location location() {
    return location;
  }

  /**
   * @return sub-expressions in evaluation order
   */
  public List<Expr> operands() {
    return operands;
  }

  /**
   * @return statements of a statement expression, otherwise empty
   */
  public List<Stmt> statements() {
    return statements;
  }

  public Expr withLocation(Location newLocation) {
    return new Expr(kind, type, newLocation, operands, statements, value);
  }

  public Expr operand(int i) {
    return operands.get(i);
  }

  private void checkKind(ExprKind ...kinds) {
    for (ExprKind k: kinds) {
      if (k == kind) {
        return;
      }
    }
    throw new GotocRuntimeError("Invalid accessor for expression kind "
                                + kind + ": " + this);
  }

  public String identifier() {
    checkKind(ExprKind.SYMBOL);
    return (String)value;
  }

  public String field() {
    checkKind(ExprKind.MEMBER, ExprKind.UNION);
    return (String)value;
  }

  public BigInteger intValue() {
    checkKind(ExprKind.INT_CONSTANT, ExprKind.POINTER_CONSTANT);
    return (BigInteger)value;
  }

  public long offset() {
    checkKind(ExprKind.BYTE_EXTRACT);
    return (Long)value;
  }

  public boolean boolValue() {
    checkKind(ExprKind.BOOL_CONSTANT, ExprKind.C_BOOL_CONSTANT);
    return (Boolean)value;
  }

  public double doubleValue() {
    checkKind(ExprKind.DOUBLE_CONSTANT);
    return (Double)value;
  }

  public float floatValue() {
    checkKind(ExprKind.FLOAT_CONSTANT);
    return (Float)value;
  }

  public String stringValue() {
    checkKind(ExprKind.STRING_CONSTANT);
    return (String)value;
  }

  public BinaryOperator binaryOp() {
    checkKind(ExprKind.BIN_OP);
    return (BinaryOperator)value;
  }

  public UnaryOperator unaryOp() {
    checkKind(ExprKind.UN_OP);
    return (UnaryOperator)value;
  }

  public SelfOperator selfOp() {
    checkKind(ExprKind.SELF_OP);
    return (SelfOperator)value;
  }

  public boolean isNondet() {
    return kind == ExprKind.NONDET;
  }

  /*
   * Leaf expressions
   */

  public static Expr symbol(String identifier, Type type) {
    if (identifier == null || identifier.isEmpty()) {
      throw new GotocRuntimeError("Empty identifier in symbol expression");
    }
    return create(ExprKind.SYMBOL, type, identifier);
  }

  public static Expr intConstant(BigInteger value, Type type) {
    if (!type.isInteger()) {
      throw new GotocRuntimeError("Integer constant " + value +
                                  " of non-integer type " + type);
    }
    return create(ExprKind.INT_CONSTANT, type, value);
  }

  public static Expr intConstant(long value, Type type) {
    return intConstant(BigInteger.valueOf(value), type);
  }

  /** __CPROVER_bool constant */
  public static Expr boolConstant(boolean value) {
    return create(ExprKind.BOOL_CONSTANT, Types.bool(), value);
  }

  /** C bool constant */
  public static Expr cBoolConstant(boolean value) {
    return create(ExprKind.C_BOOL_CONSTANT, Types.cBool(), value);
  }

  public static Expr doubleConstant(double value) {
    return create(ExprKind.DOUBLE_CONSTANT, Types.doubleType(), value);
  }

  public static Expr floatConstant(float value) {
    return create(ExprKind.FLOAT_CONSTANT, Types.floatType(), value);
  }

  public static Expr pointerConstant(long value, Type type) {
    if (!type.isPointer()) {
      throw new GotocRuntimeError("Pointer constant of type " + type);
    }
    return create(ExprKind.POINTER_CONSTANT, type, BigInteger.valueOf(value));
  }

  /**
   * String literal; has type char[len + 1]
   */
  public static Expr stringConstant(String s) {
    return create(ExprKind.STRING_CONSTANT,
                  Types.cChar().arrayOf(s.length() + 1), s);
  }

  /**
   * Marker for a nondeterministic value of type
   */
  public static Expr nondet(Type type) {
    return create(ExprKind.NONDET, type, null);
  }

  /*
   * Aggregate construction
   */

  public static Expr arrayExpr(Type type, List<Expr> elems) {
    if (!type.isArray()) {
      throw new GotocRuntimeError("Array expression of type " + type);
    }
    checkElems(type, elems);
    return create(ExprKind.ARRAY, type, null, elems);
  }

  public static Expr vectorExpr(Type type, List<Expr> elems) {
    if (!type.isVector()) {
      throw new GotocRuntimeError("Vector expression of type " + type);
    }
    checkElems(type, elems);
    return create(ExprKind.VECTOR, type, null, elems);
  }

  private static void checkElems(Type type, List<Expr> elems) {
    for (Expr e: elems) {
      if (!e.type().equals(type.baseType())) {
        throw new GotocRuntimeError("Element " + e + " does not match " +
                                    "element type of " + type);
      }
    }
  }

  /**
   * Array of size with every element set to this
   */
  public Expr arrayConstant(long size) {
    return create(ExprKind.ARRAY_OF, type.arrayOf(size), null, this);
  }

  /**
   * Struct initializer
   * @param type struct tag type
   * @param values one value per component, including padding
   * @param symbols table to look up the struct declaration in
   */
  public static Expr structExpr(Type type, List<Expr> values,
                                SymbolTable symbols) {
    if (!type.isStructTag()) {
      throw new GotocRuntimeError("Struct expression must have struct tag " +
                                  "type, got " + type);
    }
    List<DatatypeComponent> components = symbols.lookupComponents(type);
    if (components.size() != values.size()) {
      throw new GotocRuntimeError("Struct " + type.tag() + " has " +
          components.size() + " components but got " + values.size() +
          " values");
    }
    for (int i = 0; i < values.size(); i++) {
      Type expected = components.get(i).type();
      if (!values.get(i).type().equals(expected)) {
        throw new GotocRuntimeError("Field " + components.get(i).name() +
            " of " + type.tag() + " expects " + expected + " but got " +
            values.get(i).type());
      }
    }
    return create(ExprKind.STRUCT, type, null, values);
  }

  /**
   * Union initializer setting one field
   */
  public static Expr unionExpr(Type type, String field, Expr value,
                               SymbolTable symbols) {
    if (!type.isUnionTag()) {
      throw new GotocRuntimeError("Union expression must have union tag " +
                                  "type, got " + type);
    }
    Type fieldType = lookupFieldType(type, field, symbols);
    if (!fieldType.equals(value.type())) {
      throw new GotocRuntimeError("Union field " + field + " expects " +
                        fieldType + " but got " + value.type());
    }
    return create(ExprKind.UNION, type, field, value);
  }

  private static Type lookupFieldType(Type aggr, String field,
                                      SymbolTable symbols) {
    for (DatatypeComponent c: symbols.lookupComponents(aggr)) {
      if (c.name().equals(field)) {
        return c.type();
      }
    }
    throw new GotocRuntimeError("No field " + field + " in " + aggr);
  }

  /**
   * Statement expression ({ s1; s2; ...; e; }) with value of type
   */
  public static Expr statementExpression(List<Stmt> statements, Type type) {
    if (statements.isEmpty()) {
      throw new GotocRuntimeError("Empty statement expression");
    }
    return new Expr(ExprKind.STATEMENT_EXPRESSION, type, Location.none(),
          Collections.<Expr>emptyList(),
          Collections.unmodifiableList(new ArrayList<Stmt>(statements)),
          null);
  }

  /*
   * Operations on this expression
   */

  public Expr addressOf() {
    return create(ExprKind.ADDRESS_OF, type.toPointer(), null, this);
  }

  public Expr dereference() {
    if (!type.isPointer()) {
      throw new GotocRuntimeError("Dereference of non-pointer " + this);
    }
    return create(ExprKind.DEREFERENCE, type.baseType(), null, this);
  }

  public Expr member(String field, SymbolTable symbols) {
    if (!type.isStructTag() && !type.isUnionTag()) {
      throw new GotocRuntimeError("Member access on " + type);
    }
    return create(ExprKind.MEMBER, lookupFieldType(type, field, symbols),
                  field, this);
  }

  public Expr index(Expr idx) {
    if (!type.isArray() && !type.isPointer() && !type.isVector()) {
      throw new GotocRuntimeError("Cannot index into " + type);
    }
    if (!idx.type().isInteger()) {
      throw new GotocRuntimeError("Index must be integer, got " + idx.type());
    }
    return create(ExprKind.INDEX, type.baseType(), null, this, idx);
  }

  public Expr call(List<Expr> arguments) {
    if (!type.isCode()) {
      throw new GotocRuntimeError("Call of non-function " + this);
    }
    CodeType code = type.asCode();
    List<Parameter> params = code.parameters();
    if (arguments.size() < params.size() ||
        (!code.isVariadic() && arguments.size() > params.size())) {
      throw new GotocRuntimeError("Function " + this + " expects " +
          params.size() + " arguments but got " + arguments.size());
    }
    for (int i = 0; i < params.size(); i++) {
      if (!params.get(i).type().equals(arguments.get(i).type())) {
        throw new GotocRuntimeError("Argument " + i + " of call to " + this +
            " expects " + params.get(i).type() + " but got " +
            arguments.get(i).type());
      }
    }
    List<Expr> ops = new ArrayList<Expr>(arguments.size() + 1);
    ops.add(this);
    ops.addAll(arguments);
    return create(ExprKind.FUNCTION_CALL, code.returnType(), null, ops);
  }

  /**
   * @return callee of a function call
   */
  public Expr function() {
    checkKind(ExprKind.FUNCTION_CALL);
    return operands.get(0);
  }

  /**
   * @return arguments of a function call
   */
  public List<Expr> arguments() {
    checkKind(ExprKind.FUNCTION_CALL);
    return operands.subList(1, operands.size());
  }

  public Expr castTo(Type target) {
    return create(ExprKind.TYPECAST, target, null, this);
  }

  /**
   * Reinterpret the bytes of this expression starting at offset
   */
  public Expr byteExtract(Type target, long offset) {
    return create(ExprKind.BYTE_EXTRACT, target, offset, this);
  }

  public static Expr ternary(Expr cond, Expr t, Expr e) {
    if (!t.type().equals(e.type())) {
      throw new GotocRuntimeError("Branches of conditional differ: " +
                                  t.type() + " vs " + e.type());
    }
    return create(ExprKind.IF, t.type(), null, cond, t, e);
  }

  public Expr selfOp(SelfOperator op) {
    return create(ExprKind.SELF_OP, type, op, this);
  }

  public Expr unop(UnaryOperator op) {
    Type resultType;
    switch (op) {
      case NOT:
        resultType = Types.bool();
        break;
      case POPCOUNT:
        resultType = type;
        break;
      default:
        if (!type.isInteger() && op != UnaryOperator.UNARY_MINUS) {
          throw new GotocRuntimeError(op + " of non-integer " + this);
        }
        resultType = type;
    }
    return create(ExprKind.UN_OP, resultType, op, this);
  }

  public Expr binop(BinaryOperator op, Expr rhs) {
    Type resultType;
    switch (op.category()) {
      case ARITHMETIC:
        if (type.isPointer() && rhs.type().isInteger() &&
            (op == BinaryOperator.PLUS || op == BinaryOperator.MINUS)) {
          resultType = type;
        } else if (!type.equals(rhs.type())) {
          throw new GotocRuntimeError("Operands of " + op + " differ: " +
                                      type + " vs " + rhs.type());
        } else {
          resultType = type;
        }
        break;
      case COMPARISON:
        if (!type.equals(rhs.type())) {
          throw new GotocRuntimeError("Operands of " + op + " differ: " +
                                      type + " vs " + rhs.type());
        }
        resultType = Types.bool();
        break;
      case LOGICAL:
        if (!type.isBool() || !rhs.type().isBool()) {
          throw new GotocRuntimeError("Operands of " + op + " must be bool: "
                                      + type + ", " + rhs.type());
        }
        resultType = Types.bool();
        break;
      case SHIFT:
        if (!type.isInteger() || !rhs.type().isInteger()) {
          throw new GotocRuntimeError("Operands of " + op + " must be " +
                          "integers: " + type + ", " + rhs.type());
        }
        resultType = type;
        break;
      default:
        throw new GotocRuntimeError("Unknown category " + op.category());
    }
    return create(ExprKind.BIN_OP, resultType, op, this, rhs);
  }

  public Expr not() {
    return unop(UnaryOperator.NOT);
  }

  public Expr neg() {
    return unop(UnaryOperator.UNARY_MINUS);
  }

  public Expr bitnot() {
    return unop(UnaryOperator.BITNOT);
  }

  public Expr plus(Expr rhs) {
    return binop(BinaryOperator.PLUS, rhs);
  }

  public Expr mul(Expr rhs) {
    return binop(BinaryOperator.MULT, rhs);
  }

  public Expr bitor(Expr rhs) {
    return binop(BinaryOperator.BITOR, rhs);
  }

  public Expr bitand(Expr rhs) {
    return binop(BinaryOperator.BITAND, rhs);
  }

  public Expr shl(Expr rhs) {
    return binop(BinaryOperator.SHL, rhs);
  }

  public Expr and(Expr rhs) {
    return binop(BinaryOperator.AND, rhs);
  }

  public Expr or(Expr rhs) {
    return binop(BinaryOperator.OR, rhs);
  }

  public Expr implies(Expr rhs) {
    return binop(BinaryOperator.IMPLIES, rhs);
  }

  public Expr eq(Expr rhs) {
    return binop(BinaryOperator.EQUAL, rhs);
  }

  public Expr lt(Expr rhs) {
    return binop(BinaryOperator.LT, rhs);
  }

  public Stmt asStmt() {
    return Stmt.expression(this);
  }

  public Stmt assign(Expr rhs) {
    return Stmt.assign(this, rhs);
  }

  public Expr assignExpr(Expr rhs) {
    if (!isLvalue()) {
      throw new GotocRuntimeError("Assignment to non-lvalue " + this);
    }
    if (!type.equals(rhs.type())) {
      throw new GotocRuntimeError("Assignment of " + rhs.type() + " to " +
                                  type);
    }
    return create(ExprKind.ASSIGN, type, null, this, rhs);
  }

  public boolean isLvalue() {
    switch (kind) {
      case SYMBOL:
      case DEREFERENCE:
      case INDEX:
      case MEMBER:
        return true;
      default:
        return false;
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Expr))
      return false;
    Expr other = (Expr) obj;
    if (kind != other.kind || !type.equals(other.type) ||
        !location.equals(other.location)) {
      return false;
    }
    if (value == null ? other.value != null : !value.equals(other.value)) {
      return false;
    }
    return operands.equals(other.operands) &&
           statements.equals(other.statements);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + type.hashCode();
    result = prime * result + (value == null ? 0 : value.hashCode());
    result = prime * result + operands.hashCode();
    result = prime * result + statements.hashCode();
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }

  /**
   * Compact debugging representation
   */
  public void prettyPrint(StringBuilder sb) {
    switch (kind) {
      case SYMBOL:
        sb.append(value);
        return;
      case INT_CONSTANT:
      case POINTER_CONSTANT:
      case BOOL_CONSTANT:
      case C_BOOL_CONSTANT:
      case DOUBLE_CONSTANT:
      case FLOAT_CONSTANT:
        sb.append(value);
        return;
      case STRING_CONSTANT:
        sb.append('"').append(value).append('"');
        return;
      case NONDET:
        sb.append("nondet<").append(type).append(">");
        return;
      default:
        break;
    }
    sb.append(kind.toString().toLowerCase());
    if (value != null) {
      sb.append("[").append(value).append("]");
    }
    if (kind == ExprKind.TYPECAST || kind == ExprKind.BYTE_EXTRACT) {
      sb.append("<").append(type).append(">");
    }
    sb.append("(");
    boolean first = true;
    for (Expr op: operands) {
      if (!first) {
        sb.append(", ");
      }
      op.prettyPrint(sb);
      first = false;
    }
    for (Stmt s: statements) {
      if (!first) {
        sb.append("; ");
      }
      sb.append(s.toString().trim());
      first = false;
    }
    sb.append(")");
  }
}
