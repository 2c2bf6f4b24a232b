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

import org.apache.log4j.Logger;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.common.exceptions.UnsupportedConstructException;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Stmt.SwitchCase;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.SymbolValue;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.AggregateType;
import exm.gotoc.ir.tree.Types.ArrayType;
import exm.gotoc.ir.tree.Types.BitVectorType;
import exm.gotoc.ir.tree.Types.CodeType;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.PointerType;
import exm.gotoc.ir.tree.Types.TagType;
import exm.gotoc.ir.tree.Types.Type;
import exm.gotoc.ir.tree.Types.TypeDefType;
import exm.gotoc.ir.tree.Types.VectorType;

/**
 * Base class for passes that rebuild the whole symbol table.
 *
 * There is a hook for each type, expression and statement kind.  Each hook
 * defaults to rebuilding the node from its transformed children, so a
 * subclass only overrides the kinds it rewrites.
 *
 * Symbols are visited in a fixed order: first those without a value
 * (types, declarations), then those with a value, each group in table
 * order.  This way aggregate declarations are in the new table before
 * any member or struct expression needs to look them up.
 */
public abstract class Transformer implements SymtabPass {

  protected Logger logger;

  /** table being transformed, read only */
  private SymbolTable input;

  /** table being built */
  private SymbolTable output;

  /** name of symbol being transformed, for error reporting */
  private String currentSymbol;

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public SymbolTable transform(Logger logger, SymbolTable input)
                                      throws TransformException {
    this.logger = logger;
    this.input = input;
    this.output = new SymbolTable();
    this.currentSymbol = null;

    preprocess();

    for (Symbol sym: input.symbols()) {
      if (sym.value().isNone()) {
        transformInto(sym);
      }
    }
    for (Symbol sym: input.symbols()) {
      if (!sym.value().isNone()) {
        transformInto(sym);
      }
    }
    currentSymbol = null;

    postprocess();

    SymbolTable result = output;
    this.input = null;
    this.output = null;
    return result;
  }

  private void transformInto(Symbol sym) throws TransformException {
    currentSymbol = sym.name();
    Symbol transformed = transformSymbol(sym);
    if (logger.isTraceEnabled() && !transformed.name().equals(sym.name())) {
      logger.trace(getPassName() + ": " + sym.name() + " => " +
                   transformed.name());
    }
    output.insert(transformed);
  }

  /**
   * Called before any symbol is transformed
   */
  protected void preprocess() throws TransformException {
    // Nothing
  }

  /**
   * Called after all symbols are transformed
   */
  protected void postprocess() throws TransformException {
    // Nothing
  }

  protected SymbolTable inputTable() {
    return input;
  }

  /**
   * Table under construction.  Passes may insert synthesized symbols.
   */
  protected SymbolTable outputTable() {
    return output;
  }

  /**
   * @return name of symbol whose type or value is being transformed, or
   *         null outside of symbol traversal
   */
  protected String currentSymbol() {
    return currentSymbol;
  }

  protected UnsupportedConstructException unsupported(String constructKind,
                                                      String detail) {
    return new UnsupportedConstructException(
        currentSymbol == null ? "<none>" : currentSymbol,
        constructKind, getPassName(), detail);
  }

  /*
   * Symbols
   */

  protected Symbol transformSymbol(Symbol sym) throws TransformException {
    Type newType = transformType(sym.type());
    SymbolValue newValue = transformValue(sym.value());
    return sym.withType(newType).withValue(newValue)
              .withLocation(transformLocation(sym.location()));
  }

  protected Location transformLocation(Location loc)
                                throws TransformException {
    return loc;
  }

  protected SymbolValue transformValue(SymbolValue value)
                                throws TransformException {
    switch (value.kind()) {
      case EXPR:
        return SymbolValue.of(transformExpr(value.expr()));
      case STMT:
        return SymbolValue.of(transformStmt(value.stmt()));
      default:
        return value;
    }
  }

  /*
   * Types
   */

  public Type transformType(Type type) throws TransformException {
    switch (type.kind()) {
      case ARRAY:
        return transformTypeArray((ArrayType)type);
      case BOOL:
        return transformTypeBool(type);
      case C_INTEGER:
        return transformTypeCInteger(type);
      case CODE:
        return transformTypeCode((CodeType)type);
      case DOUBLE:
        return transformTypeDouble(type);
      case EMPTY:
        return transformTypeEmpty(type);
      case FLOAT:
        return transformTypeFloat(type);
      case INCOMPLETE_STRUCT:
        return transformTypeIncompleteStruct((TagType)type);
      case INCOMPLETE_UNION:
        return transformTypeIncompleteUnion((TagType)type);
      case POINTER:
        return transformTypePointer((PointerType)type);
      case SIGNED_BV:
        return transformTypeSignedBv((BitVectorType)type);
      case STRUCT:
        return transformTypeStruct((AggregateType)type);
      case STRUCT_TAG:
        return transformTypeStructTag((TagType)type);
      case TYPEDEF:
        return transformTypeTypedef((TypeDefType)type);
      case UNION:
        return transformTypeUnion((AggregateType)type);
      case UNION_TAG:
        return transformTypeUnionTag((TagType)type);
      case UNSIGNED_BV:
        return transformTypeUnsignedBv((BitVectorType)type);
      case VECTOR:
        return transformTypeVector((VectorType)type);
      default:
        throw new GotocRuntimeError("Unknown type kind " + type.kind());
    }
  }

  protected Type transformTypeArray(ArrayType type)
                              throws TransformException {
    return transformType(type.baseType()).arrayOf(type.size());
  }

  protected Type transformTypeBool(Type type) throws TransformException {
    return type;
  }

  protected Type transformTypeCInteger(Type type) throws TransformException {
    return type;
  }

  protected Type transformTypeCode(CodeType type) throws TransformException {
    List<Parameter> params = new ArrayList<Parameter>();
    for (Parameter p: type.parameters()) {
      params.add(transformParameter(p));
    }
    Type ret = transformType(type.returnType());
    if (type.isVariadic()) {
      return Types.variadicCode(params, ret);
    } else {
      return Types.code(params, ret);
    }
  }

  protected Type transformTypeDouble(Type type) throws TransformException {
    return type;
  }

  protected Type transformTypeEmpty(Type type) throws TransformException {
    return type;
  }

  protected Type transformTypeFloat(Type type) throws TransformException {
    return type;
  }

  protected Type transformTypeIncompleteStruct(TagType type)
                                    throws TransformException {
    return type;
  }

  protected Type transformTypeIncompleteUnion(TagType type)
                                    throws TransformException {
    return type;
  }

  protected Type transformTypePointer(PointerType type)
                                    throws TransformException {
    return transformType(type.baseType()).toPointer();
  }

  protected Type transformTypeSignedBv(BitVectorType type)
                                    throws TransformException {
    return type;
  }

  protected Type transformTypeStruct(AggregateType type)
                                    throws TransformException {
    return Types.structType(type.tag(), transformComponents(type));
  }

  protected Type transformTypeStructTag(TagType type)
                                    throws TransformException {
    return type;
  }

  protected Type transformTypeTypedef(TypeDefType type)
                                    throws TransformException {
    return transformType(type.type()).toTypeDef(type.name());
  }

  protected Type transformTypeUnion(AggregateType type)
                                    throws TransformException {
    return Types.unionType(type.tag(), transformComponents(type));
  }

  protected Type transformTypeUnionTag(TagType type)
                                    throws TransformException {
    return type;
  }

  protected Type transformTypeUnsignedBv(BitVectorType type)
                                    throws TransformException {
    return type;
  }

  protected Type transformTypeVector(VectorType type)
                                    throws TransformException {
    return Types.vector(transformType(type.baseType()), type.size());
  }

  protected List<DatatypeComponent> transformComponents(AggregateType type)
                                    throws TransformException {
    List<DatatypeComponent> result = new ArrayList<DatatypeComponent>();
    for (DatatypeComponent c: type.components()) {
      result.add(transformDatatypeComponent(c));
    }
    return result;
  }

  protected DatatypeComponent transformDatatypeComponent(DatatypeComponent c)
                                    throws TransformException {
    if (c.isPadding()) {
      return c;
    }
    return DatatypeComponent.field(c.name(), transformType(c.type()));
  }

  protected Parameter transformParameter(Parameter p)
                                    throws TransformException {
    return new Parameter(p.identifier(), p.baseName(),
                         transformType(p.type()));
  }

  /*
   * Expressions
   */

  public Expr transformExpr(Expr e) throws TransformException {
    Expr result;
    switch (e.kind()) {
      case ADDRESS_OF:
        result = transformExprAddressOf(e);
        break;
      case ARRAY:
        result = transformExprArray(e);
        break;
      case ARRAY_OF:
        result = transformExprArrayOf(e);
        break;
      case ASSIGN:
        result = transformExprAssign(e);
        break;
      case BIN_OP:
        result = transformExprBinOp(e);
        break;
      case BOOL_CONSTANT:
        result = transformExprBoolConstant(e);
        break;
      case BYTE_EXTRACT:
        result = transformExprByteExtract(e);
        break;
      case C_BOOL_CONSTANT:
        result = transformExprCBoolConstant(e);
        break;
      case DEREFERENCE:
        result = transformExprDereference(e);
        break;
      case DOUBLE_CONSTANT:
        result = transformExprDoubleConstant(e);
        break;
      case FLOAT_CONSTANT:
        result = transformExprFloatConstant(e);
        break;
      case FUNCTION_CALL:
        result = transformExprFunctionCall(e);
        break;
      case IF:
        result = transformExprIf(e);
        break;
      case INDEX:
        result = transformExprIndex(e);
        break;
      case INT_CONSTANT:
        result = transformExprIntConstant(e);
        break;
      case MEMBER:
        result = transformExprMember(e);
        break;
      case NONDET:
        result = transformExprNondet(e);
        break;
      case POINTER_CONSTANT:
        result = transformExprPointerConstant(e);
        break;
      case SELF_OP:
        result = transformExprSelfOp(e);
        break;
      case STATEMENT_EXPRESSION:
        result = transformExprStatementExpression(e);
        break;
      case STRING_CONSTANT:
        result = transformExprStringConstant(e);
        break;
      case STRUCT:
        result = transformExprStruct(e);
        break;
      case SYMBOL:
        result = transformExprSymbol(e);
        break;
      case TYPECAST:
        result = transformExprTypecast(e);
        break;
      case UNION:
        result = transformExprUnion(e);
        break;
      case UN_OP:
        result = transformExprUnOp(e);
        break;
      case VECTOR:
        result = transformExprVector(e);
        break;
      default:
        throw new GotocRuntimeError("Unknown expression kind " + e.kind());
    }
    return result.withLocation(transformLocation(e.location()));
  }

  protected List<Expr> transformExprs(List<Expr> exprs)
                                    throws TransformException {
    List<Expr> result = new ArrayList<Expr>(exprs.size());
    for (Expr e: exprs) {
      result.add(transformExpr(e));
    }
    return result;
  }

  protected Expr transformExprAddressOf(Expr e) throws TransformException {
    return transformExpr(e.operand(0)).addressOf();
  }

  protected Expr transformExprArray(Expr e) throws TransformException {
    return Expr.arrayExpr(transformType(e.type()),
                          transformExprs(e.operands()));
  }

  protected Expr transformExprArrayOf(Expr e) throws TransformException {
    long size = ((ArrayType)e.type()).size();
    return transformExpr(e.operand(0)).arrayConstant(size);
  }

  protected Expr transformExprAssign(Expr e) throws TransformException {
    Expr lhs = transformExpr(e.operand(0));
    return lhs.assignExpr(transformExpr(e.operand(1)));
  }

  protected Expr transformExprBinOp(Expr e) throws TransformException {
    Expr lhs = transformExpr(e.operand(0));
    Expr rhs = transformExpr(e.operand(1));
    return lhs.binop(e.binaryOp(), rhs);
  }

  protected Expr transformExprBoolConstant(Expr e)
                                    throws TransformException {
    return Expr.boolConstant(e.boolValue());
  }

  protected Expr transformExprByteExtract(Expr e) throws TransformException {
    return transformExpr(e.operand(0)).byteExtract(transformType(e.type()),
                                                   e.offset());
  }

  protected Expr transformExprCBoolConstant(Expr e)
                                    throws TransformException {
    return Expr.cBoolConstant(e.boolValue());
  }

  protected Expr transformExprDereference(Expr e) throws TransformException {
    return transformExpr(e.operand(0)).dereference();
  }

  protected Expr transformExprDoubleConstant(Expr e)
                                    throws TransformException {
    return Expr.doubleConstant(e.doubleValue());
  }

  protected Expr transformExprFloatConstant(Expr e)
                                    throws TransformException {
    return Expr.floatConstant(e.floatValue());
  }

  protected Expr transformExprFunctionCall(Expr e)
                                    throws TransformException {
    Expr function = transformExpr(e.function());
    return function.call(transformExprs(e.arguments()));
  }

  protected Expr transformExprIf(Expr e) throws TransformException {
    return Expr.ternary(transformExpr(e.operand(0)),
                        transformExpr(e.operand(1)),
                        transformExpr(e.operand(2)));
  }

  protected Expr transformExprIndex(Expr e) throws TransformException {
    Expr array = transformExpr(e.operand(0));
    return array.index(transformExpr(e.operand(1)));
  }

  protected Expr transformExprIntConstant(Expr e)
                                    throws TransformException {
    return Expr.intConstant(e.intValue(), transformType(e.type()));
  }

  protected Expr transformExprMember(Expr e) throws TransformException {
    Expr lhs = transformExpr(e.operand(0));
    return lhs.member(e.field(), outputTable());
  }

  protected Expr transformExprNondet(Expr e) throws TransformException {
    return Expr.nondet(transformType(e.type()));
  }

  protected Expr transformExprPointerConstant(Expr e)
                                    throws TransformException {
    return Expr.pointerConstant(e.intValue().longValue(),
                                transformType(e.type()));
  }

  protected Expr transformExprSelfOp(Expr e) throws TransformException {
    return transformExpr(e.operand(0)).selfOp(e.selfOp());
  }

  protected Expr transformExprStatementExpression(Expr e)
                                    throws TransformException {
    return Expr.statementExpression(transformStmts(e.statements()),
                                    transformType(e.type()));
  }

  protected Expr transformExprStringConstant(Expr e)
                                    throws TransformException {
    return Expr.stringConstant(e.stringValue());
  }

  protected Expr transformExprStruct(Expr e) throws TransformException {
    return Expr.structExpr(transformType(e.type()),
                           transformExprs(e.operands()), outputTable());
  }

  protected Expr transformExprSymbol(Expr e) throws TransformException {
    return Expr.symbol(e.identifier(), transformType(e.type()));
  }

  protected Expr transformExprTypecast(Expr e) throws TransformException {
    return transformExpr(e.operand(0)).castTo(transformType(e.type()));
  }

  protected Expr transformExprUnion(Expr e) throws TransformException {
    return Expr.unionExpr(transformType(e.type()), e.field(),
                          transformExpr(e.operand(0)), outputTable());
  }

  protected Expr transformExprUnOp(Expr e) throws TransformException {
    return transformExpr(e.operand(0)).unop(e.unaryOp());
  }

  protected Expr transformExprVector(Expr e) throws TransformException {
    return Expr.vectorExpr(transformType(e.type()),
                           transformExprs(e.operands()));
  }

  /*
   * Statements
   */

  public Stmt transformStmt(Stmt s) throws TransformException {
    Stmt result;
    switch (s.kind()) {
      case ASSERT:
        result = transformStmtAssert(s);
        break;
      case ASSIGN:
        result = transformStmtAssign(s);
        break;
      case ASSUME:
        result = transformStmtAssume(s);
        break;
      case ATOMIC_BLOCK:
        result = transformStmtAtomicBlock(s);
        break;
      case BLOCK:
        result = transformStmtBlock(s);
        break;
      case BREAK:
        result = transformStmtBreak(s);
        break;
      case CONTINUE:
        result = transformStmtContinue(s);
        break;
      case DECL:
        result = transformStmtDecl(s);
        break;
      case EXPRESSION:
        result = transformStmtExpression(s);
        break;
      case FOR:
        result = transformStmtFor(s);
        break;
      case FUNCTION_CALL:
        result = transformStmtFunctionCall(s);
        break;
      case GOTO:
        result = transformStmtGoto(s);
        break;
      case IF_THEN_ELSE:
        result = transformStmtIfThenElse(s);
        break;
      case LABEL:
        result = transformStmtLabel(s);
        break;
      case RETURN:
        result = transformStmtReturn(s);
        break;
      case SKIP:
        result = transformStmtSkip(s);
        break;
      case SWITCH:
        result = transformStmtSwitch(s);
        break;
      case WHILE:
        result = transformStmtWhile(s);
        break;
      default:
        throw new GotocRuntimeError("Unknown statement kind " + s.kind());
    }
    return result.withLocation(transformLocation(s.location()));
  }

  protected List<Stmt> transformStmts(List<Stmt> stmts)
                                    throws TransformException {
    List<Stmt> result = new ArrayList<Stmt>(stmts.size());
    for (Stmt s: stmts) {
      result.add(transformStmt(s));
    }
    return result;
  }

  private Expr transformOptExpr(Expr e) throws TransformException {
    return e == null ? null : transformExpr(e);
  }

  private Stmt transformOptStmt(Stmt s) throws TransformException {
    return s == null ? null : transformStmt(s);
  }

  protected Stmt transformStmtAssert(Stmt s) throws TransformException {
    return Stmt.assertion(transformExpr(s.cond()), s.propertyClass(),
                          s.message());
  }

  protected Stmt transformStmtAssign(Stmt s) throws TransformException {
    Expr lhs = transformExpr(s.lhs());
    Expr rhs = transformExpr(s.rhs());
    return Stmt.assign(lhs, rhs);
  }

  protected Stmt transformStmtAssume(Stmt s) throws TransformException {
    return Stmt.assume(transformExpr(s.cond()));
  }

  protected Stmt transformStmtAtomicBlock(Stmt s) throws TransformException {
    return Stmt.atomicBlock(transformStmts(s.body()));
  }

  protected Stmt transformStmtBlock(Stmt s) throws TransformException {
    return Stmt.block(transformStmts(s.body()));
  }

  protected Stmt transformStmtBreak(Stmt s) throws TransformException {
    return Stmt.breakStmt();
  }

  protected Stmt transformStmtContinue(Stmt s) throws TransformException {
    return Stmt.continueStmt();
  }

  protected Stmt transformStmtDecl(Stmt s) throws TransformException {
    Expr lhs = transformExpr(s.lhs());
    return Stmt.decl(lhs, transformOptExpr(s.value()));
  }

  protected Stmt transformStmtExpression(Stmt s) throws TransformException {
    return Stmt.expression(transformExpr(s.expr()));
  }

  protected Stmt transformStmtFor(Stmt s) throws TransformException {
    Stmt init = transformStmt(s.init());
    Expr cond = transformExpr(s.cond());
    Stmt update = transformStmt(s.update());
    Stmt body = transformStmt(s.loopBody());
    return Stmt.forLoop(init, cond, update, body);
  }

  protected Stmt transformStmtFunctionCall(Stmt s)
                                    throws TransformException {
    Expr lhs = transformOptExpr(s.callLhs());
    Expr function = transformExpr(s.function());
    return Stmt.functionCall(lhs, function, transformExprs(s.arguments()));
  }

  protected Stmt transformStmtGoto(Stmt s) throws TransformException {
    return Stmt.gotoStmt(s.label());
  }

  protected Stmt transformStmtIfThenElse(Stmt s) throws TransformException {
    Expr cond = transformExpr(s.cond());
    Stmt thenBranch = transformStmt(s.thenBranch());
    return Stmt.ifThenElse(cond, thenBranch,
                           transformOptStmt(s.elseBranch()));
  }

  protected Stmt transformStmtLabel(Stmt s) throws TransformException {
    return Stmt.label(s.label(), transformStmt(s.loopBody()));
  }

  protected Stmt transformStmtReturn(Stmt s) throws TransformException {
    return Stmt.ret(transformOptExpr(s.value()));
  }

  protected Stmt transformStmtSkip(Stmt s) throws TransformException {
    return Stmt.skip();
  }

  protected Stmt transformStmtSwitch(Stmt s) throws TransformException {
    Expr control = transformExpr(s.control());
    List<SwitchCase> cases = new ArrayList<SwitchCase>();
    for (SwitchCase c: s.cases()) {
      cases.add(new SwitchCase(transformExpr(c.caseValue()),
                               transformStmt(c.body())));
    }
    return Stmt.switchStmt(control, cases,
                           transformOptStmt(s.defaultCase()));
  }

  protected Stmt transformStmtWhile(Stmt s) throws TransformException {
    Expr cond = transformExpr(s.cond());
    return Stmt.whileLoop(cond, transformStmt(s.loopBody()));
  }
}
