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
package exm.gotoc.cbackend;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Operators.BinaryOperator;
import exm.gotoc.ir.tree.Operators.SelfOperator;
import exm.gotoc.ir.tree.Operators.UnaryOperator;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Stmt.StmtKind;
import exm.gotoc.ir.tree.Stmt.SwitchCase;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.AggregateType;
import exm.gotoc.ir.tree.Types.ArrayType;
import exm.gotoc.ir.tree.Types.CIntegerType;
import exm.gotoc.ir.tree.Types.CodeType;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;
import exm.gotoc.ir.tree.Types.TypeDefType;
import exm.gotoc.ir.tree.Types.VectorType;

/**
 * Print a symbol table as C source.
 *
 * The table should have been through the C text passes first: names must
 * be legal identifiers and no nondet values may remain, other than struct
 * padding, which is not printed.  Output order is aggregate declarations,
 * typedefs, function prototypes, globals and then function definitions,
 * each in table order.
 */
public class CTextGenerator {

  private static final String INDENT = "  ";

  private static final List<String> INCLUDES = new ArrayList<String>();
  static {
    INCLUDES.add("stdbool.h");
    INCLUDES.add("stddef.h");
    INCLUDES.add("stdint.h");
    INCLUDES.add("sys/types.h");
  }

  private final Logger logger;
  private final SymbolTable table;
  private final StringBuilder sb = new StringBuilder();

  public CTextGenerator(Logger logger, SymbolTable table) {
    this.logger = logger;
    this.table = table;
  }

  public String generate() {
    sb.setLength(0);
    for (String include: INCLUDES) {
      sb.append("#include <").append(include).append(">\n");
    }
    sb.append("\n");

    List<Symbol> aggregates = new ArrayList<Symbol>();
    List<Symbol> typedefs = new ArrayList<Symbol>();
    List<Symbol> functions = new ArrayList<Symbol>();
    List<Symbol> globals = new ArrayList<Symbol>();
    for (Symbol sym: table.symbols()) {
      if (sym.isType()) {
        if (sym.type().kind() == Types.TypeKind.TYPEDEF ||
            !isAggregateKind(sym.type())) {
          typedefs.add(sym);
        } else {
          aggregates.add(sym);
        }
      } else if (sym.isFunction()) {
        functions.add(sym);
      } else if (sym.isStaticLifetime() && !sym.isParameter()) {
        globals.add(sym);
      }
    }

    // Forward declare all so that pointer members resolve in any order
    for (Symbol sym: aggregates) {
      sb.append(aggregateKeyword(sym.type())).append(" ")
        .append(sym.type().tag()).append(";\n");
    }
    if (!aggregates.isEmpty()) {
      sb.append("\n");
    }
    Set<String> defined = new HashSet<String>();
    for (Symbol sym: aggregates) {
      defineAggregate(sym, defined, new HashSet<String>());
    }

    for (Symbol sym: typedefs) {
      sb.append("typedef ");
      sb.append(declarator(typedefTarget(sym.type()), sym.name()));
      sb.append(";\n");
    }
    if (!typedefs.isEmpty()) {
      sb.append("\n");
    }

    for (Symbol sym: functions) {
      sb.append(functionHeader(sym)).append(";\n");
    }
    if (!functions.isEmpty()) {
      sb.append("\n");
    }

    for (Symbol sym: globals) {
      if (sym.isExtern()) {
        sb.append("extern ");
      }
      sb.append(declarator(sym.type(), sym.name()));
      if (sym.value().isExpr()) {
        sb.append(" = ").append(expr(sym.value().expr()));
      }
      sb.append(";\n");
    }
    if (!globals.isEmpty()) {
      sb.append("\n");
    }

    for (Symbol sym: functions) {
      if (sym.isFunctionDefinition()) {
        sb.append(functionHeader(sym)).append("\n");
        appendBlock(sym.value().stmt(), "");
        sb.append("\n");
      }
    }
    logger.debug("Generated C text for " + table.size() + " symbols");
    return sb.toString();
  }

  private static boolean isAggregateKind(Type type) {
    switch (type.kind()) {
      case STRUCT:
      case UNION:
      case INCOMPLETE_STRUCT:
      case INCOMPLETE_UNION:
        return true;
      default:
        return false;
    }
  }

  private static String aggregateKeyword(Type type) {
    switch (type.kind()) {
      case STRUCT:
      case STRUCT_TAG:
      case INCOMPLETE_STRUCT:
        return "struct";
      default:
        return "union";
    }
  }

  /** Typedef symbols may hold the typedef type or the aliased type */
  private static Type typedefTarget(Type type) {
    if (type.kind() == Types.TypeKind.TYPEDEF) {
      return ((TypeDefType)type).type();
    }
    return type;
  }

  /**
   * Print definition of aggregate after those of aggregates it contains
   * by value
   */
  private void defineAggregate(Symbol sym, Set<String> defined,
                               Set<String> inProgress) {
    if (!sym.isAggregateDeclaration() || defined.contains(sym.name())) {
      return;
    }
    if (!inProgress.add(sym.name())) {
      throw new GotocRuntimeError("Aggregate " + sym.name() +
                                  " contains itself by value");
    }
    AggregateType type = sym.type().asAggregate();
    for (DatatypeComponent c: type.fields()) {
      Symbol dep = byValueAggregate(c.type());
      if (dep != null) {
        defineAggregate(dep, defined, inProgress);
      }
    }

    sb.append(aggregateKeyword(type)).append(" ").append(type.tag())
      .append("\n{\n");
    for (DatatypeComponent c: type.components()) {
      sb.append(INDENT);
      if (c.isPadding()) {
        long bits = c.paddingBits();
        if (bits % 8 == 0) {
          sb.append("char ").append(c.name()).append("[")
            .append(bits / 8).append("]");
        } else {
          sb.append("unsigned int ").append(c.name()).append(" : ")
            .append(bits);
        }
      } else {
        sb.append(declarator(c.type(), c.name()));
      }
      sb.append(";\n");
    }
    sb.append("};\n\n");
    defined.add(sym.name());
  }

  private Symbol byValueAggregate(Type type) {
    switch (type.kind()) {
      case STRUCT_TAG:
      case UNION_TAG:
        return table.lookup(Types.tagSymbolName(type.tag()));
      case ARRAY:
      case VECTOR:
        return byValueAggregate(type.baseType());
      case TYPEDEF:
        return byValueAggregate(((TypeDefType)type).type());
      default:
        return null;
    }
  }

  /*
   * Types
   */

  /**
   * Name of a type that needs no declarator syntax
   */
  public static String typeName(Type type) {
    switch (type.kind()) {
      case BOOL:
        return "bool";
      case C_INTEGER: {
        CIntegerType ct = (CIntegerType)type;
        return ct.intKind().cName();
      }
      case DOUBLE:
        return "double";
      case FLOAT:
        return "float";
      case EMPTY:
        return "void";
      case SIGNED_BV:
        return bitVectorName(true, type.width());
      case UNSIGNED_BV:
        return bitVectorName(false, type.width());
      case STRUCT:
      case STRUCT_TAG:
      case INCOMPLETE_STRUCT:
        return "struct " + type.tag();
      case UNION:
      case UNION_TAG:
      case INCOMPLETE_UNION:
        return "union " + type.tag();
      case TYPEDEF:
        return ((TypeDefType)type).name();
      default:
        // Pointer, array, vector, code
        return declarator(type, "");
    }
  }

  private static String bitVectorName(boolean signed, long width) {
    if (width == 8 || width == 16 || width == 32 || width == 64) {
      return (signed ? "int" : "uint") + width + "_t";
    } else if (width == 128) {
      return signed ? "__int128" : "unsigned __int128";
    }
    return (signed ? "signed" : "unsigned") +
            " __CPROVER_bitvector[" + width + "]";
  }

  /**
   * Declaration of name with type, using C declarator syntax
   * @param name declared name, or empty for an abstract declarator
   */
  public static String declarator(Type type, String name) {
    switch (type.kind()) {
      case POINTER: {
        Type base = type.baseType();
        String inner = "*" + name;
        if (base.isArray() || base.isCode() || base.isVector()) {
          inner = "(" + inner + ")";
        }
        return declarator(base, inner);
      }
      case ARRAY:
        return declarator(type.baseType(),
                          name + "[" + ((ArrayType)type).size() + "]");
      case VECTOR:
        return declarator(type.baseType(),
                          name + "[" + ((VectorType)type).size() + "]");
      case CODE:
        return declarator(type.asCode().returnType(),
                          name + "(" + parameterList(type.asCode(), false)
                          + ")");
      default: {
        String typeName = typeName(type);
        return name.isEmpty() ? typeName : typeName + " " + name;
      }
    }
  }

  private static String parameterList(CodeType code, boolean named) {
    List<String> params = new ArrayList<String>();
    int i = 0;
    for (Parameter p: code.parameters()) {
      String pname = "";
      if (named) {
        pname = p.identifier() != null ? p.identifier() : "arg" + i;
      }
      params.add(declarator(p.type(), pname));
      i++;
    }
    if (code.isVariadic()) {
      params.add("...");
    }
    if (params.isEmpty()) {
      return "void";
    }
    return StringUtils.join(params, ", ");
  }

  private String functionHeader(Symbol sym) {
    CodeType code = sym.type().asCode();
    String header = sym.name() + "(" + parameterList(code, true) + ")";
    return declarator(code.returnType(), header);
  }

  /*
   * Expressions
   */

  /**
   * Expression, parenthesized unless it is a primary expression
   */
  private String atom(Expr e) {
    switch (e.kind()) {
      case SYMBOL:
      case INT_CONSTANT:
      case BOOL_CONSTANT:
      case C_BOOL_CONSTANT:
      case STRING_CONSTANT:
      case BIN_OP:
      case IF:
      case FUNCTION_CALL:
      case INDEX:
      case MEMBER:
        return expr(e);
      default:
        return "(" + expr(e) + ")";
    }
  }

  private List<String> exprs(List<Expr> es) {
    List<String> result = new ArrayList<String>(es.size());
    for (Expr e: es) {
      result.add(expr(e));
    }
    return result;
  }

  public String expr(Expr e) {
    switch (e.kind()) {
      case ADDRESS_OF:
        return "&" + atom(e.operand(0));
      case ARRAY:
      case VECTOR:
        return "(" + typeName(e.type()) + "){" +
               StringUtils.join(exprs(e.operands()), ", ") + "}";
      case ARRAY_OF: {
        long size = ((ArrayType)e.type()).size();
        return "(" + typeName(e.type()) + "){[0 ... " + (size - 1) +
               "] = " + expr(e.operand(0)) + "}";
      }
      case ASSIGN:
        return "(" + expr(e.operand(0)) + " = " + expr(e.operand(1)) + ")";
      case BIN_OP:
        return binop(e);
      case BOOL_CONSTANT:
        return e.boolValue() ? "true" : "false";
      case BYTE_EXTRACT: {
        String ptr = "(" + declarator(e.type().toPointer(), "") + ")";
        if (e.offset() == 0) {
          return "*" + ptr + "&" + atom(e.operand(0));
        }
        return "*" + ptr + "((char *)&" + atom(e.operand(0)) + " + " +
               e.offset() + ")";
      }
      case C_BOOL_CONSTANT:
        return e.boolValue() ? "1" : "0";
      case DEREFERENCE:
        return "*" + atom(e.operand(0));
      case DOUBLE_CONSTANT:
        return doubleLiteral(e.doubleValue());
      case FLOAT_CONSTANT:
        return floatLiteral(e.floatValue());
      case FUNCTION_CALL:
        return atom(e.function()) + "(" +
               StringUtils.join(exprs(e.arguments()), ", ") + ")";
      case IF:
        return "(" + expr(e.operand(0)) + " ? " + expr(e.operand(1)) +
               " : " + expr(e.operand(2)) + ")";
      case INDEX:
        return atom(e.operand(0)) + "[" + expr(e.operand(1)) + "]";
      case INT_CONSTANT:
        return intLiteral(e.intValue(), e.type());
      case MEMBER:
        return atom(e.operand(0)) + "." + e.field();
      case NONDET:
        throw new GotocRuntimeError("Nondet value of type " + e.type() +
                                    " has no C representation");
      case POINTER_CONSTANT:
        if (e.intValue().signum() == 0) {
          return "NULL";
        }
        return "(" + typeName(e.type()) + ")" + e.intValue();
      case SELF_OP: {
        SelfOperator op = e.selfOp();
        String operand = atom(e.operand(0));
        return op.isPrefix() ? op.cSyntax() + operand
                             : operand + op.cSyntax();
      }
      case STATEMENT_EXPRESSION: {
        List<String> parts = new ArrayList<String>();
        for (Stmt s: e.statements()) {
          parts.add(inlineStmt(s) + ";");
        }
        return "({ " + StringUtils.join(parts, " ") + " })";
      }
      case STRING_CONSTANT:
        return stringLiteral(e.stringValue());
      case STRUCT:
        return structLiteral(e);
      case SYMBOL:
        return e.identifier();
      case TYPECAST:
        return "(" + typeName(e.type()) + ")" + atom(e.operand(0));
      case UNION:
        return "(" + typeName(e.type()) + "){ ." + e.field() + " = " +
               expr(e.operand(0)) + " }";
      case UN_OP: {
        UnaryOperator op = e.unaryOp();
        if (op.cSyntax() == null) {
          return "__builtin_" + op.irepId() + "(" + expr(e.operand(0)) + ")";
        }
        return op.cSyntax() + atom(e.operand(0));
      }
      default:
        throw new GotocRuntimeError("Unknown expression kind " + e.kind());
    }
  }

  private String binop(Expr e) {
    BinaryOperator op = e.binaryOp();
    if (op.cSyntax() == null) {
      throw new GotocRuntimeError("Operator " + op + " has no C syntax");
    }
    return "(" + expr(e.operand(0)) + " " + op.cSyntax() + " " +
           expr(e.operand(1)) + ")";
  }

  private String structLiteral(Expr e) {
    List<DatatypeComponent> comps = table.lookupComponents(e.type());
    List<String> values = new ArrayList<String>();
    for (int i = 0; i < comps.size(); i++) {
      DatatypeComponent c = comps.get(i);
      if (!c.isPadding()) {
        values.add("." + c.name() + " = " + expr(e.operand(i)));
      }
    }
    return "(" + typeName(e.type()) + "){" + StringUtils.join(values, ", ")
           + "}";
  }

  private static String intLiteral(BigInteger value, Type type) {
    String digits = value.toString();
    boolean unsigned = type.kind() == Types.TypeKind.UNSIGNED_BV ||
        (type instanceof CIntegerType &&
         !((CIntegerType)type).intKind().isSigned());
    if (unsigned && value.signum() >= 0) {
      digits += "u";
    }
    if (value.bitLength() >= 32) {
      digits += "ll";
    }
    if (!hasLiteralWidth(type)) {
      // A bare literal is at most 64 bits wide
      return "((" + typeName(type) + ")" + digits + ")";
    }
    return value.signum() < 0 ? "(" + digits + ")" : digits;
  }

  /**
   * @return true if a literal converts to type without a cast
   */
  private static boolean hasLiteralWidth(Type type) {
    if (!type.isBitVector()) {
      return true;
    }
    long width = type.width();
    return width == 8 || width == 16 || width == 32 || width == 64;
  }

  private static String doubleLiteral(double d) {
    if (Double.isNaN(d)) {
      return "__builtin_nan(\"\")";
    } else if (Double.isInfinite(d)) {
      return d > 0 ? "__builtin_inf()" : "(-__builtin_inf())";
    }
    String s = Double.toString(d);
    return d < 0 ? "(" + s + ")" : s;
  }

  private static String floatLiteral(float f) {
    if (Float.isNaN(f)) {
      return "__builtin_nanf(\"\")";
    } else if (Float.isInfinite(f)) {
      return f > 0 ? "__builtin_inff()" : "(-__builtin_inff())";
    }
    String s = Float.toString(f) + "f";
    return f < 0 ? "(" + s + ")" : s;
  }

  static String stringLiteral(String s) {
    StringBuilder lit = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          lit.append("\\\"");
          break;
        case '\\':
          lit.append("\\\\");
          break;
        case '\n':
          lit.append("\\n");
          break;
        case '\t':
          lit.append("\\t");
          break;
        case '\r':
          lit.append("\\r");
          break;
        default:
          if (c < 0x20 || c >= 0x7f) {
            // Octal escapes end after three digits, unlike hex
            lit.append(String.format("\\%03o", (int)c & 0xff));
          } else {
            lit.append(c);
          }
      }
    }
    return lit.append("\"").toString();
  }

  /*
   * Statements
   */

  /**
   * Render a simple statement without trailing semicolon, for use in
   * for loop headers and statement expressions
   */
  private String inlineStmt(Stmt s) {
    switch (s.kind()) {
      case ASSIGN:
        return expr(s.lhs()) + " = " + expr(s.rhs());
      case DECL: {
        String decl = declarator(s.lhs().type(), s.lhs().identifier());
        if (s.value() != null) {
          decl += " = " + expr(s.value());
        }
        return decl;
      }
      case EXPRESSION:
        return expr(s.expr());
      case FUNCTION_CALL: {
        String call = atom(s.function()) + "(" +
                      StringUtils.join(exprs(s.arguments()), ", ") + ")";
        if (s.callLhs() != null) {
          return expr(s.callLhs()) + " = " + call;
        }
        return call;
      }
      case SKIP:
        return "";
      default:
        throw new GotocRuntimeError("Statement cannot appear inline: " +
                                    s.kind());
    }
  }

  private void appendBlock(Stmt s, String indent) {
    sb.append(indent).append("{\n");
    if (s.kind() == StmtKind.BLOCK) {
      for (Stmt child: s.body()) {
        appendStmt(child, indent + INDENT);
      }
    } else {
      appendStmt(s, indent + INDENT);
    }
    sb.append(indent).append("}\n");
  }

  private void appendStmt(Stmt s, String indent) {
    switch (s.kind()) {
      case ASSERT:
        sb.append(indent).append("__CPROVER_assert(")
          .append(expr(s.cond())).append(", ")
          .append(stringLiteral(s.message() == null ? "" : s.message()))
          .append(");\n");
        break;
      case ASSUME:
        sb.append(indent).append("__CPROVER_assume(")
          .append(expr(s.cond())).append(");\n");
        break;
      case ATOMIC_BLOCK:
        sb.append(indent).append("__CPROVER_atomic_begin();\n");
        for (Stmt child: s.body()) {
          appendStmt(child, indent);
        }
        sb.append(indent).append("__CPROVER_atomic_end();\n");
        break;
      case BLOCK:
        appendBlock(s, indent);
        break;
      case BREAK:
        sb.append(indent).append("break;\n");
        break;
      case CONTINUE:
        sb.append(indent).append("continue;\n");
        break;
      case FOR:
        sb.append(indent).append("for (").append(inlineStmt(s.init()))
          .append("; ").append(expr(s.cond())).append("; ")
          .append(inlineStmt(s.update())).append(")\n");
        appendBlock(s.loopBody(), indent);
        break;
      case GOTO:
        sb.append(indent).append("goto ").append(s.label()).append(";\n");
        break;
      case IF_THEN_ELSE:
        sb.append(indent).append("if (").append(expr(s.cond()))
          .append(")\n");
        appendBlock(s.thenBranch(), indent);
        if (s.elseBranch() != null) {
          sb.append(indent).append("else\n");
          appendBlock(s.elseBranch(), indent);
        }
        break;
      case LABEL:
        sb.append(s.label()).append(":\n");
        appendStmt(s.loopBody(), indent);
        break;
      case RETURN:
        sb.append(indent).append("return");
        if (s.value() != null) {
          sb.append(" ").append(expr(s.value()));
        }
        sb.append(";\n");
        break;
      case SWITCH:
        sb.append(indent).append("switch (").append(expr(s.control()))
          .append(")\n").append(indent).append("{\n");
        for (SwitchCase c: s.cases()) {
          sb.append(indent).append("case ").append(expr(c.caseValue()))
            .append(":\n");
          appendStmt(c.body(), indent + INDENT);
        }
        if (s.defaultCase() != null) {
          sb.append(indent).append("default:\n");
          appendStmt(s.defaultCase(), indent + INDENT);
        }
        sb.append(indent).append("}\n");
        break;
      case WHILE:
        sb.append(indent).append("while (").append(expr(s.cond()))
          .append(")\n");
        appendBlock(s.loopBody(), indent);
        break;
      default:
        sb.append(indent).append(inlineStmt(s)).append(";\n");
        break;
    }
  }
}
