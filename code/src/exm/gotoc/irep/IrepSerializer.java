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
package exm.gotoc.irep;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.gson.stream.JsonWriter;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Operators.UnaryOperator;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Stmt.SwitchCase;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.SymbolValue;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.AggregateType;
import exm.gotoc.ir.tree.Types.CIntegerType;
import exm.gotoc.ir.tree.Types.CodeType;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;
import exm.gotoc.ir.tree.Types.TypeDefType;

/**
 * Convert a symbol table to CBMC ireps and write it as JSON.
 *
 * Targets a 64 bit little endian machine with 32 bit int and signed
 * 8 bit char.  Symbols are written in name order so the output depends
 * only on table contents.
 */
public class IrepSerializer {

  public static final int BOOL_WIDTH = 8;
  public static final int CHAR_WIDTH = 8;
  public static final int INT_WIDTH = 32;
  public static final int POINTER_WIDTH = 64;

  private final boolean prettyPrint;

  public IrepSerializer(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  public IrepSerializer() {
    this(false);
  }

  /**
   * Write {"symbolTable": {name: symbol, ...}}
   */
  public void write(Logger logger, SymbolTable table, Writer output)
                                                    throws IOException {
    JsonWriter out = new JsonWriter(output);
    if (prettyPrint) {
      out.setIndent("  ");
    }
    List<String> names = new ArrayList<String>(table.names());
    Collections.sort(names);

    out.beginObject();
    out.name("symbolTable");
    out.beginObject();
    for (String name: names) {
      out.name(name);
      writeSymbol(out, table.lookup(name));
    }
    out.endObject();
    out.endObject();
    out.flush();
    logger.debug("Wrote " + names.size() + " symbols as irep");
  }

  public String toJson(Logger logger, SymbolTable table) {
    StringWriter sw = new StringWriter();
    try {
      write(logger, table, sw);
    } catch (IOException e) {
      throw new GotocRuntimeError("Error writing to string: " +
                                  e.getMessage());
    }
    return sw.toString();
  }

  private void writeSymbol(JsonWriter out, Symbol sym) throws IOException {
    out.beginObject();
    out.name("type");
    typeIrep(sym.type()).write(out);
    out.name("value");
    valueIrep(sym.value()).write(out);
    out.name("location");
    locationIrep(sym.location()).write(out);
    out.name("name").value(sym.name());
    out.name("module").value(nonNull(sym.module()));
    out.name("baseName").value(nonNull(sym.baseName()));
    out.name("prettyName").value(nonNull(sym.prettyName()));
    out.name("mode").value(nonNull(sym.mode()));
    out.name("isType").value(sym.isType());
    out.name("isMacro").value(false);
    out.name("isExported").value(false);
    out.name("isInput").value(false);
    out.name("isOutput").value(false);
    out.name("isStateVar").value(false);
    out.name("isProperty").value(false);
    out.name("isStaticLifetime").value(sym.isStaticLifetime());
    out.name("isThreadLocal").value(sym.isThreadLocal());
    out.name("isLvalue").value(sym.isLvalue());
    out.name("isFileLocal").value(sym.isFileLocal());
    out.name("isExtern").value(sym.isExtern());
    out.name("isVolatile").value(false);
    out.name("isParameter").value(sym.isParameter());
    out.name("isAuxiliary").value(false);
    out.name("isWeak").value(false);
    out.endObject();
  }

  private static String nonNull(String s) {
    return s == null ? "" : s;
  }

  public Irep valueIrep(SymbolValue value) {
    if (value.isExpr()) {
      return exprIrep(value.expr());
    } else if (value.isStmt()) {
      return stmtIrep(value.stmt());
    } else {
      return Irep.nil();
    }
  }

  public Irep locationIrep(Location loc) {
    if (loc.isNone()) {
      return Irep.nil();
    }
    Irep result = Irep.record()
                      .with("file", loc.file())
                      .with("line", Irep.justInt(loc.line()));
    if (loc.column() > 0) {
      result = result.with("column", Irep.justInt(loc.column()));
    }
    return result.with("function", loc.function());
  }

  /*
   * Types
   */

  public Irep typeIrep(Type type) {
    switch (type.kind()) {
      case ARRAY:
        return Irep.create("array", typeIrep(type.baseType()))
                   .with("size", exprIrep(Expr.intConstant(
                       ((Types.ArrayType)type).size(), Types.sizeT())));
      case BOOL:
        return Irep.justId("bool");
      case C_INTEGER:
        return cIntegerIrep((CIntegerType)type);
      case CODE:
        return codeIrep(type.asCode());
      case DOUBLE:
        return floatbvIrep(52, 64, "double");
      case EMPTY:
        return Irep.justId("empty");
      case FLOAT:
        return floatbvIrep(23, 32, "float");
      case INCOMPLETE_STRUCT:
        return Irep.justId("struct").with("tag", type.tag())
                                    .with("incomplete", Irep.one());
      case INCOMPLETE_UNION:
        return Irep.justId("union").with("tag", type.tag())
                                   .with("incomplete", Irep.one());
      case POINTER:
        return Irep.create("pointer", typeIrep(type.baseType()))
                   .with("width", Irep.justInt(POINTER_WIDTH));
      case SIGNED_BV:
        return Irep.justId("signedbv")
                   .with("width", Irep.justInt(type.width()));
      case UNSIGNED_BV:
        return Irep.justId("unsignedbv")
                   .with("width", Irep.justInt(type.width()));
      case STRUCT:
        return aggregateIrep("struct", type.asAggregate());
      case UNION:
        return aggregateIrep("union", type.asAggregate());
      case STRUCT_TAG:
        return Irep.justId("struct_tag")
                   .with("identifier", Types.tagSymbolName(type.tag()));
      case UNION_TAG:
        return Irep.justId("union_tag")
                   .with("identifier", Types.tagSymbolName(type.tag()));
      case TYPEDEF: {
        TypeDefType td = (TypeDefType)type;
        return typeIrep(td.type()).with("#typedef", td.name());
      }
      case VECTOR:
        return Irep.create("vector", typeIrep(type.baseType()))
                   .with("size", exprIrep(Expr.intConstant(
                       ((Types.VectorType)type).size(), Types.sizeT())));
      default:
        throw new GotocRuntimeError("Unknown type kind: " + type.kind());
    }
  }

  private Irep cIntegerIrep(CIntegerType type) {
    switch (type.intKind()) {
      case BOOL:
        return Irep.justId("c_bool").with("width", Irep.justInt(BOOL_WIDTH));
      case CHAR:
        return Irep.justId("signedbv").with("width", Irep.justInt(CHAR_WIDTH));
      case INT:
        return Irep.justId("signedbv").with("width", Irep.justInt(INT_WIDTH));
      case SIZE_T:
        return Irep.justId("unsignedbv")
                   .with("width", Irep.justInt(POINTER_WIDTH));
      case SSIZE_T:
        return Irep.justId("signedbv")
                   .with("width", Irep.justInt(POINTER_WIDTH));
      default:
        throw new GotocRuntimeError("Unknown C integer: " + type.intKind());
    }
  }

  private static Irep floatbvIrep(int f, int width, String cType) {
    return Irep.justId("floatbv")
               .with("f", Irep.justInt(f))
               .with("width", Irep.justInt(width))
               .with("#c_type", cType);
  }

  private Irep codeIrep(CodeType code) {
    List<Irep> params = new ArrayList<Irep>();
    for (Parameter p: code.parameters()) {
      params.add(parameterIrep(p));
    }
    Irep result = Irep.justId("code")
                      .with("parameters", Irep.create("", params))
                      .with("return_type", typeIrep(code.returnType()));
    if (code.isVariadic()) {
      result = result.with("ellipsis", Irep.one());
    }
    return result;
  }

  public Irep parameterIrep(Parameter p) {
    return Irep.justId("parameter")
               .with("type", typeIrep(p.type()))
               .with("#identifier", p.identifier())
               .with("#base_name", p.baseName());
  }

  private Irep aggregateIrep(String id, AggregateType type) {
    List<Irep> comps = new ArrayList<Irep>();
    for (DatatypeComponent c: type.components()) {
      comps.add(componentIrep(c));
    }
    return Irep.justId(id).with("tag", type.tag())
               .with("components", Irep.create("", comps));
  }

  public Irep componentIrep(DatatypeComponent c) {
    if (c.isPadding()) {
      return Irep.record()
                 .with("#is_padding", Irep.one())
                 .with("name", c.name())
                 .with("type", typeIrep(Types.unsignedInt(c.paddingBits())));
    }
    return Irep.record()
               .with("name", c.name())
               .with("#pretty_name", c.name())
               .with("type", typeIrep(c.type()));
  }

  /**
   * Width of constant bit pattern for type, or -1 if none
   */
  private static long nativeWidth(Type type) {
    switch (type.kind()) {
      case C_INTEGER:
        switch (((CIntegerType)type).intKind()) {
          case BOOL:
            return BOOL_WIDTH;
          case CHAR:
            return CHAR_WIDTH;
          case INT:
            return INT_WIDTH;
          default:
            return POINTER_WIDTH;
        }
      case POINTER:
        return POINTER_WIDTH;
      case TYPEDEF:
        return nativeWidth(((TypeDefType)type).type());
      default:
        return type.width();
    }
  }

  /*
   * Expressions
   */

  public Irep exprIrep(Expr e) {
    return exprValueIrep(e)
            .with("#source_location", locationIrep(e.location()))
            .with("type", typeIrep(e.type()));
  }

  private List<Irep> exprIreps(List<Expr> es) {
    List<Irep> result = new ArrayList<Irep>(es.size());
    for (Expr e: es) {
      result.add(exprIrep(e));
    }
    return result;
  }

  private static Irep sideEffect(String statement, List<Irep> ops) {
    return Irep.create("side_effect", ops).with("statement", statement);
  }

  private static Irep constant(Irep value) {
    return Irep.justId("constant").with("value", value);
  }

  private Irep exprValueIrep(Expr e) {
    switch (e.kind()) {
      case ADDRESS_OF:
        return Irep.create("address_of", exprIreps(e.operands()));
      case ARRAY:
        return Irep.create("array", exprIreps(e.operands()));
      case ARRAY_OF:
        return Irep.create("array_of", exprIreps(e.operands()));
      case ASSIGN:
        return sideEffect("assign", exprIreps(e.operands()));
      case BIN_OP:
        return Irep.create(e.binaryOp().irepId(), exprIreps(e.operands()));
      case BOOL_CONSTANT:
        return constant(Irep.justId(e.boolValue() ? "true" : "false"));
      case BYTE_EXTRACT:
        return Irep.create("byte_extract_little_endian",
                exprIrep(e.operand(0)),
                exprIrep(Expr.intConstant(e.offset(), Types.ssizeT())));
      case C_BOOL_CONSTANT:
        return constant(Irep.justBitPattern(
                  e.boolValue() ? BigInteger.ONE : BigInteger.ZERO,
                  BOOL_WIDTH));
      case DEREFERENCE:
        return Irep.create("dereference", exprIreps(e.operands()));
      case DOUBLE_CONSTANT:
        return constant(Irep.justBitPattern(BigInteger.valueOf(
                  Double.doubleToRawLongBits(e.doubleValue())), 64));
      case FLOAT_CONSTANT:
        return constant(Irep.justBitPattern(BigInteger.valueOf(
                  Float.floatToRawIntBits(e.floatValue())), 32));
      case FUNCTION_CALL:
        return sideEffect("function_call", Arrays.asList(
                  exprIrep(e.function()),
                  Irep.create("arguments", exprIreps(e.arguments()))));
      case IF:
        return Irep.create("if", exprIreps(e.operands()));
      case INDEX:
        return Irep.create("index", exprIreps(e.operands()));
      case INT_CONSTANT: {
        long width = nativeWidth(e.type());
        if (width > 0) {
          return constant(Irep.justBitPattern(e.intValue(), width));
        }
        return constant(Irep.justInt(e.intValue()));
      }
      case MEMBER:
        return Irep.create("member", exprIreps(e.operands()))
                   .with("#lvalue", Irep.one())
                   .with("component_name", e.field());
      case NONDET:
        return sideEffect("nondet", Collections.<Irep>emptyList());
      case POINTER_CONSTANT:
        if (e.intValue().signum() == 0) {
          return constant(Irep.justId("NULL"));
        }
        return constant(Irep.justBitPattern(e.intValue(), POINTER_WIDTH));
      case SELF_OP:
        return sideEffect(e.selfOp().irepId(), exprIreps(e.operands()));
      case STATEMENT_EXPRESSION:
        return sideEffect("statement_expression",
            Collections.singletonList(stmtIrep(Stmt.block(e.statements())
                                          .withLocation(e.location()))));
      case STRING_CONSTANT:
        return Irep.justId("string_constant").with("value", e.stringValue());
      case STRUCT:
        return Irep.create("struct", exprIreps(e.operands()));
      case SYMBOL:
        return Irep.justId("symbol").with("identifier", e.identifier());
      case TYPECAST:
        return Irep.create("typecast", exprIreps(e.operands()));
      case UNION:
        return Irep.create("union", exprIreps(e.operands()))
                   .with("component_name", e.field());
      case UN_OP: {
        Irep result = Irep.create(e.unaryOp().irepId(),
                                  exprIreps(e.operands()));
        if (e.unaryOp() == UnaryOperator.BSWAP) {
          result = result.with("bits_per_byte", Irep.justInt(8));
        }
        return result;
      }
      case VECTOR:
        return Irep.create("vector", exprIreps(e.operands()));
      default:
        throw new GotocRuntimeError("Unknown expression kind: " + e.kind());
    }
  }

  /*
   * Statements
   */

  private static Irep code(String statement, List<Irep> ops) {
    return Irep.create("code", ops).with("statement", statement);
  }

  private static Irep code(String statement, Irep ...ops) {
    return code(statement, Arrays.asList(ops));
  }

  private List<Irep> stmtIreps(List<Stmt> stmts) {
    List<Irep> result = new ArrayList<Irep>(stmts.size());
    for (Stmt s: stmts) {
      result.add(stmtIrep(s));
    }
    return result;
  }

  private Irep optExprIrep(Expr e) {
    return e == null ? Irep.nil() : exprIrep(e);
  }

  private Irep optStmtIrep(Stmt s) {
    return s == null ? Irep.nil() : stmtIrep(s);
  }

  public Irep stmtIrep(Stmt s) {
    Irep result = stmtBodyIrep(s);
    Location loc = s.location();
    if (s.kind() == Stmt.StmtKind.ASSERT && !loc.isNone()) {
      Irep locIrep = locationIrep(loc)
                          .with("comment", s.message())
                          .with("property_class", s.propertyClass());
      return result.with("#source_location", locIrep);
    }
    return result.with("#source_location", locationIrep(loc));
  }

  private Irep stmtBodyIrep(Stmt s) {
    switch (s.kind()) {
      case ASSERT:
        return code("assert", exprIrep(s.cond()));
      case ASSIGN:
        return code("assign", exprIrep(s.lhs()), exprIrep(s.rhs()));
      case ASSUME:
        return code("assume", exprIrep(s.cond()));
      case ATOMIC_BLOCK: {
        List<Irep> body = new ArrayList<Irep>();
        body.add(code("atomic_begin"));
        body.addAll(stmtIreps(s.body()));
        body.add(code("atomic_end"));
        return code("block", body);
      }
      case BLOCK:
        return code("block", stmtIreps(s.body()));
      case BREAK:
        return code("break");
      case CONTINUE:
        return code("continue");
      case DECL:
        if (s.value() == null) {
          return code("decl", exprIrep(s.lhs()));
        }
        return code("decl", exprIrep(s.lhs()), exprIrep(s.value()));
      case EXPRESSION:
        return code("expression", exprIrep(s.expr()));
      case FOR:
        return code("for", stmtIrep(s.init()), exprIrep(s.cond()),
                    stmtIrep(s.update()), stmtIrep(s.loopBody()));
      case FUNCTION_CALL:
        return code("function_call", optExprIrep(s.callLhs()),
                    exprIrep(s.function()),
                    Irep.create("arguments", exprIreps(s.arguments())));
      case GOTO:
        return code("goto").with("destination", s.label());
      case IF_THEN_ELSE:
        return code("ifthenelse", exprIrep(s.cond()),
                    stmtIrep(s.thenBranch()), optStmtIrep(s.elseBranch()));
      case LABEL:
        return code("label", stmtIrep(s.loopBody()))
                   .with("label", s.label());
      case RETURN:
        return code("return", optExprIrep(s.value()));
      case SKIP:
        return code("skip");
      case SWITCH: {
        List<Irep> arms = new ArrayList<Irep>();
        for (SwitchCase c: s.cases()) {
          arms.add(code("switch_case", exprIrep(c.caseValue()),
                        stmtIrep(c.body())));
        }
        if (s.defaultCase() != null) {
          arms.add(code("switch_case", Irep.nil(),
                        stmtIrep(s.defaultCase()))
                   .with("default", Irep.one()));
        }
        return code("switch", exprIrep(s.control()), code("block", arms));
      }
      case WHILE:
        return code("while", exprIrep(s.cond()), stmtIrep(s.loopBody()));
      default:
        throw new GotocRuntimeError("Unknown statement kind: " + s.kind());
    }
  }
}
