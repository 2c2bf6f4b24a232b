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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.gotoc.common.Logging;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Operators.BinaryOperator;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolValue;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.CodeType;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

/**
 * Rewrite expressions that have no direct C equivalent, and close the
 * program so it can be compiled on its own:
 * <ul>
 * <li>implication becomes (bool)(!a | b)</li>
 * <li>integer constants wider than 64 bits are built from two halves</li>
 * <li>vector indexing goes through a pointer to the element type</li>
 * <li>byte extracts at offset 0 go through a union</li>
 * <li>extern functions get a body returning a nondet value</li>
 * <li>extern statics are initialized to nondet values in a new main,
 *     which also calls the original main</li>
 * </ul>
 */
public class ExprTransformer extends Transformer {

  public static final String MAIN = "main";
  public static final String RENAMED_MAIN = "main_";
  public static final String TRANSMUTE_SRC = "src";
  public static final String TRANSMUTE_DST = "dst";

  private static final BigInteger LOW_64_MASK =
                    BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

  private UniqueNames names;

  /** new name of user main, or null if none */
  private String renamedMain;

  /** extern static => nondet initializer, in visit order */
  private Map<String, Expr> emptyStatics;

  /** "S_to_T" => tag of union used for that byte extract */
  private Map<String, String> transmuteUnions;

  @Override
  public String getPassName() {
    return "Desugar expressions";
  }

  @Override
  protected void preprocess() throws TransformException {
    names = UniqueNames.fromSettings();
    names.reserveAll(inputTable().names());
    emptyStatics = new LinkedHashMap<String, Expr>();
    transmuteUnions = new HashMap<String, String>();

    Symbol main = inputTable().lookup(MAIN);
    if (main != null) {
      renamedMain = names.claim(RENAMED_MAIN);
      logger.debug("Renaming " + MAIN + " to " + renamedMain);
    } else {
      renamedMain = null;
    }
  }

  @Override
  protected Symbol transformSymbol(Symbol sym) throws TransformException {
    Symbol result;
    if (sym.isExtern() && sym.isFunction()) {
      result = stubExternFunction(sym);
    } else if (sym.isExtern()) {
      result = emptyExternStatic(sym);
    } else {
      result = super.transformSymbol(sym);
    }

    if (renamedMain != null && sym.name().equals(MAIN)) {
      result = result.withName(renamedMain)
                     .withBaseName(renamedMain)
                     .withPrettyName(renamedMain)
                     .withLocation(sym.location().withFunction(renamedMain));
    }
    return result;
  }

  /**
   * Give an extern function a body that returns a nondet value.
   * Unnamed parameters are named after their type.
   */
  private Symbol stubExternFunction(Symbol sym) throws TransformException {
    if (!sym.value().isNone()) {
      throw new GotocRuntimeError("Extern function " + sym.name() +
                                  " has a body");
    }
    CodeType type = transformType(sym.type()).asCode();
    List<Parameter> params = new ArrayList<Parameter>();
    for (Parameter p: type.parameters()) {
      params.add(addParameterIdentifier(p));
    }
    Type ret = type.returnType();
    CodeType newType = type.isVariadic() ? Types.variadicCode(params, ret)
                                         : Types.code(params, ret);
    Stmt body = Stmt.ret(ret.isEmpty() ? null : Expr.nondet(ret));
    Logging.uniqueWarn("No body for extern function " + sym.name() +
                       ": returning nondet values");
    return sym.withIsExtern(false)
              .withType(newType)
              .withValue(SymbolValue.of(Stmt.block(body)));
  }

  private Parameter addParameterIdentifier(Parameter p)
                                    throws TransformException {
    if (p.identifier() != null) {
      if (inputTable().contains(p.identifier())) {
        return p;
      }
      // Definitions need their parameters in the table
      Symbol added = outputTable().lookup(p.identifier());
      if (added != null && added.isParameter() &&
          added.type().equals(p.type())) {
        return p;
      }
      String name = p.identifier();
      if (!names.reserve(name)) {
        name = names.claim(p.identifier());
      }
      String base = p.baseName() != null ? p.baseName() : p.identifier();
      Symbol paramSym = Symbol.parameter(name, base, p.type(),
                                         Location.none());
      outputTable().insert(paramSym);
      return paramSym.toParameter();
    }
    String name = names.claim("__" + p.type().toIdentifier());
    Symbol paramSym = Symbol.parameter(name, name, p.type(),
                                       Location.none());
    outputTable().insert(paramSym);
    return paramSym.toParameter();
  }

  /**
   * Turn extern static into a definition, initialized to nondet in main
   */
  private Symbol emptyExternStatic(Symbol sym) throws TransformException {
    if (!sym.isStaticLifetime()) {
      throw new GotocRuntimeError("Extern object " + sym.name() +
                                  " is not a static variable");
    }
    Type type = transformType(sym.type());
    emptyStatics.put(sym.name(), Expr.nondet(type));
    return sym.withIsExtern(false)
              .withType(type)
              .withValue(SymbolValue.none())
              .withLocation(Location.none());
  }

  @Override
  protected void postprocess() throws TransformException {
    List<Stmt> mainBody = new ArrayList<Stmt>();

    for (Map.Entry<String, Expr> e: emptyStatics.entrySet()) {
      Expr lhs = Expr.symbol(e.getKey(), e.getValue().type());
      mainBody.add(Stmt.assign(lhs, e.getValue()));
    }

    Symbol oldMain = renamedMain == null ? null
                                         : outputTable().lookup(renamedMain);
    if (oldMain != null && oldMain.isFunction()) {
      // Any arguments main expects are left to the verifier
      List<Expr> args = new ArrayList<Expr>();
      for (Parameter p: oldMain.type().asCode().parameters()) {
        args.add(Expr.nondet(p.type()));
      }
      mainBody.add(Stmt.expression(oldMain.toExpr().call(args)));
    }

    Type intType = Types.cInt();
    mainBody.add(Stmt.ret(Expr.intConstant(0, intType)));

    Symbol newMain = Symbol.function(MAIN,
            Types.code(new ArrayList<Parameter>(), intType),
            Stmt.block(mainBody), Location.none());
    outputTable().insert(newMain);
  }

  @Override
  protected Expr transformExprSymbol(Expr e) throws TransformException {
    if (renamedMain != null && e.identifier().equals(MAIN)) {
      return Expr.symbol(renamedMain, transformType(e.type()));
    }
    return super.transformExprSymbol(e);
  }

  @Override
  protected Expr transformExprBinOp(Expr e) throws TransformException {
    if (e.binaryOp() != BinaryOperator.IMPLIES) {
      return super.transformExprBinOp(e);
    }
    Expr lhs = transformExpr(e.operand(0));
    Expr rhs = transformExpr(e.operand(1));
    return lhs.not().bitor(rhs).castTo(Types.bool());
  }

  @Override
  protected Expr transformExprIntConstant(Expr e)
                                    throws TransformException {
    Type type = transformType(e.type());
    if (!type.isBitVector() || type.width() <= 64) {
      return Expr.intConstant(e.intValue(), type);
    } else if (type.width() > 128) {
      throw unsupported("int_constant", "integer constant of width " +
                        type.width());
    }

    // Build from unsigned 64 bit halves.  Two's complement handles negatives.
    BigInteger value = e.intValue();
    BigInteger low = value.and(LOW_64_MASK);
    BigInteger high = value.shiftRight(64).and(LOW_64_MASK);
    Type unsigned = Types.unsignedInt(type.width());
    return Expr.intConstant(high, unsigned)
            .shl(Expr.intConstant(64, Types.cInt()))
            .bitor(Expr.intConstant(low, unsigned))
            .castTo(type);
  }

  @Override
  protected Expr transformExprIndex(Expr e) throws TransformException {
    Expr array = transformExpr(e.operand(0));
    Expr index = transformExpr(e.operand(1));
    if (array.type().isVector()) {
      Type elemPtr = array.type().baseType().toPointer();
      return array.addressOf().castTo(elemPtr).index(index);
    }
    return array.index(index);
  }

  @Override
  protected Expr transformExprByteExtract(Expr e) throws TransformException {
    if (e.offset() != 0) {
      throw unsupported("byte_extract", "non-zero offset " + e.offset());
    }
    Expr src = transformExpr(e.operand(0));
    Type dstType = transformType(e.type());

    String unionTag = transmuteUnion(src.type(), dstType);
    Type unionType = Types.unionTag(unionTag);

    String tmpName = names.claim("transmute_tmp");
    Symbol tmp = Symbol.variable(tmpName, tmpName, unionType,
                                 Location.none());
    outputTable().insert(tmp);

    Expr tmpExpr = tmp.toExpr();
    List<Stmt> stmts = Arrays.asList(
        Stmt.decl(tmpExpr, null),
        Stmt.assign(tmpExpr.member(TRANSMUTE_SRC, outputTable()), src),
        Stmt.expression(tmpExpr.member(TRANSMUTE_DST, outputTable())));
    return Expr.statementExpression(stmts, dstType);
  }

  /**
   * @return tag of union with src and dst fields of given types,
   *         declared in output table
   */
  private String transmuteUnion(Type src, Type dst)
                                    throws TransformException {
    String key = src.toIdentifier() + "_to_" + dst.toIdentifier();
    String tag = transmuteUnions.get(key);
    if (tag != null) {
      return tag;
    }
    tag = names.claim(Types.TAG_PREFIX, "transmute_" + key);
    Symbol union = Symbol.unionType(tag, Arrays.asList(
                          DatatypeComponent.field(TRANSMUTE_SRC, src),
                          DatatypeComponent.field(TRANSMUTE_DST, dst)));
    outputTable().insert(union);
    transmuteUnions.put(key, tag);
    logger.debug("Added union " + union.name() + " for byte extract");
    return tag;
  }
}
