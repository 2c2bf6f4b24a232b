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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

/**
 * Replace each nondet value of type T with a call to a function
 * non_det_T() that returns an uninitialized local.  One such function is
 * generated per type, in order of first use.
 *
 * Padding in struct expressions is left alone: it is never read.
 */
public class NondetTransformer extends Transformer {

  public static final String FUNCTION_PREFIX = "non_det_";
  public static final String RETURN_SUFFIX = "_ret";

  private UniqueNames names;

  /** type => name of function generating a value of it */
  private Map<Type, String> nondetFunctions;

  @Override
  public String getPassName() {
    return "Lower nondet values";
  }

  @Override
  protected void preprocess() throws TransformException {
    names = UniqueNames.fromSettings();
    names.reserveAll(inputTable().names());
    nondetFunctions = new LinkedHashMap<Type, String>();
  }

  public static Type functionType(Type valueType) {
    return Types.code(new ArrayList<Parameter>(), valueType);
  }

  @Override
  protected Expr transformExprNondet(Expr e) throws TransformException {
    Type type = transformType(e.type());
    if (type.isEmpty() || type.isCode()) {
      throw unsupported("nondet", "no value of type " + type);
    }
    String function = nondetFunctions.get(type);
    if (function == null) {
      function = names.claim(FUNCTION_PREFIX + type.toIdentifier());
      nondetFunctions.put(type, function);
    }
    return Expr.symbol(function, functionType(type))
               .call(new ArrayList<Expr>());
  }

  @Override
  protected Expr transformExprStruct(Expr e) throws TransformException {
    Type type = transformType(e.type());
    List<DatatypeComponent> components =
                            outputTable().lookupComponents(type);
    List<Expr> values = new ArrayList<Expr>();
    for (int i = 0; i < e.operands().size(); i++) {
      Expr value = e.operand(i);
      if (i < components.size() && components.get(i).isPadding()) {
        values.add(value);
      } else {
        values.add(transformExpr(value));
      }
    }
    return Expr.structExpr(type, values, outputTable());
  }

  @Override
  protected void postprocess() throws TransformException {
    for (Map.Entry<Type, String> e: nondetFunctions.entrySet()) {
      Type type = e.getKey();
      String function = e.getValue();

      String retName = names.claim(function + RETURN_SUFFIX);
      Symbol retSym = Symbol.variable(retName, "ret", type, Location.none());
      Expr ret = retSym.toExpr();
      Stmt body = Stmt.block(Stmt.decl(ret, null), Stmt.ret(ret));

      outputTable().insert(retSym);
      outputTable().insert(Symbol.function(function, functionType(type),
                                           body, Location.none()));
      logger.debug("Added " + function + " returning " + type);
    }
  }
}
