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

import java.util.HashMap;
import java.util.Map;

import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.AggregateType;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.TagType;
import exm.gotoc.ir.tree.Types.Type;
import exm.gotoc.ir.tree.Types.TypeDefType;

/**
 * Rename everything to legal, unique C identifiers.
 *
 * Every table key that is already legal keeps its name.  Other names are
 * sanitized with {@link CIdentifiers#sanitize(String)} and, if the result
 * is taken, given the first free numeric suffix in visit order.
 * The mapping is memoized, so each old name maps to exactly one new name
 * wherever it occurs: keys, base and pretty names, symbol expressions,
 * tags, fields, parameters and labels.
 */
public class NameTransformer extends Transformer {

  /** old name => new name */
  private Map<String, String> mapped;

  private UniqueNames names;

  @Override
  public String getPassName() {
    return "Normalize names";
  }

  @Override
  protected void preprocess() throws TransformException {
    mapped = new HashMap<String, String>();
    names = UniqueNames.fromSettings();

    // Legal names are kept, so must be reserved before renaming anything
    for (String key: inputTable().names()) {
      if (CIdentifiers.isLegalName(key)) {
        String plain = stripTag(key);
        names.reserve(plain);
        mapped.put(plain, plain);
        mapped.put(key, key);
      }
    }
  }

  @Override
  protected void postprocess() throws TransformException {
    int renamed = 0;
    for (Map.Entry<String, String> e: mapped.entrySet()) {
      if (!e.getKey().equals(e.getValue())) {
        renamed++;
      }
    }
    logger.debug(getPassName() + ": renamed " + renamed + " of " +
                 mapped.size() + " names");
  }

  private static String stripTag(String name) {
    if (name.startsWith(Types.TAG_PREFIX)) {
      return name.substring(Types.TAG_PREFIX.length());
    }
    return name;
  }

  /**
   * @return the legal unique name that name maps to
   */
  public String normalize(String name) throws TransformException {
    String result = mapped.get(name);
    if (result != null) {
      return result;
    }

    if (name.startsWith(Types.TAG_PREFIX)) {
      // Keep key of aggregate declaration consistent with its tag
      result = Types.TAG_PREFIX + normalize(stripTag(name));
    } else {
      result = names.claim(CIdentifiers.sanitize(name));
    }
    mapped.put(name, result);
    return result;
  }

  private String normalizeOpt(String name) throws TransformException {
    return name == null ? null : normalize(name);
  }

  @Override
  protected Symbol transformSymbol(Symbol sym) throws TransformException {
    Symbol result = super.transformSymbol(sym);
    return result.withName(normalize(sym.name()))
                 .withBaseName(normalizeOpt(sym.baseName()))
                 .withPrettyName(normalizeOpt(sym.prettyName()));
  }

  @Override
  protected Location transformLocation(Location loc)
                              throws TransformException {
    if (loc.function() == null) {
      return loc;
    }
    return loc.withFunction(normalize(loc.function()));
  }

  @Override
  protected Type transformTypeIncompleteStruct(TagType type)
                                    throws TransformException {
    return Types.incompleteStruct(normalize(type.tag()));
  }

  @Override
  protected Type transformTypeIncompleteUnion(TagType type)
                                    throws TransformException {
    return Types.incompleteUnion(normalize(type.tag()));
  }

  @Override
  protected Type transformTypeStruct(AggregateType type)
                                    throws TransformException {
    return Types.structType(normalize(type.tag()), transformComponents(type));
  }

  @Override
  protected Type transformTypeUnion(AggregateType type)
                                    throws TransformException {
    return Types.unionType(normalize(type.tag()), transformComponents(type));
  }

  @Override
  protected Type transformTypeStructTag(TagType type)
                                    throws TransformException {
    return Types.structTag(normalize(type.tag()));
  }

  @Override
  protected Type transformTypeUnionTag(TagType type)
                                    throws TransformException {
    return Types.unionTag(normalize(type.tag()));
  }

  @Override
  protected Type transformTypeTypedef(TypeDefType type)
                                    throws TransformException {
    return transformType(type.type()).toTypeDef(normalize(type.name()));
  }

  @Override
  protected DatatypeComponent transformDatatypeComponent(DatatypeComponent c)
                                    throws TransformException {
    if (c.isPadding()) {
      return DatatypeComponent.padding(normalize(c.name()), c.paddingBits());
    }
    return DatatypeComponent.field(normalize(c.name()),
                                   transformType(c.type()));
  }

  @Override
  protected Parameter transformParameter(Parameter p)
                                    throws TransformException {
    return new Parameter(normalizeOpt(p.identifier()),
                         normalizeOpt(p.baseName()),
                         transformType(p.type()));
  }

  @Override
  protected Expr transformExprSymbol(Expr e) throws TransformException {
    return Expr.symbol(normalize(e.identifier()), transformType(e.type()));
  }

  @Override
  protected Expr transformExprMember(Expr e) throws TransformException {
    Expr lhs = transformExpr(e.operand(0));
    return lhs.member(normalize(e.field()), outputTable());
  }

  @Override
  protected Expr transformExprUnion(Expr e) throws TransformException {
    Type type = transformType(e.type());
    Expr value = transformExpr(e.operand(0));
    return Expr.unionExpr(type, normalize(e.field()), value, outputTable());
  }

  @Override
  protected Stmt transformStmtGoto(Stmt s) throws TransformException {
    return Stmt.gotoStmt(normalize(s.label()));
  }

  @Override
  protected Stmt transformStmtLabel(Stmt s) throws TransformException {
    Stmt body = transformStmt(s.loopBody());
    return Stmt.label(normalize(s.label()), body);
  }
}
