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

import java.util.List;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.ir.tree.Types.AggregateType;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

/**
 * A named entity in the goto program: function, global or local variable,
 * parameter or type declaration.
 *
 * Symbols are immutable: the with* methods return modified copies.
 */
public class Symbol {

  /** Language mode of symbol */
  public static final String MODE_C = "C";

  private final String name;
  private final String baseName;
  private final String prettyName;
  private final Type type;
  private final SymbolValue value;
  private final Location location;
  private final String module;
  private final String mode;

  private final boolean isExtern;
  private final boolean isFileLocal;
  private final boolean isLvalue;
  private final boolean isParameter;
  private final boolean isStaticLifetime;
  private final boolean isThreadLocal;
  private final boolean isType;

  private Symbol(String name, String baseName, String prettyName, Type type,
      SymbolValue value, Location location, String module, String mode,
      boolean isExtern, boolean isFileLocal, boolean isLvalue,
      boolean isParameter, boolean isStaticLifetime, boolean isThreadLocal,
      boolean isType) {
    if (name == null || name.isEmpty()) {
      throw new GotocRuntimeError("Symbol with empty name");
    }
    assert(type != null);
    assert(value != null);
    assert(location != null);
    this.name = name;
    this.baseName = baseName;
    this.prettyName = prettyName;
    this.type = type;
    this.value = value;
    this.location = location;
    this.module = module;
    this.mode = mode;
    this.isExtern = isExtern;
    this.isFileLocal = isFileLocal;
    this.isLvalue = isLvalue;
    this.isParameter = isParameter;
    this.isStaticLifetime = isStaticLifetime;
    this.isThreadLocal = isThreadLocal;
    this.isType = isType;
  }

  private static Symbol create(String name, String baseName,
      String prettyName, Type type, SymbolValue value, Location location) {
    return new Symbol(name, baseName, prettyName, type, value, location,
                      null, MODE_C, false, false, false, false, false,
                      false, false);
  }

  /*
   * Factories for common kinds of symbol
   */

  /**
   * @param body function body, or null for a declaration
   */
  public static Symbol function(String name, Type type, Stmt body,
                                Location location) {
    if (!type.isCode()) {
      throw new GotocRuntimeError("Function " + name + " with non-code type "
                                  + type);
    }
    SymbolValue v = body == null ? SymbolValue.none() : SymbolValue.of(body);
    return create(name, name, null, type, v, location).withIsLvalue(true);
  }

  /**
   * Function declaration with unnamed parameters and no body
   */
  public static Symbol builtinFunction(String name, List<Type> paramTypes,
                                       Type returnType) {
    return function(name,
            Types.codeWithUnnamedParameters(paramTypes, returnType),
            null, Location.none());
  }

  /**
   * Local variable
   */
  public static Symbol variable(String name, String baseName, Type type,
                                Location location) {
    return create(name, baseName, null, type, SymbolValue.none(), location)
            .withIsThreadLocal(true)
            .withIsLvalue(true);
  }

  /**
   * Global variable with static lifetime
   * @param init initializer, or null
   */
  public static Symbol staticVariable(String name, String baseName,
                                      Type type, Expr init,
                                      Location location) {
    SymbolValue v = init == null ? SymbolValue.none() : SymbolValue.of(init);
    return create(name, baseName, null, type, v, location)
            .withIsLvalue(true)
            .withIsStaticLifetime(true);
  }

  /**
   * Function parameter, named by identifier
   */
  public static Symbol parameter(String identifier, String baseName,
                                 Type type, Location location) {
    return variable(identifier, baseName, type, location)
            .withIsParameter(true);
  }

  public static Symbol typedef(String name, String prettyName, Type type,
                               Location location) {
    return create(name, name, prettyName, type, SymbolValue.none(),
                  location)
            .withIsType(true)
            .withIsFileLocal(true)
            .withIsStaticLifetime(true);
  }

  private static Symbol aggregate(Type type) {
    String tag = type.tag();
    return create(Types.tagSymbolName(tag), tag, null, type,
                  SymbolValue.none(), Location.none()).withIsType(true);
  }

  public static Symbol structType(String tag,
                                  List<DatatypeComponent> components) {
    return aggregate(Types.structType(tag, components));
  }

  public static Symbol unionType(String tag,
                                 List<DatatypeComponent> components) {
    return aggregate(Types.unionType(tag, components));
  }

  public static Symbol incompleteStruct(String tag) {
    return aggregate(Types.incompleteStruct(tag));
  }

  public static Symbol incompleteUnion(String tag) {
    return aggregate(Types.incompleteUnion(tag));
  }

  /*
   * Accessors
   */

  public String name() {
    return name;
  }

  /** may be null */
  public String baseName() {
    return baseName;
  }

  /** may be null */
  public String prettyName() {
    return prettyName;
  }

  public Type type() {
    return type;
  }

  public SymbolValue value() {
    return value;
  }

  public Location location() {
    return location;
  }

  /** may be null */
  public String module() {
    return module;
  }

  public String mode() {
    return mode;
  }

  public boolean isExtern() {
    return isExtern;
  }

  public boolean isFileLocal() {
    return isFileLocal;
  }

  public boolean isLvalue() {
    return isLvalue;
  }

  public boolean isParameter() {
    return isParameter;
  }

  public boolean isStaticLifetime() {
    return isStaticLifetime;
  }

  public boolean isThreadLocal() {
    return isThreadLocal;
  }

  public boolean isType() {
    return isType;
  }

  public boolean isFunction() {
    return type.isCode();
  }

  public boolean isFunctionDeclaration() {
    return isFunction() && value.isNone();
  }

  public boolean isFunctionDefinition() {
    return isFunction() && value.isStmt();
  }

  /**
   * @return true if this declares a complete struct or union
   */
  public boolean isAggregateDeclaration() {
    return isType && type instanceof AggregateType;
  }

  public Expr toExpr() {
    return Expr.symbol(name, type);
  }

  public Parameter toParameter() {
    return new Parameter(name, baseName, type);
  }

  /*
   * Modified copies
   */

  public Symbol withName(String newName) {
    return new Symbol(newName, baseName, prettyName, type, value, location,
        module, mode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withBaseName(String newBaseName) {
    return new Symbol(name, newBaseName, prettyName, type, value, location,
        module, mode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withPrettyName(String newPrettyName) {
    return new Symbol(name, baseName, newPrettyName, type, value, location,
        module, mode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withType(Type newType) {
    return new Symbol(name, baseName, prettyName, newType, value, location,
        module, mode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withValue(SymbolValue newValue) {
    return new Symbol(name, baseName, prettyName, type, newValue, location,
        module, mode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withLocation(Location newLocation) {
    return new Symbol(name, baseName, prettyName, type, value, newLocation,
        module, mode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withModule(String newModule) {
    return new Symbol(name, baseName, prettyName, type, value, location,
        newModule, mode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withMode(String newMode) {
    return new Symbol(name, baseName, prettyName, type, value, location,
        module, newMode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withIsExtern(boolean v) {
    return new Symbol(name, baseName, prettyName, type, value, location,
        module, mode, v, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withIsFileLocal(boolean v) {
    return new Symbol(name, baseName, prettyName, type, value, location,
        module, mode, isExtern, v, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withIsLvalue(boolean v) {
    return new Symbol(name, baseName, prettyName, type, value, location,
        module, mode, isExtern, isFileLocal, v, isParameter,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withIsParameter(boolean v) {
    return new Symbol(name, baseName, prettyName, type, value, location,
        module, mode, isExtern, isFileLocal, isLvalue, v,
        isStaticLifetime, isThreadLocal, isType);
  }

  public Symbol withIsStaticLifetime(boolean v) {
    return new Symbol(name, baseName, prettyName, type, value, location,
        module, mode, isExtern, isFileLocal, isLvalue, isParameter,
        v, isThreadLocal, isType);
  }

  public Symbol withIsThreadLocal(boolean v) {
    return new Symbol(name, baseName, prettyName, type, value, location,
        module, mode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, v, isType);
  }

  public Symbol withIsType(boolean v) {
    return new Symbol(name, baseName, prettyName, type, value, location,
        module, mode, isExtern, isFileLocal, isLvalue, isParameter,
        isStaticLifetime, isThreadLocal, v);
  }

  private static boolean eq(Object a, Object b) {
    return a == null ? b == null : a.equals(b);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Symbol))
      return false;
    Symbol other = (Symbol) obj;
    return name.equals(other.name) && eq(baseName, other.baseName) &&
        eq(prettyName, other.prettyName) && type.equals(other.type) &&
        value.equals(other.value) && location.equals(other.location) &&
        eq(module, other.module) && eq(mode, other.mode) &&
        isExtern == other.isExtern && isFileLocal == other.isFileLocal &&
        isLvalue == other.isLvalue && isParameter == other.isParameter &&
        isStaticLifetime == other.isStaticLifetime &&
        isThreadLocal == other.isThreadLocal && isType == other.isType;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = name.hashCode();
    result = prime * result + type.hashCode();
    result = prime * result + value.hashCode();
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }

  public void prettyPrint(StringBuilder sb) {
    sb.append(name);
    if (prettyName != null) {
      sb.append(" (").append(prettyName).append(")");
    }
    sb.append(": ").append(type);
    if (isExtern) {
      sb.append(" extern");
    }
    if (isStaticLifetime) {
      sb.append(" static");
    }
    if (isParameter) {
      sb.append(" param");
    }
    if (isType) {
      sb.append(" type");
    }
    switch (value.kind()) {
      case EXPR:
        sb.append(" = ").append(value.expr()).append("\n");
        break;
      case STMT:
        sb.append(" =\n");
        value.stmt().prettyPrint(sb, "  ");
        break;
      default:
        sb.append("\n");
    }
  }
}
