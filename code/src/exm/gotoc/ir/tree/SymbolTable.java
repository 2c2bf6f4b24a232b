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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Supplier;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Type;

/**
 * Whole-program container: map from unique symbol name to symbol.
 *
 * Iteration follows insertion order.  Equality compares contents only,
 * so two tables holding the same symbols in a different order are equal.
 */
public class SymbolTable {

  private final Map<String, Symbol> symbols =
                        new LinkedHashMap<String, Symbol>();

  public SymbolTable() {
  }

  /**
   * Add symbol.  A symbol already present under the same name is replaced
   * and keeps its position.
   */
  public void insert(Symbol sym) {
    symbols.put(sym.name(), sym);
  }

  public void insertAll(Iterable<Symbol> syms) {
    for (Symbol sym: syms) {
      insert(sym);
    }
  }

  /**
   * @return symbol, or null if not present
   */
  public Symbol lookup(String name) {
    return symbols.get(name);
  }

  public boolean contains(String name) {
    return symbols.containsKey(name);
  }

  /**
   * @return removed symbol, or null if not present
   */
  public Symbol remove(String name) {
    return symbols.remove(name);
  }

  /**
   * @return existing symbol named name, or the symbol built by factory,
   *          which is inserted first
   */
  public Symbol ensure(String name, Supplier<Symbol> factory) {
    Symbol existing = symbols.get(name);
    if (existing != null) {
      return existing;
    }
    Symbol created = factory.get();
    if (!created.name().equals(name)) {
      throw new GotocRuntimeError("Factory for " + name +
                            " created symbol " + created.name());
    }
    insert(created);
    return created;
  }

  /**
   * @return names in insertion order
   */
  public List<String> names() {
    return Collections.unmodifiableList(
                    new ArrayList<String>(symbols.keySet()));
  }

  /**
   * @return symbols in insertion order
   */
  public List<Symbol> symbols() {
    return Collections.unmodifiableList(
                    new ArrayList<Symbol>(symbols.values()));
  }

  public int size() {
    return symbols.size();
  }

  /**
   * Look up the components of a struct or union
   * @param type tag type, or the aggregate type itself
   */
  public List<DatatypeComponent> lookupComponents(Type type) {
    switch (type.kind()) {
      case STRUCT:
      case UNION:
        return type.asAggregate().components();
      case STRUCT_TAG:
      case UNION_TAG: {
        Symbol decl = lookup(Types.tagSymbolName(type.tag()));
        if (decl == null) {
          throw new GotocRuntimeError("No declaration for " + type);
        }
        return decl.type().asAggregate().components();
      }
      default:
        throw new GotocRuntimeError("Type has no components: " + type);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof SymbolTable))
      return false;
    return symbols.equals(((SymbolTable)o).symbols);
  }

  @Override
  public int hashCode() {
    return symbols.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }

  public void prettyPrint(StringBuilder out) {
    for (Symbol sym: symbols.values()) {
      sym.prettyPrint(out);
    }
  }

  public void log(PrintStream output, String title) {
    StringBuilder sb = new StringBuilder();
    output.append("\n\n" + title + ": \n" +
        "============================================\n");
    prettyPrint(sb);
    output.append(sb.toString());
    output.flush();
  }
}
