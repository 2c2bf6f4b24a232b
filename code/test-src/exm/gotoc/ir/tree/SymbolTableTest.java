package exm.gotoc.ir.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import com.google.common.base.Supplier;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.ir.TestPrograms;
import exm.gotoc.ir.tree.Types.DatatypeComponent;

public class SymbolTableTest {

  @Test
  public void testInsertReplacesInPlace() {
    SymbolTable table = new SymbolTable();
    Symbol a = Symbol.variable("a", "a", TestPrograms.I32, Location.none());
    Symbol b = Symbol.variable("b", "b", TestPrograms.I32, Location.none());
    table.insert(a);
    table.insert(b);
    Symbol a2 = a.withType(TestPrograms.U64);
    table.insert(a2);

    assertEquals(Arrays.asList("a", "b"), table.names());
    assertEquals(a2, table.lookup("a"));
    assertEquals(2, table.size());
  }

  @Test
  public void testLookupAndRemove() {
    SymbolTable table = TestPrograms.sample();
    assertTrue(table.contains("add"));
    assertNull(table.lookup("sub"));
    assertEquals("add", table.remove("add").name());
    assertFalse(table.contains("add"));
  }

  @Test
  public void testEnsureOnlyCreatesOnce() {
    SymbolTable table = new SymbolTable();
    final int[] calls = new int[1];
    Supplier<Symbol> factory = new Supplier<Symbol>() {
      @Override
      public Symbol get() {
        calls[0]++;
        return Symbol.variable("tmp", "tmp", TestPrograms.I32,
                               Location.none());
      }
    };
    Symbol first = table.ensure("tmp", factory);
    Symbol second = table.ensure("tmp", factory);
    assertSame(first, second);
    assertEquals(1, calls[0]);
  }

  @Test
  public void testLookupComponentsByTag() {
    SymbolTable table = TestPrograms.sample();
    assertEquals(3, table.lookupComponents(Types.structTag("pair")).size());
    assertTrue(table.lookupComponents(Types.structTag("pair"))
                    .get(1).isPadding());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testLookupComponentsUndeclared() {
    new SymbolTable().lookupComponents(Types.structTag("nothing"));
  }

  @Test
  public void testAggregateKey() {
    Symbol s = Symbol.structType("node", Arrays.asList(
        DatatypeComponent.field("next", Types.structTag("node").toPointer())));
    assertEquals("tag-node", s.name());
    assertTrue(s.isType());
    assertTrue(s.isAggregateDeclaration());
    assertFalse(Symbol.incompleteStruct("node").isAggregateDeclaration());
  }

  @Test
  public void testEqualityIgnoresOrder() {
    SymbolTable forward = new SymbolTable();
    SymbolTable backward = new SymbolTable();
    Symbol a = Symbol.variable("a", "a", TestPrograms.I32, Location.none());
    Symbol b = Symbol.variable("b", "b", TestPrograms.I32, Location.none());
    forward.insert(a);
    forward.insert(b);
    backward.insert(b);
    backward.insert(a);
    assertEquals(forward, backward);
    assertEquals(forward.hashCode(), backward.hashCode());
  }
}
