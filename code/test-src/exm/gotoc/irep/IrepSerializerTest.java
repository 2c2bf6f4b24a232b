package exm.gotoc.irep;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.junit.Test;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import exm.gotoc.common.Logging;
import exm.gotoc.ir.TestPrograms;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types;

public class IrepSerializerTest {

  private static final Logger logger = Logging.getGotocLogger();

  private final IrepSerializer serializer = new IrepSerializer();

  private static JsonObject symbols(String json) {
    return JsonParser.parseString(json).getAsJsonObject()
                     .getAsJsonObject("symbolTable");
  }

  @Test
  public void testSymbolsSorted() {
    JsonObject syms = symbols(serializer.toJson(logger,
                                                TestPrograms.sample()));
    List<String> names = new ArrayList<String>();
    for (Map.Entry<String, JsonElement> e: syms.entrySet()) {
      names.add(e.getKey());
    }
    List<String> sorted = new ArrayList<String>(names);
    Collections.sort(sorted);
    assertEquals(sorted, names);
    assertEquals(TestPrograms.sample().size(), names.size());
  }

  @Test
  public void testSymbolFields() {
    JsonObject syms = symbols(serializer.toJson(logger,
                                                TestPrograms.sample()));
    JsonObject x = syms.getAsJsonObject("add::x");
    assertEquals("add::x", x.get("name").getAsString());
    assertEquals("x", x.get("baseName").getAsString());
    assertTrue(x.get("isParameter").getAsBoolean());
    assertTrue(x.get("isThreadLocal").getAsBoolean());
    assertFalse(x.get("isStaticLifetime").getAsBoolean());
    assertFalse(x.get("isMacro").getAsBoolean());
    assertEquals("nil", x.getAsJsonObject("value").get("id").getAsString());

    JsonObject type = x.getAsJsonObject("type");
    assertEquals("signedbv", type.get("id").getAsString());
    assertFalse(type.has("sub"));
    assertEquals("32", type.getAsJsonObject("namedSub")
                           .getAsJsonObject("width").get("id").getAsString());

    JsonObject pair = syms.getAsJsonObject("tag-pair");
    assertTrue(pair.get("isType").getAsBoolean());
    assertEquals("struct", pair.getAsJsonObject("type")
                               .get("id").getAsString());
  }

  @Test
  public void testDeterministic() {
    SymbolTable reversed = new SymbolTable();
    List<Symbol> syms = new ArrayList<Symbol>(
                              TestPrograms.sample().symbols());
    Collections.reverse(syms);
    reversed.insertAll(syms);
    assertEquals(serializer.toJson(logger, TestPrograms.sample()),
                 serializer.toJson(logger, reversed));
  }

  @Test
  public void testConstants() {
    Irep c = serializer.exprIrep(Expr.intConstant(-1, TestPrograms.I32));
    assertEquals("constant", c.id());
    assertEquals("FFFFFFFF", c.lookup("value").id());

    c = serializer.exprIrep(Expr.intConstant(255, Types.cInt()));
    assertEquals("FF", c.lookup("value").id());
    assertEquals("32", c.lookup("type").lookup("width").id());

    c = serializer.exprIrep(Expr.pointerConstant(0,
                              TestPrograms.I32.toPointer()));
    assertEquals("NULL", c.lookup("value").id());

    c = serializer.exprIrep(Expr.intConstant(
        BigInteger.ONE.shiftLeft(100), Types.unsignedInt(128)));
    assertEquals("10000000000000000000000000", c.lookup("value").id());
  }

  @Test
  public void testLocation() {
    assertTrue(serializer.locationIrep(Location.none()).isNil());

    Irep loc = serializer.locationIrep(TestPrograms.loc("main", 5));
    assertEquals("sample.c", loc.lookup("file").id());
    assertEquals("5", loc.lookup("line").id());
    assertEquals("1", loc.lookup("column").id());
    assertEquals("main", loc.lookup("function").id());

    loc = serializer.locationIrep(TestPrograms.loc(null, 2));
    assertNull(loc.lookup("function"));
  }

  @Test
  public void testAssertProperty() {
    Stmt s = Stmt.assertion(Expr.boolConstant(true), "user", "always")
                 .withLocation(TestPrograms.loc("main", 7));
    Irep irep = serializer.stmtIrep(s);
    assertEquals("code", irep.id());
    assertEquals("assert", irep.lookup("statement").id());
    Irep loc = irep.lookup("#source_location");
    assertEquals("always", loc.lookup("comment").id());
    assertEquals("user", loc.lookup("property_class").id());
  }

  @Test
  public void testCallSideEffect() {
    SymbolTable table = TestPrograms.sample();
    Expr call = table.lookup("add").toExpr().call(Arrays.asList(
        Expr.intConstant(1, TestPrograms.I32),
        Expr.intConstant(2, TestPrograms.I32)));
    Irep irep = serializer.exprIrep(call);
    assertEquals("side_effect", irep.id());
    assertEquals("function_call", irep.lookup("statement").id());
    assertEquals(2, irep.sub().size());
    assertEquals("symbol", irep.sub().get(0).id());
    assertEquals(2, irep.sub().get(1).sub().size());
  }

  @Test
  public void testAssignSideEffect() {
    Expr assign = Expr.symbol("counter", TestPrograms.I32)
        .assignExpr(Expr.intConstant(3, TestPrograms.I32));
    Irep irep = serializer.exprIrep(assign);
    assertEquals("side_effect", irep.id());
    assertEquals("assign", irep.lookup("statement").id());
    assertEquals(2, irep.sub().size());
    assertEquals("symbol", irep.sub().get(0).id());
    assertEquals("constant", irep.sub().get(1).id());
  }

  @Test
  public void testStructTag() {
    Irep t = serializer.typeIrep(Types.structTag("pair"));
    assertEquals("struct_tag", t.id());
    assertEquals("tag-pair", t.lookup("identifier").id());

    Irep ptr = serializer.typeIrep(Types.structTag("pair").toPointer());
    assertEquals("pointer", ptr.id());
    assertEquals("64", ptr.lookup("width").id());
  }
}
