package exm.gotoc.ir.transform;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.gotoc.common.Logging;
import exm.gotoc.ir.TestPrograms;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

public class NameTransformerTest {

  private static final Logger logger = Logging.getGotocLogger();

  private static Symbol global(String name) {
    return Symbol.staticVariable(name, name, TestPrograms.I32, null,
                                 Location.none());
  }

  @Test
  public void testSuffixAvoidsExistingNames() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(global("foo_bar"));
    table.insert(global("foo_bar$1"));
    table.insert(global("foo:bar"));

    SymbolTable out = new NameTransformer().transform(logger, table);
    assertEquals(Arrays.asList("foo_bar", "foo_bar$1", "foo_bar$2"),
                 out.names());
    assertEquals("foo_bar$2", out.lookup("foo_bar$2").baseName());
  }

  @Test
  public void testReferencesFollowRenames() throws Exception {
    SymbolTable table = TestPrograms.mangledNames();
    SymbolTable out = new NameTransformer().transform(logger, table);

    for (String name: out.names()) {
      assertTrue(name, CIdentifiers.isLegalName(name));
    }
    Symbol fn = out.lookup("x__y_i32_");
    assertNotNull(fn);
    assertEquals("x__y_i32___arg",
                 fn.type().asCode().parameters().get(0).identifier());
    assertEquals("x__y_i32_", fn.location().function());

    Symbol caller = out.lookup("caller___impl_");
    Expr call = caller.value().stmt().body().get(0).value();
    assertEquals("x__y_i32_", call.function().identifier());

    // Closure still holds
    Validate.closureValidator("names").transform(logger, out);
  }

  @Test
  public void testTagsStayConsistent() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.structType("a::S", Arrays.asList(
        DatatypeComponent.field("x.0", TestPrograms.I32))));
    Type sType = Types.structTag("a::S");
    Symbol v = Symbol.staticVariable("v", "v", sType, null,
                                     Location.none());
    table.insert(v);
    Symbol get = Symbol.function("get",
        Types.code(new ArrayList<Parameter>(), TestPrograms.I32),
        Stmt.block(Stmt.ret(v.toExpr().member("x.0", table))),
        Location.none());
    table.insert(get);

    SymbolTable out = new NameTransformer().transform(logger, table);
    Symbol decl = out.lookup("tag-a__S");
    assertNotNull(decl);
    assertEquals("a__S", decl.type().tag());
    assertEquals("x_0", decl.type().asAggregate().components()
                                 .get(0).name());
    assertEquals(Types.structTag("a__S"), out.lookup("v").type());
    Expr member = out.lookup("get").value().stmt().body().get(0).value();
    assertEquals("x_0", member.field());
  }

  @Test
  public void testLabels() throws Exception {
    SymbolTable table = new SymbolTable();
    Stmt body = Stmt.block(Stmt.gotoStmt("bb::3"),
                           Stmt.label("bb::3", Stmt.ret(null)));
    table.insert(Symbol.function("f",
        Types.code(new ArrayList<Parameter>(), Types.empty()), body,
        Location.none()));
    SymbolTable out = new NameTransformer().transform(logger, table);
    Stmt newBody = out.lookup("f").value().stmt();
    assertEquals("bb__3", newBody.body().get(0).label());
    assertEquals("bb__3", newBody.body().get(1).label());
  }

  @Test
  public void testLegalTableUnchanged() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(global("a"));
    table.insert(global("b$1"));
    assertEquals(table, new NameTransformer().transform(logger, table));
  }

  @Test
  public void testDeterministic() throws Exception {
    SymbolTable first = new NameTransformer().transform(logger,
                                  TestPrograms.mangledNames());
    SymbolTable second = new NameTransformer().transform(logger,
                                  TestPrograms.mangledNames());
    assertEquals(first, second);
    assertEquals(first.names(), second.names());
    assertFalse(first.contains("x::y<i32>"));
  }
}
