package exm.gotoc.ir.transform;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.gotoc.common.Logging;
import exm.gotoc.common.exceptions.InvalidOutputException;
import exm.gotoc.common.exceptions.UnresolvedReferenceException;
import exm.gotoc.ir.TestPrograms;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.Parameter;

public class ValidateTest {

  private static final Logger logger = Logging.getGotocLogger();

  @Test
  public void testClosedTableAccepted() throws Exception {
    SymbolTable table = TestPrograms.sample();
    assertSame(table, Validate.inputValidator().transform(logger, table));
  }

  @Test
  public void testUnresolvedReferences() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.function("f",
        Types.code(new ArrayList<Parameter>(), TestPrograms.I32),
        Stmt.block(
          Stmt.assign(Expr.symbol("missing", TestPrograms.I32),
                      Expr.symbol("other", TestPrograms.I32)),
          Stmt.ret(Expr.symbol("missing", TestPrograms.I32))),
        Location.none()));
    table.insert(Symbol.staticVariable("s", "s", Types.structTag("gone"),
                                       null, Location.none()));
    try {
      Validate.inputValidator().transform(logger, table);
      fail("expected unresolved references");
    } catch (UnresolvedReferenceException e) {
      assertEquals(Arrays.asList("missing", "other"),
                   e.getUnresolved().get("f"));
      assertEquals(Arrays.asList("tag-gone"), e.getUnresolved().get("s"));
      assertTrue(e.getMessage().contains("input"));
    }
  }

  @Test
  public void testMissingParameterSymbol() throws Exception {
    SymbolTable table = TestPrograms.sample();
    table.remove("add::y");
    try {
      Validate.closureValidator("test pass").transform(logger, table);
      fail("expected unresolved references");
    } catch (UnresolvedReferenceException e) {
      assertTrue(e.getUnresolved().get("add").contains("add::y"));
      assertTrue(e.getMessage().contains("after test pass"));
    }
  }

  @Test
  public void testIllegalIdentifiers() throws Exception {
    try {
      Validate.cTextValidator().transform(logger,
                                          TestPrograms.mangledNames());
      fail("expected invalid output");
    } catch (InvalidOutputException e) {
      assertTrue(e.getOffending().contains("x::y<i32>"));
      assertTrue(e.getOffending().contains("caller::<impl>"));
    }
  }

  @Test
  public void testHeaderNameRejected() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.staticVariable("size_t", "size_t", TestPrograms.I32,
                    Expr.intConstant(0, TestPrograms.I32), Location.none()));
    try {
      Validate.cTextValidator().transform(logger, table);
      fail("expected invalid output");
    } catch (InvalidOutputException e) {
      assertEquals(Arrays.asList("size_t"), e.getOffending());
    }
  }

  @Test
  public void testNondetRemains() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.staticVariable("v", "v", TestPrograms.I32,
                    Expr.nondet(TestPrograms.I32), Location.none()));
    try {
      Validate.cTextValidator().transform(logger, table);
      fail("expected invalid output");
    } catch (InvalidOutputException e) {
      assertEquals(Arrays.asList("v"), e.getOffending());
    }
  }

  @Test
  public void testPaddingNondetAllowed() throws Exception {
    SymbolTable table = new NameTransformer().transform(logger,
                                              TestPrograms.sample());
    Validate.cTextValidator().transform(logger, table);
  }
}
