package exm.gotoc.ir.transform;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.gotoc.common.Logging;
import exm.gotoc.common.exceptions.UnsupportedConstructException;
import exm.gotoc.ir.TestPrograms;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Expr.ExprKind;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Stmt.StmtKind;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

public class ExprTransformerTest {

  private static final Logger logger = Logging.getGotocLogger();

  private static final List<Parameter> NO_PARAMS =
                                      new ArrayList<Parameter>();

  /**
   * Table with one function f() returning value
   */
  private static SymbolTable returning(SymbolTable table, Expr value) {
    table.insert(Symbol.function("f", Types.code(NO_PARAMS, value.type()),
                   Stmt.block(Stmt.ret(value)), Location.none()));
    return table;
  }

  private static Expr returnedValue(SymbolTable table) {
    return table.lookup("f").value().stmt().body().get(0).value();
  }

  private static SymbolTable transform(SymbolTable table) throws Exception {
    return new ExprTransformer().transform(logger, table);
  }

  @Test
  public void testImplies() throws Exception {
    SymbolTable table = new SymbolTable();
    Symbol a = Symbol.staticVariable("a", "a", Types.bool(), null,
                                     Location.none());
    Symbol b = Symbol.staticVariable("b", "b", Types.bool(), null,
                                     Location.none());
    table.insert(a);
    table.insert(b);
    returning(table, a.toExpr().implies(b.toExpr()));

    Expr expected = a.toExpr().not().bitor(b.toExpr()).castTo(Types.bool());
    assertEquals(expected, returnedValue(transform(table)));
  }

  @Test
  public void testWideConstant() throws Exception {
    Type u128 = Types.unsignedInt(128);
    BigInteger value = BigInteger.ONE.shiftLeft(64).add(BigInteger.valueOf(5));
    SymbolTable out = transform(returning(new SymbolTable(),
                                          Expr.intConstant(value, u128)));

    Expr expected = Expr.intConstant(1, u128)
        .shl(Expr.intConstant(64, Types.cInt()))
        .bitor(Expr.intConstant(5, u128))
        .castTo(u128);
    assertEquals(expected, returnedValue(out));
  }

  @Test
  public void testWideNegativeConstant() throws Exception {
    Type i128 = Types.signedInt(128);
    SymbolTable out = transform(returning(new SymbolTable(),
                                          Expr.intConstant(-2, i128)));
    BigInteger ones = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
    Type u128 = Types.unsignedInt(128);
    Expr expected = Expr.intConstant(ones, u128)
        .shl(Expr.intConstant(64, Types.cInt()))
        .bitor(Expr.intConstant(ones.subtract(BigInteger.ONE), u128))
        .castTo(i128);
    assertEquals(expected, returnedValue(out));
  }

  @Test
  public void testNarrowConstantUnchanged() throws Exception {
    Expr c = Expr.intConstant(-7, Types.signedInt(64));
    assertEquals(c, returnedValue(transform(returning(new SymbolTable(), c))));
  }

  @Test
  public void testTooWideConstant() throws Exception {
    SymbolTable table = returning(new SymbolTable(),
        Expr.intConstant(1, Types.unsignedInt(256)));
    try {
      transform(table);
      fail("expected unsupported construct");
    } catch (UnsupportedConstructException e) {
      assertEquals("int_constant", e.getConstructKind());
      assertEquals("f", e.getSymbolName());
      assertEquals(new ExprTransformer().getPassName(), e.getPassName());
    }
  }

  @Test
  public void testVectorIndex() throws Exception {
    SymbolTable table = new SymbolTable();
    Symbol v = Symbol.staticVariable("v", "v",
        Types.vector(TestPrograms.I32, 4), null, Location.none());
    table.insert(v);
    Expr idx = Expr.intConstant(2, Types.sizeT());
    returning(table, v.toExpr().index(idx));

    Expr expected = v.toExpr().addressOf()
                     .castTo(TestPrograms.I32.toPointer()).index(idx);
    assertEquals(expected, returnedValue(transform(table)));
  }

  @Test
  public void testByteExtract() throws Exception {
    SymbolTable table = new SymbolTable();
    Symbol bits = Symbol.staticVariable("bits", "bits", TestPrograms.U32,
                                        null, Location.none());
    table.insert(bits);
    returning(table, bits.toExpr().byteExtract(Types.floatType(), 0));

    SymbolTable out = transform(table);
    Expr result = returnedValue(out);
    assertEquals(ExprKind.STATEMENT_EXPRESSION, result.kind());
    assertEquals(Types.floatType(), result.type());
    assertEquals(3, result.statements().size());
    assertEquals(StmtKind.DECL, result.statements().get(0).kind());

    Symbol union = out.lookup("tag-transmute_unsigned_bv_32_to_float");
    assertNotNull(union);
    assertEquals(Arrays.asList(ExprTransformer.TRANSMUTE_SRC,
                               ExprTransformer.TRANSMUTE_DST),
        Arrays.asList(union.type().asAggregate().components().get(0).name(),
            union.type().asAggregate().components().get(1).name()));
    assertTrue(out.contains("transmute_tmp"));

    Validate.closureValidator("test").transform(logger, out);
  }

  @Test
  public void testByteExtractAtOffset() throws Exception {
    SymbolTable table = new SymbolTable();
    Symbol bits = Symbol.staticVariable("bits", "bits", TestPrograms.U64,
                                        null, Location.none());
    table.insert(bits);
    returning(table, bits.toExpr().byteExtract(TestPrograms.U32, 4));
    try {
      transform(table);
      fail("expected unsupported construct");
    } catch (UnsupportedConstructException e) {
      assertEquals("byte_extract", e.getConstructKind());
    }
  }

  @Test
  public void testExternFunctionStub() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.builtinFunction("ext",
        Arrays.asList(TestPrograms.I32), TestPrograms.U32)
        .withIsExtern(true));

    SymbolTable out = transform(table);
    Symbol ext = out.lookup("ext");
    assertFalse(ext.isExtern());
    assertTrue(ext.isFunctionDefinition());

    Parameter p = ext.type().asCode().parameters().get(0);
    assertEquals("__signed_bv_32", p.identifier());
    assertTrue(out.lookup("__signed_bv_32").isParameter());

    Stmt ret = ext.value().stmt().body().get(0);
    assertEquals(Expr.nondet(TestPrograms.U32), ret.value());
    Validate.closureValidator("test").transform(logger, out);
  }

  @Test
  public void testExternVoidFunctionStub() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.builtinFunction("abort", new ArrayList<Type>(),
                                        Types.empty()).withIsExtern(true));
    Symbol abort = transform(table).lookup("abort");
    assertNull(abort.value().stmt().body().get(0).value());
  }

  @Test
  public void testExternStaticInitializedInMain() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.staticVariable("errno", "errno", TestPrograms.I32,
            null, TestPrograms.loc(null, 1)).withIsExtern(true));

    SymbolTable out = transform(table);
    Symbol errno = out.lookup("errno");
    assertFalse(errno.isExtern());
    assertTrue(errno.value().isNone());
    assertTrue(errno.location().isNone());

    Stmt first = out.lookup(ExprTransformer.MAIN).value().stmt()
                    .body().get(0);
    assertEquals(Stmt.assign(errno.toExpr(),
                             Expr.nondet(TestPrograms.I32)), first);
  }

  @Test
  public void testMainRenamedAndCalled() throws Exception {
    SymbolTable out = transform(TestPrograms.sample());

    Symbol oldMain = out.lookup(ExprTransformer.RENAMED_MAIN);
    assertNotNull(oldMain);
    assertEquals(ExprTransformer.RENAMED_MAIN, oldMain.location().function());

    Symbol main = out.lookup(ExprTransformer.MAIN);
    assertEquals(Types.cInt(), main.type().asCode().returnType());
    List<Stmt> body = main.value().stmt().body();
    assertEquals(2, body.size());
    assertEquals(Stmt.expression(oldMain.toExpr().call(new ArrayList<Expr>())),
                 body.get(0));
    assertEquals(Stmt.ret(Expr.intConstant(0, Types.cInt())), body.get(1));
  }

  @Test
  public void testMainAddedWhenMissing() throws Exception {
    SymbolTable out = transform(TestPrograms.mangledNames());
    assertTrue(out.contains(ExprTransformer.MAIN));
    assertFalse(out.contains(ExprTransformer.RENAMED_MAIN));
  }

  /**
   * Extern declaration of name with one parameter x of the given type,
   * where x is not in the table
   */
  private static Symbol externWithParameter(String name, Type paramType) {
    Parameter x = Symbol.parameter("x", "x", paramType, Location.none())
                        .toParameter();
    return Symbol.function(name,
        Types.code(Arrays.asList(x), Types.empty()), null, Location.none())
        .withIsExtern(true);
  }

  @Test
  public void testExternParameterClash() throws Exception {
    Type u8 = Types.unsignedInt(8);
    SymbolTable table = new SymbolTable();
    table.insert(externWithParameter("f", u8));
    table.insert(externWithParameter("g", TestPrograms.I32));

    SymbolTable out = transform(table);
    Parameter fx = out.lookup("f").type().asCode().parameters().get(0);
    Parameter gx = out.lookup("g").type().asCode().parameters().get(0);
    assertEquals("x", fx.identifier());
    assertEquals("x$1", gx.identifier());
    assertEquals("x", gx.baseName());
    assertEquals(u8, out.lookup("x").type());
    assertEquals(TestPrograms.I32, out.lookup("x$1").type());
    Validate.closureValidator("test").transform(logger, out);
  }

  @Test
  public void testExternParameterShared() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(externWithParameter("f", TestPrograms.I32));
    table.insert(externWithParameter("g", TestPrograms.I32));

    SymbolTable out = transform(table);
    assertEquals("x",
        out.lookup("g").type().asCode().parameters().get(0).identifier());
    assertFalse(out.contains("x$1"));
    assertTrue(out.lookup("x").isParameter());
  }

  @Test
  public void testAssignmentExpressionKept() throws Exception {
    SymbolTable table = new SymbolTable();
    Symbol v = Symbol.staticVariable("v", "v", TestPrograms.I32,
        Expr.intConstant(0, TestPrograms.I32), Location.none());
    table.insert(v);
    Expr assign = v.toExpr().assignExpr(Expr.intConstant(2, TestPrograms.I32));
    Expr result = returnedValue(transform(returning(table, assign)));
    assertEquals(ExprKind.ASSIGN, result.kind());
    assertEquals(assign, result);
  }
}
