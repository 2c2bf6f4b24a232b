package exm.gotoc.cbackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.gotoc.common.Logging;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.ir.TestPrograms;
import exm.gotoc.ir.transform.OutputMode;
import exm.gotoc.ir.transform.SymtabTransformer;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

public class CTextGeneratorTest {

  private static final Logger logger = Logging.getGotocLogger();

  private static String sampleText() throws Exception {
    SymbolTable table = SymtabTransformer.run(logger, OutputMode.C_TEXT,
                                              TestPrograms.sample());
    return new CTextGenerator(logger, table).generate();
  }

  @Test
  public void testSampleProgram() throws Exception {
    String c = sampleText();
    assertTrue(c.startsWith("#include <stdbool.h>\n"));
    assertTrue(c, c.contains("struct pair;\n"));
    assertTrue(c, c.contains("struct pair\n{\n  int32_t a;\n" +
                             "  char pad[4];\n  uint64_t b;\n};\n"));
    assertTrue(c, c.contains("int32_t add(int32_t add__x, int32_t add__y);"));
    assertTrue(c, c.contains("int32_t counter = 0;"));
    assertTrue(c, c.contains("return (add__x + add__y);"));
    assertTrue(c, c.contains("struct pair main__1__p = " +
                             "(struct pair){.a = 1, .b = 2u};"));
    assertTrue(c, c.contains("counter = add(main__1__p.a, 1);"));
    assertTrue(c, c.contains(
        "__CPROVER_assert((counter > 0), \"counter positive\");"));
    assertTrue(c, c.contains("int main(void)\n{\n  main_();\n" +
                             "  return 0;\n}\n"));
  }

  @Test
  public void testDeterministic() throws Exception {
    assertEquals(sampleText(), sampleText());
  }

  @Test
  public void testMangledNamesLegal() throws Exception {
    SymbolTable table = SymtabTransformer.run(logger, OutputMode.C_TEXT,
                                              TestPrograms.mangledNames());
    String c = new CTextGenerator(logger, table).generate();
    assertFalse(c.contains("::"));
    assertFalse(c.contains("<i32>"));
    assertTrue(c, c.contains("x__y_i32_(7)"));
  }

  @Test
  public void testDeclarators() {
    assertEquals("int32_t *p", CTextGenerator.declarator(
        TestPrograms.I32.toPointer(), "p"));
    assertEquals("int32_t a[4]", CTextGenerator.declarator(
        TestPrograms.I32.arrayOf(4), "a"));
    assertEquals("int32_t (*p)[4]", CTextGenerator.declarator(
        TestPrograms.I32.arrayOf(4).toPointer(), "p"));
    assertEquals("uint32_t (*f)(int32_t, ...)", CTextGenerator.declarator(
        Types.variadicCode(Arrays.asList(Parameter.unnamed(TestPrograms.I32)),
                           TestPrograms.U32).toPointer(), "f"));
    assertEquals("unsigned __int128", CTextGenerator.typeName(
        Types.unsignedInt(128)));
    assertEquals("signed __CPROVER_bitvector[17]",
        CTextGenerator.typeName(Types.signedInt(17)));
  }

  @Test
  public void testStringEscapes() {
    assertEquals("\"a\\\"b\\\\c\\n\"", CTextGenerator.stringLiteral("a\"b\\c\n"));
  }

  @Test
  public void testAggregateOrder() {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.structType("outer", Arrays.asList(
        DatatypeComponent.field("in", Types.structTag("inner")))));
    table.insert(Symbol.structType("inner", Arrays.asList(
        DatatypeComponent.field("x", TestPrograms.I32))));
    String c = new CTextGenerator(logger, table).generate();
    assertTrue(c.indexOf("struct inner\n{") < c.indexOf("struct outer\n{"));
  }

  @Test(expected=GotocRuntimeError.class)
  public void testNondetRejected() {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.staticVariable("v", "v", TestPrograms.I32,
                    Expr.nondet(TestPrograms.I32), Location.none()));
    new CTextGenerator(logger, table).generate();
  }

  @Test
  public void testExternGlobal() {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.staticVariable("g", "g", Types.cChar(), null,
                 Location.none()).withIsExtern(true));
    table.insert(Symbol.builtinFunction("h", new ArrayList<Types.Type>(),
                                        Types.empty()));
    String c = new CTextGenerator(logger, table).generate();
    assertTrue(c, c.contains("extern char g;"));
    assertTrue(c, c.contains("void h(void);"));
  }

  private static SymbolTable returning(Expr value) {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.function("f",
        Types.code(new ArrayList<Parameter>(), value.type()),
        Stmt.block(Stmt.ret(value)), Location.none()));
    return table;
  }

  @Test
  public void testWideConstantCast() throws Exception {
    Type u128 = Types.unsignedInt(128);
    Expr wide = Expr.intConstant(
        BigInteger.ONE.shiftLeft(64).add(BigInteger.valueOf(5)), u128);
    SymbolTable table = SymtabTransformer.run(logger, OutputMode.C_TEXT,
                                              returning(wide));
    String c = new CTextGenerator(logger, table).generate();
    assertTrue(c, c.contains("return (unsigned __int128)" +
        "((((unsigned __int128)1u) << 64) | ((unsigned __int128)5u));"));
  }

  @Test
  public void testOddWidthConstantCast() throws Exception {
    Expr odd = Expr.intConstant(3, Types.unsignedInt(17));
    SymbolTable table = SymtabTransformer.run(logger, OutputMode.C_TEXT,
                                              returning(odd));
    String c = new CTextGenerator(logger, table).generate();
    assertTrue(c, c.contains(
        "return ((unsigned __CPROVER_bitvector[17])3u);"));
  }

  @Test
  public void testAssignmentExpression() throws Exception {
    Symbol x = Symbol.staticVariable("x", "x", TestPrograms.I32,
        Expr.intConstant(0, TestPrograms.I32), Location.none());
    SymbolTable table = returning(
        x.toExpr().assignExpr(Expr.intConstant(1, TestPrograms.I32)));
    table.insert(x);
    table = SymtabTransformer.run(logger, OutputMode.C_TEXT, table);
    String c = new CTextGenerator(logger, table).generate();
    assertTrue(c, c.contains("return (x = 1);"));
  }
}
