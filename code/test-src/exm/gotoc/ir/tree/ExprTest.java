package exm.gotoc.ir.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.ir.TestPrograms;
import exm.gotoc.ir.tree.Expr.ExprKind;
import exm.gotoc.ir.tree.Operators.BinaryOperator;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

public class ExprTest {

  private static final Type I32 = TestPrograms.I32;
  private static final Type U64 = TestPrograms.U64;

  @Test
  public void testComparisonIsBool() {
    Expr x = Expr.symbol("x", I32);
    Expr cmp = x.lt(Expr.intConstant(3, I32));
    assertEquals(Types.bool(), cmp.type());
    assertEquals(BinaryOperator.LT, cmp.binaryOp());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testArithmeticTypeMismatch() {
    Expr.symbol("x", I32).plus(Expr.intConstant(1, U64));
  }

  @Test
  public void testPointerArithmetic() {
    Type ptr = I32.toPointer();
    Expr p = Expr.symbol("p", ptr).plus(Expr.intConstant(1, Types.sizeT()));
    assertEquals(ptr, p.type());
    assertEquals(I32, p.dereference().type());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testLogicalNeedsBool() {
    Expr.symbol("x", I32).and(Expr.boolConstant(true));
  }

  @Test(expected=GotocRuntimeError.class)
  public void testIntConstantNeedsIntegerType() {
    Expr.intConstant(1, Types.doubleType());
  }

  @Test
  public void testCallChecksArguments() {
    Parameter p = new Parameter("f::a", "a", I32);
    Expr f = Expr.symbol("f", Types.code(Arrays.asList(p), U64));
    Expr call = f.call(Arrays.asList(Expr.intConstant(4, I32)));
    assertEquals(ExprKind.FUNCTION_CALL, call.kind());
    assertEquals(U64, call.type());
    assertEquals(f, call.function());
    assertEquals(1, call.arguments().size());

    try {
      f.call(new ArrayList<Expr>());
      throw new AssertionError("arity not checked");
    } catch (GotocRuntimeError e) {
      // expected
    }
    try {
      f.call(Arrays.asList(Expr.intConstant(4, U64)));
      throw new AssertionError("argument type not checked");
    } catch (GotocRuntimeError e) {
      // expected
    }
  }

  @Test
  public void testVariadicCallAcceptsExtraArguments() {
    Parameter p = Parameter.unnamed(Types.cChar().toPointer());
    Expr printf = Expr.symbol("printf",
          Types.variadicCode(Arrays.asList(p), Types.cInt()));
    Expr fmt = Expr.symbol("fmt", Types.cChar().toPointer());
    Expr call = printf.call(Arrays.asList(fmt, Expr.intConstant(1, I32)));
    assertEquals(Types.cInt(), call.type());
  }

  @Test
  public void testStructExprCountsPadding() {
    SymbolTable table = TestPrograms.sample();
    Type pair = Types.structTag("pair");
    try {
      Expr.structExpr(pair, Arrays.asList(Expr.intConstant(1, I32),
                          Expr.intConstant(2, U64)), table);
      throw new AssertionError("missing padding value accepted");
    } catch (GotocRuntimeError e) {
      // expected
    }
    Expr s = Expr.structExpr(pair, Arrays.asList(Expr.intConstant(1, I32),
        Expr.nondet(Types.unsignedInt(32)), Expr.intConstant(2, U64)), table);
    assertEquals(3, s.operands().size());
    assertEquals(U64, Expr.symbol("p", pair).member("b", table).type());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testMemberOfMissingField() {
    SymbolTable table = TestPrograms.sample();
    Expr.symbol("p", Types.structTag("pair")).member("c", table);
  }

  @Test
  public void testUnionExpr() {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.unionType("u", Arrays.asList(
        DatatypeComponent.field("i", I32),
        DatatypeComponent.field("f", Types.floatType()))));
    Expr u = Expr.unionExpr(Types.unionTag("u"), "f",
                            Expr.floatConstant(1.5f), table);
    assertEquals("f", u.field());
    assertEquals(Types.unionTag("u"), u.type());
  }

  @Test
  public void testStringConstantType() {
    Expr s = Expr.stringConstant("abc");
    assertEquals(Types.cChar().arrayOf(4), s.type());
  }

  @Test
  public void testLvalues() {
    Expr x = Expr.symbol("x", I32.toPointer());
    assertTrue(x.isLvalue());
    assertTrue(x.dereference().isLvalue());
    assertFalse(Expr.intConstant(1, I32).isLvalue());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testAssignToNonLvalue() {
    Stmt.assign(Expr.intConstant(1, I32), Expr.intConstant(2, I32));
  }

  @Test(expected=GotocRuntimeError.class)
  public void testWrongAccessor() {
    Expr.intConstant(1, I32).identifier();
  }

  @Test
  public void testEqualityIncludesLocation() {
    Location loc = Location.create("a.c", "f", 1, 2);
    Expr a = Expr.symbol("x", I32);
    Expr b = Expr.symbol("x", I32).withLocation(loc);
    assertFalse(a.equals(b));
    assertEquals(b, Expr.symbol("x", I32).withLocation(loc));
  }

  @Test
  public void testStatementExpression() {
    Expr x = Expr.symbol("x", I32);
    Expr e = Expr.statementExpression(Collections.singletonList(
              Stmt.expression(x)), I32);
    assertEquals(ExprKind.STATEMENT_EXPRESSION, e.kind());
    assertEquals(1, e.statements().size());
  }

  @Test
  public void testAssignExpr() {
    Expr x = Expr.symbol("x", I32);
    Expr assign = x.assignExpr(Expr.intConstant(4, I32));
    assertEquals(ExprKind.ASSIGN, assign.kind());
    assertEquals(I32, assign.type());
    assertEquals(x, assign.operand(0));
  }

  @Test(expected=GotocRuntimeError.class)
  public void testAssignExprToNonLvalue() {
    Expr.intConstant(1, I32).assignExpr(Expr.intConstant(4, I32));
  }

  @Test(expected=GotocRuntimeError.class)
  public void testAssignTypeMismatch() {
    Expr.symbol("x", I32).assignExpr(Expr.intConstant(4, U64));
  }
}
