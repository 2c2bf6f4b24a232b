package exm.gotoc.ir;

import java.util.ArrayList;
import java.util.Arrays;

import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Operators.BinaryOperator;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.DatatypeComponent;
import exm.gotoc.ir.tree.Types.Parameter;
import exm.gotoc.ir.tree.Types.Type;

/**
 * Small closed goto programs shared between tests
 */
public class TestPrograms {

  public static final Type I32 = Types.signedInt(32);
  public static final Type U32 = Types.unsignedInt(32);
  public static final Type U64 = Types.unsignedInt(64);

  public static Location loc(String function, int line) {
    return Location.create("sample.c", function, line, 1);
  }

  /**
   * struct pair { a: i32, padding 32, b: u64 };
   * int counter = 0;
   * int add(int x, int y) { return x + y; }
   * int main() {
   *   struct pair p = { 1, nondet, 2 };
   *   counter = add(p.a, 1);
   *   assert(counter > 0);
   *   return counter;
   * }
   */
  public static SymbolTable sample() {
    SymbolTable table = new SymbolTable();

    table.insert(Symbol.structType("pair", Arrays.asList(
          DatatypeComponent.field("a", I32),
          DatatypeComponent.padding("pad", 32),
          DatatypeComponent.field("b", U64))));
    Type pairT = Types.structTag("pair");

    Symbol counter = Symbol.staticVariable("counter", "counter", I32,
                            Expr.intConstant(0, I32), loc(null, 1));
    table.insert(counter);

    Symbol x = Symbol.parameter("add::x", "x", I32, loc("add", 3));
    Symbol y = Symbol.parameter("add::y", "y", I32, loc("add", 3));
    table.insert(x);
    table.insert(y);
    Type addType = Types.code(
        Arrays.asList(x.toParameter(), y.toParameter()), I32);
    Symbol add = Symbol.function("add", addType,
        Stmt.block(Stmt.ret(x.toExpr().plus(y.toExpr()))), loc("add", 3));
    table.insert(add);

    Symbol p = Symbol.variable("main::1::p", "p", pairT, loc("main", 6));
    table.insert(p);

    Expr init = Expr.structExpr(pairT, Arrays.asList(
        Expr.intConstant(1, I32), Expr.nondet(U32),
        Expr.intConstant(2, U64)), table);
    Expr call = add.toExpr().call(Arrays.asList(
        p.toExpr().member("a", table), Expr.intConstant(1, I32)));
    Stmt body = Stmt.block(
        Stmt.decl(p.toExpr(), init),
        Stmt.assign(counter.toExpr(), call),
        Stmt.assertion(counter.toExpr().binop(BinaryOperator.GT,
                          Expr.intConstant(0, I32)),
                       "user", "counter positive"),
        Stmt.ret(counter.toExpr()));
    table.insert(Symbol.function("main",
        Types.code(new ArrayList<Parameter>(), I32), body, loc("main", 5)));
    return table;
  }

  /**
   * Function named x::y<i32> taking and returning a 32 bit value, called
   * from a function with an illegal name
   */
  public static SymbolTable mangledNames() {
    SymbolTable table = new SymbolTable();
    Symbol arg = Symbol.parameter("x::y<i32>::arg", "arg", I32,
                                  loc("x::y<i32>", 1));
    table.insert(arg);
    Symbol fn = Symbol.function("x::y<i32>",
        Types.code(Arrays.asList(arg.toParameter()), I32),
        Stmt.block(Stmt.ret(arg.toExpr())), loc("x::y<i32>", 1));
    table.insert(fn);

    Symbol caller = Symbol.function("caller::<impl>",
        Types.code(new ArrayList<Parameter>(), I32),
        Stmt.block(Stmt.ret(fn.toExpr().call(
            Arrays.asList(Expr.intConstant(7, I32))))),
        loc("caller::<impl>", 4));
    table.insert(caller);
    return table;
  }
}
