package exm.gotoc.ir.transform;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exm.gotoc.common.Logging;
import exm.gotoc.common.Settings;
import exm.gotoc.ir.TestPrograms;
import exm.gotoc.ir.transform.TreeWalk.TreeWalker;
import exm.gotoc.ir.tree.Expr;
import exm.gotoc.ir.tree.Expr.ExprKind;
import exm.gotoc.ir.tree.Location;
import exm.gotoc.ir.tree.Stmt;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.ir.tree.Types;
import exm.gotoc.ir.tree.Types.Parameter;

public class SymtabTransformerTest {

  private static final Logger logger = Logging.getGotocLogger();

  @After
  public void resetSettings() {
    Settings.reset(Settings.VALIDATE_PASSES);
  }

  private static List<String> passNames(List<SymtabPass> passes) {
    List<String> names = new ArrayList<String>();
    for (SymtabPass pass: passes) {
      names.add(pass.getPassName());
    }
    return names;
  }

  @Test
  public void testPassesForMode() {
    assertEquals(Arrays.asList("Identity"),
        passNames(SymtabTransformer.passesFor(OutputMode.GOTO_BINARY)));
    assertEquals(Arrays.asList("Identity"),
        passNames(SymtabTransformer.passesFor(OutputMode.DEBUG)));
    assertEquals(Arrays.asList("Normalize names", "Desugar expressions",
                               "Lower nondet values"),
        passNames(SymtabTransformer.passesFor(OutputMode.C_TEXT)));
  }

  @Test
  public void testFreshPassInstances() {
    List<SymtabPass> a = SymtabTransformer.passesFor(OutputMode.C_TEXT);
    List<SymtabPass> b = SymtabTransformer.passesFor(OutputMode.C_TEXT);
    for (int i = 0; i < a.size(); i++) {
      assertNotSame(a.get(i), b.get(i));
    }
  }

  @Test
  public void testPipelineWithValidation() {
    TransformPipeline pipe = SymtabTransformer.buildPipeline(null,
                                           OutputMode.C_TEXT, true);
    // input check, 3 passes each followed by a check, C text check
    assertEquals(1 + 3 * 2 + 1, pipe.getPasses().size());
    assertTrue(pipe.getPasses().get(0) instanceof Validate);
    assertTrue(pipe.getPasses().get(1) instanceof NameTransformer);

    pipe = SymtabTransformer.buildPipeline(null, OutputMode.GOTO_BINARY,
                                           false);
    assertEquals(2, pipe.getPasses().size());
  }

  @Test
  public void testIdentityModes() throws Exception {
    SymbolTable in = TestPrograms.sample();
    assertEquals(in, SymtabTransformer.run(logger, OutputMode.GOTO_BINARY,
                                           TestPrograms.sample()));
    assertEquals(in, SymtabTransformer.run(logger, OutputMode.DEBUG,
                                           TestPrograms.sample()));
  }

  @Test
  public void testInputNotModified() throws Exception {
    SymbolTable in = TestPrograms.sample();
    SymtabTransformer.run(logger, OutputMode.C_TEXT, in);
    assertEquals(TestPrograms.sample(), in);
  }

  @Test
  public void testCTextDeterministic() throws Exception {
    SymbolTable a = SymtabTransformer.run(logger, OutputMode.C_TEXT,
                                          TestPrograms.sample());
    SymbolTable b = SymtabTransformer.run(logger, OutputMode.C_TEXT,
                                          TestPrograms.sample());
    assertEquals(a, b);
    assertEquals(a.names(), b.names());
  }

  @Test
  public void testCTextNames() throws Exception {
    Settings.set(Settings.VALIDATE_PASSES, "false");
    SymbolTable out = SymtabTransformer.run(logger, OutputMode.C_TEXT,
                                            TestPrograms.mangledNames());
    assertTrue(out.contains("x__y_i32_"));
    assertTrue(out.contains("x__y_i32___arg"));
    assertTrue(out.contains("caller___impl_"));
    assertTrue(out.contains(ExprTransformer.MAIN));
    for (String name: out.names()) {
      assertTrue(name, CIdentifiers.isLegalName(name));
    }
  }

  @Test
  public void testSampleCText() throws Exception {
    SymbolTable out = SymtabTransformer.run(logger, OutputMode.C_TEXT,
                                            TestPrograms.sample());
    assertTrue(out.contains("add__x"));
    assertTrue(out.contains("main__1__p"));
    assertTrue(out.contains(ExprTransformer.RENAMED_MAIN));
    assertTrue(out.lookup(ExprTransformer.MAIN).isFunctionDefinition());
    assertFalse(out.contains("add::x"));
  }

  @Test
  public void testDumpOutput() throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream dump = new PrintStream(bytes, true, "UTF-8");
    SymtabTransformer.run(logger, dump, OutputMode.C_TEXT,
                          TestPrograms.sample());
    dump.flush();
    String text = bytes.toString("UTF-8");
    assertTrue(text.contains("Initial symbol table"));
    assertTrue(text.contains("after Normalize names"));
    assertTrue(text.contains("after Lower nondet values"));
    assertFalse(text.contains("after Validate"));
  }

  @Test
  public void testCTextLowersNondet() throws Exception {
    SymbolTable table = new SymbolTable();
    table.insert(Symbol.function("f",
        Types.code(new ArrayList<Parameter>(), TestPrograms.U32),
        Stmt.block(Stmt.ret(Expr.nondet(TestPrograms.U32))),
        Location.none()));

    SymbolTable out = SymtabTransformer.run(logger, OutputMode.C_TEXT, table);
    final List<Expr> nondets = new ArrayList<Expr>();
    final List<Expr> calls = new ArrayList<Expr>();
    TreeWalk.walk(logger, out, new TreeWalker() {
      @Override
      protected void visit(Expr e) {
        if (e.kind() == ExprKind.NONDET) {
          nondets.add(e);
        } else if (e.kind() == ExprKind.FUNCTION_CALL) {
          calls.add(e);
        }
      }
    });

    assertEquals(0, nondets.size());
    assertEquals(1, calls.size());
    Expr call = calls.get(0);
    assertEquals("non_det_unsigned_bv_32", call.function().identifier());
    assertEquals(TestPrograms.U32, call.type());
    assertTrue(out.lookup("non_det_unsigned_bv_32").isFunctionDefinition());
  }
}
