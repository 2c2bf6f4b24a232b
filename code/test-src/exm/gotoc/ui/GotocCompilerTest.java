package exm.gotoc.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.gotoc.common.Logging;
import exm.gotoc.common.Settings;
import exm.gotoc.ir.TestPrograms;
import exm.gotoc.ir.transform.OutputMode;
import exm.gotoc.ir.tree.SymbolTable;

public class GotocCompilerTest {

  private static final Logger logger = Logging.getGotocLogger();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @After
  public void resetSettings() {
    Settings.reset(Settings.DUMP_FILE);
  }

  private static String compile(OutputMode mode, SymbolTable table)
                                                    throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    new GotocCompiler(logger).compile(mode, table, out);
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void testGotoBinary() throws Exception {
    String json = compile(OutputMode.GOTO_BINARY, TestPrograms.sample());
    assertTrue(json.startsWith("{\"symbolTable\":{"));
    assertTrue(json.contains("\"add::x\""));
  }

  @Test
  public void testCText() throws Exception {
    String c = compile(OutputMode.C_TEXT, TestPrograms.mangledNames());
    assertTrue(c.startsWith("#include"));
    assertTrue(c.contains("caller___impl_(void)"));
  }

  @Test
  public void testDebug() throws Exception {
    SymbolTable table = TestPrograms.sample();
    assertEquals(table.toString(), compile(OutputMode.DEBUG, table));
  }

  @Test
  public void testDumpFile() throws Exception {
    File dump = new File(tmp.getRoot(), "dumps/tables.txt");
    Settings.set(Settings.DUMP_FILE, dump.getPath());
    compile(OutputMode.C_TEXT, TestPrograms.sample());

    String text = FileUtils.readFileToString(dump, StandardCharsets.UTF_8);
    assertTrue(text.contains("Initial symbol table"));
    assertTrue(text.contains("Symbol table after Desugar expressions"));
  }
}
