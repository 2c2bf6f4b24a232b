/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.gotoc.ui;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import exm.gotoc.cbackend.CTextGenerator;
import exm.gotoc.common.Logging;
import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.InvalidOptionException;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.ir.transform.OutputMode;
import exm.gotoc.ir.transform.SymtabTransformer;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.irep.IrepSerializer;

/**
 * Main entry point: transform a goto program for an output mode and
 * write it out.
 */
public class GotocCompiler {

  private final Logger logger;

  public GotocCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * Load settings from system properties and set up logging from them
   * @return the configured logger
   */
  public static Logger configure() throws InvalidOptionException {
    Settings.initProperties();
    return Logging.setupLogging(Settings.get(Settings.LOG_FILE),
                                Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * Transform table for mode and write result to output.  If
   * {@link Settings#DUMP_FILE} is set, the table is logged there after
   * every pass.
   * @return the transformed table
   */
  public SymbolTable compile(OutputMode mode, SymbolTable table,
                             OutputStream output)
                          throws TransformException, IOException {
    PrintStream dumpOutput = openDumpFile();
    SymbolTable result;
    try {
      result = SymtabTransformer.run(logger, dumpOutput, mode, table);
    } finally {
      IOUtils.closeQuietly(dumpOutput);
    }

    switch (mode) {
      case GOTO_BINARY: {
        Writer w = new OutputStreamWriter(output, StandardCharsets.UTF_8);
        new IrepSerializer().write(logger, result, w);
        w.flush();
        break;
      }
      case C_TEXT:
        IOUtils.write(new CTextGenerator(logger, result).generate(), output,
                      StandardCharsets.UTF_8);
        break;
      case DEBUG:
        IOUtils.write(result.toString(), output, StandardCharsets.UTF_8);
        break;
      default:
        throw new IllegalArgumentException("Unknown output mode " + mode);
    }
    output.flush();
    logger.debug("Wrote " + mode + " output");
    return result;
  }

  /**
   * @return stream for dump file, or null if none configured
   */
  private PrintStream openDumpFile() throws IOException {
    String dumpFile = Settings.get(Settings.DUMP_FILE);
    if (dumpFile == null || dumpFile.trim().isEmpty()) {
      return null;
    }
    logger.debug("Dumping symbol tables to " + dumpFile);
    OutputStream out = FileUtils.openOutputStream(new File(dumpFile));
    return new PrintStream(out, true, "UTF-8");
  }
}
