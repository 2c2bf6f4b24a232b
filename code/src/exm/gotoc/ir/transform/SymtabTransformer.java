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
package exm.gotoc.ir.transform;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * Entry point: prepare a symbol table for one kind of output.
 */
public class SymtabTransformer {

  /**
   * Transform the table for the given output mode and return a new one.
   * The input table is not modified.
   */
  public static SymbolTable run(Logger logger, OutputMode mode,
                                SymbolTable table) throws TransformException {
    return run(logger, null, mode, table);
  }

  /**
   * @param dumpOutput where to log the table between passes.  Null for
   *              no output
   */
  public static SymbolTable run(Logger logger, PrintStream dumpOutput,
          OutputMode mode, SymbolTable table) throws TransformException {
    if (dumpOutput != null) {
      table.log(dumpOutput, "Initial symbol table");
    }

    boolean validate = Settings.getBoolean(Settings.VALIDATE_PASSES);
    TransformPipeline pipe = buildPipeline(dumpOutput, mode, validate);

    logger.debug("Transforming " + table.size() + " symbols for " + mode);
    SymbolTable result = pipe.runPipeline(logger, table);
    logger.debug("Transformed table has " + result.size() + " symbols");
    return result;
  }

  /**
   * Passes for an output mode, in the order they run.  Returns new pass
   * instances on every call.
   */
  public static List<SymtabPass> passesFor(OutputMode mode) {
    List<SymtabPass> passes = new ArrayList<SymtabPass>();
    switch (mode) {
      case GOTO_BINARY:
      case DEBUG:
        passes.add(new IdentityTransformer());
        break;
      case C_TEXT:
        // Names must be normalized before passes that add new names
        passes.add(new NameTransformer());
        passes.add(new ExprTransformer());
        passes.add(new NondetTransformer());
        break;
      default:
        throw new GotocRuntimeError("Unknown output mode " + mode);
    }
    return passes;
  }

  /**
   * Mode passes, with input validation first and, if validate is set,
   * closure checks after each pass
   */
  public static TransformPipeline buildPipeline(PrintStream dumpOutput,
                                    OutputMode mode, boolean validate) {
    TransformPipeline pipe = new TransformPipeline(dumpOutput);
    pipe.addPass(Validate.inputValidator());
    for (SymtabPass pass: passesFor(mode)) {
      pipe.addPass(pass);
      if (validate) {
        pipe.addPass(Validate.closureValidator(pass.getPassName()));
      }
    }
    if (mode == OutputMode.C_TEXT) {
      pipe.addPass(Validate.cTextValidator());
    }
    return pipe;
  }
}
