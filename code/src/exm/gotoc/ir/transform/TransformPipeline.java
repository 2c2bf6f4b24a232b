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
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.InvalidOptionException;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * Fixed sequence of passes: each pass consumes the table produced by the
 * previous one.
 */
public class TransformPipeline {

  public TransformPipeline(PrintStream dumpOutput) {
    this.dumpOutput = dumpOutput;
  }

  private final List<SymtabPass> passes = new ArrayList<SymtabPass>();
  private final PrintStream dumpOutput;

  public void addPass(SymtabPass pass) {
    passes.add(pass);
  }

  public List<SymtabPass> getPasses() {
    return Collections.unmodifiableList(passes);
  }

  /**
   * Run all enabled passes in order.  The first failure aborts the run;
   * no partially transformed table is returned.
   * @return table produced by last pass
   */
  public SymbolTable runPipeline(Logger logger, SymbolTable table)
                                      throws TransformException {
    SymbolTable current = table;
    for (SymtabPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        current = pass.transform(logger, current);
        if (dumpOutput != null && !(pass instanceof Validate)) {
          current.log(dumpOutput, "Symbol table after " +
                      pass.getPassName());
        }
      }
    }
    return current;
  }

  public boolean passEnabled(SymtabPass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new GotocRuntimeError("Expected config key " +
          pass.getConfigEnabledKey() + " to exist");
    }
  }
}
