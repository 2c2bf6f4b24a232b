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

import org.apache.log4j.Logger;

import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * One stage of the symbol table pipeline.  A pass never modifies its input
 * table: it either returns it unchanged or builds a new one.
 */
public interface SymtabPass {
  /**
   * @return name of pass for logging
   */
  public String getPassName();

  /**
   * @return name of configuration key that must be true for pass to be
   *         run, or null if the pass always runs
   */
  public String getConfigEnabledKey();

  public SymbolTable transform(Logger logger, SymbolTable input)
                                      throws TransformException;
}
