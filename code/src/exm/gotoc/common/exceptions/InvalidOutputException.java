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
package exm.gotoc.common.exceptions;

import java.util.List;

/**
 * Symbol table is closed but cannot be written in the requested output
 * format, e.g. it has names that are not C identifiers.
 */
public class InvalidOutputException extends TransformException {

  private final List<String> offending;

  /**
   * @param problem what is wrong, e.g. "illegal C identifiers"
   * @param stage where the check was made
   * @param offending names of offending symbols or identifiers
   */
  public InvalidOutputException(String problem, String stage,
                                List<String> offending) {
    super(problem + " (" + stage + "): " + offending);
    this.offending = offending;
  }

  public List<String> getOffending() {
    return offending;
  }

  private static final long serialVersionUID = 1L;
}
