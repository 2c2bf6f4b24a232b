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

/**
 * A pass met a construct it cannot lower for the active output mode.
 * The same table may still be accepted by a different mode.
 */
public class UnsupportedConstructException extends TransformException {

  private final String symbolName;
  private final String constructKind;
  private final String passName;

  public UnsupportedConstructException(String symbolName,
        String constructKind, String passName, String detail) {
    super(passName + ": cannot lower " + constructKind + " in symbol "
        + symbolName + (detail == null ? "" : ": " + detail));
    this.symbolName = symbolName;
    this.constructKind = constructKind;
    this.passName = passName;
  }

  public String getSymbolName() {
    return symbolName;
  }

  public String getConstructKind() {
    return constructKind;
  }

  public String getPassName() {
    return passName;
  }

  private static final long serialVersionUID = 1L;
}
