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
package exm.gotoc.ir.tree;

/**
 * Source location attached to symbols, expressions and statements.
 * Immutable.
 */
public class Location {

  private static final Location NONE = new Location(null, null, 0, 0);

  private final String file;
  private final String function;
  private final int line;
  /** 0 if unknown */
  private final int column;

  private Location(String file, String function, int line, int column) {
    this.file = file;
    this.function = function;
    this.line = line;
    this.column = column;
  }

  public static Location none() {
    return NONE;
  }

  public static Location create(String file, String function, int line,
                                int column) {
    assert(file != null);
    return new Location(file, function, line, column);
  }

  public boolean isNone() {
    return file == null;
  }

  public String file() {
    return file;
  }

  public String function() {
    return function;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  /**
   * Same location attributed to a different function, used when
   * a function is renamed.
   */
  public Location withFunction(String newFunction) {
    if (isNone()) {
      return this;
    }
    return new Location(file, newFunction, line, column);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + ((function == null) ? 0 : function.hashCode());
    result = prime * result + line;
    result = prime * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Location))
      return false;
    Location other = (Location) obj;
    if (file == null ? other.file != null : !file.equals(other.file))
      return false;
    if (function == null ? other.function != null
                         : !function.equals(other.function))
      return false;
    return line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    if (isNone()) {
      return "<none>";
    }
    return file + ":" + line + (column > 0 ? ":" + column : "") +
        (function == null ? "" : " (" + function + ")");
  }
}
