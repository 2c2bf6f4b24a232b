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
import java.util.Map.Entry;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;

/**
 * Symbol table is not referentially closed: some symbols refer to
 * identifiers that are not keys of the table.  This always indicates
 * a defect in whatever produced the table.
 */
public class UnresolvedReferenceException extends TransformException {

  private final ListMultimap<String, String> unresolved;

  /**
   * @param stage where the check was made, e.g. "input" or a pass name
   * @param unresolved map from referencing symbol to missing identifiers
   */
  public UnresolvedReferenceException(String stage,
                  ListMultimap<String, String> unresolved) {
    super(buildMessage(stage, unresolved));
    this.unresolved = unresolved;
  }

  public ListMultimap<String, String> getUnresolved() {
    return unresolved;
  }

  private static String buildMessage(String stage,
                  ListMultimap<String, String> unresolved) {
    StringBuilder sb = new StringBuilder();
    sb.append("unresolved references after " + stage + ":");
    for (Entry<String, List<String>> e:
                        Multimaps.asMap(unresolved).entrySet()) {
      sb.append(" " + e.getKey() + " -> " + e.getValue() + ";");
    }
    return sb.toString();
  }

  private static final long serialVersionUID = 1L;
}
