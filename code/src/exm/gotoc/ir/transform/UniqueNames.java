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

import java.util.HashSet;
import java.util.Set;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.NameCollisionExhaustedException;
import exm.gotoc.common.exceptions.TransformException;

/**
 * Names in use within one pass run, and the rule for picking a fresh one:
 * base, base$1, base$2, ... taking the first that is not in use.
 *
 * One instance per run; never shared between tables.
 */
public class UniqueNames {
  public static final char SUFFIX_SEPARATOR = '$';

  private final Set<String> used = new HashSet<String>();
  private final long maxSuffix;

  public UniqueNames(long maxSuffix) {
    this.maxSuffix = maxSuffix;
  }

  /**
   * Use the configured suffix bound
   */
  public static UniqueNames fromSettings() throws TransformException {
    return new UniqueNames(Settings.getLong(Settings.NAMES_MAX_SUFFIX));
  }

  public static String candidate(String base, long n) {
    if (n == 0) {
      return base;
    }
    return base + SUFFIX_SEPARATOR + n;
  }

  /**
   * Mark name as used
   * @return false if it was already used
   */
  public boolean reserve(String name) {
    return used.add(name);
  }

  public void reserveAll(Iterable<String> names) {
    for (String name: names) {
      used.add(name);
    }
  }

  public boolean isUsed(String name) {
    return used.contains(name);
  }

  /**
   * Choose and reserve the first unused candidate for base
   */
  public String claim(String base) throws NameCollisionExhaustedException {
    return claim("", base);
  }

  /**
   * Like {@link #claim(String)}, but a candidate c is unused if prefix + c
   * is unused.  Returns the candidate without prefix.
   */
  public String claim(String prefix, String base)
                          throws NameCollisionExhaustedException {
    for (long n = 0; n <= maxSuffix; n++) {
      String name = candidate(base, n);
      if (used.add(prefix + name)) {
        return name;
      }
    }
    throw new NameCollisionExhaustedException(base, maxSuffix + 1);
  }
}
