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
package exm.gotoc.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.gotoc.common.exceptions.InvalidOptionException;

/**
 * General transformer settings.
 *
 * Defaults are set here; any key can be overridden by a Java system
 * property of the same name when {@link #initProperties()} is called.
 */
public class Settings
{
  /** Re-check referential closure after every pass */
  public static final String VALIDATE_PASSES = "gotoc.transform.validate";
  /** File to dump the symbol table to after each pass.  Empty for none */
  public static final String DUMP_FILE = "gotoc.transform.dump-file";
  /** Upper bound on numeric suffix search when making names unique */
  public static final String NAMES_MAX_SUFFIX = "gotoc.names.max-suffix";

  public static final String LOG_FILE = "gotoc.log.file";
  public static final String LOG_TRACE = "gotoc.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(VALIDATE_PASSES, "true");
    defaults.setProperty(DUMP_FILE, "");
    defaults.setProperty(NAMES_MAX_SUFFIX, "1000000");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set for key, falling back to the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(VALIDATE_PASSES);
    getBoolean(LOG_TRACE);
    long maxSuffix = getLong(NAMES_MAX_SUFFIX);
    if (maxSuffix < 1) {
      throw new InvalidOptionException("Expected " + NAMES_MAX_SUFFIX +
                  " to be positive but was " + maxSuffix);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
