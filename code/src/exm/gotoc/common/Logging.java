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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.gotoc.common.exceptions.GotocRuntimeError;

public class Logging {
  private static final String GOTOC_LOGGER_NAME = "exm.gotoc";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  private static final Set<String> emitted = new HashSet<String>();

  public static Logger getGotocLogger() {
    return Logger.getLogger(GOTOC_LOGGER_NAME);
  }

  /**
   * Configure the transformer logger.  Warnings always go to stderr;
   * if a log file is given, debug output (or trace output if requested)
   * goes there as well.
   * @param logfile path of log file, or null/empty for none
   * @param trace
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger logger = getGotocLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);

    Layout layout = new PatternLayout(LOG_PATTERN);
    ConsoleAppender console = new ConsoleAppender(layout,
                                      ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    logger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender file = new FileAppender(layout, logfile, false);
        logger.addAppender(file);
      } catch (IOException e) {
        throw new GotocRuntimeError("Could not open log file " + logfile +
                                    ": " + e.getMessage());
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      logger.setLevel(Level.WARN);
    }
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    synchronized (emitted) {
      return emitted.add(level.toString() + ":" + msg);
    }
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getGotocLogger().warn(msg);
    } else {
      getGotocLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
