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
package exm.skit.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

import exm.skit.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String SKIT_LOGGER_NAME = "exm.skit";

  private static final String FILE_LAYOUT = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted, by level.
   */
  private static final SetMultimap<Level, String> emitted =
          HashMultimap.create();

  public static Logger getSKitLogger() {
    return Logger.getLogger(SKIT_LOGGER_NAME);
  }

  /**
   * Route the generator log to a file in addition to whatever the
   * log4j.properties on the classpath configures.
   * @param logfile empty or null to leave configuration untouched
   * @param trace if true, log everything down to TRACE into the file
   * @return the generator logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                        throws InvalidOptionException {
    Logger skitLogger = getSKitLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      return skitLogger;
    }

    try {
      FileAppender appender = new FileAppender(
                  new PatternLayout(FILE_LAYOUT), logfile, false);
      skitLogger.addAppender(appender);
    } catch (IOException e) {
      throw new InvalidOptionException("Could not open log file " +
                                       logfile + ": " + e.getMessage());
    }
    skitLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return skitLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.put(level, msg);
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getSKitLogger().warn(msg);
    } else {
      getSKitLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
