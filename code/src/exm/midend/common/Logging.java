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

package exm.midend.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Map.Entry;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.Maps;

import exm.midend.common.exceptions.MidendRuntimeError;

public class Logging {
  private static final String MIDEND_LOGGER_NAME = "exm.midend";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Entry<Level, String>> emitted =
          new HashSet<Entry<Level, String>>();

  public static Logger getMidendLogger() {
    return Logger.getLogger(MIDEND_LOGGER_NAME);
  }

  /**
   * Configure the middle-end logger.
   * @param logfile file to append to.  Empty or null means console
   * @param trace if true, log at trace level, otherwise at warn level
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger logger = getMidendLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);
    if (StringUtils.isBlank(logfile)) {
      logger.addAppender(new ConsoleAppender(layout,
                                       ConsoleAppender.SYSTEM_ERR));
    } else {
      try {
        logger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new MidendRuntimeError("Could not open log file " + logfile
                                     + ": " + e.getMessage());
      }
    }
    logger.setLevel(trace ? Level.TRACE : Level.WARN);
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(Maps.immutableEntry(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getMidendLogger().warn(msg);
    } else {
      getMidendLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
