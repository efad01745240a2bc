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
package mcps.msc.common;

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import mcps.msc.common.exceptions.MscFatal;
import mcps.msc.ui.ExitCode;

public class Logging
{
  private static final String MSC_LOGGER_NAME = "mcps.msc";

  private static final String CONSOLE_PATTERN = "msc: %m%n";
  private static final String FILE_PATTERN = "%-5p %c{1} %m%n";

  public static Logger getMscLogger()
  {
    return Logger.getLogger(MSC_LOGGER_NAME);
  }

  /**
   * Send warnings to stderr and, if logfile is non-empty, everything
   * down to DEBUG (or TRACE) to that file.  Safe to call repeatedly.
   * @param logfile path of log file, or null or "" for none
   * @param trace whether to log at TRACE level
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger mscLogger = getMscLogger();
    mscLogger.removeAllAppenders();
    mscLogger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(
        new PatternLayout(CONSOLE_PATTERN), ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    mscLogger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender file = new FileAppender(new PatternLayout(FILE_PATTERN),
                                             logfile, false);
        mscLogger.addAppender(file);
      } catch (IOException e) {
        System.err.println("Could not open log file: " + logfile + ": "
                           + e.getMessage());
        throw new MscFatal(ExitCode.ERROR_IO.code());
      }
      mscLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      // Even if logging is disabled, warnings must reach the user
      mscLogger.setLevel(Level.WARN);
    }
    return mscLogger;
  }
}
