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
package mcps.msc.ui;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import mcps.msc.common.Logging;
import mcps.msc.common.Settings;
import mcps.msc.common.exceptions.InvalidOptionException;
import mcps.msc.common.exceptions.MscFatal;

/**
 * Command line interface to the MCP Script compiler.  Some options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String UPDATE_FLAG = "u";
  private static final String NO_VALIDATE_FLAG = "n";
  private static final String LOG_FILE_FLAG = "l";
  private static final String TRACE_FLAG = "t";

  private static final String INPUT_EXT = ".mcps";
  private static final String OUTPUT_EXT = ".js";

  private static final List<File> temporaries = new ArrayList<File>();

  public static void main(String[] args) {
    try {
      Settings.initMscProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Args mscArgs = processArgs(args);

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    } catch (MscFatal ex) {
      System.exit(ex.exitCode);
    }

    File inputFile = new File(mscArgs.inputFilename);
    if (!inputFile.isFile() || !inputFile.canRead()) {
      System.err.println("Input file \"" + inputFile + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }
    File finalOutput = selectOutputFile(mscArgs);

    if (skipCompile(mscArgs, inputFile, finalOutput)) {
      System.exit(ExitCode.SUCCESS.code());
    }

    try {
      // Use intermediate file so we don't create invalid output in case of
      // compilation errors
      File tmpOutput = setupTmpOutput();
      OutputStream outStream = openForOutput(tmpOutput);

      MscCompiler msc = new MscCompiler(logger);
      msc.compile(inputFile.getPath(), outStream, validateEnabled());
      copyToOutput(tmpOutput, finalOutput);
      cleanupTemporaries();
    } catch (MscFatal ex) {
      cleanupTemporaries();
      System.exit(ex.exitCode);
    }
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(UPDATE_FLAG, false, "Update output only if out of date");
    opts.addOption(NO_VALIDATE_FLAG, "no-validate", false,
                   "Skip checking that all names resolve");
    opts.addOption(LOG_FILE_FLAG, "log", true, "Write debug log to file");
    opts.addOption(TRACE_FLAG, "trace", false, "Log at trace level");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
              "but got " + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }

    // Command line flags override properties
    if (cmd.hasOption(NO_VALIDATE_FLAG)) {
      Settings.set(Settings.VALIDATE, "false");
    }
    if (cmd.hasOption(LOG_FILE_FLAG)) {
      Settings.set(Settings.LOG_FILE, cmd.getOptionValue(LOG_FILE_FLAG));
    }
    if (cmd.hasOption(TRACE_FLAG)) {
      Settings.set(Settings.LOG_TRACE, "true");
    }

    Args result = new Args(input, output, cmd.hasOption(UPDATE_FLAG));
    recordArgValues(result);
    return result;
  }

  /**
   * Store in properties for later logging
   * @param args
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.outputFilename);
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    Logger logger = Logging.setupLogging(logfile, trace);
    if (logger.isDebugEnabled()) {
      for (String key: Settings.getKeys()) {
        logger.debug("Setting " + key + "=" + Settings.get(key));
      }
    }
    return logger;
  }

  private static boolean validateEnabled() {
    try {
      return Settings.getBoolean(Settings.VALIDATE);
    } catch (InvalidOptionException e) {
      // Checked by initMscProperties
      System.err.println("Internal error with settings: " + e.getMessage());
      throw new MscFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("msc [options] <input.mcps> [output.js]", opts);
  }

  /**
   * Check conditions for skipping compilation entirely
   */
  private static boolean skipCompile(Args args, File infile, File outfile) {
    if (args.updateOutput && outfile.exists() &&
        !olderThan(outfile, infile)) {
      Logging.getMscLogger().debug("Output up to date. Done.");
      return true;
    }
    return false;
  }

  /**
   * @return output path given on the command line, or the input path with
   *        its extension replaced
   */
  static File selectOutputFile(Args args) {
    if (args.outputFilename != null) {
      return new File(args.outputFilename);
    }
    String infile = args.inputFilename;
    String prefix;
    if (infile.endsWith(INPUT_EXT)) {
      prefix = infile.substring(0, infile.length() - INPUT_EXT.length());
    } else {
      prefix = infile;
    }
    return new File(prefix + OUTPUT_EXT);
  }

  private static File setupTmpOutput() {
    try {
      File result = File.createTempFile("msc-out", OUTPUT_EXT);
      temporaries.add(result);
      return result;
    } catch (IOException e) {
      System.err.println("Error while setting up temporary output: "
          + e.getMessage());
      throw new MscFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static OutputStream openForOutput(File outfile) {
    try {
      return new BufferedOutputStream(new FileOutputStream(outfile));
    } catch (FileNotFoundException e) {
      System.err.println("Unexpected error opening " +
                         outfile.getAbsolutePath() + " for output: " +
                         e.getMessage());
      throw new MscFatal(ExitCode.ERROR_IO.code());
    }
  }

  /**
   * Copy input file to output file.  In event of failure, throw a fatal error
   * @param inputFile
   * @param output
   */
  private static void copyToOutput(File inputFile, File output) {
    try {
      // Use output stream since it interacts better with non-seekable
      // devices such as /dev/stdout
      PrintStream outStream = new PrintStream(new FileOutputStream(output));
      try {
        FileUtils.copyFile(inputFile, outStream);
      } finally {
        outStream.close();
      }
    } catch (IOException e) {
      System.err.println("Error copying output to " + output + ": " +
                         e.getMessage());
      throw new MscFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static boolean olderThan(File file1, File file2) {
    return file1.lastModified() < file2.lastModified();
  }

  private static void cleanupTemporaries() {
    for (File tmp: temporaries) {
      if (tmp.exists() && !tmp.delete()) {
        Logging.getMscLogger().warn("Could not delete temporary file " + tmp);
      }
    }
    temporaries.clear();
  }

  static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean updateOutput;

    public Args(String inputFilename, String outputFilename,
                boolean updateOutput) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.updateOutput = updateOutput;
    }
  }
}
