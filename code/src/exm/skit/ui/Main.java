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
package exm.skit.ui;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.skit.common.Logging;
import exm.skit.common.Settings;
import exm.skit.common.exceptions.InvalidOptionException;
import exm.skit.common.exceptions.SKitFatal;
import exm.skit.toolchain.SyntaxChecker;

/**
 * Command line interface to the enum generator.  Rendering options
 * may also be passed through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String STRICT_FLAG = "s";
  private static final String CHECK_FLAG = "c";
  private static final String INDENT_FLAG = "I";
  private static final List<File> temporaries = new ArrayList<File>();

  public static void main(String[] args) {
    try {
      execute(args);
    } catch (SKitFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  /**
   * Run the generator.  Does not exit the JVM.
   * @throws SKitFatal on any failure, carrying the exit code
   */
  public static void execute(String[] args) {
    try {
      Settings.initSKitProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      throw new SKitFatal(ExitCode.ERROR_COMMAND.code());
    }

    Args skitArgs = processArgs(args);

    Logger logger;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      throw new SKitFatal(ExitCode.ERROR_IO.code());
    }

    SyntaxChecker checker = skitArgs.check ? new SyntaxChecker() : null;
    File input = new File(skitArgs.inputFilename);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      throw new SKitFatal(ExitCode.ERROR_IO.code());
    }

    try {
      String code = new SKitGenerator(logger).generate(input, checker);
      if (skitArgs.outputFilename == null) {
        System.out.print(code);
        System.out.flush();
      } else {
        // Use intermediate file so we don't leave partial output
        File tmpOutput = setupTmpOutput();
        writeOutput(tmpOutput, code);
        copyToOutput(tmpOutput, new File(skitArgs.outputFilename));
      }
      cleanupFiles(true, skitArgs);
    } catch (SKitFatal ex) {
      cleanupFiles(false, skitArgs);
      throw ex;
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    opts.addOption(STRICT_FLAG, "strict", false,
                   "Fail on nodes used in the wrong syntactic role");
    opts.addOption(CHECK_FLAG, "check", false,
                   "Check the output with " + Settings.CHECK_COMMAND);

    Option indent = new Option(INDENT_FLAG, "indent", true,
                               "Spaces per indentation level");
    opts.addOption(indent);
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      throw new SKitFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.hasOption(STRICT_FLAG)) {
      Settings.set(Settings.RENDER_STRICT, "true");
    }
    if (cmd.hasOption(INDENT_FLAG)) {
      Settings.set(Settings.RENDER_INDENT_WIDTH,
                   cmd.getOptionValue(INDENT_FLAG));
    }
    try {
      Settings.validateProperties();
    } catch (InvalidOptionException ex) {
      System.err.println(ex.getMessage());
      usage(opts);
      throw new SKitFatal(ExitCode.ERROR_COMMAND.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
                         "but got " + remainingArgs.length + " arguments");
      usage(opts);
      throw new SKitFatal(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    Args result = new Args(input, output, cmd.hasOption(CHECK_FLAG));
    recordArgValues(result);
    return result;
  }

  /**
   * Store in properties for later logging
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
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("skit [options] <config.json> [output.swift]", opts);
  }

  private static File setupTmpOutput() {
    try {
      File result = File.createTempFile("skit-out", ".swift");
      temporaries.add(result);
      return result;
    } catch (IOException e) {
      System.err.println("Error while setting up temporary output: "
          + e.getMessage());
      throw new SKitFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void writeOutput(File file, String code) {
    try {
      FileUtils.writeStringToFile(file, code, StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("Error writing " + file + ": " + e.getMessage());
      throw new SKitFatal(ExitCode.ERROR_IO.code());
    }
  }

  /**
   * Copy input file to output file.  In event of failure, throw a fatal error
   * @param inputFile
   * @param output
   */
  private static void copyToOutput(File inputFile, File output) {
    // Use output stream since it interacts better with non-seekable
    // devices such as /dev/stdout
    try (OutputStream stream = new FileOutputStream(output);
         PrintStream outStream = new PrintStream(stream)) {
      FileUtils.copyFile(inputFile, outStream);
    } catch (IOException e) {
      System.err.println("Error copying to " + output + ": " +
                         e.getMessage());
      throw new SKitFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void cleanupFiles(boolean success, Args skitArgs) {
    if (!success && skitArgs.outputFilename != null) {
      File outFile = new File(skitArgs.outputFilename);
      if (outFile.exists()) {
        outFile.delete();
      }
    }
    for (File temp: temporaries) {
      if (temp.exists()) {
        temp.delete();
      }
    }
    temporaries.clear();
  }

  private static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean check;

    public Args(String inputFilename, String outputFilename,
                boolean check) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.check = check;
    }
  }
}
