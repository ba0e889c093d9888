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
package exm.skit.toolchain;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.skit.common.Logging;
import exm.skit.common.Settings;
import exm.skit.common.exceptions.ToolchainException;

/**
 * Checks generated text with an external Swift toolchain command,
 * by default swiftc -parse.  The file to check is appended as the
 * last argument.
 */
public class SyntaxChecker
{
  private final Logger logger;
  private final List<String> command;

  public SyntaxChecker()
  {
    this(Settings.getCheckCommand());
  }

  public SyntaxChecker(List<String> command)
  {
    this.logger = Logging.getSKitLogger();
    this.command = new ArrayList<String>(command);
  }

  /**
   * Write source to a temporary file and check it
   */
  public void check(String source) throws ToolchainException
  {
    File tmp;
    try {
      tmp = File.createTempFile("skit-check", ".swift");
      FileUtils.writeStringToFile(tmp, source, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ToolchainException("could not write temporary file for " +
                                   "syntax check: " + e.getMessage(), e);
    }
    try {
      check(tmp);
    } finally {
      FileUtils.deleteQuietly(tmp);
    }
  }

  /**
   * @throws ToolchainException if the command could not be run or
   *          exited non-zero.  Carries the combined command output.
   */
  public void check(File file) throws ToolchainException
  {
    if (command.isEmpty()) {
      throw new ToolchainException("no syntax check command configured" +
                              " (" + Settings.CHECK_COMMAND + ")", -1, "");
    }
    List<String> cmd = new ArrayList<String>(command);
    cmd.add(file.getPath());
    String cmdString = StringUtils.join(cmd, ' ');

    logger.debug("Running syntax check: " + cmdString);
    int exitCode;
    String diagnostics;
    Process proc = null;
    try {
      ProcessBuilder pb = new ProcessBuilder(cmd);
      pb.redirectErrorStream(true);
      proc = pb.start();
      proc.getOutputStream().close();
      diagnostics = IOUtils.toString(proc.getInputStream(),
                                     StandardCharsets.UTF_8);
      exitCode = proc.waitFor();
    } catch (IOException e) {
      throw new ToolchainException("I/O error while running syntax check " +
                                   cmdString + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ToolchainException("interrupted while running " +
                                   cmdString, e);
    } finally {
      if (proc != null && proc.isAlive()) {
        logger.debug("Killing unfinished syntax check: " + cmdString);
        proc.destroy();
      }
    }

    logger.debug("Syntax check exit code: " + exitCode);
    if (exitCode != 0) {
      throw new ToolchainException("syntax check failed: " + cmdString +
                     " exited with code " + exitCode, exitCode, diagnostics);
    } else if (diagnostics.length() != 0) {
      logger.warn("Syntax check warnings:\n" + diagnostics);
    }
  }
}
