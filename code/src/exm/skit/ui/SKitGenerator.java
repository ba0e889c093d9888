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

import org.apache.log4j.Logger;

import exm.skit.common.exceptions.SKitFatal;
import exm.skit.common.exceptions.ToolchainException;
import exm.skit.common.exceptions.UserException;
import exm.skit.enumgen.EnumGenerator;
import exm.skit.toolchain.SyntaxChecker;
import exm.skit.tree.Group;

/**
 * Runs one generation: configuration to Swift text, optionally
 * checked with the toolchain.  Failures are reported on stderr and
 * rethrown as {@link SKitFatal} with the matching exit code.
 */
public class SKitGenerator
{
  private final Logger logger;

  public SKitGenerator(Logger logger)
  {
    this.logger = logger;
  }

  /**
   * @param checker null to skip the syntax check
   * @return the generated source
   */
  public String generate(File configFile, SyntaxChecker checker)
  {
    try {
      logger.debug("Generating from " + configFile);
      EnumGenerator gen = EnumGenerator.fromFile(configFile);
      Group file = gen.generateAll();
      String code = file.generateCode() + "\n";
      if (checker != null) {
        checker.check(code);
        logger.debug("Syntax check passed");
      }
      return code;
    } catch (UserException e) {
      System.err.println("skit: " + e.getMessage());
      throw new SKitFatal(ExitCode.ERROR_USER.code());
    } catch (ToolchainException e) {
      System.err.println(e.getDiagnostics());
      System.err.println("skit: " + e.getMessage());
      throw new SKitFatal(ExitCode.ERROR_TOOLCHAIN.code());
    } catch (SKitFatal e) {
      throw e;
    } catch (Throwable e) {
      reportInternalError(e);
      throw new SKitFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("SKIT INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
