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
package exm.skit.common.exceptions;

/**
 * An external tool (e.g. the Swift compiler used to check generated
 * output) could not be run or reported a failure.  Carries the
 * diagnostic text the tool wrote so the caller can show it.
 */
public class ToolchainException extends Exception {

  private final int exitCode;
  private final String diagnostics;

  public ToolchainException(String message, int exitCode,
                            String diagnostics) {
    super(message);
    this.exitCode = exitCode;
    this.diagnostics = diagnostics;
  }

  public ToolchainException(String message, Throwable cause) {
    super(message, cause);
    this.exitCode = -1;
    this.diagnostics = "";
  }

  /**
   * @return exit code of the tool, or -1 if it never ran
   */
  public int getExitCode() {
    return exitCode;
  }

  public String getDiagnostics() {
    return diagnostics;
  }

  private static final long serialVersionUID = 1L;
}
