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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.SystemUtils;
import org.junit.After;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.skit.common.Settings;
import exm.skit.common.exceptions.SKitFatal;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private File config;
  private File output;

  @Before
  public void setUp() throws IOException {
    config = tmp.newFile("api.json");
    FileUtils.writeStringToFile(config,
        "{ \"endpoints\": { \"users\": \"/api/users\" }," +
        "  \"statusCodes\": { \"ok\": 200 }," +
        "  \"errorTypes\": [ { \"name\": \"timeout\" } ] }",
        StandardCharsets.UTF_8);
    output = new File(tmp.getRoot(), "APIEnums.swift");
  }

  @After
  public void tearDown() {
    Settings.clear(Settings.RENDER_STRICT);
    Settings.clear(Settings.RENDER_INDENT_WIDTH);
    Settings.clear(Settings.CHECK_COMMAND);
    Settings.clear(Settings.INPUT_FILENAME);
    Settings.clear(Settings.OUTPUT_FILENAME);
  }

  private static int exitCode(String... args) {
    try {
      Main.execute(args);
    } catch (SKitFatal e) {
      return e.exitCode;
    }
    return ExitCode.SUCCESS.code();
  }

  @Test
  public void testWritesOutput() throws IOException {
    Main.execute(new String[] {config.getPath(), output.getPath()});
    String code = FileUtils.readFileToString(output, StandardCharsets.UTF_8);
    assertTrue(code, code.startsWith("// MARK: - Generated API Enums\n"));
    assertTrue(code, code.contains("    case users = \"/api/users\"\n"));
    assertTrue(code, code.endsWith("}\n"));
    assertEquals(config.getPath(), Settings.get(Settings.INPUT_FILENAME));
  }

  @Test
  public void testIndentOption() throws IOException {
    Main.execute(new String[] {"-I", "2", config.getPath(),
                               output.getPath()});
    String code = FileUtils.readFileToString(output, StandardCharsets.UTF_8);
    assertTrue(code, code.contains("\n  case ok = 200\n"));
  }

  @Test
  public void testUnknownOption() {
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 exitCode("--no-such-option", config.getPath()));
  }

  @Test
  public void testMissingArguments() {
    assertEquals(ExitCode.ERROR_COMMAND.code(), exitCode());
  }

  @Test
  public void testBadIndent() {
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 exitCode("--indent", "40", config.getPath()));
  }

  @Test
  public void testMissingInput() {
    assertEquals(ExitCode.ERROR_IO.code(),
        exitCode(new File(tmp.getRoot(), "absent.json").getPath()));
  }

  @Test
  public void testInvalidConfiguration() throws IOException {
    FileUtils.writeStringToFile(config, "{ \"endpoints\": [ ",
                                StandardCharsets.UTF_8);
    assertEquals(ExitCode.ERROR_USER.code(),
                 exitCode(config.getPath(), output.getPath()));
    assertFalse(output.exists());
  }

  @Test
  public void testFailedCheck() {
    Assume.assumeTrue(SystemUtils.IS_OS_UNIX);
    Settings.set(Settings.CHECK_COMMAND, "false");
    assertEquals(ExitCode.ERROR_TOOLCHAIN.code(),
                 exitCode("--check", config.getPath(), output.getPath()));
    assertFalse(output.exists());
  }

  @Test
  public void testPassedCheck() {
    Assume.assumeTrue(SystemUtils.IS_OS_UNIX);
    Settings.set(Settings.CHECK_COMMAND, "true");
    assertEquals(ExitCode.SUCCESS.code(),
                 exitCode("-c", config.getPath(), output.getPath()));
    assertTrue(output.exists());
  }
}
