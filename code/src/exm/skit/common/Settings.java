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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.skit.common.exceptions.InvalidOptionException;
import exm.skit.common.exceptions.SKitRuntimeError;

/**
 * General generator settings.  Defaults are set here and may be
 * overridden through Java system properties of the same name,
 * e.g. -Dskit.render.strict=true
 * */
public class Settings
{
  /** Abort instead of substituting a placeholder for a misplaced node */
  public static final String RENDER_STRICT = "skit.render.strict";
  /** Number of spaces per nesting level in generated code */
  public static final String RENDER_INDENT_WIDTH = "skit.render.indent-width";

  public static final String LOG_FILE = "skit.log.file";
  public static final String LOG_TRACE = "skit.log.trace";

  /** Command used to syntax-check output; file name is appended */
  public static final String CHECK_COMMAND = "skit.check.command";

  public static final String INPUT_FILENAME = "skit.input_filename";
  public static final String OUTPUT_FILENAME = "skit.output_filename";

  private static final int MAX_INDENT_WIDTH = 16;

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(RENDER_STRICT, "false");
    defaults.setProperty(RENDER_INDENT_WIDTH, "4");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(CHECK_COMMAND, "swiftc -parse");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initSKitProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop an override so the default applies again
   */
  public static void clear(String key) {
    properties.remove(key);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * The check command split on whitespace
   */
  public static List<String> getCheckCommand() {
    String cmd = get(CHECK_COMMAND).trim();
    if (cmd.length() == 0) {
      return Collections.emptyList();
    }
    return Arrays.asList(cmd.split("\\s+"));
  }

  /**
   * Whether rendering should abort on a node in the wrong role.
   * Settings were validated at startup, so a bad value here is a bug.
   */
  public static boolean strictRendering() {
    try {
      return getBoolean(RENDER_STRICT);
    } catch (InvalidOptionException e) {
      throw new SKitRuntimeError(e.getMessage());
    }
  }

  public static int indentWidth() {
    try {
      return (int)getLong(RENDER_INDENT_WIDTH);
    } catch (InvalidOptionException e) {
      throw new SKitRuntimeError(e.getMessage());
    }
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public static void validateProperties() throws InvalidOptionException {
    getBoolean(RENDER_STRICT);
    getBoolean(LOG_TRACE);
    long width = getLong(RENDER_INDENT_WIDTH);
    if (width < 0 || width > MAX_INDENT_WIDTH) {
      throw new InvalidOptionException("Expected property " +
          RENDER_INDENT_WIDTH + " to be between 0 and " + MAX_INDENT_WIDTH +
          " but was " + width);
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    strVal = strVal.trim().toLowerCase();
    if (strVal.equals("true")) {
      return true;
    } else if (strVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option " +
          key + ": " + strVal);
    }
  }
}
