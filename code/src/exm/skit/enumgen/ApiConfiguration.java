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
package exm.skit.enumgen;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ImmutableSet;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import exm.skit.common.exceptions.UserException;

/**
 * Backend API description the enums are generated from:
 * <pre>
 * { "endpoints":   { "users": "/api/users" },
 *   "statusCodes": { "ok": 200 },
 *   "errorTypes":  [ { "name": "httpError",
 *                      "associatedData": ["statusCode: Int"] } ] }
 * </pre>
 */
public class ApiConfiguration
{
  private static final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /**
   * Swift keywords, which cannot be case or label names without
   * backticks
   */
  private static final Set<String> RESERVED = ImmutableSet.of(
      // Declarations
      "associatedtype", "class", "deinit", "enum", "extension",
      "fileprivate", "func", "import", "init", "inout", "internal", "let",
      "open", "operator", "private", "precedencegroup", "protocol",
      "public", "rethrows", "static", "struct", "subscript", "typealias",
      "var",
      // Statements
      "break", "case", "catch", "continue", "default", "defer", "do",
      "else", "fallthrough", "for", "guard", "if", "in", "repeat",
      "return", "throw", "switch", "where", "while",
      // Expressions and types
      "Any", "as", "await", "false", "is", "nil", "self", "Self",
      "super", "throws", "true", "try", "_");

  public Map<String, String> endpoints;
  public Map<String, Integer> statusCodes;
  public List<ErrorTypeConfiguration> errorTypes;

  public static class ErrorTypeConfiguration
  {
    public String name;
    /** Entries of the form "name: Type" or just "Type".  May be null */
    public List<String> associatedData;
  }

  public ApiConfiguration()
  {
    endpoints = new LinkedHashMap<String, String>();
    statusCodes = new LinkedHashMap<String, Integer>();
    errorTypes = new ArrayList<ErrorTypeConfiguration>();
  }

  public static ApiConfiguration load(File file) throws UserException
  {
    ApiConfiguration config;
    try {
      config = mapper.readValue(file, ApiConfiguration.class);
    } catch (JsonProcessingException e) {
      throw new UserException(file.getPath(),
          "malformed configuration: " + e.getOriginalMessage());
    } catch (IOException e) {
      throw new UserException(file.getPath(),
          "could not read configuration: " + e.getMessage());
    }
    config.validate(file.getPath());
    return config;
  }

  public static ApiConfiguration parse(String json) throws UserException
  {
    ApiConfiguration config;
    try {
      config = mapper.readValue(json, ApiConfiguration.class);
    } catch (JsonProcessingException e) {
      throw new UserException("malformed configuration: " +
                              e.getOriginalMessage());
    }
    config.validate("<string>");
    return config;
  }

  /**
   * Check all required sections are present and names are usable as
   * Swift identifiers
   */
  void validate(String source) throws UserException
  {
    if (endpoints == null) {
      throw new UserException(source, "missing section: endpoints");
    }
    if (statusCodes == null) {
      throw new UserException(source, "missing section: statusCodes");
    }
    if (errorTypes == null) {
      throw new UserException(source, "missing section: errorTypes");
    }
    for (String key: endpoints.keySet()) {
      checkIdentifier(source, "endpoint", key);
      if (endpoints.get(key) == null) {
        throw new UserException(source, "endpoint " + key +
                                        " has no path");
      }
    }
    for (String key: statusCodes.keySet()) {
      checkIdentifier(source, "status code", key);
      if (statusCodes.get(key) == null) {
        throw new UserException(source, "status code " + key +
                                        " has no value");
      }
    }
    for (ErrorTypeConfiguration et: errorTypes) {
      if (et == null || et.name == null) {
        throw new UserException(source, "error type without name");
      }
      checkIdentifier(source, "error type", et.name);
      if (et.associatedData != null) {
        for (String entry: et.associatedData) {
          AssociatedEntry.parse(source, et.name, entry);
        }
      }
    }
  }

  static void checkIdentifier(String source, String what, String name)
                                                  throws UserException
  {
    if (!IDENTIFIER.matcher(name).matches()) {
      throw new UserException(source, "invalid " + what + " name: \"" +
                              name + "\"");
    }
    if (RESERVED.contains(name)) {
      throw new UserException(source, what + " name \"" + name +
                              "\" is a Swift keyword");
    }
  }

  /**
   * One parsed associatedData entry
   */
  static class AssociatedEntry
  {
    /** null if unlabeled */
    final String label;
    final String type;

    private AssociatedEntry(String label, String type)
    {
      this.label = label;
      this.type = type;
    }

    static AssociatedEntry parse(String source, String errorName,
                                 String entry) throws UserException
    {
      if (entry == null || entry.trim().isEmpty()) {
        throw new UserException(source, "error type " + errorName +
                                ": empty associated data entry");
      }
      int colon = entry.indexOf(':');
      if (colon < 0) {
        return new AssociatedEntry(null, entry.trim());
      }
      String label = entry.substring(0, colon).trim();
      String type = entry.substring(colon + 1).trim();
      checkIdentifier(source, "associated value", label);
      if (type.isEmpty()) {
        throw new UserException(source, "error type " + errorName +
                                ": no type for " + label);
      }
      return new AssociatedEntry(label, type);
    }
  }
}
