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
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;

import org.apache.log4j.Logger;

import exm.skit.builder.BlockBuilder;
import exm.skit.builder.SequenceBuilder;
import exm.skit.common.Logging;
import exm.skit.common.exceptions.SKitRuntimeError;
import exm.skit.common.exceptions.UserException;
import exm.skit.enumgen.ApiConfiguration.AssociatedEntry;
import exm.skit.enumgen.ApiConfiguration.ErrorTypeConfiguration;
import exm.skit.tree.AccessLevel;
import exm.skit.tree.EnumCase;
import exm.skit.tree.EnumDecl;
import exm.skit.tree.Group;
import exm.skit.tree.Line;
import exm.skit.tree.Literal;

/**
 * Generates the API enums (endpoints, HTTP status codes and network
 * errors) from an {@link ApiConfiguration}.
 */
public class EnumGenerator
{
  private static final Logger logger = Logging.getSKitLogger();

  private final ApiConfiguration config;
  /** Config file name, quoted in comments */
  private final String sourceName;

  public EnumGenerator(ApiConfiguration config, String sourceName)
  {
    this.config = config;
    this.sourceName = sourceName;
  }

  public static EnumGenerator fromFile(File configFile)
                                              throws UserException
  {
    ApiConfiguration config = ApiConfiguration.load(configFile);
    logger.debug("loaded " + configFile + ": " +
        config.endpoints.size() + " endpoints, " +
        config.statusCodes.size() + " status codes, " +
        config.errorTypes.size() + " error types");
    return new EnumGenerator(config, configFile.getName());
  }

  /**
   * One case per endpoint, sorted by case name, raw value the path
   */
  public EnumDecl generateAPIEndpoints()
  {
    final List<Map.Entry<String, String>> entries =
        new ArrayList<Map.Entry<String, String>>(config.endpoints.entrySet());
    Collections.sort(entries, new Comparator<Map.Entry<String, String>>() {
      @Override
      public int compare(Map.Entry<String, String> a,
                         Map.Entry<String, String> b) {
        return a.getKey().compareTo(b.getKey());
      }
    });

    return new EnumDecl("APIEndpoint", new BlockBuilder() {
      @Override
      public void build(SequenceBuilder b) {
        for (Map.Entry<String, String> e: entries) {
          // Paths come from the configuration, not from Swift source
          b.add(new EnumCase(e.getKey())
                    .rawValue(Literal.escapedString(e.getValue())));
        }
      }
    })
        .inherits("String")
        .inherits("CaseIterable")
        .access(AccessLevel.PUBLIC)
        .comment("API endpoints for the application",
                 "",
                 "Generated automatically from " + sourceName,
                 "Always synchronized with backend configuration");
  }

  /**
   * One case per status code, sorted by code, then name
   */
  public EnumDecl generateHTTPStatus()
  {
    final List<Map.Entry<String, Integer>> entries =
        new ArrayList<Map.Entry<String, Integer>>(
                                   config.statusCodes.entrySet());
    Collections.sort(entries, new Comparator<Map.Entry<String, Integer>>() {
      @Override
      public int compare(Map.Entry<String, Integer> a,
                         Map.Entry<String, Integer> b) {
        int c = a.getValue().compareTo(b.getValue());
        return (c != 0) ? c : a.getKey().compareTo(b.getKey());
      }
    });

    return new EnumDecl("HTTPStatus", new BlockBuilder() {
      @Override
      public void build(SequenceBuilder b) {
        for (Map.Entry<String, Integer> e: entries) {
          b.add(new EnumCase(e.getKey()).rawValue(e.getValue()));
        }
      }
    })
        .inherits("Int")
        .inherits("CaseIterable")
        .access(AccessLevel.PUBLIC)
        .comment("HTTP status codes for API responses",
                 "",
                 "Generated automatically from " + sourceName,
                 "Complete coverage of all backend status codes");
  }

  /**
   * One case per error type, in configuration order
   */
  public EnumDecl generateNetworkError()
  {
    return new EnumDecl("NetworkError", new BlockBuilder() {
      @Override
      public void build(SequenceBuilder b) {
        for (ErrorTypeConfiguration et: config.errorTypes) {
          b.add(errorCase(et));
        }
      }
    })
        .inherits("Error")
        .inherits("Equatable")
        .access(AccessLevel.PUBLIC)
        .comment("Network errors that can occur during API calls",
                 "",
                 "Generated automatically from " + sourceName,
                 "Structural match with backend error format");
  }

  private EnumCase errorCase(ErrorTypeConfiguration et)
  {
    EnumCase c = new EnumCase(et.name);
    if (et.associatedData == null) {
      return c;
    }
    for (String entry: et.associatedData) {
      AssociatedEntry ae;
      try {
        ae = AssociatedEntry.parse(sourceName, et.name, entry);
      } catch (UserException e) {
        // Configurations are validated on load
        throw new SKitRuntimeError(e.getMessage(), e);
      }
      if (ae.label == null) {
        c = c.associatedValue(ae.type);
      } else {
        c = c.associatedValue(ae.label, ae.type);
      }
    }
    return c;
  }

  public Group generateAll()
  {
    return generateAll(timestamp(new Date()));
  }

  /**
   * @param generatedOn time stamp written into the header comment
   */
  public Group generateAll(final String generatedOn)
  {
    return new Group(new BlockBuilder() {
      @Override
      public void build(SequenceBuilder b) {
        b.add(Line.comment("MARK: - Generated API Enums"));
        b.add(Line.comment("Auto-generated from " + sourceName));
        b.add(Line.comment("Always synchronized with backend configuration"));
        b.add(Line.comment("Generated on: " + generatedOn));
        b.add(Line.blank());
        b.add(generateAPIEndpoints());
        b.add(Line.blank());
        b.add(generateHTTPStatus());
        b.add(Line.blank());
        b.add(generateNetworkError());
      }
    });
  }

  /** ISO 8601, UTC, second precision */
  static String timestamp(Date date)
  {
    SimpleDateFormat fmt = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss'Z'");
    fmt.setTimeZone(TimeZone.getTimeZone("UTC"));
    return fmt.format(date);
  }
}
