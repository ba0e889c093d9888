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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Date;

import org.junit.Before;
import org.junit.Test;

import exm.skit.common.exceptions.UserException;

public class EnumGeneratorTest {

  private EnumGenerator gen;

  @Before
  public void setUp() throws UserException {
    ApiConfiguration config = ApiConfiguration.parse(
        "{ \"endpoints\": { \"users\": \"/api/users\"," +
        "                   \"auth\": \"/api/auth\" }," +
        "  \"statusCodes\": { \"serverError\": 500, \"ok\": 200," +
        "                     \"success\": 200 }," +
        "  \"errorTypes\": [" +
        "    { \"name\": \"timeout\" }," +
        "    { \"name\": \"httpError\"," +
        "      \"associatedData\": [\"statusCode: Int\", \"String\"] }," +
        "    { \"name\": \"decoding\", \"associatedData\": [] } ] }");
    gen = new EnumGenerator(config, "api.json");
  }

  @Test
  public void testEndpointsSortedByName() {
    assertEquals("/// API endpoints for the application\n" +
                 "///\n" +
                 "/// Generated automatically from api.json\n" +
                 "/// Always synchronized with backend configuration\n" +
                 "public enum APIEndpoint: String, CaseIterable {\n" +
                 "    case auth = \"/api/auth\"\n" +
                 "    case users = \"/api/users\"\n" +
                 "}", gen.generateAPIEndpoints().generateCode());
  }

  @Test
  public void testStatusSortedByCodeThenName() {
    assertEquals("/// HTTP status codes for API responses\n" +
                 "///\n" +
                 "/// Generated automatically from api.json\n" +
                 "/// Complete coverage of all backend status codes\n" +
                 "public enum HTTPStatus: Int, CaseIterable {\n" +
                 "    case ok = 200\n" +
                 "    case success = 200\n" +
                 "    case serverError = 500\n" +
                 "}", gen.generateHTTPStatus().generateCode());
  }

  @Test
  public void testNetworkErrorKeepsFileOrder() {
    assertEquals("/// Network errors that can occur during API calls\n" +
                 "///\n" +
                 "/// Generated automatically from api.json\n" +
                 "/// Structural match with backend error format\n" +
                 "public enum NetworkError: Error, Equatable {\n" +
                 "    case timeout\n" +
                 "    case httpError(statusCode: Int, String)\n" +
                 "    case decoding\n" +
                 "}", gen.generateNetworkError().generateCode());
  }

  @Test
  public void testEndpointPathsAreEscaped() throws UserException {
    ApiConfiguration config = ApiConfiguration.parse(
        "{ \"endpoints\": { \"search\": \"/api/search?q=\\\"x\\\"\\n\"," +
        "                   \"files\": \"C:\\\\data\\\\(id)\" }," +
        "  \"statusCodes\": {}, \"errorTypes\": [] }");
    assertEquals("/api/search?q=\"x\"\n", config.endpoints.get("search"));
    String code = new EnumGenerator(config, "api.json")
                      .generateAPIEndpoints().generateCode();
    assertTrue(code, code.contains(
        "    case files = \"C:\\\\data\\\\(id)\"\n"));
    assertTrue(code, code.contains(
        "    case search = \"/api/search?q=\\\"x\\\"\\n\"\n"));
  }

  @Test
  public void testHeader() {
    String code = gen.generateAll("2024-01-02T03:04:05Z").generateCode();
    String expectedStart =
        "// MARK: - Generated API Enums\n" +
        "// Auto-generated from api.json\n" +
        "// Always synchronized with backend configuration\n" +
        "// Generated on: 2024-01-02T03:04:05Z\n" +
        "\n" +
        "/// API endpoints";
    assertEquals(expectedStart, code.substring(0, expectedStart.length()));
    assertEquals("Enums separated by one blank line", 2,
                 code.split("}\n\n///", -1).length - 1);
  }

  @Test
  public void testTimestampIsUtc() {
    assertEquals("1970-01-01T00:00:00Z", EnumGenerator.timestamp(new Date(0)));
    assertEquals("2001-09-09T01:46:40Z",
                 EnumGenerator.timestamp(new Date(1000000000000L)));
  }
}
