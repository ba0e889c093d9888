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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.skit.common.exceptions.UserException;
import exm.skit.enumgen.ApiConfiguration.AssociatedEntry;

public class ApiConfigurationTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private static final String JSON =
      "{ \"endpoints\": { \"users\": \"/api/users\", " +
      "                   \"auth\": \"/api/auth\" }," +
      "  \"statusCodes\": { \"ok\": 200 }," +
      "  \"errorTypes\": [ { \"name\": \"timeout\" }," +
      "                    { \"name\": \"httpError\"," +
      "                      \"associatedData\": [\"statusCode: Int\"] } ]," +
      "  \"version\": 3 }";

  @Test
  public void testParse() throws UserException {
    ApiConfiguration config = ApiConfiguration.parse(JSON);
    assertEquals(2, config.endpoints.size());
    assertEquals("/api/users", config.endpoints.get("users"));
    assertEquals(Integer.valueOf(200), config.statusCodes.get("ok"));
    assertEquals(2, config.errorTypes.size());
    assertEquals("timeout", config.errorTypes.get(0).name);
    assertNull(config.errorTypes.get(0).associatedData);
    assertEquals("statusCode: Int",
                 config.errorTypes.get(1).associatedData.get(0));
  }

  @Test
  public void testLoadFile() throws IOException, UserException {
    File f = tmp.newFile("api.json");
    FileUtils.writeStringToFile(f, JSON, StandardCharsets.UTF_8);
    ApiConfiguration config = ApiConfiguration.load(f);
    assertEquals(1, config.statusCodes.size());
  }

  @Test
  public void testMissingFile() throws UserException {
    exception.expect(UserException.class);
    exception.expectMessage("could not read configuration");
    ApiConfiguration.load(new File(tmp.getRoot(), "absent.json"));
  }

  @Test
  public void testMalformedJson() throws UserException {
    exception.expect(UserException.class);
    exception.expectMessage("malformed configuration");
    ApiConfiguration.parse("{ \"endpoints\": ");
  }

  @Test
  public void testWrongValueType() throws UserException {
    exception.expect(UserException.class);
    exception.expectMessage("malformed configuration");
    ApiConfiguration.parse("{ \"endpoints\": {}, " +
        "\"statusCodes\": { \"ok\": \"two hundred\" }, \"errorTypes\": [] }");
  }

  @Test
  public void testMissingSection() throws UserException {
    exception.expect(UserException.class);
    exception.expectMessage("missing section: errorTypes");
    ApiConfiguration.parse("{ \"endpoints\": {}, \"statusCodes\": {}, " +
                           "\"errorTypes\": null }");
  }

  @Test
  public void testInvalidCaseName() throws UserException {
    exception.expect(UserException.class);
    exception.expectMessage("invalid endpoint name: \"user-list\"");
    ApiConfiguration.parse("{ \"endpoints\": { \"user-list\": \"/u\" }, " +
        "\"statusCodes\": {}, \"errorTypes\": [] }");
  }

  @Test
  public void testKeywordCaseName() throws UserException {
    exception.expect(UserException.class);
    exception.expectMessage("status code name \"default\" is a Swift keyword");
    ApiConfiguration.parse("{ \"endpoints\": {}, " +
        "\"statusCodes\": { \"default\": 200 }, \"errorTypes\": [] }");
  }

  @Test
  public void testKeywordAssociatedLabel() throws UserException {
    exception.expect(UserException.class);
    exception.expectMessage("associated value name \"self\"");
    ApiConfiguration.parse("{ \"endpoints\": {}, \"statusCodes\": {}, " +
        "\"errorTypes\": [ { \"name\": \"failed\", " +
        "\"associatedData\": [\"self: Int\"] } ] }");
  }

  @Test
  public void testAssociatedEntry() throws UserException {
    AssociatedEntry labeled = AssociatedEntry.parse("f", "e",
                                                    " code : Int ");
    assertEquals("code", labeled.label);
    assertEquals("Int", labeled.type);
    AssociatedEntry unlabeled = AssociatedEntry.parse("f", "e", "String");
    assertNull(unlabeled.label);
    assertEquals("String", unlabeled.type);
  }

  @Test
  public void testAssociatedEntryWithoutType() {
    try {
      AssociatedEntry.parse("api.json", "httpError", "code:");
    } catch (UserException e) {
      assertTrue(e.getMessage(),
                 e.getMessage().startsWith("api.json: error type httpError"));
      return;
    }
    throw new AssertionError("expected UserException");
  }
}
