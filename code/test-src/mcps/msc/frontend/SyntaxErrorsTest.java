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
package mcps.msc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import mcps.msc.common.Logging;
import mcps.msc.common.exceptions.SyntaxError;

public class SyntaxErrorsTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/SyntaxErrorsTest.msc.log", true);
  }

  private static SyntaxError parseError(String source) {
    try {
      ParsedProgram.parse(source);
    } catch (SyntaxError e) {
      return e;
    }
    fail("Expected syntax error for: " + source);
    return null;
  }

  private static void checkError(String source, int line, int column,
                                 String reason) {
    SyntaxError e = parseError(source);
    assertEquals("reason for: " + source, reason, e.getReason());
    assertEquals("line for: " + source, line, e.getLine());
    assertEquals("column for: " + source, column, e.getColumn());
  }

  @Test
  public void testMessageFormat() {
    SyntaxError e = parseError("x = \"abc");
    assertEquals("Parse error at line 1, column 5: Unterminated string",
                 e.getMessage());
  }

  @Test
  public void testUnterminatedString() {
    checkError("x = 1\ny = 'abc\n\n", 2, 5, "Unterminated string");
  }

  @Test
  public void testUnexpectedCharacter() {
    checkError("x = 1 @ 2", 1, 7, "Unexpected syntax: unexpected character '@'");
  }

  @Test
  public void testMissingDeclarationName() {
    checkError("mcp { command: \"npx\" }", 1, 1,
               "Missing name for mcp declaration");
    checkError("tool (a) {}", 1, 1,
               "expected tool name before parameter list");
  }

  @Test
  public void testMissingDeclarationBody() {
    checkError("model gpt provider: \"openai\"", 1, 11,
               "Expected \"{\" to start model declaration");
  }

  @Test
  public void testMissingCondition() {
    checkError("if x > 1 { }", 1, 4,
               "Missing condition for if statement: expected \"(...)\"");
    checkError("while true { }", 1, 7,
               "Missing condition for while statement: expected \"(...)\"");
  }

  @Test
  public void testDanglingOperator() {
    checkError("x = 1 +", 1, 7, "expected value after \"+\" operator");
    checkError("x = a &&\n", 1, 7, "expected value after \"&&\" operator");
    checkError("x =", 1, 3, "expected value after \"=\" operator");
  }

  @Test
  public void testDanglingDelegation() {
    checkError("x = \"hi\" ->", 1, 10, "expected agent name after \"->\"");
  }

  @Test
  public void testDanglingDot() {
    checkError("x = a.", 1, 6, "expected property name after \".\"");
  }

  @Test
  public void testMissingType() {
    checkError("tool t(a: ) {}", 1, 9, "Missing type in type annotation");
    checkError("tool t(a: string | ) {}", 1, 18, "expected type after \"|\"");
  }

  @Test
  public void testIncompleteFor() {
    SyntaxError e = parseError("for (i = 0; i < 3 { }");
    assertEquals("Incomplete for loop", e.getReason());
  }

  @Test
  public void testMissingCloser() {
    assertEquals("Missing closing brace",
                 parseError("if (x) { y = 1").getReason());
    assertEquals("Missing closing bracket",
                 parseError("x = [1, 2").getReason());
  }

  @Test
  public void testValidInputs() throws SyntaxError {
    ParsedProgram.parse("");
    ParsedProgram.parse("// just a comment");
    ParsedProgram.parse("x = 1 // trailing\n/* block\ncomment */ y = x");
    assertTrue(true);
  }
}
