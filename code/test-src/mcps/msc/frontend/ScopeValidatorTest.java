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
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.collect.ImmutableSet;

import mcps.msc.common.Logging;
import mcps.msc.common.exceptions.SyntaxError;
import mcps.msc.common.exceptions.UndefinedVariableError;
import mcps.msc.frontend.tree.Statement;

public class ScopeValidatorTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ScopeValidatorTest.msc.log", true);
  }

  private static List<Statement> build(String source) throws SyntaxError {
    return new AstBuilder().build(ParsedProgram.parse(source).ast);
  }

  private static void valid(String source) throws Exception {
    new ScopeValidator().validate(build(source));
  }

  /**
   * Check that validation fails on the given name
   */
  private static void undefined(String source, String name)
      throws Exception {
    try {
      new ScopeValidator().validate(build(source));
    } catch (UndefinedVariableError e) {
      assertEquals("Undefined name in: " + source, name, e.getName());
      assertEquals("Undefined variable: '" + name + "'", e.getMessage());
      return;
    }
    fail("Expected undefined variable " + name + " in: " + source);
  }

  @Test
  public void testUndefinedInExpression() throws Exception {
    undefined("x = undefinedVar + 5", "undefinedVar");
  }

  @Test
  public void testRuntimeGlobals() throws Exception {
    valid("print(JSON.stringify(Math.max(1, 2)))\n" +
          "log(env.HOME ?? null)\n" +
          "s = Set\n" +
          "n = parseInt(\"42\") + parseFloat(\"1.5\")");
  }

  @Test
  public void testUseBeforeAssignment() throws Exception {
    undefined("print(y)\ny = 1", "y");
    valid("y = 1\nprint(y)");
  }

  @Test
  public void testSelfReferenceInFirstAssignment() throws Exception {
    // The value is checked before the name is bound
    undefined("count = count + 1", "count");
  }

  @Test
  public void testDeclarationsAreHoisted() throws Exception {
    valid("agent helper { model: gpt, tools: [fs, greet] }\n" +
          "result = \"hi\" -> helper\n" +
          "model gpt { provider: \"openai\" }\n" +
          "mcp fs { command: \"npx\" }\n" +
          "tool greet(name) { return helper }");
  }

  @Test
  public void testForLoopVariableScope() throws Exception {
    undefined("for (i = 0; i < 10; i = i + 1) { print(i) } print(i)", "i");
  }

  @Test
  public void testBlockScope() throws Exception {
    undefined("{ z = 1 }\nprint(z)", "z");
    valid("z = 0\n{ z = 1\n  print(z) }\nprint(z)");
  }

  @Test
  public void testIfBranchScope() throws Exception {
    undefined("if (true) w = 1\nprint(w)", "w");
    undefined("if (true) { a = 1 } else { print(a) }", "a");
  }

  @Test
  public void testWhileBodyScope() throws Exception {
    undefined("while (false) { t = 1 }\nprint(t)", "t");
  }

  @Test
  public void testToolParameters() throws Exception {
    valid("tool add(a, b?: number) { sum = a + b\n return sum }");
    undefined("tool add(a) { return a + b }", "b");
  }

  @Test
  public void testToolLocalsInvisibleOutside() throws Exception {
    undefined("tool t(a) { local = a }\nprint(local)", "local");
  }

  @Test
  public void testMemberNamesNotResolved() throws Exception {
    valid("x = {}\nx.anything = x.other.deeper");
  }

  @Test
  public void testAssignmentTargetParts() throws Exception {
    undefined("items[missing] = 1", "items");
    undefined("items = []\nitems[missing] = 1", "missing");
  }

  @Test
  public void testDeclarationConfig() throws Exception {
    undefined("model m { provider: \"openai\", apiKey: secret }", "secret");
  }

  @Test
  public void testCustomGlobals() throws Exception {
    ScopeValidator validator = new ScopeValidator(
                                    ImmutableSet.of("emit"));
    validator.validate(build("emit(1)"));
    try {
      validator.validate(build("print(1)"));
      fail("print is not a global here");
    } catch (UndefinedVariableError e) {
      assertEquals("print", e.getName());
    }
  }

  @Test
  public void testValidatorIsReusable() throws Exception {
    ScopeValidator validator = new ScopeValidator();
    validator.validate(build("a = 1"));
    try {
      validator.validate(build("print(a)"));
      fail("a leaked between validations");
    } catch (UndefinedVariableError e) {
      assertEquals("a", e.getName());
    }
  }
}
