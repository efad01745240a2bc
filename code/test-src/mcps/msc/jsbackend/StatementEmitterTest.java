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
package mcps.msc.jsbackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import mcps.msc.common.Logging;
import mcps.msc.common.exceptions.MscRuntimeError;
import mcps.msc.common.exceptions.SyntaxError;
import mcps.msc.frontend.AstBuilder;
import mcps.msc.frontend.ParsedProgram;
import mcps.msc.frontend.tree.Expression;
import mcps.msc.frontend.tree.Expression.Identifier;
import mcps.msc.frontend.tree.Expression.NumberLit;
import mcps.msc.frontend.tree.Expression.ObjectLit;
import mcps.msc.frontend.tree.Expression.Property;
import mcps.msc.frontend.tree.ExpressionStmt;
import mcps.msc.frontend.tree.Return;
import mcps.msc.frontend.tree.Statement;

public class StatementEmitterTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/StatementEmitterTest.msc.log", true);
  }

  private static String emit(String source) throws SyntaxError {
    List<Statement> prog = new AstBuilder().build(
                              ParsedProgram.parse(source).ast);
    return newEmitter().emitStatements(prog).toString();
  }

  private static StatementEmitter newEmitter() {
    return new StatementEmitter(new ExpressionEmitter());
  }

  @Test
  public void testFirstAssignmentDeclares() throws SyntaxError {
    assertEquals("let x = 1;\nx = 2;\n", emit("x = 1\nx = 2"));
    assertEquals("let x = 1;\nlet y = x;\n", emit("x = 1; y = x"));
  }

  @Test
  public void testMemberAndIndexTargets() throws SyntaxError {
    assertEquals("let obj = {};\nobj.name = \"n\";\nobj[\"k\"] = 2;\n",
                 emit("obj = {}\nobj.name = 'n'\nobj['k'] = 2"));
  }

  @Test
  public void testExpressionStatements() throws SyntaxError {
    assertEquals("await print(\"hi\");\nawait bot.run(q);\n",
                 emit("print(\"hi\")\nq -> bot"));
  }

  @Test
  public void testObjectStatementGrouped() {
    Statement stmt = new ExpressionStmt(new ObjectLit(Arrays.asList(
                        new Property("a", new NumberLit(1.0)))));
    assertEquals("({ a: 1 });\n", newEmitter().emitStatement(stmt).toString());
  }

  @Test
  public void testLeadingObjectLiteralGrouped() throws SyntaxError {
    assertEquals("({ a: 1 }.x);\n", emit("({a: 1}).x;"));
    assertEquals("({ a: 1 }[\"a\"]) = 2;\n", emit("({a: 1})[\"a\"] = 2;"));
    assertEquals("({ a: 1 } == 1);\n", emit("({a: 1}) == 1;"));
    // Only a leading brace needs grouping
    assertEquals("let o = { a: 1 };\n", emit("o = {a: 1}"));
  }

  @Test
  public void testSiblingBranchesDeclareSeparately() throws SyntaxError {
    assertEquals("if (c) {\n" +
                 "  let y = 1;\n" +
                 "} else {\n" +
                 "  let y = 2;\n" +
                 "}\n",
                 emit("if (c) { y = 1 } else { y = 2 }"));
  }

  @Test
  public void testOuterVariableReassigned() throws SyntaxError {
    assertEquals("let a = 0;\n" +
                 "if (a) {\n" +
                 "  a = 1;\n" +
                 "}\n",
                 emit("a = 0\nif (a) { a = 1 }"));
  }

  @Test
  public void testBlockLocalRedeclaredOutside() throws SyntaxError {
    assertEquals("{\n" +
                 "  let a = 1;\n" +
                 "}\n" +
                 "let a = 2;\n",
                 emit("{ a = 1 }\na = 2"));
  }

  @Test
  public void testSingleStatementBodies() throws SyntaxError {
    assertEquals("if (ok) {\n" +
                 "  let b = 1;\n" +
                 "} else {\n" +
                 "  let b = 2;\n" +
                 "}\n",
                 emit("if (ok) b = 1 else b = 2"));
    assertEquals("while (n) {\n" +
                 "  n = n - 1;\n" +
                 "}\n",
                 emit("n = 3\nwhile (n) n = n - 1").substring(
                                                  "let n = 3;\n".length()));
  }

  @Test
  public void testNestedIndentation() throws SyntaxError {
    assertEquals("while (go) {\n" +
                 "  if (x > 1) {\n" +
                 "    break;\n" +
                 "  } else {\n" +
                 "    continue;\n" +
                 "  }\n" +
                 "}\n",
                 emit("while (go) { if (x > 1) { break } else { continue } }"));
  }

  @Test
  public void testEmptyBodies() throws SyntaxError {
    assertEquals("while (x) {}\n", emit("while (x) {}"));
    assertEquals("{}\n", emit("{}"));
    assertEquals("if (x) {} else {}\n", emit("if (x) {} else {}"));
  }

  @Test
  public void testForLoop() throws SyntaxError {
    assertEquals("for (let i = 0; i < 3; i = i + 1) {\n" +
                 "  let total = i;\n" +
                 "}\n",
                 emit("for (i = 0; i < 3; i = i + 1) { total = i }"));
  }

  @Test
  public void testForHeaderScope() throws SyntaxError {
    assertEquals("for (let i = 0; i < 2; i = i + 1) {}\n" +
                 "let i = 5;\n",
                 emit("for (i = 0; i < 2; i = i + 1) {}\ni = 5"));
    assertEquals("let i = 0;\n" +
                 "for (i = 1; i < 2; i = i + 1) {}\n",
                 emit("i = 0\nfor (i = 1; i < 2; i = i + 1) {}"));
  }

  @Test
  public void testForUpdateNeverDeclares() throws SyntaxError {
    assertEquals("for (; k; k = k - 1) {}\n",
                 emit("for (; k; k = k - 1) {}"));
  }

  @Test
  public void testEmptyForHeader() throws SyntaxError {
    assertEquals("for (;;) {\n" +
                 "  break;\n" +
                 "}\n",
                 emit("for (;;) { break }"));
  }

  @Test
  public void testReturn() {
    StatementEmitter emitter = newEmitter();
    assertEquals("return x;\n",
        emitter.emitStatement(new Return(new Identifier("x"))).toString());
    assertEquals("return;\n",
        emitter.emitStatement(new Return(null)).toString());
  }

  @Test
  public void testDeclaredNamesAreReassigned() throws SyntaxError {
    List<Statement> prog = new AstBuilder().build(
                              ParsedProgram.parse("text = 'a'").ast);
    StatementEmitter emitter = newEmitter();
    emitter.pushScope();
    emitter.declare("text");
    assertTrue(emitter.isDeclared("text"));
    assertEquals("text = \"a\";\n",
                 emitter.emitStatements(prog).toString());
    emitter.popScope();
    assertFalse(emitter.isDeclared("text"));
  }

  @Test(expected=MscRuntimeError.class)
  public void testPopRootScope() {
    newEmitter().popScope();
  }

  @Test(expected=MscRuntimeError.class)
  public void testDeclarationRejected() throws SyntaxError {
    List<Statement> prog = new AstBuilder().build(
            ParsedProgram.parse("model m { provider: 'openai' }").ast);
    newEmitter().emitStatement(prog.get(0));
  }

  @Test
  public void testExpressionValueOnly() {
    Expression e = new Identifier("done");
    assertEquals("done;\n",
        newEmitter().emitStatement(new ExpressionStmt(e)).toString());
  }
}
