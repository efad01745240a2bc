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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import mcps.msc.common.Logging;
import mcps.msc.common.exceptions.SyntaxError;
import mcps.msc.frontend.tree.Assignment;
import mcps.msc.frontend.tree.BinaryOp;
import mcps.msc.frontend.tree.Block;
import mcps.msc.frontend.tree.Expression;
import mcps.msc.frontend.tree.Expression.Binary;
import mcps.msc.frontend.tree.Expression.NumberLit;
import mcps.msc.frontend.tree.Expression.StringLit;
import mcps.msc.frontend.tree.For;
import mcps.msc.frontend.tree.If;
import mcps.msc.frontend.tree.McpDecl;
import mcps.msc.frontend.tree.Statement;
import mcps.msc.frontend.tree.ToolDecl;
import mcps.msc.frontend.tree.ToolParameter;
import mcps.msc.frontend.tree.TypeExpr;
import mcps.msc.frontend.tree.TypeExpr.UnionType;

public class AstBuilderTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/AstBuilderTest.msc.log", true);
  }

  private static List<Statement> build(String source) throws SyntaxError {
    return new AstBuilder().build(ParsedProgram.parse(source).ast);
  }

  /**
   * @return value assigned by the single statement x = expr
   */
  private static Expression value(String expr) throws SyntaxError {
    List<Statement> prog = build("x = " + expr);
    assertEquals(1, prog.size());
    return ((Assignment)prog.get(0)).getValue();
  }

  @Test
  public void testEmptyPrograms() throws SyntaxError {
    assertTrue(build("").isEmpty());
    assertTrue(build("  \n\t\n").isEmpty());
    assertTrue(build("// nothing\n/* at\n all */").isEmpty());
    assertTrue("Empty statements are dropped", build(";;").isEmpty());
  }

  @Test
  public void testNumbers() throws SyntaxError {
    assertEquals(42.0, ((NumberLit)value("42")).getValue(), 0.0);
    assertEquals(3.25, ((NumberLit)value("3.25")).getValue(), 0.0);
    assertEquals(0.5, ((NumberLit)value(".5")).getValue(), 0.0);
    assertEquals(1500.0, ((NumberLit)value("1.5e3")).getValue(), 0.0);
    assertEquals(6.022e23, ((NumberLit)value("6.022E23")).getValue(), 0.0);
    assertEquals(4.56e-7, ((NumberLit)value("4.56e-7")).getValue(), 0.0);
  }

  @Test
  public void testStringEscapes() throws SyntaxError {
    assertEquals("a\nb\tc", ((StringLit)value("\"a\\nb\\tc\"")).getValue());
    assertEquals("say \"hi\"",
                 ((StringLit)value("\"say \\\"hi\\\"\"")).getValue());
    assertEquals("it's", ((StringLit)value("'it\\'s'")).getValue());
    assertEquals("back\\slash",
                 ((StringLit)value("\"back\\\\slash\"")).getValue());
    // Escaped backslash followed by n is not a newline
    assertEquals("\\n", ((StringLit)value("\"\\\\n\"")).getValue());
    assertEquals("Unknown escapes are kept", "\\q",
                 ((StringLit)value("\"\\q\"")).getValue());
  }

  @Test
  public void testPrecedence() throws SyntaxError {
    assertEquals("(a + (b * c))", value("a + b * c").toString());
    assertEquals("((a - b) - c)", value("a - b - c").toString());
    assertEquals("(a ?? (b || c))", value("a ?? b || c").toString());
    assertEquals("((a || b) ?? c)", value("a || b ?? c").toString());
    assertEquals("((a && b) || c)", value("a && b || c").toString());
    assertEquals("((a < b) == c)", value("a < b == c").toString());
    assertEquals("((p + q) -> agent)", value("p + q -> agent").toString());
    assertEquals("((!a) && (-b))", value("!a && -b").toString());
  }

  @Test
  public void testPostfix() throws SyntaxError {
    assertEquals("fs.read('a.txt')", value("fs.read('a.txt')").toString());
    assertEquals("a.b(x).c[i]", value("a.b(x).c[i]").toString());
    assertEquals("Keywords are valid member names",
                 "x.if.return", value("x.if.return").toString());
  }

  @Test
  public void testLiterals() throws SyntaxError {
    assertEquals("[1.0, 'two', true]", value("[1, 'two', true,]").toString());
    assertEquals("{a: 1.0, b c: false}",
                 value("{a: 1, \"b c\": false}").toString());
    assertEquals("{}", value("{}").toString());
  }

  @Test
  public void testDelegationIsBinary() throws SyntaxError {
    Binary b = (Binary)value("\"hi\" -> helper");
    assertEquals(BinaryOp.DELEGATE, b.getOp());
    assertEquals(Expression.Kind.STRING, b.getLeft().kind());
  }

  @Test
  public void testMcpDeclaration() throws SyntaxError {
    List<Statement> prog = build(
        "mcp fs { command: \"npx\", args: [\"server\"] }");
    McpDecl decl = (McpDecl)prog.get(0);
    assertEquals("fs", decl.getName());
    assertEquals("mcp", decl.keyword());
    assertEquals(2, decl.getConfig().getProperties().size());
    assertEquals(Expression.Kind.ARRAY, decl.getConfig().get("args").kind());
  }

  @Test
  public void testToolDeclaration() throws SyntaxError {
    List<Statement> prog = build(
        "tool greet(name: string, title?: string, extra,): string {\n" +
        "  return \"Hello \" + name\n" +
        "}");
    ToolDecl tool = (ToolDecl)prog.get(0);
    assertEquals("greet", tool.getName());
    assertEquals(3, tool.getParameters().size());

    ToolParameter title = tool.getParameters().get(1);
    assertEquals("title", title.getName());
    assertTrue(title.isOptional());
    assertEquals("string", title.getType().toString());

    ToolParameter extra = tool.getParameters().get(2);
    assertFalse(extra.isOptional());
    assertFalse(extra.hasType());

    assertEquals("string", tool.getReturnType().toString());
    assertEquals(1, tool.getBody().getStatements().size());
  }

  @Test
  public void testTypes() throws SyntaxError {
    ToolDecl tool = (ToolDecl)build(
        "tool t(a: string[][], b: {name: string, age?: number}, " +
        "c: string | number | null) {}").get(0);
    assertEquals("string[][]",
                 tool.getParameters().get(0).getType().toString());
    assertEquals("{name: string, age?: number}",
                 tool.getParameters().get(1).getType().toString());

    TypeExpr c = tool.getParameters().get(2).getType();
    assertEquals(TypeExpr.Kind.UNION, c.kind());
    assertEquals("Left-nested unions are flattened", 3,
                 ((UnionType)c).getTypes().size());
  }

  @Test
  public void testParenthesizedUnionStaysNested() throws SyntaxError {
    ToolDecl tool = (ToolDecl)build(
        "tool t(a: string | (number | boolean)) {}").get(0);
    UnionType u = (UnionType)tool.getParameters().get(0).getType();
    assertEquals(2, u.getTypes().size());
    assertEquals(TypeExpr.Kind.UNION, u.getTypes().get(1).kind());
  }

  @Test
  public void testUnknownType() throws SyntaxError {
    exception.expect(SyntaxError.class);
    exception.expectMessage("Unknown type \"strin\"");
    build("tool t(a: strin) {}");
  }

  @Test
  public void testControlFlow() throws SyntaxError {
    List<Statement> prog = build(
        "if (a) b = 1 else { b = 2 }\n" +
        "while (true) { break }\n" +
        "for (;;) continue\n" +
        "for (i = 0; i < 3; i = i + 1) ;");
    assertEquals(4, prog.size());

    If ifStmt = (If)prog.get(0);
    assertTrue(ifStmt.hasElse());
    assertEquals(Statement.Kind.ASSIGNMENT, ifStmt.getThenBranch().kind());
    assertEquals(Statement.Kind.BLOCK, ifStmt.getElseBranch().kind());

    assertEquals(Statement.Kind.WHILE, prog.get(1).kind());

    For forever = (For)prog.get(2);
    assertNull(forever.getInit());
    assertNull(forever.getCondition());
    assertNull(forever.getUpdate());
    assertEquals(Statement.Kind.CONTINUE, forever.getBody().kind());

    For counted = (For)prog.get(3);
    assertEquals("i", counted.getInit().getVariableName());
    assertEquals("(i < 3.0)", counted.getCondition().toString());
    assertEquals("An empty body is an empty block", 0,
                 ((Block)counted.getBody()).getStatements().size());
  }

  @Test
  public void testAssignmentTargets() throws SyntaxError {
    List<Statement> prog = build("a.b = 1\nc[0] = 2");
    assertNull(((Assignment)prog.get(0)).getVariableName());
    assertEquals(Expression.Kind.INDEX,
                 ((Assignment)prog.get(1)).getTarget().kind());
  }

  @Test
  public void testInvalidAssignmentTarget() throws SyntaxError {
    exception.expect(SyntaxError.class);
    exception.expectMessage("Invalid assignment target");
    build("f() = 1");
  }

  @Test
  public void testNestedDeclaration() throws SyntaxError {
    exception.expect(SyntaxError.class);
    exception.expectMessage(
        "Parse error at line 2, column 3: " +
        "model declarations are only allowed at the top level");
    build("if (x) {\n  model m { provider: \"openai\" }\n}");
  }

  @Test
  public void testDeclarationInTopLevelBody() throws SyntaxError {
    exception.expect(SyntaxError.class);
    exception.expectMessage("tool declarations are only allowed at the top level");
    build("while (x) tool t() {}");
  }

  @Test
  public void testDuplicateParameter() throws SyntaxError {
    exception.expect(SyntaxError.class);
    exception.expectMessage("Parse error at line 1, column 11: " +
                            "Duplicate parameter \"a\" in tool t");
    build("tool t(a, a) {}");
  }

  @Test
  public void testReservedWordAssigned() throws SyntaxError {
    exception.expect(SyntaxError.class);
    exception.expectMessage("Parse error at line 1, column 1: " +
        "\"var\" is a reserved word and can't be used as a name");
    build("var = 5");
  }

  @Test
  public void testReservedWordParameter() throws SyntaxError {
    exception.expect(SyntaxError.class);
    exception.expectMessage(
        "\"class\" is a reserved word and can't be used as a name");
    build("tool t(class: string) {}");
  }

  @Test
  public void testReservedWordDeclaration() throws SyntaxError {
    exception.expect(SyntaxError.class);
    exception.expectMessage(
        "\"new\" is a reserved word and can't be used as a name");
    build("model new { provider: \"openai\" }");
  }

  @Test
  public void testReservedWordAsMemberName() throws SyntaxError {
    List<Statement> prog = build("o = {}\no.new = 1\nx = { class: 2 }");
    assertEquals(3, prog.size());
  }
}
