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

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import mcps.msc.common.Logging;
import mcps.msc.common.exceptions.SyntaxError;
import mcps.msc.frontend.AstBuilder;
import mcps.msc.frontend.ParsedProgram;
import mcps.msc.frontend.tree.Assignment;
import mcps.msc.frontend.tree.BinaryOp;
import mcps.msc.frontend.tree.Expression;
import mcps.msc.frontend.tree.Expression.Binary;
import mcps.msc.frontend.tree.Expression.Identifier;
import mcps.msc.frontend.tree.Expression.NumberLit;
import mcps.msc.frontend.tree.Expression.Unary;
import mcps.msc.frontend.tree.Statement;
import mcps.msc.frontend.tree.UnaryOp;

public class ExpressionEmitterTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ExpressionEmitterTest.msc.log", true);
  }

  private static Expression parse(String expr) throws SyntaxError {
    List<Statement> prog = new AstBuilder().build(
                        ParsedProgram.parse("x = " + expr).ast);
    return ((Assignment)prog.get(0)).getValue();
  }

  private static String emit(String expr) throws SyntaxError {
    return new ExpressionEmitter().emit(parse(expr));
  }

  @Test
  public void testLiterals() throws SyntaxError {
    assertEquals("\"hello\"", emit("'hello'"));
    assertEquals("\"say \\\"hi\\\"\\n\"", emit("\"say \\\"hi\\\"\\n\""));
    assertEquals("1500", emit("1.5e3"));
    assertEquals("0.5", emit(".5"));
    assertEquals("6.022e+23", emit("6.022e23"));
    assertEquals("true", emit("true"));
    assertEquals("[1, \"two\", false]", emit("[1, \"two\", false]"));
    assertEquals("[]", emit("[]"));
  }

  @Test
  public void testObjectLiterals() throws SyntaxError {
    assertEquals("{}", emit("{}"));
    assertEquals("{ a: 1, \"b c\": [2], if: null }",
                 emit("{a: 1, \"b c\": [2], if: null}"));
    assertEquals("{ outer: { inner: true } }",
                 emit("{outer: {inner: true}}"));
  }

  @Test
  public void testNullishMixedWithLogical() throws SyntaxError {
    assertEquals("a ?? (b || c)", emit("a ?? b || c"));
    assertEquals("(a || b) ?? c", emit("a || b ?? c"));
    assertEquals("(a && b) ?? c", emit("a && b ?? c"));
    assertEquals("a || (b ?? c)", emit("a || (b ?? c)"));
    assertEquals("(a ?? b) && c", emit("(a ?? b) && c"));
  }

  @Test
  public void testPrecedenceGrouping() throws SyntaxError {
    assertEquals("a + b * c", emit("a + b * c"));
    assertEquals("(a + b) * c", emit("(a + b) * c"));
    assertEquals("a - b - c", emit("a - b - c"));
    assertEquals("a - (b - c)", emit("a - (b - c)"));
    assertEquals("a / (b * c)", emit("a / (b * c)"));
    assertEquals("a && b || c && d", emit("a && b || c && d"));
    assertEquals("a && (b || c)", emit("a && (b || c)"));
    assertEquals("a < b == c > d", emit("a < b == c > d"));
    assertEquals("a == (b == c)", emit("a == (b == c)"));
    assertEquals("a ?? b ?? c", emit("a ?? b ?? c"));
  }

  @Test
  public void testUnary() throws SyntaxError {
    assertEquals("!done", emit("!done"));
    assertEquals("!(a && b)", emit("!(a && b)"));
    assertEquals("-(a + b)", emit("-(a + b)"));
    assertEquals("-(-x)", emit("-(-x)"));
    assertEquals("-x * y", emit("-x * y"));
    assertEquals("!!x", emit("!!x"));
  }

  @Test
  public void testNegativeNumberOperand() {
    Expression e = new Unary(UnaryOp.NEGATE, new NumberLit(-2.0));
    assertEquals("-(-2)", new ExpressionEmitter().emit(e));
  }

  @Test
  public void testCallsAreAwaited() throws SyntaxError {
    assertEquals("await print(x)", emit("print(x)"));
    assertEquals("await fs.read_file(\"a.txt\", 2)",
                 emit("fs.read_file(\"a.txt\", 2)"));
    assertEquals("await f()", emit("f()"));
  }

  @Test
  public void testMemberCallChain() throws SyntaxError {
    assertEquals("await text.trim().split(\" \")",
                 emit("text.trim().split(\" \")"));
    assertEquals("await a.b(1).c(2).d(3)", emit("a.b(1).c(2).d(3)"));
  }

  @Test
  public void testAwaitedCallAsOperand() throws SyntaxError {
    assertEquals("(await f()).length", emit("f().length"));
    assertEquals("(await items.get(0))[1]", emit("items.get(0)[1]"));
    assertEquals("await (await make())(1)", emit("make()(1)"));
    assertEquals("await f() + await g()", emit("f() + g()"));
    assertEquals("!await ok()", emit("!ok()"));
  }

  @Test
  public void testGroupedObjects() throws SyntaxError {
    assertEquals("(a + b).length", emit("(a + b).length"));
    assertEquals("(-x).y", emit("(-x).y"));
    assertEquals("(1).toString", emit("(1).toString"));
    assertEquals("[1, 2][0]", emit("[1, 2][0]"));
    assertEquals("{ a: 1 }.a", emit("{a: 1}.a"));
  }

  @Test
  public void testDelegation() throws SyntaxError {
    assertEquals("await helper.run(\"hi\")", emit("\"hi\" -> helper"));
    assertEquals("await team.writer.run(draft)", emit("draft -> team.writer"));
    assertEquals("await helper.run(\"a\" + b)", emit("\"a\" + b -> helper"));
    assertEquals("await second.run(await first.run(p))",
                 emit("p -> first -> second"));
    assertEquals("await (await pick(k)).run(p)", emit("p -> pick(k)"));
    assertEquals("await (agents[i]).run(p)", emit("p -> agents[i]"));
  }

  @Test
  public void testDelegationAsOperand() throws SyntaxError {
    assertEquals("(await helper.run(q)) ?? \"none\"",
                 emit("(q -> helper) ?? \"none\""));
    Expression e = new Binary(new Identifier("x"), BinaryOp.PLUS,
                     new Binary(new Identifier("p"), BinaryOp.DELEGATE,
                                new Identifier("a")));
    assertEquals("x + (await a.run(p))", new ExpressionEmitter().emit(e));
  }

  @Test
  public void testRoundTripKeepsGrouping() throws SyntaxError {
    List<String> sources = Arrays.asList(
        "a ?? b || c",
        "(a ?? b) || c",
        "a - (b - (c - d))",
        "((a - b) - c) - d",
        "-(a * (b + c)) % d",
        "!(a == b) && (c != d || e <= f)",
        "x.y[z + 1].w",
        "{k: [1, 2.5, -3], \"odd key\": 'v'}",
        "(a + b) * (c - d) / e");
    for (String source: sources) {
      Expression original = parse(source);
      String emitted = new ExpressionEmitter().emit(original);
      Expression reparsed = parse(emitted);
      assertEquals("Round trip of " + source + " via " + emitted,
                   original.toString(), reparsed.toString());
    }
  }
}
