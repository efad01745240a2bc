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
package mcps.msc.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import mcps.msc.antlr.gen.McpsParser;
import mcps.msc.common.Logging;
import mcps.msc.frontend.ParsedProgram;

public class McpsASTTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/McpsASTTest.msc.log", true);
  }

  @Test
  public void testKindsOfAssignment() throws Exception {
    McpsAST tree = ParsedProgram.parse("x = 1").ast;
    assertEquals(NodeKind.PROGRAM, tree.kind());
    assertEquals(1, tree.childCount());

    McpsAST assign = tree.child(0);
    assertEquals(NodeKind.ASSIGN, assign.kind());
    assertEquals("ASSIGN", assign.kindName());
    assertEquals(NodeKind.ID, assign.child(0).kind());
    assertEquals(NodeKind.NUMBER, assign.child(1).kind());
  }

  @Test
  public void testKindsOfDeclaration() throws Exception {
    McpsAST tool = ParsedProgram.parse("tool t(a) { }").ast.child(0);
    assertEquals(NodeKind.TOOL, tool.kind());
    assertEquals(NodeKind.ID, tool.child(0).kind());
    assertEquals(NodeKind.PARAMS, tool.child(1).kind());
  }

  @Test
  public void testEveryKindIsAToken() {
    List<String> tokens = Arrays.asList(McpsParser.tokenNames);
    for (NodeKind kind: NodeKind.values()) {
      if (kind != NodeKind.OTHER) {
        assertTrue("No token for " + kind, tokens.contains(kind.name()));
      }
    }
  }
}
