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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;

import com.google.common.base.Enums;

import mcps.msc.antlr.gen.McpsParser;

/**
 * A custom tree class for the MCP Script concrete syntax tree
 */
public class McpsAST extends CommonTree implements SyntaxNode {

  /** Node kind by token type */
  private static final NodeKind[] KINDS = new NodeKind[
                                      McpsParser.tokenNames.length];
  static {
    for (int type = 0; type < KINDS.length; type++) {
      KINDS[type] = Enums.getIfPresent(NodeKind.class,
                McpsParser.tokenNames[type]).or(NodeKind.OTHER);
    }
  }

  public McpsAST(Token t) {
    super(t);
  }

  @Override
  public NodeKind kind() {
    int type = getType();
    if (type < 0 || type >= KINDS.length) {
      return NodeKind.OTHER;
    }
    return KINDS[type];
  }

  @Override
  public String kindName() {
    int type = getType();
    if (type < 0 || type >= McpsParser.tokenNames.length) {
      return "<" + type + ">";
    }
    return McpsParser.tokenNames[type];
  }

  @Override
  public String text() {
    return getText();
  }

  /**
   * Shorter alternative to getChildCount()
   */
  @Override
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * McpsAST everywhere
   */
  @Override
  public McpsAST child(int i) {
    return (McpsAST)super.getChild(i);
  }

  @Override
  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<McpsAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  /**
   * Imaginary nodes without a source token take the position of their
   * first child
   */
  @Override
  public int line() {
    if (getLine() == 0 && childCount() > 0) {
      return child(0).line();
    }
    return getLine();
  }

  @Override
  public int column() {
    if (getLine() == 0 && childCount() > 0) {
      return child(0).column();
    }
    return getCharPositionInLine() + 1;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    writer.println("printTree:");
    printTree(writer, 0);
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.println(this.getText());
    for (int i = 0; i < this.getChildCount(); i++)
      this.child(i).printTree(writer, indent+2);
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }
}
