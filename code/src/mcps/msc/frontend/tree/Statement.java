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
package mcps.msc.frontend.tree;

/**
 * Base of all statements in the MCP Script AST.  Nodes are immutable;
 * consumers dispatch on kind() and downcast.
 */
public abstract class Statement {

  public static enum Kind {
    MCP_DECL,
    MODEL_DECL,
    AGENT_DECL,
    TOOL_DECL,
    ASSIGNMENT,
    EXPRESSION,
    BLOCK,
    IF,
    WHILE,
    FOR,
    BREAK,
    CONTINUE,
    RETURN,
  }

  private final Kind kind;

  protected Statement(Kind kind) {
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
