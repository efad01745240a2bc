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

/**
 * Kinds of syntax tree node the AST builder distinguishes.  Each
 * constant is named after the parser token it stands for; tokens that
 * never need telling apart map to OTHER.
 */
public enum NodeKind {
  // Structure
  PROGRAM, BLOCK, PARAMS, PARAM, RETURN_TYPE,
  FOR_INIT, FOR_COND, FOR_UPDATE,
  ARGS, PROPERTY, SEMI,

  // Statements
  MCP, MODEL, AGENT, TOOL,
  IF, WHILE, FOR, BREAK, CONTINUE, RETURN, ASSIGN,

  // Expressions
  ID, STRING, NUMBER, TRUE, FALSE,
  ARRAY_LIT, OBJECT_LIT, CALL, MEMBER, INDEX,
  ARROW, NULLISH, OR, AND,
  EQ, NEQ, LT, GT, LTE, GTE,
  PLUS, MINUS, STAR, SLASH, PERCENT,
  NOT, NEGATE,

  // Types
  PIPE, QUESTION, TYPE_ARRAY, TYPE_OBJECT, TYPE_PROPERTY,

  OTHER;
}
