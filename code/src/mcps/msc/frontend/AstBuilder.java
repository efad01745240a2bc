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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import mcps.msc.ast.NodeKind;
import mcps.msc.ast.SyntaxNode;
import mcps.msc.common.exceptions.MscRuntimeError;
import mcps.msc.common.exceptions.SyntaxError;
import mcps.msc.frontend.tree.AgentDecl;
import mcps.msc.frontend.tree.Assignment;
import mcps.msc.frontend.tree.BinaryOp;
import mcps.msc.frontend.tree.Block;
import mcps.msc.frontend.tree.Expression;
import mcps.msc.frontend.tree.Expression.ArrayLit;
import mcps.msc.frontend.tree.Expression.Binary;
import mcps.msc.frontend.tree.Expression.BooleanLit;
import mcps.msc.frontend.tree.Expression.Call;
import mcps.msc.frontend.tree.Expression.Identifier;
import mcps.msc.frontend.tree.Expression.Index;
import mcps.msc.frontend.tree.Expression.Member;
import mcps.msc.frontend.tree.Expression.NumberLit;
import mcps.msc.frontend.tree.Expression.ObjectLit;
import mcps.msc.frontend.tree.Expression.Property;
import mcps.msc.frontend.tree.Expression.StringLit;
import mcps.msc.frontend.tree.Expression.Unary;
import mcps.msc.frontend.tree.ExpressionStmt;
import mcps.msc.frontend.tree.For;
import mcps.msc.frontend.tree.If;
import mcps.msc.frontend.tree.LoopControl;
import mcps.msc.frontend.tree.McpDecl;
import mcps.msc.frontend.tree.ModelDecl;
import mcps.msc.frontend.tree.Return;
import mcps.msc.frontend.tree.Statement;
import mcps.msc.frontend.tree.ToolDecl;
import mcps.msc.frontend.tree.ToolParameter;
import mcps.msc.frontend.tree.TypeExpr;
import mcps.msc.frontend.tree.TypeExpr.ArrayType;
import mcps.msc.frontend.tree.TypeExpr.ObjectType;
import mcps.msc.frontend.tree.TypeExpr.Primitive;
import mcps.msc.frontend.tree.TypeExpr.PrimitiveType;
import mcps.msc.frontend.tree.TypeExpr.TypeProperty;
import mcps.msc.frontend.tree.TypeExpr.UnionType;
import mcps.msc.frontend.tree.UnaryOp;
import mcps.msc.frontend.tree.While;

/**
 * Projects the concrete syntax tree onto the typed AST.  The tree shape
 * already encodes precedence, so this is a direct node-by-node mapping
 * that resolves literal values on the way.
 */
public class AstBuilder {

  /**
   * Words that can't name a binding in the generated JavaScript module
   */
  static final ImmutableSet<String> RESERVED_WORDS = ImmutableSet.of(
      "await", "break", "case", "catch", "class", "const", "continue",
      "debugger", "default", "delete", "do", "else", "enum", "export",
      "extends", "false", "finally", "for", "function", "if", "implements",
      "import", "in", "instanceof", "interface", "let", "new", "null",
      "package", "private", "protected", "public", "return", "static",
      "super", "switch", "this", "throw", "true", "try", "typeof", "var",
      "void", "while", "with", "yield", "arguments", "eval");

  /**
   * @param tree root PROGRAM node
   * @return top-level statements in source order
   * @throws SyntaxError for constructs the grammar accepts but the
   *        language does not, e.g. a nested declaration
   */
  public List<Statement> build(SyntaxNode tree) throws SyntaxError {
    if (tree.kind() != NodeKind.PROGRAM) {
      throw new MscRuntimeError("Expected PROGRAM at root but got "
                                + tree.kindName());
    }
    List<Statement> program = statements(tree.children(), true);
    LogHelper.debug(0, "Built AST with " + program.size() +
                       " top-level statements");
    return program;
  }

  private List<Statement> statements(List<? extends SyntaxNode> nodes,
                            boolean topLevel) throws SyntaxError {
    List<Statement> result = new ArrayList<Statement>(nodes.size());
    for (SyntaxNode node: nodes) {
      // Empty statement
      if (node.kind() == NodeKind.SEMI) {
        continue;
      }
      result.add(statement(node, topLevel));
    }
    return result;
  }

  private Statement statement(SyntaxNode tree, boolean topLevel)
                                                  throws SyntaxError {
    LogHelper.trace(2, "statement: " + tree.kindName());
    switch (tree.kind()) {
      case MCP:
      case MODEL:
      case AGENT:
      case TOOL:
        if (!topLevel) {
          throw error(tree, tree.text() +
                " declarations are only allowed at the top level");
        }
        return declaration(tree);
      case BLOCK:
        return block(tree);
      case IF:
        return ifStatement(tree);
      case WHILE:
        checkChildCount(tree, 2);
        return new While(expression(tree.child(0)), body(tree.child(1)));
      case FOR:
        return forStatement(tree);
      case BREAK:
        return LoopControl.BREAK;
      case CONTINUE:
        return LoopControl.CONTINUE;
      case RETURN:
        if (tree.childCount() == 0) {
          return new Return(null);
        }
        return new Return(expression(tree.child(0)));
      case ASSIGN:
        return assignment(tree);
      case SEMI:
        return new Block(new ArrayList<Statement>());
      default:
        return new ExpressionStmt(expression(tree));
    }
  }

  private Statement declaration(SyntaxNode tree) throws SyntaxError {
    String name = bindingName(tree.child(0));
    switch (tree.kind()) {
      case MCP:
        return new McpDecl(name, objectLiteral(tree.child(1)));
      case MODEL:
        return new ModelDecl(name, objectLiteral(tree.child(1)));
      case AGENT:
        return new AgentDecl(name, objectLiteral(tree.child(1)));
      case TOOL:
        return toolDeclaration(tree);
      default:
        throw new MscRuntimeError("Not a declaration: " + tree.kindName());
    }
  }

  /**
   * Children: ID, PARAMS, [RETURN_TYPE], BLOCK
   */
  private ToolDecl toolDeclaration(SyntaxNode tree) throws SyntaxError {
    String name = tree.child(0).text();
    SyntaxNode params = tree.child(1);
    List<ToolParameter> parameters = new ArrayList<ToolParameter>();
    Set<String> seen = new HashSet<String>();
    for (SyntaxNode param: params.children()) {
      ToolParameter p = parameter(param);
      if (!seen.add(p.getName())) {
        throw error(param, "Duplicate parameter \"" + p.getName() +
                           "\" in tool " + name);
      }
      parameters.add(p);
    }

    TypeExpr returnType = null;
    int pos = 2;
    if (tree.child(pos).kind() == NodeKind.RETURN_TYPE) {
      returnType = type(tree.child(pos).child(0));
      pos++;
    }
    Block body = block(tree.child(pos));
    return new ToolDecl(name, parameters, returnType, body);
  }

  /**
   * Children: ID, [QUESTION], [type]
   */
  private ToolParameter parameter(SyntaxNode tree) throws SyntaxError {
    String name = bindingName(tree.child(0));
    int pos = 1;
    boolean optional = false;
    if (pos < tree.childCount() &&
        tree.child(pos).kind() == NodeKind.QUESTION) {
      optional = true;
      pos++;
    }
    TypeExpr type = null;
    if (pos < tree.childCount()) {
      type = type(tree.child(pos));
    }
    return new ToolParameter(name, optional, type);
  }

  private Block block(SyntaxNode tree) throws SyntaxError {
    if (tree.kind() != NodeKind.BLOCK) {
      throw new MscRuntimeError("Expected BLOCK but got " + tree.kindName());
    }
    return new Block(statements(tree.children(), false));
  }

  /**
   * Body of a compound statement.  Declarations are not allowed here
   * even when the compound statement is at the top level.
   */
  private Statement body(SyntaxNode tree) throws SyntaxError {
    return statement(tree, false);
  }

  private If ifStatement(SyntaxNode tree) throws SyntaxError {
    int count = tree.childCount();
    if (count < 2 || count > 3) {
      throw new MscRuntimeError("if: child count > 3 or < 2");
    }
    Expression condition = expression(tree.child(0));
    Statement thenBranch = body(tree.child(1));
    Statement elseBranch = null;
    if (count == 3) {
      elseBranch = body(tree.child(2));
    }
    return new If(condition, thenBranch, elseBranch);
  }

  /**
   * Children: FOR_INIT, FOR_COND, FOR_UPDATE, body
   */
  private For forStatement(SyntaxNode tree) throws SyntaxError {
    checkChildCount(tree, 4);
    SyntaxNode init = tree.child(0);
    SyntaxNode cond = tree.child(1);
    SyntaxNode update = tree.child(2);

    Assignment initAssign = init.childCount() == 0 ? null :
                                  assignment(init.child(0));
    Expression condition = cond.childCount() == 0 ? null :
                                  expression(cond.child(0));
    Assignment updateAssign = update.childCount() == 0 ? null :
                                  assignment(update.child(0));
    return new For(initAssign, condition, updateAssign, body(tree.child(3)));
  }

  private Assignment assignment(SyntaxNode tree) throws SyntaxError {
    checkChildCount(tree, 2);
    Expression target = expression(tree.child(0));
    if (!Assignment.isValidTarget(target)) {
      throw error(tree.child(0), "Invalid assignment target");
    }
    if (target.kind() == Expression.Kind.IDENTIFIER) {
      bindingName(tree.child(0));
    }
    return new Assignment(target, expression(tree.child(1)));
  }

  /**
   * @param tree ID node that introduces a name
   * @return the name
   * @throws SyntaxError if the generated code couldn't bind it
   */
  private static String bindingName(SyntaxNode tree) throws SyntaxError {
    String name = tree.text();
    if (RESERVED_WORDS.contains(name)) {
      throw error(tree, "\"" + name + "\" is a reserved word and can't " +
                        "be used as a name");
    }
    return name;
  }

  public Expression expression(SyntaxNode tree) throws SyntaxError {
    switch (tree.kind()) {
      case ID:
        return new Identifier(tree.text());
      case STRING:
        return new StringLit(unescape(tree.text()));
      case NUMBER:
        return new NumberLit(parseNumber(tree));
      case TRUE:
        return new BooleanLit(true);
      case FALSE:
        return new BooleanLit(false);
      case ARRAY_LIT:
        return new ArrayLit(expressions(tree.children()));
      case OBJECT_LIT:
        return objectLiteral(tree);
      case CALL:
        checkChildCount(tree, 2);
        return new Call(expression(tree.child(0)),
                        expressions(tree.child(1).children()));
      case MEMBER:
        checkChildCount(tree, 2);
        return new Member(expression(tree.child(0)), tree.child(1).text());
      case INDEX:
        checkChildCount(tree, 2);
        return new Index(expression(tree.child(0)),
                         expression(tree.child(1)));
      case NOT:
        checkChildCount(tree, 1);
        return new Unary(UnaryOp.NOT, expression(tree.child(0)));
      case NEGATE:
        checkChildCount(tree, 1);
        return new Unary(UnaryOp.NEGATE, expression(tree.child(0)));
      case ASSIGN:
        throw error(tree, "Unexpected syntax: assignment is not an expression");
      default:
        BinaryOp op = binaryOp(tree.kind());
        if (op == null) {
          throw new MscRuntimeError("Unexpected token in expression: " +
                                    tree.kindName());
        }
        checkChildCount(tree, 2);
        return new Binary(expression(tree.child(0)), op,
                          expression(tree.child(1)));
    }
  }

  private List<Expression> expressions(List<? extends SyntaxNode> nodes)
                                                    throws SyntaxError {
    List<Expression> result = new ArrayList<Expression>(nodes.size());
    for (SyntaxNode node: nodes) {
      result.add(expression(node));
    }
    return result;
  }

  private ObjectLit objectLiteral(SyntaxNode tree) throws SyntaxError {
    if (tree.kind() != NodeKind.OBJECT_LIT) {
      throw new MscRuntimeError("Expected OBJECT_LIT but got " +
                                tree.kindName());
    }
    List<Property> properties = new ArrayList<Property>();
    for (SyntaxNode prop: tree.children()) {
      checkChildCount(prop, 2);
      SyntaxNode key = prop.child(0);
      String keyText = key.kind() == NodeKind.STRING ?
                            unescape(key.text()) : key.text();
      properties.add(new Property(keyText, expression(prop.child(1))));
    }
    return new ObjectLit(properties);
  }

  private static BinaryOp binaryOp(NodeKind kind) {
    switch (kind) {
      case ARROW: return BinaryOp.DELEGATE;
      case NULLISH: return BinaryOp.NULLISH;
      case OR: return BinaryOp.OR;
      case AND: return BinaryOp.AND;
      case EQ: return BinaryOp.EQ;
      case NEQ: return BinaryOp.NEQ;
      case LT: return BinaryOp.LT;
      case GT: return BinaryOp.GT;
      case LTE: return BinaryOp.LTE;
      case GTE: return BinaryOp.GTE;
      case PLUS: return BinaryOp.PLUS;
      case MINUS: return BinaryOp.MINUS;
      case STAR: return BinaryOp.TIMES;
      case SLASH: return BinaryOp.DIVIDE;
      case PERCENT: return BinaryOp.MOD;
      default: return null;
    }
  }

  public TypeExpr type(SyntaxNode tree) throws SyntaxError {
    switch (tree.kind()) {
      case ID: {
        PrimitiveType prim = PrimitiveType.fromName(tree.text());
        if (prim == null) {
          throw error(tree, "Unknown type \"" + tree.text() + "\"");
        }
        return new Primitive(prim);
      }
      case TYPE_ARRAY:
        checkChildCount(tree, 1);
        return new ArrayType(type(tree.child(0)));
      case TYPE_OBJECT: {
        List<TypeProperty> props = new ArrayList<TypeProperty>();
        for (SyntaxNode prop: tree.children()) {
          props.add(typeProperty(prop));
        }
        return new ObjectType(props);
      }
      case PIPE: {
        List<TypeExpr> members = new ArrayList<TypeExpr>();
        unionMembers(tree, members);
        return new UnionType(members);
      }
      default:
        throw new MscRuntimeError("Unexpected token in type: " +
                                  tree.kindName());
    }
  }

  /**
   * Children: name, [QUESTION], type
   */
  private TypeProperty typeProperty(SyntaxNode tree) throws SyntaxError {
    String name = tree.child(0).text();
    boolean optional = tree.child(1).kind() == NodeKind.QUESTION;
    SyntaxNode typeNode = tree.child(optional ? 2 : 1);
    return new TypeProperty(name, optional, type(typeNode));
  }

  /**
   * a | b | c parses as ((a | b) | c): collect the left spine into one
   * list.  A union on the right only comes from explicit parentheses and
   * is kept nested.
   */
  private void unionMembers(SyntaxNode tree, List<TypeExpr> members)
                                                    throws SyntaxError {
    SyntaxNode left = tree.child(0);
    if (left.kind() == NodeKind.PIPE) {
      unionMembers(left, members);
    } else {
      members.add(type(left));
    }
    members.add(type(tree.child(1)));
  }

  private static double parseNumber(SyntaxNode tree) throws SyntaxError {
    try {
      return Double.parseDouble(tree.text());
    } catch (NumberFormatException e) {
      throw error(tree, "Invalid number \"" + tree.text() + "\"");
    }
  }

  /**
   * Strip quotes and resolve escape sequences.  Unknown escapes are
   * left in place, backslash included.
   * @param quoted string token text including quotes
   */
  public static String unescape(String quoted) {
    String body = quoted.substring(1, quoted.length() - 1);
    StringBuilder sb = new StringBuilder(body.length());
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c != '\\' || i == body.length() - 1) {
        sb.append(c);
        continue;
      }
      char next = body.charAt(++i);
      switch (next) {
        case 'n': sb.append('\n'); break;
        case 'r': sb.append('\r'); break;
        case 't': sb.append('\t'); break;
        case 'b': sb.append('\b'); break;
        case 'f': sb.append('\f'); break;
        case '\\': sb.append('\\'); break;
        case '"': sb.append('"'); break;
        case '\'': sb.append('\''); break;
        default:
          sb.append('\\').append(next);
          break;
      }
    }
    return sb.toString();
  }

  private static void checkChildCount(SyntaxNode tree, int expected) {
    if (tree.childCount() != expected) {
      throw new MscRuntimeError(tree.kindName() + ": expected " + expected
                    + " children but got " + tree.childCount());
    }
  }

  private static SyntaxError error(SyntaxNode tree, String reason) {
    return new SyntaxError(tree.line(), tree.column(), reason);
  }
}
