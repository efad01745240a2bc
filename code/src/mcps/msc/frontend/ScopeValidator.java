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

import java.util.List;

import com.google.common.collect.ImmutableSet;

import mcps.msc.common.exceptions.MscRuntimeError;
import mcps.msc.common.exceptions.UndefinedVariableError;
import mcps.msc.frontend.tree.Assignment;
import mcps.msc.frontend.tree.Block;
import mcps.msc.frontend.tree.EntityDecl;
import mcps.msc.frontend.tree.Expression;
import mcps.msc.frontend.tree.Expression.ArrayLit;
import mcps.msc.frontend.tree.Expression.Binary;
import mcps.msc.frontend.tree.Expression.Call;
import mcps.msc.frontend.tree.Expression.Identifier;
import mcps.msc.frontend.tree.Expression.Index;
import mcps.msc.frontend.tree.Expression.Member;
import mcps.msc.frontend.tree.Expression.ObjectLit;
import mcps.msc.frontend.tree.Expression.Property;
import mcps.msc.frontend.tree.Expression.Unary;
import mcps.msc.frontend.tree.ExpressionStmt;
import mcps.msc.frontend.tree.For;
import mcps.msc.frontend.tree.If;
import mcps.msc.frontend.tree.Return;
import mcps.msc.frontend.tree.Statement;
import mcps.msc.frontend.tree.ToolDecl;
import mcps.msc.frontend.tree.ToolParameter;
import mcps.msc.frontend.tree.While;

/**
 * Checks that every identifier a program reads is bound: by an entity
 * declaration anywhere at the top level, by an earlier assignment in an
 * enclosing scope, by a tool parameter, or by the runtime.
 *
 * Stops at the first unbound name.  A validator holds no state between
 * calls to validate() and may be reused.
 */
public class ScopeValidator {

  private final ImmutableSet<String> globals;

  public ScopeValidator() {
    this(RuntimeGlobals.ALLOWED);
  }

  public ScopeValidator(ImmutableSet<String> globals) {
    this.globals = globals;
  }

  public void validate(List<Statement> program)
                              throws UndefinedVariableError {
    ValidationScope scope = new ValidationScope(globals);

    // Entity declarations are visible everywhere, including before
    // and inside each other
    for (Statement stmt: program) {
      String name = declaredName(stmt);
      if (name != null) {
        LogHelper.trace(2, "hoisting " + name);
        scope.declare(name);
      }
    }

    for (Statement stmt: program) {
      statement(scope, stmt);
    }
    LogHelper.debug(0, "Scope validation passed");
  }

  private static String declaredName(Statement stmt) {
    switch (stmt.kind()) {
      case MCP_DECL:
      case MODEL_DECL:
      case AGENT_DECL:
        return ((EntityDecl)stmt).getName();
      case TOOL_DECL:
        return ((ToolDecl)stmt).getName();
      default:
        return null;
    }
  }

  private void statement(ValidationScope scope, Statement stmt)
                                    throws UndefinedVariableError {
    switch (stmt.kind()) {
      case MCP_DECL:
      case MODEL_DECL:
      case AGENT_DECL:
        expression(scope, ((EntityDecl)stmt).getConfig());
        break;
      case TOOL_DECL:
        toolDeclaration(scope, (ToolDecl)stmt);
        break;
      case ASSIGNMENT:
        assignment(scope, (Assignment)stmt);
        break;
      case EXPRESSION:
        expression(scope, ((ExpressionStmt)stmt).getExpression());
        break;
      case BLOCK:
        scope.push();
        statements(scope, ((Block)stmt).getStatements());
        scope.pop();
        break;
      case IF: {
        If ifStmt = (If)stmt;
        expression(scope, ifStmt.getCondition());
        branch(scope, ifStmt.getThenBranch());
        if (ifStmt.hasElse()) {
          branch(scope, ifStmt.getElseBranch());
        }
        break;
      }
      case WHILE: {
        While loop = (While)stmt;
        expression(scope, loop.getCondition());
        branch(scope, loop.getBody());
        break;
      }
      case FOR:
        forLoop(scope, (For)stmt);
        break;
      case BREAK:
      case CONTINUE:
        break;
      case RETURN: {
        Return ret = (Return)stmt;
        if (ret.hasValue()) {
          expression(scope, ret.getValue());
        }
        break;
      }
      default:
        throw new MscRuntimeError("Unexpected statement kind: " + stmt.kind());
    }
  }

  private void statements(ValidationScope scope, List<Statement> stmts)
                                    throws UndefinedVariableError {
    for (Statement stmt: stmts) {
      statement(scope, stmt);
    }
  }

  /**
   * A block branch opens its own scope; anything else gets one here
   */
  private void branch(ValidationScope scope, Statement stmt)
                                    throws UndefinedVariableError {
    if (stmt.kind() == Statement.Kind.BLOCK) {
      statement(scope, stmt);
    } else {
      scope.push();
      statement(scope, stmt);
      scope.pop();
    }
  }

  private void toolDeclaration(ValidationScope scope, ToolDecl tool)
                                    throws UndefinedVariableError {
    scope.push();
    for (ToolParameter param: tool.getParameters()) {
      scope.declare(param.getName());
    }
    statements(scope, tool.getBody().getStatements());
    scope.pop();
  }

  /**
   * The loop variable lives in a scope that ends with the loop
   */
  private void forLoop(ValidationScope scope, For loop)
                                    throws UndefinedVariableError {
    scope.push();
    if (loop.getInit() != null) {
      assignment(scope, loop.getInit());
    }
    if (loop.getCondition() != null) {
      expression(scope, loop.getCondition());
    }
    if (loop.getUpdate() != null) {
      assignment(scope, loop.getUpdate());
    }
    statement(scope, loop.getBody());
    scope.pop();
  }

  private void assignment(ValidationScope scope, Assignment assign)
                                    throws UndefinedVariableError {
    expression(scope, assign.getValue());
    Expression target = assign.getTarget();
    switch (target.kind()) {
      case IDENTIFIER:
        scope.declare(((Identifier)target).getName());
        break;
      case MEMBER:
        expression(scope, ((Member)target).getObject());
        break;
      case INDEX:
        expression(scope, ((Index)target).getObject());
        expression(scope, ((Index)target).getIndex());
        break;
      default:
        throw new MscRuntimeError("Invalid assignment target: " + target);
    }
  }

  private void expression(ValidationScope scope, Expression expr)
                                    throws UndefinedVariableError {
    switch (expr.kind()) {
      case IDENTIFIER: {
        String name = ((Identifier)expr).getName();
        if (!scope.isDefined(name)) {
          LogHelper.debug(0, "Undefined variable " + name + " at depth "
                             + scope.depth());
          throw new UndefinedVariableError(name);
        }
        break;
      }
      case STRING:
      case NUMBER:
      case BOOLEAN:
        break;
      case ARRAY:
        for (Expression elem: ((ArrayLit)expr).getElements()) {
          expression(scope, elem);
        }
        break;
      case OBJECT:
        for (Property prop: ((ObjectLit)expr).getProperties()) {
          expression(scope, prop.getValue());
        }
        break;
      case CALL: {
        Call call = (Call)expr;
        expression(scope, call.getCallee());
        for (Expression arg: call.getArgs()) {
          expression(scope, arg);
        }
        break;
      }
      case MEMBER:
        // Property names are not bindings
        expression(scope, ((Member)expr).getObject());
        break;
      case INDEX:
        expression(scope, ((Index)expr).getObject());
        expression(scope, ((Index)expr).getIndex());
        break;
      case BINARY:
        expression(scope, ((Binary)expr).getLeft());
        expression(scope, ((Binary)expr).getRight());
        break;
      case UNARY:
        expression(scope, ((Unary)expr).getOperand());
        break;
      default:
        throw new MscRuntimeError("Unexpected expression kind: " + expr.kind());
    }
  }
}
