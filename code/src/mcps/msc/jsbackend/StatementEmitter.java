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

import java.util.List;

import org.apache.log4j.Logger;

import mcps.msc.common.Logging;
import mcps.msc.common.exceptions.MscRuntimeError;
import mcps.msc.frontend.tree.Assignment;
import mcps.msc.frontend.tree.Block;
import mcps.msc.frontend.tree.ExpressionStmt;
import mcps.msc.frontend.tree.For;
import mcps.msc.frontend.tree.LoopControl;
import mcps.msc.frontend.tree.Return;
import mcps.msc.frontend.tree.Statement;
import mcps.msc.frontend.tree.While;
import mcps.msc.jsbackend.tree.BlockStatement;
import mcps.msc.jsbackend.tree.ForLoop;
import mcps.msc.jsbackend.tree.If;
import mcps.msc.jsbackend.tree.JsTree;
import mcps.msc.jsbackend.tree.Line;
import mcps.msc.jsbackend.tree.Sequence;
import mcps.msc.jsbackend.tree.WhileLoop;

/**
 * Emits statements, deciding for each assignment whether it declares a
 * new local with let or reassigns one declared in an enclosing block.
 */
public class StatementEmitter {

  private static final Logger logger = Logging.getMscLogger();

  private final ExpressionEmitter exprs;

  private EmitScope scope = new EmitScope();

  public StatementEmitter(ExpressionEmitter exprs) {
    this.exprs = exprs;
  }

  public void pushScope() {
    scope = scope.makeChild();
  }

  public void popScope() {
    EmitScope parent = scope.getParent();
    if (parent == null) {
      throw new MscRuntimeError("Popped outermost emission scope");
    }
    scope = parent;
  }

  /**
   * Record a name declared by surrounding code, e.g. a tool parameter
   */
  public void declare(String name) {
    scope.declare(name);
  }

  public boolean isDeclared(String name) {
    return scope.isDeclared(name);
  }

  /**
   * Emit statements in the current scope
   */
  public Sequence emitStatements(List<Statement> stmts) {
    Sequence seq = new Sequence();
    for (Statement stmt: stmts) {
      seq.add(emitStatement(stmt));
    }
    return seq;
  }

  public JsTree emitStatement(Statement stmt) {
    switch (stmt.kind()) {
      case ASSIGNMENT:
        return new Line(assignment((Assignment)stmt, true) + ";");
      case EXPRESSION:
        return new Line(expressionStatement((ExpressionStmt)stmt) + ";");
      case BLOCK:
        return new BlockStatement(block((Block)stmt));
      case IF:
        return ifStatement((mcps.msc.frontend.tree.If)stmt);
      case WHILE:
        return whileLoop((While)stmt);
      case FOR:
        return forLoop((For)stmt);
      case BREAK:
      case CONTINUE:
        return new Line(((LoopControl)stmt).keyword() + ";");
      case RETURN:
        return returnStatement((Return)stmt);
      default:
        throw new MscRuntimeError("Statement can't be emitted here: " +
                                  stmt.kind());
    }
  }

  /**
   * @param allowDeclare if false, never introduce a let declaration
   * @return assignment without the trailing semicolon
   */
  private String assignment(Assignment assign, boolean allowDeclare) {
    String value = exprs.emit(assign.getValue());
    String var = assign.getVariableName();
    if (var == null) {
      return groupLeadingBrace(exprs.emit(assign.getTarget())) + " = " +
             value;
    }
    if (!allowDeclare || scope.isDeclared(var)) {
      return var + " = " + value;
    }
    scope.declare(var);
    if (logger.isTraceEnabled()) {
      logger.trace("Declared " + var);
    }
    return "let " + var + " = " + value;
  }

  private String expressionStatement(ExpressionStmt stmt) {
    return groupLeadingBrace(exprs.emit(stmt.getExpression()));
  }

  /**
   * A statement starting with { would be read as a block, e.g. when an
   * object literal is the leftmost operand
   */
  private static String groupLeadingBrace(String code) {
    if (code.startsWith("{")) {
      return "(" + code + ")";
    }
    return code;
  }

  /**
   * Emit block contents in a new scope
   */
  private Sequence block(Block block) {
    pushScope();
    try {
      return emitStatements(block.getStatements());
    } finally {
      popScope();
    }
  }

  /**
   * Emit a branch or loop body.  A single statement is wrapped into
   * a block with its own scope.
   */
  private Sequence body(Statement stmt) {
    if (stmt.kind() == Statement.Kind.BLOCK) {
      return block((Block)stmt);
    }
    pushScope();
    try {
      Sequence seq = new Sequence();
      seq.add(emitStatement(stmt));
      return seq;
    } finally {
      popScope();
    }
  }

  private JsTree ifStatement(mcps.msc.frontend.tree.If stmt) {
    String condition = exprs.emit(stmt.getCondition());
    Sequence thenBlock = body(stmt.getThenBranch());
    Sequence elseBlock = null;
    if (stmt.hasElse()) {
      elseBlock = body(stmt.getElseBranch());
    }
    return new If(condition, thenBlock, elseBlock);
  }

  private JsTree whileLoop(While loop) {
    String condition = exprs.emit(loop.getCondition());
    return new WhileLoop(condition, body(loop.getBody()));
  }

  private JsTree forLoop(For loop) {
    // The header's declarations are only visible inside the loop
    pushScope();
    try {
      String init = "";
      if (loop.getInit() != null) {
        init = assignment(loop.getInit(), true);
      }
      String condition = "";
      if (loop.getCondition() != null) {
        condition = exprs.emit(loop.getCondition());
      }
      String update = "";
      if (loop.getUpdate() != null) {
        update = assignment(loop.getUpdate(), false);
      }
      return new ForLoop(init, condition, update, body(loop.getBody()));
    } finally {
      popScope();
    }
  }

  private JsTree returnStatement(Return ret) {
    if (ret.hasValue()) {
      return new Line("return " + exprs.emit(ret.getValue()) + ";");
    }
    return new Line("return;");
  }
}
