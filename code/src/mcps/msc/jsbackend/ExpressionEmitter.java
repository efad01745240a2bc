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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import mcps.msc.common.exceptions.MscRuntimeError;
import mcps.msc.frontend.tree.BinaryOp;
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
import mcps.msc.frontend.tree.UnaryOp;

/**
 * Prints expressions as JavaScript, inserting the parentheses needed
 * to reproduce the tree's grouping.
 *
 * Calls are awaited, since tools and agents are asynchronous at run
 * time.  Inside a chain like a.b().c() only the outermost call is.
 */
public class ExpressionEmitter {

  public String emit(Expression expr) {
    switch (expr.kind()) {
      case IDENTIFIER:
        return ((Identifier)expr).getName();
      case STRING:
        return JsUtil.jsonQuote(((StringLit)expr).getValue());
      case NUMBER:
        return JsUtil.formatNumber(((NumberLit)expr).getValue());
      case BOOLEAN:
        return Boolean.toString(((BooleanLit)expr).getValue());
      case ARRAY:
        return arrayLiteral((ArrayLit)expr);
      case OBJECT:
        return objectLiteral((ObjectLit)expr);
      case CALL:
        return call((Call)expr);
      case MEMBER:
        return member((Member)expr);
      case INDEX:
        return index((Index)expr);
      case BINARY:
        return binary((Binary)expr);
      case UNARY:
        return unary((Unary)expr);
      default:
        throw new MscRuntimeError("Unexpected expression kind: "
                                  + expr.kind());
    }
  }

  private String arrayLiteral(ArrayLit arr) {
    return "[" + StringUtils.join(emitAll(arr.getElements()), ", ") + "]";
  }

  private String objectLiteral(ObjectLit obj) {
    if (obj.getProperties().isEmpty()) {
      return "{}";
    }
    List<String> props = new ArrayList<String>();
    for (Property prop: obj.getProperties()) {
      String key = JsUtil.isIdentifier(prop.getKey()) ?
                    prop.getKey() : JsUtil.jsonQuote(prop.getKey());
      props.add(key + ": " + emit(prop.getValue()));
    }
    return "{ " + StringUtils.join(props, ", ") + " }";
  }

  private List<String> emitAll(List<Expression> exprs) {
    List<String> result = new ArrayList<String>(exprs.size());
    for (Expression e: exprs) {
      result.add(emit(e));
    }
    return result;
  }

  private String call(Call call) {
    return "await " + callNoAwait(call);
  }

  /**
   * A call without the leading await, for use inside member chains
   */
  private String callNoAwait(Call call) {
    String callee;
    if (call.getCallee().kind() == Expression.Kind.MEMBER) {
      callee = memberInChain((Member)call.getCallee());
    } else {
      callee = operand(call.getCallee());
    }
    return callee + "(" + StringUtils.join(emitAll(call.getArgs()), ", ")
                  + ")";
  }

  /**
   * Member expression used as a callee.  A call on its left that itself
   * has a member callee is part of the same chain and is not awaited.
   */
  private String memberInChain(Member member) {
    Expression object = member.getObject();
    String objectCode;
    if (object.kind() == Expression.Kind.CALL &&
        ((Call)object).getCallee().kind() == Expression.Kind.MEMBER) {
      objectCode = callNoAwait((Call)object);
    } else {
      objectCode = operand(object);
    }
    return objectCode + "." + member.getProperty();
  }

  private String member(Member member) {
    return operand(member.getObject()) + "." + member.getProperty();
  }

  private String index(Index index) {
    return operand(index.getObject()) + "[" + emit(index.getIndex()) + "]";
  }

  /**
   * Emit the object or callee of a member, index or call expression.
   * Anything that would bind looser than the postfix operator is grouped.
   */
  private String operand(Expression expr) {
    String code = emit(expr);
    switch (expr.kind()) {
      case CALL:
      case BINARY:
      case UNARY:
      case NUMBER:
        return "(" + code + ")";
      default:
        return code;
    }
  }

  private String binary(Binary bin) {
    if (bin.getOp() == BinaryOp.DELEGATE) {
      return delegation(bin);
    }
    String left = emit(bin.getLeft());
    if (needsParens(bin.getLeft(), bin.getOp(), false)) {
      left = "(" + left + ")";
    }
    String right = emit(bin.getRight());
    if (needsParens(bin.getRight(), bin.getOp(), true)) {
      right = "(" + right + ")";
    }
    return left + " " + bin.getOp().symbol() + " " + right;
  }

  /**
   * prompt -> agent becomes a call of the agent's run method
   */
  private String delegation(Binary bin) {
    Expression target = bin.getRight();
    String targetCode = emit(target);
    if (target.kind() != Expression.Kind.IDENTIFIER &&
        target.kind() != Expression.Kind.MEMBER) {
      targetCode = "(" + targetCode + ")";
    }
    return "await " + targetCode + ".run(" + emit(bin.getLeft()) + ")";
  }

  /**
   * @param child operand of parent
   * @param parent operator
   * @param rightSide true if child is the right operand
   * @return true if child must be grouped to keep the tree's meaning
   */
  static boolean needsParens(Expression child, BinaryOp parent,
                             boolean rightSide) {
    if (child.kind() != Expression.Kind.BINARY) {
      return false;
    }
    BinaryOp childOp = ((Binary)child).getOp();

    // JavaScript rejects ?? mixed with && or || unless grouped
    if (parent == BinaryOp.NULLISH && childOp.isLogical()) {
      return true;
    }
    if (parent.isLogical() && childOp == BinaryOp.NULLISH) {
      return true;
    }

    if (childOp.precedence() < parent.precedence()) {
      return true;
    }
    return childOp.precedence() == parent.precedence() && rightSide;
  }

  private String unary(Unary unary) {
    String operand = emit(unary.getOperand());
    if (unary.getOperand().kind() == Expression.Kind.BINARY ||
        (unary.getOp() == UnaryOp.NEGATE && operand.startsWith("-"))) {
      operand = "(" + operand + ")";
    }
    return unary.getOp().symbol() + operand;
  }
}
