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

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.apache.commons.lang3.StringUtils;

/**
 * Expressions of the MCP Script AST.  Nesting of Binary nodes already
 * encodes precedence and associativity.
 *
 * toString() renders a fully parenthesized form, so two trees with the
 * same structure print identically.
 */
public abstract class Expression {

  public static enum Kind {
    IDENTIFIER,
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    CALL,
    MEMBER,
    INDEX,
    BINARY,
    UNARY,
  }

  private final Kind kind;

  protected Expression(Kind kind) {
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  public static class Identifier extends Expression {
    private final String name;

    public Identifier(String name) {
      super(Kind.IDENTIFIER);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class StringLit extends Expression {
    /** Escapes already resolved */
    private final String value;

    public StringLit(String value) {
      super(Kind.STRING);
      this.value = value;
    }

    public String getValue() {
      return value;
    }

    @Override
    public String toString() {
      return "'" + value + "'";
    }
  }

  public static class NumberLit extends Expression {
    private final double value;

    public NumberLit(double value) {
      super(Kind.NUMBER);
      this.value = value;
    }

    public double getValue() {
      return value;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  public static class BooleanLit extends Expression {
    private final boolean value;

    public BooleanLit(boolean value) {
      super(Kind.BOOLEAN);
      this.value = value;
    }

    public boolean getValue() {
      return value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  public static class ArrayLit extends Expression {
    private final ImmutableList<Expression> elements;

    public ArrayLit(List<Expression> elements) {
      super(Kind.ARRAY);
      this.elements = ImmutableList.copyOf(elements);
    }

    public ImmutableList<Expression> getElements() {
      return elements;
    }

    @Override
    public String toString() {
      return "[" + StringUtils.join(elements, ", ") + "]";
    }
  }

  public static class Property {
    private final String key;
    private final Expression value;

    public Property(String key, Expression value) {
      this.key = key;
      this.value = value;
    }

    public String getKey() {
      return key;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public String toString() {
      return key + ": " + value;
    }
  }

  public static class ObjectLit extends Expression {
    private final ImmutableList<Property> properties;

    public ObjectLit(List<Property> properties) {
      super(Kind.OBJECT);
      this.properties = ImmutableList.copyOf(properties);
    }

    public ImmutableList<Property> getProperties() {
      return properties;
    }

    /**
     * @return value of first property with key, or null
     */
    public Expression get(String key) {
      for (Property p: properties) {
        if (p.getKey().equals(key)) {
          return p.getValue();
        }
      }
      return null;
    }

    @Override
    public String toString() {
      return "{" + StringUtils.join(properties, ", ") + "}";
    }
  }

  public static class Call extends Expression {
    private final Expression callee;
    private final ImmutableList<Expression> args;

    public Call(Expression callee, List<Expression> args) {
      super(Kind.CALL);
      this.callee = callee;
      this.args = ImmutableList.copyOf(args);
    }

    public Expression getCallee() {
      return callee;
    }

    public ImmutableList<Expression> getArgs() {
      return args;
    }

    @Override
    public String toString() {
      return callee + "(" + StringUtils.join(args, ", ") + ")";
    }
  }

  public static class Member extends Expression {
    private final Expression object;
    private final String property;

    public Member(Expression object, String property) {
      super(Kind.MEMBER);
      this.object = object;
      this.property = property;
    }

    public Expression getObject() {
      return object;
    }

    public String getProperty() {
      return property;
    }

    @Override
    public String toString() {
      return object + "." + property;
    }
  }

  public static class Index extends Expression {
    private final Expression object;
    private final Expression index;

    public Index(Expression object, Expression index) {
      super(Kind.INDEX);
      this.object = object;
      this.index = index;
    }

    public Expression getObject() {
      return object;
    }

    public Expression getIndex() {
      return index;
    }

    @Override
    public String toString() {
      return object + "[" + index + "]";
    }
  }

  public static class Binary extends Expression {
    private final Expression left;
    private final BinaryOp op;
    private final Expression right;

    public Binary(Expression left, BinaryOp op, Expression right) {
      super(Kind.BINARY);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    public Expression getLeft() {
      return left;
    }

    public BinaryOp getOp() {
      return op;
    }

    public Expression getRight() {
      return right;
    }

    @Override
    public String toString() {
      return "(" + left + " " + op + " " + right + ")";
    }
  }

  public static class Unary extends Expression {
    private final UnaryOp op;
    private final Expression operand;

    public Unary(UnaryOp op, Expression operand) {
      super(Kind.UNARY);
      this.op = op;
      this.operand = operand;
    }

    public UnaryOp getOp() {
      return op;
    }

    public Expression getOperand() {
      return operand;
    }

    @Override
    public String toString() {
      return "(" + op + operand + ")";
    }
  }
}
