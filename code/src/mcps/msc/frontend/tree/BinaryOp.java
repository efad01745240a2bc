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
 * Binary operators, with their binding strength.  Higher binds tighter;
 * all are left-associative.
 */
public enum BinaryOp {
  DELEGATE("->", 0),
  NULLISH("??", 1),
  OR("||", 2),
  AND("&&", 3),
  EQ("==", 4),
  NEQ("!=", 4),
  LT("<", 4),
  GT(">", 4),
  LTE("<=", 4),
  GTE(">=", 4),
  PLUS("+", 5),
  MINUS("-", 5),
  TIMES("*", 6),
  DIVIDE("/", 6),
  MOD("%", 6);

  private final String symbol;
  private final int precedence;

  private BinaryOp(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  public String symbol() {
    return symbol;
  }

  public int precedence() {
    return precedence;
  }

  public boolean isLogical() {
    return this == OR || this == AND;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
