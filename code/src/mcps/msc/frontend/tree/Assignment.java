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

import com.google.common.base.Preconditions;

import mcps.msc.frontend.tree.Expression.Identifier;

/**
 * <code>target = value</code>.  The target is always an identifier,
 * member or index expression.
 */
public class Assignment extends Statement {

  private final Expression target;
  private final Expression value;

  public Assignment(Expression target, Expression value) {
    super(Kind.ASSIGNMENT);
    Preconditions.checkArgument(isValidTarget(target),
                                "Invalid assignment target: %s", target);
    this.target = target;
    this.value = value;
  }

  public static boolean isValidTarget(Expression target) {
    switch (target.kind()) {
      case IDENTIFIER:
      case MEMBER:
      case INDEX:
        return true;
      default:
        return false;
    }
  }

  public Expression getTarget() {
    return target;
  }

  public Expression getValue() {
    return value;
  }

  /**
   * @return name of plain variable target, or null for member and index
   *        targets
   */
  public String getVariableName() {
    if (target.kind() == Expression.Kind.IDENTIFIER) {
      return ((Identifier)target).getName();
    }
    return null;
  }
}
