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
 * C-style loop.  Each of init, condition and update may be absent.
 */
public class For extends Statement {

  private final Assignment init;
  private final Expression condition;
  private final Assignment update;
  private final Statement body;

  public For(Assignment init, Expression condition, Assignment update,
             Statement body) {
    super(Kind.FOR);
    this.init = init;
    this.condition = condition;
    this.update = update;
    this.body = body;
  }

  public Assignment getInit() {
    return init;
  }

  public Expression getCondition() {
    return condition;
  }

  public Assignment getUpdate() {
    return update;
  }

  public Statement getBody() {
    return body;
  }
}
