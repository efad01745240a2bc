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
package mcps.msc.jsbackend.tree;

/**
 * for (init; condition; update) { body }
 */
public class ForLoop extends JsTree
{
  private final String init;
  private final String condition;
  private final String update;
  private final JsTree body;

  /**
   * @param init empty if absent
   * @param condition empty if absent
   * @param update empty if absent
   * @param body
   */
  public ForLoop(String init, String condition, String update, JsTree body)
  {
    this.init = init;
    this.condition = condition;
    this.update = update;
    this.body = body;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    if (init.isEmpty() && condition.isEmpty() && update.isEmpty()) {
      sb.append("for (;;) ");
    } else {
      sb.append("for (");
      sb.append(init);
      sb.append("; ");
      sb.append(condition);
      sb.append("; ");
      sb.append(update);
      sb.append(") ");
    }
    body.setIndentation(indentation);
    body.appendToAsBlock(sb);
    sb.append("\n");
  }
}
