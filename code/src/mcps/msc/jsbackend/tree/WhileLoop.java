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

public class WhileLoop extends JsTree
{
  private final String condition;
  private final JsTree body;

  public WhileLoop(String condition, JsTree body)
  {
    this.condition = condition;
    this.body = body;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("while (");
    sb.append(condition);
    sb.append(") ");
    body.setIndentation(indentation);
    body.appendToAsBlock(sb);
    sb.append("\n");
  }
}
