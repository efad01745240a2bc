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

public class If extends JsTree
{
  private final String condition;
  private final JsTree thenBlock;
  /** null if there is no else */
  private final JsTree elseBlock;

  public If(String condition, JsTree thenBlock, JsTree elseBlock)
  {
    this.condition = condition;
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("if (");
    sb.append(condition);
    sb.append(") ");
    thenBlock.setIndentation(indentation);
    thenBlock.appendToAsBlock(sb);
    if (elseBlock != null) {
      sb.append(" else ");
      elseBlock.setIndentation(indentation);
      elseBlock.appendToAsBlock(sb);
    }
    sb.append("\n");
  }
}
