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

import org.apache.commons.lang3.StringUtils;

/**
 * Node of the generated JavaScript.  Each node renders itself at its
 * current indentation, which the enclosing node sets before rendering.
 */
public abstract class JsTree
{
  int indentation = 0;
  static int indentWidth = 2;

  public abstract void appendTo(StringBuilder sb);

  /**
   * @return true if rendering this produces no statements
   */
  public boolean isEmpty()
  {
    return false;
  }

  /**
   * Append this inside curly braces.  Empty content renders as {}
   * @param sb
   */
  public void appendToAsBlock(StringBuilder sb) {
    if (isEmpty()) {
      sb.append("{}");
      return;
    }
    sb.append("{\n");
    increaseIndent();
    appendTo(sb);
    decreaseIndent();
    indent(sb);
    sb.append("}");
  }

  public void indent(StringBuilder sb)
  {
    sb.append(StringUtils.repeat(' ', indentation));
  }

  public void setIndentation(int i)
  {
    indentation = i;
  }

  public void increaseIndent()
  {
    indentation += indentWidth;
  }

  public void decreaseIndent()
  {
    indentation -= indentWidth;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(2048);
    appendTo(sb);
    return sb.toString();
  }
}
