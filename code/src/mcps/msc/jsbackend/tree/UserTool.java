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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Definition of a user-defined tool: an async arrow function wrapped by
 * the runtime's tool factory together with its parameter names and the
 * descriptor of its call surface.
 */
public class UserTool extends JsTree
{
  private final String name;
  private final String quotedName;
  private final List<String> params;
  private final List<String> quotedParams;
  private final JsTree body;
  private final String schema;

  /**
   * @param name
   * @param quotedName name as a string literal
   * @param params
   * @param quotedParams params as string literals
   * @param body
   * @param schema descriptor object literal for __buildZodSchema
   */
  public UserTool(String name, String quotedName, List<String> params,
          List<String> quotedParams, JsTree body, String schema)
  {
    this.name = name;
    this.quotedName = quotedName;
    this.params = new ArrayList<String>(params);
    this.quotedParams = new ArrayList<String>(quotedParams);
    this.body = body;
    this.schema = schema;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("const ").append(name).append(" = __createUserTool(");
    sb.append(quotedName).append(", [");
    sb.append(StringUtils.join(quotedParams, ", "));
    sb.append("], async (");
    sb.append(StringUtils.join(params, ", "));
    sb.append(") => ");
    body.setIndentation(indentation);
    body.appendToAsBlock(sb);
    sb.append(", __buildZodSchema(").append(schema).append("));\n");
  }
}
