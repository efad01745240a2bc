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

/**
 * User-defined tool with a typed parameter list and a body
 */
public class ToolDecl extends Statement {

  private final String name;
  private final ImmutableList<ToolParameter> parameters;
  /** Recorded but not enforced */
  private final TypeExpr returnType;
  private final Block body;

  public ToolDecl(String name, List<ToolParameter> parameters,
                  TypeExpr returnType, Block body) {
    super(Kind.TOOL_DECL);
    this.name = name;
    this.parameters = ImmutableList.copyOf(parameters);
    this.returnType = returnType;
    this.body = body;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<ToolParameter> getParameters() {
    return parameters;
  }

  public TypeExpr getReturnType() {
    return returnType;
  }

  public Block getBody() {
    return body;
  }
}
