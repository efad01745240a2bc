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
 * A parameter of a user-defined tool: <code>name?: type</code>
 */
public class ToolParameter {

  private final String name;
  private final boolean optional;
  /** null if unannotated */
  private final TypeExpr type;

  public ToolParameter(String name, boolean optional, TypeExpr type) {
    this.name = name;
    this.optional = optional;
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public boolean isOptional() {
    return optional;
  }

  public TypeExpr getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }
}
