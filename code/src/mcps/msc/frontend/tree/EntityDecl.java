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

import mcps.msc.frontend.tree.Expression.ObjectLit;

/**
 * A named declaration configured by an object literal:
 * mcp, model or agent.
 */
public abstract class EntityDecl extends Statement {

  private final String name;
  private final ObjectLit config;

  protected EntityDecl(Kind kind, String name, ObjectLit config) {
    super(kind);
    this.name = name;
    this.config = config;
  }

  public String getName() {
    return name;
  }

  public ObjectLit getConfig() {
    return config;
  }

  /**
   * @return keyword introducing this declaration
   */
  public abstract String keyword();
}
