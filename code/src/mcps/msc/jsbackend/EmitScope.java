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
package mcps.msc.jsbackend;

import java.util.HashSet;
import java.util.Set;

/**
 * Names that already have a declaration emitted, per output block.
 * A child starts empty; lookups walk out through the parents.
 */
class EmitScope {
  private final EmitScope parent;
  private final Set<String> declared = new HashSet<String>();

  EmitScope() {
    this(null);
  }

  private EmitScope(EmitScope parent) {
    this.parent = parent;
  }

  /**
   * Make a new scope with this as the parent
   */
  EmitScope makeChild() {
    return new EmitScope(this);
  }

  EmitScope getParent() {
    return parent;
  }

  /**
   * @return true if name was declared here or in an enclosing scope
   */
  boolean isDeclared(String name) {
    EmitScope curr = this;
    while (curr != null) {
      if (curr.declared.contains(name)) {
        return true;
      }
      curr = curr.parent;
    }
    return false;
  }

  void declare(String name) {
    declared.add(name);
  }
}
