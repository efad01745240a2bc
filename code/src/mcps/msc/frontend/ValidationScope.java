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
package mcps.msc.frontend;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import mcps.msc.common.exceptions.MscRuntimeError;

/**
 * Names visible at a point of the program.  Entering a scope copies
 * every name of the enclosing scope, so lookups only look at the top.
 * Names bound inside a scope vanish when it is popped.
 */
class ValidationScope {

  private final Deque<Set<String>> scopes = new ArrayDeque<Set<String>>();

  ValidationScope(Set<String> globals) {
    scopes.push(new HashSet<String>(globals));
  }

  void push() {
    scopes.push(new HashSet<String>(scopes.peek()));
  }

  void pop() {
    if (scopes.size() <= 1) {
      throw new MscRuntimeError("Cannot pop global scope");
    }
    scopes.pop();
  }

  void declare(String name) {
    scopes.peek().add(name);
  }

  boolean isDefined(String name) {
    return scopes.peek().contains(name);
  }

  int depth() {
    return scopes.size();
  }
}
