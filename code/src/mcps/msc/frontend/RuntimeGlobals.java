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

import com.google.common.collect.ImmutableSet;

/**
 * Names the execution environment binds before a compiled program
 * runs.  References to these never need a declaration.
 */
public class RuntimeGlobals {

  public static final ImmutableSet<String> ALLOWED = ImmutableSet.of(
      // Bindings injected by the runtime
      "log", "print", "env", "Set", "Map", "JSON",
      "null", "undefined",
      // Host built-ins
      "Math", "Date", "Object", "Array", "String", "Number", "Boolean",
      "RegExp", "parseInt", "parseFloat", "isNaN", "isFinite",
      "encodeURIComponent", "decodeURIComponent", "encodeURI", "decodeURI");

  private RuntimeGlobals() {
  }
}
