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
package mcps.msc.ast;

import java.util.List;

/**
 * Read-only view of a concrete syntax tree node.  The AST builder only
 * walks nodes through this interface.
 */
public interface SyntaxNode {

  NodeKind kind();

  /** Token name for diagnostics, e.g. "OBJECT_LIT" */
  String kindName();

  String text();

  int childCount();

  SyntaxNode child(int i);

  List<? extends SyntaxNode> children();

  /** 1-based */
  int line();

  /** 1-based */
  int column();
}
