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

package mcps.msc.common.exceptions;

/**
 * Malformed program text.  Line and column are 1-based.
 */
public class SyntaxError extends UserException {

  private final int line;
  private final int column;
  private final String reason;

  public SyntaxError(int line, int column, String reason) {
    super("Parse error at line " + line + ", column " + column + ": " + reason);
    this.line = line;
    this.column = column;
    this.reason = reason;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  /**
   * @return the message without position information
   */
  public String getReason() {
    return reason;
  }

  private static final long serialVersionUID = 1L;
}
