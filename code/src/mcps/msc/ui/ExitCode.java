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
package mcps.msc.ui;

/**
 * Process status msc exits with.  Status 1 is left to the JVM, which
 * uses it for uncaught exceptions.
 */
public enum ExitCode {
  SUCCESS(0),
  /** Input unreadable or output unwritable */
  ERROR_IO(2),
  /** Program text does not parse */
  ERROR_PARSER(3),
  /** Undefined name or invalid declaration */
  ERROR_USER(4),
  ERROR_COMMAND(5),
  /** Bug in msc itself */
  ERROR_INTERNAL(90);

  private final int code;

  private ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
