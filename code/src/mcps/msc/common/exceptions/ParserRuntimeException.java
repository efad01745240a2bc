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

import org.antlr.runtime.RecognitionException;

import mcps.msc.ast.ParseContext;

/**
 * Thrown from the generated lexer and parser on the first error so that
 * parsing aborts instead of recovering.  Carries what is needed to
 * build a readable SyntaxError afterwards.
 */
public class ParserRuntimeException extends RuntimeException {

  private final RecognitionException recognition;
  private final boolean fromLexer;

  /** Innermost construct being parsed, or null */
  private final ParseContext context;

  private final boolean inString;
  private final boolean inComment;
  private final int tokenStartLine;
  /** 0-based, as ANTLR reports it */
  private final int tokenStartColumn;

  public ParserRuntimeException(RecognitionException cause,
                                ParseContext context) {
    super(cause);
    this.recognition = cause;
    this.fromLexer = false;
    this.context = context;
    this.inString = false;
    this.inComment = false;
    this.tokenStartLine = cause.line;
    this.tokenStartColumn = cause.charPositionInLine;
  }

  public ParserRuntimeException(RecognitionException cause, boolean inString,
                      boolean inComment, int tokenStartLine,
                      int tokenStartColumn) {
    super(cause);
    this.recognition = cause;
    this.fromLexer = true;
    this.context = null;
    this.inString = inString;
    this.inComment = inComment;
    this.tokenStartLine = tokenStartLine;
    this.tokenStartColumn = tokenStartColumn;
  }

  public RecognitionException getRecognitionException() {
    return recognition;
  }

  public boolean isFromLexer() {
    return fromLexer;
  }

  public ParseContext getContext() {
    return context;
  }

  public boolean isInString() {
    return inString;
  }

  public boolean isInComment() {
    return inComment;
  }

  public int getTokenStartLine() {
    return tokenStartLine;
  }

  public int getTokenStartColumn() {
    return tokenStartColumn;
  }

  private static final long serialVersionUID = 1L;
}
