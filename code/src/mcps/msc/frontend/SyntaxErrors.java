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

import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.MismatchedTokenException;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;

import mcps.msc.antlr.gen.McpsParser;
import mcps.msc.ast.ParseContext;
import mcps.msc.common.exceptions.ParserRuntimeException;
import mcps.msc.common.exceptions.SyntaxError;

/**
 * Turns the first lexer or parser failure into a SyntaxError whose
 * message names what was being written, e.g. a declaration without its
 * name or an operator without its right operand.
 *
 * The checks look at the two tokens before the failure point, the token
 * the parser expected, and the construct the parser was inside.  Order
 * of the checks matters: the first that matches wins.
 */
public class SyntaxErrors {

  public static SyntaxError translate(ParserRuntimeException e,
                                      CommonTokenStream tokens) {
    SyntaxError err;
    if (e.isFromLexer()) {
      err = lexerError(e);
    } else {
      err = parserError(e, tokens);
    }
    LogHelper.debug(0, "Syntax error: " + err.getMessage()
                       + " (from " + e.getRecognitionException() + ")");
    return err;
  }

  private static SyntaxError lexerError(ParserRuntimeException e) {
    RecognitionException re = e.getRecognitionException();
    if (e.isInString()) {
      return new SyntaxError(e.getTokenStartLine(),
                e.getTokenStartColumn() + 1, "Unterminated string");
    } else if (e.isInComment()) {
      return new SyntaxError(e.getTokenStartLine(),
                e.getTokenStartColumn() + 1, "Unterminated comment");
    } else if (re.c == Token.EOF) {
      return new SyntaxError(re.line, re.charPositionInLine + 1,
                "Incomplete expression: unexpected end of input");
    } else {
      return new SyntaxError(re.line, re.charPositionInLine + 1,
                "Unexpected syntax: unexpected character '" + (char)re.c + "'");
    }
  }

  private static SyntaxError parserError(ParserRuntimeException e,
                                         CommonTokenStream tokens) {
    RecognitionException re = e.getRecognitionException();
    Token offending = re.token;
    int expecting = Token.INVALID_TOKEN_TYPE;
    if (re instanceof MismatchedTokenException) {
      expecting = ((MismatchedTokenException)re).expecting;
    }

    Token prev = null, prevPrev = null;
    if (offending != null) {
      prev = previousToken(tokens, offending.getTokenIndex());
      if (prev != null) {
        prevPrev = previousToken(tokens, prev.getTokenIndex());
      }
    }
    int prevType = typeOf(prev);
    int prevPrevType = typeOf(prevPrev);
    int offendingType = typeOf(offending);

    // Declaration keyword not followed by a name
    if (isDeclarationKeyword(prevType) && expecting == McpsParser.ID &&
        prevPrevType != McpsParser.DOT) {
      String kind = prev.getText();
      if (prevType == McpsParser.TOOL &&
          offendingType == McpsParser.LPAREN) {
        return at(prev, "expected tool name before parameter list");
      }
      return at(prev, "Missing name for " + kind + " declaration");
    }

    // Named declaration without its body
    if (isDeclarationKeyword(prevPrevType) && prevType == McpsParser.ID) {
      String kind = prevPrev.getText();
      if (prevPrevType == McpsParser.TOOL) {
        if (expecting == McpsParser.LPAREN) {
          return at(offending, "Expected \"(\" to start parameter list of tool");
        }
      } else if (expecting == McpsParser.LBRACE) {
        return at(offending, "Expected \"{\" to start " + kind +
                             " declaration");
      }
    }

    if ((prevType == McpsParser.IF || prevType == McpsParser.WHILE) &&
        expecting == McpsParser.LPAREN) {
      return at(offending, "Missing condition for " + prev.getText() +
                " statement: expected \"(...)\"");
    }

    String dangling = danglingOperatorMessage(prev, e.getContext());
    if (dangling != null) {
      return at(prev, dangling);
    }

    if (e.getContext() == ParseContext.FOR_HEADER ||
        prevType == McpsParser.FOR) {
      return at(offending, "Incomplete for loop");
    }

    switch (expecting) {
      case McpsParser.RBRACE:
        return at(offending, "Missing closing brace");
      case McpsParser.RPAREN:
        return at(offending, "Missing closing parenthesis");
      case McpsParser.RBRACKET:
        return at(offending, "Missing closing bracket");
      default:
        break;
    }

    if (offending == null || offendingType == Token.EOF) {
      return at(offending, "Incomplete expression: unexpected end of input");
    }
    return at(offending, "Unexpected syntax: unexpected \"" +
                         offending.getText() + "\"");
  }

  /**
   * @return message if prev is an operator left without its operand,
   *        otherwise null
   */
  private static String danglingOperatorMessage(Token prev,
                                                ParseContext context) {
    switch (typeOf(prev)) {
      case McpsParser.ARROW:
        return "expected agent name after \"->\"";
      case McpsParser.DOT:
        return "expected property name after \".\"";
      case McpsParser.PIPE:
        return "expected type after \"|\"";
      case McpsParser.COLON:
        if (context == ParseContext.TYPE_ANNOTATION) {
          return "Missing type in type annotation";
        }
        return null;
      case McpsParser.NULLISH:
      case McpsParser.OR:
      case McpsParser.AND:
      case McpsParser.EQ:
      case McpsParser.NEQ:
      case McpsParser.LT:
      case McpsParser.GT:
      case McpsParser.LTE:
      case McpsParser.GTE:
      case McpsParser.PLUS:
      case McpsParser.MINUS:
      case McpsParser.STAR:
      case McpsParser.SLASH:
      case McpsParser.PERCENT:
      case McpsParser.NOT:
      case McpsParser.ASSIGN:
        return "expected value after \"" + prev.getText() + "\" operator";
      default:
        return null;
    }
  }

  private static boolean isDeclarationKeyword(int type) {
    return type == McpsParser.MCP || type == McpsParser.MODEL ||
           type == McpsParser.AGENT || type == McpsParser.TOOL;
  }

  /**
   * @return closest token before index on the default channel, or null
   */
  private static Token previousToken(CommonTokenStream tokens, int index) {
    for (int i = index - 1; i >= 0; i--) {
      Token t = tokens.get(i);
      if (t.getChannel() == Token.DEFAULT_CHANNEL) {
        return t;
      }
    }
    return null;
  }

  private static int typeOf(Token t) {
    return t == null ? Token.INVALID_TOKEN_TYPE : t.getType();
  }

  private static SyntaxError at(Token t, String reason) {
    if (t == null) {
      return new SyntaxError(1, 1, reason);
    }
    return new SyntaxError(t.getLine(), t.getCharPositionInLine() + 1, reason);
  }
}
