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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.apache.commons.io.FileUtils;

import mcps.msc.antlr.gen.McpsLexer;
import mcps.msc.antlr.gen.McpsParser;
import mcps.msc.ast.McpsAST;
import mcps.msc.ast.McpsTreeAdaptor;
import mcps.msc.common.exceptions.MscRuntimeError;
import mcps.msc.common.exceptions.ParserRuntimeException;
import mcps.msc.common.exceptions.SyntaxError;

/**
 * Represents an input MCP Script program after parsing
 */
public class ParsedProgram {

  public ParsedProgram(String inputFilePath, McpsAST ast) {
    this.inputFilePath = inputFilePath;
    this.ast = ast;
  }

  /** null if the program did not come from a file */
  public final String inputFilePath;
  public final McpsAST ast;

  /**
   * Parse program text
   * @param source
   * @return
   * @throws SyntaxError on the first malformed construct
   */
  public static ParsedProgram parse(String source) throws SyntaxError {
    return new ParsedProgram(null, runANTLR(source));
  }

  /**
   * Parse the specified UTF-8 file
   * @param path
   * @return
   * @throws IOException
   * @throws SyntaxError
   */
  public static ParsedProgram parseFile(String path)
                                throws IOException, SyntaxError {
    String source = FileUtils.readFileToString(new File(path),
                                               StandardCharsets.UTF_8);
    return new ParsedProgram(path, runANTLR(source));
  }

  /**
     Use ANTLR to parse the input and get the Tree
   */
  private static McpsAST runANTLR(String source) throws SyntaxError {
    McpsLexer lexer = new McpsLexer(new ANTLRStringStream(source));
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    McpsParser parser = new McpsParser(tokens);
    parser.setTreeAdaptor(new McpsTreeAdaptor());

    McpsParser.program_return program;
    try {
      program = parser.program();
    } catch (ParserRuntimeException e) {
      throw SyntaxErrors.translate(e, tokens);
    } catch (RecognitionException e) {
      // reportError throws before rules can rethrow, so this is unexpected
      throw new MscRuntimeError("Parser did not abort on error: " + e);
    }

    McpsAST tree = (McpsAST) program.getTree();
    if (tree == null) {
      throw new MscRuntimeError("Parser produced no tree");
    }
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(0, tree.printTree());
    }
    return tree;
  }
}
