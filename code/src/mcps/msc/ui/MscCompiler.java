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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import mcps.msc.common.exceptions.MscFatal;
import mcps.msc.common.exceptions.SyntaxError;
import mcps.msc.common.exceptions.UserException;
import mcps.msc.frontend.AstBuilder;
import mcps.msc.frontend.ParsedProgram;
import mcps.msc.frontend.tree.Statement;
import mcps.msc.jsbackend.JsGenerator;

/**
 * This is the main entry point to the compiler
 */
public class MscCompiler {

  private final Logger logger;

  public MscCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * Compile an MCP Script file to JavaScript.
   *
   * Errors are reported on stderr and signalled by throwing MscFatal
   * with the matching exit code.
   * @param inputFile
   * @param output closed when done
   * @param validate whether to check that all names resolve
   */
  public void compile(String inputFile, OutputStream output,
                      boolean validate) {
    try {
      logger.info("msc starting: " + inputFile);
      ParsedProgram parsed = ParsedProgram.parseFile(inputFile);
      String code = generate(parsed, validate);
      try {
        IOUtils.write(code, output, StandardCharsets.UTF_8);
        output.close();
      } catch (IOException e) {
        System.err.println("I/O error while writing to output");
        System.err.println(e.getMessage());
        throw new MscFatal(ExitCode.ERROR_IO.code());
      }
      logger.debug("msc done: " + inputFile);
    }
    catch (MscFatal e) {
      // Rethrow
      throw e;
    }
    catch (IOException e) {
      System.err.println("msc error: could not read " + inputFile);
      System.err.println(e.getMessage());
      throw new MscFatal(ExitCode.ERROR_IO.code());
    }
    catch (SyntaxError e) {
      System.err.println("msc error:");
      System.err.println(inputFile + ": " + e.getMessage());
      throw new MscFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (UserException e) {
      System.err.println("msc error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled()) {
        logger.debug("Compilation failed", e);
      }
      throw new MscFatal(ExitCode.ERROR_USER.code());
    }
    catch (Throwable e) {
      // Other error, e.g. MscRuntimeError
      reportInternalError(e);
      throw new MscFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Compile program text to JavaScript
   * @param source
   * @param validate whether to check that all names resolve
   * @return generated code
   * @throws UserException for any error in the program
   */
  public static String compileSource(String source, boolean validate)
      throws UserException {
    return generate(ParsedProgram.parse(source), validate);
  }

  private static String generate(ParsedProgram parsed, boolean validate)
      throws UserException {
    List<Statement> program = new AstBuilder().build(parsed.ast);
    JsGenerator codeGen = new JsGenerator();
    if (validate) {
      return codeGen.generateCode(program);
    } else {
      return codeGen.generateCodeUnsafe(program);
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("MSC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
