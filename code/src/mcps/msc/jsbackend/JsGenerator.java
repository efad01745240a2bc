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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import mcps.msc.common.Logging;
import mcps.msc.common.exceptions.InvalidDeclarationException;
import mcps.msc.common.exceptions.UndefinedVariableError;
import mcps.msc.frontend.ScopeValidator;
import mcps.msc.frontend.tree.AgentDecl;
import mcps.msc.frontend.tree.Assignment;
import mcps.msc.frontend.tree.Block;
import mcps.msc.frontend.tree.For;
import mcps.msc.frontend.tree.If;
import mcps.msc.frontend.tree.McpDecl;
import mcps.msc.frontend.tree.ModelDecl;
import mcps.msc.frontend.tree.Statement;
import mcps.msc.frontend.tree.ToolDecl;
import mcps.msc.frontend.tree.ToolParameter;
import mcps.msc.frontend.tree.While;
import mcps.msc.jsbackend.tree.JsTree;
import mcps.msc.jsbackend.tree.Sequence;

/**
 * Turns a program into JavaScript for the MCP Script runtime.
 *
 * Output is laid out in sections separated by blank lines: server
 * connections, models, user tools, agents, the program's own
 * statements and finally server cleanup.  Later sections may refer to
 * bindings made by earlier ones, whatever the order in the source.
 */
public class JsGenerator {

  private static final Logger logger = Logging.getMscLogger();

  private final ScopeValidator validator;

  public JsGenerator() {
    this(new ScopeValidator());
  }

  public JsGenerator(ScopeValidator validator) {
    this.validator = validator;
  }

  /**
   * Check scoping, then generate code
   */
  public String generateCode(List<Statement> program)
      throws UndefinedVariableError, InvalidDeclarationException {
    validator.validate(program);
    return generateCodeUnsafe(program);
  }

  /**
   * Generate code without checking that all names resolve
   */
  public String generateCodeUnsafe(List<Statement> program)
      throws InvalidDeclarationException {
    // Declarations keyed by name; the first of a name wins
    Map<String, McpDecl> servers = new LinkedHashMap<String, McpDecl>();
    Map<String, ModelDecl> models = new LinkedHashMap<String, ModelDecl>();
    Map<String, AgentDecl> agents = new LinkedHashMap<String, AgentDecl>();
    Map<String, ToolDecl> tools = new LinkedHashMap<String, ToolDecl>();
    List<Statement> main = new ArrayList<Statement>();

    for (Statement stmt: program) {
      switch (stmt.kind()) {
        case MCP_DECL: {
          McpDecl decl = (McpDecl)stmt;
          putFirst(servers, decl.getName(), decl);
          break;
        }
        case MODEL_DECL: {
          ModelDecl decl = (ModelDecl)stmt;
          putFirst(models, decl.getName(), decl);
          break;
        }
        case AGENT_DECL: {
          AgentDecl decl = (AgentDecl)stmt;
          putFirst(agents, decl.getName(), decl);
          break;
        }
        case TOOL_DECL: {
          ToolDecl decl = (ToolDecl)stmt;
          putFirst(tools, decl.getName(), decl);
          break;
        }
        default:
          main.add(stmt);
          break;
      }
    }
    logger.debug("Generating code: " + servers.size() + " servers, " +
                 models.size() + " models, " + agents.size() + " agents, " +
                 tools.size() + " tools, " + main.size() +
                 " top-level statements");

    ExpressionEmitter exprs = new ExpressionEmitter();
    StatementEmitter stmts = new StatementEmitter(exprs);
    // Entity bindings are const, so assignments to them never get let
    for (Map<String, ? extends Statement> byName:
         ImmutableList.<Map<String, ? extends Statement>>of(
             servers, models, agents, tools)) {
      for (String name: byName.keySet()) {
        stmts.declare(name);
      }
    }
    // A top-level variable that a tool assigns is bound before the
    // tools, so the tool body reassigns it instead of declaring its own
    Set<String> shared = new LinkedHashSet<String>();
    for (String name: sharedVariables(main, tools.values())) {
      if (!stmts.isDeclared(name)) {
        shared.add(name);
        stmts.declare(name);
      }
    }
    DeclarationEmitter decls = new DeclarationEmitter(exprs,
                                              new TypeSchemaCompiler());

    List<String> sections = new ArrayList<String>();
    if (!servers.isEmpty()) {
      sections.add(decls.mcpSection(servers.values()));
    }
    if (!models.isEmpty()) {
      sections.add(decls.modelSection(models.values()));
    }
    if (!shared.isEmpty()) {
      sections.add("// Variables shared with user-defined tools\n" +
                   "let " + StringUtils.join(shared, ", ") + ";");
    }
    // Tools come before agents, whose tool lists may name them
    if (!tools.isEmpty()) {
      List<String> toolCode = new ArrayList<String>();
      for (ToolDecl tool: tools.values()) {
        toolCode.add(render(decls.tool(tool, stmts)));
      }
      sections.add("// User-defined tools\n" +
                   StringUtils.join(toolCode, "\n\n"));
    }
    if (!agents.isEmpty()) {
      sections.add(decls.agentSection(agents.values(), servers.keySet()));
    }

    Sequence mainCode = stmts.emitStatements(main);
    if (!mainCode.isEmpty()) {
      sections.add("// Generated code\n" + render(mainCode));
    }

    if (!servers.isEmpty()) {
      sections.add("// Cleanup MCP servers\n" +
                   "for (const server of __mcpServers) {\n" +
                   "  await server.cleanup();\n" +
                   "}");
    }
    if (sections.isEmpty()) {
      return "";
    }
    return StringUtils.join(sections, "\n\n") + "\n";
  }

  /**
   * @return names assigned by top-level statements that some tool body
   *        also assigns, in order of first top-level assignment
   */
  private static Set<String> sharedVariables(List<Statement> main,
                                             Collection<ToolDecl> tools) {
    Set<String> assignedInTools = new HashSet<String>();
    for (ToolDecl tool: tools) {
      Set<String> names = new HashSet<String>();
      for (Statement stmt: tool.getBody().getStatements()) {
        assignedNames(stmt, names);
      }
      for (ToolParameter param: tool.getParameters()) {
        names.remove(param.getName());
      }
      assignedInTools.addAll(names);
    }

    Set<String> shared = new LinkedHashSet<String>();
    for (Statement stmt: main) {
      if (stmt.kind() == Statement.Kind.ASSIGNMENT) {
        String var = ((Assignment)stmt).getVariableName();
        if (var != null && assignedInTools.contains(var)) {
          shared.add(var);
        }
      }
    }
    return shared;
  }

  /**
   * Add every variable stmt or its nested statements assign to
   */
  private static void assignedNames(Statement stmt, Set<String> names) {
    switch (stmt.kind()) {
      case ASSIGNMENT:
        addVariable((Assignment)stmt, names);
        break;
      case BLOCK:
        for (Statement s: ((Block)stmt).getStatements()) {
          assignedNames(s, names);
        }
        break;
      case IF: {
        If ifStmt = (If)stmt;
        assignedNames(ifStmt.getThenBranch(), names);
        if (ifStmt.hasElse()) {
          assignedNames(ifStmt.getElseBranch(), names);
        }
        break;
      }
      case WHILE:
        assignedNames(((While)stmt).getBody(), names);
        break;
      case FOR: {
        For loop = (For)stmt;
        if (loop.getInit() != null) {
          addVariable(loop.getInit(), names);
        }
        if (loop.getUpdate() != null) {
          addVariable(loop.getUpdate(), names);
        }
        assignedNames(loop.getBody(), names);
        break;
      }
      default:
        // Nothing else binds a name
        break;
    }
  }

  private static void addVariable(Assignment assign, Set<String> names) {
    String var = assign.getVariableName();
    if (var != null) {
      names.add(var);
    }
  }

  private static <T> void putFirst(Map<String, T> decls, String name,
                                   T decl) {
    if (decls.containsKey(name)) {
      logger.warn("Duplicate declaration of " + name + " ignored");
      return;
    }
    decls.put(name, decl);
  }

  /**
   * Render at top level without the final newline
   */
  private static String render(JsTree tree) {
    return StringUtils.stripEnd(tree.toString(), "\n");
  }
}
