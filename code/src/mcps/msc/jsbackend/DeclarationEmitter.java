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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import mcps.msc.common.Logging;
import mcps.msc.common.exceptions.InvalidDeclarationException;
import mcps.msc.common.exceptions.MscRuntimeError;
import mcps.msc.frontend.tree.AgentDecl;
import mcps.msc.frontend.tree.Expression;
import mcps.msc.frontend.tree.Expression.ArrayLit;
import mcps.msc.frontend.tree.Expression.Identifier;
import mcps.msc.frontend.tree.McpDecl;
import mcps.msc.frontend.tree.ModelDecl;
import mcps.msc.frontend.tree.ToolDecl;
import mcps.msc.frontend.tree.ToolParameter;
import mcps.msc.jsbackend.tree.Sequence;
import mcps.msc.jsbackend.tree.UserTool;

/**
 * Emits the initialization code for entity declarations: MCP server
 * connections, model backends, user-defined tools and agents.
 */
public class DeclarationEmitter {

  private static final Logger logger = Logging.getMscLogger();

  private static final String PROXY_TEMPLATE = "mcp_proxy.js";
  private static final String NAME_PLACEHOLDER = "${NAME}";

  private final ExpressionEmitter exprs;
  private final TypeSchemaCompiler schemas;

  /** Body of per-server tool proxies, loaded on first use */
  private String proxyTemplate = null;

  public DeclarationEmitter(ExpressionEmitter exprs,
                            TypeSchemaCompiler schemas) {
    this.exprs = exprs;
    this.schemas = schemas;
  }

  /*
   * MCP servers
   */

  public String mcpSection(Collection<McpDecl> servers)
      throws InvalidDeclarationException {
    List<String> inits = new ArrayList<String>();
    for (McpDecl server: servers) {
      inits.add(mcpServer(server));
    }
    return "// Initialize MCP servers using LlamaIndex\n" +
           "// Track all MCP servers for cleanup\n" +
           "const __mcpServers = [];\n\n" +
           StringUtils.join(inits, "\n\n");
  }

  String mcpServer(McpDecl decl) throws InvalidDeclarationException {
    String name = decl.getName();
    logger.debug("Emitting mcp server " + name);
    Map<String, Object> config = ConfigValues.extract(decl.getConfig());
    String serverConfig = mcpServerConfig(name, config);

    StringBuilder sb = new StringBuilder();
    sb.append("// Connect to ").append(name)
      .append(" MCP server using LlamaIndex\n");
    sb.append("const __").append(name).append("_server = __llamaindex_mcp(")
      .append(serverConfig).append(");\n\n");
    sb.append("// Register for cleanup\n");
    sb.append("__mcpServers.push(__").append(name).append("_server);\n\n");
    sb.append("// Get tools from MCP server\n");
    sb.append("const __").append(name).append("_tools = await __")
      .append(name).append("_server.tools();\n\n");
    sb.append(StringUtils.replace(proxyTemplate(), NAME_PLACEHOLDER, name));
    return sb.toString();
  }

  /**
   * Transport configuration: url selects a remote server, command a
   * local subprocess
   */
  String mcpServerConfig(String name, Map<String, Object> config)
      throws InvalidDeclarationException {
    List<String> params = new ArrayList<String>();
    if (ConfigValues.isTruthy(config.get("url"))) {
      params.add("url: " + ConfigValues.toJson(config.get("url")));
      addIfPresent(params, config, "verbose");
      addIfPresent(params, config, "useSSETransport");
    } else if (ConfigValues.isTruthy(config.get("command"))) {
      params.add("command: " + ConfigValues.toJson(config.get("command")));
      Object args = config.get("args");
      if (args instanceof List) {
        params.add("args: " + ConfigValues.serialize(args));
      }
      if (config.get("stderr") != null) {
        params.add("stderr: " +
                   ConfigValues.serializeValue(config.get("stderr")));
      }
      addIfPresent(params, config, "verbose");
    } else {
      throw new InvalidDeclarationException("Invalid MCP configuration for "
              + name + ": must specify either 'url' or 'command'");
    }
    return "{ " + StringUtils.join(params, ", ") + " }";
  }

  private static void addIfPresent(List<String> params,
                                   Map<String, Object> config, String key) {
    Object value = config.get(key);
    if (value != null) {
      params.add(key + ": " + ConfigValues.serialize(value));
    }
  }

  private String proxyTemplate() {
    if (proxyTemplate == null) {
      InputStream in = DeclarationEmitter.class.getResourceAsStream(
                                                          PROXY_TEMPLATE);
      if (in == null) {
        throw new MscRuntimeError("Missing resource: " + PROXY_TEMPLATE);
      }
      try {
        try {
          proxyTemplate = StringUtils.stripEnd(
                  IOUtils.toString(in, StandardCharsets.UTF_8), "\n");
        } finally {
          in.close();
        }
      } catch (IOException e) {
        throw new MscRuntimeError("Could not read resource " +
                                  PROXY_TEMPLATE + ": " + e.getMessage());
      }
    }
    return proxyTemplate;
  }

  /*
   * Models
   */

  private static enum Provider {
    OPENAI("OpenAI", true, "maxTokens"),
    ANTHROPIC("Anthropic", false, "maxTokens"),
    GEMINI("Gemini", false, "maxOutputTokens");

    /** Suffix of the runtime constructor */
    final String className;
    final boolean hasBaseURL;
    /** Name the token limit is passed under */
    final String maxTokensKey;

    private Provider(String className, boolean hasBaseURL,
                     String maxTokensKey) {
      this.className = className;
      this.hasBaseURL = hasBaseURL;
      this.maxTokensKey = maxTokensKey;
    }

    static Provider fromName(String name) {
      for (Provider p: values()) {
        if (p.name().equalsIgnoreCase(name)) {
          return p;
        }
      }
      return null;
    }
  }

  public String modelSection(Collection<ModelDecl> models)
      throws InvalidDeclarationException {
    List<String> inits = new ArrayList<String>();
    for (ModelDecl model: models) {
      inits.add(model(model));
    }
    return "// Initialize model configurations\n" +
           "const __models = {};\n\n" +
           StringUtils.join(inits, "\n\n");
  }

  String model(ModelDecl decl) throws InvalidDeclarationException {
    String name = decl.getName();
    logger.debug("Emitting model " + name);
    Map<String, Object> config = ConfigValues.extract(decl.getConfig());
    Object providerVal = config.get("provider");
    if (!ConfigValues.isTruthy(providerVal)) {
      throw new InvalidDeclarationException("Model \"" + name +
          "\" must specify a provider (openai, anthropic, or gemini)");
    }
    String providerName = ConfigValues.toText(providerVal);
    Provider provider = Provider.fromName(providerName);
    if (provider == null) {
      throw new InvalidDeclarationException(
                    "Unsupported model provider: " + providerName);
    }

    // Unrecognized keys are dropped
    List<String> params = new ArrayList<String>();
    if (ConfigValues.isTruthy(config.get("apiKey"))) {
      params.add("apiKey: " + ConfigValues.serializeValue(config.get("apiKey")));
    }
    if (ConfigValues.isTruthy(config.get("model"))) {
      params.add("model: " + ConfigValues.serializeValue(config.get("model")));
    }
    if (config.get("temperature") != null) {
      params.add("temperature: " +
                 ConfigValues.serializeValue(config.get("temperature")));
    }
    if (config.get("maxTokens") != null) {
      params.add(provider.maxTokensKey + ": " +
                 ConfigValues.serializeValue(config.get("maxTokens")));
    }
    if (provider.hasBaseURL && ConfigValues.isTruthy(config.get("baseURL"))) {
      params.add("baseURL: " +
                 ConfigValues.serializeValue(config.get("baseURL")));
    }

    String args = params.isEmpty() ? "{}" :
                  "{ " + StringUtils.join(params, ", ") + " }";
    return "// Model configuration for " + name + "\n" +
           "const " + name + " = new __llamaindex_" + provider.className +
           "(" + args + ");\n" +
           "__models." + name + " = " + name + ";";
  }

  /*
   * Agents
   */

  /**
   * @param mcpServers names of declared servers.  A server named in an
   *        agent's tool list contributes all of its tools.
   */
  public String agentSection(Collection<AgentDecl> agents,
                             Set<String> mcpServers)
      throws InvalidDeclarationException {
    List<String> inits = new ArrayList<String>();
    for (AgentDecl agent: agents) {
      inits.add(agent(agent, mcpServers));
    }
    return "// Initialize agent configurations\n" +
           StringUtils.join(inits, "\n\n");
  }

  String agent(AgentDecl decl, Set<String> mcpServers)
      throws InvalidDeclarationException {
    String name = decl.getName();
    logger.debug("Emitting agent " + name);
    Map<String, Object> config = ConfigValues.extract(decl.getConfig());
    Object model = config.get("model");
    if (!ConfigValues.isTruthy(model)) {
      throw new InvalidDeclarationException("Agent \"" + name +
                                  "\" must specify a model reference");
    }

    List<String> params = new ArrayList<String>();
    params.add("name: " + JsUtil.jsonQuote(name));
    if (ConfigValues.isTruthy(config.get("description"))) {
      params.add("description: " +
                 ConfigValues.toJson(config.get("description")));
    }
    if (ConfigValues.isTruthy(config.get("systemPrompt"))) {
      params.add("systemPrompt: " +
                 ConfigValues.toJson(config.get("systemPrompt")));
    }
    Expression tools = decl.getConfig().get("tools");
    if (tools != null && tools.kind() == Expression.Kind.ARRAY) {
      List<String> refs = new ArrayList<String>();
      for (Expression elem: ((ArrayLit)tools).getElements()) {
        refs.add(toolReference(elem, mcpServers));
      }
      params.add("tools: [" + StringUtils.join(refs, ", ") + "]");
    }
    params.add("llm: " + ConfigValues.toText(model));

    return "// Agent configuration for " + name + "\n" +
           "const " + name + " = new __Agent({\n" +
           "  " + StringUtils.join(params, ",\n  ") + "\n" +
           "});";
  }

  private String toolReference(Expression ref, Set<String> mcpServers) {
    if (ref.kind() == Expression.Kind.IDENTIFIER) {
      String refName = ((Identifier)ref).getName();
      if (mcpServers.contains(refName)) {
        return "...__" + refName + "_tools";
      }
      return refName;
    }
    return exprs.emit(ref);
  }

  /*
   * User-defined tools
   */

  /**
   * Emit a tool.  Its body gets a fresh scope in which the parameters
   * are already declared.
   */
  public UserTool tool(ToolDecl decl, StatementEmitter stmts) {
    logger.debug("Emitting tool " + decl.getName());
    List<String> params = new ArrayList<String>();
    List<String> quotedParams = new ArrayList<String>();
    for (ToolParameter param: decl.getParameters()) {
      params.add(param.getName());
      quotedParams.add(JsUtil.jsonQuote(param.getName()));
    }

    Sequence body;
    stmts.pushScope();
    try {
      for (String param: params) {
        stmts.declare(param);
      }
      body = stmts.emitStatements(decl.getBody().getStatements());
    } finally {
      stmts.popScope();
    }

    Map<String, SchemaDescriptor> paramSchemas =
                        schemas.compileParameters(decl.getParameters());
    return new UserTool(decl.getName(), JsUtil.jsonQuote(decl.getName()),
            params, quotedParams, body,
            SchemaDescriptor.renderProperties(paramSchemas));
  }
}
