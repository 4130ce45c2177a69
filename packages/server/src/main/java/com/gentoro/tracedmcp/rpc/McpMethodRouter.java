package com.gentoro.tracedmcp.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tracedmcp.tools.Tool;
import com.gentoro.tracedmcp.tools.ToolException;
import com.gentoro.tracedmcp.tools.ToolRegistry;
import com.gentoro.tracedmcp.trace.SpanAttributes;
import com.gentoro.tracedmcp.trace.SpanHandle;
import com.gentoro.tracedmcp.trace.SpanRecorder;
import com.gentoro.tracedmcp.trace.TraceContextStore;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import com.gentoro.tracedmcp.utility.StringUtility;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse;
import io.opentelemetry.api.trace.StatusCode;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Terminal handler: maps MCP method names onto their implementations. */
public class McpMethodRouter implements RpcHandler {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(McpMethodRouter.class);

  private static final TypeReference<Map<String, Object>> STRUCTURED = new TypeReference<>() {};

  /** Oldest first; the last entry is offered when the client asks for something unknown. */
  public static final List<String> SUPPORTED_PROTOCOL_VERSIONS =
      List.of("2024-11-05", "2025-03-26", "2025-06-18");

  private final ToolRegistry registry;
  private final SpanRecorder recorder;
  private final TraceContextStore sessions;
  private final ServerIdentity identity;
  private final boolean structuredResults;

  public McpMethodRouter(
      ToolRegistry registry,
      SpanRecorder recorder,
      TraceContextStore sessions,
      ServerIdentity identity,
      boolean structuredResults) {
    this.registry = registry;
    this.recorder = recorder;
    this.sessions = sessions;
    this.identity = identity;
    this.structuredResults = structuredResults;
  }

  @Override
  public JSONRPCResponse handle(RpcExchange exchange) {
    String method = exchange.method();
    Object result =
        switch (method) {
          case McpSchema.METHOD_INITIALIZE -> initialize(exchange);
          case McpSchema.METHOD_NOTIFICATION_INITIALIZED, McpSchema.METHOD_PING ->
              JsonNodeFactory.instance.objectNode();
          case McpSchema.METHOD_TOOLS_LIST -> new McpSchema.ListToolsResult(
              registry.definitions(), null);
          case McpSchema.METHOD_TOOLS_CALL -> callTool(exchange);
          default -> throw RpcException.methodNotFound(method);
        };
    return exchange.isNotification() ? null : RpcMessages.success(exchange.requestId(), result);
  }

  private McpSchema.InitializeResult initialize(RpcExchange exchange) {
    JsonNode params = exchange.params();
    String requested = params == null ? null : params.path("protocolVersion").asText(null);
    String negotiated =
        requested != null && SUPPORTED_PROTOCOL_VERSIONS.contains(requested)
            ? requested
            : SUPPORTED_PROTOCOL_VERSIONS.get(SUPPORTED_PROTOCOL_VERSIONS.size() - 1);

    String sessionId = sessions.createSession();
    sessions.remember(sessionId, exchange.traceContext());
    exchange.sessionId(sessionId);
    exchange.responseHeaders().put(RpcExchange.SESSION_HEADER, sessionId);
    log.info("Initialized session {} (protocol {})", sessionId, negotiated);

    return new McpSchema.InitializeResult(
        negotiated,
        McpSchema.ServerCapabilities.builder().tools(false).build(),
        new McpSchema.Implementation(identity.name(), identity.version()),
        StringUtility.isBlank(identity.instructions()) ? null : identity.instructions());
  }

  private Object callTool(RpcExchange exchange) {
    JsonNode params = exchange.params();
    JsonNode nameNode = params == null ? null : params.get("name");
    if (nameNode == null || !nameNode.isTextual()) {
      throw RpcException.invalidParams("params.name must be a string", null);
    }
    String name = nameNode.asText();
    JsonNode arguments = params.get("arguments");
    if (arguments == null || !arguments.isObject()) {
      throw RpcException.invalidParams("params.arguments must be an object", toolData(name));
    }

    Optional<Tool> tool = registry.find(name);
    if (tool.isEmpty()) {
      log.debug("tools/call for unknown tool '{}'", name);
      throw RpcException.invalidParams("Unknown tool: " + name, toolData(name));
    }

    SpanHandle span = recorder.startSpan(exchange.traceContext(), name);
    try {
      RpcSpans.describeRequest(span, exchange);
      span.setAttribute(SpanAttributes.MCP_TOOL_NAME, name);
      span.setAttribute(SpanAttributes.MCP_TOOL_INPUT, JacksonUtility.toJson(arguments));

      JsonNode output = registry.invoke(name, arguments, span);
      span.setAttribute(SpanAttributes.MCP_TOOL_OUTPUT, JacksonUtility.toJson(output));
      span.setStatus(StatusCode.OK);
      return structuredResults ? callToolResult(output) : output;
    } catch (ToolException e) {
      RpcException rpc = ToolErrors.toRpcException(e);
      RpcSpans.recordError(span, rpc.toError());
      throw rpc;
    } catch (RuntimeException e) {
      RpcSpans.recordFailure(span, e);
      throw e;
    } finally {
      span.end();
    }
  }

  static ObjectNode toolData(String name) {
    return JsonNodeFactory.instance.objectNode().put("tool", name);
  }

  /** Text content always; structured content only for object outputs. */
  static McpSchema.CallToolResult callToolResult(JsonNode output) {
    McpSchema.CallToolResult.Builder result =
        McpSchema.CallToolResult.builder().addTextContent(JacksonUtility.toJson(output));
    if (output != null && output.isObject()) {
      result.structuredContent(JacksonUtility.getJsonMapper().convertValue(output, STRUCTURED));
    }
    return result.isError(false).build();
  }
}
