package com.gentoro.tracedmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.tracedmcp.exception.ExceptionUtil;
import com.gentoro.tracedmcp.trace.SpanHandle;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name-indexed set of tools. Populated at startup and read-only afterwards, so lookups need no
 * locking once the server accepts requests.
 */
public class ToolRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(ToolRegistry.class);

  public static final String CONTEXT_VIOLATIONS = "violations";
  public static final String CONTEXT_DETAIL = "detail";

  private final Map<String, Tool> tools = new LinkedHashMap<>();

  public synchronized ToolRegistry register(Tool tool) {
    String name = tool.name();
    if (tools.containsKey(name)) {
      throw new ToolException(
          ToolErrorKind.ALREADY_EXISTS, name, "Tool already registered: " + name);
    }
    tools.put(name, tool);
    log.info("Registered tool '{}'", name);
    return this;
  }

  public synchronized Optional<Tool> find(String name) {
    return Optional.ofNullable(name == null ? null : tools.get(name));
  }

  /** MCP tool definitions in registration order. */
  public synchronized List<McpSchema.Tool> definitions() {
    List<McpSchema.Tool> result = new ArrayList<>(tools.size());
    for (Tool t : tools.values()) {
      result.add(t.descriptor().definition());
    }
    return Collections.unmodifiableList(result);
  }

  public synchronized int size() {
    return tools.size();
  }

  /**
   * Validate {@code arguments} against the tool's input schema and run it.
   *
   * @throws ToolException with kind NOT_FOUND, INVALID_PARAMS or EXECUTION_FAILED
   */
  public JsonNode invoke(String name, JsonNode arguments, SpanHandle span) {
    Tool tool =
        find(name)
            .orElseThrow(
                () -> new ToolException(ToolErrorKind.NOT_FOUND, name, "Unknown tool: " + name));

    ToolInvocation invocation = new ToolInvocation(name, arguments, span);
    List<String> violations = tool.descriptor().inputSchema().validate(invocation.arguments());
    if (!violations.isEmpty()) {
      log.debug("Rejected arguments for tool '{}': {}", name, violations);
      throw new ToolException(
          ToolErrorKind.INVALID_PARAMS,
          name,
          "Invalid arguments for tool " + name,
          Map.of(CONTEXT_VIOLATIONS, List.copyOf(violations)),
          null);
    }

    try {
      return tool.execute(invocation);
    } catch (ToolException e) {
      throw e;
    } catch (Exception e) {
      String detail = ExceptionUtil.describe(e);
      log.warn("Tool '{}' failed: {}", name, detail);
      log.debug("Tool failure stack trace:\n{}", ExceptionUtil.formatCompactStackTrace(e));
      throw new ToolException(
          ToolErrorKind.EXECUTION_FAILED,
          name,
          "Tool " + name + " failed: " + detail,
          Map.of(CONTEXT_DETAIL, detail),
          e);
    }
  }
}
