package com.gentoro.tracedmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An executable, schema-described capability exposed through {@code tools/call}.
 *
 * <p>{@link #execute} only runs with arguments that already passed the descriptor's input schema.
 * Any exception it throws is reported to the caller as an execution failure.
 */
public interface Tool {
  ToolDescriptor descriptor();

  JsonNode execute(ToolInvocation invocation) throws Exception;

  default String name() {
    return descriptor().name();
  }
}
