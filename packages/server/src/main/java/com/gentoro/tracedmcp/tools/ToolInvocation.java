package com.gentoro.tracedmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gentoro.tracedmcp.trace.SpanHandle;

/** Arguments of one tool call plus access to the span that wraps it. */
public final class ToolInvocation {
  private final String toolName;
  private final JsonNode arguments;
  private final SpanHandle span;

  public ToolInvocation(String toolName, JsonNode arguments, SpanHandle span) {
    this.toolName = toolName;
    this.arguments = arguments == null ? JsonNodeFactory.instance.objectNode() : arguments;
    this.span = span;
  }

  public String toolName() {
    return toolName;
  }

  public JsonNode arguments() {
    return arguments;
  }

  public String requireString(String name) {
    return arguments.path(name).asText();
  }

  /**
   * Integral argument read at full width. Values beyond the {@code long} range saturate to its
   * bounds, so callers can clamp before narrowing.
   */
  public long longOrDefault(String name, long defaultValue) {
    JsonNode v = arguments.get(name);
    if (v == null || !v.isNumber()) return defaultValue;
    if (v.canConvertToLong()) return v.asLong();
    return v.asDouble() > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
  }

  public ToolInvocation attribute(String key, String value) {
    if (span != null) span.setAttribute(key, value);
    return this;
  }

  public ToolInvocation attribute(String key, long value) {
    if (span != null) span.setAttribute(key, value);
    return this;
  }
}
