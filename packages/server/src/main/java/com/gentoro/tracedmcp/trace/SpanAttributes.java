package com.gentoro.tracedmcp.trace;

import io.opentelemetry.api.common.AttributeKey;

/** Attribute keys recorded on server spans. */
public final class SpanAttributes {
  private SpanAttributes() {}

  public static final AttributeKey<String> RPC_SYSTEM = AttributeKey.stringKey("rpc.system");
  public static final AttributeKey<String> RPC_METHOD = AttributeKey.stringKey("rpc.method");
  public static final AttributeKey<String> RPC_JSONRPC_REQUEST_ID =
      AttributeKey.stringKey("rpc.jsonrpc.request_id");
  public static final AttributeKey<Long> RPC_JSONRPC_ERROR_CODE =
      AttributeKey.longKey("rpc.jsonrpc.error_code");
  public static final AttributeKey<String> MCP_SESSION_ID = AttributeKey.stringKey("mcp.session.id");
  public static final AttributeKey<String> MCP_TOOL_NAME = AttributeKey.stringKey("mcp.tool.name");
  public static final AttributeKey<String> MCP_TOOL_INPUT = AttributeKey.stringKey("mcp.tool.input");
  public static final AttributeKey<String> MCP_TOOL_OUTPUT =
      AttributeKey.stringKey("mcp.tool.output");
  public static final AttributeKey<String> ERROR_KIND = AttributeKey.stringKey("error.kind");
  public static final AttributeKey<String> ERROR_MESSAGE = AttributeKey.stringKey("error.message");
  public static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  public static final AttributeKey<String> SERVICE_VERSION =
      AttributeKey.stringKey("service.version");

  public static final String RPC_SYSTEM_JSONRPC = "jsonrpc";
}
