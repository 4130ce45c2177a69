package com.gentoro.tracedmcp.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCMessage;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCNotification;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCRequest;
import java.io.IOException;

/**
 * Turns a request body into a {@link JSONRPCRequest}, or a {@link JSONRPCNotification} when the
 * body has no {@code id} member. Params are kept as a {@link JsonNode}. Every rejection is a parse
 * error.
 *
 * <p>Request ids must be a string or an integer; {@code null} and fractional ids are rejected.
 */
public class JsonRpcParser {
  private final ObjectMapper mapper;

  public JsonRpcParser() {
    this(JacksonUtility.getJsonMapper());
  }

  public JsonRpcParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public JSONRPCMessage parse(byte[] body) {
    if (body == null || body.length == 0) {
      throw RpcException.parseError("empty body");
    }
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw RpcException.parseError(e.getOriginalMessage());
    } catch (IOException e) {
      throw RpcException.parseError(e.getMessage());
    }
    if (root == null || !root.isObject()) {
      throw RpcException.parseError("request must be a JSON object");
    }

    JsonNode version = root.get("jsonrpc");
    if (version == null
        || !version.isTextual()
        || !McpSchema.JSONRPC_VERSION.equals(version.asText())) {
      throw RpcException.parseError("jsonrpc must be \"2.0\"");
    }
    JsonNode method = root.get("method");
    if (method == null || !method.isTextual() || method.asText().isEmpty()) {
      throw RpcException.parseError("method must be a non-empty string");
    }
    JsonNode params = root.get("params");
    if (params != null && params.isNull()) {
      params = null;
    }

    if (!root.has("id")) {
      return new JSONRPCNotification(McpSchema.JSONRPC_VERSION, method.asText(), params);
    }
    return new JSONRPCRequest(
        McpSchema.JSONRPC_VERSION, method.asText(), requestId(root.get("id")), params);
  }

  private static Object requestId(JsonNode id) {
    if (id.isTextual()) {
      return id.asText();
    }
    if (id.isIntegralNumber() && id.canConvertToLong()) {
      return id.canConvertToInt() ? (Object) id.intValue() : (Object) id.longValue();
    }
    throw RpcException.parseError("id must be a string or an integer");
  }
}
