package com.gentoro.tracedmcp.rpc;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse.JSONRPCError;

/** Builds and renders JSON-RPC responses. A response carries a result or an error, never both. */
public final class RpcMessages {
  private RpcMessages() {}

  /** A null {@code result} is answered with an empty object. */
  public static JSONRPCResponse success(Object id, Object result) {
    return new JSONRPCResponse(
        McpSchema.JSONRPC_VERSION,
        id,
        result == null ? JsonNodeFactory.instance.objectNode() : result,
        null);
  }

  public static JSONRPCResponse failure(Object id, JSONRPCError error) {
    return new JSONRPCResponse(McpSchema.JSONRPC_VERSION, id, null, error);
  }

  public static boolean isError(JSONRPCResponse response) {
    return response != null && response.error() != null;
  }

  /**
   * Render {@code response} as a JSON object. The {@code id} member is always written, as {@code
   * null} when the request id could not be read.
   */
  public static ObjectNode toJson(JSONRPCResponse response) {
    ObjectNode node = JacksonUtility.getJsonMapper().valueToTree(response);
    if (!node.hasNonNull("id")) {
      node.putNull("id");
    }
    return node;
  }
}
