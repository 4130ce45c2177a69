package com.gentoro.tracedmcp.rpc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse;
import java.util.Map;

/**
 * What the transport should send back: the HTTP status, extra headers and the JSON-RPC response
 * (null for notifications).
 */
public record RpcOutcome(int httpStatus, JSONRPCResponse response, Map<String, String> headers) {
  public static final int OK = 200;
  public static final int ACCEPTED = 202;
  public static final int BAD_REQUEST = 400;

  public RpcOutcome {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public boolean hasBody() {
    return response != null;
  }

  /** The response body as JSON, or null when there is none. */
  public ObjectNode body() {
    return response == null ? null : RpcMessages.toJson(response);
  }
}
