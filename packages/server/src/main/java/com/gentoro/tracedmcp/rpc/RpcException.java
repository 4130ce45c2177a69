package com.gentoro.tracedmcp.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.tracedmcp.exception.TracedMcpErrorCode;
import com.gentoro.tracedmcp.exception.TracedMcpException;
import io.modelcontextprotocol.spec.McpSchema.ErrorCodes;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse.JSONRPCError;

/** A failure that is reported to the caller as a JSON-RPC error object. */
public class RpcException extends TracedMcpException {
  /** Server-defined: the tool ran and failed. */
  public static final int EXECUTION_FAILED = -32000;

  private final int rpcCode;
  private final transient JsonNode data;

  public RpcException(int rpcCode, String message, JsonNode data) {
    this(rpcCode, message, data, null);
  }

  public RpcException(int rpcCode, String message, JsonNode data, Throwable cause) {
    super(TracedMcpErrorCode.PROTOCOL_ERROR, message, cause);
    this.rpcCode = rpcCode;
    this.data = data;
  }

  public int getRpcCode() {
    return rpcCode;
  }

  public JsonNode getData() {
    return data;
  }

  public JSONRPCError toError() {
    return new JSONRPCError(rpcCode, getMessage(), data);
  }

  public static RpcException parseError(String message) {
    return new RpcException(ErrorCodes.PARSE_ERROR, "Parse error: " + message, null);
  }

  public static RpcException methodNotFound(String method) {
    ObjectNode data = JsonNodeFactory.instance.objectNode().put("method", method);
    return new RpcException(ErrorCodes.METHOD_NOT_FOUND, "Method not found: " + method, data);
  }

  public static RpcException invalidParams(String message, JsonNode data) {
    return new RpcException(ErrorCodes.INVALID_PARAMS, message, data);
  }

  public static RpcException internal(String message, Throwable cause) {
    return new RpcException(ErrorCodes.INTERNAL_ERROR, message, null, cause);
  }
}
