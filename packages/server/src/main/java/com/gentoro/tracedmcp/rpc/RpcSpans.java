package com.gentoro.tracedmcp.rpc;

import com.gentoro.tracedmcp.trace.SpanAttributes;
import com.gentoro.tracedmcp.trace.SpanHandle;
import io.modelcontextprotocol.spec.McpSchema.ErrorCodes;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse.JSONRPCError;

final class RpcSpans {
  private RpcSpans() {}

  static void describeRequest(SpanHandle span, RpcExchange exchange) {
    span.setAttribute(SpanAttributes.RPC_SYSTEM, SpanAttributes.RPC_SYSTEM_JSONRPC);
    span.setAttribute(SpanAttributes.RPC_METHOD, exchange.method());
    if (exchange.requestId() != null) {
      span.setAttribute(SpanAttributes.RPC_JSONRPC_REQUEST_ID, String.valueOf(exchange.requestId()));
    }
    if (exchange.sessionId() != null) {
      span.setAttribute(SpanAttributes.MCP_SESSION_ID, exchange.sessionId());
    }
  }

  static void recordError(SpanHandle span, JSONRPCError error) {
    int code = error.code();
    span.setAttribute(SpanAttributes.RPC_JSONRPC_ERROR_CODE, (long) code);
    span.recordError(kindOf(code), error.message());
  }

  /** An unexpected exception escaped a handler: reported as an internal error. */
  static void recordFailure(SpanHandle span, RuntimeException e) {
    span.setAttribute(SpanAttributes.RPC_JSONRPC_ERROR_CODE, (long) ErrorCodes.INTERNAL_ERROR);
    span.recordException(e);
    span.recordError(e.getClass().getSimpleName(), String.valueOf(e.getMessage()));
  }

  static String kindOf(int code) {
    return switch (code) {
      case ErrorCodes.PARSE_ERROR -> "ParseError";
      case ErrorCodes.METHOD_NOT_FOUND -> "MethodNotFound";
      case ErrorCodes.INVALID_PARAMS -> "InvalidParams";
      case RpcException.EXECUTION_FAILED -> "ExecutionFailed";
      default -> "InternalError";
    };
  }
}
