package com.gentoro.tracedmcp.rpc;

import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse;

/** Produces the response for a parsed request; returns null for notifications. */
@FunctionalInterface
public interface RpcHandler {
  JSONRPCResponse handle(RpcExchange exchange);
}
