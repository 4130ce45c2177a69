package com.gentoro.tracedmcp.rpc;

import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse;
import java.util.List;

/** One link of the dispatch chain. Implementations call {@code next} at most once. */
@FunctionalInterface
public interface RpcMiddleware {
  JSONRPCResponse handle(RpcExchange exchange, RpcHandler next);

  /** Compose {@code middlewares} in order around {@code terminal}. */
  static RpcHandler chain(List<RpcMiddleware> middlewares, RpcHandler terminal) {
    RpcHandler handler = terminal;
    for (int i = middlewares.size() - 1; i >= 0; i--) {
      RpcMiddleware middleware = middlewares.get(i);
      RpcHandler next = handler;
      handler = exchange -> middleware.handle(exchange, next);
    }
    return handler;
  }
}
