package com.gentoro.tracedmcp.rpc;

import com.gentoro.tracedmcp.trace.TraceContext;
import com.gentoro.tracedmcp.trace.TraceContextCodec;
import com.gentoro.tracedmcp.trace.TraceContextStore;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse;

/**
 * Resolves the parent trace context of a request: a valid {@code traceparent} header wins and is
 * remembered for the session; without one, the session's last context is reused; otherwise the
 * request starts a new trace.
 */
public class ContextPropagationMiddleware implements RpcMiddleware {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(ContextPropagationMiddleware.class);

  private final TraceContextCodec codec;
  private final TraceContextStore store;

  public ContextPropagationMiddleware(TraceContextCodec codec, TraceContextStore store) {
    this.codec = codec;
    this.store = store;
  }

  @Override
  public JSONRPCResponse handle(RpcExchange exchange, RpcHandler next) {
    TraceContext context = codec.extract(exchange.headers());
    String sessionId = exchange.sessionId();
    if (sessionId != null && store.hasSession(sessionId)) {
      if (context.isRoot()) {
        TraceContext stored = store.lookup(sessionId).orElse(null);
        if (stored != null) {
          log.debug("Using stored trace context for session {}", sessionId);
          context = stored;
        }
      } else {
        store.remember(sessionId, context);
      }
    }
    exchange.traceContext(context);
    return next.handle(exchange);
  }
}
