package com.gentoro.tracedmcp.rpc;

import com.gentoro.tracedmcp.exception.ExceptionUtil;
import io.modelcontextprotocol.spec.McpSchema.ErrorCodes;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import java.util.List;
import java.util.Map;

/**
 * Runs one request through {@code RECEIVED -> PARSED -> AUTHORIZED -> DISPATCHING -> COMPLETED}.
 *
 * <p>Every non-notification request yields exactly one response; every failure, expected or not,
 * is converted to a JSON-RPC error here so that the transport never sees an exception. Spans
 * opened by the chain are closed before this method returns.
 */
public class RpcDispatcher {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(RpcDispatcher.class);

  private final JsonRpcParser parser;
  private final RpcHandler chain;

  public RpcDispatcher(JsonRpcParser parser, List<RpcMiddleware> middlewares, RpcHandler router) {
    this.parser = parser;
    this.chain = RpcMiddleware.chain(middlewares, router);
  }

  public RpcOutcome dispatch(byte[] body, Map<String, String> headers) {
    RpcExchange exchange = new RpcExchange(headers);
    try {
      exchange.message(parser.parse(body));
    } catch (RpcException e) {
      log.debug("Rejected request body: {}", e.getMessage());
      exchange.advance(RpcState.COMPLETED);
      return new RpcOutcome(
          RpcOutcome.BAD_REQUEST, RpcMessages.failure(null, e.toError()), Map.of());
    }
    exchange.advance(RpcState.PARSED);
    // no authentication: every parsed request is authorized
    exchange.advance(RpcState.AUTHORIZED);
    exchange.advance(RpcState.DISPATCHING);

    Object id = exchange.requestId();
    JSONRPCResponse response;
    try {
      response = chain.handle(exchange);
    } catch (RpcException e) {
      log.debug("{} (id {}) failed: {}", exchange.method(), id, e.getMessage());
      response = RpcMessages.failure(id, e.toError());
    } catch (RuntimeException e) {
      log.error(
          "Unexpected failure while handling {} (id {}):\n{}",
          exchange.method(),
          id,
          ExceptionUtil.formatCompactStackTrace(e));
      response =
          RpcMessages.failure(
              id, new JSONRPCError(ErrorCodes.INTERNAL_ERROR, "Internal error", null));
    }
    exchange.advance(RpcState.COMPLETED);

    if (exchange.isNotification()) {
      return new RpcOutcome(RpcOutcome.ACCEPTED, null, exchange.responseHeaders());
    }
    if (response == null) {
      response = RpcMessages.success(id, null);
    }
    return new RpcOutcome(RpcOutcome.OK, response, exchange.responseHeaders());
  }
}
