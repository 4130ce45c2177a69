package com.gentoro.tracedmcp.rpc;

import com.gentoro.tracedmcp.trace.SpanHandle;
import com.gentoro.tracedmcp.trace.SpanRecorder;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCResponse;
import io.opentelemetry.api.trace.StatusCode;
import java.util.Set;

/**
 * Wraps every method in a server span named after it. Methods listed as self-traced (tools/call)
 * pass straight through; they open their own span once they know what they are running.
 */
public class RequestSpanMiddleware implements RpcMiddleware {
  private final SpanRecorder recorder;
  private final Set<String> selfTracedMethods;

  public RequestSpanMiddleware(SpanRecorder recorder, Set<String> selfTracedMethods) {
    this.recorder = recorder;
    this.selfTracedMethods = Set.copyOf(selfTracedMethods);
  }

  @Override
  public JSONRPCResponse handle(RpcExchange exchange, RpcHandler next) {
    if (selfTracedMethods.contains(exchange.method())) {
      return next.handle(exchange);
    }

    SpanHandle span = recorder.startSpan(exchange.traceContext(), exchange.method());
    RpcSpans.describeRequest(span, exchange);
    try {
      JSONRPCResponse response = next.handle(exchange);
      if (RpcMessages.isError(response)) {
        RpcSpans.recordError(span, response.error());
      } else {
        span.setStatus(StatusCode.OK);
      }
      return response;
    } catch (RpcException e) {
      RpcSpans.recordError(span, e.toError());
      throw e;
    } catch (RuntimeException e) {
      RpcSpans.recordFailure(span, e);
      throw e;
    } finally {
      span.end();
    }
  }
}
