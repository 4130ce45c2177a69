package com.gentoro.tracedmcp.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.tracedmcp.exception.StateException;
import com.gentoro.tracedmcp.trace.TraceContext;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCMessage;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCNotification;
import io.modelcontextprotocol.spec.McpSchema.JSONRPCRequest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-request state shared by the middleware chain. Owned by the thread handling the request and
 * never shared.
 */
public final class RpcExchange {
  public static final String SESSION_HEADER = "Mcp-Session-Id";

  private final Map<String, String> headers;
  private final Map<String, String> responseHeaders = new LinkedHashMap<>();
  private RpcState state = RpcState.RECEIVED;
  private JSONRPCMessage message;
  private TraceContext traceContext;
  private String sessionId;

  public RpcExchange(Map<String, String> headers) {
    Map<String, String> normalized = new LinkedHashMap<>();
    if (headers != null) {
      headers.forEach(
          (k, v) -> {
            if (k != null && v != null) normalized.put(k.toLowerCase(Locale.ROOT), v);
          });
    }
    this.headers = Collections.unmodifiableMap(normalized);
    this.sessionId = header(SESSION_HEADER);
  }

  /** Request headers, names lowercased. */
  public Map<String, String> headers() {
    return headers;
  }

  public String header(String name) {
    return headers.get(name.toLowerCase(Locale.ROOT));
  }

  public RpcState state() {
    return state;
  }

  void advance(RpcState next) {
    if (next.ordinal() < state.ordinal()) {
      throw new StateException("Cannot move request from " + state + " back to " + next);
    }
    state = next;
  }

  /** The parsed {@link JSONRPCRequest} or {@link JSONRPCNotification}. */
  public JSONRPCMessage message() {
    return message;
  }

  void message(JSONRPCMessage message) {
    if (!(message instanceof JSONRPCRequest || message instanceof JSONRPCNotification)) {
      throw new StateException("Not a request: " + message);
    }
    this.message = message;
  }

  public boolean isNotification() {
    return message instanceof JSONRPCNotification;
  }

  public String method() {
    if (message instanceof JSONRPCRequest request) return request.method();
    return ((JSONRPCNotification) message).method();
  }

  /** String or integer id; null for a notification. */
  public Object requestId() {
    return message instanceof JSONRPCRequest request ? request.id() : null;
  }

  /** May be null when the request carried no params. */
  public JsonNode params() {
    Object params =
        message instanceof JSONRPCRequest request
            ? request.params()
            : ((JSONRPCNotification) message).params();
    return params instanceof JsonNode node ? node : null;
  }

  /** Parent context for spans opened while serving this request. */
  public TraceContext traceContext() {
    return traceContext;
  }

  public void traceContext(TraceContext traceContext) {
    this.traceContext = traceContext;
  }

  public String sessionId() {
    return sessionId;
  }

  public void sessionId(String sessionId) {
    this.sessionId = sessionId;
  }

  public Map<String, String> responseHeaders() {
    return responseHeaders;
  }
}
