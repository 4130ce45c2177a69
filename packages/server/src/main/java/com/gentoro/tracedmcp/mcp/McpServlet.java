package com.gentoro.tracedmcp.mcp;

import com.gentoro.tracedmcp.rpc.RpcDispatcher;
import com.gentoro.tracedmcp.rpc.RpcExchange;
import com.gentoro.tracedmcp.rpc.RpcOutcome;
import com.gentoro.tracedmcp.trace.TraceContextStore;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streamable HTTP transport, POST flavour only: one JSON-RPC request per POST, one JSON response.
 *
 * <p>By the time the response is written every span of the request has been closed and handed to
 * the exporter, so a client that disconnects early cannot lose or corrupt a span.
 */
public class McpServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(McpServlet.class);

  static final String JSON = "application/json";

  private final transient RpcDispatcher dispatcher;
  private final transient TraceContextStore sessions;
  private final boolean disallowDelete;

  public McpServlet(RpcDispatcher dispatcher, TraceContextStore sessions, boolean disallowDelete) {
    this.dispatcher = dispatcher;
    this.sessions = sessions;
    this.disallowDelete = disallowDelete;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    byte[] body = req.getInputStream().readAllBytes();
    RpcOutcome outcome = dispatcher.dispatch(body, headers(req));

    resp.setStatus(outcome.httpStatus());
    outcome.headers().forEach(resp::setHeader);
    if (!outcome.hasBody()) {
      return;
    }
    byte[] payload = JacksonUtility.toJsonBytes(outcome.body());
    resp.setContentType(JSON);
    resp.setCharacterEncoding("UTF-8");
    resp.setContentLength(payload.length);
    try (OutputStream out = resp.getOutputStream()) {
      out.write(payload);
    } catch (IOException e) {
      log.debug("Client went away before the response was written: {}", e.getMessage());
    }
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) {
    // no server-initiated SSE stream
    resp.setHeader("Allow", disallowDelete ? "POST" : "POST, DELETE");
    resp.setStatus(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) {
    if (disallowDelete) {
      resp.setHeader("Allow", "POST");
      resp.setStatus(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
      return;
    }
    String sessionId = req.getHeader(RpcExchange.SESSION_HEADER);
    if (sessionId == null || sessionId.isBlank()) {
      resp.setStatus(HttpServletResponse.SC_BAD_REQUEST);
      return;
    }
    boolean removed = sessions.removeSession(sessionId.trim());
    log.debug("DELETE session {} -> {}", sessionId, removed ? "removed" : "unknown");
    resp.setStatus(removed ? HttpServletResponse.SC_OK : HttpServletResponse.SC_NOT_FOUND);
  }

  private static Map<String, String> headers(HttpServletRequest req) {
    Map<String, String> headers = new LinkedHashMap<>();
    Enumeration<String> names = req.getHeaderNames();
    while (names != null && names.hasMoreElements()) {
      String name = names.nextElement();
      headers.put(name, req.getHeader(name));
    }
    return headers;
  }
}
