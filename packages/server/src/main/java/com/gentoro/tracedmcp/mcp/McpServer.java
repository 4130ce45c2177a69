package com.gentoro.tracedmcp.mcp;

import com.gentoro.tracedmcp.TracedMcp;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Mounts the MCP servlet on the shared Jetty context. */
public class McpServer {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(McpServer.class);

  private final TracedMcp app;

  public McpServer(TracedMcp app) {
    this.app = app;
  }

  public void register() {
    McpServerSettings settings = app.mcpSettings();
    McpServlet servlet =
        new McpServlet(app.dispatcher(), app.sessionStore(), settings.disallowDelete());
    app.httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(servlet), settings.endpoint());
    log.info(
        "MCP endpoint registered at http://localhost:{}{}",
        app.httpServer().getPort(),
        settings.endpoint());
  }
}
