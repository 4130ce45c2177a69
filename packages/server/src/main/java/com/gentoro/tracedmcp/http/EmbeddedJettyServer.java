package com.gentoro.tracedmcp.http;

import com.gentoro.tracedmcp.TracedMcp;
import com.gentoro.tracedmcp.exception.ConfigException;
import com.gentoro.tracedmcp.exception.ExceptionUtil;
import com.gentoro.tracedmcp.exception.NetworkException;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle (prepare/start/stop/join). Components register their servlets on
 * {@link #getContextHandler()} between {@link #prepare()} and {@link #start()}. Port {@code 0}
 * binds an ephemeral port; {@link #getPort()} reports the bound one once started.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  public static final int DEFAULT_PORT = 8001;

  private final TracedMcp app;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(TracedMcp app) {
    this.app = app;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = app.configuration().getInt("http.port", DEFAULT_PORT);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }
      if (port < 0 || port > 65535) {
        throw new ConfigException("http.port out of range: " + port);
      }

      String hostname = app.configuration().getString("http.hostname", "0.0.0.0");
      if (hostname == null || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }
      hostname = hostname.trim();
      log.trace("Resolved http.hostname={} http.port={}", hostname, port);

      try {
        server = new Server();
        connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException("Failed to initialize the Jetty server", e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", connector.getLocalPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "Failed to start the Jetty server. Check that the configured hostname and"
                        + " port are available",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      try {
        if (server.isRunning() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        // keep going so the remaining services can still shut down
        log.error("Error stopping Jetty server", e);
      } finally {
        server = null;
        connector = null;
        contextHandler = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (connector != null && server.isStarted()) {
        return connector.getLocalPort();
      }
      return app.configuration().getInt("http.port", DEFAULT_PORT);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
