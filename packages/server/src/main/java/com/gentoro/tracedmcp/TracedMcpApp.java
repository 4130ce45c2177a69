package com.gentoro.tracedmcp;

public class TracedMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(TracedMcpApp.class);

  public static void main(String[] args) {
    TracedMcp app;
    try {
      app = new TracedMcp(new StartupParameters(args));
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
      return;
    }
    app.waitShutdownSignal();
  }
}
