package com.gentoro.tracedmcp.actuator;

import com.gentoro.tracedmcp.trace.export.BatchingSpanProcessor;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health check endpoint in the style of Spring Boot's actuator.
 *
 * <p>{@code GET /actuator/health} answers {@code {"status":"UP","exporter":{...}}} with the span
 * exporter counters.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String HEALTH_PATH = "/actuator/health";

  private final BatchingSpanProcessor processor;

  public ActuatorService(BatchingSpanProcessor processor) {
    this.processor = processor;
  }

  public void register(ServletContextHandler contextHandler) {
    contextHandler.addServlet(new ServletHolder(new ActuatorServlet(processor)), HEALTH_PATH);
    log.info("Actuator health endpoint registered at {}", HEALTH_PATH);
  }

  static Map<String, Object> health(BatchingSpanProcessor processor) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("status", "UP");
    payload.put("exporter", processor.stats().toMap());
    return payload;
  }

  private static class ActuatorServlet extends HttpServlet {
    private final transient BatchingSpanProcessor processor;

    ActuatorServlet(BatchingSpanProcessor processor) {
      this.processor = processor;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      byte[] payload = JacksonUtility.toJsonBytes(health(processor));
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (OutputStream out = resp.getOutputStream()) {
        out.write(payload);
      }
    }
  }
}
