package com.gentoro.tracedmcp.mcp;

import com.gentoro.tracedmcp.exception.ConfigException;
import com.gentoro.tracedmcp.rpc.ServerIdentity;
import org.apache.commons.configuration2.Configuration;

/**
 * MCP endpoint options.
 *
 * <pre>
 * http:
 *   mcp:
 *     endpoint: /weather
 *     disallow-delete: false
 *     max-sessions: 1024
 *     structured-results: false
 *     server:
 *       name: weather-assistant
 *       version: 1.0.0
 *       instructions: ...
 * </pre>
 */
public record McpServerSettings(
    String endpoint,
    boolean disallowDelete,
    int maxSessions,
    boolean structuredResults,
    ServerIdentity identity) {

  public static final String DEFAULT_ENDPOINT = "/weather";
  public static final int DEFAULT_MAX_SESSIONS = 1024;

  public static McpServerSettings from(Configuration cfg) {
    int maxSessions = cfg.getInt("http.mcp.max-sessions", DEFAULT_MAX_SESSIONS);
    if (maxSessions <= 0) {
      throw new ConfigException("http.mcp.max-sessions must be > 0");
    }
    return new McpServerSettings(
        normalizeEndpoint(cfg.getString("http.mcp.endpoint", DEFAULT_ENDPOINT)),
        cfg.getBoolean("http.mcp.disallow-delete", false),
        maxSessions,
        cfg.getBoolean("http.mcp.structured-results", false),
        new ServerIdentity(
            cfg.getString("http.mcp.server.name", "weather-assistant"),
            cfg.getString("http.mcp.server.version", "1.0.0"),
            cfg.getString(
                "http.mcp.server.instructions",
                "Use get_weather for current conditions and get_forecast for daily forecasts.")));
  }

  static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return DEFAULT_ENDPOINT;
    String e = endpoint.trim();
    if (!e.startsWith("/")) e = "/" + e;
    while (e.length() > 1 && e.endsWith("/")) {
      e = e.substring(0, e.length() - 1);
    }
    return e;
  }
}
