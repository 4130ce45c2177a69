package com.gentoro.tracedmcp.trace;

import com.gentoro.tracedmcp.exception.ConfigException;
import com.gentoro.tracedmcp.trace.export.OverflowPolicy;
import com.gentoro.tracedmcp.utility.StringUtility;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;

/**
 * Tracing options resolved from the {@code tracing.*} configuration keys, with the conventional
 * OpenTelemetry environment variables as fallback.
 *
 * <pre>
 * tracing:
 *   service-name: weather-assistant
 *   max-attribute-length: 4096
 *   exporter:
 *     type: otlp            # otlp | langfuse | logging | none
 *     queue-size: 2048
 *     batch-size: 512
 *     flush-interval-ms: 200
 *     shutdown-timeout-ms: 5000
 *     overflow-policy: drop-newest
 * </pre>
 */
public final class TracingSettings {
  public static final String DEFAULT_SERVICE_NAME = "weather-assistant";

  private final String serviceName;
  private final String exporterType;
  private final int queueSize;
  private final int batchSize;
  private final Duration flushInterval;
  private final Duration shutdownTimeout;
  private final OverflowPolicy overflowPolicy;
  private final int maxAttributeLength;

  public TracingSettings(
      String serviceName,
      String exporterType,
      int queueSize,
      int batchSize,
      Duration flushInterval,
      Duration shutdownTimeout,
      OverflowPolicy overflowPolicy,
      int maxAttributeLength) {
    if (queueSize <= 0) throw new ConfigException("tracing.exporter.queue-size must be > 0");
    if (batchSize <= 0) throw new ConfigException("tracing.exporter.batch-size must be > 0");
    this.serviceName = serviceName;
    this.exporterType = exporterType;
    this.queueSize = queueSize;
    this.batchSize = batchSize;
    this.flushInterval = flushInterval;
    this.shutdownTimeout = shutdownTimeout;
    this.overflowPolicy = overflowPolicy;
    this.maxAttributeLength = maxAttributeLength;
  }

  public static TracingSettings from(Configuration cfg, Function<String, String> env) {
    String serviceName =
        StringUtility.firstNonBlank(
            cfg.getString("tracing.service-name", null),
            env.apply("OTEL_SERVICE_NAME"),
            DEFAULT_SERVICE_NAME);
    String type =
        cfg.getString("tracing.exporter.type", "otlp").trim().toLowerCase(Locale.ROOT);
    OverflowPolicy policy;
    try {
      policy = OverflowPolicy.fromString(cfg.getString("tracing.exporter.overflow-policy", null));
    } catch (IllegalArgumentException e) {
      throw new ConfigException(
          "Invalid tracing.exporter.overflow-policy; expected drop-newest or drop-oldest", e);
    }
    return new TracingSettings(
        serviceName,
        type,
        cfg.getInt("tracing.exporter.queue-size", 2048),
        cfg.getInt("tracing.exporter.batch-size", 512),
        Duration.ofMillis(cfg.getLong("tracing.exporter.flush-interval-ms", 200L)),
        Duration.ofMillis(cfg.getLong("tracing.exporter.shutdown-timeout-ms", 5000L)),
        policy,
        cfg.getInt("tracing.max-attribute-length", 4096));
  }

  public String serviceName() {
    return serviceName;
  }

  public String exporterType() {
    return exporterType;
  }

  public int queueSize() {
    return queueSize;
  }

  public int batchSize() {
    return batchSize;
  }

  public Duration flushInterval() {
    return flushInterval;
  }

  public Duration shutdownTimeout() {
    return shutdownTimeout;
  }

  public OverflowPolicy overflowPolicy() {
    return overflowPolicy;
  }

  public int maxAttributeLength() {
    return maxAttributeLength;
  }
}
