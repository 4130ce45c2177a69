package com.gentoro.tracedmcp.trace.export.sink;

import com.gentoro.tracedmcp.utility.StringUtility;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporterBuilder;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;

/**
 * SPI provider for the OTLP/HTTP (protobuf) exporter.
 *
 * <p>Endpoint resolution order: {@code tracing.exporter.otlp.endpoint}, {@code
 * OTEL_EXPORTER_OTLP_TRACES_ENDPOINT}, {@code OTEL_EXPORTER_OTLP_ENDPOINT} + {@code /v1/traces},
 * then {@value #DEFAULT_ENDPOINT}. Extra headers come from {@code tracing.exporter.otlp.headers.*}
 * and {@code OTEL_EXPORTER_OTLP_HEADERS} ({@code k1=v1,k2=v2}).
 */
public final class OtlpHttpSpanExporterProvider implements SpanExporterProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(OtlpHttpSpanExporterProvider.class);

  public static final String DEFAULT_ENDPOINT = "http://localhost:4318/v1/traces";

  @Override
  public String exporterId() {
    return "otlp";
  }

  @Override
  public SpanExporter create(Configuration subConfiguration, Function<String, String> env) {
    String endpoint = resolveEndpoint(subConfiguration, env);
    Map<String, String> headers = parseHeaderList(env.apply("OTEL_EXPORTER_OTLP_HEADERS"));
    headers.putAll(configuredHeaders(subConfiguration));
    log.info("Exporting spans over OTLP/HTTP to {}", endpoint);
    return build(endpoint, subConfiguration, headers);
  }

  /** Shared by every OTLP/HTTP flavoured provider. */
  static SpanExporter build(String endpoint, Configuration cfg, Map<String, String> headers) {
    OtlpHttpSpanExporterBuilder builder =
        OtlpHttpSpanExporter.builder()
            .setEndpoint(endpoint)
            .setConnectTimeout(connectTimeout(cfg))
            .setTimeout(readTimeout(cfg));
    headers.forEach(builder::addHeader);
    return builder.build();
  }

  static String resolveEndpoint(Configuration cfg, Function<String, String> env) {
    String explicit =
        StringUtility.firstNonBlank(
            cfg.getString("endpoint", null), env.apply("OTEL_EXPORTER_OTLP_TRACES_ENDPOINT"));
    if (explicit != null) return explicit;
    String base = StringUtility.firstNonBlank(env.apply("OTEL_EXPORTER_OTLP_ENDPOINT"));
    if (base != null) {
      return stripTrailingSlash(base) + "/v1/traces";
    }
    return DEFAULT_ENDPOINT;
  }

  static Map<String, String> configuredHeaders(Configuration cfg) {
    Map<String, String> headers = new LinkedHashMap<>();
    Configuration sub = cfg.subset("headers");
    Iterator<String> keys = sub.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = sub.getString(key, null);
      if (value != null && !value.isBlank()) headers.put(key, value.trim());
    }
    return headers;
  }

  static Map<String, String> parseHeaderList(String value) {
    Map<String, String> headers = new LinkedHashMap<>();
    if (StringUtility.isBlank(value)) return headers;
    for (String pair : value.split(",")) {
      int idx = pair.indexOf('=');
      if (idx <= 0) continue;
      String k = pair.substring(0, idx).trim();
      String v = pair.substring(idx + 1).trim();
      if (!k.isEmpty() && !v.isEmpty()) headers.put(k, v);
    }
    return headers;
  }

  static Duration connectTimeout(Configuration cfg) {
    return Duration.ofMillis(cfg.getLong("connect-timeout-ms", 5000L));
  }

  /** Bounds a whole export call, connection included. */
  static Duration readTimeout(Configuration cfg) {
    return Duration.ofMillis(cfg.getLong("read-timeout-ms", 10000L));
  }

  static String stripTrailingSlash(String url) {
    String u = url.trim();
    while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
    return u;
  }
}
