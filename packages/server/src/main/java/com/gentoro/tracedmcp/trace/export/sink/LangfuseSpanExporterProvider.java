package com.gentoro.tracedmcp.trace.export.sink;

import com.gentoro.tracedmcp.exception.ConfigException;
import com.gentoro.tracedmcp.utility.StringUtility;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import okhttp3.Credentials;
import org.apache.commons.configuration2.Configuration;

/**
 * SPI provider for Langfuse, which ingests OTLP/HTTP at {@code /api/public/otel/v1/traces} with
 * HTTP Basic authentication ({@code public-key:secret-key}).
 *
 * <p>Host: {@code tracing.exporter.langfuse.host}, {@code LANGFUSE_HOST}, {@code
 * LANGFUSE_BASE_URL}, then {@value #DEFAULT_HOST}. Keys: {@code public-key}/{@code secret-key} or
 * {@code LANGFUSE_PUBLIC_KEY}/{@code LANGFUSE_SECRET_KEY}.
 */
public final class LangfuseSpanExporterProvider implements SpanExporterProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(LangfuseSpanExporterProvider.class);

  public static final String DEFAULT_HOST = "http://localhost:3000";
  static final String OTLP_PATH = "/api/public/otel/v1/traces";

  @Override
  public String exporterId() {
    return "langfuse";
  }

  @Override
  public SpanExporter create(Configuration subConfiguration, Function<String, String> env) {
    String endpoint = resolveEndpoint(subConfiguration, env);
    String publicKey =
        StringUtility.firstNonBlank(
            subConfiguration.getString("public-key", null), env.apply("LANGFUSE_PUBLIC_KEY"));
    String secretKey =
        StringUtility.firstNonBlank(
            subConfiguration.getString("secret-key", null), env.apply("LANGFUSE_SECRET_KEY"));
    if (publicKey == null || secretKey == null) {
      throw new ConfigException(
          "Langfuse exporter requires tracing.exporter.langfuse.public-key/secret-key "
              + "or LANGFUSE_PUBLIC_KEY/LANGFUSE_SECRET_KEY");
    }
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Authorization", Credentials.basic(publicKey, secretKey));
    headers.putAll(OtlpHttpSpanExporterProvider.configuredHeaders(subConfiguration));
    log.info("Exporting spans to Langfuse at {}", endpoint);
    return OtlpHttpSpanExporterProvider.build(endpoint, subConfiguration, headers);
  }

  static String resolveEndpoint(Configuration cfg, Function<String, String> env) {
    String host =
        StringUtility.firstNonBlank(
            cfg.getString("host", null),
            env.apply("LANGFUSE_HOST"),
            env.apply("LANGFUSE_BASE_URL"),
            DEFAULT_HOST);
    return OtlpHttpSpanExporterProvider.stripTrailingSlash(host) + OTLP_PATH;
  }
}
