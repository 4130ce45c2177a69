package com.gentoro.tracedmcp.trace.export.sink;

import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable span exporters.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and selected by matching
 * {@code tracing.exporter.type} against {@link #exporterId()}. To register a provider, add its
 * fully qualified class name to {@code
 * META-INF/services/com.gentoro.tracedmcp.trace.export.sink.SpanExporterProvider}.
 */
public interface SpanExporterProvider {

  /** A stable, lowercase identifier (e.g. "otlp"). */
  String exporterId();

  /**
   * Creates a configured OpenTelemetry exporter.
   *
   * @param subConfiguration exporter-specific subset, e.g. {@code tracing.exporter.otlp.*}
   * @param env environment lookup used for the conventional fallback variables
   * @throws com.gentoro.tracedmcp.exception.ConfigException when the configuration is invalid
   */
  SpanExporter create(Configuration subConfiguration, Function<String, String> env);
}
