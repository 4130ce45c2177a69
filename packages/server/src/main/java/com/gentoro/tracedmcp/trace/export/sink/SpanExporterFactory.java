package com.gentoro.tracedmcp.trace.export.sink;

import com.gentoro.tracedmcp.exception.ConfigException;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.ServiceLoader;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;

/** Resolves the configured {@link SpanExporter} through the {@link SpanExporterProvider} SPI. */
public final class SpanExporterFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(SpanExporterFactory.class);

  private SpanExporterFactory() {}

  /**
   * Create the exporter named {@code type}, handing it the {@code tracing.exporter.<type>.*}
   * subset.
   */
  public static SpanExporter create(String type, Configuration cfg, Function<String, String> env) {
    for (SpanExporterProvider p : ServiceLoader.load(SpanExporterProvider.class)) {
      if (p.exporterId().equals(type)) {
        SpanExporter exporter = p.create(cfg.subset("tracing.exporter.%s".formatted(type)), env);
        log.info("Using span exporter '{}'", type);
        return exporter;
      }
    }
    throw new ConfigException("Unknown tracing.exporter.type: %s".formatted(type));
  }
}
