package com.gentoro.tracedmcp.trace.export.sink;

import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Collections;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;

/** SPI providers for the exporters that need no configuration. */
public final class SimpleSpanExporterProviders {
  private SimpleSpanExporterProviders() {}

  public static final class Logging implements SpanExporterProvider {
    @Override
    public String exporterId() {
      return "logging";
    }

    @Override
    public SpanExporter create(Configuration subConfiguration, Function<String, String> env) {
      return new LoggingSpanExporter();
    }
  }

  /** Discards everything; tracing stays on but nothing leaves the process. */
  public static final class None implements SpanExporterProvider {
    @Override
    public String exporterId() {
      return "none";
    }

    @Override
    public SpanExporter create(Configuration subConfiguration, Function<String, String> env) {
      return SpanExporter.composite(Collections.<SpanExporter>emptyList());
    }
  }
}
