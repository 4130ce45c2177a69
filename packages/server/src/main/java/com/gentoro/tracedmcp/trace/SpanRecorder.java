package com.gentoro.tracedmcp.trace;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import java.util.Objects;

/** Creates spans and links them to their parent context. */
public class SpanRecorder {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(SpanRecorder.class);

  public static final String INSTRUMENTATION_SCOPE = "com.gentoro.tracedmcp";

  private final Tracer tracer;

  public SpanRecorder(TracerProvider tracerProvider) {
    this(tracerProvider.get(INSTRUMENTATION_SCOPE));
  }

  public SpanRecorder(Tracer tracer) {
    this.tracer = Objects.requireNonNull(tracer, "tracer");
  }

  public SpanHandle startSpan(TraceContext parent, String name) {
    return startSpan(parent, name, SpanKind.SERVER);
  }

  /**
   * Start a span beneath {@code parent}. A root (or null) parent starts a brand new trace: the span
   * gets a fresh trace id and no parent span id. A remote parent's tracestate is carried over.
   */
  public SpanHandle startSpan(TraceContext parent, String name, SpanKind kind) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    SpanBuilder builder = tracer.spanBuilder(name).setSpanKind(kind);
    if (parent == null || parent.isRoot()) {
      builder.setNoParent();
    } else {
      builder.setParent(parent.asParent());
    }
    Span span = builder.startSpan();
    log.trace("Started span '{}' {}", name, span.getSpanContext());
    return new SpanHandle(span, name);
  }
}
