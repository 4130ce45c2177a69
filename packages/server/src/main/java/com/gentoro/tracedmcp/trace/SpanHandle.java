package com.gentoro.tracedmcp.trace;

import com.gentoro.tracedmcp.exception.StateException;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A span in progress, backed by an OpenTelemetry {@link Span}. Attributes and status may be
 * changed until {@link #end()}; afterwards any mutation throws {@link StateException}. {@code
 * end()} itself is idempotent.
 */
public final class SpanHandle {
  private final Span span;
  private final String name;
  private final AtomicBoolean ended = new AtomicBoolean(false);

  SpanHandle(Span span, String name) {
    this.span = Objects.requireNonNull(span, "span");
    this.name = name;
  }

  /** This span's own context, suitable for propagating to downstream calls. */
  public TraceContext context() {
    return TraceContext.fromSpanContext(span.getSpanContext());
  }

  public String name() {
    return name;
  }

  public SpanHandle setAttribute(String key, String value) {
    ensureOpen("setAttribute");
    span.setAttribute(Objects.requireNonNull(key, "key"), value);
    return this;
  }

  public SpanHandle setAttribute(String key, long value) {
    ensureOpen("setAttribute");
    span.setAttribute(Objects.requireNonNull(key, "key"), value);
    return this;
  }

  public SpanHandle setAttribute(String key, double value) {
    ensureOpen("setAttribute");
    span.setAttribute(Objects.requireNonNull(key, "key"), value);
    return this;
  }

  public SpanHandle setAttribute(String key, boolean value) {
    ensureOpen("setAttribute");
    span.setAttribute(Objects.requireNonNull(key, "key"), value);
    return this;
  }

  public <T> SpanHandle setAttribute(AttributeKey<T> key, T value) {
    ensureOpen("setAttribute");
    span.setAttribute(Objects.requireNonNull(key, "key"), value);
    return this;
  }

  public SpanHandle setStatus(StatusCode status, String message) {
    ensureOpen("setStatus");
    Objects.requireNonNull(status, "status");
    if (message == null) {
      span.setStatus(status);
    } else {
      span.setStatus(status, message);
    }
    return this;
  }

  public SpanHandle setStatus(StatusCode status) {
    return setStatus(status, null);
  }

  /** Mark the span failed and record the error kind and description as attributes. */
  public SpanHandle recordError(String kind, String message) {
    ensureOpen("recordError");
    if (kind != null) span.setAttribute(SpanAttributes.ERROR_KIND, kind);
    if (message != null) span.setAttribute(SpanAttributes.ERROR_MESSAGE, message);
    return setStatus(StatusCode.ERROR, message);
  }

  /** Attach {@code error} as an exception event; the status is left to the caller. */
  public SpanHandle recordException(Throwable error) {
    ensureOpen("recordException");
    span.recordException(error);
    return this;
  }

  public boolean isEnded() {
    return ended.get();
  }

  /** Stamp the end time and hand the span to the span processors. Calling it again is a no-op. */
  public void end() {
    if (ended.compareAndSet(false, true)) {
      span.end();
    }
  }

  private void ensureOpen(String operation) {
    if (ended.get()) {
      throw new StateException(
          "Cannot %s on span '%s' (%s): span already ended"
              .formatted(operation, name, span.getSpanContext().getSpanId()));
    }
  }
}
