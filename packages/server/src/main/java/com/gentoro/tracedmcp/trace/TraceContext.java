package com.gentoro.tracedmcp.trace;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.IdGenerator;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable position within a distributed trace.
 *
 * <p>A <em>root</em> context holds a freshly generated trace id but no span that new work could be
 * parented onto; spans started beneath it open a brand new trace. Any other context wraps the
 * OpenTelemetry {@link SpanContext} of an existing (local or remote) span.
 */
public final class TraceContext {
  private static final IdGenerator IDS = IdGenerator.random();

  private final String traceId;
  private final SpanContext spanContext;
  private final TraceFlags flags;
  private final TraceState traceState;

  private TraceContext(
      String traceId, SpanContext spanContext, TraceFlags flags, TraceState traceState) {
    this.traceId = traceId;
    this.spanContext = spanContext;
    this.flags = flags;
    this.traceState = traceState;
  }

  /** Fresh root context: random trace id, sampled, no span. */
  public static TraceContext newRoot() {
    return new TraceContext(
        IDS.generateTraceId(),
        SpanContext.getInvalid(),
        TraceFlags.getSampled(),
        TraceState.getDefault());
  }

  /** Context pointing at an existing span. */
  public static TraceContext fromSpanContext(@NotNull SpanContext spanContext) {
    if (!spanContext.isValid()) {
      throw new IllegalArgumentException("span context must be valid: " + spanContext);
    }
    return new TraceContext(
        spanContext.getTraceId(),
        spanContext,
        spanContext.getTraceFlags(),
        spanContext.getTraceState());
  }

  public boolean isRoot() {
    return !spanContext.isValid();
  }

  public boolean isSampled() {
    return flags.isSampled();
  }

  /** 32 lowercase hex characters, never all zero. */
  public String traceId() {
    return traceId;
  }

  /** 16 lowercase hex characters, or null for a root context. */
  @Nullable
  public String spanId() {
    return isRoot() ? null : spanContext.getSpanId();
  }

  public TraceFlags flags() {
    return flags;
  }

  /** Vendor state propagated alongside the span; empty when none was received. */
  public TraceState traceState() {
    return traceState;
  }

  /** The wrapped span context; invalid for a root context. */
  public SpanContext toSpanContext() {
    return spanContext;
  }

  /** An OpenTelemetry context to start child spans in. A root context yields no parent. */
  public Context asParent() {
    return isRoot() ? Context.root() : Context.root().with(Span.wrap(spanContext));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TraceContext that)) return false;
    return traceId.equals(that.traceId)
        && Objects.equals(spanId(), that.spanId())
        && flags.equals(that.flags)
        && traceState.equals(that.traceState);
  }

  @Override
  public int hashCode() {
    return Objects.hash(traceId, spanId(), flags, traceState);
  }

  @Override
  public String toString() {
    return "TraceContext{traceId="
        + traceId
        + ", spanId="
        + spanId()
        + ", flags="
        + flags.asHex()
        + (traceState.isEmpty() ? "" : ", traceState=" + traceState.asMap())
        + '}';
  }
}
