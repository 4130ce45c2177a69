package com.gentoro.tracedmcp.trace;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes the W3C {@code traceparent} / {@code tracestate} headers through the
 * OpenTelemetry {@link W3CTraceContextPropagator}.
 *
 * <p>Extraction is best-effort: an absent, malformed or version-unsupported carrier yields a fresh
 * root context instead of an error. Only version {@code 00} is accepted. See
 * https://www.w3.org/TR/trace-context/#traceparent-header
 */
public final class TraceContextCodec {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(TraceContextCodec.class);

  public static final String TRACEPARENT = "traceparent";
  public static final String TRACESTATE = "tracestate";

  /** Version '00' is fixed length: 00-traceid128-spanid-01. */
  static final int FORMAT_LENGTH = 2 + 1 + 32 + 1 + 16 + 1 + 2;

  static final String SUPPORTED_VERSION_PREFIX = "00-";
  static final int MAX_TRACESTATE_LENGTH = 512;

  private static final TextMapGetter<Map<String, String>> GETTER =
      new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(Map<String, String> carrier) {
          return carrier.keySet();
        }

        @Override
        public String get(Map<String, String> carrier, String key) {
          return carrier == null ? null : carrier.get(key);
        }
      };

  private final TextMapPropagator propagator;

  public TraceContextCodec() {
    this(W3CTraceContextPropagator.getInstance());
  }

  TraceContextCodec(TextMapPropagator propagator) {
    this.propagator = propagator;
  }

  /**
   * Parse the carrier into a context. Header names are matched case-insensitively. Never throws.
   */
  public TraceContext extract(Map<String, String> carrier) {
    String traceparent = header(carrier, TRACEPARENT);
    if (traceparent == null) {
      log.debug("No traceparent header found; starting a new trace");
      return TraceContext.newRoot();
    }
    if (traceparent.length() != FORMAT_LENGTH
        || !traceparent.startsWith(SUPPORTED_VERSION_PREFIX)) {
      log.debug("Unsupported or malformed traceparent {}", traceparent);
      return TraceContext.newRoot();
    }

    Map<String, String> normalized = new LinkedHashMap<>();
    normalized.put(TRACEPARENT, traceparent);
    String traceState = header(carrier, TRACESTATE);
    if (traceState != null) {
      if (traceState.length() > MAX_TRACESTATE_LENGTH) {
        log.debug("Discarding tracestate longer than {} characters", MAX_TRACESTATE_LENGTH);
      } else {
        normalized.put(TRACESTATE, traceState);
      }
    }

    SpanContext remote =
        Span.fromContext(propagator.extract(Context.root(), normalized, GETTER)).getSpanContext();
    if (!remote.isValid()) {
      log.debug("Invalid traceparent {}", traceparent);
      return TraceContext.newRoot();
    }
    log.debug("Received traceparent {}", traceparent);
    return TraceContext.fromSpanContext(remote);
  }

  /** Inverse of {@link #extract}. A root context propagates nothing. */
  public Map<String, String> inject(TraceContext context) {
    if (context == null || context.isRoot()) return Collections.emptyMap();
    Map<String, String> carrier = new LinkedHashMap<>();
    propagator.inject(context.asParent(), carrier, Map::put);
    return carrier;
  }

  /** Trimmed header value, or null when absent or blank. */
  private static String header(Map<String, String> carrier, String name) {
    if (carrier == null || carrier.isEmpty()) return null;
    String value = carrier.get(name);
    if (value == null) {
      for (Map.Entry<String, String> e : carrier.entrySet()) {
        if (e.getKey() != null && e.getKey().toLowerCase(Locale.ROOT).equals(name)) {
          value = e.getValue();
          break;
        }
      }
    }
    if (value == null || value.isBlank()) return null;
    return value.trim();
  }
}
