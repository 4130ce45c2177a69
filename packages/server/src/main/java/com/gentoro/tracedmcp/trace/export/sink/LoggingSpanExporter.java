package com.gentoro.tracedmcp.trace.export.sink;

import com.gentoro.tracedmcp.trace.SpanAttributes;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Writes each span as one JSON line to the application log under category {@value #CATEGORY}.
 *
 * <p>Useful when no collector is running; log consumers can rebuild the trace tree from the
 * {@code traceId}/{@code spanId}/{@code parentSpanId} fields.
 */
public class LoggingSpanExporter implements SpanExporter {
  public static final String CATEGORY = "tracing.spans";

  private final org.slf4j.Logger log;

  public LoggingSpanExporter() {
    this(org.slf4j.LoggerFactory.getLogger(CATEGORY));
  }

  public LoggingSpanExporter(org.slf4j.Logger logger) {
    this.log = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public CompletableResultCode export(@NotNull Collection<SpanData> spans) {
    for (SpanData span : spans) {
      log.info("{}", JacksonUtility.toJson(toPayload(span)));
    }
    return CompletableResultCode.ofSuccess();
  }

  /** Stable payload shape, extracted for testability. */
  protected Map<String, Object> toPayload(SpanData span) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("service", span.getResource().getAttribute(SpanAttributes.SERVICE_NAME));
    payload.put("name", span.getName());
    payload.put("kind", span.getKind().name());
    payload.put("traceId", span.getTraceId());
    payload.put("spanId", span.getSpanId());
    String parent = span.getParentSpanId();
    payload.put("parentSpanId", SpanId.isValid(parent) ? parent : null);
    payload.put("startTimeUnixNano", span.getStartEpochNanos());
    payload.put("durationMs", (span.getEndEpochNanos() - span.getStartEpochNanos()) / 1e6d);
    payload.put("status", span.getStatus().getStatusCode().name());
    String description = span.getStatus().getDescription();
    payload.put("statusMessage", description == null || description.isEmpty() ? null : description);
    Map<String, Object> attributes = new LinkedHashMap<>();
    span.getAttributes().forEach((key, value) -> attributes.put(key.getKey(), value));
    payload.put("attributes", attributes);
    return payload;
  }

  @Override
  public CompletableResultCode flush() {
    return CompletableResultCode.ofSuccess();
  }

  @Override
  public CompletableResultCode shutdown() {
    return CompletableResultCode.ofSuccess();
  }
}
