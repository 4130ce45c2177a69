package com.gentoro.tracedmcp.trace.export;

import java.util.Locale;

/** What a full {@link SpanBuffer} does with one more span. */
public enum OverflowPolicy {
  /** Reject the incoming span; buffered spans are kept. */
  DROP_NEWEST,
  /** Evict the oldest buffered span to make room for the incoming one. */
  DROP_OLDEST;

  public static OverflowPolicy fromString(String value) {
    if (value == null || value.isBlank()) return DROP_NEWEST;
    return OverflowPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
  }
}
