package com.gentoro.tracedmcp.exception;

import java.util.Objects;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining the top
   * frames in call-order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Human readable description of a failure: its message when present, otherwise the exception
   * type followed by the compact stack trace.
   */
  public static String describe(Throwable t) {
    if (t == null) return "";
    String message = t.getMessage();
    if (message != null && !message.isBlank()) return message;
    return t.getClass().getSimpleName() + " at " + formatCompactStackTrace(t, 3);
  }

  public static TracedMcpException rethrowIfUnchecked(
      Throwable t, Function<Throwable, TracedMcpException> supplier) {
    if (t instanceof TracedMcpException) {
      return (TracedMcpException) t;
    } else {
      return Objects.requireNonNull(supplier.apply(t), "supplier result");
    }
  }
}
