package com.gentoro.tracedmcp.utility;

public class StringUtility {

  public static boolean isBlank(String input) {
    return input == null || input.isBlank();
  }

  /** First non-blank value, trimmed, or null when all are blank. */
  public static String firstNonBlank(String... values) {
    if (values == null) return null;
    for (String v : values) {
      if (!isBlank(v)) return v.trim();
    }
    return null;
  }
}
