package com.gentoro.tracedmcp.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends TracedMcpException {
  public ConfigException(String message) {
    super(TracedMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(TracedMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
