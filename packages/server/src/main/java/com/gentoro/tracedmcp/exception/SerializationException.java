package com.gentoro.tracedmcp.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends TracedMcpException {
  public SerializationException(String message) {
    super(TracedMcpErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(TracedMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
