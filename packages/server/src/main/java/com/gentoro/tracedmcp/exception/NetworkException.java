package com.gentoro.tracedmcp.exception;

/** Network-level communication error (HTTP, sockets, timeouts). */
public class NetworkException extends TracedMcpException {
  public NetworkException(String message) {
    super(TracedMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(TracedMcpErrorCode.NETWORK_ERROR, message, cause);
  }
}
