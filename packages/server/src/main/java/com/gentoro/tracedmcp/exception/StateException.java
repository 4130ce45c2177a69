package com.gentoro.tracedmcp.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends TracedMcpException {
  public StateException(String message) {
    super(TracedMcpErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(TracedMcpErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
