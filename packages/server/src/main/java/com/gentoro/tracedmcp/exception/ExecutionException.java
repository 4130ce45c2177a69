package com.gentoro.tracedmcp.exception;

/** Error while starting services or executing runtime operations. */
public class ExecutionException extends TracedMcpException {
  public ExecutionException(String message) {
    super(TracedMcpErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(TracedMcpErrorCode.EXECUTION_ERROR, message, cause);
  }
}
