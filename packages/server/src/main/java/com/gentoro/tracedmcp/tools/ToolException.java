package com.gentoro.tracedmcp.tools;

import com.gentoro.tracedmcp.exception.TracedMcpErrorCode;
import com.gentoro.tracedmcp.exception.TracedMcpException;
import java.util.Map;

/** Normalized tool failure. The {@link ToolErrorKind} drives the JSON-RPC error code. */
public class ToolException extends TracedMcpException {
  private final ToolErrorKind kind;
  private final String toolName;

  public ToolException(ToolErrorKind kind, String toolName, String message) {
    this(kind, toolName, message, Map.of(), null);
  }

  public ToolException(
      ToolErrorKind kind,
      String toolName,
      String message,
      Map<String, ?> context,
      Throwable cause) {
    super(codeFor(kind), message, context, cause);
    this.kind = kind;
    this.toolName = toolName;
  }

  public ToolErrorKind getKind() {
    return kind;
  }

  public String getToolName() {
    return toolName;
  }

  private static TracedMcpErrorCode codeFor(ToolErrorKind kind) {
    return switch (kind) {
      case ALREADY_EXISTS -> TracedMcpErrorCode.ALREADY_EXISTS;
      case NOT_FOUND -> TracedMcpErrorCode.NOT_FOUND;
      case INVALID_PARAMS -> TracedMcpErrorCode.INVALID_ARGUMENT;
      case EXECUTION_FAILED -> TracedMcpErrorCode.EXECUTION_ERROR;
    };
  }
}
