package com.gentoro.tracedmcp.tools;

/** Why a tool could not be registered or produce a result. */
public enum ToolErrorKind {
  ALREADY_EXISTS,
  NOT_FOUND,
  INVALID_PARAMS,
  EXECUTION_FAILED
}
