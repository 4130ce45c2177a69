package com.gentoro.tracedmcp.exception;

/**
 * Canonical error codes for the server. Codes are stable and suitable for logs and the {@code
 * data} member of JSON-RPC error objects. Prefer the most specific code that reflects the failure
 * origin.
 */
public enum TracedMcpErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  ALREADY_EXISTS,

  // Configuration and transport
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Domain specific
  EXECUTION_ERROR,
  PROTOCOL_ERROR,
}
