package com.gentoro.toolbroker.exception;

/**
 * Canonical error codes for the broker. Codes are stable and suitable for the orchestrator and for
 * logs. Prefer the most specific code that reflects where the failure originated.
 */
public enum BrokerErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  UNAUTHENTICATED,
  DEADLINE_EXCEEDED,
  UNAVAILABLE,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Tool execution
  REMOTE_ERROR,
}
