package com.gentoro.onepress.exception;

/**
 * Canonical error codes for OnePress. Codes are stable and safe to match on in callers and logs.
 */
public enum OnePressErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Ingestion
  ATTRIBUTE_PARSE_ERROR,
}
