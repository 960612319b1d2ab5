package com.gentoro.toolbroker.exception;

/** Input validation failure. Always raised before any network activity. */
public class ValidationException extends BrokerException {
  public ValidationException(String message) {
    super(BrokerErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(BrokerErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
