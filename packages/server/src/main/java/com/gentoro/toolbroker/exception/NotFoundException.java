package com.gentoro.toolbroker.exception;

/** Resource requested was not found. */
public class NotFoundException extends BrokerException {
  public NotFoundException(String message) {
    super(BrokerErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(BrokerErrorCode.NOT_FOUND, message, cause);
  }
}
