package com.gentoro.toolbroker.exception;

/** A correlated request did not receive a terminal answer before its deadline. */
public class RequestTimeoutException extends BrokerException {
  public RequestTimeoutException(String message) {
    super(BrokerErrorCode.DEADLINE_EXCEEDED, message);
  }

  public RequestTimeoutException(String message, Throwable cause) {
    super(BrokerErrorCode.DEADLINE_EXCEEDED, message, cause);
  }
}
