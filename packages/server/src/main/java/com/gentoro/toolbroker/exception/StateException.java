package com.gentoro.toolbroker.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends BrokerException {
  public StateException(String message) {
    super(BrokerErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(BrokerErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
