package com.gentoro.toolbroker.exception;

/** Provider reported unhealthy by the health monitor. */
public class ProviderUnavailableException extends BrokerException {
  public ProviderUnavailableException(String message) {
    super(BrokerErrorCode.UNAVAILABLE, message);
  }

  public ProviderUnavailableException(String message, Throwable cause) {
    super(BrokerErrorCode.UNAVAILABLE, message, cause);
  }
}
