package com.gentoro.toolbroker.exception;

import java.util.Map;

/** No usable authentication payload could be resolved for a tool call. */
public class AuthenticationException extends BrokerException {
  public AuthenticationException(String message) {
    super(BrokerErrorCode.UNAUTHENTICATED, message);
  }

  public AuthenticationException(String message, Map<String, ?> context) {
    super(BrokerErrorCode.UNAUTHENTICATED, message, context);
  }

  public AuthenticationException(String message, Throwable cause) {
    super(BrokerErrorCode.UNAUTHENTICATED, message, cause);
  }
}
