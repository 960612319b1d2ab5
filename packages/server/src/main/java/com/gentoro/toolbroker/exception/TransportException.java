package com.gentoro.toolbroker.exception;

import java.util.Map;

/**
 * Network-level failure talking to a tool-provider: handshake failure, non-2xx submission, lost
 * stream. Whoever observes it drops the affected connection.
 */
public class TransportException extends BrokerException {
  public TransportException(String message) {
    super(BrokerErrorCode.NETWORK_ERROR, message);
  }

  public TransportException(String message, Throwable cause) {
    super(BrokerErrorCode.NETWORK_ERROR, message, cause);
  }

  public TransportException(String message, Map<String, ?> context, Throwable cause) {
    super(BrokerErrorCode.NETWORK_ERROR, message, context, cause);
  }
}
