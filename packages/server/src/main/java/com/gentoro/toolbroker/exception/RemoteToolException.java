package com.gentoro.toolbroker.exception;

import java.util.Map;

/** The tool-provider answered a request with a JSON-RPC error object. */
public class RemoteToolException extends BrokerException {
  private final int remoteCode;

  public RemoteToolException(int remoteCode, String message, Map<String, ?> context) {
    super(BrokerErrorCode.REMOTE_ERROR, message, context);
    this.remoteCode = remoteCode;
  }

  public int getRemoteCode() {
    return remoteCode;
  }
}
