package com.gentoro.toolbroker.exception;

/** JSON encoding or decoding failure. */
public class SerializationException extends BrokerException {
  public SerializationException(String message) {
    super(BrokerErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(BrokerErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
