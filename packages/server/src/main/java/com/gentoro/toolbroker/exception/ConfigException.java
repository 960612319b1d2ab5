package com.gentoro.toolbroker.exception;

/** Configuration problem: missing provider definition, malformed YAML, bad key material. */
public class ConfigException extends BrokerException {
  public ConfigException(String message) {
    super(BrokerErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(BrokerErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
