package com.gentoro.toolbroker.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the broker, carrying a stable {@link BrokerErrorCode} and optional
 * diagnostic context (tenant id, provider id, request id and so on).
 *
 * <p>The context map is copied on construction and exposed read-only.
 */
public class BrokerException extends RuntimeException {
  private final BrokerErrorCode code;
  private final Map<String, Object> context;

  public BrokerException(BrokerErrorCode code, String message) {
    this(code, message, null, null);
  }

  public BrokerException(BrokerErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public BrokerException(BrokerErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public BrokerException(
      BrokerErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public BrokerErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    return Collections.unmodifiableMap(new LinkedHashMap<>(input));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
