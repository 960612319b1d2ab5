package com.gentoro.toolbroker.exception;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/** Helpers for unwrapping, classifying and summarizing exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. Code and context of a {@link
   * BrokerException} are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    Throwable cause = unwrap(t);
    if (cause instanceof BrokerException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        cause.getClass().getSimpleName(),
        safeMessage(cause.getMessage()),
        BrokerErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Strip the wrappers added by {@code CompletableFuture} and {@code Future.get()} so callers see
   * the exception raised by the failing stage.
   */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Human readable message for a failure, falling back to the exception type name. */
  public static String describe(Throwable t) {
    Throwable cause = unwrap(t);
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static BrokerException rethrowIfUnchecked(
      Throwable t, Function<Throwable, BrokerException> supplier) {
    Throwable cause = unwrap(t);
    if (cause instanceof BrokerException ex) {
      return ex;
    }
    return supplier.apply(cause);
  }
}
