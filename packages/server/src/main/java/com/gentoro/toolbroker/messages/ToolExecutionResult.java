package com.gentoro.toolbroker.messages;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.toolbroker.exception.BrokerErrorCode;

/**
 * Uniform outcome of a tool call. Exactly one of {@code result} and {@code error} is set.
 *
 * @param errorCode classification of the failure, null on success
 * @param providerId provider that handled the call, {@value #UNKNOWN_PROVIDER} when none was picked
 * @param processingTimeMs wall time spent inside the router
 */
public record ToolExecutionResult(
    boolean success,
    JsonNode result,
    String error,
    BrokerErrorCode errorCode,
    String toolName,
    String providerId,
    String agentId,
    long processingTimeMs) {

  public static final String UNKNOWN_PROVIDER = "unknown";

  public static ToolExecutionResult ok(
      JsonNode result, String toolName, String providerId, String agentId, long processingTimeMs) {
    return new ToolExecutionResult(
        true, result, null, null, toolName, providerId, agentId, processingTimeMs);
  }

  public static ToolExecutionResult failed(
      String error,
      BrokerErrorCode errorCode,
      String toolName,
      String providerId,
      String agentId,
      long processingTimeMs) {
    return new ToolExecutionResult(
        false,
        null,
        error,
        errorCode,
        toolName,
        providerId == null ? UNKNOWN_PROVIDER : providerId,
        agentId,
        processingTimeMs);
  }
}
