package com.gentoro.toolbroker.provider;

import java.util.Objects;

/**
 * Immutable description of a tool-provider deployment.
 *
 * @param id stable provider id referenced by tenant and agent configuration
 * @param endpoint base URL; tools, stream and message addresses are derived from it
 * @param healthEndpoint liveness probe URL
 * @param transport wire transport used for execution
 * @param singleSessionUpstream true when the provider fronts an upstream system that allows only
 *     one active session per tenant; calls are then serialized per tenant
 */
public record ProviderDefinition(
    String id,
    String endpoint,
    String healthEndpoint,
    TransportKind transport,
    boolean singleSessionUpstream) {

  public ProviderDefinition {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(endpoint, "endpoint");
    endpoint = stripTrailingSlash(endpoint);
    healthEndpoint =
        healthEndpoint == null || healthEndpoint.isBlank() ? endpoint + "/health" : healthEndpoint;
    transport = transport == null ? TransportKind.SSE : transport;
  }

  public static ProviderDefinition of(String id, String endpoint) {
    return new ProviderDefinition(id, endpoint, null, TransportKind.SSE, false);
  }

  public String toolsEndpoint() {
    return endpoint + "/tools";
  }

  public String streamEndpoint() {
    return endpoint + "/stream";
  }

  public String messageEndpoint(String sessionId) {
    return endpoint + "/messages/" + sessionId;
  }

  private static String stripTrailingSlash(String url) {
    String trimmed = url.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }
}
