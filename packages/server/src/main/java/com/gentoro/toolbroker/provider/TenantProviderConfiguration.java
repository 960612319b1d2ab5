package com.gentoro.toolbroker.provider;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Per tenant (and optionally per agent) settings for one provider.
 *
 * <p>An empty {@code allowedTools} list means every tool the provider exposes is allowed.
 */
public record TenantProviderConfiguration(
    String tenantId,
    String providerId,
    boolean enabled,
    Duration timeout,
    List<String> allowedTools,
    AuthMode authMode) {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  public TenantProviderConfiguration {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(providerId, "providerId");
    timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
    authMode = authMode == null ? AuthMode.CREDENTIAL : authMode;
  }

  public boolean allows(String toolName) {
    return allowedTools.isEmpty() || allowedTools.contains(toolName);
  }
}
