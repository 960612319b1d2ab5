package com.gentoro.toolbroker.health;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of the most recent probe of a provider.
 *
 * @param responseTimeMs probe round trip; -1 when the probe did not get a response
 * @param error failure description, null when healthy
 */
public record ProviderHealth(
    String providerId,
    HealthStatus status,
    Instant lastCheck,
    long responseTimeMs,
    String error,
    String endpoint) {

  public static ProviderHealth unknown(String providerId, String endpoint, Instant now) {
    return new ProviderHealth(providerId, HealthStatus.UNKNOWN, now, -1, null, endpoint);
  }

  public boolean isHealthy() {
    return status == HealthStatus.HEALTHY;
  }

  public boolean isFreshAt(Instant now, Duration ttl) {
    return lastCheck != null && now.isBefore(lastCheck.plus(ttl));
  }
}
