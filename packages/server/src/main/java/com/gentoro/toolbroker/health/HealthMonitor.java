package com.gentoro.toolbroker.health;

import com.gentoro.toolbroker.exception.ExceptionUtil;
import com.gentoro.toolbroker.http.OkHttpFactory;
import com.gentoro.toolbroker.provider.ProviderDefinition;
import com.gentoro.toolbroker.transport.ProviderConnection;
import com.gentoro.toolbroker.transport.StreamListener;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Cached liveness of providers. A cached record is served until its TTL elapses; the next read
 * after that probes {@link ProviderDefinition#healthEndpoint()} and caches the outcome, failed or
 * not. Probing never throws.
 *
 * <p>Registered as a {@link StreamListener} so that a dropped connection forgets the provider's
 * cached status.
 */
public class HealthMonitor implements StreamListener {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(HealthMonitor.class);

  public static final Duration DEFAULT_TTL = Duration.ofMinutes(2);
  public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(10);

  private final OkHttpClient probeClient;
  private final Duration ttl;
  private final Clock clock;
  private final Map<String, ProviderHealth> cache = new ConcurrentHashMap<>();

  public HealthMonitor(OkHttpClient httpClient, Duration ttl, Duration probeTimeout, Clock clock) {
    this.probeClient =
        OkHttpFactory.bounded(
            Objects.requireNonNull(httpClient, "httpClient"),
            probeTimeout == null ? DEFAULT_PROBE_TIMEOUT : probeTimeout);
    this.ttl = ttl == null ? DEFAULT_TTL : ttl;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ProviderHealth checkHealth(ProviderDefinition provider) {
    Instant now = clock.instant();
    ProviderHealth cached = cache.get(provider.id());
    if (cached != null && cached.isFreshAt(now, ttl)) {
      return cached;
    }
    ProviderHealth fresh = probe(provider);
    cache.put(provider.id(), fresh);
    if (cached == null || cached.status() != fresh.status()) {
      log.info(
          "Provider {} is {}{}",
          provider.id(),
          fresh.status(),
          fresh.error() == null ? "" : " (" + fresh.error() + ")");
    }
    return fresh;
  }

  /** Health of each provider, in the given order. */
  public List<ProviderHealth> checkAll(Collection<ProviderDefinition> providers) {
    List<ProviderHealth> result = new ArrayList<>(providers.size());
    for (ProviderDefinition provider : providers) {
      result.add(checkHealth(provider));
    }
    return result;
  }

  public Optional<ProviderHealth> cached(String providerId) {
    return Optional.ofNullable(cache.get(providerId));
  }

  public Map<String, ProviderHealth> snapshot() {
    return Map.copyOf(cache);
  }

  /** Forget the cached record, forcing a probe on the next read. */
  public void invalidate(String providerId) {
    if (cache.remove(providerId) != null) {
      log.debug("Health record of provider {} invalidated", providerId);
    }
  }

  @Override
  public void onClosed(ProviderConnection connection, Throwable cause) {
    invalidate(connection.providerId());
  }

  private ProviderHealth probe(ProviderDefinition provider) {
    String endpoint = provider.healthEndpoint();
    Instant started = clock.instant();
    long t0 = System.nanoTime();
    try (Response response =
        probeClient.newCall(new Request.Builder().url(endpoint).get().build()).execute()) {
      long elapsed = (System.nanoTime() - t0) / 1_000_000;
      if (response.isSuccessful()) {
        return new ProviderHealth(
            provider.id(), HealthStatus.HEALTHY, started, elapsed, null, endpoint);
      }
      return new ProviderHealth(
          provider.id(),
          HealthStatus.UNHEALTHY,
          started,
          elapsed,
          "HTTP " + response.code(),
          endpoint);
    } catch (IOException | RuntimeException e) {
      log.debug("Health probe of {} failed", provider.id(), e);
      return new ProviderHealth(
          provider.id(), HealthStatus.UNHEALTHY, started, -1, ExceptionUtil.describe(e), endpoint);
    }
  }
}
