package com.gentoro.toolbroker.session;

import com.gentoro.toolbroker.exception.ValidationException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-side custody of upstream session tokens.
 *
 * <p>Sessions are created after an upstream login performed elsewhere, read on every call that
 * needs upstream access and removed by explicit logout or by the periodic expiry sweep. The store
 * never re-authenticates: an expired session yields {@link Optional#empty()} and the caller must
 * drive a fresh login.
 *
 * <p>Every read-modify-write of a row goes through {@link SessionRepository#update}, so a touch on
 * read never overwrites a concurrent token update and never resurrects a deleted row. Callers that
 * need a consistent view across several operations run them under the tenant mutex.
 */
public class UpstreamSessionStore implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(UpstreamSessionStore.class);

  public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);

  private final SessionRepository repository;
  private final Clock clock;
  private ScheduledFuture<?> sweepTask;

  public UpstreamSessionStore(SessionRepository repository, Clock clock) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Schedule the expiry sweep on {@code scheduler}. Calling twice has no effect. */
  public synchronized void startSweeper(ScheduledExecutorService scheduler, Duration interval) {
    if (sweepTask != null) return;
    long millis = interval.toMillis();
    sweepTask =
        scheduler.scheduleWithFixedDelay(this::sweepQuietly, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Upstream session sweep scheduled every {}", interval);
  }

  /**
   * Store a session and return its id. The id is derived from tenant, username and instance, so a
   * second login by the same user replaces the earlier row.
   */
  public String create(SessionCreateRequest request) {
    requireText(request.tenantId(), "tenantId");
    requireText(request.username(), "username");
    requireText(request.sessionToken(), "sessionToken");
    Objects.requireNonNull(request.expiresAt(), "expiresAt");

    String sessionId = sessionIdFor(request.tenantId(), request.username(), request.instanceId());
    Instant now = clock.instant();
    String userId =
        request.userId() == null || request.userId().isBlank()
            ? "temp_" + request.username()
            : request.userId();
    repository.save(
        new UpstreamSession(
            sessionId,
            request.tenantId(),
            userId,
            request.username(),
            request.sessionToken(),
            request.instanceId(),
            request.baseUrl(),
            request.userDomainId(),
            request.expiresAt(),
            now,
            now));
    log.info(
        "Stored upstream session for {}@{} (tenant {}, expires {})",
        request.username(),
        request.instanceId(),
        request.tenantId(),
        request.expiresAt());
    return sessionId;
  }

  /** Live session for the id, or empty when absent or expired. Touches the updated timestamp. */
  public Optional<UpstreamSession> getValid(String sessionId) {
    Instant now = clock.instant();
    Optional<UpstreamSession> found =
        repository
            .update(sessionId, s -> s.isExpiredAt(now) ? s : s.touched(now))
            .filter(s -> !s.isExpiredAt(now));
    if (found.isEmpty()) {
      log.debug("Upstream session not found or expired: {}", sessionId);
    }
    return found;
  }

  /**
   * Refresh path. Reads the row regardless of expiry: a row that turns out to be still live (clock
   * skew between the expiry filter and this read) is returned; an expired row yields empty because
   * automatic re-authentication is not available.
   */
  public Optional<UpstreamSession> getEvenIfExpired(String sessionId) {
    Optional<UpstreamSession> row = repository.findById(sessionId);
    if (row.isEmpty()) {
      log.debug("No session row to refresh: {}", sessionId);
      return Optional.empty();
    }
    Instant now = clock.instant();
    UpstreamSession session = row.get();
    if (!session.isExpiredAt(now)) {
      log.debug("Session {} is not expired, returning existing session", sessionId);
      return row;
    }
    log.info(
        "Session {} for {}@{} expired {} ago; manual re-authentication required",
        sessionId,
        session.username(),
        session.instanceId(),
        Duration.between(session.expiresAt(), now));
    return Optional.empty();
  }

  /**
   * Provider-facing view of a session: {@link #getValid} first, then the refresh path. Empty means
   * the caller has to authenticate again.
   */
  public Optional<UpstreamConnectionConfig> connectionConfig(String sessionId) {
    return getValid(sessionId)
        .or(() -> getEvenIfExpired(sessionId))
        .map(UpstreamConnectionConfig::from);
  }

  public boolean hasValidSession(String tenantId, String username, String instanceId) {
    return getValid(sessionIdFor(tenantId, username, instanceId)).isPresent();
  }

  /** Replace token and expiry of an existing row. Returns false when no row exists. */
  public boolean updateToken(String sessionId, String token, Instant expiresAt) {
    requireText(token, "token");
    Instant now = clock.instant();
    if (repository.update(sessionId, s -> s.withToken(token, expiresAt, now)).isEmpty()) {
      log.warn("Cannot update token of unknown session {}", sessionId);
      return false;
    }
    log.info("Updated session token for {}, expires {}", sessionId, expiresAt);
    return true;
  }

  /** Push out the expiry of a live session. Expired sessions cannot be extended. */
  public boolean extend(String sessionId, Instant newExpiresAt) {
    Instant now = clock.instant();
    AtomicBoolean extended = new AtomicBoolean();
    repository.update(
        sessionId,
        s -> {
          if (s.isExpiredAt(now)) return s;
          extended.set(true);
          return s.withExpiry(newExpiresAt, now);
        });
    if (extended.get()) {
      log.debug("Extended session {} until {}", sessionId, newExpiresAt);
    }
    return extended.get();
  }

  /** Logout. */
  public void delete(String sessionId) {
    if (repository.delete(sessionId)) {
      log.info("Upstream session removed: {}", sessionId);
    }
  }

  /** Delete every expired row now; returns how many were removed. */
  public int sweepExpired() {
    int removed = repository.deleteExpired(clock.instant());
    if (removed > 0) {
      log.info("Cleaned up {} expired upstream session(s)", removed);
    }
    return removed;
  }

  public SessionStats stats() {
    Instant now = clock.instant();
    Collection<UpstreamSession> all = repository.findAll();
    long active = all.stream().filter(s -> !s.isExpiredAt(now)).count();
    return new SessionStats(all.size(), active, all.size() - active);
  }

  static String sessionIdFor(String tenantId, String username, String instanceId) {
    String key =
        tenantId + ":" + username + ":" + (instanceId == null || instanceId.isBlank() ? "default" : instanceId);
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(key.getBytes(StandardCharsets.UTF_8));
  }

  private void sweepQuietly() {
    // an exception would cancel the scheduled task for good
    try {
      sweepExpired();
    } catch (RuntimeException e) {
      log.error("Error cleaning up expired upstream sessions", e);
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " is required and cannot be empty");
    }
  }

  @Override
  public synchronized void close() {
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
  }
}
