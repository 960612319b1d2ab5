package com.gentoro.toolbroker.session;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Generic keyed store holding upstream session rows. Implementations must make each method atomic
 * with respect to a single session id; cross-row consistency is not required.
 */
public interface SessionRepository {

  /** Insert or replace the row with the session's id. */
  void save(UpstreamSession session);

  Optional<UpstreamSession> findById(String sessionId);

  /**
   * Replace the row with {@code change} applied to it, atomically with respect to every other
   * operation on the same id. Returns the stored row, or empty when no row exists.
   */
  Optional<UpstreamSession> update(String sessionId, UnaryOperator<UpstreamSession> change);

  /** @return true when a row was removed */
  boolean delete(String sessionId);

  /** Delete every row whose expiry is at or before {@code now}; returns the number removed. */
  int deleteExpired(Instant now);

  Collection<UpstreamSession> findAll();
}
