package com.gentoro.toolbroker.session;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/** Process-local {@link SessionRepository}. Rows are lost on restart. */
public class InMemorySessionRepository implements SessionRepository {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(InMemorySessionRepository.class);
  private final Map<String, UpstreamSession> rows = new ConcurrentHashMap<>();

  @Override
  public void save(UpstreamSession session) {
    rows.put(session.sessionId(), session);
    log.trace("SessionRepository: save {}", session.sessionId());
  }

  @Override
  public Optional<UpstreamSession> findById(String sessionId) {
    return Optional.ofNullable(rows.get(sessionId));
  }

  @Override
  public Optional<UpstreamSession> update(
      String sessionId, UnaryOperator<UpstreamSession> change) {
    return Optional.ofNullable(rows.computeIfPresent(sessionId, (id, row) -> change.apply(row)));
  }

  @Override
  public boolean delete(String sessionId) {
    return rows.remove(sessionId) != null;
  }

  @Override
  public int deleteExpired(Instant now) {
    int removed = 0;
    for (UpstreamSession session : rows.values()) {
      // conditional remove: a concurrent re-login replaces the row and must survive the sweep
      if (session.isExpiredAt(now) && rows.remove(session.sessionId(), session)) {
        removed++;
      }
    }
    return removed;
  }

  @Override
  public Collection<UpstreamSession> findAll() {
    return List.copyOf(rows.values());
  }
}
