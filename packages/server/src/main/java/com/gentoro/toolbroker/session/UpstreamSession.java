package com.gentoro.toolbroker.session;

import java.time.Instant;

/**
 * Opaque upstream session held on behalf of a tenant user. Routing fields tell providers which
 * upstream instance the token belongs to.
 */
public record UpstreamSession(
    String sessionId,
    String tenantId,
    String userId,
    String username,
    String sessionToken,
    String instanceId,
    String baseUrl,
    String userDomainId,
    Instant expiresAt,
    Instant createdAt,
    Instant updatedAt) {

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }

  UpstreamSession withToken(String token, Instant newExpiry, Instant now) {
    return new UpstreamSession(
        sessionId, tenantId, userId, username, token, instanceId, baseUrl, userDomainId,
        newExpiry, createdAt, now);
  }

  UpstreamSession withExpiry(Instant newExpiry, Instant now) {
    return withToken(sessionToken, newExpiry, now);
  }

  UpstreamSession touched(Instant now) {
    return withToken(sessionToken, expiresAt, now);
  }
}
