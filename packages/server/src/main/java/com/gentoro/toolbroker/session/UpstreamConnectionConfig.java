package com.gentoro.toolbroker.session;

import java.time.Instant;

/** What a provider needs to reach the upstream system on behalf of a stored session. */
public record UpstreamConnectionConfig(
    String baseUrl,
    String username,
    String instanceId,
    String sessionToken,
    String userDomainId,
    Instant sessionExpiresAt) {

  static UpstreamConnectionConfig from(UpstreamSession session) {
    return new UpstreamConnectionConfig(
        session.baseUrl(),
        session.username(),
        session.instanceId(),
        session.sessionToken(),
        session.userDomainId(),
        session.expiresAt());
  }
}
