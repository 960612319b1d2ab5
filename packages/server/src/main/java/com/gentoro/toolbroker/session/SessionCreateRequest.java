package com.gentoro.toolbroker.session;

import java.time.Instant;

/** Data produced by an upstream login, handed to {@link UpstreamSessionStore#create}. */
public record SessionCreateRequest(
    String tenantId,
    String userId,
    String username,
    String sessionToken,
    String instanceId,
    String baseUrl,
    String userDomainId,
    Instant expiresAt) {}
