package com.gentoro.toolbroker.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.toolbroker.exception.AuthenticationException;
import com.gentoro.toolbroker.messages.ToolExecutionRequest;
import com.gentoro.toolbroker.provider.AuthMode;
import com.gentoro.toolbroker.provider.TenantProviderConfiguration;
import com.gentoro.toolbroker.session.UpstreamConnectionConfig;
import com.gentoro.toolbroker.session.UpstreamSessionStore;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides, per tool call, which authentication material travels to the provider.
 *
 * <p>A request that carries both a session token and user context always runs in {@link
 * AuthMode#SESSION}, whatever the tenant configured. Otherwise the configured mode applies:
 *
 * <ul>
 *   <li>SESSION: the request's token, or the session store's view of {@code upstreamSessionId}.
 *   <li>CREDENTIAL: the stored credential of the request's connection, decrypted.
 * </ul>
 */
public class SessionBroker {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(SessionBroker.class);

  private final CredentialStore credentialStore;
  private final CredentialCipher cipher;
  private final UpstreamSessionStore sessionStore;

  public SessionBroker(
      CredentialStore credentialStore, CredentialCipher cipher, UpstreamSessionStore sessionStore) {
    this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore");
    this.cipher = Objects.requireNonNull(cipher, "cipher");
    this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
  }

  /** Encrypt and store the secret used for {@code connectionId} in credential mode. */
  public void registerCredential(String tenantId, String connectionId, Map<String, ?> secret) {
    credentialStore.save(cipher.encrypt(tenantId, connectionId, secret));
    log.info("Registered credential for connection {} of tenant {}", connectionId, tenantId);
  }

  public AuthPayload resolveAuth(ToolExecutionRequest request, TenantProviderConfiguration config) {
    if (request.hasSessionData()) {
      if (config.authMode() != AuthMode.SESSION) {
        log.debug(
            "Request for {} carries session data; using session mode instead of {}",
            config.providerId(),
            config.authMode());
      }
      return fromRequestSession(request);
    }
    return switch (config.authMode()) {
      case SESSION -> fromStoredSession(request, config);
      case CREDENTIAL -> fromStoredCredential(request, config);
    };
  }

  private AuthPayload fromRequestSession(ToolExecutionRequest request) {
    ObjectNode fields = JacksonUtility.getJsonMapper().createObjectNode();
    fields.put("session_token", request.sessionToken());
    fields.set("user_context", JacksonUtility.valueToTree(request.userContext()));
    copyText(request.userContext(), "baseUrl", fields, "base_url");
    copyText(request.userContext(), "instanceId", fields, "instance_id");
    copyText(request.userContext(), "username", fields, "username");
    copyText(request.userContext(), "userDomainId", fields, "user_domain_id");
    return new AuthPayload(AuthMode.SESSION, fields);
  }

  private AuthPayload fromStoredSession(
      ToolExecutionRequest request, TenantProviderConfiguration config) {
    String sessionId = request.upstreamSessionId();
    if (sessionId == null || sessionId.isBlank()) {
      throw new AuthenticationException(
          "No upstream session for provider " + config.providerId() + "; authenticate first",
          Map.of("tenantId", config.tenantId(), "providerId", config.providerId()));
    }
    Optional<UpstreamConnectionConfig> connection = sessionStore.connectionConfig(sessionId);
    if (connection.isEmpty()) {
      throw new AuthenticationException(
          "Upstream session expired or missing; authenticate first",
          Map.of("tenantId", config.tenantId(), "providerId", config.providerId()));
    }
    UpstreamConnectionConfig c = connection.get();
    ObjectNode fields = JacksonUtility.getJsonMapper().createObjectNode();
    fields.put("session_id", sessionId);
    fields.put("session_token", c.sessionToken());
    fields.put("base_url", c.baseUrl());
    fields.put("instance_id", c.instanceId());
    fields.put("username", c.username());
    fields.put("user_domain_id", c.userDomainId());
    if (c.sessionExpiresAt() != null) {
      fields.put("session_expires_at", c.sessionExpiresAt().toString());
    }
    return new AuthPayload(AuthMode.SESSION, fields);
  }

  private AuthPayload fromStoredCredential(
      ToolExecutionRequest request, TenantProviderConfiguration config) {
    StoredCredential stored =
        credentialStore
            .find(request.tenantId(), request.connectionId())
            .orElseThrow(
                () ->
                    new AuthenticationException(
                        "Stored credential not found for connection " + request.connectionId(),
                        Map.of(
                            "tenantId", request.tenantId(),
                            "connectionId", request.connectionId(),
                            "providerId", config.providerId())));
    JsonNode secret = cipher.decrypt(stored);
    ObjectNode fields = JacksonUtility.getJsonMapper().createObjectNode();
    fields.put("connection_id", request.connectionId());
    fields.set("credentials", secret);
    log.debug(
        "Resolved stored credential of connection {} for provider {}",
        request.connectionId(),
        config.providerId());
    return new AuthPayload(AuthMode.CREDENTIAL, fields);
  }

  private static void copyText(
      Map<String, Object> source, String sourceKey, ObjectNode target, String targetKey) {
    Object value = source.get(sourceKey);
    if (value != null) {
      target.put(targetKey, value.toString());
    }
  }
}
