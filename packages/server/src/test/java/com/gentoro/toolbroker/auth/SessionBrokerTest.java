package com.gentoro.toolbroker.auth;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.toolbroker.exception.AuthenticationException;
import com.gentoro.toolbroker.messages.ToolExecutionRequest;
import com.gentoro.toolbroker.provider.AuthMode;
import com.gentoro.toolbroker.provider.TenantProviderConfiguration;
import com.gentoro.toolbroker.session.InMemorySessionRepository;
import com.gentoro.toolbroker.session.SessionCreateRequest;
import com.gentoro.toolbroker.session.UpstreamSessionStore;
import com.gentoro.toolbroker.testing.MutableClock;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionBrokerTest {

  @Mock private CredentialStore credentialStore;

  private final CredentialCipher cipher = new CredentialCipher("broker-test");
  private MutableClock clock;
  private UpstreamSessionStore sessionStore;
  private SessionBroker broker;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
    sessionStore = new UpstreamSessionStore(new InMemorySessionRepository(), clock);
    broker = new SessionBroker(credentialStore, cipher, sessionStore);
  }

  private static TenantProviderConfiguration config(AuthMode mode) {
    return new TenantProviderConfiguration("acme", "grc", true, null, List.of(), mode);
  }

  private static ToolExecutionRequest.Builder request() {
    return ToolExecutionRequest.builder()
        .toolName("search_records")
        .arguments(JacksonUtility.getJsonMapper().createObjectNode())
        .tenantId("acme")
        .agentId("risk-agent")
        .connectionId("conn-1");
  }

  @Test
  void sessionDataOnTheRequestOverridesCredentialMode() {
    ToolExecutionRequest req =
        request()
            .sessionToken("tok-live")
            .userContext(Map.of("username", "alice", "instanceId", "prod"))
            .build();

    AuthPayload payload = broker.resolveAuth(req, config(AuthMode.CREDENTIAL));

    assertEquals(AuthMode.SESSION, payload.mode());
    assertEquals("tok-live", payload.field("session_token").asText());
    assertEquals("prod", payload.field("instance_id").asText());
    assertEquals("alice", payload.field("user_context").get("username").asText());
    verifyNoInteractions(credentialStore);
  }

  @Test
  void tokenWithoutUserContextDoesNotForceSessionMode() {
    StoredCredential stored = cipher.encrypt("acme", "conn-1", Map.of("apiKey", "k-1"));
    when(credentialStore.find("acme", "conn-1")).thenReturn(Optional.of(stored));

    AuthPayload payload =
        broker.resolveAuth(request().sessionToken("tok").build(), config(AuthMode.CREDENTIAL));

    assertEquals(AuthMode.CREDENTIAL, payload.mode());
  }

  @Test
  void credentialModeDecryptsTheStoredSecret() {
    StoredCredential stored = cipher.encrypt("acme", "conn-1", Map.of("apiKey", "k-1"));
    when(credentialStore.find("acme", "conn-1")).thenReturn(Optional.of(stored));

    AuthPayload payload = broker.resolveAuth(request().build(), config(AuthMode.CREDENTIAL));

    assertEquals(AuthMode.CREDENTIAL, payload.mode());
    assertEquals("conn-1", payload.field("connection_id").asText());
    assertEquals("k-1", payload.field("credentials").get("apiKey").asText());
    assertEquals("credential", payload.toJson().get("auth_mode").asText());
    assertFalse(payload.toString().contains("k-1"));
  }

  @Test
  void missingCredentialIsAnAuthenticationFailure() {
    when(credentialStore.find("acme", "conn-1")).thenReturn(Optional.empty());

    AuthenticationException e =
        assertThrows(
            AuthenticationException.class,
            () -> broker.resolveAuth(request().build(), config(AuthMode.CREDENTIAL)));
    assertTrue(e.getMessage().contains("not found"));
    assertEquals("conn-1", e.getContext().get("connectionId"));
  }

  @Test
  void sessionModeUsesTheStoredUpstreamSession() {
    String sessionId =
        sessionStore.create(
            new SessionCreateRequest(
                "acme",
                "u-1",
                "alice",
                "tok-stored",
                "prod",
                "https://grc.acme.example",
                "d-1",
                clock.instant().plus(Duration.ofHours(1))));

    AuthPayload payload =
        broker.resolveAuth(
            request().upstreamSessionId(sessionId).build(), config(AuthMode.SESSION));

    assertEquals(AuthMode.SESSION, payload.mode());
    assertEquals("tok-stored", payload.field("session_token").asText());
    assertEquals("https://grc.acme.example", payload.field("base_url").asText());
    assertEquals(sessionId, payload.field("session_id").asText());
  }

  @Test
  void sessionModeWithoutAnySessionAsksToAuthenticateFirst() {
    AuthenticationException e =
        assertThrows(
            AuthenticationException.class,
            () -> broker.resolveAuth(request().build(), config(AuthMode.SESSION)));
    assertTrue(e.getMessage().contains("authenticate first"));
  }

  @Test
  void expiredStoredSessionAsksToAuthenticateFirst() {
    String sessionId =
        sessionStore.create(
            new SessionCreateRequest(
                "acme", "u-1", "alice", "tok", "prod", null, null,
                clock.instant().plus(Duration.ofMinutes(1))));
    clock.advance(Duration.ofMinutes(2));

    AuthenticationException e =
        assertThrows(
            AuthenticationException.class,
            () ->
                broker.resolveAuth(
                    request().upstreamSessionId(sessionId).build(), config(AuthMode.SESSION)));
    assertTrue(e.getMessage().contains("authenticate first"));
  }

  @Test
  void registerCredentialStoresEncryptedSecret() {
    broker.registerCredential("acme", "conn-9", Map.of("password", "pw"));

    verify(credentialStore)
        .save(
            argThat(
                c ->
                    c.connectionId().equals("conn-9")
                        && !c.encryptedData().contains("pw")
                        && cipher.decrypt(c).get("password").asText().equals("pw")));
  }
}
