package com.gentoro.toolbroker.routing;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.toolbroker.auth.SessionBroker;
import com.gentoro.toolbroker.concurrency.TenantMutex;
import com.gentoro.toolbroker.exception.ValidationException;
import com.gentoro.toolbroker.health.HealthMonitor;
import com.gentoro.toolbroker.messages.ToolExecutionRequest;
import com.gentoro.toolbroker.provider.AgentDirectory;
import com.gentoro.toolbroker.transport.ConnectionManager;
import com.gentoro.toolbroker.transport.RequestCorrelator;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ToolRouterValidationTest {

  @Mock private AgentDirectory directory;
  @Mock private HealthMonitor healthMonitor;
  @Mock private ToolDiscoveryClient discovery;
  @Mock private ConnectionManager connections;
  @Mock private RequestCorrelator correlator;
  @Mock private SessionBroker sessionBroker;
  @Mock private ExecutorService workers;

  private ToolRouter router;

  @BeforeEach
  void setUp() {
    router =
        new ToolRouter(
            directory,
            healthMonitor,
            discovery,
            connections,
            correlator,
            sessionBroker,
            new TenantMutex(),
            workers,
            Clock.systemUTC());
  }

  @AfterEach
  void noCollaboratorWasTouched() {
    verifyNoInteractions(
        directory, healthMonitor, discovery, connections, correlator, sessionBroker, workers);
  }

  private static ToolExecutionRequest.Builder valid() {
    return ToolExecutionRequest.builder()
        .toolName("search_records")
        .arguments(JacksonUtility.getJsonMapper().createObjectNode())
        .tenantId("acme")
        .agentId("risk-agent")
        .connectionId("conn-1");
  }

  @Test
  void missingToolNameIsRejected() {
    assertThrows(
        ValidationException.class, () -> router.executeToolCall(valid().toolName(" ").build()));
  }

  @Test
  void missingTenantIsRejected() {
    assertThrows(
        ValidationException.class, () -> router.executeToolCall(valid().tenantId(null).build()));
  }

  @Test
  void missingConnectionIsRejected() {
    assertThrows(
        ValidationException.class, () -> router.executeToolCall(valid().connectionId("").build()));
  }

  @Test
  void nonObjectArgumentsAreRejected() {
    assertThrows(
        ValidationException.class,
        () ->
            router.executeToolCall(
                valid().arguments(JacksonUtility.getJsonMapper().createArrayNode()).build()));
    assertThrows(
        ValidationException.class, () -> router.executeToolCall(valid().arguments(null).build()));
  }

  @Test
  void nullRequestIsRejected() {
    assertThrows(ValidationException.class, () -> router.executeToolCall(null));
  }

  @Test
  void agentToolsRequireTenantAndAgent() {
    assertThrows(ValidationException.class, () -> router.getAgentTools(null, "risk-agent"));
    assertThrows(ValidationException.class, () -> router.getAgentTools("acme", " "));
    assertThrows(ValidationException.class, () -> router.getTenantProviderHealth(""));
  }
}
