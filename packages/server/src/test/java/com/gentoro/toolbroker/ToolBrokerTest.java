package com.gentoro.toolbroker;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.toolbroker.exception.ConfigException;
import com.gentoro.toolbroker.exception.StateException;
import com.gentoro.toolbroker.health.HealthStatus;
import com.gentoro.toolbroker.health.ProviderHealth;
import com.gentoro.toolbroker.http.OkHttpFactory;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ToolBrokerTest {

  private ToolBroker broker;

  @AfterEach
  void tearDown() {
    if (broker != null) {
      broker.shutdown();
    }
  }

  private static ToolBroker brokerFor(String... args) {
    return new ToolBroker(new StartupParameters(args), Clock.systemUTC());
  }

  private static JsonNode get(String url) throws Exception {
    OkHttpClient client = OkHttpFactory.create(Duration.ofSeconds(2), Duration.ofSeconds(2));
    try (Response response = client.newCall(new Request.Builder().url(url).build()).execute()) {
      assertEquals(200, response.code());
      return JacksonUtility.readTree(response.body().string());
    }
  }

  @Test
  void serverModeExposesActuatorEndpoints() throws Exception {
    broker = brokerFor("--config-file", "classpath:broker-test.yaml");
    broker.initialize();

    assertTrue(broker.httpServer().isRunning());
    String base = "http://127.0.0.1:" + broker.httpServer().getPort();

    assertEquals("UP", get(base + "/actuator/health").get("status").asText());

    JsonNode status = get(base + "/actuator/broker");
    assertTrue(status.get("connections").isArray());
    assertEquals(0, status.get("pendingRequests").asInt());
    assertEquals(0, status.get("lockedTenants").asInt());
    assertEquals(0, status.path("sessions").path("totalSessions").asInt());
  }

  @Test
  void checkReportsUnreachableProviders() {
    broker = brokerFor("--config-file", "classpath:broker-test.yaml");
    broker.initialize();

    List<ProviderHealth> report = broker.checkProviders();

    assertEquals(1, report.size());
    assertEquals("offline", report.get(0).providerId());
    assertEquals(HealthStatus.UNHEALTHY, report.get(0).status());
  }

  @Test
  void helpModeWiresNothing() {
    broker = brokerFor("--mode", "help");
    broker.initialize();

    assertThrows(StateException.class, () -> broker.configuration());
    assertThrows(StateException.class, () -> broker.toolRouter());
  }

  @Test
  void initializeTwiceIsRejected() {
    broker = brokerFor("--mode", "help");
    broker.initialize();

    assertThrows(StateException.class, () -> broker.initialize());
  }

  @Test
  void componentsAreUnavailableBeforeInitialize() {
    broker = brokerFor();

    assertThrows(StateException.class, () -> broker.configuration());
    assertThrows(StateException.class, () -> broker.sessionBroker());
  }

  @Test
  void missingCredentialKeyFailsStartup(@TempDir Path dir) throws Exception {
    Path config = dir.resolve("broker.yaml");
    Files.writeString(
        config,
        """
        http:
          port: 0
        providers:
          offline:
            endpoint: "http://127.0.0.1:1"
        """);
    broker = brokerFor("--config-file", config.toString());

    ConfigException e = assertThrows(ConfigException.class, () -> broker.initialize());
    assertTrue(e.getMessage().contains("broker.credentials.key"));
  }
}
