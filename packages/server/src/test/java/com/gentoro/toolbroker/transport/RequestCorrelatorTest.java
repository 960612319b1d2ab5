package com.gentoro.toolbroker.transport;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.toolbroker.exception.ExceptionUtil;
import com.gentoro.toolbroker.exception.RemoteToolException;
import com.gentoro.toolbroker.exception.RequestTimeoutException;
import com.gentoro.toolbroker.exception.TransportException;
import com.gentoro.toolbroker.http.OkHttpFactory;
import com.gentoro.toolbroker.testing.FakeToolProvider;
import com.gentoro.toolbroker.testing.FakeToolProvider.Behavior;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RequestCorrelatorTest {

  private final OkHttpClient http = OkHttpFactory.create(Duration.ofSeconds(2), Duration.ofSeconds(5));
  private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);
  private FakeToolProvider provider;
  private ConnectionManager manager;
  private RequestCorrelator correlator;
  private ProviderConnection connection;

  @BeforeEach
  void setUp() throws Exception {
    provider =
        new FakeToolProvider()
            .withTool("echo", Behavior.ECHO)
            .withTool("silent", Behavior.SILENT)
            .withTool("progress", Behavior.PROGRESS)
            .withTool("explode", Behavior.ERROR)
            .start();
    manager = new ConnectionManager(http, scheduler, Duration.ofSeconds(2), Clock.systemUTC());
    correlator = new RequestCorrelator(http, scheduler, Clock.systemUTC());
    manager.addListener(correlator);
    connection = manager.getOrCreateConnection(provider.definition("grc"));
  }

  @AfterEach
  void tearDown() throws Exception {
    correlator.close();
    manager.close();
    provider.close();
    scheduler.shutdownNow();
  }

  private CompletableFuture<JsonNode> call(String tool, Duration timeout) {
    ObjectNode args = JacksonUtility.getJsonMapper().createObjectNode().put("q", tool);
    return correlator.send(connection, JsonRpc.TOOLS_CALL, JsonRpc.toolCall(tool, args), timeout);
  }

  private static Throwable failureOf(CompletableFuture<?> future) throws Exception {
    ExecutionException e =
        assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    return ExceptionUtil.unwrap(e);
  }

  @Test
  void responseResolvesTheMatchingRequest() throws Exception {
    JsonNode result = call("echo", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

    assertEquals("echo", result.get("tool").asText());
    assertEquals("echo", result.path("arguments").path("q").asText());
    assertEquals(0, correlator.pendingCount());
  }

  @Test
  void requestIdsIncreaseAndEnvelopeIsJsonRpc() throws Exception {
    call("echo", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);
    call("echo", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

    List<JsonNode> calls = provider.calls();
    assertEquals(2, calls.size());
    assertEquals("2.0", calls.get(0).get("jsonrpc").asText());
    assertEquals("tools/call", calls.get(0).get("method").asText());
    assertTrue(calls.get(1).get("id").asLong() > calls.get(0).get("id").asLong());
  }

  @Test
  void remoteErrorFailsTheRequest() throws Exception {
    Throwable failure = failureOf(call("explode", Duration.ofSeconds(5)));

    RemoteToolException remote = assertInstanceOf(RemoteToolException.class, failure);
    assertEquals(-32000, remote.getRemoteCode());
    assertEquals("tool exploded", remote.getMessage());
    assertEquals(0, correlator.pendingCount());
  }

  @Test
  void progressIsDeliveredAndEntryKeptUntilTheResult() throws Exception {
    List<JsonNode> progress = new CopyOnWriteArrayList<>();
    ObjectNode args = JacksonUtility.getJsonMapper().createObjectNode();
    JsonNode result =
        correlator
            .send(
                connection,
                JsonRpc.TOOLS_CALL,
                JsonRpc.toolCall("progress", args),
                Duration.ofSeconds(5),
                (id, data) -> progress.add(data))
            .get(5, TimeUnit.SECONDS);

    assertEquals(1, progress.size());
    assertEquals(50, progress.get(0).get("percent").asInt());
    assertEquals("progress", result.get("tool").asText());
  }

  @Test
  void unansweredRequestTimesOutOnceAndLateAnswerIsDiscarded() throws Exception {
    AtomicInteger completions = new AtomicInteger();
    CompletableFuture<JsonNode> future = call("silent", Duration.ofMillis(100));
    future.whenComplete((r, e) -> completions.incrementAndGet());

    assertInstanceOf(RequestTimeoutException.class, failureOf(future));
    assertEquals(0, correlator.pendingCount());

    long id = provider.callsTo("silent").get(0).get("id").asLong();
    ObjectNode late = JacksonUtility.getJsonMapper().createObjectNode();
    late.put("jsonrpc", "2.0").put("id", id).putObject("result");
    correlator.onMessage(connection, late);

    assertEquals(1, completions.get());
    assertTrue(connection.isEstablished());
  }

  @Test
  void thousandTimeoutsLeaveThePendingTableEmpty() throws Exception {
    AtomicInteger timeouts = new AtomicInteger();
    List<CompletableFuture<JsonNode>> futures = new ArrayList<>();
    for (int i = 0; i < 1000; i++) {
      CompletableFuture<JsonNode> f = call("silent", Duration.ofMillis(20));
      f.whenComplete(
          (r, e) -> {
            if (ExceptionUtil.unwrap(e) instanceof RequestTimeoutException) {
              timeouts.incrementAndGet();
            }
          });
      futures.add(f);
    }
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
        .handle((r, e) -> null)
        .get(30, TimeUnit.SECONDS);

    assertEquals(1000, timeouts.get());
    assertEquals(0, correlator.pendingCount());
  }

  @Test
  void rejectedSubmissionFailsTheRequestAndDropsTheConnection() throws Exception {
    provider.setMessageStatus(500);

    Throwable failure = failureOf(call("echo", Duration.ofSeconds(5)));

    assertInstanceOf(TransportException.class, failure);
    assertTrue(failure.getMessage().contains("HTTP 500"));
    assertFalse(connection.isEstablished());
    assertEquals(0, correlator.pendingCount());
  }

  @Test
  void lostConnectionFailsEveryPendingRequest() throws Exception {
    CompletableFuture<JsonNode> a = call("silent", Duration.ofSeconds(30));
    CompletableFuture<JsonNode> b = call("silent", Duration.ofSeconds(30));
    waitUntil(() -> provider.callsTo("silent").size() == 2);

    provider.closeStreams();

    assertInstanceOf(TransportException.class, failureOf(a));
    assertInstanceOf(TransportException.class, failureOf(b));
    assertEquals(0, correlator.pendingCount());
  }

  @Test
  void sendingOverAnAlreadyDroppedConnectionFailsAtOnce() throws Exception {
    manager.disconnect("grc");
    assertFalse(connection.isEstablished());

    CompletableFuture<JsonNode> late = call("echo", Duration.ofMinutes(5));

    assertTrue(late.isCompletedExceptionally());
    Throwable failure = failureOf(late);
    assertInstanceOf(TransportException.class, failure);
    assertTrue(failure.getMessage().contains("lost"));
    assertEquals(0, correlator.pendingCount());
    assertTrue(provider.calls().isEmpty());
  }

  @Test
  void requestThatCannotBeBuiltDoesNotStayPending() throws Exception {
    ProviderConnection broken =
        new ProviderConnection(
            "grc", "s-1", "not a url", mock(Call.class), Clock.systemUTC(), (c, e) -> {});

    CompletableFuture<JsonNode> future =
        correlator.send(
            broken,
            JsonRpc.TOOLS_CALL,
            JsonRpc.toolCall("echo", JacksonUtility.getJsonMapper().createObjectNode()),
            Duration.ofMinutes(5));

    assertInstanceOf(TransportException.class, failureOf(future));
    assertEquals(0, correlator.pendingCount());
  }

  @Test
  void messagesWithoutKnownIdAreIgnored() {
    ObjectNode notification = JacksonUtility.getJsonMapper().createObjectNode().put("event", "hi");
    ObjectNode stray = JacksonUtility.getJsonMapper().createObjectNode().put("id", 987654);
    stray.putObject("result");
    ObjectNode strayProgress =
        JacksonUtility.getJsonMapper().createObjectNode().put("type", "progress").put("requestId", 5);

    assertDoesNotThrow(() -> correlator.onMessage(connection, notification));
    assertDoesNotThrow(() -> correlator.onMessage(connection, stray));
    assertDoesNotThrow(() -> correlator.onMessage(connection, strayProgress));
    assertEquals(0, correlator.pendingCount());
  }

  private static void waitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        fail("condition not met within 5s");
      }
      Thread.sleep(20);
    }
  }
}
