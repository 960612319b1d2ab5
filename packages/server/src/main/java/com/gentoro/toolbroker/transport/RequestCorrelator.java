package com.gentoro.toolbroker.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.gentoro.toolbroker.exception.ExceptionUtil;
import com.gentoro.toolbroker.exception.RemoteToolException;
import com.gentoro.toolbroker.exception.RequestTimeoutException;
import com.gentoro.toolbroker.exception.TransportException;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Matches responses arriving on provider event streams to the requests that caused them.
 *
 * <p>Each request gets a process-wide increasing id and a pending entry. The entry is removed
 * exactly once, by whichever comes first of: the response, the timeout, the loss of the connection
 * or a rejected submission. Responses for ids with no entry (late, duplicate or foreign) are
 * logged and dropped.
 */
public class RequestCorrelator implements StreamListener, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(RequestCorrelator.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;
  private final AtomicLong nextId = new AtomicLong();
  private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();

  public RequestCorrelator(
      OkHttpClient httpClient, ScheduledExecutorService scheduler, Clock clock) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public CompletableFuture<JsonNode> send(
      ProviderConnection connection, String method, JsonNode params, Duration timeout) {
    return send(connection, method, params, timeout, null);
  }

  /**
   * Submit a request over {@code connection}. The returned future completes with the {@code result}
   * member of the response, or exceptionally with {@link RemoteToolException}, {@link
   * RequestTimeoutException} or {@link TransportException}.
   */
  public CompletableFuture<JsonNode> send(
      ProviderConnection connection,
      String method,
      JsonNode params,
      Duration timeout,
      ProgressListener progressListener) {
    Objects.requireNonNull(connection, "connection");
    Objects.requireNonNull(timeout, "timeout");
    long id = nextId.incrementAndGet();
    CompletableFuture<JsonNode> result = new CompletableFuture<>();
    PendingRequest request =
        new PendingRequest(
            id, method, connection, result, progressListener, clock.instant().plus(timeout));
    pending.put(id, request);
    if (!connection.isEstablished()) {
      // dropped after the caller obtained it; the close sweep may already have run
      failIfPending(
          id,
          new TransportException(
              "Connection to provider " + connection.providerId() + " lost",
              Map.of("requestId", id, "providerId", connection.providerId()),
              null));
      return result;
    }

    Request post;
    try {
      String body = JacksonUtility.toJson(JsonRpc.request(id, method, params));
      post =
          new Request.Builder()
              .url(connection.messageUrl())
              .post(RequestBody.create(body, JSON))
              .build();
    } catch (RuntimeException e) {
      failIfPending(
          id,
          ExceptionUtil.rethrowIfUnchecked(
              e,
              cause ->
                  new TransportException(
                      "Request #" + id + " to provider " + connection.providerId()
                          + " could not be built",
                      Map.of("requestId", id, "providerId", connection.providerId()),
                      cause)));
      return result;
    }

    ScheduledFuture<?> task =
        scheduler.schedule(() -> expire(id, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
    request.timeoutTask(task);
    if (!pending.containsKey(id)) {
      // resolved before the timer was attached
      task.cancel(false);
    }

    log.debug("Sending {} #{} to provider {}", method, id, connection.providerId());
    connection.touch();
    httpClient.newCall(post).enqueue(new SubmissionCallback(id, connection));
    return result;
  }

  /** Number of requests still waiting for a response. */
  public int pendingCount() {
    return pending.size();
  }

  @Override
  public void onMessage(ProviderConnection connection, JsonNode message) {
    long id = JsonRpc.correlationId(message);
    if (JsonRpc.isProgress(message)) {
      PendingRequest request = id < 0 ? null : pending.get(id);
      if (request == null) {
        log.debug("Progress for unknown request {} from {} discarded", id, connection.providerId());
        return;
      }
      if (request.progressListener != null) {
        request.progressListener.onProgress(id, message.path("data"));
      }
      return;
    }
    if (id < 0) {
      log.debug("Notification without request id from {} ignored", connection.providerId());
      return;
    }

    PendingRequest request = pending.remove(id);
    if (request == null) {
      log.warn(
          "Discarding response for unknown request id {} from provider {}",
          id,
          connection.providerId());
      return;
    }
    JsonNode error = message.get("error");
    if (error != null && !error.isNull()) {
      int code = error.path("code").asInt(-32603);
      String text = error.path("message").asText("Provider returned an error");
      log.debug("Request #{} failed remotely with code {}: {}", id, code, text);
      request.fail(
          new RemoteToolException(
              code,
              text,
              Map.of("requestId", id, "providerId", connection.providerId())));
      return;
    }
    JsonNode result = message.get("result");
    request.complete(result == null ? NullNode.getInstance() : result);
  }

  @Override
  public void onClosed(ProviderConnection connection, Throwable cause) {
    int failed = failPending(connection, cause);
    if (failed > 0) {
      log.warn(
          "Failed {} pending request(s) after losing provider {}",
          failed,
          connection.providerId());
    }
  }

  /** Fail every request still waiting on {@code connection}; returns how many were failed. */
  int failPending(ProviderConnection connection, Throwable cause) {
    int failed = 0;
    for (PendingRequest request : new ArrayList<>(pending.values())) {
      if (request.connection == connection && pending.remove(request.id, request)) {
        request.fail(
            new TransportException(
                "Connection to provider " + connection.providerId() + " lost",
                Map.of("requestId", request.id, "providerId", connection.providerId()),
                cause));
        failed++;
      }
    }
    return failed;
  }

  private void expire(long id, Duration timeout) {
    PendingRequest request = pending.remove(id);
    if (request == null) return;
    log.warn(
        "Request #{} ({}) to provider {} timed out after {}ms",
        id,
        request.method,
        request.connection.providerId(),
        timeout.toMillis());
    request.fail(
        new RequestTimeoutException(
            "Request to provider "
                + request.connection.providerId()
                + " timed out after "
                + timeout.toMillis()
                + "ms"));
  }

  private void failIfPending(long id, Throwable error) {
    PendingRequest request = pending.remove(id);
    if (request != null) {
      request.fail(error);
    }
  }

  private void reject(long id, ProviderConnection connection, TransportException error) {
    PendingRequest request = pending.remove(id);
    connection.fail(error);
    if (request != null) {
      request.fail(error);
    }
  }

  private final class SubmissionCallback implements Callback {
    private final long id;
    private final ProviderConnection connection;

    SubmissionCallback(long id, ProviderConnection connection) {
      this.id = id;
      this.connection = connection;
    }

    @Override
    public void onResponse(Call call, Response response) {
      try (response) {
        if (!response.isSuccessful()) {
          reject(
              id,
              connection,
              new TransportException(
                  "Provider "
                      + connection.providerId()
                      + " rejected request #"
                      + id
                      + " with HTTP "
                      + response.code(),
                  Map.of("requestId", id, "status", response.code()),
                  null));
        }
      }
    }

    @Override
    public void onFailure(Call call, IOException e) {
      reject(
          id,
          connection,
          new TransportException(
              "Submitting request #"
                  + id
                  + " to provider "
                  + connection.providerId()
                  + " failed: "
                  + ExceptionUtil.describe(e),
              Map.of("requestId", id, "providerId", connection.providerId()),
              e));
    }
  }

  @Override
  public void close() {
    for (PendingRequest request : new ArrayList<>(pending.values())) {
      if (pending.remove(request.id, request)) {
        request.fail(new TransportException("Request correlator shut down"));
      }
    }
  }
}
