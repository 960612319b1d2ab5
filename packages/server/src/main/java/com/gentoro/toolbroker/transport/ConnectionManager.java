package com.gentoro.toolbroker.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.toolbroker.concurrency.NamedThreadFactory;
import com.gentoro.toolbroker.exception.ExceptionUtil;
import com.gentoro.toolbroker.exception.SerializationException;
import com.gentoro.toolbroker.exception.TransportException;
import com.gentoro.toolbroker.http.OkHttpFactory;
import com.gentoro.toolbroker.provider.ProviderDefinition;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Keeps at most one streaming connection per provider id.
 *
 * <p>A connection is opened lazily by {@link #getOrCreateConnection}: a {@code GET {endpoint}/stream}
 * is issued and the first event announcing a session id completes the handshake. Every later event
 * is parsed as JSON and handed to the registered {@link StreamListener}s. Each stream is read by its
 * own daemon thread.
 *
 * <p>Any transport error drops the connection from the table; nothing is retried here, the next
 * call for the provider simply performs a fresh handshake.
 */
public class ConnectionManager implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(ConnectionManager.class);

  public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);

  private final OkHttpClient streamingClient;
  private final ScheduledExecutorService scheduler;
  private final Duration handshakeTimeout;
  private final Clock clock;
  private final ExecutorService readers =
      Executors.newCachedThreadPool(new NamedThreadFactory("provider-stream"));
  private final Map<String, CompletableFuture<ProviderConnection>> connections =
      new ConcurrentHashMap<>();
  private final List<StreamListener> listeners = new CopyOnWriteArrayList<>();

  public ConnectionManager(
      OkHttpClient httpClient,
      ScheduledExecutorService scheduler,
      Duration handshakeTimeout,
      Clock clock) {
    this.streamingClient = OkHttpFactory.streaming(Objects.requireNonNull(httpClient, "httpClient"));
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.handshakeTimeout = handshakeTimeout == null ? DEFAULT_HANDSHAKE_TIMEOUT : handshakeTimeout;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public void addListener(StreamListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Established connection for the provider, performing the handshake when none exists. Concurrent
   * callers for the same provider share one handshake.
   *
   * @throws TransportException when the stream cannot be opened or no session id is announced
   *     within the handshake timeout
   */
  public ProviderConnection getOrCreateConnection(ProviderDefinition provider) {
    Objects.requireNonNull(provider, "provider");
    // a connection can be dropped between the handshake and our read of it; one more attempt
    for (int attempt = 0; attempt < 2; attempt++) {
      CompletableFuture<ProviderConnection> future =
          connections.compute(
              provider.id(),
              (id, existing) ->
                  existing == null || existing.isCompletedExceptionally()
                      ? handshake(provider)
                      : existing);
      ProviderConnection connection = await(provider, future);
      if (connection.isEstablished()) {
        return connection;
      }
      connections.remove(provider.id(), future);
    }
    throw new TransportException(
        "Connection to provider " + provider.id() + " dropped right after the handshake");
  }

  public ConnectionState connectionState(String providerId) {
    CompletableFuture<ProviderConnection> future = connections.get(providerId);
    if (future == null) return ConnectionState.DISCONNECTED;
    if (!future.isDone()) return ConnectionState.CONNECTING;
    if (future.isCompletedExceptionally()) return ConnectionState.DISCONNECTED;
    return future.join().state();
  }

  /** Connections that completed their handshake and have not been dropped. */
  public List<ProviderConnection> activeConnections() {
    List<ProviderConnection> result = new ArrayList<>();
    for (CompletableFuture<ProviderConnection> future : connections.values()) {
      if (future.isDone() && !future.isCompletedExceptionally()) {
        ProviderConnection connection = future.join();
        if (connection.isEstablished()) {
          result.add(connection);
        }
      }
    }
    return result;
  }

  /** Close the provider's connection, or abort its pending handshake. */
  public void disconnect(String providerId) {
    CompletableFuture<ProviderConnection> future = connections.remove(providerId);
    if (future == null) return;
    TransportException cause =
        new TransportException("Connection to provider " + providerId + " closed by the broker");
    if (!future.completeExceptionally(cause) && !future.isCompletedExceptionally()) {
      drop(future.join(), cause);
    }
  }

  private CompletableFuture<ProviderConnection> handshake(ProviderDefinition provider) {
    CompletableFuture<ProviderConnection> future = new CompletableFuture<>();
    Request request =
        new Request.Builder()
            .url(provider.streamEndpoint())
            .header("Accept", "text/event-stream")
            .header("Cache-Control", "no-cache")
            .get()
            .build();
    Call call = streamingClient.newCall(request);

    ScheduledFuture<?> timeout =
        scheduler.schedule(
            () -> {
              TransportException e =
                  new TransportException(
                      "Handshake with provider "
                          + provider.id()
                          + " timed out after "
                          + handshakeTimeout.toMillis()
                          + "ms",
                      Map.of("providerId", provider.id(), "endpoint", provider.streamEndpoint()),
                      null);
              future.completeExceptionally(e);
            },
            handshakeTimeout.toMillis(),
            TimeUnit.MILLISECONDS);

    future.whenComplete(
        (connection, error) -> {
          timeout.cancel(false);
          if (error != null) {
            call.cancel();
            connections.remove(provider.id(), future);
          }
        });

    log.debug("Opening event stream to provider {} at {}", provider.id(), provider.streamEndpoint());
    readers.execute(() -> readStream(provider, call, future));
    return future;
  }

  private void readStream(
      ProviderDefinition provider, Call call, CompletableFuture<ProviderConnection> handshake) {
    ProviderConnection connection = null;
    Throwable cause = null;
    try (Response response = call.execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new TransportException(
            "Provider "
                + provider.id()
                + " rejected the event stream with HTTP "
                + response.code(),
            Map.of("providerId", provider.id(), "status", response.code()),
            null);
      }
      SseEventReader reader = new SseEventReader(body.source());
      SseEvent event;
      while ((event = reader.next()) != null) {
        if (connection == null) {
          String sessionId = announcedSessionId(event);
          if (sessionId == null) {
            log.debug("Ignoring pre-handshake event '{}' from {}", event.event(), provider.id());
            continue;
          }
          connection =
              new ProviderConnection(
                  provider.id(),
                  sessionId,
                  provider.messageEndpoint(sessionId),
                  call,
                  clock,
                  this::drop);
          if (!handshake.complete(connection)) {
            // handshake already timed out or was aborted
            connection.markClosed();
            return;
          }
          log.info("Connected to provider {} (session {})", provider.id(), sessionId);
          continue;
        }
        dispatch(connection, event);
      }
      cause = new TransportException("Provider " + provider.id() + " closed the event stream");
    } catch (IOException e) {
      cause =
          new TransportException(
              "Event stream of provider " + provider.id() + " failed: " + e.getMessage(),
              Map.of("providerId", provider.id()),
              e);
    } catch (RuntimeException e) {
      cause = e;
    } finally {
      if (connection != null) {
        drop(connection, cause);
      } else if (cause != null) {
        handshake.completeExceptionally(cause);
      } else {
        handshake.completeExceptionally(
            new TransportException("Provider " + provider.id() + " ended the stream"));
      }
    }
  }

  private void dispatch(ProviderConnection connection, SseEvent event) {
    if (!event.hasData()) return;
    JsonNode message;
    try {
      message = JacksonUtility.readTree(event.data());
    } catch (SerializationException e) {
      log.warn(
          "Discarding malformed message from provider {}: {}",
          connection.providerId(),
          e.getMessage());
      return;
    }
    connection.touch();
    for (StreamListener listener : listeners) {
      try {
        listener.onMessage(connection, message);
      } catch (RuntimeException e) {
        log.error("Stream listener failed on message from {}", connection.providerId(), e);
      }
    }
  }

  /**
   * Session id carried by a handshake event. Accepts {@code event: endpoint} with the message path
   * as data (session id is its last segment or its {@code sessionId} query parameter) and a JSON
   * data line with a {@code sessionId} field.
   */
  static String announcedSessionId(SseEvent event) {
    if (!event.hasData()) return null;
    String data = event.data().trim();
    if ("endpoint".equals(event.event())) {
      int query = data.indexOf("sessionId=");
      if (query >= 0) {
        String value = data.substring(query + "sessionId=".length());
        int amp = value.indexOf('&');
        return blankToNull(amp < 0 ? value : value.substring(0, amp));
      }
      String path = data.endsWith("/") ? data.substring(0, data.length() - 1) : data;
      return blankToNull(path.substring(path.lastIndexOf('/') + 1));
    }
    if (!data.startsWith("{")) return null;
    try {
      JsonNode node = JacksonUtility.readTree(data);
      return node.hasNonNull("sessionId") ? blankToNull(node.get("sessionId").asText()) : null;
    } catch (SerializationException e) {
      log.debug("Handshake candidate is not JSON: {}", data);
      return null;
    }
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s;
  }

  /** Remove a failed connection and notify listeners; later calls for it are no-ops. */
  void drop(ProviderConnection connection, Throwable cause) {
    if (!connection.markClosed()) return;
    connections.computeIfPresent(
        connection.providerId(),
        (id, future) ->
            future.isDone() && !future.isCompletedExceptionally() && future.join() == connection
                ? null
                : future);
    connection.cancelStream();
    if (cause == null) {
      log.info("Connection to provider {} closed", connection.providerId());
    } else {
      log.warn(
          "Connection to provider {} dropped: {}",
          connection.providerId(),
          ExceptionUtil.describe(cause));
    }
    for (StreamListener listener : listeners) {
      try {
        listener.onClosed(connection, cause);
      } catch (RuntimeException e) {
        log.error("Stream listener failed while handling disconnect of {}", connection.providerId(), e);
      }
    }
  }

  private ProviderConnection await(
      ProviderDefinition provider, CompletableFuture<ProviderConnection> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          cause ->
              new TransportException(
                  "Unable to connect to provider " + provider.id(),
                  Map.of("providerId", provider.id()),
                  cause));
    }
  }

  @Override
  public void close() {
    for (String providerId : new ArrayList<>(connections.keySet())) {
      disconnect(providerId);
    }
    readers.shutdownNow();
    log.info("Connection manager closed");
  }
}
