package com.gentoro.toolbroker.transport;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import okhttp3.Call;

/**
 * An established streaming session with one provider. Instances are created by {@link
 * ConnectionManager} once the provider has announced its session id and are never reused after
 * being dropped.
 */
public class ProviderConnection {
  private final String providerId;
  private final String sessionId;
  private final String messageUrl;
  private final Call streamCall;
  private final Clock clock;
  private final BiConsumer<ProviderConnection, Throwable> failureHandler;
  private final Instant createdAt;
  private final AtomicInteger errorCount = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile Instant lastUsed;

  ProviderConnection(
      String providerId,
      String sessionId,
      String messageUrl,
      Call streamCall,
      Clock clock,
      BiConsumer<ProviderConnection, Throwable> failureHandler) {
    this.providerId = providerId;
    this.sessionId = sessionId;
    this.messageUrl = messageUrl;
    this.streamCall = streamCall;
    this.clock = clock;
    this.failureHandler = failureHandler;
    this.createdAt = clock.instant();
    this.lastUsed = createdAt;
  }

  public String providerId() {
    return providerId;
  }

  public String sessionId() {
    return sessionId;
  }

  /** Where requests for this session are POSTed. */
  public String messageUrl() {
    return messageUrl;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant lastUsed() {
    return lastUsed;
  }

  public int errorCount() {
    return errorCount.get();
  }

  public ConnectionState state() {
    return closed.get() ? ConnectionState.DISCONNECTED : ConnectionState.ESTABLISHED;
  }

  public boolean isEstablished() {
    return !closed.get();
  }

  void touch() {
    lastUsed = clock.instant();
  }

  /**
   * Report a transport failure observed while using this connection. The connection is dropped and
   * the next call to the provider performs a new handshake.
   */
  public void fail(Throwable cause) {
    errorCount.incrementAndGet();
    failureHandler.accept(this, cause);
  }

  /** True for the first caller only. */
  boolean markClosed() {
    return closed.compareAndSet(false, true);
  }

  void cancelStream() {
    streamCall.cancel();
  }

  @Override
  public String toString() {
    return "ProviderConnection{providerId="
        + providerId
        + ", sessionId="
        + sessionId
        + ", state="
        + state()
        + ", errors="
        + errorCount.get()
        + '}';
  }
}
