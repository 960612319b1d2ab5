package com.gentoro.toolbroker.concurrency;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion for operations that reach a single-session upstream.
 *
 * <p>The registry maps each key to the release marker of the most recent operation that attached
 * to it. A caller atomically swaps in its own marker, waits for the previous one, runs, and
 * completes its marker in a {@code finally} block. Operations under the same key therefore run one
 * at a time in the order they attached; operations under different keys never wait on each other.
 *
 * <p>The marker is removed from the registry by the operation that installed it if nobody attached
 * behind it, so idle keys do not accumulate.
 *
 * <p>Not reentrant: calling {@code withExclusive} for a key from inside an operation already
 * holding that key deadlocks.
 */
public class TenantMutex {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(TenantMutex.class);

  private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

  /** Mutex key for a tenant, optionally narrowed to one upstream resource (e.g. an instance). */
  public static String key(String tenantId, String resource) {
    Objects.requireNonNull(tenantId, "tenantId");
    return resource == null || resource.isBlank() ? tenantId : tenantId + ":" + resource;
  }

  /**
   * Run {@code operation} on the calling thread once every earlier operation for {@code key} has
   * finished. Exceptions thrown by the operation propagate unchanged after the key is released.
   */
  public <T> T withExclusive(String key, Supplier<T> operation) {
    Objects.requireNonNull(operation, "operation");
    CompletableFuture<Void> release = new CompletableFuture<>();
    CompletableFuture<Void> previous = attach(key, release);
    try {
      previous.join();
      log.trace("Acquired exclusive section for {}", key);
      return operation.get();
    } finally {
      release(key, release);
    }
  }

  /**
   * Asynchronous variant: {@code operation} is invoked once earlier operations for {@code key} are
   * done, and the key stays held until the future it returns completes.
   */
  public <T> CompletableFuture<T> withExclusiveAsync(
      String key, Supplier<CompletableFuture<T>> operation) {
    Objects.requireNonNull(operation, "operation");
    CompletableFuture<Void> release = new CompletableFuture<>();
    CompletableFuture<Void> previous = attach(key, release);
    CompletableFuture<T> result = previous.thenCompose(ignored -> operation.get());
    result.whenComplete((value, error) -> release(key, release));
    return result;
  }

  /** Number of keys that currently have a running or waiting operation. */
  public int activeKeys() {
    return tails.size();
  }

  private CompletableFuture<Void> attach(String key, CompletableFuture<Void> release) {
    Objects.requireNonNull(key, "key");
    CompletableFuture<?>[] previous = new CompletableFuture<?>[1];
    tails.compute(
        key,
        (k, tail) -> {
          previous[0] = tail;
          return release;
        });
    if (previous[0] == null) {
      return CompletableFuture.completedFuture(null);
    }
    log.debug("Operation for {} queued behind a running one", key);
    // markers are only ever completed normally, so this never propagates an error
    return previous[0].thenApply(ignored -> null);
  }

  private void release(String key, CompletableFuture<Void> release) {
    tails.remove(key, release);
    release.complete(null);
  }
}
