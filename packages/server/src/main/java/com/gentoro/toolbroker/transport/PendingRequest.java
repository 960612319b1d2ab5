package com.gentoro.toolbroker.transport;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/** A request waiting for its response. Owned by {@link RequestCorrelator}. */
final class PendingRequest {
  final long id;
  final String method;
  final ProviderConnection connection;
  final CompletableFuture<JsonNode> result;
  final ProgressListener progressListener;
  final Instant deadline;
  private volatile ScheduledFuture<?> timeoutTask;

  PendingRequest(
      long id,
      String method,
      ProviderConnection connection,
      CompletableFuture<JsonNode> result,
      ProgressListener progressListener,
      Instant deadline) {
    this.id = id;
    this.method = method;
    this.connection = connection;
    this.result = result;
    this.progressListener = progressListener;
    this.deadline = deadline;
  }

  void timeoutTask(ScheduledFuture<?> task) {
    this.timeoutTask = task;
  }

  void complete(JsonNode value) {
    cancelTimeout();
    result.complete(value);
  }

  void fail(Throwable error) {
    cancelTimeout();
    result.completeExceptionally(error);
  }

  private void cancelTimeout() {
    ScheduledFuture<?> task = timeoutTask;
    if (task != null) {
      task.cancel(false);
    }
  }
}
