package com.gentoro.toolbroker.transport;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface ProgressListener {
  void onProgress(long requestId, JsonNode data);
}
