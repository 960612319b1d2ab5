package com.gentoro.toolbroker.transport;

import com.fasterxml.jackson.databind.JsonNode;

/** Receives what providers push over their event streams. Called on the stream reader thread. */
public interface StreamListener {

  /** A JSON message arrived after the session announcement. */
  default void onMessage(ProviderConnection connection, JsonNode message) {}

  /** The connection was dropped; called once per connection. */
  default void onClosed(ProviderConnection connection, Throwable cause) {}
}
