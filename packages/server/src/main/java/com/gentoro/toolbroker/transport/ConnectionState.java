package com.gentoro.toolbroker.transport;

/** Lifecycle of the streaming connection to one provider. */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  ESTABLISHED
}
