package com.gentoro.toolbroker.provider;

/** Wire transport a provider speaks for tool execution. */
public enum TransportKind {
  /** Server-sent event stream plus per-session POST submission address. */
  SSE;

  public static TransportKind parse(String value) {
    if (value == null || value.isBlank()) return SSE;
    return TransportKind.valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
  }
}
