package com.gentoro.toolbroker.transport;

/**
 * One server-sent event.
 *
 * @param event value of the {@code event:} field, {@code message} when absent
 * @param data {@code data:} lines joined with a newline
 */
public record SseEvent(String event, String data) {
  public static final String DEFAULT_EVENT = "message";

  public boolean hasData() {
    return data != null && !data.isBlank();
  }
}
