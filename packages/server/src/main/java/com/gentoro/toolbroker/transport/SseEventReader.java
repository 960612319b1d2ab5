package com.gentoro.toolbroker.transport;

import java.io.IOException;
import okio.BufferedSource;

/**
 * Splits a {@code text/event-stream} body into events. Only {@code event} and {@code data} fields
 * are kept; comments, {@code id} and {@code retry} lines are skipped.
 */
class SseEventReader {
  private final BufferedSource source;

  SseEventReader(BufferedSource source) {
    this.source = source;
  }

  /** Next complete event, or {@code null} once the stream ends. Blocks until one is available. */
  SseEvent next() throws IOException {
    String event = null;
    StringBuilder data = null;
    String line;
    while ((line = source.readUtf8Line()) != null) {
      if (line.isEmpty()) {
        if (data != null || event != null) {
          return build(event, data);
        }
        continue;
      }
      if (line.startsWith(":")) continue;

      int colon = line.indexOf(':');
      String field = colon < 0 ? line : line.substring(0, colon);
      String value = colon < 0 ? "" : line.substring(colon + 1);
      if (value.startsWith(" ")) value = value.substring(1);

      switch (field) {
        case "event" -> event = value;
        case "data" -> {
          if (data == null) {
            data = new StringBuilder(value);
          } else {
            data.append('\n').append(value);
          }
        }
        default -> {
          // id, retry and unknown fields carry nothing we route on
        }
      }
    }
    return data != null || event != null ? build(event, data) : null;
  }

  private static SseEvent build(String event, StringBuilder data) {
    return new SseEvent(
        event == null || event.isBlank() ? SseEvent.DEFAULT_EVENT : event,
        data == null ? "" : data.toString());
  }
}
