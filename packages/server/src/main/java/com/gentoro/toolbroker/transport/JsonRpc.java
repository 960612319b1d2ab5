package com.gentoro.toolbroker.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.toolbroker.utility.JacksonUtility;

/** JSON-RPC 2.0 envelopes exchanged with providers. */
public final class JsonRpc {
  public static final String VERSION = "2.0";
  public static final String TOOLS_CALL = "tools/call";

  private JsonRpc() {}

  public static ObjectNode request(long id, String method, JsonNode params) {
    ObjectNode envelope = JacksonUtility.getJsonMapper().createObjectNode();
    envelope.put("jsonrpc", VERSION);
    envelope.put("id", id);
    envelope.put("method", method);
    if (params != null) {
      envelope.set("params", params);
    }
    return envelope;
  }

  /** Params of a {@code tools/call} request. */
  public static ObjectNode toolCall(String toolName, JsonNode arguments) {
    ObjectNode params = JacksonUtility.getJsonMapper().createObjectNode();
    params.put("name", toolName);
    params.set(
        "arguments", arguments == null ? JacksonUtility.getJsonMapper().createObjectNode() : arguments);
    return params;
  }

  public static boolean isProgress(JsonNode message) {
    return "progress".equals(message.path("type").asText(null));
  }

  /**
   * Numeric request id of a response ({@code id}) or progress message ({@code requestId}); -1 when
   * absent or not a number.
   */
  public static long correlationId(JsonNode message) {
    JsonNode id = isProgress(message) ? message.get("requestId") : message.get("id");
    if (id == null || id.isNull()) return -1;
    if (id.canConvertToLong()) return id.asLong();
    if (id.isTextual()) {
      try {
        return Long.parseLong(id.asText().trim());
      } catch (NumberFormatException e) {
        return -1;
      }
    }
    return -1;
  }
}
