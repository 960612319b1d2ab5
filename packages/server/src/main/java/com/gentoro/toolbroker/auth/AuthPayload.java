package com.gentoro.toolbroker.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.toolbroker.provider.AuthMode;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.util.Objects;

/**
 * Authentication material forwarded to a provider as the {@code upstream_connection} argument.
 *
 * @param mode how the material was obtained
 * @param fields provider-facing fields; contains secrets, never log it
 */
public record AuthPayload(AuthMode mode, ObjectNode fields) {

  public AuthPayload {
    Objects.requireNonNull(mode, "mode");
    fields = fields == null ? JacksonUtility.getJsonMapper().createObjectNode() : fields.deepCopy();
  }

  /** JSON view sent to the provider, with the mode recorded under {@code auth_mode}. */
  public ObjectNode toJson() {
    ObjectNode node = fields.deepCopy();
    node.put("auth_mode", mode.name().toLowerCase());
    return node;
  }

  public JsonNode field(String name) {
    return fields.get(name);
  }

  @Override
  public String toString() {
    return "AuthPayload{mode=" + mode + ", fields=" + fields.size() + "}";
  }
}
