package com.gentoro.toolbroker.messages;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * A tool call issued by the agent orchestrator.
 *
 * @param toolName tool to execute
 * @param arguments JSON object with the tool arguments
 * @param tenantId tenant on whose behalf the call runs
 * @param agentId agent whose enabled providers are searched for the tool
 * @param connectionId tenant connection whose stored credential is used in credential mode
 * @param sessionToken upstream session token forwarded in session mode
 * @param userContext identity of the end user forwarded in session mode
 * @param upstreamSessionId id of a session held by the session store, used in session mode when no
 *     token is supplied directly
 */
public record ToolExecutionRequest(
    String toolName,
    JsonNode arguments,
    String tenantId,
    String agentId,
    String connectionId,
    String sessionToken,
    Map<String, Object> userContext,
    String upstreamSessionId) {

  public ToolExecutionRequest {
    userContext = userContext == null ? null : Map.copyOf(userContext);
  }

  public boolean hasSessionData() {
    return sessionToken != null
        && !sessionToken.isBlank()
        && userContext != null
        && !userContext.isEmpty();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String toolName;
    private JsonNode arguments;
    private String tenantId;
    private String agentId;
    private String connectionId;
    private String sessionToken;
    private Map<String, Object> userContext;
    private String upstreamSessionId;

    private Builder() {}

    public Builder toolName(String toolName) {
      this.toolName = toolName;
      return this;
    }

    public Builder arguments(JsonNode arguments) {
      this.arguments = arguments;
      return this;
    }

    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder agentId(String agentId) {
      this.agentId = agentId;
      return this;
    }

    public Builder connectionId(String connectionId) {
      this.connectionId = connectionId;
      return this;
    }

    public Builder sessionToken(String sessionToken) {
      this.sessionToken = sessionToken;
      return this;
    }

    public Builder userContext(Map<String, Object> userContext) {
      this.userContext = userContext;
      return this;
    }

    public Builder upstreamSessionId(String upstreamSessionId) {
      this.upstreamSessionId = upstreamSessionId;
      return this;
    }

    public ToolExecutionRequest build() {
      return new ToolExecutionRequest(
          toolName,
          arguments,
          tenantId,
          agentId,
          connectionId,
          sessionToken,
          userContext,
          upstreamSessionId);
    }
  }
}
