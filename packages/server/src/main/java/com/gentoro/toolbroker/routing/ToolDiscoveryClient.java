package com.gentoro.toolbroker.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.toolbroker.exception.SerializationException;
import com.gentoro.toolbroker.exception.TransportException;
import com.gentoro.toolbroker.http.OkHttpFactory;
import com.gentoro.toolbroker.provider.ProviderDefinition;
import com.gentoro.toolbroker.provider.ToolDescriptor;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Reads the tool catalogue a provider publishes at {@code GET {endpoint}/tools}. */
public class ToolDiscoveryClient {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(ToolDiscoveryClient.class);

  private final OkHttpClient httpClient;

  public ToolDiscoveryClient(OkHttpClient httpClient, Duration callTimeout) {
    this.httpClient = OkHttpFactory.bounded(httpClient, callTimeout);
  }

  /**
   * @throws TransportException on network failure or non-2xx status
   * @throws SerializationException when the body is not a tool list
   */
  public List<ToolDescriptor> fetchTools(ProviderDefinition provider) {
    Request request =
        new Request.Builder()
            .url(provider.toolsEndpoint())
            .header("Accept", "application/json")
            .get()
            .build();
    String body;
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      if (!response.isSuccessful()) {
        throw new TransportException(
            "Tool list of provider " + provider.id() + " returned HTTP " + response.code(),
            Map.of("providerId", provider.id(), "status", response.code()),
            null);
      }
      body = responseBody == null ? "" : responseBody.string();
    } catch (IOException e) {
      throw new TransportException(
          "Tool list of provider " + provider.id() + " could not be fetched",
          Map.of("providerId", provider.id(), "endpoint", provider.toolsEndpoint()),
          e);
    }
    List<ToolDescriptor> tools = parse(provider.id(), JacksonUtility.readTree(body));
    log.debug("Provider {} exposes {} tool(s)", provider.id(), tools.size());
    return tools;
  }

  static List<ToolDescriptor> parse(String providerId, JsonNode root) {
    JsonNode array = root.isArray() ? root : root.path("tools");
    if (!array.isArray()) {
      throw new SerializationException("Provider " + providerId + " returned no tools array");
    }
    List<ToolDescriptor> result = new ArrayList<>(array.size());
    for (JsonNode tool : array) {
      String name = tool.path("name").asText(null);
      if (name == null || name.isBlank()) {
        log.warn("Skipping unnamed tool advertised by {}", providerId);
        continue;
      }
      JsonNode schema = tool.hasNonNull("schema") ? tool.get("schema") : tool.get("inputSchema");
      List<String> impact = new ArrayList<>();
      tool.path("complianceImpact").forEach(n -> impact.add(n.asText()));
      result.add(
          new ToolDescriptor(
              name,
              tool.path("description").asText(""),
              schema,
              tool.path("riskLevel").asText(null),
              impact,
              providerId));
    }
    return result;
  }
}
