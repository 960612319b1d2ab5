package com.gentoro.toolbroker.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.toolbroker.auth.AuthPayload;
import com.gentoro.toolbroker.auth.SessionBroker;
import com.gentoro.toolbroker.concurrency.TenantMutex;
import com.gentoro.toolbroker.exception.ConfigException;
import com.gentoro.toolbroker.exception.ErrorDetails;
import com.gentoro.toolbroker.exception.ExceptionUtil;
import com.gentoro.toolbroker.exception.NotFoundException;
import com.gentoro.toolbroker.exception.ProviderUnavailableException;
import com.gentoro.toolbroker.exception.TransportException;
import com.gentoro.toolbroker.exception.ValidationException;
import com.gentoro.toolbroker.health.HealthMonitor;
import com.gentoro.toolbroker.health.HealthStatus;
import com.gentoro.toolbroker.health.ProviderHealth;
import com.gentoro.toolbroker.messages.ToolExecutionRequest;
import com.gentoro.toolbroker.messages.ToolExecutionResult;
import com.gentoro.toolbroker.provider.AgentDirectory;
import com.gentoro.toolbroker.provider.ProviderDefinition;
import com.gentoro.toolbroker.provider.TenantProviderConfiguration;
import com.gentoro.toolbroker.provider.ToolDescriptor;
import com.gentoro.toolbroker.transport.ConnectionManager;
import com.gentoro.toolbroker.transport.JsonRpc;
import com.gentoro.toolbroker.transport.ProgressListener;
import com.gentoro.toolbroker.transport.ProviderConnection;
import com.gentoro.toolbroker.transport.RequestCorrelator;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for the agent orchestrator: lists the tools an agent may use and executes tool calls
 * on the provider that exposes them.
 *
 * <p>Provider order is the order of the agent's configuration; the first provider exposing an
 * allowed tool of the requested name handles the call. Failures after request validation are
 * reported through {@link ToolExecutionResult}, never thrown.
 */
public class ToolRouter {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(ToolRouter.class);

  private final AgentDirectory directory;
  private final HealthMonitor healthMonitor;
  private final ToolDiscoveryClient discovery;
  private final ConnectionManager connections;
  private final RequestCorrelator correlator;
  private final SessionBroker sessionBroker;
  private final TenantMutex tenantMutex;
  private final ExecutorService workers;
  private final Clock clock;

  public ToolRouter(
      AgentDirectory directory,
      HealthMonitor healthMonitor,
      ToolDiscoveryClient discovery,
      ConnectionManager connections,
      RequestCorrelator correlator,
      SessionBroker sessionBroker,
      TenantMutex tenantMutex,
      ExecutorService workers,
      Clock clock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
    this.discovery = Objects.requireNonNull(discovery, "discovery");
    this.connections = Objects.requireNonNull(connections, "connections");
    this.correlator = Objects.requireNonNull(correlator, "correlator");
    this.sessionBroker = Objects.requireNonNull(sessionBroker, "sessionBroker");
    this.tenantMutex = Objects.requireNonNull(tenantMutex, "tenantMutex");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Tools the agent may call, merged in provider order. Providers are queried concurrently; one
   * that is unhealthy, unconfigured or failing contributes nothing.
   *
   * @throws ValidationException when tenant or agent id is missing
   */
  public List<ToolDescriptor> getAgentTools(String tenantId, String agentId) {
    requireText(tenantId, "tenantId");
    requireText(agentId, "agentId");

    List<TenantProviderConfiguration> configs = directory.enabledProviders(tenantId, agentId);
    List<CompletableFuture<List<ToolDescriptor>>> perProvider = new ArrayList<>(configs.size());
    for (TenantProviderConfiguration config : configs) {
      perProvider.add(
          CompletableFuture.supplyAsync(() -> allowedToolsOf(config), workers)
              .exceptionally(
                  e -> {
                    log.warn(
                        "Provider {} contributes no tools to agent {}: {}",
                        config.providerId(),
                        agentId,
                        ExceptionUtil.describe(e));
                    return List.of();
                  }));
    }

    List<ToolDescriptor> merged = new ArrayList<>();
    for (CompletableFuture<List<ToolDescriptor>> f : perProvider) {
      merged.addAll(f.join());
    }
    log.debug(
        "Agent {} of tenant {} has {} tool(s) from {} provider(s)",
        agentId,
        tenantId,
        merged.size(),
        configs.size());
    return merged;
  }

  public ToolExecutionResult executeToolCall(ToolExecutionRequest request) {
    return executeToolCall(request, null);
  }

  /**
   * Execute a tool call. Progress messages the provider emits while working are passed to {@code
   * progressListener} when one is given.
   *
   * @throws ValidationException when the request is malformed; nothing has been sent at that point
   */
  public ToolExecutionResult executeToolCall(
      ToolExecutionRequest request, ProgressListener progressListener) {
    validate(request);
    long started = System.nanoTime();
    String providerId = null;
    try {
      List<TenantProviderConfiguration> configs =
          directory.enabledProviders(request.tenantId(), request.agentId());
      Selection selection = selectProvider(request, configs);
      providerId = selection.definition().id();

      ProviderHealth health = healthMonitor.checkHealth(selection.definition());
      if (health.status() == HealthStatus.UNHEALTHY) {
        throw new ProviderUnavailableException(
            "Provider " + providerId + " is unhealthy: " + health.error());
      }

      JsonNode result;
      if (selection.definition().singleSessionUpstream()) {
        // the tenant's upstream session is read and used under the same lock
        result =
            tenantMutex.withExclusive(
                TenantMutex.key(request.tenantId(), null),
                () -> authorizeAndDispatch(request, configs, selection, progressListener));
      } else {
        result = authorizeAndDispatch(request, configs, selection, progressListener);
      }

      long elapsed = elapsedMs(started);
      logUsage(request, providerId, true, elapsed);
      return ToolExecutionResult.ok(
          result, request.toolName(), providerId, request.agentId(), elapsed);
    } catch (RuntimeException e) {
      long elapsed = elapsedMs(started);
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.warn(
          "Tool call {} for tenant {} failed on {}: {}",
          request.toolName(),
          request.tenantId(),
          providerId == null ? ToolExecutionResult.UNKNOWN_PROVIDER : providerId,
          details.message());
      log.debug("Tool call failure detail", e);
      logUsage(request, providerId, false, elapsed);
      return ToolExecutionResult.failed(
          ExceptionUtil.describe(e),
          details.code(),
          request.toolName(),
          providerId,
          request.agentId(),
          elapsed);
    }
  }

  /** Health of every provider the tenant configures, keyed by provider id. */
  public Map<String, ProviderHealth> getTenantProviderHealth(String tenantId) {
    requireText(tenantId, "tenantId");
    Map<String, ProviderHealth> result = new LinkedHashMap<>();
    for (TenantProviderConfiguration config : directory.tenantProviders(tenantId)) {
      ProviderHealth health =
          directory
              .providerDefinition(config.providerId())
              .map(healthMonitor::checkHealth)
              .orElseGet(
                  () ->
                      new ProviderHealth(
                          config.providerId(),
                          HealthStatus.UNKNOWN,
                          clock.instant(),
                          -1,
                          "No provider definition",
                          null));
      result.put(config.providerId(), health);
    }
    return result;
  }

  private List<ToolDescriptor> allowedToolsOf(TenantProviderConfiguration config) {
    ProviderDefinition definition = definitionOf(config);
    ProviderHealth health = healthMonitor.checkHealth(definition);
    if (health.status() == HealthStatus.UNHEALTHY) {
      log.info("Skipping unhealthy provider {} during tool discovery", definition.id());
      return List.of();
    }
    List<ToolDescriptor> allowed = new ArrayList<>();
    for (ToolDescriptor tool : discovery.fetchTools(definition)) {
      if (config.allows(tool.name())) {
        allowed.add(tool);
      }
    }
    return allowed;
  }

  private Selection selectProvider(
      ToolExecutionRequest request, List<TenantProviderConfiguration> configs) {
    String toolName = request.toolName();
    for (TenantProviderConfiguration config : configs) {
      if (!config.allows(toolName)) continue;
      ProviderDefinition definition;
      List<ToolDescriptor> tools;
      try {
        definition = definitionOf(config);
        tools = discovery.fetchTools(definition);
      } catch (RuntimeException e) {
        log.warn(
            "Could not list tools of provider {}: {}",
            config.providerId(),
            ExceptionUtil.describe(e));
        continue;
      }
      for (ToolDescriptor tool : tools) {
        if (tool.name().equals(toolName)) {
          log.debug("Tool {} resolved to provider {}", toolName, definition.id());
          return new Selection(definition, config);
        }
      }
    }
    throw new NotFoundException(
        "No enabled provider of agent " + request.agentId() + " exposes tool " + toolName);
  }

  private JsonNode authorizeAndDispatch(
      ToolExecutionRequest request,
      List<TenantProviderConfiguration> configs,
      Selection selection,
      ProgressListener progressListener) {
    AuthPayload auth = sessionBroker.resolveAuth(request, selection.config());
    ObjectNode arguments = augmentArguments(request, configs, auth);
    return dispatch(selection, request.toolName(), arguments, progressListener);
  }

  private JsonNode dispatch(
      Selection selection,
      String toolName,
      ObjectNode arguments,
      ProgressListener progressListener) {
    ProviderDefinition definition = selection.definition();
    ProviderConnection connection = connections.getOrCreateConnection(definition);
    ProgressListener listener =
        (requestId, data) -> {
          log.debug("Progress of {} #{} on {}: {}", toolName, requestId, definition.id(), data);
          if (progressListener != null) {
            progressListener.onProgress(requestId, data);
          }
        };
    CompletableFuture<JsonNode> response =
        correlator.send(
            connection,
            JsonRpc.TOOLS_CALL,
            JsonRpc.toolCall(toolName, arguments),
            selection.config().timeout(),
            listener);
    try {
      return response.join();
    } catch (CompletionException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          cause ->
              new TransportException(
                  "Tool call " + toolName + " on provider " + definition.id() + " failed",
                  Map.of("providerId", definition.id()),
                  cause));
    }
  }

  private static ObjectNode augmentArguments(
      ToolExecutionRequest request, List<TenantProviderConfiguration> configs, AuthPayload auth) {
    ObjectNode arguments = ((ObjectNode) request.arguments()).deepCopy();
    arguments.put("tenant_id", request.tenantId());
    arguments.put("connection_id", request.connectionId());
    arguments.put("agent_id", request.agentId());
    ArrayNode enabled = arguments.putArray("enabled_providers");
    configs.forEach(c -> enabled.add(c.providerId()));
    arguments.set("upstream_connection", auth.toJson());
    return arguments;
  }

  private ProviderDefinition definitionOf(TenantProviderConfiguration config) {
    return directory
        .providerDefinition(config.providerId())
        .orElseThrow(
            () ->
                new ConfigException(
                    "Provider " + config.providerId() + " is enabled but has no definition"));
  }

  private static void validate(ToolExecutionRequest request) {
    if (request == null) {
      throw new ValidationException("Tool execution request is required");
    }
    requireText(request.toolName(), "toolName");
    requireText(request.tenantId(), "tenantId");
    requireText(request.connectionId(), "connectionId");
    if (request.arguments() == null || !request.arguments().isObject()) {
      throw new ValidationException("arguments must be a JSON object");
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " is required and cannot be empty");
    }
  }

  private static long elapsedMs(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000;
  }

  private static void logUsage(
      ToolExecutionRequest request, String providerId, boolean success, long elapsedMs) {
    log.info(
        "usage tenant={} agent={} tool={} provider={} success={} durationMs={}",
        request.tenantId(),
        request.agentId(),
        request.toolName(),
        providerId == null ? ToolExecutionResult.UNKNOWN_PROVIDER : providerId,
        success,
        elapsedMs);
  }

  private record Selection(ProviderDefinition definition, TenantProviderConfiguration config) {}
}
