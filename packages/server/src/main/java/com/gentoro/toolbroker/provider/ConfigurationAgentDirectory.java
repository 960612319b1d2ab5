package com.gentoro.toolbroker.provider;

import com.gentoro.toolbroker.exception.ConfigException;
import com.gentoro.toolbroker.utility.Durations;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * {@link AgentDirectory} backed by the application YAML.
 *
 * <p>Expected structure (provider, tenant and agent ids must not contain dots):
 *
 * <pre>
 * providers:
 *   grc:
 *     endpoint: "http://grc-provider:3006"
 *     health-endpoint: "http://grc-provider:3006/health"   # optional
 *     transport: sse                                       # optional
 *     single-session-upstream: true                        # optional
 * tenants:
 *   acme:
 *     providers:
 *       grc:
 *         enabled: true
 *         timeout: PT45S            # ISO-8601 or milliseconds
 *         auth-mode: session        # credential | session
 *         allowed-tools: [search_records]
 *     agents:
 *       risk-agent:
 *         providers: [grc, analytics]   # order is the routing priority
 *         overrides:
 *           grc:
 *             timeout: PT10S
 * </pre>
 *
 * Provider definitions are read once at construction; tenant and agent sections are read on each
 * call so that a reloaded configuration is picked up. A tenant provider entry with an invalid
 * timeout or auth mode is left out of the result with a warning.
 */
public class ConfigurationAgentDirectory implements AgentDirectory {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(ConfigurationAgentDirectory.class);

  private final Configuration configuration;
  private final Map<String, ProviderDefinition> definitions;

  public ConfigurationAgentDirectory(Configuration configuration) {
    this.configuration = configuration;
    this.definitions = Collections.unmodifiableMap(loadDefinitions(configuration));
    log.info("Loaded {} provider definition(s): {}", definitions.size(), definitions.keySet());
  }

  @Override
  public List<TenantProviderConfiguration> enabledProviders(String tenantId, String agentId) {
    String agentPrefix = "tenants.%s.agents.%s".formatted(tenantId, agentId);
    List<String> providerIds = configuration.getList(String.class, agentPrefix + ".providers", null);
    if (providerIds == null || providerIds.isEmpty()) {
      log.debug("Agent {} in tenant {} has no providers configured", agentId, tenantId);
      return List.of();
    }

    List<TenantProviderConfiguration> result = new ArrayList<>();
    for (String providerId : new LinkedHashSet<>(providerIds)) {
      Configuration tenantScope =
          configuration.subset("tenants.%s.providers.%s".formatted(tenantId, providerId));
      Configuration agentScope =
          configuration.subset("%s.overrides.%s".formatted(agentPrefix, providerId));
      if (tenantScope.isEmpty() && agentScope.isEmpty()) {
        log.warn(
            "Agent {} lists provider {} which tenant {} does not configure; skipping",
            agentId,
            providerId,
            tenantId);
        continue;
      }
      TenantProviderConfiguration cfg;
      try {
        cfg = toConfiguration(tenantId, providerId, tenantScope, agentScope);
      } catch (ConfigException e) {
        log.warn(
            "Skipping provider {} of agent {} in tenant {}: {}",
            providerId,
            agentId,
            tenantId,
            e.getMessage());
        continue;
      }
      if (cfg.enabled()) {
        result.add(cfg);
      }
    }
    return result;
  }

  @Override
  public List<TenantProviderConfiguration> tenantProviders(String tenantId) {
    Configuration providers = configuration.subset("tenants.%s.providers".formatted(tenantId));
    List<TenantProviderConfiguration> result = new ArrayList<>();
    for (String providerId : childNames(providers)) {
      Configuration scope = providers.subset(providerId);
      try {
        result.add(toConfiguration(tenantId, providerId, scope, scope));
      } catch (ConfigException e) {
        log.warn("Skipping provider {} of tenant {}: {}", providerId, tenantId, e.getMessage());
      }
    }
    return result;
  }

  @Override
  public Optional<ProviderDefinition> providerDefinition(String providerId) {
    return Optional.ofNullable(definitions.get(providerId));
  }

  @Override
  public Collection<ProviderDefinition> providerDefinitions() {
    return definitions.values();
  }

  private static TenantProviderConfiguration toConfiguration(
      String tenantId, String providerId, Configuration tenantScope, Configuration agentScope) {
    Configuration enabledSrc = agentScope.containsKey("enabled") ? agentScope : tenantScope;
    Configuration timeoutSrc = agentScope.containsKey("timeout") ? agentScope : tenantScope;
    Configuration authSrc = agentScope.containsKey("auth-mode") ? agentScope : tenantScope;
    Configuration toolsSrc = agentScope.containsKey("allowed-tools") ? agentScope : tenantScope;
    return new TenantProviderConfiguration(
        tenantId,
        providerId,
        enabledSrc.getBoolean("enabled", true),
        Durations.parse(timeoutSrc.getString("timeout", null)),
        toolsSrc.getList(String.class, "allowed-tools", List.of()),
        AuthMode.parse(authSrc.getString("auth-mode", null)));
  }

  private static Map<String, ProviderDefinition> loadDefinitions(Configuration configuration) {
    Configuration providers = configuration.subset("providers");
    Map<String, ProviderDefinition> result = new LinkedHashMap<>();
    for (String id : childNames(providers)) {
      Configuration p = providers.subset(id);
      String endpoint = p.getString("endpoint", null);
      if (endpoint == null || endpoint.isBlank()) {
        throw new ConfigException("Provider '" + id + "' is missing its endpoint");
      }
      result.put(
          id,
          new ProviderDefinition(
              id,
              endpoint,
              p.getString("health-endpoint", null),
              TransportKind.parse(p.getString("transport", null)),
              p.getBoolean("single-session-upstream", false)));
    }
    return result;
  }

  /** First key segment of every key in {@code cfg}, in declaration order. */
  private static Set<String> childNames(Configuration cfg) {
    Set<String> names = new LinkedHashSet<>();
    Iterator<String> keys = cfg.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      int dot = key.indexOf('.');
      names.add(dot < 0 ? key : key.substring(0, dot));
    }
    return names;
  }
}
