package com.gentoro.toolbroker.provider;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to agent and provider configuration, owned by the administration side of the
 * platform.
 */
public interface AgentDirectory {

  /**
   * Providers enabled for the agent, in the order the agent configuration lists them. Disabled
   * providers are never returned. Unknown tenants or agents yield an empty list.
   */
  List<TenantProviderConfiguration> enabledProviders(String tenantId, String agentId);

  /** Every provider configured for the tenant, enabled or not. */
  List<TenantProviderConfiguration> tenantProviders(String tenantId);

  Optional<ProviderDefinition> providerDefinition(String providerId);

  /** Every known provider definition. */
  Collection<ProviderDefinition> providerDefinitions();
}
