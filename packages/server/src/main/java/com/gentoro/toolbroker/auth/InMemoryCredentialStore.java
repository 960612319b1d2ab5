package com.gentoro.toolbroker.auth;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCredentialStore implements CredentialStore {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(InMemoryCredentialStore.class);

  private final Map<String, StoredCredential> credentials = new ConcurrentHashMap<>();

  @Override
  public Optional<StoredCredential> find(String tenantId, String connectionId) {
    return Optional.ofNullable(credentials.get(key(tenantId, connectionId)));
  }

  @Override
  public void save(StoredCredential credential) {
    credentials.put(key(credential.tenantId(), credential.connectionId()), credential);
    log.debug("Stored credential for connection {} of tenant {}", credential.connectionId(), credential.tenantId());
  }

  @Override
  public void remove(String tenantId, String connectionId) {
    credentials.remove(key(tenantId, connectionId));
  }

  @Override
  public int removeTenant(String tenantId) {
    int removed = 0;
    for (StoredCredential c : credentials.values()) {
      if (c.tenantId().equals(tenantId) && credentials.remove(key(c.tenantId(), c.connectionId()), c)) {
        removed++;
      }
    }
    log.info("Cleared {} credential(s) for tenant {}", removed, tenantId);
    return removed;
  }

  private static String key(String tenantId, String connectionId) {
    return tenantId + "\u0000" + connectionId;
  }
}
