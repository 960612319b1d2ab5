package com.gentoro.toolbroker.auth;

import java.util.Optional;

/** Keyed custody of encrypted connection credentials. */
public interface CredentialStore {

  Optional<StoredCredential> find(String tenantId, String connectionId);

  void save(StoredCredential credential);

  void remove(String tenantId, String connectionId);

  /** Remove every credential of the tenant; returns how many were removed. */
  int removeTenant(String tenantId);
}
