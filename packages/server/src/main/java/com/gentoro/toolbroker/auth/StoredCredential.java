package com.gentoro.toolbroker.auth;

import java.util.Objects;

/**
 * Encrypted secret for one (tenant, connection) pair. Cipher text and IV are base64 encoded; the
 * plaintext never leaves {@link CredentialCipher}.
 */
public record StoredCredential(
    String tenantId, String connectionId, String encryptedData, String iv) {

  public StoredCredential {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(connectionId, "connectionId");
    Objects.requireNonNull(encryptedData, "encryptedData");
    Objects.requireNonNull(iv, "iv");
  }

  @Override
  public String toString() {
    return "StoredCredential{tenantId=" + tenantId + ", connectionId=" + connectionId + "}";
  }
}
