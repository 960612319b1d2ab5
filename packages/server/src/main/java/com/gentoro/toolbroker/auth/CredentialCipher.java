package com.gentoro.toolbroker.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.toolbroker.exception.AuthenticationException;
import com.gentoro.toolbroker.exception.ConfigException;
import com.gentoro.toolbroker.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM encryption of credential payloads. The key is the SHA-256 digest of the configured
 * secret; every encryption draws a fresh 96-bit IV. Tenant and connection ids are bound as
 * associated data, so a blob copied to another connection fails to decrypt.
 */
public class CredentialCipher {
  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int IV_BYTES = 12;
  private static final int TAG_BITS = 128;

  private final SecretKey key;
  private final SecureRandom random = new SecureRandom();

  public CredentialCipher(String secret) {
    if (secret == null || secret.isBlank()) {
      throw new ConfigException("broker.credentials.key must be configured");
    }
    try {
      byte[] digest =
          MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
      this.key = new SecretKeySpec(digest, "AES");
    } catch (GeneralSecurityException e) {
      throw new ConfigException("Unable to derive credential encryption key", e);
    }
  }

  public StoredCredential encrypt(String tenantId, String connectionId, Map<String, ?> secret) {
    byte[] iv = new byte[IV_BYTES];
    random.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
      cipher.updateAAD(associatedData(tenantId, connectionId));
      byte[] plain = JacksonUtility.toJson(secret).getBytes(StandardCharsets.UTF_8);
      byte[] encrypted = cipher.doFinal(plain);
      Base64.Encoder b64 = Base64.getEncoder();
      return new StoredCredential(
          tenantId, connectionId, b64.encodeToString(encrypted), b64.encodeToString(iv));
    } catch (GeneralSecurityException e) {
      throw new ConfigException("Credential encryption failed", e);
    }
  }

  /** Decrypt to the JSON object that was encrypted. */
  public JsonNode decrypt(StoredCredential credential) {
    try {
      Base64.Decoder b64 = Base64.getDecoder();
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, b64.decode(credential.iv())));
      cipher.updateAAD(associatedData(credential.tenantId(), credential.connectionId()));
      byte[] plain = cipher.doFinal(b64.decode(credential.encryptedData()));
      return JacksonUtility.readTree(new String(plain, StandardCharsets.UTF_8));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new AuthenticationException(
          "Stored credential for connection " + credential.connectionId() + " cannot be decrypted",
          e);
    }
  }

  private static byte[] associatedData(String tenantId, String connectionId) {
    return (tenantId + "/" + connectionId).getBytes(StandardCharsets.UTF_8);
  }
}
