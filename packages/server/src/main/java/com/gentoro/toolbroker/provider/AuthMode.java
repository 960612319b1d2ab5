package com.gentoro.toolbroker.provider;

import com.gentoro.toolbroker.exception.ConfigException;
import java.util.Locale;

/** How the broker authenticates tool calls routed to a provider. */
public enum AuthMode {
  /** Decrypt the tenant's stored credential for the connection and attach it. */
  CREDENTIAL,
  /** Forward the caller's upstream session token and user context unchanged. */
  SESSION;

  public static AuthMode parse(String value) {
    if (value == null || value.isBlank()) return CREDENTIAL;
    try {
      return AuthMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown auth-mode '" + value + "'", e);
    }
  }
}
