package com.gentoro.toolbroker.utility;

import com.gentoro.toolbroker.exception.ConfigException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import org.apache.commons.configuration2.Configuration;

/** Duration values in configuration: plain digits are milliseconds, anything else ISO-8601. */
public final class Durations {
  private Durations() {}

  /** Parsed value, or {@code null} for a null or blank input. */
  public static Duration parse(String value) {
    if (value == null || value.isBlank()) return null;
    String v = value.trim();
    if (v.chars().allMatch(Character::isDigit)) {
      return Duration.ofMillis(Long.parseLong(v));
    }
    try {
      return Duration.parse(v);
    } catch (DateTimeParseException e) {
      throw new ConfigException("Invalid duration '" + value + "'", e);
    }
  }

  public static Duration get(Configuration config, String key, Duration defaultValue) {
    Duration parsed = parse(config.getString(key, null));
    return parsed == null ? defaultValue : parsed;
  }
}
