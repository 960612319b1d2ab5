package com.gentoro.toolbroker;

import com.gentoro.toolbroker.exception.ConfigException;
import com.gentoro.toolbroker.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the broker YAML configuration.
 *
 * <p>Locations: {@code classpath:broker.yaml}, {@code file:/etc/broker.yaml} or a plain file path.
 * A blank location means {@code classpath:application.yaml}. Values may reference environment
 * variables as {@code ${env:NAME}}; variables missing from the environment are looked up in a
 * {@code .env.local} file.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.toolbroker.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = load(location == null || location.isBlank() ? DEFAULT_LOCATION : location);
  }

  public Configuration config() {
    return configuration;
  }

  private static Configuration load(String location) {
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return fromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      return fromFile(new File(URI.create(loc)));
    }
    return fromFile(new File(loc));
  }

  private static Configuration fromClasspath(String resource) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    try (InputStream input = loader.getResourceAsStream(resource)) {
      if (input == null) {
        throw new ConfigException("Configuration resource not found on classpath: " + resource);
      }
      log.info("Loading configuration from classpath resource: {}", resource);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new InputStreamReader(input, StandardCharsets.UTF_8));
      return withEnvLookup(config);
    } catch (IOException | ConfigurationException e) {
      throw new SerializationException("Failed to read YAML from classpath resource: " + resource, e);
    }
  }

  private static Configuration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return withEnvLookup(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration withEnvLookup(Configuration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  /** Environment first, then {@code .env.local} in the working directory or the module dir. */
  private static class FallbackEnvLookup implements Lookup {
    private static final List<Path> CANDIDATES =
        List.of(Paths.get(".env.local"), Paths.get("packages/server/.env.local"));

    private volatile Map<String, String> fallback;

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
      return fallback().get(key);
    }

    private Map<String, String> fallback() {
      Map<String, String> result = fallback;
      if (result == null) {
        synchronized (this) {
          if (fallback == null) {
            fallback = readEnvFile();
          }
          result = fallback;
        }
      }
      return result;
    }

    private static Map<String, String> readEnvFile() {
      Map<String, String> values = new HashMap<>();
      Path path = CANDIDATES.stream().filter(Files::isRegularFile).findFirst().orElse(null);
      if (path == null) {
        log.debug("No .env.local found, only the process environment is used");
        return values;
      }
      log.info("Reading fallback environment from {}", path.toAbsolutePath());
      try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        String line;
        while ((line = reader.readLine()) != null) {
          line = line.trim();
          int eq = line.indexOf('=');
          if (line.isEmpty() || line.startsWith("#") || eq <= 0) continue;
          values.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
        }
      } catch (IOException e) {
        log.warn("Could not read {}: {}", path.toAbsolutePath(), e.getMessage());
      }
      return values;
    }

    private static String unquote(String value) {
      if (value.length() >= 2
          && ((value.startsWith("\"") && value.endsWith("\""))
              || (value.startsWith("'") && value.endsWith("'")))) {
        return value.substring(1, value.length() - 1);
      }
      return value;
    }
  }
}
