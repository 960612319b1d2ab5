package com.gentoro.toolbroker;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line of the broker: {@code --config-file <location>} and {@code --mode <mode>}.
 *
 * <p>Modes: {@code server} runs until shutdown, {@code check} probes every configured provider and
 * exits, {@code help} prints usage.
 */
public class StartupParameters {
  public static final Set<String> MODES = Set.of("server", "check", "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "server");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments == null ? new String[0] : arguments));
    this.validate();
  }

  private static Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String name = arguments[p].substring(2);
      String value = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        value = arguments[++p];
      }
      result.put(name, value);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new IllegalArgumentException("Invalid mode: " + mode + ", expected one of " + MODES);
    }
    String configFile = parameters.get("config-file");
    if (configFile == null || configFile.isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
  }

  public String configFile() {
    return parameters.get("config-file");
  }

  public String mode() {
    return parameters.get("mode");
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        System.lineSeparator(),
        "Usage: toolbroker [--config-file <location>] [--mode server|check|help]",
        "  --config-file  classpath:<resource>, file:<uri> or a path (default "
            + ConfigurationProvider.DEFAULT_LOCATION
            + ")",
        "  --mode         server: serve until stopped (default)",
        "                 check:  probe the health of every configured provider and exit",
        "                 help:   print this message");
  }
}
