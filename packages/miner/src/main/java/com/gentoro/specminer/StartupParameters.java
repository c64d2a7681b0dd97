package com.gentoro.specminer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line parameters in {@code --name value} form.
 *
 * <p>Recognized: {@code --config-file}, {@code --mode} (extract, dry-run, help), and the
 * configuration overrides {@code --root-dir}, {@code --output-dir}, {@code --extractors}.
 */
public class StartupParameters {

  private static final Set<String> MODES = Set.of("extract", "dry-run", "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "extract");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      // a flag directly followed by another flag has no value
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    String configFile = parameters.get("config-file");
    if (configFile == null || configFile.isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
  }

  public String mode() {
    return parameters.get("mode");
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/specminer.yaml", "config/local.yaml".
   */
  public String configFile() {
    return parameters.get("config-file");
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name)).filter(v -> !v.isBlank());
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
