package com.gentoro.onepress;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line options: {@code --config-file <location>}, {@code --source-root <dir>} and {@code
 * --mode summary|dump|help}.
 */
public class StartupParameters {
  private static final Set<String> MODES = Set.of("summary", "dump", "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "summary");
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

    if (parameters.containsKey("source-root")
        && (parameters.get("source-root") == null || parameters.get("source-root").isBlank())) {
      throw new IllegalArgumentException("Missing value for --source-root");
    }
  }

  /** Settings location, e.g. "classpath:onepress.yaml" or "site/onepress.yaml". */
  public String configFile() {
    return parameters.get("config-file");
  }

  public String mode() {
    return parameters.get("mode");
  }

  /** Overrides {@code datasource.source_root} from the settings file when given. */
  public Optional<String> sourceRoot() {
    return Optional.ofNullable(parameters.get("source-root"));
  }
}
