package ca.gc.cra.screenlog.api;

import ca.gc.cra.screenlog.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the effective configuration map of a command: YAML file values overridden by CLI arguments.
 *
 * @since 0.1.0
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  private CommandSupport() {}

  /**
   * Merges {@code config=PATH} (if given) with the remaining CLI arguments; CLI wins.
   *
   * @param mode command name used to select the YAML section
   * @param cli mutable CLI map; {@code config} is consumed
   * @return merged flat configuration without the telemetry keys, which are applied to system properties
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when the YAML or a telemetry argument is invalid
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli) throws IOException {
    String configPath = CliArgsParser.takeConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path;
      try {
        path = Path.of(configPath);
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("config is not a valid path: " + configPath, ex);
      }
      yaml = YamlConfigLoader.load(path, mode);
      if (yaml.isEmpty()) {
        throw new IllegalArgumentException("config file not found: " + configPath);
      }
    }
    Map<String, String> fileValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(fileValues);
    for (Map.Entry<String, String> entry : cli.entrySet()) {
      if (fileValues.containsKey(entry.getKey())) {
        log.info("CLI overrides configuration file for key: {}", entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    TelemetryConfigurator.configureMetrics(merged);
    return merged;
  }
}
