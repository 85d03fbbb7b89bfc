package ca.gc.cra.lumen.api;

import ca.gc.cra.lumen.config.ConfigMerger;
import ca.gc.cra.lumen.config.DefaultsForCommand;
import ca.gc.cra.lumen.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared helpers that combine CLI arguments with YAML and embedded defaults.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Builds the effective configuration for a command.
   *
   * @param command CLI command
   * @param cli parsed CLI arguments; {@code config} is consumed
   * @return merged configuration
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when the file is missing or any value is invalid
   */
  static Map<String, String> effectiveConfig(String command, Map<String, String> cli) throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, command);
    }
    return ConfigMerger.buildEffectiveConfig(command, yaml, cli, DefaultsForCommand.asFlatMap(command), log::warn);
  }
}
