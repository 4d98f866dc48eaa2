package ca.gc.cra.trail.api;

import ca.gc.cra.trail.config.ConfigMerger;
import ca.gc.cra.trail.config.DefaultsForMode;
import ca.gc.cra.trail.config.YamlConfigLoader;
import ca.gc.cra.trail.logging.LoggingConfigurator;
import ca.gc.cra.trail.validation.Paths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

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
   * Resolves the effective configuration of a command: CLI over YAML over defaults. Applies the verbose and
   * telemetry settings as a side effect.
   *
   * @param command command name as understood by {@link DefaultsForMode}
   * @param cli parsed CLI pairs; the {@code config} key is consumed
   * @param log logger of the calling command, used for override warnings
   * @return immutable effective configuration
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when the configuration is invalid
   */
  static Map<String, String> effectiveConfig(String command, Map<String, String> cli, Logger log)
      throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Path.of(configPath);
      if (!Files.isRegularFile(path)) {
        throw new IllegalArgumentException("config file not found: " + configPath);
      }
      yaml = YamlConfigLoader.load(path, command);
    }
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        command, yaml, cli, DefaultsForMode.asFlatMap(command), log::warn);
    if (parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    TelemetryConfigurator.configureMetrics(effective);
    return effective;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  /**
   * Reads free text from an inline key or, when absent, from a UTF-8 file named by {@code fileKey}.
   *
   * @param cli CLI pairs
   * @param inlineKey key holding the text itself
   * @param fileKey key holding a file path
   * @return text
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when neither or both keys are supplied
   */
  static String readText(Map<String, String> cli, String inlineKey, String fileKey) throws IOException {
    String inline = cli.remove(inlineKey);
    String file = cli.remove(fileKey);
    if (inline != null && file != null) {
      throw new IllegalArgumentException(inlineKey + " and " + fileKey + " are mutually exclusive");
    }
    if (inline != null) {
      return inline;
    }
    if (file == null || file.isBlank()) {
      throw new IllegalArgumentException(inlineKey + "=TEXT or " + fileKey + "=PATH is required");
    }
    Path path = Paths.requireReadableFile(fileKey, Path.of(file.trim()));
    return Files.readString(path, StandardCharsets.UTF_8);
  }
}
