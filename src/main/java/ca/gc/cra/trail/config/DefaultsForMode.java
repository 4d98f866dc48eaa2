package ca.gc.cra.trail.config;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each TRAIL command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI overrides.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a command merged with the common defaults.
   *
   * @param command command name
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "record" -> buildRecordDefaults();
      case "exec" -> buildExecDefaults();
      case "send" -> buildDeliveryDefaults();
      case "upload-all" -> buildUploadDefaults();
      case "verify" -> Map.of("clearHalt", "false");
      case "keygen" -> Map.of("force", "false");
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Path base = Path.of(System.getProperty("user.home", "."), ".trail");
    Map<String, String> map = new LinkedHashMap<>();
    map.put("storeDir", base.resolve("logs").toString());
    map.put("keyDir", base.resolve("keys").toString());
    map.put("region", "");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRecordDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("language", "ja");
    map.put("remote", "false");
    map.put("confidenceThreshold", Double.toString(RedactionConfig.DEFAULT_CONFIDENCE_THRESHOLD));
    map.put("classifierTimeoutMillis", Long.toString(RedactionConfig.DEFAULT_TIMEOUT.toMillis()));
    map.put("analysis", "false");
    map.put("method", "cli");
    map.put("model", "");
    map.put("status", "success");
    return map;
  }

  private static Map<String, String> buildExecDefaults() {
    Map<String, String> map = buildRecordDefaults();
    map.put("method", "exec");
    map.put("command", "");
    map.put("execTimeoutMillis", "600000");
    return map;
  }

  private static Map<String, String> buildDeliveryDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("sink", SinkMode.CLOUDWATCH.name());
    map.put("logGroup", DeliveryConfig.DEFAULT_LOG_GROUP);
    map.put("logStream", defaultLogStream());
    map.put("kafkaBootstrap", "");
    map.put("fileSinkDir", "");
    map.put("maxAttempts", "3");
    map.put("backoffUnitMillis", "1000");
    map.put("sinkTimeoutMillis", "10000");
    return map;
  }

  private static Map<String, String> buildUploadDefaults() {
    Map<String, String> map = buildDeliveryDefaults();
    map.put("retention", "7d");
    map.put("pacingMillis", "200");
    map.put("dryRun", "false");
    return map;
  }

  /** Log stream used when none is configured: {@code audit-<host>}. */
  static String defaultLogStream() {
    return "audit-" + hostLabel();
  }

  private static String hostLabel() {
    String host;
    try {
      host = InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      host = "localhost";
    }
    String cleaned = host.replaceAll("[^A-Za-z0-9_.-]", "_");
    return cleaned.isEmpty() ? "localhost" : cleaned;
  }
}
