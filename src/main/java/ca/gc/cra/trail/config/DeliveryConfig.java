package ca.gc.cra.trail.config;

import ca.gc.cra.trail.application.delivery.DeliverySettings;
import ca.gc.cra.trail.domain.delivery.RetryPolicy;
import ca.gc.cra.trail.validation.Net;
import ca.gc.cra.trail.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Delivery sink, destination, retry and retention settings.
 * <p><strong>Invariants:</strong> a Kafka sink has bootstrap servers; a file sink has a directory; log group and
 * stream names use the characters CloudWatch Logs accepts.</p>
 *
 * @param sink selected sink
 * @param logGroup destination group (topic for Kafka, sub-directory for files)
 * @param logStream destination stream
 * @param region AWS region, or empty for the SDK default
 * @param kafkaBootstrap Kafka bootstrap servers when {@code sink=KAFKA}
 * @param fileSinkDir output directory when {@code sink=FILE}
 * @param retryPolicy throttling retry policy
 * @param retention processed record retention
 * @param pacingMillis pause after each delivered record
 * @param sinkTimeout per-call sink timeout
 * @since 0.1.0
 */
public record DeliveryConfig(
    SinkMode sink,
    String logGroup,
    String logStream,
    Optional<String> region,
    Optional<String> kafkaBootstrap,
    Optional<Path> fileSinkDir,
    RetryPolicy retryPolicy,
    Duration retention,
    long pacingMillis,
    Duration sinkTimeout) {
  static final String DEFAULT_LOG_GROUP = "/trail/audit";
  static final Duration DEFAULT_RETENTION = Duration.ofDays(7);

  public DeliveryConfig {
    Objects.requireNonNull(sink, "sink");
    Strings.requireLogName("logGroup", logGroup);
    Strings.requireLogName("logStream", logStream);
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap");
    Objects.requireNonNull(fileSinkDir, "fileSinkDir");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    Objects.requireNonNull(retention, "retention");
    Objects.requireNonNull(sinkTimeout, "sinkTimeout");
    if (sink == SinkMode.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when sink=KAFKA");
    }
    if (sink == SinkMode.FILE && fileSinkDir.isEmpty()) {
      throw new IllegalArgumentException("fileSinkDir is required when sink=FILE");
    }
  }

  /**
   * Builds the configuration from flattened settings.
   *
   * @param args effective configuration
   * @return delivery configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static DeliveryConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Duration retention = ConfigValues.optional(args, "retention")
        .map(raw -> ConfigValues.duration("retention", raw))
        .orElse(DEFAULT_RETENTION);
    return new DeliveryConfig(
        SinkMode.fromString(args.get("sink")),
        ConfigValues.optional(args, "logGroup").orElse(DEFAULT_LOG_GROUP),
        ConfigValues.optional(args, "logStream").orElseGet(DefaultsForMode::defaultLogStream),
        ConfigValues.optional(args, "region"),
        ConfigValues.optional(args, "kafkaBootstrap").map(Net::validateBootstrapServers),
        ConfigValues.optional(args, "fileSinkDir").map(raw -> ConfigValues.path(args, "fileSinkDir", null)),
        new RetryPolicy(
            (int) ConfigValues.number(args, "maxAttempts", 3, 1, 10),
            ConfigValues.number(args, "backoffUnitMillis", 1_000L, 0L, 60_000L)),
        retention,
        ConfigValues.number(args, "pacingMillis", 200L, 0L, 60_000L),
        Duration.ofMillis(ConfigValues.number(args, "sinkTimeoutMillis", 10_000L, 100L, 300_000L)));
  }

  /**
   * Settings handed to the delivery use cases.
   *
   * @return delivery settings
   */
  public DeliverySettings toSettings() {
    return new DeliverySettings(logGroup, logStream, retryPolicy, retention, pacingMillis);
  }
}
