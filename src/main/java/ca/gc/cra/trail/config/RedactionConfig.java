package ca.gc.cra.trail.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Redaction and analysis settings.
 *
 * @param language ISO 639-1 language of the prompts
 * @param remote whether to consult the remote PII classifier
 * @param region AWS region for the classifier, or empty for the SDK default
 * @param confidenceThreshold minimum classifier score for a PII entity
 * @param classifierTimeout API call timeout for the classifier
 * @param analysis whether to run sentiment, key phrase and entity analysis
 * @since 0.1.0
 */
public record RedactionConfig(
    String language,
    boolean remote,
    Optional<String> region,
    double confidenceThreshold,
    Duration classifierTimeout,
    boolean analysis) {
  static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  public RedactionConfig {
    Objects.requireNonNull(language, "language");
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(classifierTimeout, "classifierTimeout");
    if (!language.matches("[a-z]{2}(-[A-Za-z]{2,4})?")) {
      throw new IllegalArgumentException("language must be an ISO 639-1 code such as ja or en");
    }
  }

  /** Whether any remote call may be made. */
  public boolean usesRemoteService() {
    return remote || analysis;
  }

  /**
   * Builds the configuration from flattened settings.
   *
   * @param args effective configuration
   * @return redaction configuration
   * @throws IllegalArgumentException when a value is out of range
   */
  public static RedactionConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    return new RedactionConfig(
        ConfigValues.optional(args, "language").orElse("ja").toLowerCase(Locale.ROOT),
        ConfigValues.bool(args, "remote", false),
        ConfigValues.optional(args, "region"),
        ConfigValues.decimal(args, "confidenceThreshold", DEFAULT_CONFIDENCE_THRESHOLD, 0.0, 1.0),
        Duration.ofMillis(ConfigValues.number(
            args, "classifierTimeoutMillis", DEFAULT_TIMEOUT.toMillis(), 100L, 120_000L)),
        ConfigValues.bool(args, "analysis", false));
  }
}
