package ca.gc.cra.trail.config;

import java.util.Locale;

/**
 * Log sink selected for delivery.
 *
 * @since 0.1.0
 */
public enum SinkMode {
  /** Amazon CloudWatch Logs. */
  CLOUDWATCH,
  /** Apache Kafka topic derived from the log group. */
  KAFKA,
  /** Local files, for offline use. */
  FILE;

  /**
   * Parses a sink name, defaulting to {@link #CLOUDWATCH} when blank.
   *
   * @param value textual representation such as {@code "kafka"}
   * @return parsed mode
   * @throws IllegalArgumentException if the string does not match a known sink
   */
  public static SinkMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return CLOUDWATCH;
    }
    try {
      return SinkMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown sink: " + value + " (expected CLOUDWATCH, KAFKA or FILE)", ex);
    }
  }
}
