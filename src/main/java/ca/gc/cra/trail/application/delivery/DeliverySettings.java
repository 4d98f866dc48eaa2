package ca.gc.cra.trail.application.delivery;

import ca.gc.cra.trail.domain.delivery.RetryPolicy;
import java.time.Duration;
import java.util.Objects;

/**
 * Delivery parameters shared by {@link DeliveryEngine} and {@link RecordSender}.
 *
 * @param logGroup destination group
 * @param logStream destination stream
 * @param retryPolicy throttling retry policy
 * @param retention age after which processed records are purged
 * @param pacingMillis pause after each successful submission
 * @since 0.1.0
 */
public record DeliverySettings(
    String logGroup, String logStream, RetryPolicy retryPolicy, Duration retention, long pacingMillis) {
  public DeliverySettings {
    Objects.requireNonNull(logGroup, "logGroup");
    Objects.requireNonNull(logStream, "logStream");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    Objects.requireNonNull(retention, "retention");
    if (retention.isNegative()) {
      throw new IllegalArgumentException("retention must not be negative");
    }
    if (pacingMillis < 0) {
      throw new IllegalArgumentException("pacingMillis must be >= 0");
    }
  }
}
