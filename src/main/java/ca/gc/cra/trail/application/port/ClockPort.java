package ca.gc.cra.trail.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to trace id generation, record stamping, retry backoff, and
 * retention decisions.
 * <p><strong>Why:</strong> Retention and backoff boundaries are tested at one-unit precision, which needs a
 * controllable clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant with millisecond precision
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
