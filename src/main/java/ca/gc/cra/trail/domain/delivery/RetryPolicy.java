package ca.gc.cra.trail.domain.delivery;

/**
 * Throttling retry policy: at most {@code maxAttempts} submissions per record, waiting {@code 2^k × unit} after the
 * k-th throttled attempt.
 *
 * @param maxAttempts total submissions allowed per record (the first one included)
 * @param backoffUnitMillis backoff unit in milliseconds
 * @since 0.1.0
 */
public record RetryPolicy(int maxAttempts, long backoffUnitMillis) {
  /** Three attempts with a one second unit (2 s, then 4 s). */
  public static final RetryPolicy DEFAULT = new RetryPolicy(3, 1_000L);

  public RetryPolicy {
    if (maxAttempts < 1 || maxAttempts > 10) {
      throw new IllegalArgumentException("maxAttempts must be between 1 and 10");
    }
    if (backoffUnitMillis < 0 || backoffUnitMillis > 60_000L) {
      throw new IllegalArgumentException("backoffUnitMillis must be between 0 and 60000");
    }
  }

  /**
   * Backoff after the given throttled attempt.
   *
   * @param attemptNumber 1-based attempt that was throttled
   * @return delay in milliseconds
   */
  public long backoffMillis(int attemptNumber) {
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("attemptNumber must be >= 1");
    }
    return (1L << attemptNumber) * backoffUnitMillis;
  }

  /**
   * Whether another submission is allowed after {@code attemptNumber} attempts.
   *
   * @param attemptNumber attempts made so far
   * @return {@code true} while under the cap
   */
  public boolean allowsRetryAfter(int attemptNumber) {
    return attemptNumber < maxAttempts;
  }
}
