package ca.gc.cra.trail.application.port;

/**
 * Blocks the calling thread for retry backoff and inter-record pacing.
 *
 * <p>Delivery sleeps synchronously; tests substitute a recording sleeper so that backoff sequences can be asserted
 * without waiting.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SleeperPort {
  /**
   * Sleeps for the given duration.
   *
   * @param millis milliseconds to sleep; non-positive values return immediately
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  void sleep(long millis) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  SleeperPort SYSTEM = millis -> {
    if (millis > 0) {
      Thread.sleep(millis);
    }
  };
}
