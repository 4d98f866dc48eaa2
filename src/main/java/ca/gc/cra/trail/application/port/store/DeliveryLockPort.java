package ca.gc.cra.trail.application.port.store;

import java.io.IOException;
import java.util.Optional;

/**
 * Non-blocking, cross-process guard that keeps two uploads of the same store from running at once.
 *
 * @since 0.1.0
 */
public interface DeliveryLockPort {
  /**
   * Tries to take the delivery lock.
   *
   * @return held lock, or empty when another upload holds it
   * @throws IOException when the lock file cannot be opened
   */
  Optional<Held> tryAcquire() throws IOException;

  /** A held delivery lock. */
  interface Held extends AutoCloseable {
    @Override
    void close() throws IOException;
  }
}
