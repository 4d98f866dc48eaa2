package ca.gc.cra.trail.domain.audit;

/**
 * Checked exception signalling that chain state is inconsistent.
 *
 * <p>Fatal: record creation stays halted until an operator verifies the chain and clears the halt.</p>
 *
 * @since 0.1.0
 */
public final class IntegrityException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public IntegrityException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause parse or I/O failure that exposed the inconsistency
   */
  public IntegrityException(String msg, Throwable cause) { super(msg, cause); }
}
