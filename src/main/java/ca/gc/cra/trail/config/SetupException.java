package ca.gc.cra.trail.config;

/**
 * Signals missing or unusable setup, such as absent signing keys. Not retried.
 *
 * @since 0.1.0
 */
public final class SetupException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error including the remedy
   */
  public SetupException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause underlying failure
   */
  public SetupException(String msg, Throwable cause) { super(msg, cause); }
}
