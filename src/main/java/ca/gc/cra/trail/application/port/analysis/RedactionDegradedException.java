package ca.gc.cra.trail.application.port.analysis;

/**
 * Checked exception raised when the remote classifier cannot serve a request.
 *
 * <p>Never surfaced to users as a failure: the redactor catches it, falls back to local rules, and records the
 * reason in the audit record.</p>
 *
 * @since 0.1.0
 */
public final class RedactionDegradedException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable reason
   */
  public RedactionDegradedException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable reason
   * @param cause SDK or transport failure
   */
  public RedactionDegradedException(String msg, Throwable cause) { super(msg, cause); }
}
