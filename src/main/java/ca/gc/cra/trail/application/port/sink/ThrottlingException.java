package ca.gc.cra.trail.application.port.sink;

/**
 * Signals that the sink rejected a submission because of rate limiting; the only retryable sink failure.
 *
 * @since 0.1.0
 */
public class ThrottlingException extends TransportException {
  public ThrottlingException(String message) { super(message); }

  public ThrottlingException(String message, Throwable cause) { super(message, cause); }
}
