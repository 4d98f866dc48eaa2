package ca.gc.cra.trail.application.port.sink;

/**
 * Signals that a log sink did not accept a submission.
 *
 * @since 0.1.0
 */
public class TransportException extends Exception {
  public TransportException(String message) { super(message); }

  public TransportException(String message, Throwable cause) { super(message, cause); }
}
