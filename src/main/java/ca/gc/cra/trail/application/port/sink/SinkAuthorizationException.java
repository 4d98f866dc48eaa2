package ca.gc.cra.trail.application.port.sink;

/**
 * Signals missing, expired or rejected sink credentials. Every later submission would fail the same way.
 *
 * @since 0.1.0
 */
public class SinkAuthorizationException extends TransportException {
  public SinkAuthorizationException(String message) { super(message); }

  public SinkAuthorizationException(String message, Throwable cause) { super(message, cause); }
}
