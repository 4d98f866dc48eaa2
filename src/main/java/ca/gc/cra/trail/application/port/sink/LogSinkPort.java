package ca.gc.cra.trail.application.port.sink;

import java.util.List;

/**
 * <strong>What:</strong> Output port for the remote log store that receives serialized audit records.
 * <p><strong>Role:</strong> Implemented by the CloudWatch Logs, Kafka and file adapters.</p>
 * <p><strong>Contract:</strong> {@link #put(String, String, List)} returns only after the sink acknowledged every
 * event. Calls are bounded by the adapter's timeout.</p>
 * <p><strong>Thread-safety:</strong> Called from a single delivery thread.</p>
 *
 * @since 0.1.0
 */
public interface LogSinkPort extends AutoCloseable {
  /**
   * Submits events and waits for acknowledgement.
   *
   * @param logGroup destination group (topic or directory for non-CloudWatch sinks)
   * @param logStream destination stream
   * @param events events in submission order
   * @throws ThrottlingException when the sink asks the caller to slow down
   * @throws SinkAuthorizationException when credentials are missing or rejected
   * @throws TransportException for any other failure
   */
  void put(String logGroup, String logStream, List<LogEvent> events) throws TransportException;

  @Override
  default void close() {}
}
