package ca.gc.cra.trail.application.port.sink;

import java.util.Objects;

/**
 * One event submitted to a log sink.
 *
 * @param timestampMillis event time in epoch milliseconds
 * @param message serialized audit record
 * @param recordHash hash of the carried record, used as a deduplication key by sinks that support one
 */
public record LogEvent(long timestampMillis, String message, String recordHash) {
  public LogEvent {
    if (timestampMillis < 0) {
      throw new IllegalArgumentException("timestampMillis must be >= 0");
    }
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(recordHash, "recordHash");
  }
}
