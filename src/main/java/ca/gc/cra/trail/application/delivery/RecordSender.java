package ca.gc.cra.trail.application.delivery;

import ca.gc.cra.trail.application.audit.AuditJson;
import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.port.SleeperPort;
import ca.gc.cra.trail.application.port.sink.LogSinkPort;
import ca.gc.cra.trail.domain.audit.AuditRecord;
import ca.gc.cra.trail.domain.delivery.DeliveryOutcome;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Sends a single serialized record file to the sink with the same retry policy as bulk uploads.
 *
 * <p>The file is left where it is; moving and journaling belong to {@link DeliveryEngine}.</p>
 *
 * @since 0.1.0
 */
public final class RecordSender {
  private final AttemptRunner runner;
  private final MetricsPort metrics;

  /**
   * Creates a sender.
   *
   * @param sink log sink
   * @param settings delivery settings
   * @param clock clock for backoff deadlines
   * @param sleeper sleeper for backoff
   * @param metrics metrics sink
   */
  public RecordSender(
      LogSinkPort sink, DeliverySettings settings, ClockPort clock, SleeperPort sleeper, MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.runner = new AttemptRunner(sink, settings, clock, sleeper, metrics);
  }

  /**
   * Sends one record file.
   *
   * @param file serialized audit record
   * @return outcome
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the file is not an audit record
   * @throws InterruptedException when interrupted while backing off
   */
  public DeliveryOutcome send(Path file) throws IOException, InterruptedException {
    Objects.requireNonNull(file, "file");
    String json = Files.readString(file, StandardCharsets.UTF_8);
    Map<String, Object> fields = AuditJson.parse(json);
    Object hash = fields.get(AuditRecord.RECORD_HASH_FIELD);
    if (hash == null) {
      throw new IllegalArgumentException(file + " is not an audit record (no record_hash)");
    }
    DeliveryOutcome outcome = runner.deliver(file.getFileName().toString(), json, hash.toString()).outcome();
    metrics.increment(outcome.status() == DeliveryOutcome.Status.DELIVERED ? "delivery.succeeded" : "delivery.failed");
    return outcome;
  }
}
