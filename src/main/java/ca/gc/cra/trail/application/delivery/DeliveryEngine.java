package ca.gc.cra.trail.application.delivery;

import ca.gc.cra.trail.application.audit.AuditJson;
import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.port.SleeperPort;
import ca.gc.cra.trail.application.port.sink.LogSinkPort;
import ca.gc.cra.trail.application.port.store.DeliveryJournalPort;
import ca.gc.cra.trail.application.port.store.DeliveryLockPort;
import ca.gc.cra.trail.application.port.store.PurgeReport;
import ca.gc.cra.trail.application.port.store.RecordHandle;
import ca.gc.cra.trail.application.port.store.RecordStorePort;
import ca.gc.cra.trail.domain.audit.AuditRecord;
import ca.gc.cra.trail.domain.delivery.DeliveryOutcome;
import ca.gc.cra.trail.domain.delivery.DeliveryOutcome.Status;
import ca.gc.cra.trail.domain.delivery.DeliveryReport;
import ca.gc.cra.trail.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Uploads every pending record to the log sink, then applies retention to the processed
 * area.
 * <p><strong>Flow:</strong> take the delivery lock; for each pending record, oldest first, skip it if it vanished,
 * move it without resubmitting when the journal shows an earlier acknowledgement, otherwise submit it with
 * throttling retries; journal and move each acknowledged record; purge; prune the journal.</p>
 * <p><strong>Failure handling:</strong> a failed record stays pending for the next run and never aborts the
 * batch. A credentials rejection fails the current record and skips the rest.</p>
 * <p><strong>Preview:</strong> the same traversal and retention computation without submitting, moving, journaling
 * or deleting anything.</p>
 * <p><strong>Observability:</strong> {@code delivery.succeeded}, {@code delivery.failed},
 * {@code delivery.skipped}, {@code delivery.throttled}, {@code delivery.latencyMillis},
 * {@code retention.purged}.</p>
 *
 * @since 0.1.0
 */
public final class DeliveryEngine {
  private static final Logger log = LoggerFactory.getLogger(DeliveryEngine.class);
  private static final String MDC_TRACE_ID = "traceId";

  private final RecordStorePort store;
  private final DeliveryJournalPort journal;
  private final DeliveryLockPort lock;
  private final DeliverySettings settings;
  private final SleeperPort sleeper;
  private final MetricsPort metrics;
  private final AttemptRunner runner;

  /**
   * Creates the engine.
   *
   * @param store record store
   * @param journal acknowledgement journal
   * @param lock delivery lock
   * @param sink log sink
   * @param settings delivery settings
   * @param clock clock for backoff deadlines
   * @param sleeper sleeper for backoff and pacing
   * @param metrics metrics sink
   */
  public DeliveryEngine(
      RecordStorePort store,
      DeliveryJournalPort journal,
      DeliveryLockPort lock,
      LogSinkPort sink,
      DeliverySettings settings,
      ClockPort clock,
      SleeperPort sleeper,
      MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.journal = Objects.requireNonNull(journal, "journal");
    this.lock = Objects.requireNonNull(lock, "lock");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.runner = new AttemptRunner(sink, settings, clock, sleeper, metrics);
  }

  /**
   * Delivers all pending records and applies retention.
   *
   * @param preview {@code true} for a dry run
   * @return run report
   * @throws IOException when the store cannot be listed or the lock file opened
   * @throws InterruptedException when interrupted while backing off or pacing
   */
  public DeliveryReport deliverAll(boolean preview) throws IOException, InterruptedException {
    Optional<DeliveryLockPort.Held> held = lock.tryAcquire();
    if (held.isEmpty()) {
      List<DeliveryOutcome> outcomes = new ArrayList<>();
      for (RecordHandle handle : store.listPending()) {
        outcomes.add(skip(handle.fileName(), DeliveryOutcome.DELIVERY_IN_PROGRESS));
      }
      log.warn("Another upload is running for this store; {} pending record(s) left for it", outcomes.size());
      return new DeliveryReport(preview, outcomes, 0, 0);
    }
    try (DeliveryLockPort.Held ignored = held.get()) {
      return deliverLocked(preview);
    }
  }

  private DeliveryReport deliverLocked(boolean preview) throws IOException, InterruptedException {
    List<RecordHandle> pending = store.listPending();
    log.info("{} {} pending record(s) to {}/{}",
        preview ? "Previewing" : "Delivering", pending.size(), settings.logGroup(), settings.logStream());
    List<DeliveryOutcome> outcomes = new ArrayList<>();
    Map<String, String> hashes = new HashMap<>();
    boolean unauthorized = false;

    for (RecordHandle handle : pending) {
      if (unauthorized) {
        outcomes.add(skip(handle.fileName(), DeliveryOutcome.SINK_UNAUTHORIZED));
        continue;
      }
      Optional<String> json = store.read(handle);
      if (json.isEmpty()) {
        outcomes.add(skip(handle.fileName(), DeliveryOutcome.VANISHED));
        continue;
      }
      Map<String, Object> fields;
      try {
        fields = AuditJson.parse(json.get());
      } catch (IllegalArgumentException ex) {
        outcomes.add(fail(handle.fileName(), "unreadable record: " + Logs.describe(ex)));
        continue;
      }
      Object hash = fields.get(AuditRecord.RECORD_HASH_FIELD);
      if (hash == null) {
        outcomes.add(fail(handle.fileName(), "record has no record_hash"));
        continue;
      }
      String recordHash = hash.toString();
      hashes.put(handle.fileName(), recordHash);

      Object traceId = fields.get(AuditRecord.TRACE_ID_FIELD);
      String previousTraceId = MDC.get(MDC_TRACE_ID);
      if (traceId != null) {
        MDC.put(MDC_TRACE_ID, traceId.toString());
      }
      try {
        AttemptRunner.Result result = processRecord(handle, json.get(), recordHash, preview);
        outcomes.add(result.outcome());
        unauthorized = result.unauthorized();
      } finally {
        if (previousTraceId != null) {
          MDC.put(MDC_TRACE_ID, previousTraceId);
        } else {
          MDC.remove(MDC_TRACE_ID);
        }
      }
    }

    PurgeReport purge = store.purgeProcessedOlderThan(settings.retention(), preview);
    if (!preview) {
      metrics.increment("retention.purged", purge.deleted().size());
      pruneJournal(hashes);
    }
    DeliveryReport report = new DeliveryReport(preview, outcomes, purge.deleted().size(), purge.wouldDelete());
    log.info("Upload {}: {} delivered, {} failed, {} skipped, {} would deliver, {} purged, {} would purge",
        preview ? "preview" : "run",
        report.succeeded(), report.failed(), report.skipped(), report.wouldDeliver(),
        report.purged(), report.wouldPurge());
    return report;
  }

  private AttemptRunner.Result processRecord(RecordHandle handle, String json, String recordHash, boolean preview)
      throws InterruptedException {
    try {
      if (journal.contains(recordHash)) {
        if (!preview) {
          store.moveToProcessed(handle);
        }
        log.info("Record {} was acknowledged earlier; moved without resubmitting", handle.fileName());
        return new AttemptRunner.Result(skip(handle.fileName(), DeliveryOutcome.ALREADY_ACKNOWLEDGED), false);
      }
      if (preview) {
        return new AttemptRunner.Result(
            new DeliveryOutcome(handle.fileName(), Status.WOULD_DELIVER, 0, null), false);
      }
      AttemptRunner.Result result = runner.deliver(handle.fileName(), json, recordHash);
      if (!result.delivered()) {
        metrics.increment("delivery.failed");
        return result;
      }
      journal.append(recordHash);
      store.moveToProcessed(handle);
      metrics.increment("delivery.succeeded");
      log.info("Delivered {} in {} attempt(s)", handle.fileName(), result.outcome().attempts());
      if (settings.pacingMillis() > 0) {
        sleeper.sleep(settings.pacingMillis());
      }
      return result;
    } catch (IOException ex) {
      log.error("Local bookkeeping failed for {}: {}", handle.fileName(), Logs.describe(ex));
      return new AttemptRunner.Result(fail(handle.fileName(), "local I/O failure: " + Logs.describe(ex)), false);
    }
  }

  private void pruneJournal(Map<String, String> hashes) {
    try {
      Set<String> stillPending = new HashSet<>();
      for (RecordHandle handle : store.listPending()) {
        String hash = hashes.get(handle.fileName());
        if (hash != null) {
          stillPending.add(hash);
        }
      }
      journal.retainOnly(stillPending);
    } catch (IOException ex) {
      log.warn("Unable to prune delivery journal: {}", Logs.describe(ex));
    }
  }

  private DeliveryOutcome skip(String fileName, String reason) {
    metrics.increment("delivery.skipped");
    return new DeliveryOutcome(fileName, Status.SKIPPED, 0, reason);
  }

  private DeliveryOutcome fail(String fileName, String reason) {
    metrics.increment("delivery.failed");
    log.error("Cannot deliver {}: {}", fileName, reason);
    return new DeliveryOutcome(fileName, Status.FAILED, 0, reason);
  }
}
