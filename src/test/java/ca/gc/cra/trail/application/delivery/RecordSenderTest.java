package ca.gc.cra.trail.application.delivery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.port.sink.ThrottlingException;
import ca.gc.cra.trail.application.port.store.RecordHandle;
import ca.gc.cra.trail.domain.delivery.DeliveryOutcome;
import ca.gc.cra.trail.domain.delivery.RetryPolicy;
import ca.gc.cra.trail.testutil.AuditFixtures;
import ca.gc.cra.trail.testutil.ManualClock;
import ca.gc.cra.trail.testutil.RecordingMetricsPort;
import ca.gc.cra.trail.testutil.ScriptedLogSink;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecordSenderTest {
  @TempDir Path storeDir;

  private final ManualClock clock = new ManualClock(Instant.parse("2025-06-30T00:00:00Z"));
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ScriptedLogSink sink = new ScriptedLogSink();

  @Test
  void sendsFileInPlace() throws Exception {
    RecordHandle handle = AuditFixtures.open(storeDir, clock, metrics).record("one").handle();

    DeliveryOutcome outcome = sender(RetryPolicy.DEFAULT).send(handle.path());

    assertEquals(DeliveryOutcome.Status.DELIVERED, outcome.status());
    assertEquals(handle.fileName(), outcome.fileName());
    assertEquals(1, sink.accepted().size());
    assertTrue(Files.exists(handle.path()));
    assertEquals(1L, metrics.count("delivery.succeeded"));
  }

  @Test
  void usesSameRetryPolicy() throws Exception {
    RecordHandle handle = AuditFixtures.open(storeDir, clock, metrics).record("one").handle();
    sink.failTimes(2, new ThrottlingException("Rate exceeded"));

    DeliveryOutcome outcome = sender(new RetryPolicy(2, 500)).send(handle.path());

    assertEquals(DeliveryOutcome.Status.FAILED, outcome.status());
    assertEquals(List.of(1000L), clock.sleeps());
    assertEquals(1L, metrics.count("delivery.failed"));
  }

  @Test
  void rejectsNonRecordJson() throws Exception {
    Path file = Files.writeString(storeDir.resolve("other.json"), "{\"hello\":\"world\"}");

    assertThrows(IllegalArgumentException.class, () -> sender(RetryPolicy.DEFAULT).send(file));
  }

  private RecordSender sender(RetryPolicy policy) {
    return new RecordSender(sink, new DeliverySettings("/trail/audit", "host-1", policy, Duration.ofDays(1), 0),
        clock, clock, metrics);
  }
}
