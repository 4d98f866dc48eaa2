package ca.gc.cra.trail.application.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.audit.AuditTrailService.AppendResult;
import ca.gc.cra.trail.application.audit.AuditTrailService.RedactedPrompt;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.redaction.RemoteAugmentedRedactor;
import ca.gc.cra.trail.application.redaction.TextAnalyzer;
import ca.gc.cra.trail.domain.audit.ChainReport;
import ca.gc.cra.trail.domain.audit.IntegrityException;
import ca.gc.cra.trail.domain.redaction.Detector;
import ca.gc.cra.trail.infrastructure.persistence.FileChainState;
import ca.gc.cra.trail.infrastructure.persistence.FileRecordStore;
import ca.gc.cra.trail.testutil.AuditFixtures;
import ca.gc.cra.trail.testutil.FakeTextAnalysisPort;
import ca.gc.cra.trail.testutil.ManualClock;
import ca.gc.cra.trail.testutil.RecordingMetricsPort;
import ca.gc.cra.trail.testutil.TestKeys;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class AuditTrailServiceTest {
  @TempDir Path storeDir;

  private final ManualClock clock = new ManualClock(Instant.parse("2025-01-01T00:00:00Z"));
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void recordPersistsMaskedPendingRecord() throws Exception {
    AuditFixtures fixtures = AuditFixtures.open(storeDir, clock, metrics);

    AppendResult result = fixtures.service().record(
        AuditFixtures.exchange("Contact: test@example.com, Phone: 090-1234-5678", "noted"));

    Path file = result.handle().path();
    assertEquals(storeDir.resolve(result.handle().fileName()), file);
    String json = Files.readString(file, StandardCharsets.UTF_8);
    assertFalse(json.contains("test@example.com"));
    assertTrue(json.contains("[MASKED_PHONE_JP]"));
    assertEquals(2, result.record().request().piiDetection().totalMasked());
    assertEquals(1L, metrics.count("audit.record.appended"));
    assertNull(MDC.get("traceId"));
  }

  @Test
  void concurrentWritersProduceOneChain() throws Exception {
    AuditFixtures fixtures = AuditFixtures.open(storeDir, clock, metrics);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Callable<AppendResult>> tasks = new ArrayList<>();
      for (int i = 0; i < 24; i++) {
        String prompt = "parallel prompt " + i;
        tasks.add(() -> fixtures.record(prompt));
      }
      for (Future<AppendResult> future : pool.invokeAll(tasks, 60, TimeUnit.SECONDS)) {
        assertNotNull(future.get());
      }
    } finally {
      pool.shutdownNow();
    }

    ChainReport report = AuditFixtures.verifier().verify(fixtures.storedRecords());

    assertTrue(report.valid(), report.issues().toString());
    assertEquals(24, report.verified());
    assertEquals(1, report.anchors());
    assertEquals(24L, metrics.count("audit.record.appended"));
  }

  @Test
  void separateInstancesOverOneStoreShareTheChain() throws Exception {
    AuditFixtures first = AuditFixtures.open(storeDir, clock, metrics);
    AuditFixtures second = AuditFixtures.open(storeDir, clock, metrics);

    AppendResult a = first.record("from first");
    AppendResult b = second.record("from second");

    assertEquals(a.record().recordHash(), b.record().prevHash());
    assertTrue(AuditFixtures.verifier().verify(first.storedRecords()).valid());
  }

  @Test
  void haltedChainRefusesNewRecords() throws Exception {
    AuditFixtures fixtures = AuditFixtures.open(storeDir, clock, metrics);
    fixtures.record("before halt");
    Files.writeString(storeDir.resolve(".chain").resolve("HALTED"), "state mismatch detected");

    IntegrityException ex = assertThrows(IntegrityException.class, () -> fixtures.record("after halt"));

    assertTrue(ex.getMessage().startsWith("Record creation halted:"), ex.getMessage());
    assertTrue(ex.getMessage().contains("state mismatch detected"), ex.getMessage());
    assertEquals(1, fixtures.store().listPending().size());
    assertEquals(1L, metrics.count("audit.record.appended"));
  }

  @Test
  void redactRunsAnalysisOnMaskedText() throws Exception {
    FileRecordStore store = new FileRecordStore(storeDir, clock);
    FakeTextAnalysisPort classifier = new FakeTextAnalysisPort("en").withEntity("NAME", 0, 4);
    AuditTrailService service = new AuditTrailService(
        new RemoteAugmentedRedactor(classifier, metrics),
        new TextAnalyzer(classifier),
        new AuditRecordBuilder(new RecordSigner(TestKeys.primary().getPrivate()), clock),
        new FileChainState(storeDir, store::exists),
        store,
        MetricsPort.NO_OP);

    RedactedPrompt redacted = service.redact("Anna wrote from a@b.io", "en", true);

    assertEquals("[MASKED_NAME] wrote from [MASKED_EMAIL]", redacted.result().maskedText());
    assertEquals(Detector.REMOTE_CLASSIFIER, redacted.result().detectorUsed());
    assertNotNull(redacted.analysis());
    assertEquals("NEUTRAL", redacted.analysis().sentiment());
  }
}
