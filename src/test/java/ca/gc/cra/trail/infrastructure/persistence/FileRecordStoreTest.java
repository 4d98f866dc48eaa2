package ca.gc.cra.trail.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.audit.AuditTrailService.AppendResult;
import ca.gc.cra.trail.application.port.store.PurgeReport;
import ca.gc.cra.trail.application.port.store.RecordHandle;
import ca.gc.cra.trail.testutil.AuditFixtures;
import ca.gc.cra.trail.testutil.ManualClock;
import ca.gc.cra.trail.testutil.RecordingMetricsPort;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileRecordStoreTest {
  private static final Instant NOW = Instant.parse("2025-06-30T00:00:00Z");
  private static final Duration RETENTION = Duration.ofDays(7);

  @TempDir Path storeDir;

  private ManualClock clock;
  private AuditFixtures fixtures;
  private FileRecordStore store;

  @BeforeEach
  void setUp() throws Exception {
    clock = new ManualClock(NOW);
    fixtures = AuditFixtures.open(storeDir, clock, new RecordingMetricsPort());
    store = fixtures.store();
  }

  @Test
  void persistWritesPendingFileNamedByTraceId() throws Exception {
    AppendResult result = fixtures.record("hello");

    String expected = result.record().traceId().substring(0, 36) + ".json";
    assertEquals(expected, result.handle().fileName());
    assertTrue(Files.isRegularFile(storeDir.resolve(expected)));
    assertTrue(store.exists(expected));
    assertEquals(List.of(expected), names(store.listPending()));
    assertTrue(store.listProcessed().isEmpty());
  }

  @Test
  void recordsAreWriteOnce() throws Exception {
    AppendResult result = fixtures.record("hello");

    assertThrows(FileAlreadyExistsException.class, () -> store.persist(result.record()));
  }

  @Test
  void listingIgnoresTempAndForeignFiles() throws Exception {
    fixtures.record("hello");
    Files.writeString(storeDir.resolve(".trail-123.part"), "partial");
    Files.writeString(storeDir.resolve("notes.txt"), "hi");

    assertEquals(1, store.listPending().size());
  }

  @Test
  void listingIsOldestFirst() throws Exception {
    RecordHandle newer = fixtures.record("newer").handle();
    RecordHandle older = fixtures.record("older").handle();
    Files.setLastModifiedTime(older.path(), FileTime.from(NOW.minusSeconds(60)));
    Files.setLastModifiedTime(newer.path(), FileTime.from(NOW.minusSeconds(30)));

    assertEquals(List.of(older.fileName(), newer.fileName()), names(store.listPending()));
  }

  @Test
  void moveToProcessedIsIdempotent() throws Exception {
    RecordHandle handle = fixtures.record("hello").handle();

    store.moveToProcessed(handle);
    store.moveToProcessed(handle);

    assertTrue(store.listPending().isEmpty());
    assertEquals(List.of(handle.fileName()), names(store.listProcessed()));
    assertTrue(store.exists(handle.fileName()));
    assertTrue(store.read(store.listProcessed().get(0)).isPresent());
  }

  @Test
  void readOfVanishedRecordIsEmpty() throws Exception {
    RecordHandle handle = fixtures.record("hello").handle();
    Files.delete(handle.path());

    assertTrue(store.read(handle).isEmpty());
    assertFalse(store.exists(handle.fileName()));
  }

  @Test
  void retentionBoundaryIsExclusive() throws Exception {
    RecordHandle justInside = processedAged(RETENTION.minusSeconds(1));
    RecordHandle exactly = processedAged(RETENTION);
    RecordHandle justOutside = processedAged(RETENTION.plusSeconds(1));

    PurgeReport report = store.purgeProcessedOlderThan(RETENTION, false);

    assertEquals(List.of(justOutside.fileName()), report.deleted());
    assertEquals(1, report.wouldDelete());
    assertTrue(store.exists(justInside.fileName()));
    assertTrue(store.exists(exactly.fileName()));
    assertFalse(store.exists(justOutside.fileName()));
  }

  @Test
  void previewDeletesNothing() throws Exception {
    RecordHandle expired = processedAged(RETENTION.plusSeconds(1));
    processedAged(RETENTION.minusSeconds(1));

    PurgeReport report = store.purgeProcessedOlderThan(RETENTION, true);

    assertTrue(report.preview());
    assertEquals(1, report.wouldDelete());
    assertTrue(report.deleted().isEmpty());
    assertTrue(store.exists(expired.fileName()));
    assertEquals(2, store.listProcessed().size());
  }

  @Test
  void purgeNeverTouchesPending() throws Exception {
    RecordHandle pending = fixtures.record("still pending").handle();
    Files.setLastModifiedTime(pending.path(), FileTime.from(NOW.minus(Duration.ofDays(365))));

    PurgeReport report = store.purgeProcessedOlderThan(RETENTION, false);

    assertEquals(0, report.wouldDelete());
    assertTrue(Files.exists(pending.path()));
  }

  @Test
  void negativeRetentionIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> store.purgeProcessedOlderThan(Duration.ofSeconds(-1), true));
  }

  private RecordHandle processedAged(Duration age) throws Exception {
    RecordHandle handle = fixtures.record("aged " + age).handle();
    store.moveToProcessed(handle);
    Path processed = storeDir.resolve(FileRecordStore.PROCESSED_DIR).resolve(handle.fileName());
    Files.setLastModifiedTime(processed, FileTime.from(NOW.minus(age)));
    return handle;
  }

  private static List<String> names(List<RecordHandle> handles) {
    return handles.stream().map(RecordHandle::fileName).toList();
  }
}
