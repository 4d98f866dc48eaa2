package ca.gc.cra.trail.testutil;

import ca.gc.cra.trail.application.audit.AuditRecordBuilder;
import ca.gc.cra.trail.application.audit.AuditTrailService;
import ca.gc.cra.trail.application.audit.AuditTrailService.AppendResult;
import ca.gc.cra.trail.application.audit.AuditTrailService.Exchange;
import ca.gc.cra.trail.application.audit.ChainVerifier;
import ca.gc.cra.trail.application.audit.ChainVerifier.StoredRecord;
import ca.gc.cra.trail.application.audit.RecordSigner;
import ca.gc.cra.trail.application.audit.RecordVerifier;
import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.port.store.RecordHandle;
import ca.gc.cra.trail.application.redaction.LocalPatternRedactor;
import ca.gc.cra.trail.domain.audit.IntegrityException;
import ca.gc.cra.trail.domain.trace.TraceId;
import ca.gc.cra.trail.infrastructure.persistence.FileChainState;
import ca.gc.cra.trail.infrastructure.persistence.FileRecordStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires a file-backed audit trail over a temporary directory with the shared test key.
 */
public final class AuditFixtures {
  private final FileRecordStore store;
  private final FileChainState chainState;
  private final AuditTrailService service;

  private AuditFixtures(FileRecordStore store, FileChainState chainState, AuditTrailService service) {
    this.store = store;
    this.chainState = chainState;
    this.service = service;
  }

  public static AuditFixtures open(Path storeDir, ClockPort clock, MetricsPort metrics) throws IOException {
    FileRecordStore store = new FileRecordStore(storeDir, clock);
    FileChainState chainState = new FileChainState(storeDir, store::exists);
    AuditTrailService service = new AuditTrailService(
        new LocalPatternRedactor(metrics),
        null,
        new AuditRecordBuilder(new RecordSigner(TestKeys.primary().getPrivate()), clock),
        chainState,
        store,
        metrics);
    return new AuditFixtures(store, chainState, service);
  }

  public FileRecordStore store() {
    return store;
  }

  public FileChainState chainState() {
    return chainState;
  }

  public AuditTrailService service() {
    return service;
  }

  public static Exchange exchange(String prompt, String response) {
    return new Exchange(TraceId.newId(), "cli", "test-model", prompt, response, "success", "ja", false);
  }

  public AppendResult record(String prompt) throws IOException, IntegrityException {
    return service.record(exchange(prompt, "reply to " + prompt));
  }

  public static ChainVerifier verifier() {
    return new ChainVerifier(new RecordVerifier(TestKeys.primary().getPublic()));
  }

  public List<StoredRecord> storedRecords() throws IOException {
    List<StoredRecord> records = new ArrayList<>();
    List<RecordHandle> handles = new ArrayList<>(store.listPending());
    handles.addAll(store.listProcessed());
    for (RecordHandle handle : handles) {
      records.add(new StoredRecord(handle.fileName(), Files.readString(handle.path(), StandardCharsets.UTF_8)));
    }
    return records;
  }
}
