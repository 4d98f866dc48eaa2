package ca.gc.cra.trail.application.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.port.store.ChainLease;
import ca.gc.cra.trail.application.redaction.LocalPatternRedactor;
import ca.gc.cra.trail.application.util.Digests;
import ca.gc.cra.trail.domain.audit.AuditRecord;
import ca.gc.cra.trail.domain.audit.RequestFields;
import ca.gc.cra.trail.domain.audit.ResponseFields;
import ca.gc.cra.trail.domain.redaction.RedactionResult;
import ca.gc.cra.trail.domain.trace.TraceId;
import ca.gc.cra.trail.testutil.ManualClock;
import ca.gc.cra.trail.testutil.TestKeys;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuditRecordBuilderTest {
  private static final String PROMPT = "Contact: test@example.com, Phone: 090-1234-5678";

  private final ManualClock clock = new ManualClock(Instant.parse("2025-03-01T12:34:56.789Z"));
  private final AuditRecordBuilder builder =
      new AuditRecordBuilder(new RecordSigner(TestKeys.primary().getPrivate()), clock);
  private final RecordVerifier verifier = new RecordVerifier(TestKeys.primary().getPublic());

  @Test
  void genesisRecordHasNoPredecessorAndSignedHash() {
    AuditRecord record = build(null);

    assertNull(record.prevHash());
    assertEquals("2025-03-01T12:34:56Z", record.timestamp());
    assertEquals(RecordSigner.ALGORITHM_LABEL, record.signatureAlgorithm());
    assertEquals(Digests.sha256Hex(PROMPT), record.request().bodyHash());
    assertEquals(Digests.sha256Hex("ok"), record.response().contentHash());
    assertEquals(RecordHashes.compute(AuditJson.toMap(record)), record.recordHash());
    assertTrue(verifier.verify(record.recordHash(), record.signature()));
  }

  @Test
  void recordHashCoversPredecessor() {
    AuditRecord first = build(null);
    AuditRecord second = build(first.recordHash());

    assertEquals(first.recordHash(), second.prevHash());
    assertNotEquals(first.recordHash(), second.recordHash());
    Map<String, Object> relinked = AuditJson.toMap(second);
    relinked.put(AuditRecord.PREV_HASH_FIELD, "0".repeat(64));
    assertNotEquals(second.recordHash(), RecordHashes.compute(relinked));
  }

  @Test
  void serializedRecordCarriesOnlyMaskedPrompt() {
    String json = AuditJson.write(build(null));

    assertFalse(json.contains("test@example.com"), json);
    assertFalse(json.contains("090-1234-5678"), json);
    assertTrue(json.contains("[MASKED_EMAIL]"), json);
    assertTrue(json.contains("\"detector_used\":\"local_pattern\""), json);
    assertTrue(json.indexOf("\"prev_hash\"") < json.indexOf("\"record_hash\""), json);
  }

  @Test
  void hashSurvivesRoundTripThroughJson() {
    AuditRecord record = build("a".repeat(64));

    Map<String, Object> parsed = AuditJson.parse(AuditJson.write(record));

    assertEquals(record.recordHash(), RecordHashes.compute(parsed));
  }

  @Test
  void wrongKeyDoesNotVerify() {
    AuditRecord record = build(null);

    assertFalse(new RecordVerifier(TestKeys.other().getPublic()).verify(record.recordHash(), record.signature()));
    assertFalse(verifier.verify(record.recordHash(), "not base64!"));
    assertFalse(verifier.verify(record.recordHash(), null));
  }

  private AuditRecord build(String prevHash) {
    RedactionResult redaction = new LocalPatternRedactor().mask(PROMPT, "ja", false);
    return builder.build(
        TraceId.newId(clock.now()),
        new RequestFields("cli", "test-model", PROMPT, redaction, null),
        new ResponseFields("success", "ok"),
        new FixedLease(prevHash));
  }

  private static final class FixedLease implements ChainLease {
    private final String lastHash;

    private FixedLease(String lastHash) {
      this.lastHash = lastHash;
    }

    @Override
    public String lastHash() {
      return lastHash;
    }

    @Override
    public long sequence() {
      return 0;
    }

    @Override
    public void prepare(String recordHash, String fileName) {
      throw new UnsupportedOperationException();
    }

    @Override
    public void commit(String recordHash) {
      throw new UnsupportedOperationException();
    }

    @Override
    public void close() {}
  }
}
