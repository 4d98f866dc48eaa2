package ca.gc.cra.trail.application.audit;

import ca.gc.cra.trail.application.util.Digests;
import ca.gc.cra.trail.domain.audit.AuditRecord;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes record hashes from the generic map form of a record.
 *
 * @since 0.1.0
 */
public final class RecordHashes {
  private RecordHashes() {}

  /**
   * Computes {@code SHA-256(canonical(body) + (prev_hash or ""))} where the body is the record minus its
   * integrity fields.
   *
   * @param recordMap record as produced by {@link AuditJson#toMap} or {@link AuditJson#parse}
   * @return lowercase hex digest
   */
  public static String compute(Map<String, Object> recordMap) {
    Objects.requireNonNull(recordMap, "recordMap");
    Map<String, Object> body = new LinkedHashMap<>(recordMap);
    body.remove(AuditRecord.PREV_HASH_FIELD);
    body.remove(AuditRecord.RECORD_HASH_FIELD);
    body.remove(AuditRecord.SIGNATURE_FIELD);
    body.remove(AuditRecord.SIGNATURE_ALGORITHM_FIELD);
    Object prev = recordMap.get(AuditRecord.PREV_HASH_FIELD);
    return Digests.sha256Hex(AuditJson.canonical(body) + (prev == null ? "" : prev.toString()));
  }
}
