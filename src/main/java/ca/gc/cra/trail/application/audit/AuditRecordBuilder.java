package ca.gc.cra.trail.application.audit;

import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.store.ChainLease;
import ca.gc.cra.trail.application.util.Digests;
import ca.gc.cra.trail.domain.audit.AuditRecord;
import ca.gc.cra.trail.domain.audit.RequestFields;
import ca.gc.cra.trail.domain.audit.ResponseFields;
import ca.gc.cra.trail.domain.trace.TraceId;
import java.util.Objects;

/**
 * <strong>What:</strong> Assembles a signed, chain-linked {@link AuditRecord}.
 * <p><strong>Why:</strong> Hashing the raw prompt and response lets an auditor later confirm that a given text
 * belongs to a record without the record ever containing that text.</p>
 * <p><strong>Contract:</strong> the caller must hold the {@link ChainLease} for the whole call, so the
 * {@code prevHash} read here cannot be claimed by a concurrent writer.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class AuditRecordBuilder {
  private final RecordSigner signer;
  private final ClockPort clock;

  /**
   * Creates a builder.
   *
   * @param signer signer holding the private key
   * @param clock clock used for the record timestamp
   */
  public AuditRecordBuilder(RecordSigner signer, ClockPort clock) {
    this.signer = Objects.requireNonNull(signer, "signer");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the next record of the chain.
   *
   * @param traceId trace id of the exchange
   * @param request request inputs (raw prompt is hashed, not stored)
   * @param response response inputs (raw content is hashed, not stored)
   * @param chain held chain lease supplying the predecessor hash
   * @return signed record
   */
  public AuditRecord build(TraceId traceId, RequestFields request, ResponseFields response, ChainLease chain) {
    Objects.requireNonNull(traceId, "traceId");
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(response, "response");
    Objects.requireNonNull(chain, "chain");

    String prevHash = chain.lastHash();
    AuditRecord.Request requestSection = new AuditRecord.Request(
        request.method(),
        request.model(),
        Digests.sha256Hex(request.rawBody()),
        request.piiDetection(),
        request.nlpAnalysis());
    AuditRecord.Response responseSection =
        new AuditRecord.Response(response.status(), Digests.sha256Hex(response.rawContent()));
    String timestamp = TraceId.TIMESTAMP_FORMAT.format(clock.now());

    AuditRecord unsigned = new AuditRecord(
        traceId.toString(), timestamp, requestSection, responseSection, prevHash, null, null, null);
    String recordHash = RecordHashes.compute(AuditJson.toMap(unsigned));
    return new AuditRecord(
        unsigned.traceId(),
        timestamp,
        requestSection,
        responseSection,
        prevHash,
        recordHash,
        signer.sign(recordHash),
        RecordSigner.ALGORITHM_LABEL);
  }
}
