package ca.gc.cra.trail.domain.audit;

import ca.gc.cra.trail.domain.redaction.NlpAnalysis;
import ca.gc.cra.trail.domain.redaction.RedactionResult;
import java.util.Objects;

/**
 * <strong>What:</strong> Chain-linked, signed audit record for one prompt/response exchange.
 * <p><strong>Integrity:</strong>
 * <ul>
 *   <li>{@code recordHash = SHA-256(canonical(record without prevHash, recordHash, signature,
 *       signatureAlgorithm) + (prevHash or ""))}</li>
 *   <li>{@code signature = RSASSA-PSS(SHA-256) over recordHash}, Base64 encoded</li>
 *   <li>{@code prevHash} equals the {@code recordHash} of the previous record; {@code null} for the first</li>
 * </ul>
 * <p>Records are written once and never mutated; they are only relocated after delivery.</p>
 *
 * @param traceId external trace id form
 * @param timestamp UTC creation time, {@code yyyy-MM-ddTHH:mm:ssZ}
 * @param request request section
 * @param response response section
 * @param prevHash hash of the predecessor, or {@code null} for the first record of a chain
 * @param recordHash hash of this record
 * @param signature Base64 signature over {@code recordHash}
 * @param signatureAlgorithm signature scheme label
 * @since 0.1.0
 */
public record AuditRecord(
    String traceId,
    String timestamp,
    Request request,
    Response response,
    String prevHash,
    String recordHash,
    String signature,
    String signatureAlgorithm) {

  /** Field names excluded from the hash input. */
  public static final String PREV_HASH_FIELD = "prev_hash";
  public static final String RECORD_HASH_FIELD = "record_hash";
  public static final String SIGNATURE_FIELD = "signature";
  public static final String SIGNATURE_ALGORITHM_FIELD = "signature_algorithm";
  public static final String TRACE_ID_FIELD = "trace_id";

  public AuditRecord {
    Objects.requireNonNull(traceId, "traceId");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(response, "response");
  }

  /**
   * Request section. Only hashes and masked derivatives of the prompt are stored.
   *
   * @param method assistant or transport label (for example {@code chatgpt})
   * @param model model name, or {@code null}
   * @param bodyHash SHA-256 of the raw prompt bytes
   * @param piiDetection redaction result, including the masked prompt
   * @param nlpAnalysis auxiliary analysis, or {@code null}
   */
  public record Request(
      String method,
      String model,
      String bodyHash,
      RedactionResult piiDetection,
      NlpAnalysis nlpAnalysis) {
    public Request {
      Objects.requireNonNull(method, "method");
      Objects.requireNonNull(bodyHash, "bodyHash");
      Objects.requireNonNull(piiDetection, "piiDetection");
    }
  }

  /**
   * Response section.
   *
   * @param status outcome label reported by the assistant invocation
   * @param contentHash SHA-256 of the raw response bytes
   */
  public record Response(String status, String contentHash) {
    public Response {
      Objects.requireNonNull(status, "status");
      Objects.requireNonNull(contentHash, "contentHash");
    }
  }
}
