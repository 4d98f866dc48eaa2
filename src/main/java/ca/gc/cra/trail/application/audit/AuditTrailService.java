package ca.gc.cra.trail.application.audit;

import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.port.store.ChainLease;
import ca.gc.cra.trail.application.port.store.ChainStatePort;
import ca.gc.cra.trail.application.port.store.RecordHandle;
import ca.gc.cra.trail.application.port.store.RecordStorePort;
import ca.gc.cra.trail.application.redaction.PiiRedactor;
import ca.gc.cra.trail.application.redaction.TextAnalyzer;
import ca.gc.cra.trail.domain.audit.AuditRecord;
import ca.gc.cra.trail.domain.audit.IntegrityException;
import ca.gc.cra.trail.domain.audit.RequestFields;
import ca.gc.cra.trail.domain.audit.ResponseFields;
import ca.gc.cra.trail.domain.redaction.NlpAnalysis;
import ca.gc.cra.trail.domain.redaction.RedactionResult;
import ca.gc.cra.trail.domain.trace.TraceId;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Use case that turns one prompt/response exchange into a persisted audit record.
 * <p><strong>Flow:</strong> redact the prompt, optionally analyze the masked text, then under the chain lease
 * build the record, write the intent, persist the file, and commit the chain.</p>
 * <p><strong>Observability:</strong> Puts {@code traceId} into the MDC for the duration of the call; increments
 * {@code audit.record.appended}.</p>
 *
 * @since 0.1.0
 */
public final class AuditTrailService {
  private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);
  private static final String MDC_TRACE_ID = "traceId";

  private final PiiRedactor redactor;
  private final TextAnalyzer analyzer;
  private final AuditRecordBuilder builder;
  private final ChainStatePort chainState;
  private final RecordStorePort store;
  private final MetricsPort metrics;

  /**
   * Creates the service.
   *
   * @param redactor redactor for prompts
   * @param analyzer optional analyzer; {@code null} disables analysis
   * @param builder record builder
   * @param chainState chain state shared with other writers of the store
   * @param store record store
   * @param metrics metrics sink
   */
  public AuditTrailService(
      PiiRedactor redactor,
      TextAnalyzer analyzer,
      AuditRecordBuilder builder,
      ChainStatePort chainState,
      RecordStorePort store,
      MetricsPort metrics) {
    this.redactor = Objects.requireNonNull(redactor, "redactor");
    this.analyzer = analyzer;
    this.builder = Objects.requireNonNull(builder, "builder");
    this.chainState = Objects.requireNonNull(chainState, "chainState");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Redacts a prompt and, when enabled, analyzes the masked text.
   *
   * @param prompt raw prompt
   * @param language ISO 639-1 code
   * @param useRemote whether to consult the remote classifier
   * @return redaction and optional analysis
   */
  public RedactedPrompt redact(String prompt, String language, boolean useRemote) {
    RedactionResult result = redactor.mask(prompt, language, useRemote);
    NlpAnalysis analysis = analyzer == null
        ? null
        : analyzer.analyze(result.maskedText(), language).orElse(null);
    return new RedactedPrompt(result, analysis);
  }

  /**
   * Records a complete exchange: redact, build, persist.
   *
   * @param exchange exchange to record
   * @return persisted record and its handle
   * @throws IOException when the record or chain state cannot be written
   * @throws IntegrityException when the chain is halted or inconsistent
   */
  public AppendResult record(Exchange exchange) throws IOException, IntegrityException {
    Objects.requireNonNull(exchange, "exchange");
    RedactedPrompt redacted = redact(exchange.prompt(), exchange.language(), exchange.useRemote());
    return append(
        exchange.traceId(),
        new RequestFields(exchange.method(), exchange.model(), exchange.prompt(), redacted.result(),
            redacted.analysis()),
        new ResponseFields(exchange.status(), exchange.response()));
  }

  /**
   * Appends a record to the chain and persists it.
   *
   * @param traceId trace id of the exchange
   * @param request request inputs
   * @param response response inputs
   * @return persisted record and its handle
   * @throws IOException when the record or chain state cannot be written
   * @throws IntegrityException when the chain is halted or inconsistent
   */
  public AppendResult append(TraceId traceId, RequestFields request, ResponseFields response)
      throws IOException, IntegrityException {
    Objects.requireNonNull(traceId, "traceId");
    String previousTraceId = MDC.get(MDC_TRACE_ID);
    MDC.put(MDC_TRACE_ID, traceId.toString());
    try (ChainLease lease = chainState.acquire()) {
      AuditRecord record = builder.build(traceId, request, response, lease);
      lease.prepare(record.recordHash(), traceId.fileName());
      RecordHandle handle = store.persist(record);
      lease.commit(record.recordHash());
      metrics.increment("audit.record.appended");
      log.info("Audit record {} appended (sequence {}, masked {}, detector {})",
          handle.fileName(),
          lease.sequence(),
          record.request().piiDetection().totalMasked(),
          record.request().piiDetection().detectorUsed().wireName());
      return new AppendResult(record, handle);
    } finally {
      if (previousTraceId != null) {
        MDC.put(MDC_TRACE_ID, previousTraceId);
      } else {
        MDC.remove(MDC_TRACE_ID);
      }
    }
  }

  /**
   * Redaction plus optional analysis of a prompt.
   *
   * @param result redaction result
   * @param analysis analysis of the masked text, or {@code null}
   */
  public record RedactedPrompt(RedactionResult result, NlpAnalysis analysis) {}

  /**
   * Persisted record with its location.
   *
   * @param record record as written
   * @param handle pending file handle
   */
  public record AppendResult(AuditRecord record, RecordHandle handle) {}

  /**
   * One prompt/response exchange.
   *
   * @param traceId trace id
   * @param method assistant label
   * @param model model name or {@code null}
   * @param prompt raw prompt
   * @param response raw response
   * @param status response status label
   * @param language prompt language
   * @param useRemote whether to consult the remote classifier
   */
  public record Exchange(
      TraceId traceId,
      String method,
      String model,
      String prompt,
      String response,
      String status,
      String language,
      boolean useRemote) {
    public Exchange {
      Objects.requireNonNull(traceId, "traceId");
      Objects.requireNonNull(method, "method");
      Objects.requireNonNull(prompt, "prompt");
      Objects.requireNonNull(response, "response");
      Objects.requireNonNull(status, "status");
    }
  }
}
