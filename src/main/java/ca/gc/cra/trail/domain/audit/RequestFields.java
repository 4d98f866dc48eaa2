package ca.gc.cra.trail.domain.audit;

import ca.gc.cra.trail.domain.redaction.NlpAnalysis;
import ca.gc.cra.trail.domain.redaction.RedactionResult;
import java.util.Objects;

/**
 * Inputs for the request section of a record. {@code rawBody} is hashed, never stored.
 *
 * @param method assistant label
 * @param model model name, or {@code null}
 * @param rawBody unmasked prompt text
 * @param piiDetection redaction of {@code rawBody}
 * @param nlpAnalysis optional analysis of the masked prompt
 * @since 0.1.0
 */
public record RequestFields(
    String method,
    String model,
    String rawBody,
    RedactionResult piiDetection,
    NlpAnalysis nlpAnalysis) {
  public RequestFields {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(rawBody, "rawBody");
    Objects.requireNonNull(piiDetection, "piiDetection");
    if (method.isBlank()) {
      throw new IllegalArgumentException("method must not be blank");
    }
  }
}
