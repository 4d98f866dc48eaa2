package ca.gc.cra.trail.domain.redaction;

import java.util.Objects;

/**
 * One masked span. Only a digest of the original text is kept.
 *
 * @param category PII category (for example {@code EMAIL} or {@code NAME})
 * @param originalSpanHash SHA-256 hex digest of the original matched substring
 * @param maskingMethod detection tier that produced the finding
 * @since 0.1.0
 */
public record Finding(String category, String originalSpanHash, Detector maskingMethod) {
  public Finding {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(originalSpanHash, "originalSpanHash");
    Objects.requireNonNull(maskingMethod, "maskingMethod");
    if (category.isBlank()) {
      throw new IllegalArgumentException("category must not be blank");
    }
  }
}
