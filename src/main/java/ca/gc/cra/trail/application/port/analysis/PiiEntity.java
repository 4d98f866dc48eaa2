package ca.gc.cra.trail.application.port.analysis;

import java.util.Objects;

/**
 * PII span reported by the remote classifier.
 *
 * @param category entity type reported by the classifier (for example {@code NAME})
 * @param begin inclusive start offset (UTF-16 code units)
 * @param end exclusive end offset
 * @param score confidence between 0 and 1
 * @since 0.1.0
 */
public record PiiEntity(String category, int begin, int end, double score) {
  public PiiEntity {
    Objects.requireNonNull(category, "category");
    if (begin < 0 || end <= begin) {
      throw new IllegalArgumentException("invalid span [" + begin + ", " + end + ")");
    }
  }
}
