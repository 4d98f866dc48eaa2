package ca.gc.cra.trail.domain.audit;

import java.util.Objects;

/**
 * Inputs for the response section of a record. {@code rawContent} is hashed, never stored.
 *
 * @param status outcome label such as {@code success}
 * @param rawContent unmasked response text
 * @since 0.1.0
 */
public record ResponseFields(String status, String rawContent) {
  public ResponseFields {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(rawContent, "rawContent");
  }
}
