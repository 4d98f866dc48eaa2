package ca.gc.cra.trail.domain.redaction;

import java.util.Locale;

/**
 * Detection tier that produced a finding or a whole redaction result.
 *
 * @since 0.1.0
 */
public enum Detector {
  LOCAL_PATTERN,
  REMOTE_CLASSIFIER;

  /**
   * Returns the lowercase form written into audit records.
   *
   * @return {@code local_pattern} or {@code remote_classifier}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves the wire form back to the enum.
   *
   * @param value {@code local_pattern} or {@code remote_classifier}, case-insensitive
   * @return matching detector
   * @throws IllegalArgumentException for unknown values
   */
  public static Detector fromWireName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("detector must not be null");
    }
    return Detector.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
