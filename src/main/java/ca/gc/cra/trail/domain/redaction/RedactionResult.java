package ca.gc.cra.trail.domain.redaction;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of masking one piece of text.
 *
 * <p>{@code detectorUsed} is honest about which tier actually ran: it only reads
 * {@link Detector#REMOTE_CLASSIFIER} when the remote classifier answered for this text. When the remote tier was
 * requested but unavailable, {@code degradedReason} explains why.</p>
 *
 * @param maskedText text with every finding replaced by its placeholder
 * @param findings findings in text order
 * @param detectorUsed highest tier that ran successfully
 * @param totalMasked number of findings; always {@code findings.size()}
 * @param piiScore fraction of original characters that were masked, rounded to two decimals
 * @param limitations known precision limits of the tiers that ran
 * @param degradedReason reason the remote tier was skipped, or {@code null}
 * @since 0.1.0
 */
public record RedactionResult(
    String maskedText,
    List<Finding> findings,
    Detector detectorUsed,
    int totalMasked,
    double piiScore,
    String limitations,
    String degradedReason) {

  /** Precision limits of the local rules. */
  public static final String LOCAL_LIMITATIONS =
      "pattern rules only; no checksum validation on numeric identifiers; "
          + "free-form narrative PII and image content are not detected";

  /** Precision limits when the remote classifier contributed. */
  public static final String REMOTE_LIMITATIONS =
      "classifier findings below the confidence threshold are ignored; "
          + "no checksum validation on numeric identifiers; image content is not detected";

  public RedactionResult {
    Objects.requireNonNull(maskedText, "maskedText");
    Objects.requireNonNull(detectorUsed, "detectorUsed");
    Objects.requireNonNull(limitations, "limitations");
    findings = List.copyOf(Objects.requireNonNull(findings, "findings"));
    if (totalMasked != findings.size()) {
      throw new IllegalArgumentException(
          "totalMasked (" + totalMasked + ") must equal findings (" + findings.size() + ")");
    }
    if (piiScore < 0.0 || piiScore > 1.0) {
      throw new IllegalArgumentException("piiScore must be between 0 and 1");
    }
  }

  /**
   * Indicates whether the remote tier was requested but could not be used.
   *
   * @return {@code true} when degraded
   */
  public boolean degraded() {
    return degradedReason != null;
  }
}
