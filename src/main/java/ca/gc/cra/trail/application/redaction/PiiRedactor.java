package ca.gc.cra.trail.application.redaction;

import ca.gc.cra.trail.domain.redaction.RedactionResult;

/**
 * Masks PII in outbound text before it is persisted or transmitted.
 *
 * <p>Implementations never throw because a remote tier is unavailable; they degrade to local rules and say so in
 * the result.</p>
 *
 * @since 0.1.0
 * @see LocalPatternRedactor
 * @see RemoteAugmentedRedactor
 */
public interface PiiRedactor {
  /**
   * Masks PII in {@code text}.
   *
   * @param text text to mask; {@code null} is treated as empty
   * @param language ISO 639-1 language code of the text
   * @param useRemote whether the remote classifier should be consulted when available
   * @return masked text and findings
   */
  RedactionResult mask(String text, String language, boolean useRemote);
}
