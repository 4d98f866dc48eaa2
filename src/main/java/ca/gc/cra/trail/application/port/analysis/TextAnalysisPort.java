package ca.gc.cra.trail.application.port.analysis;

import ca.gc.cra.trail.domain.redaction.NlpAnalysis;
import java.util.List;

/**
 * Remote natural-language classifier used for higher-accuracy PII detection and auxiliary analysis.
 *
 * <p>Language support differs per feature. Callers must check {@link #supportsPii(String)} before relying on
 * {@link #detectPii(String, String)} and fall back to local rules when it returns {@code false}.</p>
 *
 * @since 0.1.0
 */
public interface TextAnalysisPort {
  /**
   * Indicates whether PII detection is available for a language.
   *
   * @param language ISO 639-1 code such as {@code en}
   * @return {@code true} when {@link #detectPii(String, String)} may be called
   */
  boolean supportsPii(String language);

  /**
   * Detects PII spans.
   *
   * @param text text to classify
   * @param language ISO 639-1 code
   * @return entities above the adapter's confidence threshold, offsets relative to {@code text}
   * @throws RedactionDegradedException when the classifier is unreachable, times out, or rejects the call
   */
  List<PiiEntity> detectPii(String text, String language) throws RedactionDegradedException;

  /**
   * Detects the dominant sentiment.
   *
   * @param text text to analyze
   * @param language ISO 639-1 code
   * @return sentiment label and scores
   * @throws RedactionDegradedException on classifier failure
   */
  SentimentResult detectSentiment(String text, String language) throws RedactionDegradedException;

  /**
   * Extracts key phrases.
   *
   * @param text text to analyze
   * @param language ISO 639-1 code
   * @return phrases with their offsets
   * @throws RedactionDegradedException on classifier failure
   */
  List<PhraseSpan> detectKeyPhrases(String text, String language) throws RedactionDegradedException;

  /**
   * Classifies named entities.
   *
   * @param text text to analyze
   * @param language ISO 639-1 code
   * @return entity types and scores
   * @throws RedactionDegradedException on classifier failure
   */
  List<NlpAnalysis.EntityMention> detectEntities(String text, String language) throws RedactionDegradedException;

  /**
   * Sentiment answer.
   *
   * @param label dominant label
   * @param scores per-label scores
   */
  record SentimentResult(String label, NlpAnalysis.SentimentScores scores) {}

  /**
   * Key phrase located in the analyzed text.
   *
   * @param begin inclusive start offset
   * @param end exclusive end offset
   * @param score confidence
   */
  record PhraseSpan(int begin, int end, double score) {}
}
