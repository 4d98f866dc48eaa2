package ca.gc.cra.trail.application.redaction;

import ca.gc.cra.trail.application.port.analysis.TextAnalysisPort;
import ca.gc.cra.trail.application.port.analysis.TextAnalysisPort.PhraseSpan;
import ca.gc.cra.trail.application.port.analysis.TextAnalysisPort.SentimentResult;
import ca.gc.cra.trail.domain.redaction.NlpAnalysis;
import ca.gc.cra.trail.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort sentiment, key phrase, and entity analysis.
 *
 * <p>Runs on the already masked text so phrases copied into the record cannot carry PII. Each step is independent:
 * a failure is logged, listed in {@link NlpAnalysis#errors()}, and the remaining steps still run.</p>
 *
 * @since 0.1.0
 */
public final class TextAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(TextAnalyzer.class);

  private final TextAnalysisPort port;

  /**
   * Creates an analyzer backed by the remote classifier.
   *
   * @param port remote classifier
   */
  public TextAnalyzer(TextAnalysisPort port) {
    this.port = Objects.requireNonNull(port, "port");
  }

  /**
   * Analyzes masked text.
   *
   * @param maskedText text after redaction
   * @param language ISO 639-1 code
   * @return analysis, or empty when the text is blank
   */
  public Optional<NlpAnalysis> analyze(String maskedText, String language) {
    if (maskedText == null || maskedText.isBlank()) {
      return Optional.empty();
    }
    String lang = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
    List<String> errors = new ArrayList<>();

    SentimentResult sentiment = null;
    try {
      sentiment = port.detectSentiment(maskedText, lang);
    } catch (Exception ex) {
      errors.add(failure("sentiment", ex));
    }

    List<NlpAnalysis.KeyPhrase> phrases = new ArrayList<>();
    try {
      for (PhraseSpan span : port.detectKeyPhrases(maskedText, lang)) {
        int end = Math.min(span.end(), maskedText.length());
        if (span.begin() >= 0 && span.begin() < end) {
          phrases.add(new NlpAnalysis.KeyPhrase(maskedText.substring(span.begin(), end), span.score()));
        }
      }
    } catch (Exception ex) {
      errors.add(failure("key_phrases", ex));
    }

    List<NlpAnalysis.EntityMention> entities = List.of();
    try {
      entities = port.detectEntities(maskedText, lang);
    } catch (Exception ex) {
      errors.add(failure("entities", ex));
    }

    return Optional.of(new NlpAnalysis(
        sentiment == null ? null : sentiment.label(),
        sentiment == null ? null : sentiment.scores(),
        phrases,
        entities,
        errors));
  }

  private static String failure(String step, Exception ex) {
    String reason = Logs.describe(ex);
    log.warn("Text analysis step {} failed: {}", step, reason);
    return step + ": " + reason;
  }
}
