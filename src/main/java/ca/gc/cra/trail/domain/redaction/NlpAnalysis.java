package ca.gc.cra.trail.domain.redaction;

import java.util.List;
import java.util.Objects;

/**
 * Auxiliary language signals attached to a request. Every field is optional; failures are listed in
 * {@code errors} instead of failing the request.
 *
 * @param sentiment dominant sentiment label ({@code POSITIVE}, {@code NEGATIVE}, {@code NEUTRAL}, {@code MIXED})
 * @param sentimentScores per-label confidence, or {@code null}
 * @param keyPhrases key phrases; text is locally masked before it is stored
 * @param entities entity types and scores; entity text is never stored
 * @param errors analysis steps that failed, with scrubbed reasons
 * @since 0.1.0
 */
public record NlpAnalysis(
    String sentiment,
    SentimentScores sentimentScores,
    List<KeyPhrase> keyPhrases,
    List<EntityMention> entities,
    List<String> errors) {

  public NlpAnalysis {
    keyPhrases = keyPhrases == null ? List.of() : List.copyOf(keyPhrases);
    entities = entities == null ? List.of() : List.copyOf(entities);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /**
   * Sentiment confidence per label.
   *
   * @param positive positive score
   * @param negative negative score
   * @param neutral neutral score
   * @param mixed mixed score
   */
  public record SentimentScores(double positive, double negative, double neutral, double mixed) {}

  /**
   * Key phrase with confidence.
   *
   * @param text masked phrase text
   * @param score confidence
   */
  public record KeyPhrase(String text, double score) {
    public KeyPhrase {
      Objects.requireNonNull(text, "text");
    }
  }

  /**
   * Entity classification without the entity text.
   *
   * @param type entity type such as {@code PERSON}
   * @param score confidence
   */
  public record EntityMention(String type, double score) {
    public EntityMention {
      Objects.requireNonNull(type, "type");
    }
  }
}
