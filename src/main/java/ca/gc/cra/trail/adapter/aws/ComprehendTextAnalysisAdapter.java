package ca.gc.cra.trail.adapter.aws;

import ca.gc.cra.trail.application.port.analysis.PiiEntity;
import ca.gc.cra.trail.application.port.analysis.RedactionDegradedException;
import ca.gc.cra.trail.application.port.analysis.TextAnalysisPort;
import ca.gc.cra.trail.domain.redaction.NlpAnalysis;
import ca.gc.cra.trail.logging.Logs;
import ca.gc.cra.trail.validation.Numbers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.comprehend.ComprehendClient;
import software.amazon.awssdk.services.comprehend.ComprehendClientBuilder;
import software.amazon.awssdk.services.comprehend.model.DetectEntitiesRequest;
import software.amazon.awssdk.services.comprehend.model.DetectKeyPhrasesRequest;
import software.amazon.awssdk.services.comprehend.model.DetectPiiEntitiesRequest;
import software.amazon.awssdk.services.comprehend.model.DetectSentimentRequest;
import software.amazon.awssdk.services.comprehend.model.DetectSentimentResponse;
import software.amazon.awssdk.services.comprehend.model.Entity;
import software.amazon.awssdk.services.comprehend.model.KeyPhrase;
import software.amazon.awssdk.services.comprehend.model.SentimentScore;

/**
 * <strong>What:</strong> Amazon Comprehend implementation of {@link TextAnalysisPort}.
 * <p><strong>Limits:</strong> PII detection is only offered for English and Spanish; sentiment, key phrases and
 * entities accept every language Comprehend supports. Inputs are cut to 100 KB of UTF-8 on a code point
 * boundary. PII entities under the confidence threshold are dropped.</p>
 * <p><strong>Offsets:</strong> Comprehend reports code point offsets; they are converted to UTF-16 indexes of the
 * submitted text.</p>
 * <p><strong>Failure model:</strong> every SDK failure, including the API call timeout, surfaces as
 * {@link RedactionDegradedException}.</p>
 *
 * @since 0.1.0
 */
public final class ComprehendTextAnalysisAdapter implements TextAnalysisPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ComprehendTextAnalysisAdapter.class);
  static final int MAX_TEXT_BYTES = 100 * 1024;
  private static final Set<String> PII_LANGUAGES = Set.of("en", "es");

  private final ComprehendClient client;
  private final double confidenceThreshold;

  /**
   * Creates an adapter with its own client.
   *
   * @param region AWS region, or {@code null} for the SDK default chain
   * @param timeout API call timeout
   * @param confidenceThreshold minimum PII score in {@code [0, 1]}
   */
  public ComprehendTextAnalysisAdapter(String region, Duration timeout, double confidenceThreshold) {
    this(createClient(region, timeout), confidenceThreshold);
  }

  ComprehendTextAnalysisAdapter(ComprehendClient client, double confidenceThreshold) {
    this.client = Objects.requireNonNull(client, "client");
    this.confidenceThreshold = Numbers.requireRange("confidenceThreshold", confidenceThreshold, 0.0, 1.0);
  }

  @Override
  public boolean supportsPii(String language) {
    return language != null && PII_LANGUAGES.contains(language.toLowerCase(Locale.ROOT));
  }

  @Override
  public List<PiiEntity> detectPii(String text, String language) throws RedactionDegradedException {
    if (!supportsPii(language)) {
      throw new RedactionDegradedException("PII detection does not support language '" + language + "'");
    }
    String input = truncateUtf8(text, MAX_TEXT_BYTES);
    List<software.amazon.awssdk.services.comprehend.model.PiiEntity> found = call("DetectPiiEntities",
        () -> client.detectPiiEntities(DetectPiiEntitiesRequest.builder()
            .text(input).languageCode(language).build()).entities());
    List<PiiEntity> entities = new ArrayList<>();
    for (software.amazon.awssdk.services.comprehend.model.PiiEntity entity : found) {
      double score = entity.score() == null ? 0.0 : entity.score();
      if (score < confidenceThreshold || entity.beginOffset() == null || entity.endOffset() == null) {
        continue;
      }
      int begin = toUtf16(input, entity.beginOffset());
      int end = toUtf16(input, entity.endOffset());
      if (end > begin) {
        entities.add(new PiiEntity(entity.typeAsString(), begin, end, score));
      }
    }
    log.debug("Comprehend returned {} PII entities ({} above threshold {})",
        found.size(), entities.size(), confidenceThreshold);
    return entities;
  }

  @Override
  public SentimentResult detectSentiment(String text, String language) throws RedactionDegradedException {
    String input = truncateUtf8(text, MAX_TEXT_BYTES);
    DetectSentimentResponse response = call("DetectSentiment",
        () -> client.detectSentiment(DetectSentimentRequest.builder()
            .text(input).languageCode(language).build()));
    SentimentScore score = response.sentimentScore();
    NlpAnalysis.SentimentScores scores = score == null
        ? null
        : new NlpAnalysis.SentimentScores(
            value(score.positive()), value(score.negative()), value(score.neutral()), value(score.mixed()));
    return new SentimentResult(response.sentimentAsString(), scores);
  }

  @Override
  public List<PhraseSpan> detectKeyPhrases(String text, String language) throws RedactionDegradedException {
    String input = truncateUtf8(text, MAX_TEXT_BYTES);
    List<KeyPhrase> phrases = call("DetectKeyPhrases",
        () -> client.detectKeyPhrases(DetectKeyPhrasesRequest.builder()
            .text(input).languageCode(language).build()).keyPhrases());
    List<PhraseSpan> spans = new ArrayList<>(phrases.size());
    for (KeyPhrase phrase : phrases) {
      if (phrase.beginOffset() == null || phrase.endOffset() == null) {
        continue;
      }
      int begin = toUtf16(input, phrase.beginOffset());
      int end = toUtf16(input, phrase.endOffset());
      if (end > begin) {
        spans.add(new PhraseSpan(begin, end, value(phrase.score())));
      }
    }
    return spans;
  }

  @Override
  public List<NlpAnalysis.EntityMention> detectEntities(String text, String language)
      throws RedactionDegradedException {
    String input = truncateUtf8(text, MAX_TEXT_BYTES);
    List<Entity> entities = call("DetectEntities",
        () -> client.detectEntities(DetectEntitiesRequest.builder()
            .text(input).languageCode(language).build()).entities());
    List<NlpAnalysis.EntityMention> mentions = new ArrayList<>(entities.size());
    for (Entity entity : entities) {
      mentions.add(new NlpAnalysis.EntityMention(entity.typeAsString(), value(entity.score())));
    }
    return mentions;
  }

  @Override
  public void close() {
    client.close();
  }

  /**
   * Cuts text to at most {@code maxBytes} UTF-8 bytes without splitting a code point.
   *
   * @param text input text
   * @param maxBytes byte budget
   * @return the text, or its longest prefix that fits
   */
  static String truncateUtf8(String text, int maxBytes) {
    Objects.requireNonNull(text, "text");
    if (text.length() * 3L <= maxBytes || text.getBytes(StandardCharsets.UTF_8).length <= maxBytes) {
      return text;
    }
    int bytes = 0;
    int index = 0;
    while (index < text.length()) {
      int cp = text.codePointAt(index);
      int width = cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
      if (bytes + width > maxBytes) {
        break;
      }
      bytes += width;
      index += Character.charCount(cp);
    }
    return text.substring(0, index);
  }

  static int toUtf16(String text, int codePointOffset) {
    int codePoints = text.codePointCount(0, text.length());
    return text.offsetByCodePoints(0, Math.max(0, Math.min(codePointOffset, codePoints)));
  }

  private static double value(Float score) {
    return score == null ? 0.0 : score.doubleValue();
  }

  private static <T> T call(String operation, Supplier<T> request) throws RedactionDegradedException {
    try {
      return request.get();
    } catch (SdkException ex) {
      throw new RedactionDegradedException("Comprehend " + operation + " failed: " + Logs.describe(ex), ex);
    }
  }

  private static ComprehendClient createClient(String region, Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    ComprehendClientBuilder builder = ComprehendClient.builder()
        .overrideConfiguration(ClientOverrideConfiguration.builder()
            .apiCallTimeout(timeout)
            .apiCallAttemptTimeout(timeout)
            .build());
    if (region != null && !region.isBlank()) {
      builder.region(Region.of(region.trim()));
    }
    return builder.build();
  }
}
