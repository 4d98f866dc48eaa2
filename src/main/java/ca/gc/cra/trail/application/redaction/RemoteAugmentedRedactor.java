package ca.gc.cra.trail.application.redaction;

import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.port.analysis.PiiEntity;
import ca.gc.cra.trail.application.port.analysis.RedactionDegradedException;
import ca.gc.cra.trail.application.port.analysis.TextAnalysisPort;
import ca.gc.cra.trail.domain.redaction.Detector;
import ca.gc.cra.trail.domain.redaction.RedactionResult;
import ca.gc.cra.trail.logging.Logs;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Redactor that merges remote classifier findings with the local pattern rules.
 * <p><strong>Why:</strong> The classifier finds names and addresses that patterns cannot, while locale-specific
 * identifiers (My Number, Japanese phone and postal codes) are only covered locally, so both always run.</p>
 * <p><strong>Failure model:</strong> an unsupported language, a timeout, or any classifier error degrades the call
 * to local rules. The result then reports {@link Detector#LOCAL_PATTERN} and carries the scrubbed reason; a
 * warning is logged and {@code redaction.degraded} is incremented. Masking itself never fails.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe when the supplied port is.</p>
 *
 * @since 0.1.0
 */
public final class RemoteAugmentedRedactor implements PiiRedactor {
  private static final Logger log = LoggerFactory.getLogger(RemoteAugmentedRedactor.class);

  private final TextAnalysisPort classifier;
  private final MetricsPort metrics;

  /**
   * Creates a remote-augmented redactor.
   *
   * @param classifier remote classifier
   * @param metrics metrics sink
   */
  public RemoteAugmentedRedactor(TextAnalysisPort classifier, MetricsPort metrics) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public RedactionResult mask(String text, String language, boolean useRemote) {
    String source = text == null ? "" : text;
    MaskingPlan plan = new MaskingPlan(source);
    plan.addLocalMatches();
    if (!useRemote || source.isEmpty()) {
      return finish(plan.render(Detector.LOCAL_PATTERN, RedactionResult.LOCAL_LIMITATIONS, null));
    }

    String lang = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
    if (!classifier.supportsPii(lang)) {
      return degraded(plan, "remote PII detection does not support language '" + lang + "'");
    }
    List<PiiEntity> entities;
    try {
      entities = classifier.detectPii(source, lang);
    } catch (RedactionDegradedException ex) {
      return degraded(plan, Logs.describe(ex));
    } catch (RuntimeException ex) {
      return degraded(plan, "classifier failure: " + Logs.describe(ex));
    }
    for (PiiEntity entity : entities) {
      plan.addRemote(entity.category(), entity.begin(), entity.end());
    }
    return finish(plan.render(Detector.REMOTE_CLASSIFIER, RedactionResult.REMOTE_LIMITATIONS, null));
  }

  private RedactionResult degraded(MaskingPlan plan, String reason) {
    log.warn("Remote PII classifier unavailable; masked with local rules only ({})", reason);
    metrics.increment("redaction.degraded");
    return finish(plan.render(Detector.LOCAL_PATTERN, RedactionResult.LOCAL_LIMITATIONS, reason));
  }

  private RedactionResult finish(RedactionResult result) {
    metrics.observe("redaction.masked", result.totalMasked());
    return result;
  }
}
