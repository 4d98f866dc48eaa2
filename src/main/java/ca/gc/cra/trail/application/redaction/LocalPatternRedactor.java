package ca.gc.cra.trail.application.redaction;

import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.domain.redaction.Detector;
import ca.gc.cra.trail.domain.redaction.RedactionResult;
import java.util.Objects;

/**
 * Redactor that only applies the deterministic {@link ca.gc.cra.trail.domain.redaction.PiiPattern} rules.
 *
 * <p>Ignores {@code useRemote}; the result always reports {@link Detector#LOCAL_PATTERN}. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class LocalPatternRedactor implements PiiRedactor {
  private final MetricsPort metrics;

  /** Creates a redactor without metrics. */
  public LocalPatternRedactor() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a redactor reporting {@code redaction.masked} observations.
   *
   * @param metrics metrics sink
   */
  public LocalPatternRedactor(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public RedactionResult mask(String text, String language, boolean useRemote) {
    MaskingPlan plan = new MaskingPlan(text == null ? "" : text);
    plan.addLocalMatches();
    RedactionResult result = plan.render(Detector.LOCAL_PATTERN, RedactionResult.LOCAL_LIMITATIONS, null);
    metrics.observe("redaction.masked", result.totalMasked());
    return result;
  }
}
