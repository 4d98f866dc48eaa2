package ca.gc.cra.trail.application.port;

/**
 * <strong>What:</strong> Port abstracting TRAIL metrics emission.
 * <p><strong>Why:</strong> Lets redaction, record building, and delivery count outcomes without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code delivery.throttled}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code delivery.succeeded}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Increments the named counter by {@code amount}.
   *
   * @param key dotted metric identifier
   * @param amount non-negative increment
   */
  default void increment(String key, long amount) {
    for (long i = 0; i < amount; i++) {
      increment(key);
    }
  }

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; unit implied by the key suffix (e.g., {@code latencyMillis})
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
