/**
 * <strong>Purpose:</strong> OpenTelemetry implementation of the metrics port.
 * <p><strong>Configuration:</strong> {@code metricsExporter}, {@code otelEndpoint} and
 * {@code otelResourceAttributes} are copied into {@code otel.*} system properties by the CLI before the adapter is
 * created.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.infrastructure.metrics;
