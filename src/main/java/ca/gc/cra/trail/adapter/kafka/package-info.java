/**
 * <strong>Purpose:</strong> Kafka log sink adapter.
 * <p><strong>Pipeline role:</strong> Implements {@link ca.gc.cra.trail.application.port.sink.LogSinkPort} for
 * deployments that collect audit records on a Kafka topic instead of CloudWatch Logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.adapter.kafka;
