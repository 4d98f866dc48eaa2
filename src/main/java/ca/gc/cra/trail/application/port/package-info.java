/**
 * <strong>Purpose:</strong> Ports that decouple the audit pipeline from clocks, metrics, and remote services.
 * <p><strong>Pipeline role:</strong> Implemented by adapters under {@code ca.gc.cra.trail.adapter} and
 * {@code ca.gc.cra.trail.infrastructure}; consumed by the application services.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.port;
