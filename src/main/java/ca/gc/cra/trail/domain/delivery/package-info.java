/**
 * <strong>Purpose:</strong> Delivery value types: retry policy, the per-record attempt state machine and run
 * reports.
 * <p><strong>Pipeline role:</strong> Domain layer; no I/O.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.domain.delivery;
