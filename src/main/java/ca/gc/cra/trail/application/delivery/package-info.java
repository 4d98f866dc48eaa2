/**
 * <strong>Purpose:</strong> Delivery of persisted audit records to the configured log sink.
 * <p><strong>Pipeline role:</strong> Last stage; moves delivered records to the processed area and applies
 * retention.
 * <p><strong>Concurrency:</strong> One upload per store at a time, enforced by the delivery lock.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.delivery;
