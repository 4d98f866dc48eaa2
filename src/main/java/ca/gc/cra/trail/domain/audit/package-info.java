/**
 * <strong>Purpose:</strong> Audit record model and chain verification results.
 * <p><strong>Pipeline role:</strong> Produced by {@code AuditRecordBuilder}, persisted by the record store, and
 * shipped verbatim by the delivery engine.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.domain.audit;
