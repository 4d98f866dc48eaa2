/**
 * <strong>Purpose:</strong> Persistence ports for audit records and the hash chain state.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.port.store;
