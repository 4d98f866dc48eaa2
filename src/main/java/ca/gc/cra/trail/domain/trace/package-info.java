/**
 * <strong>Purpose:</strong> Trace identifiers that tie a prompt, its response, and the resulting audit record
 * together.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.domain.trace;
