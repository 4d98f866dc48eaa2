/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize messages before emission.
 * <p><strong>Security:</strong> {@link ca.gc.cra.trail.logging.Logs#scrub(String)} masks PII and credentials in
 * exception text originating from remote services.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.logging;
