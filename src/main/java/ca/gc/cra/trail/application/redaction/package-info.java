/**
 * <strong>Purpose:</strong> Layered PII redaction and auxiliary text analysis.
 * <p><strong>Pipeline role:</strong> First step of every exchange; its output is the only form of the prompt that
 * is stored or shipped.
 * <p><strong>Concurrency:</strong> Redactors are stateless apart from their ports and are safe to share.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.redaction;
