/**
 * <strong>Purpose:</strong> Value types describing what was masked in a prompt and how.
 * <p><strong>Pipeline role:</strong> Produced by the redaction services and embedded in audit records as
 * {@code pii_detection} and {@code nlp_analysis}.
 * <p><strong>Security:</strong> Findings carry digests of the original spans, never the spans themselves.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.domain.redaction;
