/**
 * <strong>Purpose:</strong> Subprocess execution of the wrapped AI assistant.
 * <p><strong>Security:</strong> prompts and replies only touch disk through owner-only scoped temp files.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.infrastructure.exec;
