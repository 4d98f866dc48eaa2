/**
 * <strong>Purpose:</strong> Construction and verification of the signed audit hash chain.
 * <p><strong>Pipeline role:</strong> Sits between redaction and the record store; every record is built while the
 * chain lease is held.
 * <p><strong>Security:</strong> Private keys are only used through {@link ca.gc.cra.trail.application.audit.RecordSigner};
 * verification needs only the public key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.audit;
