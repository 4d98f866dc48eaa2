/**
 * <strong>Purpose:</strong> PEM storage of the audit signing key pair.
 * <p><strong>Security:</strong> the private key file is written owner-only and never logged.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.infrastructure.crypto;
