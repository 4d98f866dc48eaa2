package ca.gc.cra.trail.application.audit;

import java.nio.charset.StandardCharsets;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.util.Base64;
import java.util.Objects;

/**
 * Verifies record signatures with the public key.
 *
 * @since 0.1.0
 */
public final class RecordVerifier {
  private final PublicKey publicKey;

  /**
   * Creates a verifier.
   *
   * @param publicKey RSA public key
   */
  public RecordVerifier(PublicKey publicKey) {
    this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
  }

  /**
   * Checks a signature over a record hash.
   *
   * @param recordHash stated record hash
   * @param signatureBase64 stated signature
   * @return {@code true} only when the signature is well-formed and valid
   */
  public boolean verify(String recordHash, String signatureBase64) {
    if (recordHash == null || signatureBase64 == null) {
      return false;
    }
    byte[] signatureBytes;
    try {
      signatureBytes = Base64.getDecoder().decode(signatureBase64);
    } catch (IllegalArgumentException ex) {
      return false;
    }
    try {
      Signature signature = Signature.getInstance(RecordSigner.JCA_ALGORITHM);
      signature.setParameter(RecordSigner.PSS_PARAMETERS);
      signature.initVerify(publicKey);
      signature.update(recordHash.getBytes(StandardCharsets.UTF_8));
      return signature.verify(signatureBytes);
    } catch (SignatureException ex) {
      return false;
    } catch (NoSuchAlgorithmException | InvalidAlgorithmParameterException | InvalidKeyException ex) {
      throw new IllegalStateException("Unable to verify audit record signatures", ex);
    }
  }
}
