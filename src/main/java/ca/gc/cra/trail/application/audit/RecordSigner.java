package ca.gc.cra.trail.application.audit;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;
import java.util.Base64;
import java.util.Objects;

/**
 * Signs record hashes with the local private key using RSASSA-PSS over SHA-256.
 *
 * <p>Thread-safe; a fresh {@link Signature} is created per call.</p>
 *
 * @since 0.1.0
 */
public final class RecordSigner {
  /** Label stored in {@code signature_algorithm}. */
  public static final String ALGORITHM_LABEL = "RSASSA-PSS-SHA256";

  static final String JCA_ALGORITHM = "RSASSA-PSS";
  static final PSSParameterSpec PSS_PARAMETERS =
      new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, 32, PSSParameterSpec.TRAILER_FIELD_BC);

  private final PrivateKey privateKey;

  /**
   * Creates a signer.
   *
   * @param privateKey RSA private key loaded once per process
   */
  public RecordSigner(PrivateKey privateKey) {
    this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
  }

  /**
   * Signs a record hash.
   *
   * @param recordHash hex digest to sign
   * @return Base64 signature
   * @throws IllegalStateException when the JCA provider rejects the key or algorithm
   */
  public String sign(String recordHash) {
    Objects.requireNonNull(recordHash, "recordHash");
    try {
      Signature signature = Signature.getInstance(JCA_ALGORITHM);
      signature.setParameter(PSS_PARAMETERS);
      signature.initSign(privateKey);
      signature.update(recordHash.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(signature.sign());
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Unable to sign audit record", ex);
    }
  }
}
