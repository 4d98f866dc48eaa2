package ca.gc.cra.trail.infrastructure.crypto;

import ca.gc.cra.trail.config.SetupException;
import ca.gc.cra.trail.infrastructure.fs.OwnerOnlyFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads and generates the RSA signing key pair stored as PEM files.
 * <p><strong>Files:</strong> {@code audit_private_key.pem} (PKCS#8, owner-only) and {@code audit_public_key.pem}
 * (X.509 SubjectPublicKeyInfo) in the key directory.</p>
 * <p><strong>Failure model:</strong> missing or unparseable keys raise {@link SetupException} naming the
 * {@code keygen} command.</p>
 *
 * @since 0.1.0
 */
public final class PemKeyStore {
  private static final Logger log = LoggerFactory.getLogger(PemKeyStore.class);
  public static final String PRIVATE_KEY_FILE = "audit_private_key.pem";
  public static final String PUBLIC_KEY_FILE = "audit_public_key.pem";
  static final int KEY_SIZE = 2048;
  private static final String PRIVATE_LABEL = "PRIVATE KEY";
  private static final String PUBLIC_LABEL = "PUBLIC KEY";

  private final Path keyDir;

  /**
   * Creates a key store over a directory.
   *
   * @param keyDir directory holding the PEM files
   */
  public PemKeyStore(Path keyDir) {
    this.keyDir = Objects.requireNonNull(keyDir, "keyDir");
  }

  /** Path of the private key file. */
  public Path privateKeyPath() {
    return keyDir.resolve(PRIVATE_KEY_FILE);
  }

  /** Path of the public key file. */
  public Path publicKeyPath() {
    return keyDir.resolve(PUBLIC_KEY_FILE);
  }

  /**
   * Loads the private signing key.
   *
   * @return RSA private key
   * @throws SetupException when the file is missing or not a PKCS#8 RSA key
   */
  public PrivateKey loadPrivateKey() throws SetupException {
    byte[] der = readPem(privateKeyPath(), PRIVATE_LABEL);
    try {
      return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
    } catch (GeneralSecurityException ex) {
      throw new SetupException("Private key " + privateKeyPath() + " is not a PKCS#8 RSA key", ex);
    }
  }

  /**
   * Loads the public verification key.
   *
   * @return RSA public key
   * @throws SetupException when the file is missing or not an X.509 RSA key
   */
  public PublicKey loadPublicKey() throws SetupException {
    byte[] der = readPem(publicKeyPath(), PUBLIC_LABEL);
    try {
      return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
    } catch (GeneralSecurityException ex) {
      throw new SetupException("Public key " + publicKeyPath() + " is not an X.509 RSA key", ex);
    }
  }

  /**
   * Derives the public key from the private key file when the public file is missing.
   *
   * @return public key
   * @throws SetupException when neither file yields a key
   */
  public PublicKey loadOrDerivePublicKey() throws SetupException {
    if (Files.exists(publicKeyPath())) {
      return loadPublicKey();
    }
    PrivateKey privateKey = loadPrivateKey();
    if (!(privateKey instanceof RSAPrivateCrtKey crt)) {
      throw new SetupException("Public key " + publicKeyPath() + " is missing and cannot be derived");
    }
    try {
      return KeyFactory.getInstance("RSA")
          .generatePublic(new RSAPublicKeySpec(crt.getModulus(), crt.getPublicExponent()));
    } catch (GeneralSecurityException ex) {
      throw new SetupException("Unable to derive public key from " + privateKeyPath(), ex);
    }
  }

  /**
   * Generates and writes a fresh RSA-2048 key pair.
   *
   * @param force overwrite existing key files
   * @return generated key pair
   * @throws SetupException when keys exist and {@code force} is {@code false}
   * @throws IOException when the files cannot be written
   */
  public KeyPair generate(boolean force) throws SetupException, IOException {
    if (!force && (Files.exists(privateKeyPath()) || Files.exists(publicKeyPath()))) {
      throw new SetupException("Key files already exist in " + keyDir + "; use --force to replace them");
    }
    KeyPair pair;
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(KEY_SIZE, new SecureRandom());
      pair = generator.generateKeyPair();
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("RSA key generation unavailable", ex);
    }
    OwnerOnlyFiles.createPrivateDirectories(keyDir);
    writePem(privateKeyPath(), PRIVATE_LABEL, pair.getPrivate().getEncoded());
    writePem(publicKeyPath(), PUBLIC_LABEL, pair.getPublic().getEncoded());
    log.info("Generated RSA-{} audit signing key pair in {}", KEY_SIZE, keyDir);
    return pair;
  }

  private static byte[] readPem(Path file, String label) throws SetupException {
    if (!Files.isRegularFile(file)) {
      throw new SetupException("Key file " + file + " not found; run 'trail keygen' first");
    }
    String text;
    try {
      text = Files.readString(file, StandardCharsets.US_ASCII);
    } catch (IOException ex) {
      throw new SetupException("Key file " + file + " is not readable: " + ex.getMessage(), ex);
    }
    String begin = "-----BEGIN " + label + "-----";
    String end = "-----END " + label + "-----";
    int start = text.indexOf(begin);
    int stop = text.indexOf(end);
    if (start < 0 || stop < start) {
      throw new SetupException("Key file " + file + " has no " + label + " PEM block");
    }
    try {
      return Base64.getMimeDecoder().decode(text.substring(start + begin.length(), stop));
    } catch (IllegalArgumentException ex) {
      throw new SetupException("Key file " + file + " has invalid Base64 content", ex);
    }
  }

  private static void writePem(Path file, String label, byte[] der) throws IOException {
    String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
    String pem = "-----BEGIN " + label + "-----\n" + body + "\n-----END " + label + "-----\n";
    Path temp = Files.createTempFile(file.getParent(), ".key-", ".tmp", OwnerOnlyFiles.fileAttributes());
    try {
      Files.writeString(temp, pem, StandardCharsets.US_ASCII);
      OwnerOnlyFiles.restrictFile(temp);
      Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
