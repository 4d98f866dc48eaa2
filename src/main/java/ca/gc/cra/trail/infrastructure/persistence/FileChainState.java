package ca.gc.cra.trail.infrastructure.persistence;

import ca.gc.cra.trail.application.port.store.ChainLease;
import ca.gc.cra.trail.application.port.store.ChainStatePort;
import ca.gc.cra.trail.domain.audit.IntegrityException;
import ca.gc.cra.trail.infrastructure.fs.OwnerOnlyFiles;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ChainStatePort} persisted under {@code <store>/.chain/}.
 * <p><strong>Layout:</strong> {@code state.json} holds {@code last_hash}, {@code sequence} and an optional
 * {@code pending} intent; {@code chain.lock} is the cross-process lock file; {@code HALTED} carries the reason a
 * failed consistency check stopped record creation.</p>
 * <p><strong>Thread-safety:</strong> A {@link ReentrantLock} per chain directory serializes threads of this JVM
 * (file locks are held per JVM, not per thread); {@link FileChannel#lock()} serializes processes.</p>
 *
 * @since 0.1.0
 */
public final class FileChainState implements ChainStatePort {
  private static final Logger log = LoggerFactory.getLogger(FileChainState.class);
  static final String CHAIN_DIR = ".chain";
  static final String STATE_FILE = "state.json";
  static final String LOCK_FILE = "chain.lock";
  static final String HALT_FILE = "HALTED";
  private static final String LAST_HASH = "last_hash";
  private static final String SEQUENCE = "sequence";
  private static final String PENDING = "pending";
  private static final String PENDING_HASH = "record_hash";
  private static final String PENDING_FILE = "file_name";
  private static final Map<Path, ReentrantLock> JVM_LOCKS = new ConcurrentHashMap<>();
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Path chainDir;
  private final Path stateFile;
  private final Path lockFile;
  private final Path haltFile;
  private final Predicate<String> recordExists;
  private final ReentrantLock jvmLock;

  /**
   * Opens the chain state of a store.
   *
   * @param storeRoot record store root
   * @param recordExists tells whether a record file name exists in the store (pending or processed)
   * @throws IOException when the chain directory cannot be created
   */
  public FileChainState(Path storeRoot, Predicate<String> recordExists) throws IOException {
    Objects.requireNonNull(storeRoot, "storeRoot");
    this.chainDir = OwnerOnlyFiles.createPrivateDirectories(storeRoot.resolve(CHAIN_DIR));
    this.stateFile = chainDir.resolve(STATE_FILE);
    this.lockFile = chainDir.resolve(LOCK_FILE);
    this.haltFile = chainDir.resolve(HALT_FILE);
    this.recordExists = Objects.requireNonNull(recordExists, "recordExists");
    this.jvmLock = JVM_LOCKS.computeIfAbsent(chainDir.toAbsolutePath().normalize(), key -> new ReentrantLock());
  }

  @Override
  public ChainLease acquire() throws IOException, IntegrityException {
    failIfHalted();
    Locked locked = lock();
    try {
      failIfHalted();
      State state = readState();
      if (state.pending() != null) {
        state = recover(state);
        writeState(state);
      }
      return new FileChainLease(locked, state.lastHash(), state.sequence());
    } catch (IOException | IntegrityException | RuntimeException ex) {
      try {
        locked.close();
      } catch (IOException closeEx) {
        ex.addSuppressed(closeEx);
      }
      throw ex;
    }
  }

  @Override
  public boolean halted() {
    return Files.exists(haltFile);
  }

  @Override
  public String haltReason() throws IOException {
    try {
      return Files.readString(haltFile, StandardCharsets.UTF_8).strip();
    } catch (NoSuchFileException ex) {
      return null;
    }
  }

  @Override
  public void resetAfterVerification(String tailHash, long sequence) throws IOException {
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must be >= 0");
    }
    try (Locked ignored = lock()) {
      writeState(new State(tailHash, sequence, null, null));
      Files.deleteIfExists(haltFile);
    }
    log.info("Chain state re-anchored at sequence {} (tail {})", sequence, tailHash);
  }

  private State recover(State state) {
    if (recordExists.test(state.pendingFile())) {
      log.warn("Rolling chain forward to interrupted record {}", state.pendingFile());
      return new State(state.pending(), state.sequence() + 1, null, null);
    }
    log.warn("Discarding chain intent for unwritten record {}", state.pendingFile());
    return new State(state.lastHash(), state.sequence(), null, null);
  }

  private void failIfHalted() throws IOException, IntegrityException {
    if (halted()) {
      throw new IntegrityException("Record creation halted: " + haltReason()
          + " (run 'verify --clear-halt' after investigating)");
    }
  }

  private IntegrityException halt(String reason) {
    try {
      Files.writeString(haltFile, reason + System.lineSeparator(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      log.error("Unable to write halt marker {}", haltFile, ex);
    }
    log.error("Chain halted: {}", reason);
    return new IntegrityException(reason);
  }

  private State readState() throws IOException, IntegrityException {
    if (!Files.exists(stateFile)) {
      return new State(null, 0L, null, null);
    }
    String json = Files.readString(stateFile, StandardCharsets.UTF_8);
    try {
      JsonNode root = MAPPER.readTree(json);
      if (root == null || !root.isObject() || !root.path(SEQUENCE).canConvertToLong()
          || root.path(SEQUENCE).asLong() < 0) {
        throw halt("Chain state " + stateFile + " is malformed");
      }
      JsonNode pending = root.path(PENDING);
      return new State(
          textOrNull(root.get(LAST_HASH)),
          root.path(SEQUENCE).asLong(),
          pending.isObject() ? textOrNull(pending.get(PENDING_HASH)) : null,
          pending.isObject() ? textOrNull(pending.get(PENDING_FILE)) : null);
    } catch (JsonProcessingException ex) {
      throw halt("Chain state " + stateFile + " is unreadable: " + ex.getOriginalMessage());
    }
  }

  private void writeState(State state) throws IOException {
    ObjectNode root = MAPPER.createObjectNode();
    root.put(LAST_HASH, state.lastHash());
    root.put(SEQUENCE, state.sequence());
    if (state.pending() != null) {
      root.putObject(PENDING).put(PENDING_HASH, state.pending()).put(PENDING_FILE, state.pendingFile());
    }
    Path temp = Files.createTempFile(chainDir, ".state-", ".tmp", OwnerOnlyFiles.fileAttributes());
    try {
      Files.writeString(temp, MAPPER.writeValueAsString(root), StandardCharsets.UTF_8);
      Files.move(temp, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private Locked lock() throws IOException {
    jvmLock.lock();
    FileChannel channel = null;
    try {
      channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      return new Locked(channel, channel.lock());
    } catch (IOException | RuntimeException ex) {
      if (channel != null) {
        channel.close();
      }
      jvmLock.unlock();
      throw ex;
    }
  }

  private static String textOrNull(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }

  private record State(String lastHash, long sequence, String pending, String pendingFile) {}

  private final class Locked implements AutoCloseable {
    private final FileChannel channel;
    private final FileLock fileLock;
    private boolean released;

    private Locked(FileChannel channel, FileLock fileLock) {
      this.channel = channel;
      this.fileLock = fileLock;
    }

    @Override
    public void close() throws IOException {
      if (released) {
        return;
      }
      released = true;
      try {
        fileLock.release();
      } finally {
        channel.close();
        jvmLock.unlock();
      }
    }
  }

  private final class FileChainLease implements ChainLease {
    private final Locked locked;
    private String lastHash;
    private long sequence;
    private String preparedHash;

    private FileChainLease(Locked locked, String lastHash, long sequence) {
      this.locked = locked;
      this.lastHash = lastHash;
      this.sequence = sequence;
    }

    @Override
    public String lastHash() {
      return lastHash;
    }

    @Override
    public long sequence() {
      return sequence;
    }

    @Override
    public void prepare(String recordHash, String fileName) throws IOException, IntegrityException {
      Objects.requireNonNull(recordHash, "recordHash");
      Objects.requireNonNull(fileName, "fileName");
      if (preparedHash != null) {
        throw new IllegalStateException("A record is already prepared on this lease");
      }
      State current = readState();
      if (current.sequence() != sequence || !Objects.equals(current.lastHash(), lastHash)) {
        throw halt("Chain state changed under the lock before prepare (expected sequence " + sequence
            + ", found " + current.sequence() + ")");
      }
      writeState(new State(lastHash, sequence, recordHash, fileName));
      preparedHash = recordHash;
    }

    @Override
    public void commit(String recordHash) throws IOException, IntegrityException {
      Objects.requireNonNull(recordHash, "recordHash");
      if (!recordHash.equals(preparedHash)) {
        throw new IllegalStateException("commit does not match the prepared record");
      }
      State current = readState();
      if (current.sequence() != sequence || !recordHash.equals(current.pending())) {
        throw halt("Chain state changed under the lock before commit (expected sequence " + sequence
            + ", found " + current.sequence() + ")");
      }
      writeState(new State(recordHash, sequence + 1, null, null));
      lastHash = recordHash;
      sequence++;
      preparedHash = null;
    }

    @Override
    public void close() throws IOException {
      locked.close();
    }
  }
}
