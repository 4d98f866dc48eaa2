package ca.gc.cra.trail.infrastructure.persistence;

import ca.gc.cra.trail.application.port.store.DeliveryJournalPort;
import ca.gc.cra.trail.application.util.Digests;
import ca.gc.cra.trail.infrastructure.fs.OwnerOnlyFiles;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-per-hash delivery journal at {@code <store>/.chain/delivered.journal}.
 *
 * <p>Appends are forced to disk before returning. Only the upload holding the delivery lock writes it.</p>
 *
 * @since 0.1.0
 */
public final class FileDeliveryJournal implements DeliveryJournalPort {
  private static final Logger log = LoggerFactory.getLogger(FileDeliveryJournal.class);
  static final String JOURNAL_FILE = "delivered.journal";

  private final Path journal;
  private Set<String> cache;

  /**
   * Opens the journal of a store.
   *
   * @param storeRoot record store root
   * @throws IOException when the chain directory cannot be created
   */
  public FileDeliveryJournal(Path storeRoot) throws IOException {
    Objects.requireNonNull(storeRoot, "storeRoot");
    Path chainDir = OwnerOnlyFiles.createPrivateDirectories(storeRoot.resolve(FileChainState.CHAIN_DIR));
    this.journal = chainDir.resolve(JOURNAL_FILE);
  }

  @Override
  public synchronized boolean contains(String recordHash) throws IOException {
    return entries().contains(recordHash);
  }

  @Override
  public synchronized void append(String recordHash) throws IOException {
    if (!Digests.isSha256Hex(recordHash)) {
      throw new IllegalArgumentException("recordHash must be a SHA-256 hex digest");
    }
    byte[] line = (recordHash + "\n").getBytes(StandardCharsets.US_ASCII);
    try (FileChannel channel = FileChannel.open(journal,
        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
      channel.write(ByteBuffer.wrap(line));
      channel.force(true);
    }
    entries().add(recordHash);
  }

  @Override
  public synchronized void retainOnly(Set<String> stillPending) throws IOException {
    Objects.requireNonNull(stillPending, "stillPending");
    Set<String> kept = entries().stream().filter(stillPending::contains)
        .collect(Collectors.toCollection(LinkedHashSet::new));
    if (kept.size() == entries().size()) {
      return;
    }
    Path temp = Files.createTempFile(journal.getParent(), ".journal-", ".tmp", OwnerOnlyFiles.fileAttributes());
    try {
      Files.write(temp, kept, StandardCharsets.US_ASCII);
      Files.move(temp, journal, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.debug("Delivery journal pruned from {} to {} entries", entries().size(), kept.size());
    cache = kept;
  }

  private Set<String> entries() throws IOException {
    if (cache == null) {
      Set<String> loaded = new LinkedHashSet<>();
      if (Files.exists(journal)) {
        List<String> lines = Files.readAllLines(journal, StandardCharsets.US_ASCII);
        for (String line : lines) {
          String trimmed = line.strip();
          if (Digests.isSha256Hex(trimmed)) {
            loaded.add(trimmed);
          } else if (!trimmed.isEmpty()) {
            log.warn("Ignoring malformed delivery journal line in {}", journal);
          }
        }
      }
      cache = loaded;
    }
    return cache;
  }
}
