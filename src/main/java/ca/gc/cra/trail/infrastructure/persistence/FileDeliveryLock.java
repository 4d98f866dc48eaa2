package ca.gc.cra.trail.infrastructure.persistence;

import ca.gc.cra.trail.application.port.store.DeliveryLockPort;
import ca.gc.cra.trail.infrastructure.fs.OwnerOnlyFiles;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DeliveryLockPort} backed by {@code <store>/.chain/delivery.lock}.
 *
 * @since 0.1.0
 */
public final class FileDeliveryLock implements DeliveryLockPort {
  static final String LOCK_FILE = "delivery.lock";

  private final Path lockFile;

  /**
   * Creates the lock for a store.
   *
   * @param storeRoot record store root
   * @throws IOException when the chain directory cannot be created
   */
  public FileDeliveryLock(Path storeRoot) throws IOException {
    Objects.requireNonNull(storeRoot, "storeRoot");
    this.lockFile = OwnerOnlyFiles.createPrivateDirectories(storeRoot.resolve(FileChainState.CHAIN_DIR))
        .resolve(LOCK_FILE);
  }

  @Override
  public Optional<Held> tryAcquire() throws IOException {
    FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    FileLock lock;
    try {
      lock = channel.tryLock();
    } catch (OverlappingFileLockException ex) {
      // held by another thread of this JVM
      lock = null;
    } catch (IOException | RuntimeException ex) {
      channel.close();
      throw ex;
    }
    if (lock == null) {
      channel.close();
      return Optional.empty();
    }
    FileLock held = lock;
    return Optional.of(() -> {
      try {
        held.release();
      } finally {
        channel.close();
      }
    });
  }
}
