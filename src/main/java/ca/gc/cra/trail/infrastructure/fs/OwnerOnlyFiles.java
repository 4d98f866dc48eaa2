package ca.gc.cra.trail.infrastructure.fs;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.AclEntry;
import java.nio.file.attribute.AclEntryPermission;
import java.nio.file.attribute.AclEntryType;
import java.nio.file.attribute.AclFileAttributeView;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.nio.file.attribute.UserPrincipal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Restricts files and directories to their owner.
 *
 * <p>On POSIX file systems files become {@code rw-------} and directories {@code rwx------}. Elsewhere the ACL is
 * replaced with a single ALLOW entry for the owner, which also drops inherited entries.</p>
 *
 * @since 0.1.0
 */
public final class OwnerOnlyFiles {
  private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");
  private static final Set<PosixFilePermission> DIRECTORY_PERMISSIONS =
      PosixFilePermissions.fromString("rwx------");

  private OwnerOnlyFiles() {}

  /**
   * Reports whether the default file system supports POSIX permissions.
   *
   * @return {@code true} on POSIX systems
   */
  public static boolean posixSupported() {
    return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
  }

  /**
   * Returns creation attributes for an owner-only file, or none when POSIX permissions are unsupported.
   *
   * @return attributes to pass to {@code Files.createFile} or {@code Files.createTempFile}
   */
  public static FileAttribute<?>[] fileAttributes() {
    if (!posixSupported()) {
      return new FileAttribute<?>[0];
    }
    return new FileAttribute<?>[] {PosixFilePermissions.asFileAttribute(FILE_PERMISSIONS)};
  }

  /**
   * Restricts a regular file to its owner.
   *
   * @param file file to restrict
   * @throws IOException when the permissions cannot be applied
   */
  public static void restrictFile(Path file) throws IOException {
    restrict(file, FILE_PERMISSIONS);
  }

  /**
   * Restricts a directory to its owner.
   *
   * @param directory directory to restrict
   * @throws IOException when the permissions cannot be applied
   */
  public static void restrictDirectory(Path directory) throws IOException {
    restrict(directory, DIRECTORY_PERMISSIONS);
  }

  /**
   * Creates a directory (and parents) and restricts the leaf to its owner.
   *
   * @param directory directory to create
   * @return the directory
   * @throws IOException when creation fails
   */
  public static Path createPrivateDirectories(Path directory) throws IOException {
    boolean existed = Files.isDirectory(directory);
    Files.createDirectories(directory);
    if (!existed) {
      restrictDirectory(directory);
    }
    return directory;
  }

  private static void restrict(Path path, Set<PosixFilePermission> posix) throws IOException {
    if (posixSupported()) {
      Files.setPosixFilePermissions(path, posix);
      return;
    }
    AclFileAttributeView acl = Files.getFileAttributeView(path, AclFileAttributeView.class);
    if (acl == null) {
      throw new IOException("No POSIX or ACL attribute view available for " + path);
    }
    UserPrincipal owner = Files.getOwner(path);
    AclEntry entry = AclEntry.newBuilder()
        .setType(AclEntryType.ALLOW)
        .setPrincipal(owner)
        .setPermissions(EnumSet.allOf(AclEntryPermission.class))
        .build();
    acl.setAcl(List.of(entry));
  }
}
