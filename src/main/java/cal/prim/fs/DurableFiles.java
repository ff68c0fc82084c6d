package cal.prim.fs;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Crash-safe filesystem operations.  Every method here returns only once its
 * effect is on disk: file data and the directory entries that name it are
 * flushed with <code>fsync</code>.
 */
public abstract class DurableFiles {

  // Windows cannot open a directory for syncing; NTFS journals metadata anyway.
  private static final boolean CAN_SYNC_DIRECTORIES =
          !System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

  /**
   * Create a directory and any missing parents, syncing each parent after a
   * child is added to it.
   *
   * @param dir the directory
   * @throws FileAlreadyExistsException if something other than a directory is in the way
   * @throws IOException if a directory could not be created
   */
  public static void createDirectories(Path dir) throws IOException {
    Path absolute = dir.toAbsolutePath().normalize();
    Deque<Path> missing = new ArrayDeque<>();
    for (Path p = absolute; p != null && !Files.isDirectory(p); p = p.getParent()) {
      missing.push(p);
    }
    while (!missing.isEmpty()) {
      Path p = missing.pop();
      try {
        Files.createDirectory(p);
      } catch (FileAlreadyExistsException e) {
        if (!Files.isDirectory(p)) {
          throw e;
        }
        // created concurrently
        continue;
      }
      Path parent = p.getParent();
      if (parent != null) {
        syncDirectory(parent);
      }
    }
  }

  /**
   * Atomically replace <code>target</code> with <code>bytes</code>.
   *
   * @param target the file to write
   * @param bytes its new contents
   * @throws IOException if writing failed; the old contents are then intact
   */
  public static void write(Path target, byte[] bytes) throws IOException {
    try (AtomicFileOutputStream out = new AtomicFileOutputStream(target)) {
      out.write(bytes);
      out.commit();
    }
  }

  /**
   * Sync <code>src</code> to disk and rename it over <code>dst</code>.  The two
   * paths must be on the same filesystem.
   *
   * @param src a fully written file
   * @param dst the file to replace
   * @throws IOException if the data could not be synced or renamed
   */
  public static void replace(Path src, Path dst) throws IOException {
    try (FileChannel ch = FileChannel.open(src, StandardOpenOption.WRITE)) {
      ch.force(true);
    }
    moveDurably(src, dst);
  }

  static void moveDurably(Path src, Path dst) throws IOException {
    try {
      Files.move(src, dst, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      throw new IOException("cannot atomically replace " + dst + " with " + src, e);
    }
    Path parent = dst.toAbsolutePath().getParent();
    if (parent != null) {
      syncDirectory(parent);
    }
  }

  /**
   * Flush a directory's entries (creations, renames, deletions) to disk.
   */
  public static void syncDirectory(Path dir) throws IOException {
    if (CAN_SYNC_DIRECTORIES) {
      try (FileChannel ch = FileChannel.open(dir, StandardOpenOption.READ)) {
        ch.force(true);
      }
    }
  }

}
