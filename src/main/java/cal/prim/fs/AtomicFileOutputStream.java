package cal.prim.fs;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * An output stream that replaces a file atomically and durably.  Bytes go to a
 * hidden temporary file in the same directory.  {@link #commit()} forces them to
 * disk, renames the temporary file over the target, and syncs the directory.
 * Closing without committing discards everything written, so a writer that
 * fails halfway (or a crash at any point) leaves the old file untouched.
 *
 * <p>Typical use:
 * <pre>
 *   try (AtomicFileOutputStream out = new AtomicFileOutputStream(path)) {
 *     ... write ...
 *     out.commit();
 *   }
 * </pre>
 */
public class AtomicFileOutputStream extends OutputStream {

  public static final String TEMP_SUFFIX = ".partial";

  private final Path target;
  private final Path temp;
  private final FileChannel channel;
  private boolean done = false;

  public AtomicFileOutputStream(Path target) throws IOException {
    this.target = target.toAbsolutePath();
    Path dir = this.target.getParent();
    if (dir == null) {
      throw new IllegalArgumentException("cannot replace a filesystem root: " + target);
    }
    this.temp = Files.createTempFile(dir, "." + this.target.getFileName(), TEMP_SUFFIX);
    this.channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
  }

  /**
   * @return true if <code>file</code> looks like the leftover temporary file of
   *   an uncommitted stream
   */
  public static boolean isTemporary(Path file) {
    Path name = file.getFileName();
    return name != null && name.toString().startsWith(".") && name.toString().endsWith(TEMP_SUFFIX);
  }

  private void checkOpen() throws IOException {
    if (done) {
      throw new IOException("stream for " + target + " is already closed");
    }
  }

  @Override
  public void write(int b) throws IOException {
    write(new byte[] { (byte) b }, 0, 1);
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    checkOpen();
    ByteBuffer buf = ByteBuffer.wrap(b, off, len);
    while (buf.hasRemaining()) {
      channel.write(buf);
    }
  }

  /**
   * Make the written bytes the new contents of the target file.
   *
   * @throws IOException if the data could not be synced or renamed; the target
   *   then still has its old contents
   */
  public void commit() throws IOException {
    checkOpen();
    done = true;
    try {
      channel.force(true);
      channel.close();
      DurableFiles.moveDurably(temp, target);
    } catch (IOException | RuntimeException e) {
      discard(e);
      throw e;
    }
  }

  @Override
  public void close() throws IOException {
    if (!done) {
      done = true;
      try {
        channel.close();
      } finally {
        Files.deleteIfExists(temp);
      }
    }
  }

  private void discard(Exception cause) {
    try {
      channel.close();
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }

}
