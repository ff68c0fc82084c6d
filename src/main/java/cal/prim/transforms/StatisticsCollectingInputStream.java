package cal.prim.transforms;

import cal.sync.Util;
import org.checkerframework.checker.mustcall.qual.MustCall;
import org.checkerframework.checker.mustcall.qual.MustCallAlias;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.util.function.Consumer;

/**
 * A pass-through stream that hashes and counts every byte it yields.  Each read that
 * produces data invokes the progress callback, so a caller can report transfer
 * progress and compute the content hash in the same single pass.
 *
 * <p>Skipping, marking and resetting are not supported: every byte of the
 * underlying stream has to go through the digest.
 */
public class StatisticsCollectingInputStream extends FilterInputStream {

  private final MessageDigest digest;
  private final Consumer<@MustCall({}) StatisticsCollectingInputStream> onProgress;
  private long bytesRead;

  public @MustCallAlias StatisticsCollectingInputStream(@MustCallAlias InputStream in, Consumer<@MustCall({}) StatisticsCollectingInputStream> onProgress) {
    super(in);
    this.digest = Util.sha256Digest();
    this.onProgress = onProgress;
    this.bytesRead = 0L;
  }

  @Override
  public int read() throws IOException {
    int res = super.read();
    if (res >= 0) {
      digest.update((byte) res);
      bytesRead++;
      onProgress.accept(this);
    }
    return res;
  }

  @Override
  public int read(byte[] b) throws IOException {
    return read(b, 0, b.length);
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    int nread = super.read(b, off, len);
    if (nread > 0) {
      digest.update(b, off, nread);
      bytesRead += nread;
      onProgress.accept(this);
    }
    return nread;
  }

  @Override
  public long skip(long n) {
    throw new UnsupportedOperationException();
  }

  @Override
  public synchronized void mark(int readlimit) {
    throw new UnsupportedOperationException();
  }

  @Override
  public boolean markSupported() {
    return false;
  }

  @Override
  public synchronized void reset() {
    throw new UnsupportedOperationException();
  }

  /**
   * The digest of everything read so far.  May be called repeatedly; it does not
   * disturb the running hash.
   */
  public byte[] getSha256Digest() {
    try {
      // .digest() resets the MessageDigest, so work on a copy
      return ((MessageDigest) digest.clone()).digest();
    } catch (CloneNotSupportedException e) {
      throw new UnsupportedOperationException(e);
    }
  }

  public long getBytesRead() {
    return bytesRead;
  }

}
