package cal.sync;

import cal.prim.transforms.StatisticsCollectingInputStream;
import cal.sync.types.Sha256AndSize;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.function.Consumer;
import java.util.regex.Pattern;

public abstract class Util {

  public static final long ONE_BYTE = 1;
  public static final long ONE_KB = ONE_BYTE * 1024;
  public static final long ONE_MB = ONE_KB * 1024;
  public static final long ONE_GB = ONE_MB * 1024;
  public static final long ONE_TB = ONE_GB * 1024;

  /**
   * The suggested size of in-memory byte buffers for I/O.
   * The value is 8192, which is currently the size used by {@link BufferedInputStream}
   * on desktop JVMs.  Hashing and transfers read in chunks of this size, so memory
   * use stays flat no matter how large the offloaded files are.
   */
  public static final int SUGGESTED_BUFFER_SIZE = 8192;

  /**
   * A thread-local byte array of {@link #SUGGESTED_BUFFER_SIZE} bytes.
   */
  private static final ThreadLocal<byte[]> MEM_BUFFER = ThreadLocal.withInitial(() -> new byte[SUGGESTED_BUFFER_SIZE]);

  public static long copyStream(InputStream in, OutputStream out) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      out.write(buf, 0, n);
      count += n;
    }
    return count;
  }

  public static MessageDigest sha256Digest() {
    MessageDigest md;
    try {
      md = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // This should never happen; all JREs are required to support
      // SHA-256 (as well as MD5 and SHA-1).
      throw new UnsupportedOperationException();
    }
    return md;
  }

  public static Sha256AndSize summarize(InputStream in, Consumer<StatisticsCollectingInputStream> progressCallback) throws IOException {
    StatisticsCollectingInputStream s = new StatisticsCollectingInputStream(in, progressCallback);
    drain(s);
    return new Sha256AndSize(s.getSha256Digest(), s.getBytesRead());
  }

  /**
   * Stream-hash a file.
   *
   * @param file the file to read
   * @return its digest and length
   * @throws java.nio.file.NoSuchFileException if the file does not exist
   * @throws IOException if the file cannot be read
   */
  public static Sha256AndSize summarize(Path file) throws IOException {
    try (InputStream in = buffered(Files.newInputStream(file))) {
      return summarize(in, s -> { });
    }
  }

  public static BufferedInputStream buffered(InputStream in) {
    return new BufferedInputStream(in, SUGGESTED_BUFFER_SIZE);
  }

  public static byte[] read(InputStream in) throws IOException {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      copyStream(in, out);
      return out.toByteArray();
    }
  }

  public static long drain(InputStream in) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      count += n;
    }
    return count;
  }

  public static long divideAndRoundUp(long numerator, long denominator) {
    return (numerator + denominator - 1) / denominator;
  }

  public static String formatSize(long l) {
    if (l > ONE_TB) return divideAndRoundUp(l, ONE_TB) + " Tb";
    if (l > ONE_GB) return divideAndRoundUp(l, ONE_GB) + " Gb";
    if (l > ONE_MB) return divideAndRoundUp(l, ONE_MB) + " Mb";
    if (l > ONE_KB) return divideAndRoundUp(l, ONE_KB) + " Kb";
    return l + " bytes";
  }

  private static final String HEX_CHARS = "0123456789abcdef";
  public static String sha256toString(byte[] sha256) {
    StringBuilder builder = new StringBuilder();
    for (byte b : sha256) {
      int i = Byte.toUnsignedInt(b);
      builder.append(HEX_CHARS.charAt((i >> 4) & 0xF));
      builder.append(HEX_CHARS.charAt(i & 0xF));
    }
    return builder.toString();
  }

  /**
   * Convert a single hexadecimal digit to its integer value.
   * @param c a character
   * @return an int in the range [0, 15]
   */
  private static int hexValue(char c) {
    int value = Character.digit(c, 16);
    if (value < 0) {
      throw new IllegalArgumentException("character " + c + " is not a hex digit");
    }
    return value;
  }

  /**
   * Inverse of {@link #sha256toString(byte[])}.
   * @param sha256 64 hex digits
   * @return the 32 bytes they encode
   * @throws IllegalArgumentException if the string is not 64 hex digits
   */
  public static byte[] stringToSha256(CharSequence sha256) {
    int len = sha256.length();
    if (len != 64) {
      throw new IllegalArgumentException("string has the wrong length to be a SHA-256 sum (should be 64, was " + len + ')');
    }
    byte[] sum = new byte[32];
    for (int i = 0; i < sum.length; ++i) {
      char c1 = sha256.charAt(i * 2);
      char c2 = sha256.charAt(i * 2 + 1);
      int val1 = hexValue(c1);
      int val2 = hexValue(c2);
      sum[i] = (byte)(val1 << 4 | val2);
    }
    return sum;
  }

  /**
   * The path of <code>file</code> relative to <code>root</code>, with forward
   * slashes on every platform.  This is the form used as a manifest key and as a
   * git pathspec.
   */
  public static String relativePath(Path root, Path file) {
    return root.toAbsolutePath().normalize()
            .relativize(file.toAbsolutePath().normalize())
            .toString()
            .replace(File.separatorChar, '/');
  }

  private static final Pattern URL_CREDENTIALS = Pattern.compile("(://[^/:@\\s]+:)[^@/\\s]+@");

  /**
   * Hide the secret part of any <code>user:secret@</code> credentials embedded in
   * URLs, so command lines can be logged.
   */
  public static String maskCredentials(String text) {
    return URL_CREDENTIALS.matcher(text).replaceAll("$1****@");
  }

}
