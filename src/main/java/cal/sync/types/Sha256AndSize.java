package cal.sync.types;

import cal.prim.MalformedDataException;
import cal.sync.Util;

import java.util.Arrays;
import java.util.Objects;

/**
 * The content identity of a file: its SHA-256 digest and its length.
 *
 * <p>Pointer files and the manifest spell the digest as
 * <code>"sha256:" + 64 lowercase hex digits</code>; see {@link #hashString()} and
 * {@link #parseHash(String)}.
 */
public record Sha256AndSize(byte[] sha256, long size) {

  public static final String HASH_PREFIX = "sha256:";

  public Sha256AndSize {
    Objects.requireNonNull(sha256);
    if (sha256.length != 32) {
      throw new IllegalArgumentException("array is the wrong length to be a sha256 checksum");
    }
  }

  public String hex() {
    return Util.sha256toString(sha256);
  }

  public String hashString() {
    return HASH_PREFIX + hex();
  }

  /**
   * Decode a <code>"sha256:&lt;hex&gt;"</code> string.
   *
   * @param hash the encoded digest
   * @return the raw digest bytes
   * @throws MalformedDataException if the prefix is missing or the hex is invalid
   */
  public static byte[] parseHash(String hash) throws MalformedDataException {
    if (!hash.startsWith(HASH_PREFIX)) {
      throw new MalformedDataException("hash '" + hash + "' does not start with " + HASH_PREFIX);
    }
    try {
      return Util.stringToSha256(hash.substring(HASH_PREFIX.length()));
    } catch (IllegalArgumentException e) {
      throw new MalformedDataException("hash '" + hash + "' is not a SHA-256 digest", e);
    }
  }

  /**
   * @return true if this content has the given <code>"sha256:&lt;hex&gt;"</code> digest
   */
  public boolean matches(String hash) {
    return hashString().equalsIgnoreCase(hash);
  }

  // NOTE: Arrays use reference equality, so we need our own equals() and hashCode()

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Sha256AndSize other &&
            size == other.size &&
            Arrays.equals(sha256, other.sha256);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(sha256) * 31 + Long.hashCode(size);
  }

  @Override
  public String toString() {
    return hashString() + " (" + size + " bytes)";
  }

}
