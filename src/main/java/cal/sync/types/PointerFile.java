package cal.sync.types;

/**
 * The contents of a pointer file: a small JSON placeholder that is committed in
 * place of a large file whose bytes live in a {@link cal.prim.storage.BlobStore}.
 *
 * @param version pointer format version
 * @param hash <code>"sha256:" + hex</code> digest of the original content
 * @param size length of the original content in bytes
 * @param filename the original file name (no directory)
 * @param containerTag the tag of the container holding the asset
 * @param assetName the authoritative name of the stored asset
 */
public record PointerFile(int version, String hash, long size, String filename, String containerTag, String assetName) {

  public static final int CURRENT_VERSION = 1;

  /** The value of the <code>type</code> field that marks a JSON document as a pointer. */
  public static final String TYPE_MARKER = "lfs-pointer";

  /** Pointer files are written next to the real file with this suffix. */
  public static final String SUFFIX = ".pointer";

}
