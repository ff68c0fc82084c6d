package cal.prim.storage;

/**
 * Receives byte-level progress for a single upload or download.
 */
@FunctionalInterface
public interface TransferListener {

  /**
   * @param transferred bytes moved so far
   * @param total the expected total, or -1 if unknown
   */
  void onProgress(long transferred, long total);

  TransferListener NONE = (transferred, total) -> { };

}
