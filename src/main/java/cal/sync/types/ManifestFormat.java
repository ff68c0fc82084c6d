package cal.sync.types;

import cal.prim.MalformedDataException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;

/**
 * The on-disk encoding of a {@link cal.sync.impls.Manifest}.
 */
public interface ManifestFormat {

  /**
   * Decode a manifest.
   *
   * @param data the serialized manifest
   * @return its contents
   * @throws IOException if <code>data</code> cannot be read
   * @throws MalformedDataException if the data is not a manifest this format understands
   */
  ManifestContents load(InputStream data) throws IOException, MalformedDataException;

  /**
   * Encode a manifest.
   *
   * @param contents what to write
   * @param lastUpdated the save time to record
   * @param out the destination, left open
   * @throws IOException if writing fails
   */
  void serialize(ManifestContents contents, Instant lastUpdated, OutputStream out) throws IOException;

}
