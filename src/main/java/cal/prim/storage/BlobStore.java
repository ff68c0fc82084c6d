package cal.prim.storage;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * An external store of large binary objects.  Objects ("assets") live in tagged
 * groups ("containers"); within a container every asset has a unique name.  On
 * GitHub a container is a release, on S3 a key prefix, locally a directory.
 *
 * <p>All methods are stateless with respect to the caller and may be invoked
 * concurrently from several worker threads.  Remote implementations retry
 * transient failures internally (see {@link StoreException#classify(IOException)});
 * an {@link IOException} escaping one of these methods means the request has
 * already been given up on.
 *
 * <p>A missing container or asset is an ordinary answer, reported as
 * <code>null</code> by the <code>find</code> methods, never as an exception.
 */
public interface BlobStore {

  /**
   * Look up a container.
   *
   * @param tag the container tag
   * @return the container, or null if there is none with that tag
   * @throws IOException if the store could not be queried
   */
  @Nullable Container findContainer(String tag) throws IOException;

  /**
   * Return the container with the given tag, creating it if it does not exist.
   * Calling this repeatedly with the same tag returns the same container.
   *
   * @param tag the container tag
   * @return the container
   * @throws IOException if the container could not be found or created
   */
  Container getOrCreateContainer(String tag) throws IOException;

  /**
   * @param container a container
   * @return every asset in it, in no particular order
   * @throws IOException if the listing failed
   */
  List<Asset> listAssets(Container container) throws IOException;

  /**
   * Look up an asset by name.
   *
   * @param container a container
   * @param name the asset name
   * @return the asset, or null if the container has no asset with that name
   * @throws IOException if the listing failed
   */
  default @Nullable Asset findAsset(Container container, String name) throws IOException {
    for (Asset a : listAssets(container)) {
      if (a.name().equals(name)) {
        return a;
      }
    }
    return null;
  }

  /**
   * Upload a file as a named asset.  Any existing asset with the same name is
   * deleted first.  The data is streamed, so the file may be arbitrarily large.
   *
   * <p>The store may normalize the requested name; callers must record the name
   * of the returned asset, not the one they asked for.
   *
   * <p>Note that the old asset is deleted before the new one is stored.  If the
   * upload then fails, neither copy exists.
   *
   * @param container the destination container
   * @param name the requested asset name
   * @param source the file to upload
   * @param listener receives byte progress
   * @return the stored asset
   * @throws IOException if the upload failed
   */
  Asset upload(Container container, String name, Path source, TransferListener listener) throws IOException;

  /**
   * Stream an asset into a file, replacing the file if it exists.  Memory use
   * does not depend on the asset size.
   *
   * @param asset the asset to fetch
   * @param destination where to write it
   * @param listener receives byte progress
   * @throws IOException if the download failed; the destination may then hold
   *   partial data
   */
  void download(Asset asset, Path destination, TransferListener listener) throws IOException;

  /**
   * Delete an asset.  Deleting an asset that is already gone succeeds.
   *
   * @param asset the asset
   * @throws IOException if the deletion failed
   */
  void delete(Asset asset) throws IOException;

}
