package cal.prim.storage;

/**
 * A tagged group of assets in a {@link BlobStore}.
 *
 * @param tag the user-facing tag, e.g. <code>large-files-v1</code>
 * @param id the backend's identifier for the container
 * @param locator backend-specific address (an upload URL, a key prefix, a directory)
 */
public record Container(String tag, String id, String locator) {
}
