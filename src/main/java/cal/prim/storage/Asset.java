package cal.prim.storage;

/**
 * A named binary object inside a {@link Container}.
 *
 * @param containerTag the tag of the owning container
 * @param name the authoritative stored name
 * @param size length in bytes
 * @param locator backend-specific address used to download or delete the asset
 */
public record Asset(String containerTag, String name, long size, String locator) {
}
