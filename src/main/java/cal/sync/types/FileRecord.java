package cal.sync.types;

import com.google.common.collect.ImmutableList;

/**
 * The history of one offloaded path.
 *
 * @param currentHash the hash of the version the pointer should name; normally one of
 *   <code>versions</code>, but retention can evict it
 * @param versions every retained version, in the order they were recorded
 */
public record FileRecord(String currentHash, ImmutableList<FileVersion> versions) {
}
