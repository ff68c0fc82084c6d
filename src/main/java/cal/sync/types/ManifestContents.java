package cal.sync.types;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;

/**
 * A snapshot of everything a manifest holds.
 *
 * @param containerTag the container the manifest's assets live in
 * @param lastUpdated when the manifest was last saved, if known
 * @param files per-path records, keyed by repository-relative path
 */
public record ManifestContents(String containerTag, @Nullable Instant lastUpdated, ImmutableMap<String, FileRecord> files) {
}
