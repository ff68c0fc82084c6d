package cal.sync.types;

import java.time.Instant;

/**
 * One stored version of an offloaded file.  Versions are never modified once
 * recorded.
 *
 * @param hash <code>"sha256:" + hex</code> digest
 * @param assetName where the bytes are stored
 * @param size length in bytes
 * @param timestamp when the version was recorded (second precision, UTC)
 * @param uploaded whether the asset was confirmed stored
 */
public record FileVersion(String hash, String assetName, long size, Instant timestamp, boolean uploaded) {
}
