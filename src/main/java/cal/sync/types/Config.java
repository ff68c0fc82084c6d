package cal.sync.types;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Validated runtime settings.  Built by {@link cal.sync.ConfigLoader}.
 *
 * @param repoDir the working copy that mirrors the tree
 * @param branch the branch to sync
 * @param remoteRepo the remote repository, as <code>owner/name</code>
 * @param token credential for the remote and for the GitHub store
 * @param offloadEnabled whether large files are offloaded and restored at all
 * @param threshold files strictly larger than this many bytes are offloaded
 * @param containerTag the store container that holds offloaded assets
 * @param maxVersions versions kept per path by retention cleanup
 * @param workers width of the transfer worker pool
 * @param interval time between periodic sync cycles
 * @param verifyHash whether restores check the downloaded content hash
 * @param excludes repository-relative path prefixes never offloaded or committed
 * @param store which blob-store backend to use
 * @param s3Bucket the bucket, for {@link StoreKind#S3}
 * @param s3Region the region, for {@link StoreKind#S3} (null: SDK default chain)
 * @param localStoreDir the directory, for {@link StoreKind#LOCAL}
 */
public record Config(
        Path repoDir,
        String branch,
        String remoteRepo,
        String token,
        boolean offloadEnabled,
        long threshold,
        String containerTag,
        int maxVersions,
        int workers,
        Duration interval,
        boolean verifyHash,
        ImmutableList<String> excludes,
        StoreKind store,
        @Nullable String s3Bucket,
        @Nullable String s3Region,
        @Nullable Path localStoreDir) {

  public enum StoreKind {
    GITHUB,
    S3,
    LOCAL
  }

  /**
   * @return the HTTPS remote URL with the token embedded
   */
  public String remoteUrl() {
    return "https://x-access-token:" + token + "@github.com/" + remoteRepo + ".git";
  }

  // Keep the token out of logs and stack traces
  @Override
  public String toString() {
    return "Config{repoDir=" + repoDir +
            ", branch=" + branch +
            ", remoteRepo=" + remoteRepo +
            ", offloadEnabled=" + offloadEnabled +
            ", threshold=" + threshold +
            ", containerTag=" + containerTag +
            ", maxVersions=" + maxVersions +
            ", workers=" + workers +
            ", interval=" + interval +
            ", verifyHash=" + verifyHash +
            ", excludes=" + excludes +
            ", store=" + store +
            '}';
  }

}
