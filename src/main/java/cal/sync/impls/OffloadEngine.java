package cal.sync.impls;

import cal.prim.storage.Asset;
import cal.prim.storage.BlobStore;
import cal.prim.storage.Container;
import cal.prim.storage.TransferListener;
import cal.prim.time.UnreliableWallClock;
import cal.sync.Util;
import cal.sync.types.HistoryExclusions;
import cal.sync.types.PointerFile;
import cal.sync.types.Sha256AndSize;
import cal.sync.types.VersionControl;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Moves oversized files out of the history.  For each file it uploads the content
 * to the {@link BlobStore} (unless an identical asset is already there), writes a
 * pointer next to it, takes the real file out of the version-control index, and
 * records the version in the {@link Manifest}.
 *
 * <p>The real file is left where it is.  Offloading an unchanged file again
 * uploads nothing and records nothing new.
 */
public class OffloadEngine {

  private static final Logger logger = LoggerFactory.getLogger(OffloadEngine.class);

  private final Path repoDir;
  private final BlobStore store;
  private final Manifest manifest;
  private final PointerCodec codec;
  private final TreeScanner scanner;
  private final VersionControl vcs;
  private final HistoryExclusions exclusions;
  private final UnreliableWallClock clock;
  private final int workers;

  // git's index lock does not tolerate concurrent writers
  private final Object indexLock = new Object();

  public OffloadEngine(
          Path repoDir,
          BlobStore store,
          Manifest manifest,
          PointerCodec codec,
          VersionControl vcs,
          HistoryExclusions exclusions,
          UnreliableWallClock clock,
          int workers) {
    this.repoDir = repoDir;
    this.store = store;
    this.manifest = manifest;
    this.codec = codec;
    this.scanner = new TreeScanner(codec);
    this.vcs = vcs;
    this.exclusions = exclusions;
    this.clock = clock;
    this.workers = workers;
  }

  /**
   * Offload one file.  Failures are logged and reported as <code>false</code>;
   * they never propagate.
   *
   * @param file the file to offload
   * @return true if the file is now represented by a pointer
   */
  public boolean offload(Path file) {
    return offload(file, null);
  }

  private boolean offload(Path file, ProgressDisplay.@Nullable Task task) {
    String rel = Util.relativePath(repoDir, file);
    try {
      Sha256AndSize content = Util.summarize(file);
      String filename = file.getFileName().toString();
      String requestedName = AssetNames.assetName(content, filename);
      String tag = manifest.containerTag();

      Container container = store.getOrCreateContainer(tag);
      Asset existing = store.findAsset(container, requestedName);
      Asset asset;
      if (existing != null) {
        logger.info("Asset {} already stored; skipping upload of {}", existing.name(), rel);
        asset = existing;
      } else {
        logger.info("Uploading {} ({})", rel, Util.formatSize(content.size()));
        asset = store.upload(container, requestedName, file, task != null ? task : TransferListener.NONE);
      }

      PointerFile pointer = new PointerFile(
              PointerFile.CURRENT_VERSION,
              content.hashString(),
              content.size(),
              filename,
              tag,
              asset.name());
      codec.write(PointerCodec.pointerPath(file), pointer);

      synchronized (indexLock) {
        if (vcs.isTracked(rel)) {
          vcs.unstage(rel);
          logger.info("Removed {} from the index (file kept locally)", rel);
        }
      }

      if (manifest.addVersion(rel, content.hashString(), asset.name(), content.size(), true)) {
        manifest.save();
      }
      exclusions.register(List.of(rel));
      logger.info("Offloaded {} as {}", rel, asset.name());
      return true;
    } catch (IOException | RuntimeException e) {
      logger.error("Failed to offload {}", rel, e);
      return false;
    }
  }

  /**
   * Offload several files on the worker pool.
   *
   * @return success per file
   */
  public Map<Path, Boolean> offloadAll(List<Path> files) throws InterruptedException {
    if (files.isEmpty()) {
      return Map.of();
    }
    try (ProgressDisplay display = new ProgressDisplay(files.size(), clock)) {
      Map<Path, Boolean> results = Batches.run(files, workers, "offload", file -> {
        ProgressDisplay.Task task = display.startTask("offload " + Util.relativePath(repoDir, file));
        boolean ok = offload(file, task);
        if (ok) {
          display.finishTask(task);
        } else {
          display.failTask(task, "see log");
        }
        return ok;
      }, (completed, total) -> { });
      long succeeded = results.values().stream().filter(b -> b).count();
      logger.info("Offloaded {}/{} large files", succeeded, results.size());
      return results;
    }
  }

  /**
   * Scan the repository for files larger than <code>threshold</code> and offload them.
   *
   * @param threshold size limit in bytes
   * @param excludes repository-relative path prefixes to leave alone
   * @return success per candidate file
   * @throws IOException if the tree could not be scanned
   */
  public Map<Path, Boolean> offloadLargeFiles(long threshold, Collection<String> excludes) throws IOException, InterruptedException {
    List<Path> candidates = scanner.scanLargeFiles(repoDir, threshold, excludes);
    if (!candidates.isEmpty()) {
      logger.info("Found {} files larger than {}", candidates.size(), Util.formatSize(threshold));
    }
    return offloadAll(candidates);
  }

  /**
   * Retention: drop all but the <code>keep</code> newest versions of every path,
   * delete the evicted assets from the store, and save the manifest.  A failed
   * deletion is logged and leaves the asset behind.
   *
   * @param keep versions to retain per path
   * @return the number of assets deleted
   * @throws IOException if the manifest could not be saved
   */
  public int cleanupOldVersions(int keep) throws IOException {
    Map<String, List<String>> evicted = manifest.cleanupAllOldVersions(keep);
    if (evicted.isEmpty()) {
      return 0;
    }
    AtomicInteger deleted = new AtomicInteger();
    @Nullable Container container = null;
    try {
      container = store.findContainer(manifest.containerTag());
    } catch (IOException e) {
      logger.error("Cannot reach container {}; evicted assets stay in the store", manifest.containerTag(), e);
    }
    if (container != null) {
      for (Map.Entry<String, List<String>> entry : evicted.entrySet()) {
        for (String name : entry.getValue()) {
          try {
            Asset asset = store.findAsset(container, name);
            if (asset != null) {
              store.delete(asset);
              deleted.incrementAndGet();
            }
          } catch (IOException e) {
            logger.error("Failed to delete old asset {} of {}", name, entry.getKey(), e);
          }
        }
      }
    }
    manifest.save();
    return deleted.get();
  }

  /**
   * Forget a path: remove it from the manifest and delete the assets no other
   * path uses.
   *
   * @param repoRelativePath the path to forget
   * @return the number of assets deleted
   * @throws IOException if the manifest could not be saved
   */
  public int forget(String repoRelativePath) throws IOException {
    List<String> assets = manifest.removeFile(repoRelativePath);
    int deleted = 0;
    Container container = store.findContainer(manifest.containerTag());
    if (container != null) {
      for (String name : assets) {
        Asset asset = store.findAsset(container, name);
        if (asset != null) {
          store.delete(asset);
          ++deleted;
        }
      }
    }
    manifest.save();
    return deleted;
  }

}
