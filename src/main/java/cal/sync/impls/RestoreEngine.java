package cal.sync.impls;

import cal.prim.MalformedDataException;
import cal.prim.fs.DurableFiles;
import cal.prim.storage.Asset;
import cal.prim.storage.BlobStore;
import cal.prim.storage.Container;
import cal.prim.storage.TransferListener;
import cal.prim.time.UnreliableWallClock;
import cal.sync.Util;
import cal.sync.types.FileVersion;
import cal.sync.types.HistoryExclusions;
import cal.sync.types.PointerFile;
import cal.sync.types.Sha256AndSize;
import com.google.common.util.concurrent.Striped;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;

/**
 * Rebuilds real files from pointers.  The content is downloaded to a hidden
 * file next to the pointer, checked, synced, and then renamed into place, so a
 * failed restore never leaves a partial file at the real path.
 *
 * <p>If the asset a pointer names is gone from the store, the manifest's other
 * versions of the same path are tried, newest first.  The restored file is then
 * checked against the version actually downloaded.
 */
public class RestoreEngine {

  private static final Logger logger = LoggerFactory.getLogger(RestoreEngine.class);

  static final String TEMP_SUFFIX = ".restoring";
  private static final int LOCK_STRIPES = 64;

  public interface ProgressCallback {
    void onProgress(int completed, int total);
  }

  private final Path repoDir;
  private final BlobStore store;
  private final Manifest manifest;
  private final PointerCodec codec;
  private final TreeScanner scanner;
  private final HistoryExclusions exclusions;
  private final UnreliableWallClock clock;
  private final int workers;

  // restores of one real path are serialized, so concurrent restores of a file download it at most once
  private final Striped<Lock> destinationLocks = Striped.lock(LOCK_STRIPES);

  public RestoreEngine(
          Path repoDir,
          BlobStore store,
          Manifest manifest,
          PointerCodec codec,
          HistoryExclusions exclusions,
          UnreliableWallClock clock,
          int workers) {
    this.repoDir = repoDir;
    this.store = store;
    this.manifest = manifest;
    this.codec = codec;
    this.scanner = new TreeScanner(codec);
    this.exclusions = exclusions;
    this.clock = clock;
    this.workers = workers;
  }

  /**
   * Restore the file a pointer stands for.  Failures are logged and reported as
   * <code>false</code>.
   *
   * @param pointerPath the pointer file
   * @param verifyHash whether to check the downloaded content against the hash
   * @return true if the real file now holds the pointer's content
   */
  public boolean restore(Path pointerPath, boolean verifyHash) {
    return restore(pointerPath, verifyHash, TransferListener.NONE);
  }

  private boolean restore(Path pointerPath, boolean verifyHash, TransferListener listener) {
    final PointerFile pointer;
    try {
      pointer = codec.read(pointerPath);
      PointerCodec.validate(pointer);
    } catch (MalformedDataException e) {
      logger.warn("Invalid pointer {}: {}", pointerPath, e.getMessage());
      return false;
    } catch (IOException e) {
      logger.warn("Cannot read pointer {}", pointerPath, e);
      return false;
    }

    Path realPath = PointerCodec.realPath(pointerPath);
    Lock lock = destinationLocks.get(realPath.toAbsolutePath().normalize());
    lock.lock();
    try {
      return restoreLocked(pointerPath, realPath, pointer, verifyHash, listener);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Where the content for <code>pointerPath</code> is downloaded before it is
   * checked and moved into place: a hidden sibling of the pointer.
   */
  static Path tempPath(Path pointerPath) {
    return pointerPath.resolveSibling("." + pointerPath.getFileName() + TEMP_SUFFIX);
  }

  /**
   * @return true if <code>file</code> is a download left behind by an
   *   interrupted restore
   */
  public static boolean isTemporary(Path file) {
    Path name = file.getFileName();
    return name != null && name.toString().startsWith(".") && name.toString().endsWith(TEMP_SUFFIX);
  }

  private boolean restoreLocked(Path pointerPath, Path realPath, PointerFile pointer, boolean verifyHash, TransferListener listener) {
    String rel = Util.relativePath(repoDir, realPath);
    Path temp = tempPath(pointerPath);
    try {
      if (!realPath.equals(pointerPath) && hasContent(realPath, pointer.hash())) {
        logger.debug("{} already up to date", rel);
        exclusions.register(List.of(rel));
        return true;
      }

      Container container = store.findContainer(pointer.containerTag());
      if (container == null) {
        logger.error("Container {} not found; cannot restore {}", pointer.containerTag(), rel);
        return false;
      }

      String expectedHash = pointer.hash();
      Asset asset = store.findAsset(container, pointer.assetName());
      if (asset == null) {
        FileVersion fallback = findFallback(container, rel, pointer.assetName());
        if (fallback == null) {
          logger.error("Asset {} not found and no other version of {} is stored", pointer.assetName(), rel);
          return false;
        }
        logger.warn("Asset {} not found; restoring {} from older version {}", pointer.assetName(), rel, fallback.assetName());
        asset = store.findAsset(container, fallback.assetName());
        expectedHash = fallback.hash();
        if (asset == null) {
          return false;
        }
      }

      store.download(asset, temp, listener);

      if (verifyHash) {
        Sha256AndSize actual = Util.summarize(temp);
        if (!actual.matches(expectedHash)) {
          logger.error("Hash mismatch for {}: expected {}, got {}", rel, expectedHash, actual.hashString());
          Files.deleteIfExists(temp);
          return false;
        }
      }

      // another process may have produced the file while we were downloading
      if (!realPath.equals(pointerPath) && hasContent(realPath, expectedHash)) {
        Files.deleteIfExists(temp);
        exclusions.register(List.of(rel));
        return true;
      }

      DurableFiles.replace(temp, realPath);
      if (!realPath.equals(pointerPath)) {
        exclusions.register(List.of(rel));
      }
      logger.info("Restored {} ({})", rel, Util.formatSize(asset.size()));
      return true;
    } catch (IOException | RuntimeException e) {
      logger.error("Failed to restore {}", rel, e);
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
        logger.warn("Could not remove {}", temp, cleanup);
      }
      return false;
    }
  }

  private @Nullable FileVersion findFallback(Container container, String rel, String missingAsset) throws IOException {
    for (FileVersion v : manifest.getAllVersions(rel)) {
      if (!v.assetName().equals(missingAsset) && store.findAsset(container, v.assetName()) != null) {
        return v;
      }
    }
    return null;
  }

  private static boolean hasContent(Path file, String hash) throws IOException {
    return Files.isRegularFile(file) && Util.summarize(file).matches(hash);
  }

  /**
   * Restore every pointer under <code>root</code> on the worker pool.
   *
   * @param root where to look for pointers
   * @param verifyHash whether to check downloaded content
   * @param progress told after each pointer finishes
   * @return success per pointer
   * @throws IOException if the tree cannot be scanned
   */
  public Map<Path, Boolean> restoreAll(Path root, boolean verifyHash, ProgressCallback progress) throws IOException, InterruptedException {
    return restoreEach(scanner.scanPointerFiles(root), verifyHash, progress);
  }

  /**
   * Restore only the pointers whose real file is missing.  Content is not
   * re-verified; this is the cheap catch-up run of the periodic cycle.
   *
   * @return success per restored pointer
   */
  public Map<Path, Boolean> restoreMissing(Path root) throws IOException, InterruptedException {
    List<Path> missing = scanner.scanPointerFiles(root).stream()
            .filter(p -> !PointerCodec.realPath(p).equals(p) && !Files.exists(PointerCodec.realPath(p)))
            .collect(Collectors.toList());
    if (!missing.isEmpty()) {
      logger.info("Restoring {} missing files", missing.size());
    }
    return restoreEach(missing, false, (completed, total) -> { });
  }

  private Map<Path, Boolean> restoreEach(List<Path> pointers, boolean verifyHash, ProgressCallback progress) throws InterruptedException {
    if (pointers.isEmpty()) {
      return Map.of();
    }
    try (ProgressDisplay display = new ProgressDisplay(pointers.size(), clock)) {
      Map<Path, Boolean> results = Batches.run(pointers, workers, "restore", pointer -> {
        ProgressDisplay.Task task = display.startTask("restore " + Util.relativePath(repoDir, PointerCodec.realPath(pointer)));
        boolean ok = restore(pointer, verifyHash, task);
        if (ok) {
          display.finishTask(task);
        } else {
          display.failTask(task, "see log");
        }
        return ok;
      }, progress::onProgress);
      long succeeded = results.values().stream().filter(b -> b).count();
      logger.info("Restored {}/{} files", succeeded, results.size());
      return results;
    }
  }

}
