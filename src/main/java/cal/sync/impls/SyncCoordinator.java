package cal.sync.impls;

import cal.prim.concurrency.StopSignal;
import cal.prim.time.Sleeper;
import cal.sync.Util;
import cal.sync.types.Config;
import cal.sync.types.HistoryExclusions;
import cal.sync.types.LinkingStep;
import cal.sync.types.SyncState;
import cal.sync.types.VersionControl;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the mirror through its lifecycle:
 * <ol>
 *   <li>ALIGNING: set up the working copy and retry every {@link #ALIGN_RETRY_DELAY}
 *     until local HEAD equals the remote-tracking HEAD</li>
 *   <li>LINKING: run the {@link LinkingStep} once and commit what it produced</li>
 *   <li>RESTORING: restore every pointer in the tree</li>
 *   <li>STEADY: run {@link #runCycle()} every {@link Config#interval()}</li>
 * </ol>
 *
 * <p>All repository and manifest mutations happen under one mutex, so a cycle
 * started by {@link #syncNow()} never overlaps a periodic one.
 */
public class SyncCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(SyncCoordinator.class);

  static final Duration ALIGN_RETRY_DELAY = Duration.ofSeconds(3);
  static final String LINK_COMMIT_MESSAGE = "chore(sync): initial link & empty dirs";
  static final String PERIODIC_COMMIT_MESSAGE = "chore(sync): periodic commit";

  private final Config config;
  private final VersionControl vcs;
  private final HistoryExclusions exclusions;
  private final @Nullable OffloadEngine offloadEngine;
  private final @Nullable RestoreEngine restoreEngine;
  private final LinkingStep linkingStep;
  private final SyncStatusFile status;
  private final StopSignal stopSignal;
  private final Sleeper sleeper;
  private final ReentrantLock mutex = new ReentrantLock();
  private volatile SyncState state = SyncState.UNINITIALIZED;

  /**
   * @param offloadEngine null if no blob store is available
   * @param restoreEngine null if no blob store is available
   * @param sleeper used for every wait; normally the stop signal itself, so that
   *   {@link #stop()} cuts waits short
   */
  public SyncCoordinator(
          Config config,
          VersionControl vcs,
          HistoryExclusions exclusions,
          @Nullable OffloadEngine offloadEngine,
          @Nullable RestoreEngine restoreEngine,
          LinkingStep linkingStep,
          SyncStatusFile status,
          StopSignal stopSignal,
          Sleeper sleeper) {
    this.config = config;
    this.vcs = vcs;
    this.exclusions = exclusions;
    this.offloadEngine = offloadEngine;
    this.restoreEngine = restoreEngine;
    this.linkingStep = linkingStep;
    this.status = status;
    this.stopSignal = stopSignal;
    this.sleeper = sleeper;
  }

  public SyncState state() {
    return state;
  }

  private boolean offloadCapable() {
    return config.offloadEnabled() && offloadEngine != null && restoreEngine != null;
  }

  /**
   * Bring the mirror up: align, link, restore.
   *
   * @return false if the stop signal arrived before alignment finished
   * @throws IOException if the working copy cannot be set up at all
   */
  public boolean initialize() throws IOException, InterruptedException {
    status.write(SyncStatusFile.Stage.STARTING, 0);

    state = SyncState.ALIGNING;
    status.write(SyncStatusFile.Stage.GIT, 10);
    if (!align()) {
      state = SyncState.STOPPED;
      return false;
    }
    status.write(SyncStatusFile.Stage.GIT, 25);

    state = SyncState.LINKING;
    status.write(SyncStatusFile.Stage.LINKING, 30);
    link();
    status.write(SyncStatusFile.Stage.LINKING, 50);

    state = SyncState.RESTORING;
    restoreAll();

    status.markComplete();
    state = SyncState.STEADY;
    return true;
  }

  /**
   * Prepare the working copy, then retry until HEAD matches the remote.  HEAD
   * equality is the only thing that ends this loop.
   */
  boolean align() throws IOException, InterruptedException {
    vcs.ensureRepository();
    exclusions.register(config.excludes());
    vcs.setRemote(config.remoteUrl());

    while (!stopSignal.isStopped()) {
      try {
        if (vcs.remoteIsEmpty()) {
          logger.info("Remote is empty; creating an initial commit");
          vcs.createInitialCommitIfNeeded();
          vcs.push();
        } else {
          vcs.fetchAndReset();
        }
        if (headMatchesRemote()) {
          logger.info("Local HEAD is aligned with the remote");
          return true;
        }
        logger.info("HEAD not yet aligned with the remote; retrying");
      } catch (IOException e) {
        logger.error("Alignment attempt failed: {}", Util.maskCredentials(String.valueOf(e.getMessage())));
      }
      sleeper.sleep(ALIGN_RETRY_DELAY);
    }
    return false;
  }

  private boolean headMatchesRemote() throws IOException {
    String local = vcs.headCommit();
    return local != null && !local.isEmpty() && local.equals(vcs.remoteHeadCommit());
  }

  private void link() {
    try {
      linkingStep.link();
    } catch (IOException e) {
      logger.error("Linking step failed", e);
    }
    mutex.lock();
    try {
      if (vcs.commitAllIfDirty(LINK_COMMIT_MESSAGE)) {
        vcs.push();
      }
    } catch (IOException e) {
      logger.warn("Initial commit/push failed; the next cycle will retry: {}", Util.maskCredentials(String.valueOf(e.getMessage())));
    } finally {
      mutex.unlock();
    }
  }

  private void restoreAll() throws InterruptedException {
    if (!offloadCapable()) {
      logger.info("Large-file offload disabled; skipping restore");
      return;
    }
    RestoreEngine restore = Objects.requireNonNull(restoreEngine);
    status.writeRestoreProgress(0, 0);
    try {
      Map<?, Boolean> results = restore.restoreAll(config.repoDir(), config.verifyHash(), status::writeRestoreProgress);
      if (results.isEmpty()) {
        logger.info("No pointers to restore");
      }
    } catch (IOException e) {
      logger.error("Restore pass failed", e);
    }
    status.write(SyncStatusFile.Stage.LFS_DOWNLOAD, 95);
  }

  /**
   * One sync cycle: pull, restore files the pull removed, offload new large
   * files, apply retention, commit, push.  Each step's failure is logged and the
   * cycle continues; a failed push is retried by the next cycle.
   */
  public void runCycle() throws InterruptedException {
    mutex.lock();
    try {
      try {
        vcs.pullRebase();
      } catch (IOException e) {
        logger.warn("Pull failed: {}", Util.maskCredentials(String.valueOf(e.getMessage())));
      }

      if (offloadCapable()) {
        OffloadEngine offload = Objects.requireNonNull(offloadEngine);
        RestoreEngine restore = Objects.requireNonNull(restoreEngine);

        // must precede the offload scan: the pull may have removed real files
        try {
          restore.restoreMissing(config.repoDir());
        } catch (IOException e) {
          logger.error("Failed to restore files removed by pull", e);
        }

        try {
          offload.offloadLargeFiles(config.threshold(), config.excludes());
          int deleted = offload.cleanupOldVersions(config.maxVersions());
          if (deleted > 0) {
            logger.info("Deleted {} old assets", deleted);
          }
        } catch (IOException e) {
          logger.error("Failed to process large files", e);
        }
      }

      boolean committed = false;
      try {
        committed = vcs.commitAllIfDirty(PERIODIC_COMMIT_MESSAGE);
      } catch (IOException e) {
        logger.error("Commit failed", e);
      }

      try {
        vcs.push();
        if (committed) {
          logger.info("Committed and pushed changes");
        }
      } catch (IOException e) {
        logger.warn("Push failed; will retry next cycle: {}", Util.maskCredentials(String.valueOf(e.getMessage())));
      }
    } finally {
      mutex.unlock();
    }
  }

  /**
   * Run a cycle right now, waiting for any cycle in progress to finish first.
   */
  public void syncNow() throws InterruptedException {
    logger.info("Sync requested");
    runCycle();
  }

  /**
   * Initialize, then cycle until stopped.
   */
  public void run() throws IOException, InterruptedException {
    logger.info("Starting sync for {}", config);
    try {
      if (!initialize()) {
        return;
      }
      logger.info("Entering periodic sync loop (every {}s)", config.interval().getSeconds());
      while (!stopSignal.isStopped()) {
        runCycle();
        sleeper.sleep(config.interval());
      }
    } finally {
      state = SyncState.STOPPED;
      logger.info("Sync stopped");
    }
  }

  public void stop() {
    stopSignal.stop();
  }

}
