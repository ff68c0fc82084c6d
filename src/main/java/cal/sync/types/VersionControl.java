package cal.sync.types;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;

/**
 * The version-control tool behind the mirrored history, seen as a black box.
 * An instance is bound to one working copy, one remote and one branch.
 *
 * <p>Every method may fail with an {@link IOException}; callers decide whether
 * a failure is fatal.
 */
public interface VersionControl {

  /**
   * Create the working copy if it does not exist yet, on the configured branch.
   */
  void ensureRepository() throws IOException;

  /**
   * Point the remote at the given URL, adding it if necessary.
   */
  void setRemote(String url) throws IOException;

  /**
   * @return true if the remote has no branches at all
   */
  boolean remoteIsEmpty() throws IOException;

  /**
   * Give a fresh repository its first commit so that it has something to push.
   * Does nothing if HEAD already exists.
   */
  void createInitialCommitIfNeeded() throws IOException;

  /**
   * Fetch the remote branch and move the local branch (and working copy) onto it.
   */
  void fetchAndReset() throws IOException;

  /**
   * Pull the remote branch, rebasing local commits on top of it.
   */
  void pullRebase() throws IOException;

  /**
   * Stage everything and commit if anything changed.
   *
   * @param message the commit message
   * @return true if a commit was made
   */
  boolean commitAllIfDirty(String message) throws IOException;

  void push() throws IOException;

  /**
   * @return the commit id of local HEAD, or null if there is none yet
   */
  @Nullable String headCommit() throws IOException;

  /**
   * @return the commit id of the remote-tracking branch, or null if there is none yet
   */
  @Nullable String remoteHeadCommit() throws IOException;

  /**
   * @param repoRelativePath a path relative to the working-copy root
   * @return true if the index tracks the path
   */
  boolean isTracked(String repoRelativePath) throws IOException;

  /**
   * Remove a path from the index, leaving the working-copy file alone.
   */
  void unstage(String repoRelativePath) throws IOException;

}
