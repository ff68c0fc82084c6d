package cal.sync.types;

import java.util.Collection;

/**
 * Keeps paths permanently out of the version-controlled history, e.g. the real
 * copies of files that are represented there by pointers.
 *
 * <p>Registration is best effort: implementations log failures instead of
 * throwing, because a missed exclusion never loses data.
 */
public interface HistoryExclusions {

  /**
   * Exclude the given paths.  Registering a path that is already excluded has
   * no effect.
   *
   * @param repoRelativePaths paths relative to the repository root, with forward slashes
   */
  void register(Collection<String> repoRelativePaths);

}
