package cal.sync.impls;

import cal.prim.MalformedDataException;
import cal.prim.fs.AtomicFileOutputStream;
import cal.prim.fs.DurableFiles;
import cal.prim.time.UnreliableWallClock;
import cal.sync.Util;
import cal.sync.types.FileRecord;
import cal.sync.types.FileVersion;
import cal.sync.types.ManifestContents;
import cal.sync.types.ManifestFormat;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A <code>Manifest</code> is the ledger of offloaded files.  For each
 * repository-relative path it stores a {@link FileRecord}: the hash the path's
 * pointer currently names, and the retained {@link FileVersion versions} with the
 * store asset each one lives in.
 *
 * <p>The ledger lives in memory and is written out whole by {@link #save()}.
 * Modifications are not durable until saved; callers save after each logical
 * change.
 *
 * <p>Instances of this class are thread-safe.  All modification methods are
 * atomic, and all query methods return immutable copies.  There is no protection
 * against a second process writing the same file.
 */
public class Manifest {

  private static final Logger logger = LoggerFactory.getLogger(Manifest.class);

  public static final String DIRECTORY = ".lfs";
  public static final String FILE_NAME = "manifest.json";

  private final Path location;
  private final ManifestFormat format;
  private final UnreliableWallClock clock;
  private final String containerTag;
  private final Map<String, FileRecord> files;

  Manifest(Path location, ManifestFormat format, UnreliableWallClock clock, ManifestContents contents) {
    this.location = location;
    this.format = format;
    this.clock = clock;
    this.containerTag = contents.containerTag();
    this.files = new LinkedHashMap<>(contents.files());
  }

  /**
   * Load the manifest of a repository.  A missing file gives an empty manifest.
   * So does a file that cannot be read or parsed: the error is logged and
   * startup continues, since refusing to run would also stop every restore.
   *
   * @param repoDir the repository root
   * @param containerTag the container tag to use if the file does not name one
   * @param format the on-disk format
   * @param clock the source of version timestamps
   * @return the manifest
   */
  public static Manifest load(Path repoDir, String containerTag, ManifestFormat format, UnreliableWallClock clock) {
    Path location = repoDir.resolve(DIRECTORY).resolve(FILE_NAME);
    ManifestContents empty = new ManifestContents(containerTag, null, ImmutableMap.of());
    ManifestContents contents;
    try (InputStream in = Util.buffered(Files.newInputStream(location))) {
      contents = format.load(in);
      logger.info("Loaded manifest: {} files", contents.files().size());
    } catch (NoSuchFileException e) {
      contents = empty;
    } catch (IOException | MalformedDataException e) {
      logger.error("Failed to load manifest {}; starting with an empty one", location, e);
      contents = empty;
    }
    return new Manifest(location, format, clock, contents);
  }

  public Path location() {
    return location;
  }

  public String containerTag() {
    return containerTag;
  }

  /**
   * Write the manifest, replacing the previous file atomically and durably.
   * After a crash the file holds either the old or the new contents.
   *
   * @throws IOException if the file could not be written
   */
  public synchronized void save() throws IOException {
    Path dir = location.toAbsolutePath().getParent();
    if (dir != null) {
      DurableFiles.createDirectories(dir);
    }
    try (AtomicFileOutputStream file = new AtomicFileOutputStream(location)) {
      OutputStream out = new BufferedOutputStream(file);
      format.serialize(snapshot(), clock.now().truncatedTo(ChronoUnit.SECONDS), out);
      out.flush();
      file.commit();
    }
  }

  public synchronized ManifestContents snapshot() {
    return new ManifestContents(containerTag, null, ImmutableMap.copyOf(files));
  }

  public synchronized @Nullable FileRecord getFileRecord(String path) {
    return files.get(path);
  }

  public synchronized List<String> listAllFiles() {
    return ImmutableList.copyOf(files.keySet());
  }

  /**
   * Record a version of a path.  If the path already has a version with this
   * hash, no version is added.
   *
   * @param path repository-relative path
   * @param hash content hash
   * @param assetName the stored asset
   * @param size content length
   * @param setCurrent whether the path's current hash should become <code>hash</code>
   * @return true if the record changed
   */
  public synchronized boolean addVersion(String path, String hash, String assetName, long size, boolean setCurrent) {
    FileVersion version = new FileVersion(hash, assetName, size, clock.now().truncatedTo(ChronoUnit.SECONDS), true);
    FileRecord existing = files.get(path);
    if (existing == null) {
      files.put(path, new FileRecord(hash, ImmutableList.of(version)));
      logger.info("Added version for {}: {}", path, abbreviate(hash));
      return true;
    }

    boolean known = existing.versions().stream().anyMatch(v -> v.hash().equals(hash));
    ImmutableList<FileVersion> versions = known ?
            existing.versions() :
            ImmutableList.<FileVersion>builder().addAll(existing.versions()).add(version).build();
    String current = setCurrent ? hash : existing.currentHash();
    if (known && current.equals(existing.currentHash())) {
      return false;
    }
    files.put(path, new FileRecord(current, versions));
    if (!known) {
      logger.info("Added version for {}: {}", path, abbreviate(hash));
    }
    return true;
  }

  private static String abbreviate(String hash) {
    return hash.length() > 16 ? hash.substring(0, 16) + "..." : hash;
  }

  /**
   * The version a path's pointer should name: the one matching the current hash.
   * If retention has evicted that version, the most recently recorded version is
   * returned instead.  That fallback is a guess, so it is logged.
   *
   * @param path repository-relative path
   * @return the version, or null if the path has none
   */
  public synchronized @Nullable FileVersion getCurrentVersion(String path) {
    FileRecord record = files.get(path);
    if (record == null || record.versions().isEmpty()) {
      return null;
    }
    for (FileVersion v : record.versions()) {
      if (v.hash().equals(record.currentHash())) {
        return v;
      }
    }
    FileVersion newest = record.versions().get(record.versions().size() - 1);
    logger.warn("Current hash {} of {} has no recorded version; using newest version {}",
            abbreviate(record.currentHash()), path, newest.assetName());
    return newest;
  }

  /**
   * @param path repository-relative path
   * @return the path's versions, newest first; versions with equal timestamps are
   *   ordered by when they were recorded, later first
   */
  public synchronized List<FileVersion> getAllVersions(String path) {
    FileRecord record = files.get(path);
    if (record == null) {
      return ImmutableList.of();
    }
    return newestFirst(record.versions());
  }

  private static List<FileVersion> newestFirst(List<FileVersion> versions) {
    List<FileVersion> result = new ArrayList<>(versions);
    Collections.reverse(result);
    // stable sort, so the reversal breaks timestamp ties
    result.sort(Comparator.comparing(FileVersion::timestamp).reversed());
    return ImmutableList.copyOf(result);
  }

  /**
   * Retention: keep the <code>keep</code> newest versions of a path and drop the rest.
   * The caller deletes the returned assets from the store and then saves.
   *
   * @param path repository-relative path
   * @param keep how many versions to retain (at least 1)
   * @return asset names of evicted versions that no retained version, of this or
   *   any other path, still uses
   */
  public synchronized List<String> cleanupOldVersions(String path, int keep) {
    if (keep < 1) {
      throw new IllegalArgumentException("must keep at least one version, not " + keep);
    }
    FileRecord record = files.get(path);
    if (record == null || record.versions().size() <= keep) {
      return ImmutableList.of();
    }
    List<FileVersion> sorted = newestFirst(record.versions());
    Set<FileVersion> retained = new HashSet<>(sorted.subList(0, keep));
    List<FileVersion> evicted = sorted.subList(keep, sorted.size());

    ImmutableList<FileVersion> remaining = record.versions().stream()
            .filter(retained::contains)
            .collect(ImmutableList.toImmutableList());
    files.put(path, new FileRecord(record.currentHash(), remaining));

    List<String> removed = unreferenced(evicted);
    logger.info("Cleaned up {} old versions of {}", evicted.size(), path);
    return removed;
  }

  /**
   * Apply {@link #cleanupOldVersions(String, int)} to every path.
   *
   * @return evicted asset names by path; paths with nothing evicted are omitted
   */
  public synchronized Map<String, List<String>> cleanupAllOldVersions(int keep) {
    Map<String, List<String>> result = new LinkedHashMap<>();
    for (String path : listAllFiles()) {
      List<String> removed = cleanupOldVersions(path, keep);
      if (!removed.isEmpty()) {
        result.put(path, removed);
      }
    }
    return result;
  }

  /**
   * Forget a path entirely.
   *
   * @param path repository-relative path
   * @return the asset names of its versions that no other path still uses
   */
  public synchronized List<String> removeFile(String path) {
    FileRecord record = files.remove(path);
    if (record == null) {
      return ImmutableList.of();
    }
    logger.info("Removed {} from manifest", path);
    return unreferenced(record.versions());
  }

  private List<String> unreferenced(List<FileVersion> dropped) {
    Set<String> stillUsed = new HashSet<>();
    for (FileRecord r : files.values()) {
      for (FileVersion v : r.versions()) {
        stillUsed.add(v.assetName());
      }
    }
    List<String> result = new ArrayList<>();
    for (FileVersion v : dropped) {
      if (!stillUsed.contains(v.assetName()) && !result.contains(v.assetName())) {
        result.add(v.assetName());
      }
    }
    return ImmutableList.copyOf(result);
  }

}
