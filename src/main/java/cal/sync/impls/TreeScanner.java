package cal.sync.impls;

import cal.prim.fs.AtomicFileOutputStream;
import cal.sync.Util;
import cal.sync.types.PointerFile;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Finds pointer files and offload candidates in the working copy.  Symbolic
 * links are never followed.  Results are sorted by path.
 */
public class TreeScanner {

  private static final Logger logger = LoggerFactory.getLogger(TreeScanner.class);

  private static final Set<String> SKIPPED_FOR_POINTERS = Set.of(".git");
  private static final Set<String> SKIPPED_FOR_OFFLOAD = Set.of(".git", Manifest.DIRECTORY);

  private final PointerCodec codec;

  public TreeScanner(PointerCodec codec) {
    this.codec = codec;
  }

  /**
   * @param root the directory to scan
   * @return every pointer file under <code>root</code>, outside <code>.git</code>
   */
  public List<Path> scanPointerFiles(Path root) throws IOException {
    List<Path> result = new ArrayList<>();
    walk(root, SKIPPED_FOR_POINTERS, (file, attrs) -> {
      if (!isLeftover(file) && codec.isPointer(file)) {
        result.add(file);
      }
    });
    result.sort(null);
    return ImmutableList.copyOf(result);
  }

  /**
   * Find files that should be offloaded: regular files strictly larger than
   * <code>threshold</code> bytes, excluding pointer files, temporary files left
   * by an interrupted restore or atomic write, anything under <code>.git</code>
   * or <code>.lfs</code>, and any path equal to or under one of the
   * <code>excludes</code> prefixes.
   *
   * @param root the repository root
   * @param threshold size limit in bytes
   * @param excludes repository-relative path prefixes
   * @return the candidates
   */
  public List<Path> scanLargeFiles(Path root, long threshold, Collection<String> excludes) throws IOException {
    List<Path> result = new ArrayList<>();
    walk(root, SKIPPED_FOR_OFFLOAD, (file, attrs) -> {
      if (attrs.size() > threshold
              && !file.getFileName().toString().endsWith(PointerFile.SUFFIX)
              && !isLeftover(file)
              && !isExcluded(Util.relativePath(root, file), excludes)) {
        result.add(file);
      }
    });
    result.sort(null);
    return ImmutableList.copyOf(result);
  }

  /**
   * Prefix matching on whole path segments: <code>a/b</code> excludes
   * <code>a/b</code> and <code>a/b/c</code> but not <code>a/bc</code>.
   */
  public static boolean isExcluded(String repoRelativePath, Collection<String> excludes) {
    String rel = trimSlashes(repoRelativePath);
    for (String ex : excludes) {
      String prefix = trimSlashes(ex);
      if (prefix.isEmpty()) {
        continue;
      }
      if (rel.equals(prefix) || rel.startsWith(prefix + '/')) {
        return true;
      }
    }
    return false;
  }

  private static boolean isLeftover(Path file) {
    return RestoreEngine.isTemporary(file) || AtomicFileOutputStream.isTemporary(file);
  }

  private static String trimSlashes(String s) {
    String result = s.startsWith("./") ? s.substring(2) : s;
    int start = 0;
    int end = result.length();
    while (start < end && result.charAt(start) == '/') ++start;
    while (end > start && result.charAt(end - 1) == '/') --end;
    return result.substring(start, end);
  }

  private interface FileCallback {
    void onFile(Path file, BasicFileAttributes attrs) throws IOException;
  }

  private static void walk(Path root, Set<String> skippedDirectories, FileCallback onFile) throws IOException {
    Files.walkFileTree(root, new FileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        Path name = dir.getFileName();
        return !dir.equals(root) && name != null && skippedDirectories.contains(name.toString()) ?
                FileVisitResult.SKIP_SUBTREE :
                FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        if (attrs.isRegularFile()) {
          onFile.onFile(file, attrs);
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) {
        logger.warn("Failed to visit {}: {}", file, exc.toString());
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
        return FileVisitResult.CONTINUE;
      }
    });
  }

}
