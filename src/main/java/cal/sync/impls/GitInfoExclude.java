package cal.sync.impls;

import cal.prim.fs.DurableFiles;
import cal.sync.types.HistoryExclusions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link HistoryExclusions} via the repository's <code>.git/info/exclude</code>
 * file, which git treats like an untracked <code>.gitignore</code>.
 */
public class GitInfoExclude implements HistoryExclusions {

  private static final Logger logger = LoggerFactory.getLogger(GitInfoExclude.class);

  private final Path excludeFile;

  public GitInfoExclude(Path repoDir) {
    this.excludeFile = repoDir.resolve(".git").resolve("info").resolve("exclude");
  }

  @Override
  public synchronized void register(Collection<String> repoRelativePaths) {
    try {
      DurableFiles.createDirectories(excludeFile.getParent());
      List<String> lines = new ArrayList<>();
      if (Files.exists(excludeFile)) {
        lines.addAll(Files.readAllLines(excludeFile, StandardCharsets.UTF_8));
      }
      Set<String> existing = new HashSet<>(lines);
      int added = 0;
      for (String path : repoRelativePaths) {
        String entry = path.strip();
        if (!entry.isEmpty() && existing.add(entry)) {
          lines.add(entry);
          ++added;
        }
      }
      if (added > 0) {
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
          content.append(line).append('\n');
        }
        DurableFiles.write(excludeFile, content.toString().getBytes(StandardCharsets.UTF_8));
        logger.info("Added {} entries to {}", added, excludeFile);
      }
    } catch (IOException e) {
      logger.warn("Failed to update {}", excludeFile, e);
    }
  }

}
