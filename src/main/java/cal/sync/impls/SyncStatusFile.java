package cal.sync.impls;

import cal.prim.fs.DurableFiles;
import cal.prim.time.UnreliableWallClock;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Publishes startup progress for other processes to read:
 * <code>.sync-progress.json</code> holds the current stage and a percentage, and
 * <code>.sync-complete</code> appears (holding epoch seconds) once the initial
 * sync is done.  Both are informational; failures to write them are logged and
 * otherwise ignored.
 */
public class SyncStatusFile {

  private static final Logger logger = LoggerFactory.getLogger(SyncStatusFile.class);

  public static final String PROGRESS_FILE = ".sync-progress.json";
  public static final String COMPLETE_FILE = ".sync-complete";

  public enum Stage {
    STARTING("starting"),
    GIT("git"),
    LINKING("linking"),
    LFS_DOWNLOAD("lfs_download"),
    COMPLETE("complete");

    private final String wireName;

    Stage(String wireName) {
      this.wireName = wireName;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private static class JsonProgress {
    public @Nullable String stage;
    public int progress;
    public @Nullable Integer current;
    public @Nullable Integer total;
  }

  private final Path progressFile;
  private final Path completeFile;
  private final UnreliableWallClock clock;
  private final ObjectMapper mapper;

  public SyncStatusFile(Path repoDir, UnreliableWallClock clock) {
    this.progressFile = repoDir.resolve(PROGRESS_FILE);
    this.completeFile = repoDir.resolve(COMPLETE_FILE);
    this.clock = clock;
    this.mapper = new ObjectMapper();
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
  }

  public void write(Stage stage, int percent) {
    write(stage, percent, null, null);
  }

  public void write(Stage stage, int percent, @Nullable Integer current, @Nullable Integer total) {
    JsonProgress p = new JsonProgress();
    p.stage = stage.wireName;
    p.progress = percent;
    p.current = current;
    p.total = total;
    try {
      DurableFiles.write(progressFile, mapper.writeValueAsBytes(p));
    } catch (IOException e) {
      logger.warn("Failed to write {}", progressFile, e);
    }
  }

  /**
   * Report restore progress, scaled into the 50%..95% band of the startup bar.
   */
  public void writeRestoreProgress(int completed, int total) {
    int percent = total > 0 ? 50 + (int) ((long) completed * 45 / total) : 50;
    write(Stage.LFS_DOWNLOAD, percent, completed, total);
  }

  public void markComplete() {
    try {
      DurableFiles.write(completeFile, Long.toString(clock.now().getEpochSecond()).getBytes(StandardCharsets.UTF_8));
      logger.info("Initial sync complete");
    } catch (IOException e) {
      logger.warn("Failed to write {}", completeFile, e);
    }
    write(Stage.COMPLETE, 100);
  }

}
