package cal.sync.impls;

import cal.prim.QuietAutoCloseable;
import cal.prim.storage.TransferListener;
import cal.prim.time.UnreliableWallClock;
import cal.sync.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Logs the progress of a batch of transfers: one line per finished or skipped
 * task (prefixed by the batch percentage), plus throttled byte-level progress for
 * tasks still running.
 */
public class ProgressDisplay implements QuietAutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ProgressDisplay.class);

  static final Duration REFRESH_INTERVAL = Duration.ofSeconds(30);

  public class Task implements TransferListener {
    private final String description;
    private long progress;
    private long denominator;
    private Instant lastReport;

    private Task(String description) {
      this.description = description;
      this.progress = 0L;
      this.denominator = 1L;
      this.lastReport = Instant.MIN;
    }

    @Override
    public void onProgress(long transferred, long total) {
      reportProgress(this, transferred, total);
    }
  }

  private final long totalTasks;
  private final UnreliableWallClock clock;
  private final List<Task> tasks;
  private long totalComplete;

  public ProgressDisplay(long totalTasks, UnreliableWallClock clock) {
    this.totalTasks = totalTasks;
    this.clock = clock;
    this.tasks = new ArrayList<>();
    this.totalComplete = 0L;
  }

  static String formatPercent(long numerator, long denominator) {
    if (numerator < 0) {
      throw new IllegalArgumentException("negative numerator: " + numerator);
    }
    if (denominator < 0) {
      throw new IllegalArgumentException("negative denominator: " + denominator);
    }
    if (denominator == 0 || numerator >= denominator) {
      return "100%";
    }
    return String.format("%3d", numerator * 100 / denominator) + '%';
  }

  public synchronized Task startTask(String description) {
    Task t = new Task(description);
    tasks.add(t);
    logger.debug("[{}] started {}", formatPercent(totalComplete, totalTasks), description);
    return t;
  }

  public synchronized void reportProgress(Task task, long progress, long denominator) {
    task.progress = progress;
    task.denominator = denominator;
    Instant now = clock.now();
    if (Duration.between(task.lastReport, now).compareTo(REFRESH_INTERVAL) >= 0) {
      task.lastReport = now;
      logger.info("[{}/{}] {} ({} of {})",
              formatPercent(totalComplete, totalTasks),
              formatPercent(progress, Math.max(denominator, 0)),
              task.description,
              Util.formatSize(progress),
              denominator >= 0 ? Util.formatSize(denominator) : "?");
    }
  }

  public synchronized void finishTask(Task task) {
    if (!tasks.remove(task)) {
      throw new IllegalArgumentException("unknown task " + task.description);
    }
    ++totalComplete;
    logger.info("[{}] {}", formatPercent(totalComplete, totalTasks), task.description);
  }

  public synchronized void failTask(Task task, String why) {
    if (!tasks.remove(task)) {
      throw new IllegalArgumentException("unknown task " + task.description);
    }
    ++totalComplete;
    logger.warn("[{}] failed: {} ({})", formatPercent(totalComplete, totalTasks), task.description, why);
  }

  public synchronized void skipTask(String taskDescription, String why) {
    ++totalComplete;
    logger.info("[{}] skipped: {} ({})", formatPercent(totalComplete, totalTasks), taskDescription, why);
  }

  public synchronized long completed() {
    return totalComplete;
  }

  @Override
  public synchronized void close() {
    tasks.clear();
  }

}
