package cal.sync.impls;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Predicate;

/**
 * Runs a per-file job over a list of files on a bounded worker pool.  Each job
 * reports success as a boolean; one job failing (even by throwing) never affects
 * the others.
 */
abstract class Batches {

  private static final Logger logger = LoggerFactory.getLogger(Batches.class);

  interface ProgressCallback {
    void onProgress(int completed, int total);
  }

  /**
   * @param files the inputs
   * @param workers pool width
   * @param threadNamePrefix used to name the worker threads
   * @param job the per-file job
   * @param progress called after each job completes, on the calling thread
   * @return success per file, in input order
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  static Map<Path, Boolean> run(List<Path> files, int workers, String threadNamePrefix, Predicate<Path> job, ProgressCallback progress) throws InterruptedException {
    Map<Path, Boolean> results = new LinkedHashMap<>();
    for (Path p : files) {
      results.put(p, false);
    }
    if (files.isEmpty()) {
      return results;
    }

    ExecutorService executor = Executors.newFixedThreadPool(
            Math.max(1, Math.min(workers, files.size())),
            new ThreadFactoryBuilder().setNameFormat(threadNamePrefix + "-%d").setDaemon(true).build());
    try {
      CompletionService<Boolean> completion = new ExecutorCompletionService<>(executor);
      Map<Future<Boolean>, Path> inFlight = new LinkedHashMap<>();
      for (Path p : files) {
        inFlight.put(completion.submit(() -> job.test(p)), p);
      }
      for (int completed = 1; completed <= files.size(); ++completed) {
        Future<Boolean> done = completion.take();
        Path p = inFlight.get(done);
        boolean ok;
        try {
          ok = done.get();
        } catch (ExecutionException e) {
          logger.error("Unexpected failure processing {}", p, e.getCause());
          ok = false;
        }
        results.put(p, ok);
        progress.onProgress(completed, files.size());
      }
    } finally {
      executor.shutdownNow();
    }
    return Collections.unmodifiableMap(results);
  }

}
