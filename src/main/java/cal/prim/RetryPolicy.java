package cal.prim;

import cal.prim.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.function.Function;

/**
 * Retries an I/O action with exponential backoff.  Whether a failure is worth
 * retrying is decided by a caller-supplied classifier, so the same policy can
 * serve HTTP-backed and SDK-backed stores.
 *
 * <p>With <code>maxAttempts = 3</code> and a one-second base, a failing action is
 * tried at most three times, sleeping 1s after the first failure and 2s after the
 * second (<code>2^attempt</code> seconds, counting attempts from zero).  The final
 * failure is rethrown unchanged.
 *
 * @see #call(String, Action)
 */
public class RetryPolicy {

  private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

  public enum Verdict {
    RETRY,
    FAIL
  }

  @FunctionalInterface
  public interface Action<T> {
    T run() throws IOException;
  }

  private final int maxAttempts;
  private final Duration baseDelay;
  private final Function<? super IOException, Verdict> classifier;
  private final Sleeper sleeper;

  public RetryPolicy(int maxAttempts, Duration baseDelay, Function<? super IOException, Verdict> classifier, Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    this.baseDelay = baseDelay;
    this.classifier = classifier;
    this.sleeper = sleeper;
  }

  /**
   * The policy used by the remote blob stores: three attempts, backing off
   * 2^attempt seconds.
   */
  public static RetryPolicy exponential(Function<? super IOException, Verdict> classifier, Sleeper sleeper) {
    return new RetryPolicy(3, Duration.ofSeconds(1), classifier, sleeper);
  }

  /**
   * A policy that never retries.
   */
  public static RetryPolicy once() {
    return new RetryPolicy(1, Duration.ZERO, e -> Verdict.FAIL, d -> { });
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  Duration delayAfterAttempt(int attempt) {
    return baseDelay.multipliedBy(1L << attempt);
  }

  /**
   * Run <code>action</code>, retrying it while the classifier says so.
   *
   * @param description a short description of the action for log messages
   * @param action the action
   * @return the action's result
   * @throws IOException the last failure, if every attempt failed or the
   *   classifier rejected a failure
   * @throws InterruptedIOException if the thread is interrupted during backoff
   */
  public <T> T call(String description, Action<T> action) throws IOException {
    for (int attempt = 0; ; ++attempt) {
      try {
        return action.run();
      } catch (IOException e) {
        boolean lastAttempt = attempt + 1 >= maxAttempts;
        if (lastAttempt || classifier.apply(e) != Verdict.RETRY) {
          throw e;
        }
        Duration delay = delayAfterAttempt(attempt);
        logger.warn("{} failed (attempt {}/{}): {}; retrying in {}s",
                description, attempt + 1, maxAttempts, e.getMessage(), delay.toSeconds());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          InterruptedIOException exn = new InterruptedIOException("interrupted while retrying " + description);
          exn.addSuppressed(e);
          throw exn;
        }
      }
    }
  }

}
