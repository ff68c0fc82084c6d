package cal.prim.time;

import java.time.Duration;

/**
 * Something that can wait.  Backoff loops take a <code>Sleeper</code> instead of
 * calling {@link Thread#sleep(long)} directly so that they can be interrupted by a
 * stop signal and so that tests can observe the requested delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Wait for (at most) the given duration.  Implementations may return early.
   *
   * @param duration how long to wait
   * @throws InterruptedException if the waiting thread is interrupted
   */
  void sleep(Duration duration) throws InterruptedException;

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

}
