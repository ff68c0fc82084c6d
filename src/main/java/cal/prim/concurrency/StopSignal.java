package cal.prim.concurrency;

import cal.prim.time.Sleeper;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A one-shot, process-wide "please stop" flag.  Once {@link #stop()} has been
 * called, every current and future {@link #sleep(Duration)} returns immediately.
 *
 * <p>The signal does not cancel work in progress; it only shortens waits.  Loops
 * are expected to check {@link #isStopped()} between units of work.
 */
public class StopSignal implements Sleeper {

  private final CountDownLatch latch = new CountDownLatch(1);

  public void stop() {
    latch.countDown();
  }

  public boolean isStopped() {
    return latch.getCount() == 0;
  }

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    //noinspection ResultOfMethodCallIgnored
    latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
  }

}
