package cal.sync.impls;

import cal.prim.time.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Records requested sleeps without sleeping.  An optional hook runs on each
 * sleep, e.g. to stop the loop under test after a few iterations.
 */
public class RecordingSleeper implements Sleeper {

  private final List<Duration> sleeps = new ArrayList<>();
  private final Runnable onSleep;

  public RecordingSleeper(Runnable onSleep) {
    this.onSleep = onSleep;
  }

  public RecordingSleeper() {
    this(() -> { });
  }

  @Override
  public synchronized void sleep(Duration duration) {
    sleeps.add(duration);
    onSleep.run();
  }

  public synchronized List<Duration> sleeps() {
    return new ArrayList<>(sleeps);
  }

}
