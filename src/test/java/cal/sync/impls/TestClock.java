package cal.sync.impls;

import cal.prim.time.UnreliableWallClock;

import java.time.Duration;
import java.time.Instant;

/**
 * A clock that only moves when told to.
 */
public class TestClock implements UnreliableWallClock {

  private Instant now;

  public TestClock(Instant start) {
    this.now = start;
  }

  public TestClock() {
    this(Instant.parse("2026-01-02T03:04:05Z"));
  }

  @Override
  public synchronized Instant now() {
    return now;
  }

  public synchronized void advance(Duration d) {
    now = now.plus(d);
  }

}
