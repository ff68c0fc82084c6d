package cal.prim.time;

import java.time.Instant;

/**
 * A wall clock can tell you the date and time.  Wall clock time is used to
 * stamp manifest entries, and manifest retention orders versions by those
 * stamps.  Be aware that the system clock can jump forward and backward, so
 * two stamps taken in sequence are not guaranteed to be ordered.
 *
 * <p>Tests substitute a settable implementation so that retention can be
 * exercised without waiting for real time to pass.
 */
public interface UnreliableWallClock {
  Instant now();

  UnreliableWallClock SYSTEM_CLOCK = Instant::now;
}
