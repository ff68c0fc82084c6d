package cal.prim;

import cal.prim.storage.StoreException;
import cal.sync.impls.RecordingSleeper;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class RetryPolicyTests {

  @Test
  public void testTransientFailuresAreRetriedWithBackoff() throws IOException {
    RecordingSleeper sleeper = new RecordingSleeper();
    RetryPolicy policy = RetryPolicy.exponential(StoreException::classify, sleeper);
    AtomicInteger calls = new AtomicInteger();

    String result = policy.call("flaky", () -> {
      if (calls.incrementAndGet() < 3) {
        throw new StoreException(503, "unavailable");
      }
      return "ok";
    });

    Assert.assertEquals(result, "ok");
    Assert.assertEquals(calls.get(), 3);
    Assert.assertEquals(sleeper.sleeps(), List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)));
  }

  @Test
  public void testGivesUpAfterMaxAttempts() {
    RecordingSleeper sleeper = new RecordingSleeper();
    RetryPolicy policy = RetryPolicy.exponential(StoreException::classify, sleeper);
    AtomicInteger calls = new AtomicInteger();

    StoreException e = Assert.expectThrows(StoreException.class, () -> policy.call("down", () -> {
      calls.incrementAndGet();
      throw new StoreException(StoreException.TRANSPORT_FAILURE, "connection refused");
    }));
    Assert.assertEquals(e.getMessage(), "connection refused");
    Assert.assertEquals(calls.get(), 3);
    Assert.assertEquals(sleeper.sleeps().size(), 2);
  }

  @Test
  public void testPermanentFailuresFailFast() {
    RecordingSleeper sleeper = new RecordingSleeper();
    RetryPolicy policy = RetryPolicy.exponential(StoreException::classify, sleeper);
    AtomicInteger calls = new AtomicInteger();

    StoreException e = Assert.expectThrows(StoreException.class, () -> policy.call("forbidden", () -> {
      calls.incrementAndGet();
      throw new StoreException(403, "forbidden");
    }));
    Assert.assertEquals(e.status(), 403);
    Assert.assertEquals(calls.get(), 1);
    Assert.assertEquals(sleeper.sleeps(), List.of());
  }

  @Test
  public void testInterruptDuringBackoff() {
    RetryPolicy policy = RetryPolicy.exponential(e -> RetryPolicy.Verdict.RETRY, d -> {
      throw new InterruptedException();
    });
    try {
      Assert.expectThrows(InterruptedIOException.class, () -> policy.call("interrupted", () -> {
        throw new IOException("broken pipe");
      }));
      Assert.assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      // clear the flag for the next test
      Thread.interrupted();
    }
  }

  @Test
  public void testOnce() {
    AtomicInteger calls = new AtomicInteger();
    Assert.assertThrows(IOException.class, () -> RetryPolicy.once().call("once", () -> {
      calls.incrementAndGet();
      throw new IOException("nope");
    }));
    Assert.assertEquals(calls.get(), 1);
    Assert.assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(0, Duration.ZERO, e -> RetryPolicy.Verdict.FAIL, d -> { }));
  }

}
