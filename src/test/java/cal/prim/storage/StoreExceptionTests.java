package cal.prim.storage;

import cal.prim.RetryPolicy;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;

public class StoreExceptionTests {

  @Test
  public void testClassification() {
    Assert.assertEquals(StoreException.classify(new StoreException(500, "x")), RetryPolicy.Verdict.RETRY);
    Assert.assertEquals(StoreException.classify(new StoreException(503, "x")), RetryPolicy.Verdict.RETRY);
    Assert.assertEquals(StoreException.classify(new StoreException(StoreException.TRANSPORT_FAILURE, "x")), RetryPolicy.Verdict.RETRY);
    Assert.assertEquals(StoreException.classify(new IOException("reset")), RetryPolicy.Verdict.RETRY);
    Assert.assertEquals(StoreException.classify(new StoreException(404, "x")), RetryPolicy.Verdict.FAIL);
    Assert.assertEquals(StoreException.classify(new StoreException(422, "x")), RetryPolicy.Verdict.FAIL);
    Assert.assertTrue(new StoreException(404, "x").isNotFound());
  }

}
