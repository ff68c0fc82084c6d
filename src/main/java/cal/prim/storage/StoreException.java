package cal.prim.storage;

import cal.prim.RetryPolicy;

import java.io.IOException;

/**
 * A failed blob-store request.  The status code follows HTTP conventions; transport
 * failures (connection refused, reset, timeout) use status 0.
 */
public class StoreException extends IOException {

  public static final int TRANSPORT_FAILURE = 0;

  private final int status;

  public StoreException(int status, String message) {
    super(message);
    this.status = status;
  }

  public StoreException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public int status() {
    return status;
  }

  /**
   * @return true for network failures and 5xx responses
   */
  public boolean isTransient() {
    return status == TRANSPORT_FAILURE || status >= 500;
  }

  public boolean isNotFound() {
    return status == 404;
  }

  /**
   * The retry classification shared by the remote backends.  Transient store
   * errors and plain {@link IOException}s (broken sockets and the like) are
   * retried; any other store error, such as a 403 or 422, fails at once.
   */
  public static RetryPolicy.Verdict classify(IOException e) {
    if (e instanceof StoreException se) {
      return se.isTransient() ? RetryPolicy.Verdict.RETRY : RetryPolicy.Verdict.FAIL;
    }
    return RetryPolicy.Verdict.RETRY;
  }

}
