package cal.prim;

import org.checkerframework.checker.mustcall.qual.InheritableMustCall;

/**
 * An <code>AutoCloseable</code> whose {@link #close()} method does not throw
 * checked exceptions, so it can be used in try-with-resources blocks inside
 * worker code that only deals in {@link java.io.IOException}.
 */
@InheritableMustCall("close")
public interface QuietAutoCloseable extends AutoCloseable {
  @Override
  void close();
}
