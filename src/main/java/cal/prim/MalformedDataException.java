package cal.prim;

/**
 * Indicates that some persisted data (a pointer file, a manifest) could be read
 * but does not have the expected shape.
 */
public class MalformedDataException extends Exception {

  public MalformedDataException(String message) {
    super(message);
  }

  public MalformedDataException(String message, Throwable cause) {
    super(message, cause);
  }

}
