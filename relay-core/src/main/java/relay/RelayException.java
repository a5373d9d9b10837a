package relay;

/**
 * Unchecked exception reporting that a relay component terminated for a reason other
 * than an orderly stop.
 */
public class RelayException extends RuntimeException {
  public RelayException(String message) {
    super(message);
  }

  public RelayException(String message, Throwable cause) {
    super(message, cause);
  }
}
