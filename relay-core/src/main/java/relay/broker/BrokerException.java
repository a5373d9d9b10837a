package relay.broker;

/**
 * Failure returned to a caller of {@link BrokerHandle#request}. The message is meant to
 * be shown to the end user as is.
 */
public class BrokerException extends Exception {

  public BrokerException(String message) {
    super(message);
  }

  public BrokerException(String message, Throwable cause) {
    super(message, cause);
  }
}
