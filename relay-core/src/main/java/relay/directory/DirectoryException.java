package relay.directory;

/**
 * Failure talking to the directory server. Messages never contain the bind password.
 */
public class DirectoryException extends Exception {

  public DirectoryException(String message, Throwable cause) {
    super(message, cause);
  }
}
