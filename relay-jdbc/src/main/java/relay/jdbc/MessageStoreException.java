package relay.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by message store implementations.
 */
public final class MessageStoreException extends RuntimeException {
  private static final int MYSQL_DUPLICATE_ENTRY = 1062;

  public MessageStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether the underlying failure is a unique-key violation.
   */
  public boolean isDuplicateKey() {
    for (Throwable t = getCause(); t != null; t = t.getCause()) {
      if (t instanceof SQLException sql) {
        if ("23505".equals(sql.getSQLState()) || sql.getErrorCode() == MYSQL_DUPLICATE_ENTRY) {
          return true;
        }
      }
    }
    return false;
  }
}
