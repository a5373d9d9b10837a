package relay.spi;

import relay.model.AccountInfo;
import relay.model.Lane;
import relay.model.Message;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence contract for the message log and the account configuration it is keyed by.
 *
 * <p>The log is append-only: every row carries a lane, an account name, and a strictly
 * increasing identifier assigned on insert. {@code (nonce, lane)} is unique, so inserting
 * the same message twice into the same lane is detectable as a duplicate.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Implementations live in the {@code relay-jdbc} module and report failures as
 * unchecked exceptions.
 *
 * @see relay.jdbc.store.AbstractJdbcMessageStore
 */
public interface MessageStore {

  /**
   * Appends a message to the given lane.
   *
   * @param conn    the JDBC connection
   * @param message the message to store; its {@code id} is ignored
   * @param lane    the lane to append to
   * @return the identifier assigned by the store
   */
  long insert(Connection conn, Message message, Lane lane);

  /**
   * Appends a message to the given lane unless a row with the same nonce already exists
   * there. Any failure other than that duplicate is thrown.
   *
   * @param conn    the JDBC connection
   * @param message the message to store
   * @param lane    the lane to append to
   * @return {@code true} if a row was inserted, {@code false} if it was a duplicate
   */
  boolean insertIfAbsent(Connection conn, Message message, Lane lane);

  /**
   * Returns outgoing messages for one account with {@code id > afterId}, in ascending
   * id order.
   *
   * @param conn    the JDBC connection
   * @param account the owning account
   * @param afterId exclusive lower bound (the delivery cursor)
   * @param limit   maximum number of rows to return
   * @return the next batch of messages, possibly empty
   */
  List<Message> queryOutgoing(Connection conn, String account, long afterId, int limit);

  /**
   * Reads every configured account together with its channels.
   *
   * <p>Callers that need a snapshot isolated from concurrent cursor updates must run this
   * inside a transaction with a suitable isolation level.
   *
   * @param conn the JDBC connection
   * @return all accounts, ordered by name
   */
  List<AccountInfo> loadAccounts(Connection conn);

  /**
   * Advances the persisted delivery cursor of an account. The cursor never moves backwards.
   *
   * @param conn    the JDBC connection
   * @param account the account name
   * @param lastId  the id of the last message known to be delivered
   * @return the number of rows updated (0 if the account is unknown or already past {@code lastId})
   */
  int updateCursor(Connection conn, String account, long lastId);

  /**
   * Returns the highest message id in the log, or {@code 0} if it is empty.
   *
   * @param conn the JDBC connection
   */
  long maxMessageId(Connection conn);
}
