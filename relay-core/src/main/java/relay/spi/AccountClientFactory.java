package relay.spi;

import relay.model.AccountInfo;
import relay.model.Message;

import java.util.concurrent.BlockingQueue;

/**
 * Creates and starts {@link AccountClient}s of one kind.
 *
 * <p>Factories are discovered from
 * {@code META-INF/services/relay.spi.AccountClientFactory} or registered explicitly on the
 * {@link relay.account.AccountManager.Builder}.
 */
public interface AccountClientFactory {

  /** The account kind this factory handles, e.g. {@code irc}. Compared case-insensitively. */
  String kind();

  /**
   * Starts a client for the given account.
   *
   * @param info     the account configuration, including the delivery cursor
   * @param incoming the manager's incoming queue; the client must stop offering into it
   *                 once it is dying
   * @return the running client
   */
  AccountClient start(AccountInfo info, BlockingQueue<Message> incoming);
}
