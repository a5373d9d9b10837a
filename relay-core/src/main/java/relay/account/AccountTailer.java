package relay.account;

import relay.RelayException;
import relay.model.Lane;
import relay.model.Message;
import relay.spi.AccountClient;
import relay.spi.ConnectionProvider;
import relay.spi.MessageStore;
import relay.spi.MetricsExporter;
import relay.util.Liveness;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers the outgoing lane of one account to its client, in id order.
 *
 * <p>Each delivered message is echoed into the incoming lane with its nonce preserved,
 * so replays after a restart collapse into the existing echo row. The cursor lives in
 * memory only; the persisted cursor moves when the client acknowledges transmission.
 *
 * <p>The tailer exits when either the owning manager or the client starts dying.
 */
final class AccountTailer implements Runnable {
  private static final Logger logger = Logger.getLogger(AccountTailer.class.getName());

  private final AccountClient client;
  private final Liveness manager;
  private final ConnectionProvider connectionProvider;
  private final MessageStore messageStore;
  private final MetricsExporter metrics;
  private final int batchSize;
  private final long pollDelayMs;
  private final long handoffPollMs;
  private volatile long cursor;

  AccountTailer(AccountClient client, Liveness manager, ConnectionProvider connectionProvider,
      MessageStore messageStore, MetricsExporter metrics, int batchSize, long pollDelayMs,
      long handoffPollMs) {
    this.client = client;
    this.manager = manager;
    this.connectionProvider = connectionProvider;
    this.messageStore = messageStore;
    this.metrics = metrics;
    this.batchSize = batchSize;
    this.pollDelayMs = pollDelayMs;
    this.handoffPollMs = handoffPollMs;
    this.cursor = client.lastId();
  }

  /** Id of the last message handed to the client. */
  long cursor() {
    return cursor;
  }

  @Override
  public void run() {
    String account = client.accountName();
    logger.log(Level.FINE, "[{0}] Tailing outgoing messages after id {1}",
        new Object[]{account, cursor});
    try {
      while (running()) {
        List<Message> batch = fetch(account);
        if (batch != null) {
          for (Message msg : batch) {
            if (!handOff(msg) || !recordEcho(account, msg)) {
              return;
            }
            cursor = msg.id();
          }
        }
        if (batch == null || batch.size() < batchSize) {
          if (manager.awaitDying(pollDelayMs, TimeUnit.MILLISECONDS)) {
            return;
          }
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      logger.log(Level.FINE, "[{0}] Tailer stopped at id {1}", new Object[]{account, cursor});
    }
  }

  private boolean running() {
    return manager.isAlive() && client.isAlive();
  }

  private List<Message> fetch(String account) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return messageStore.queryOutgoing(conn, account, cursor, batchSize);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "[" + account + "] Cannot query outgoing messages", e);
      return null;
    }
  }

  private boolean handOff(Message msg) throws InterruptedException {
    while (running()) {
      if (client.outgoing().offer(msg, handoffPollMs, TimeUnit.MILLISECONDS)) {
        metrics.incrementOutgoingDelivered();
        return true;
      }
    }
    return false;
  }

  private boolean recordEcho(String account, Message msg) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (!messageStore.insertIfAbsent(conn, msg.asEcho(), Lane.INCOMING)) {
        metrics.incrementEchoDuplicate();
        logger.log(Level.FINE, "[{0}] Echo of message {1} already recorded",
            new Object[]{account, msg.id()});
      }
      return true;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "[" + account + "] Cannot record delivered message id="
          + msg.id() + "; stopping account manager", e);
      manager.kill(new RelayException("cannot record echo of message " + msg.id()
          + " for account " + account, e));
      return false;
    }
  }
}
