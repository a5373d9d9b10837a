package relay.spi;

import relay.model.AccountInfo;
import relay.model.Message;

import java.util.concurrent.BlockingQueue;

/**
 * A running connection for one account, owned by the account manager.
 *
 * <p>The client pushes everything it receives into the manager's incoming queue (passed
 * to {@link AccountClientFactory#start}) and transmits whatever its tailer hands to
 * {@link #outgoing()}. A client that wants the manager to persist its delivery progress
 * pushes a {@code PONG} message with text {@code sent:<id>} after transmitting the
 * outgoing message with that id.
 *
 * <p>The incoming queue is usually a {@link java.util.concurrent.SynchronousQueue} with the
 * manager thread as its only consumer. A client must hand messages over with bounded
 * {@code offer(msg, timeout, unit)} calls and re-check its own state between attempts,
 * never with an unbounded {@code put}. While stopping it may keep offering messages it
 * already received: the manager consumes the queue until {@link #stop()} returns.
 *
 * <p>Implementations must be safe for use from the manager thread and the tailer thread
 * concurrently.
 */
public interface AccountClient {

  /** The name of the account this client serves. Never changes. */
  String accountName();

  /** Returns {@code true} until the client starts shutting down or fails. */
  boolean isAlive();

  /** Returns {@code true} once the client is shutting down or has failed. */
  default boolean isDying() {
    return !isAlive();
  }

  /**
   * Stops the client and waits for it to terminate. The manager may call this from a
   * worker thread while it keeps draining the incoming queue.
   *
   * @throws relay.RelayException if the client terminated because of a failure
   */
  void stop();

  /**
   * Queue the tailer hands outgoing messages to. Typically a
   * {@link java.util.concurrent.SynchronousQueue} so a handoff completes only when the
   * client has taken the message.
   */
  BlockingQueue<Message> outgoing();

  /** Delivery cursor the client was started with. */
  long lastId();

  /**
   * Applies new configuration. Everything but the account name may change.
   *
   * @throws IllegalArgumentException if {@code info} names a different account
   */
  void updateInfo(AccountInfo info);
}
