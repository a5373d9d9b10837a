package relay.broker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A caller's reference to a {@link ConnectionBroker}. While any handle is open the broker
 * keeps its connection alive.
 *
 * <p>Handles are safe to share between threads; {@link #close()} releases the reference
 * exactly once no matter how often it is called.
 *
 * @param <Q> request type
 * @param <R> result type
 */
public final class BrokerHandle<Q, R> implements AutoCloseable {
  static final String CLOSED_MESSAGE = "connection already closed";

  private final ConnectionBroker<Q, R> broker;
  private final AtomicBoolean closed = new AtomicBoolean();

  BrokerHandle(ConnectionBroker<Q, R> broker) {
    this.broker = broker;
  }

  /**
   * Runs a request on the broker's current connection, waiting at most the broker's
   * request timeout.
   *
   * @throws BrokerException if the handle is closed, the broker did not answer in time,
   *                         or the request itself failed
   */
  public R request(Q request) throws BrokerException {
    if (closed.get()) {
      throw new BrokerException(CLOSED_MESSAGE);
    }
    return broker.execute(request);
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      broker.release();
    }
  }
}
