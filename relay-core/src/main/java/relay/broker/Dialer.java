package relay.broker;

/**
 * Opens a fresh connection for a {@link ConnectionBroker}. Called from the broker thread
 * only, once per (re)connect.
 *
 * @param <Q> request type
 * @param <R> result type
 */
@FunctionalInterface
public interface Dialer<Q, R> {

  /**
   * @return a connected, ready-to-use connection
   * @throws Exception if the connection cannot be established; the broker records the
   *                   failure and retries after its redial delay
   */
  ManagedConnection<Q, R> dial() throws Exception;
}
