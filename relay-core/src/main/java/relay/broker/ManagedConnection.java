package relay.broker;

/**
 * A single-use connection owned by a {@link ConnectionBroker}. Once {@link #execute} or
 * {@link #ping} fails the broker closes it and dials a new one.
 *
 * <p>Implementations are only ever used from the broker thread and need no
 * synchronization.
 *
 * @param <Q> request type
 * @param <R> result type
 */
public interface ManagedConnection<Q, R> extends AutoCloseable {

  R execute(Q request) throws Exception;

  /** Cheap liveness probe sent while the connection is idle. */
  void ping() throws Exception;

  /** Releases the connection. Called exactly once by the broker. */
  @Override
  void close();
}
