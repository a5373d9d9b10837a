package relay.spi;

/**
 * Observability hook for exporting relay counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of messages persisted to the incoming lane.
   */
  void incrementIncomingStored();

  /**
   * Increments the count of delivery acknowledgments applied to an account cursor.
   */
  void incrementAckApplied();

  /**
   * Increments the count of outgoing messages handed to an account client.
   */
  void incrementOutgoingDelivered();

  /**
   * Increments the count of echo inserts skipped because the echo already existed.
   */
  void incrementEchoDuplicate();

  /**
   * Increments the count of abandoned refresh passes.
   */
  void incrementRefreshFailure();

  /**
   * Increments the count of account clients started.
   */
  default void incrementClientStarted() {
  }

  /**
   * Increments the count of account clients stopped.
   */
  default void incrementClientStopped() {
  }

  /**
   * Records the number of account clients currently registered.
   *
   * @param count registry size after a refresh pass
   */
  void recordActiveClients(int count);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementIncomingStored() {
    }

    @Override
    public void incrementAckApplied() {
    }

    @Override
    public void incrementOutgoingDelivered() {
    }

    @Override
    public void incrementEchoDuplicate() {
    }

    @Override
    public void incrementRefreshFailure() {
    }

    @Override
    public void recordActiveClients(int count) {
    }
  }
}
