package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import relay.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.incoming.stored}: messages written to the incoming lane</li>
 *   <li>{@code relay.ack.applied}: delivery acknowledgments applied to a cursor</li>
 *   <li>{@code relay.outgoing.delivered}: outgoing messages handed to a client</li>
 *   <li>{@code relay.echo.duplicate}: echo inserts that found an existing row</li>
 *   <li>{@code relay.refresh.failure}: abandoned refresh passes</li>
 *   <li>{@code relay.client.started} and {@code relay.client.stopped}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.clients.active}: registered account clients</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter incomingStored;
  private final Counter ackApplied;
  private final Counter outgoingDelivered;
  private final Counter echoDuplicate;
  private final Counter refreshFailure;
  private final Counter clientStarted;
  private final Counter clientStopped;
  private final Gauge activeClientsGauge;

  private final AtomicInteger activeClients = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "chat.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.incomingStored = counter(namePrefix + ".incoming.stored", "Messages stored in the incoming lane");
    this.ackApplied = counter(namePrefix + ".ack.applied", "Delivery acknowledgments applied");
    this.outgoingDelivered = counter(namePrefix + ".outgoing.delivered", "Outgoing messages handed to clients");
    this.echoDuplicate = counter(namePrefix + ".echo.duplicate", "Echo inserts skipped as already present");
    this.refreshFailure = counter(namePrefix + ".refresh.failure", "Abandoned refresh passes");
    this.clientStarted = counter(namePrefix + ".client.started", "Account clients started");
    this.clientStopped = counter(namePrefix + ".client.stopped", "Account clients stopped");
    this.activeClientsGauge = Gauge.builder(namePrefix + ".clients.active", activeClients, AtomicInteger::get)
        .description("Registered account clients")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementIncomingStored() {
    if (closed) return;
    incomingStored.increment();
  }

  @Override
  public void incrementAckApplied() {
    if (closed) return;
    ackApplied.increment();
  }

  @Override
  public void incrementOutgoingDelivered() {
    if (closed) return;
    outgoingDelivered.increment();
  }

  @Override
  public void incrementEchoDuplicate() {
    if (closed) return;
    echoDuplicate.increment();
  }

  @Override
  public void incrementRefreshFailure() {
    if (closed) return;
    refreshFailure.increment();
  }

  @Override
  public void incrementClientStarted() {
    if (closed) return;
    clientStarted.increment();
  }

  @Override
  public void incrementClientStopped() {
    if (closed) return;
    clientStopped.increment();
  }

  @Override
  public void recordActiveClients(int count) {
    if (closed) return;
    activeClients.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(incomingStored, ackApplied, outgoingDelivered, echoDuplicate,
        refreshFailure, clientStarted, clientStopped, activeClientsGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
