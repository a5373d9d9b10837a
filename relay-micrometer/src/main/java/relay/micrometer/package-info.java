/**
 * Micrometer bridge for relay counters and gauges.
 *
 * <p>{@link relay.micrometer.MicrometerMetricsExporter} implements the
 * {@link relay.spi.MetricsExporter} SPI with Micrometer meters.
 */
package relay.micrometer;
