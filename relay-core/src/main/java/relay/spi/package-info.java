/**
 * Service Provider Interfaces (SPI) for plugging the relay into storage, transports and
 * monitoring.
 *
 * @see relay.spi.MessageStore
 * @see relay.spi.ConnectionProvider
 * @see relay.spi.AccountClient
 * @see relay.spi.AccountClientFactory
 * @see relay.spi.MetricsExporter
 */
package relay.spi;
