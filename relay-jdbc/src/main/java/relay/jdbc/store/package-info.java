/**
 * Database-specific {@link relay.spi.MessageStore} implementations and their registry.
 *
 * @see relay.jdbc.store.JdbcMessageStores
 * @see relay.jdbc.store.AbstractJdbcMessageStore
 */
package relay.jdbc.store;
