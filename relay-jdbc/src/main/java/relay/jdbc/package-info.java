/**
 * JDBC support for the relay: connection provider, statement helper and the store
 * exception type.
 *
 * @see relay.jdbc.store.JdbcMessageStores
 */
package relay.jdbc;
