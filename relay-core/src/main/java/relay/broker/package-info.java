/**
 * Reference-counted broker that keeps one long-lived connection to a flaky backend alive
 * and serializes requests over it.
 *
 * <p>Callers {@linkplain relay.broker.ConnectionBroker#acquire() acquire} a
 * {@link relay.broker.BrokerHandle}, issue requests with a bounded wait, and close the
 * handle. The broker redials after failures and pings the connection while idle.
 *
 * @see relay.broker.ConnectionBroker
 * @see relay.broker.Dialer
 */
package relay.broker;
