/**
 * Directory (LDAP) lookups over a {@link relay.broker.ConnectionBroker}.
 */
package relay.directory;
