/**
 * Spring Boot auto-configuration for the relay.
 *
 * <p>Binds {@code relay.*} properties and starts an
 * {@link relay.account.AccountManager} over the application's {@code DataSource}.
 */
package relay.spring.boot;
