/**
 * Account supervision and outgoing delivery.
 *
 * <p>{@link relay.account.AccountManager} keeps one client per enabled account, persists
 * everything clients receive and tails each account's outgoing lane into its client.
 *
 * @see relay.account.AccountManager
 * @see relay.account.AccountClientFactories
 */
package relay.account;
