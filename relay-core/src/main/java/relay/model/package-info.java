/**
 * Data model shared by the account manager, the tailers and the message stores.
 *
 * @see relay.model.Message
 * @see relay.model.Lane
 * @see relay.model.AccountInfo
 */
package relay.model;
